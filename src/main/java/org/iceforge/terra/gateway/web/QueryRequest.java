package org.iceforge.terra.gateway.web;

import jakarta.validation.constraints.NotBlank;

import java.util.List;
import java.util.Map;

public class QueryRequest {

    @NotBlank
    private String fileId;

    private List<String> select = List.of();

    /**
     * Column -> value, list of values, or operator object, e.g.
     * {"country_name":"Germany", "year":{"gte":2015,"lte":2020}}.
     */
    private Map<String, Object> where;

    private List<String> groupBy = List.of();

    /**
     * Column -> function (sum, avg, count, distinct, min, max, std, variance).
     */
    private Map<String, String> aggregations;

    /**
     * Same shape as where; may reference group_by columns or aggregated columns.
     */
    private Map<String, Object> having;

    /**
     * Comma-separated "column [ASC|DESC]" items.
     */
    private String orderBy;

    private Integer limit;

    private Integer offset;

    public String getFileId() {
        return fileId;
    }

    public void setFileId(String fileId) {
        this.fileId = fileId;
    }

    public List<String> getSelect() {
        return select;
    }

    public void setSelect(List<String> select) {
        this.select = select == null ? List.of() : select;
    }

    public Map<String, Object> getWhere() {
        return where;
    }

    public void setWhere(Map<String, Object> where) {
        this.where = where;
    }

    public List<String> getGroupBy() {
        return groupBy;
    }

    public void setGroupBy(List<String> groupBy) {
        this.groupBy = groupBy == null ? List.of() : groupBy;
    }

    public Map<String, String> getAggregations() {
        return aggregations;
    }

    public void setAggregations(Map<String, String> aggregations) {
        this.aggregations = aggregations;
    }

    public Map<String, Object> getHaving() {
        return having;
    }

    public void setHaving(Map<String, Object> having) {
        this.having = having;
    }

    public String getOrderBy() {
        return orderBy;
    }

    public void setOrderBy(String orderBy) {
        this.orderBy = orderBy;
    }

    public Integer getLimit() {
        return limit;
    }

    public void setLimit(Integer limit) {
        this.limit = limit;
    }

    public Integer getOffset() {
        return offset;
    }

    public void setOffset(Integer offset) {
        this.offset = offset;
    }
}
