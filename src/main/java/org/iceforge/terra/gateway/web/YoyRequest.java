package org.iceforge.terra.gateway.web;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;

public class YoyRequest {

    public static final String DEFAULT_KEY_COL = "admin1_name";
    public static final String DEFAULT_VALUE_COL = "emissions_tonnes";

    @NotBlank
    private String fileId;

    private String keyCol = DEFAULT_KEY_COL;
    private String valueCol = DEFAULT_VALUE_COL;
    private int baseYear = 2019;
    private int compareYear = 2020;
    private Map<String, Object> where;
    private int topN = 10;

    /**
     * drop (largest decrease first) or rise.
     */
    private String direction = "drop";

    public String getFileId() {
        return fileId;
    }

    public void setFileId(String fileId) {
        this.fileId = fileId;
    }

    public String getKeyCol() {
        return keyCol;
    }

    public void setKeyCol(String keyCol) {
        this.keyCol = keyCol == null || keyCol.isBlank() ? DEFAULT_KEY_COL : keyCol;
    }

    public String getValueCol() {
        return valueCol;
    }

    public void setValueCol(String valueCol) {
        this.valueCol = valueCol == null || valueCol.isBlank() ? DEFAULT_VALUE_COL : valueCol;
    }

    public int getBaseYear() {
        return baseYear;
    }

    public void setBaseYear(int baseYear) {
        this.baseYear = baseYear;
    }

    public int getCompareYear() {
        return compareYear;
    }

    public void setCompareYear(int compareYear) {
        this.compareYear = compareYear;
    }

    public Map<String, Object> getWhere() {
        return where;
    }

    public void setWhere(Map<String, Object> where) {
        this.where = where;
    }

    public int getTopN() {
        return topN;
    }

    public void setTopN(int topN) {
        this.topN = topN;
    }

    public String getDirection() {
        return direction;
    }

    public void setDirection(String direction) {
        this.direction = direction;
    }
}
