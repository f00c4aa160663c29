package org.iceforge.terra.gateway.web;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

public class BatchQueryRequest {

    public static final int MAX_QUERIES = 20;

    @NotEmpty
    @Size(max = MAX_QUERIES)
    private List<@Valid QueryRequest> queries;

    public List<QueryRequest> getQueries() {
        return queries;
    }

    public void setQueries(List<QueryRequest> queries) {
        this.queries = queries;
    }
}
