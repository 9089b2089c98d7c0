package com.livemux.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merged result of a query across all selected peers.
 * Serialized as is for {@code OutputFormat: wrapped_json}; plain json only writes the data.
 */
@JsonPropertyOrder({"columns", "data", "total", "failed"})
public class QueryResponse {

    @JsonProperty("columns")
    private List<String> columns;

    @JsonProperty("data")
    private List<List<Object>> data;

    @JsonProperty("total")
    private long total;

    @JsonProperty("failed")
    private Map<String, String> failed;

    public QueryResponse() {
        this.columns = new ArrayList<>();
        this.data = new ArrayList<>();
        this.failed = new LinkedHashMap<>();
    }

    public QueryResponse(List<String> columns, List<List<Object>> data, long total, Map<String, String> failed) {
        this.columns = columns != null ? columns : new ArrayList<>();
        this.data = data != null ? data : new ArrayList<>();
        this.total = total;
        this.failed = failed != null ? failed : new LinkedHashMap<>();
    }

    public List<String> getColumns() {
        return columns;
    }

    public void setColumns(List<String> columns) {
        this.columns = columns;
    }

    public List<List<Object>> getData() {
        return data;
    }

    public void setData(List<List<Object>> data) {
        this.data = data;
    }

    /**
     * Number of rows before offset and limit were applied
     */
    public long getTotal() {
        return total;
    }

    public void setTotal(long total) {
        this.total = total;
    }

    /**
     * Peers that could not answer, by peer key, with their error
     */
    public Map<String, String> getFailed() {
        return failed;
    }

    public void setFailed(Map<String, String> failed) {
        this.failed = failed;
    }

    @Override
    public String toString() {
        return "QueryResponse{" +
                "rows=" + data.size() +
                ", total=" + total +
                ", failed=" + failed.keySet() +
                '}';
    }
}
