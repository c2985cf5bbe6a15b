package io.github.koszti.flinksqlgateway.gateway.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class RowData {
    private String kind; // INSERT, UPDATE_BEFORE, UPDATE_AFTER, DELETE
    private List<Object> fields;

    public RowData() {
    }

    public RowData(String kind, List<Object> fields) {
        this.kind = kind;
        this.fields = new ArrayList<>(fields);
    }

    public static RowData insert(Object... fields) {
        return new RowData("INSERT", List.of(fields));
    }

    public String getKind() {
        return kind;
    }

    public void setKind(String kind) {
        this.kind = kind;
    }

    public List<Object> getFields() {
        return fields;
    }

    public void setFields(List<Object> fields) {
        this.fields = fields;
    }

    @Override
    public String toString() {
        return kind + String.valueOf(fields);
    }
}
