package io.github.koszti.flinksqlgateway.gateway.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One page of an operation's result stream.
 * A page may be NOT_READY (nothing yet), PAYLOAD (columns and/or rows) or EOS.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class FetchResultsResponse {
    private ResultType resultType;
    private String resultKind; // SUCCESS or SUCCESS_WITH_CONTENT
    private Results results;
    private String nextResultUri;
    @JsonProperty("jobID")
    private String jobId;
    @JsonProperty("isQueryResult")
    private boolean queryResult;

    public enum ResultType {
        NOT_READY,
        PAYLOAD,
        EOS
    }

    public ResultType getResultType() {
        return resultType;
    }

    public void setResultType(ResultType resultType) {
        this.resultType = resultType;
    }

    public String getResultKind() {
        return resultKind;
    }

    public void setResultKind(String resultKind) {
        this.resultKind = resultKind;
    }

    public Results getResults() {
        return results;
    }

    public void setResults(Results results) {
        this.results = results;
    }

    public String getNextResultUri() {
        return nextResultUri;
    }

    public void setNextResultUri(String nextResultUri) {
        this.nextResultUri = nextResultUri;
    }

    public String getJobId() {
        return jobId;
    }

    public void setJobId(String jobId) {
        this.jobId = jobId;
    }

    public boolean isQueryResult() {
        return queryResult;
    }

    public void setQueryResult(boolean queryResult) {
        this.queryResult = queryResult;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Results {
        private List<ColumnInfo> columns;
        private List<RowData> data;
        private String rowFormat;

        public List<ColumnInfo> getColumns() {
            return columns;
        }

        public void setColumns(List<ColumnInfo> columns) {
            this.columns = columns;
        }

        public List<RowData> getData() {
            return data;
        }

        public void setData(List<RowData> data) {
            this.data = data;
        }

        public String getRowFormat() {
            return rowFormat;
        }

        public void setRowFormat(String rowFormat) {
            this.rowFormat = rowFormat;
        }
    }
}
