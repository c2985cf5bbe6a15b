package io.github.koszti.flinksqlgateway.gateway.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ColumnInfo {
    private String name;
    private LogicalType logicalType;
    private String comment;

    public ColumnInfo() {
    }

    public ColumnInfo(String name, String type) {
        this.name = name;
        this.logicalType = new LogicalType();
        this.logicalType.setType(type);
        this.logicalType.setNullable(true);
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public LogicalType getLogicalType() {
        return logicalType;
    }

    public void setLogicalType(LogicalType logicalType) {
        this.logicalType = logicalType;
    }

    public String getComment() {
        return comment;
    }

    public void setComment(String comment) {
        this.comment = comment;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LogicalType {
        private String type; // VARCHAR, BIGINT, TIMESTAMP_WITHOUT_TIME_ZONE, ROW, ...
        private boolean nullable;
        private Integer length;
        private Integer precision;
        private Integer scale;
        private List<LogicalType> children;

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public boolean isNullable() {
            return nullable;
        }

        public void setNullable(boolean nullable) {
            this.nullable = nullable;
        }

        public Integer getLength() {
            return length;
        }

        public void setLength(Integer length) {
            this.length = length;
        }

        public Integer getPrecision() {
            return precision;
        }

        public void setPrecision(Integer precision) {
            this.precision = precision;
        }

        public Integer getScale() {
            return scale;
        }

        public void setScale(Integer scale) {
            this.scale = scale;
        }

        public List<LogicalType> getChildren() {
            return children;
        }

        public void setChildren(List<LogicalType> children) {
            this.children = children;
        }
    }
}
