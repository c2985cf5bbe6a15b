package io.github.koszti.flinksqlgateway.sql;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StatementSplitterTest {

    @Test
    void splitsOnSemicolons() {
        assertEquals(List.of("SELECT 1", "SELECT 2"), StatementSplitter.split("SELECT 1;\n  SELECT 2;\n"));
    }

    @Test
    void keepsSeparatorsInsideQuotes() {
        String sql = "INSERT INTO t VALUES ('a;b', 'it''s; fine'); SELECT \"weird;name\" FROM t";

        assertEquals(List.of(
                "INSERT INTO t VALUES ('a;b', 'it''s; fine')",
                "SELECT \"weird;name\" FROM t"), StatementSplitter.split(sql));
    }

    @Test
    void keepsSeparatorsInsideComments() {
        String sql = """
                -- first; still a comment
                SELECT 1;
                /* block; comment */ SELECT 2
                """;

        assertEquals(List.of(
                "-- first; still a comment\nSELECT 1",
                "/* block; comment */ SELECT 2"), StatementSplitter.split(sql));
    }

    @Test
    void dropsEmptyStatements() {
        assertTrue(StatementSplitter.split(" ;; \n ; ").isEmpty());
        assertEquals(List.of("SELECT 1"), StatementSplitter.split(";;SELECT 1;;"));
    }

    @Test
    void unterminatedQuoteRunsToEnd() {
        assertEquals(List.of("SELECT 'abc; def"), StatementSplitter.split("SELECT 'abc; def"));
    }
}
