package io.github.koszti.flinksqlgateway.query;

import java.util.Objects;

/**
 * Identity of one statement within a run. Each transition that learns something new
 * (the operation handle) produces a new context instead of mutating the old one.
 */
record StatementContext(int index, int total, String statement, String operationHandle) {

    StatementContext {
        Objects.requireNonNull(statement, "statement must not be null");
    }

    static StatementContext first(String statement, int total) {
        return new StatementContext(0, total, statement, null);
    }

    StatementContext next(String nextStatement) {
        return new StatementContext(index + 1, total, nextStatement, null);
    }

    StatementContext withOperation(String handle) {
        return new StatementContext(index, total, statement, handle);
    }

    /**
     * 1-based position shown to users.
     */
    int position() {
        return index + 1;
    }

    boolean isLast() {
        return index == total - 1;
    }

    boolean isChained() {
        return total > 1;
    }

    String annotate(String message) {
        return isChained() ? "Statement " + position() + "/" + total + ": " + message : message;
    }
}
