package io.github.koszti.flinksqlgateway.query;

/**
 * How one statement of a run ended.
 */
enum StatementOutcome {
    FINISHED,
    FAILED,
    CANCELLED,
    SESSION_EXPIRED
}
