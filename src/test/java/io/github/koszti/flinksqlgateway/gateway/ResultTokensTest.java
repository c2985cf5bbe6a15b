package io.github.koszti.flinksqlgateway.gateway;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ResultTokensTest {

    @Test
    void readsTokenFromNextResultUri() {
        assertEquals(42L, ResultTokens.next("/v4/sessions/s/operations/o/result/42?rowFormat=JSON", 3));
    }

    @Test
    void incrementsWhenUriIsMissingOrUnparseable() {
        assertEquals(4L, ResultTokens.next(null, 3));
        assertEquals(4L, ResultTokens.next("", 3));
        assertEquals(4L, ResultTokens.next("/v4/sessions/s/operations/o/status", 3));
        assertEquals(4L, ResultTokens.next("/result/99999999999999999999", 3));
    }
}
