package io.github.koszti.flinksqlgateway.gateway;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pagination cursor helpers for the {@code /result/{token}} endpoint.
 */
public final class ResultTokens {

    public static final long FIRST = 0L;

    private static final Pattern RESULT_TOKEN = Pattern.compile("/result/(\\d+)");

    private ResultTokens() {
    }

    /**
     * Token of the next page: taken from {@code nextResultUri} when it carries one, otherwise {@code current + 1}.
     */
    public static long next(String nextResultUri, long current) {
        if (nextResultUri == null || nextResultUri.isBlank()) {
            return current + 1;
        }
        Matcher m = RESULT_TOKEN.matcher(nextResultUri);
        if (m.find()) {
            try {
                return Long.parseLong(m.group(1));
            } catch (NumberFormatException e) {
                return current + 1;
            }
        }
        return current + 1;
    }
}
