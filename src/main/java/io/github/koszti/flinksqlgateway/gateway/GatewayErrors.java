package io.github.koszti.flinksqlgateway.gateway;

import io.github.koszti.flinksqlgateway.gateway.exception.RequestCancelledException;
import io.github.koszti.flinksqlgateway.gateway.exception.SessionExpiredException;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classification and message extraction for gateway failures.
 */
public final class GatewayErrors {

    private static final Pattern SESSION_MISSING = Pattern.compile("Session '[\\w-]+' does not exist");
    private static final Pattern CLASS_PREFIX = Pattern.compile("^[\\w.$]+(?:Exception|Error):\\s*(.+)$");

    private GatewayErrors() {
    }

    /**
     * Strips {@link CompletionException}/{@link ExecutionException} wrappers added by future composition.
     */
    public static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }

    public static boolean isSessionExpired(Throwable t) {
        return unwrap(t) instanceof SessionExpiredException;
    }

    public static boolean isCancellation(Throwable t) {
        Throwable cause = unwrap(t);
        return cause instanceof CancellationException || cause instanceof RequestCancelledException;
    }

    public static boolean mentionsMissingSession(String text) {
        return text != null && SESSION_MISSING.matcher(text).find();
    }

    public static String messageOf(Throwable t) {
        Throwable cause = unwrap(t);
        if (cause == null) {
            return "(null)";
        }
        String msg = cause.getMessage();
        if (msg == null || msg.isBlank()) {
            return cause.getClass().getSimpleName();
        }
        return msg;
    }

    /**
     * Extracts a readable root cause from a server-side Java stack trace:
     * the deepest {@code Caused by:} line without its exception class prefix,
     * or failing that the first line that is not a stack frame.
     */
    public static String extractErrorMessage(String rawError) {
        if (rawError == null || rawError.isBlank()) {
            return "An unexpected error occurred";
        }
        String cleaned = rawError
                .replaceAll("<Exception on server side:\\n?", "")
                .replaceAll("\\n?>$", "");
        String[] lines = cleaned.split("\n");

        String lastCausedBy = null;
        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.startsWith("Caused by:")) {
                lastCausedBy = trimmed;
            }
        }
        if (lastCausedBy != null) {
            String afterCausedBy = lastCausedBy.substring("Caused by:".length()).trim();
            return stripClassName(afterCausedBy);
        }

        for (String line : lines) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty() && !trimmed.startsWith("at ")) {
                return stripClassName(trimmed);
            }
        }
        return rawError;
    }

    static String stripClassName(String text) {
        Matcher m = CLASS_PREFIX.matcher(text);
        if (m.matches()) {
            return m.group(1);
        }
        return text;
    }
}
