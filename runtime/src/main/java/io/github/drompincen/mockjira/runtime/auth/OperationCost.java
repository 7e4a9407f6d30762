package io.github.drompincen.mockjira.runtime.auth;

import java.util.Locale;

/**
 * Cost classes of the rate limiter. Searches scan the whole item set and are the most expensive.
 */
public enum OperationCost {
    READ,
    WRITE,
    SEARCH;

    public static OperationCost classify(String method, String path) {
        String lowerPath = path == null ? "" : path.toLowerCase(Locale.ROOT);
        if (lowerPath.endsWith("/search") || lowerPath.contains("/search/")) {
            return SEARCH;
        }
        return isRead(method) ? READ : WRITE;
    }

    public static boolean isRead(String method) {
        return "GET".equalsIgnoreCase(method) || "HEAD".equalsIgnoreCase(method)
                || "OPTIONS".equalsIgnoreCase(method);
    }
}
