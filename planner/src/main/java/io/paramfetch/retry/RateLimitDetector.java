package io.paramfetch.retry;

import java.util.List;
import java.util.Locale;

/** Recognises provider rate-limit failures by message, anywhere in the cause chain. */
public final class RateLimitDetector {
    static final List<String> MARKERS = List.of(
            "429", "rate limit", "ratelimit", "too many requests", "quota exceeded", "exceeded request limit");

    private RateLimitDetector() {}

    public static boolean isRateLimit(Throwable t) {
        Throwable cur = t;
        int depth = 0;
        while (cur != null && depth++ < 16) {
            if (isRateLimitMessage(cur.getMessage())) return true;
            if (cur.getCause() == cur) break;
            cur = cur.getCause();
        }
        return false;
    }

    public static boolean isRateLimitMessage(String message) {
        if (message == null) return false;
        String m = message.toLowerCase(Locale.ROOT);
        for (String marker : MARKERS) {
            if (m.contains(marker)) return true;
        }
        return false;
    }
}
