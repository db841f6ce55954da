package com.sentimentfusion.common.error;

import com.sentimentfusion.common.model.ErrorSeverity;
import com.sentimentfusion.common.model.NewsProvider;
import com.sentimentfusion.common.model.ProviderError;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;

/**
 * Factory and severity classifier for {@link ProviderError} values.
 *
 * <h3>Severity rules (first match wins)</h3>
 * <pre>
 *   code contains RATE_LIMIT or TIMEOUT                 → transient
 *   code contains INVALID_KEY, NOT_FOUND, NOT_CONFIGURED → permanent
 *   httpStatus 429                                       → transient
 *   httpStatus 5xx                                       → retryable
 *   httpStatus 4xx                                       → permanent
 *   otherwise                                            → unknown
 * </pre>
 * An error is retryable when its severity is transient or retryable.
 *
 * <p>Pure utility: no logging, no state.
 */
public final class ProviderErrors {

    private ProviderErrors() {}

    public static ProviderError create(NewsProvider provider, ProviderErrorCode kind,
                                       String message, Integer httpStatus) {
        return create(provider, kind.codeFor(provider), message, httpStatus, null, Clock.systemUTC());
    }

    public static ProviderError create(NewsProvider provider, String code, String message,
                                       Integer httpStatus, Integer retryCount, Clock clock) {
        ErrorSeverity severity = determineSeverity(code, httpStatus);
        return new ProviderError(
            provider,
            code,
            message == null ? "" : message,
            severity,
            isRetryable(severity),
            httpStatus,
            retryCount,
            Instant.now(clock));
    }

    /** A provider call that completed but returned no articles. */
    public static ProviderError emptyResult(NewsProvider provider, String symbol) {
        return create(provider, ProviderErrorCode.EMPTY_RESULT,
            provider.displayName() + " returned 0 articles for " + symbol, null);
    }

    /** The per-provider time bound elapsed. Always transient and retryable. */
    public static ProviderError timeout(NewsProvider provider, long timeoutMs) {
        return create(provider, ProviderErrorCode.TIMEOUT,
            provider.displayName() + " timed out after " + timeoutMs + "ms", null);
    }

    /**
     * Classifies a raw failure message when nothing more specific is known about it.
     */
    public static ProviderError fromMessage(NewsProvider provider, String message) {
        String lower = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if (lower.contains("rate limit") || lower.contains("429")) {
            return create(provider, ProviderErrorCode.RATE_LIMIT, message, 429);
        }
        if (lower.contains("quota") || lower.contains("exceeded")) {
            return create(provider, ProviderErrorCode.QUOTA_EXCEEDED, message, 429);
        }
        if (lower.contains("not found") || lower.contains("404")) {
            return create(provider, ProviderErrorCode.NOT_FOUND, message, 404);
        }
        if (lower.contains("timeout") || lower.contains("timed out")) {
            return create(provider, ProviderErrorCode.TIMEOUT, message, null);
        }
        return create(provider, ProviderErrorCode.UNKNOWN, message, null);
    }

    public static ErrorSeverity determineSeverity(String code, Integer httpStatus) {
        String c = code == null ? "" : code;
        if (c.contains("RATE_LIMIT") || c.contains("TIMEOUT")) {
            return ErrorSeverity.TRANSIENT;
        }
        if (c.contains("INVALID_KEY") || c.contains("NOT_FOUND") || c.contains("NOT_CONFIGURED")) {
            return ErrorSeverity.PERMANENT;
        }
        if (httpStatus != null) {
            if (httpStatus == 429) return ErrorSeverity.TRANSIENT;
            if (httpStatus >= 500) return ErrorSeverity.RETRYABLE;
            if (httpStatus >= 400) return ErrorSeverity.PERMANENT;
        }
        return ErrorSeverity.UNKNOWN;
    }

    public static boolean isRetryable(ErrorSeverity severity) {
        return severity == ErrorSeverity.TRANSIENT || severity == ErrorSeverity.RETRYABLE;
    }
}
