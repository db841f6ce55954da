package com.sentimentfusion.common.error;

import com.sentimentfusion.common.model.ErrorSeverity;
import com.sentimentfusion.common.model.ErrorSummary;
import com.sentimentfusion.common.model.NewsProvider;
import com.sentimentfusion.common.model.ProviderError;

import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds the provider failures of one fetch attempt into a single {@link ErrorSummary}.
 *
 * <p>Callers invoke this only when the fetch produced zero usable articles. A failure masked by a
 * later successful fallback is a degraded success and gets no summary.
 *
 * <p>Pure, total and thread-safe. Every provider and severity key is present in the output maps,
 * zero-filled, so stored summaries have a stable shape.
 */
public final class ErrorAggregator {

    /** Providers that take part in the fallback chain (excludes UNKNOWN). */
    private static final List<NewsProvider> CHAIN_PROVIDERS = List.of(
        NewsProvider.PRIMARY_POOL, NewsProvider.FEED_A, NewsProvider.FEED_B, NewsProvider.FEED_C);

    private ErrorAggregator() {}

    public static ErrorSummary aggregate(List<ProviderError> errors) {
        return aggregate(errors, Clock.systemUTC());
    }

    public static ErrorSummary aggregate(List<ProviderError> errors, Clock clock) {
        List<ProviderError> ordered = errors == null ? List.of() : List.copyOf(errors);

        Map<String, Integer> byProvider = new LinkedHashMap<>();
        for (NewsProvider p : NewsProvider.values()) {
            byProvider.put(p.displayName(), 0);
        }
        Map<String, Integer> bySeverity = new LinkedHashMap<>();
        Arrays.stream(ErrorSeverity.values()).forEach(s -> bySeverity.put(s.label(), 0));

        int retryable = 0;
        int permanent = 0;
        for (ProviderError e : ordered) {
            NewsProvider provider = e.provider() == null ? NewsProvider.UNKNOWN : e.provider();
            ErrorSeverity severity = e.severity() == null ? ErrorSeverity.UNKNOWN : e.severity();
            byProvider.merge(provider.displayName(), 1, Integer::sum);
            bySeverity.merge(severity.label(), 1, Integer::sum);
            if (e.retryable()) {
                retryable++;
            } else if (severity == ErrorSeverity.PERMANENT) {
                permanent++;
            }
        }

        return new ErrorSummary(
            ordered.size(),
            Collections.unmodifiableMap(byProvider),
            Collections.unmodifiableMap(bySeverity),
            retryable,
            permanent,
            ordered,
            Instant.now(clock));
    }

    /** One-line rendering for log output. */
    public static String format(ErrorSummary summary) {
        StringBuilder byProvider = new StringBuilder();
        for (NewsProvider p : CHAIN_PROVIDERS) {
            if (byProvider.length() > 0) byProvider.append(", ");
            byProvider.append(p.displayName()).append('=').append(summary.countFor(p));
        }
        return String.join(" | ",
            "Total Errors: " + summary.totalErrors(),
            "By Provider: " + byProvider,
            "By Severity: transient=" + summary.countFor(ErrorSeverity.TRANSIENT)
                + ", retryable=" + summary.countFor(ErrorSeverity.RETRYABLE)
                + ", permanent=" + summary.countFor(ErrorSeverity.PERMANENT),
            "Retryable: " + summary.retryableErrors() + ", Permanent: " + summary.permanentErrors());
    }

    /** Every provider in the fallback chain recorded at least one failure. */
    public static boolean allProvidersFailed(ErrorSummary summary) {
        return CHAIN_PROVIDERS.stream().allMatch(p -> summary.countFor(p) > 0);
    }

    /** At least one provider in the chain recorded no failure. */
    public static boolean anyProviderSucceeded(ErrorSummary summary) {
        return !allProvidersFailed(summary);
    }
}
