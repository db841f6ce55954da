package com.sentimentfusion.common.error;

import com.sentimentfusion.common.model.ErrorSeverity;
import com.sentimentfusion.common.model.ErrorSummary;
import com.sentimentfusion.common.model.NewsProvider;
import com.sentimentfusion.common.model.ProviderError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ErrorAggregatorTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2026-03-02T14:00:00Z"), ZoneOffset.UTC);

    private static List<ProviderError> fullChainFailure() {
        return List.of(
            ProviderErrors.create(NewsProvider.PRIMARY_POOL, ProviderErrorCode.NOT_FOUND, "pool: 404", 404),
            ProviderErrors.create(NewsProvider.FEED_A, ProviderErrorCode.RATE_LIMIT, "FeedA: 429", 429),
            ProviderErrors.timeout(NewsProvider.FEED_B, 10_000),
            ProviderErrors.create(NewsProvider.FEED_C, ProviderErrorCode.SERVER_ERROR, "FeedC: 503", 503));
    }

    @Nested
    @DisplayName("aggregate()")
    class AggregateTests {

        @Test
        @DisplayName("empty list → zero-filled summary")
        void emptyList() {
            ErrorSummary s = ErrorAggregator.aggregate(List.of(), FIXED);
            assertEquals(0, s.totalErrors());
            assertEquals(0, s.retryableErrors());
            assertEquals(0, s.permanentErrors());
            assertEquals(NewsProvider.values().length, s.errorsByProvider().size());
            assertEquals(ErrorSeverity.values().length, s.errorsBySeverity().size());
            assertTrue(s.errorsByProvider().values().stream().allMatch(v -> v == 0));
            assertEquals(Instant.parse("2026-03-02T14:00:00Z"), s.timestamp());
        }

        @Test
        @DisplayName("null list is treated as empty")
        void nullList() {
            assertEquals(0, ErrorAggregator.aggregate(null, FIXED).totalErrors());
        }

        @Test
        @DisplayName("four-provider failure → counts per provider and severity")
        void fullChain() {
            ErrorSummary s = ErrorAggregator.aggregate(fullChainFailure(), FIXED);
            assertEquals(4, s.totalErrors());
            for (NewsProvider p : List.of(NewsProvider.PRIMARY_POOL, NewsProvider.FEED_A,
                                          NewsProvider.FEED_B, NewsProvider.FEED_C)) {
                assertEquals(1, s.countFor(p), p.displayName());
            }
            assertEquals(0, s.countFor(NewsProvider.UNKNOWN));
            assertEquals(2, s.countFor(ErrorSeverity.TRANSIENT));
            assertEquals(1, s.countFor(ErrorSeverity.RETRYABLE));
            assertEquals(1, s.countFor(ErrorSeverity.PERMANENT));
            assertEquals(3, s.retryableErrors());
            assertEquals(1, s.permanentErrors());
        }

        @Test
        @DisplayName("error list preserves input order")
        void preservesOrder() {
            List<ProviderError> input = fullChainFailure();
            ErrorSummary s = ErrorAggregator.aggregate(input, FIXED);
            assertEquals(input, s.errors());
        }

        @Test
        @DisplayName("error without provider or severity lands in the unknown buckets")
        void unattributed() {
            ProviderError raw = new ProviderError(null, "X", "?", null, false, null, null, Instant.EPOCH);
            ErrorSummary s = ErrorAggregator.aggregate(List.of(raw), FIXED);
            assertEquals(1, s.countFor(NewsProvider.UNKNOWN));
            assertEquals(1, s.countFor(ErrorSeverity.UNKNOWN));
            assertEquals(0, s.permanentErrors());
        }
    }

    @Nested
    @DisplayName("format() and predicates")
    class FormatTests {

        @Test
        @DisplayName("single-line rendering")
        void format() {
            ErrorSummary s = ErrorAggregator.aggregate(fullChainFailure(), FIXED);
            assertEquals(
                "Total Errors: 4 | By Provider: PrimaryPool=1, FeedA=1, FeedB=1, FeedC=1"
                    + " | By Severity: transient=2, retryable=1, permanent=1"
                    + " | Retryable: 3, Permanent: 1",
                ErrorAggregator.format(s));
        }

        @Test
        @DisplayName("allProvidersFailed only when every chain provider has an error")
        void allProvidersFailed() {
            ErrorSummary all = ErrorAggregator.aggregate(fullChainFailure(), FIXED);
            assertTrue(ErrorAggregator.allProvidersFailed(all));
            assertFalse(ErrorAggregator.anyProviderSucceeded(all));

            ErrorSummary partial = ErrorAggregator.aggregate(fullChainFailure().subList(0, 2), FIXED);
            assertFalse(ErrorAggregator.allProvidersFailed(partial));
            assertTrue(ErrorAggregator.anyProviderSucceeded(partial));
        }
    }
}
