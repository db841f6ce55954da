package com.sentimentfusion.sentiment.service;

import com.sentimentfusion.common.model.Article;
import com.sentimentfusion.common.model.Direction;
import com.sentimentfusion.common.model.ModelPair;
import com.sentimentfusion.common.model.ModelResult;
import com.sentimentfusion.common.model.ModelRole;
import com.sentimentfusion.sentiment.adapter.SentimentModelAdapter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.BiFunction;

import static org.junit.jupiter.api.Assertions.*;

class DualModelDispatchServiceTest {

    private static final List<Article> ARTICLES =
        List.of(Article.of("Headline", "Body", "Wire", "https://example.com", Instant.EPOCH));

    private static SentimentModelAdapter adapter(ModelRole role,
                                                 BiFunction<String, List<Article>, Mono<ModelResult>> body) {
        return new SentimentModelAdapter() {
            @Override public ModelRole role() { return role; }
            @Override public String modelId() { return role.key() + "-model"; }
            @Override public Mono<ModelResult> analyze(String symbol, List<Article> articles) {
                return body.apply(symbol, articles);
            }
        };
    }

    @Test
    @DisplayName("both results are paired by role regardless of registration order")
    void pairsByRole() {
        DualModelDispatchService service = new DualModelDispatchService(List.of(
            adapter(ModelRole.MODEL_B, (s, a) -> Mono.just(
                ModelResult.of(ModelRole.MODEL_B, "b", Direction.BEARISH, 0.6, "b"))),
            adapter(ModelRole.MODEL_A, (s, a) -> Mono.just(
                ModelResult.of(ModelRole.MODEL_A, "a", Direction.BULLISH, 0.7, "a")))));

        ModelPair pair = service.dispatch("AAPL", ARTICLES).block();

        assertEquals(Direction.BULLISH, pair.modelA().direction());
        assertEquals(Direction.BEARISH, pair.modelB().direction());
        assertEquals(2, pair.successfulModels());
    }

    @Test
    @DisplayName("models run concurrently, not one after the other")
    void concurrent() {
        DualModelDispatchService service = new DualModelDispatchService(List.of(
            adapter(ModelRole.MODEL_A, (s, a) -> Mono.delay(Duration.ofMillis(300))
                .thenReturn(ModelResult.of(ModelRole.MODEL_A, "a", Direction.BULLISH, 0.7, "a"))),
            adapter(ModelRole.MODEL_B, (s, a) -> Mono.delay(Duration.ofMillis(300))
                .thenReturn(ModelResult.of(ModelRole.MODEL_B, "b", Direction.BULLISH, 0.6, "b")))));

        long start = System.currentTimeMillis();
        service.dispatch("AAPL", ARTICLES).block(Duration.ofSeconds(5));
        assertTrue(System.currentTimeMillis() - start < 550, "expected overlapping calls");
    }

    @Test
    @DisplayName("an adapter that errors anyway yields a failed result, the other survives")
    void escapedError() {
        DualModelDispatchService service = new DualModelDispatchService(List.of(
            adapter(ModelRole.MODEL_A, (s, a) -> { throw new IllegalStateException("bug"); }),
            adapter(ModelRole.MODEL_B, (s, a) -> Mono.just(
                ModelResult.of(ModelRole.MODEL_B, "b", Direction.BEARISH, 0.9, "b")))));

        ModelPair pair = service.dispatch("AAPL", ARTICLES).block();

        assertFalse(pair.modelA().isValid());
        assertEquals("bug", pair.modelA().error());
        assertTrue(pair.modelB().isValid());
    }

    @Test
    @DisplayName("missing adapter is rejected at construction")
    void missingAdapter() {
        assertThrows(IllegalArgumentException.class, () -> new DualModelDispatchService(List.of(
            adapter(ModelRole.MODEL_A, (s, a) -> Mono.empty()))));
    }
}
