package com.sentimentfusion.orchestrator.service;

import com.sentimentfusion.common.consensus.AgreementResolver;
import com.sentimentfusion.common.consensus.SignalGenerator;
import com.sentimentfusion.common.error.ProviderErrorCode;
import com.sentimentfusion.common.exception.ProviderException;
import com.sentimentfusion.common.model.AgreementType;
import com.sentimentfusion.common.model.Article;
import com.sentimentfusion.common.model.Direction;
import com.sentimentfusion.common.model.ModelResult;
import com.sentimentfusion.common.model.ModelRole;
import com.sentimentfusion.common.model.NewsProvider;
import com.sentimentfusion.common.model.SignalAction;
import com.sentimentfusion.common.model.SignalStrength;
import com.sentimentfusion.common.model.SymbolAnalysisResult;
import com.sentimentfusion.news.provider.NewsContentProvider;
import com.sentimentfusion.news.service.ContentFetchService;
import com.sentimentfusion.orchestrator.config.FusionProperties;
import com.sentimentfusion.orchestrator.logger.PipelineFlowLogger;
import com.sentimentfusion.sentiment.adapter.SentimentModelAdapter;
import com.sentimentfusion.sentiment.service.DualModelDispatchService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class SymbolAnalysisServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private static final List<Article> ARTICLES = List.of(
        Article.of("Apple beats estimates", "Revenue up", "Wire", "https://example.com/1", NOW),
        Article.of("Apple raises guidance", null, "Wire", "https://example.com/2", NOW));

    private static NewsContentProvider provider(NewsProvider id, Mono<List<Article>> answer) {
        return new NewsContentProvider() {
            @Override public NewsProvider provider() { return id; }
            @Override public Mono<List<Article>> fetchArticles(String symbol) { return answer; }
        };
    }

    private static NewsContentProvider failing(NewsProvider id) {
        return provider(id, Mono.error(new ProviderException(id, ProviderErrorCode.RATE_LIMIT, "Too many requests", 429)));
    }

    /** Adapter fake: counts calls, short-circuits on empty input the way real adapters do. */
    static final class FakeAdapter implements SentimentModelAdapter {
        private final ModelRole role;
        private final Function<Integer, ModelResult> answerForCall;
        final AtomicInteger calls = new AtomicInteger();
        final List<List<Article>> received = new ArrayList<>();

        FakeAdapter(ModelRole role, Function<Integer, ModelResult> answerForCall) {
            this.role = role;
            this.answerForCall = answerForCall;
        }

        @Override public ModelRole role() { return role; }
        @Override public String modelId() { return role.key() + "-model"; }

        @Override
        public Mono<ModelResult> analyze(String symbol, List<Article> articles) {
            received.add(articles);
            if (articles.isEmpty()) {
                return Mono.just(ModelResult.noData(role, modelId()));
            }
            return Mono.fromSupplier(() -> answerForCall.apply(calls.incrementAndGet()));
        }
    }

    private static FakeAdapter answering(ModelRole role, Direction direction, double confidence) {
        return new FakeAdapter(role, call -> ModelResult.of(role, role.key() + "-model", direction, confidence, "fine"));
    }

    private static FakeAdapter rateLimited(ModelRole role) {
        return new FakeAdapter(role, call -> ModelResult.failed(role, role.key() + "-model",
            "429 Too Many Requests", "Analysis failed: 429 Too Many Requests"));
    }

    /** Fails remotely on the first {@code failures} calls, then answers bullish. */
    private static FakeAdapter recoveringAfter(ModelRole role, int failures) {
        return new FakeAdapter(role, call -> call <= failures
            ? ModelResult.failed(role, role.key() + "-model", "TIMEOUT", "Model timed out - temporary issue")
            : ModelResult.of(role, role.key() + "-model", Direction.BULLISH, 0.75, "recovered"));
    }

    private static FusionProperties properties(int retryAttempts) {
        FusionProperties properties = new FusionProperties();
        properties.setModelRetryAttempts(retryAttempts);
        properties.setModelRetryBackoffMs(10);
        return properties;
    }

    private static SymbolAnalysisService service(List<NewsContentProvider> providers,
                                                 FakeAdapter a, FakeAdapter b, int retryAttempts) {
        ContentFetchService fetcher = new ContentFetchService(providers,
            List.of(NewsProvider.PRIMARY_POOL, NewsProvider.FEED_A), Duration.ofSeconds(1));
        return new SymbolAnalysisService(fetcher, new DualModelDispatchService(List.of(a, b)),
            new AgreementResolver(), new SignalGenerator(), new PipelineFlowLogger(),
            properties(retryAttempts), CLOCK);
    }

    @Nested
    @DisplayName("content acquisition")
    class Content {

        @Test
        @DisplayName("a fallback provider's articles feed both models and no error summary is attached")
        void fallbackSuccess() {
            FakeAdapter a = answering(ModelRole.MODEL_A, Direction.BULLISH, 0.8);
            FakeAdapter b = answering(ModelRole.MODEL_B, Direction.BULLISH, 0.7);
            SymbolAnalysisService service = service(List.of(
                failing(NewsProvider.PRIMARY_POOL),
                provider(NewsProvider.FEED_A, Mono.just(ARTICLES))), a, b, 2);

            SymbolAnalysisResult result = service.analyzeOne("AAPL").block();

            assertNotNull(result);
            assertEquals("AAPL", result.symbol());
            assertEquals(NOW, result.timestamp());
            assertNull(result.errorSummary());
            assertEquals(ARTICLES, a.received.get(0));
            assertEquals(ARTICLES, b.received.get(0));
            assertEquals(AgreementType.FULL_AGREEMENT, result.comparison().type());
            assertEquals(SignalStrength.STRONG, result.signal().strength());
            assertEquals(SignalAction.STRONG_BUY, result.signal().action());
            assertEquals(2, result.performanceMetrics().modelsExecuted());
            assertEquals(2, result.performanceMetrics().successfulModels());
            assertFalse(result.isDegraded());
        }

        @Test
        @DisplayName("when every provider fails the models see no data and the summary is attached")
        void allProvidersFailed() {
            FakeAdapter a = answering(ModelRole.MODEL_A, Direction.BULLISH, 0.8);
            FakeAdapter b = answering(ModelRole.MODEL_B, Direction.BULLISH, 0.7);
            SymbolAnalysisService service = service(List.of(
                failing(NewsProvider.PRIMARY_POOL),
                provider(NewsProvider.FEED_A, Mono.just(List.of()))), a, b, 2);

            SymbolAnalysisResult result = service.analyzeOne("ZZZZ").block();

            assertNotNull(result.errorSummary());
            assertEquals(2, result.errorSummary().totalErrors());
            assertEquals(1, result.errorSummary().countFor(NewsProvider.PRIMARY_POOL));
            assertEquals(1, result.errorSummary().countFor(NewsProvider.FEED_A));
            assertEquals(ModelResult.NO_DATA, result.models().modelA().error());
            assertEquals(ModelResult.NO_DATA, result.models().modelB().error());
            assertEquals(0, a.calls.get(), "no-data short-circuit must not reach the model");
            assertEquals(AgreementType.ERROR, result.comparison().type());
            assertEquals(SignalStrength.FAILED, result.signal().strength());
            assertEquals(SignalAction.SKIP, result.signal().action());
            assertEquals(0, result.performanceMetrics().successfulModels());
        }
    }

    @Nested
    @DisplayName("model-stage retry")
    class ModelRetry {

        private final List<NewsContentProvider> providers =
            List.of(provider(NewsProvider.PRIMARY_POOL, Mono.just(ARTICLES)));

        @Test
        @DisplayName("both models failing remotely re-runs the model stage on the same articles")
        void retriesUntilRecovered() {
            FakeAdapter a = recoveringAfter(ModelRole.MODEL_A, 1);
            FakeAdapter b = recoveringAfter(ModelRole.MODEL_B, 1);

            SymbolAnalysisResult result = service(providers, a, b, 2).analyzeOne("AAPL").block();

            assertEquals(2, a.calls.get());
            assertEquals(2, b.calls.get());
            assertEquals(ARTICLES, a.received.get(1));
            assertTrue(result.models().modelA().isValid());
            assertEquals(AgreementType.FULL_AGREEMENT, result.comparison().type());
        }

        @Test
        @DisplayName("exhausted retries keep the last failed pair and end in an error verdict")
        void exhausted() {
            FakeAdapter a = rateLimited(ModelRole.MODEL_A);
            FakeAdapter b = rateLimited(ModelRole.MODEL_B);

            SymbolAnalysisResult result = service(providers, a, b, 2).analyzeOne("AAPL").block();

            assertEquals(3, a.calls.get(), "one call plus two retries");
            assertEquals(3, b.calls.get());
            assertEquals("429 Too Many Requests", result.models().modelA().error());
            assertNull(result.models().modelB().confidence());
            assertEquals(AgreementType.ERROR, result.comparison().type());
            assertEquals(SignalAction.SKIP, result.signal().action());
            assertFalse(result.isDegraded(), "model failures are a verdict, not a pipeline failure");
        }

        @Test
        @DisplayName("one failed model is a partial verdict and is never retried")
        void singleFailureNotRetried() {
            FakeAdapter a = rateLimited(ModelRole.MODEL_A);
            FakeAdapter b = answering(ModelRole.MODEL_B, Direction.BEARISH, 0.9);

            SymbolAnalysisResult result = service(providers, a, b, 2).analyzeOne("AAPL").block();

            assertEquals(1, a.calls.get());
            assertEquals(AgreementType.PARTIAL_AGREEMENT, result.comparison().type());
            assertEquals(Direction.BEARISH, result.signal().direction());
            assertEquals(SignalAction.CONSIDER, result.signal().action());
            assertEquals(1, result.performanceMetrics().successfulModels());
        }

        @Test
        @DisplayName("zero retry attempts means a single model call")
        void retriesDisabled() {
            FakeAdapter a = rateLimited(ModelRole.MODEL_A);
            FakeAdapter b = rateLimited(ModelRole.MODEL_B);

            service(providers, a, b, 0).analyzeOne("AAPL").block();

            assertEquals(1, a.calls.get());
            assertEquals(1, b.calls.get());
        }
    }
}
