package com.sentimentfusion.sentiment.adapter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentimentfusion.common.model.Article;
import com.sentimentfusion.common.model.Direction;
import com.sentimentfusion.common.model.ModelResult;
import com.sentimentfusion.common.model.ModelRole;
import com.sentimentfusion.sentiment.client.InferenceClient;
import com.sentimentfusion.sentiment.parse.SentimentResponseParser;
import io.netty.handler.timeout.ReadTimeoutException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class SentimentModelAdapterTest {

    private final SentimentResponseParser parser = new SentimentResponseParser(new ObjectMapper());

    private static List<Article> articles(int n) {
        return IntStream.range(0, n)
            .mapToObj(i -> Article.of("Headline " + i, "Summary " + i, "Wire", "https://example.com/" + i, Instant.EPOCH))
            .toList();
    }

    /** Records prompts and answers every call with the same reply. */
    static final class RecordingClient implements InferenceClient {
        final AtomicInteger calls = new AtomicInteger();
        final List<String> prompts = new CopyOnWriteArrayList<>();
        private final Mono<String> reply;

        RecordingClient(Mono<String> reply) {
            this.reply = reply;
        }

        @Override
        public Mono<String> complete(String model, String prompt) {
            calls.incrementAndGet();
            prompts.add(prompt);
            return reply;
        }
    }

    @Nested
    @DisplayName("success path")
    class SuccessTests {

        @Test
        @DisplayName("model A parses reply and records metadata")
        void modelA() {
            RecordingClient client = new RecordingClient(
                Mono.just("{\"sentiment\":\"bullish\",\"confidence\":0.8,\"reasoning\":\"Beat\"}"));
            ContextualAnalysisAdapter adapter =
                new ContextualAnalysisAdapter(client, parser, "model-a", Duration.ofSeconds(1));

            ModelResult r = adapter.analyze("AAPL", articles(3)).block();

            assertTrue(r.isValid());
            assertEquals(ModelRole.MODEL_A, r.role());
            assertEquals(Direction.BULLISH, r.direction());
            assertEquals(0.8, r.confidence());
            assertEquals(3, r.articlesAnalyzed());
            assertEquals("contextual_analysis", r.analysisType());
            assertNotNull(r.responseTimeMs());
            assertTrue(client.prompts.get(0).contains("financial analyst specializing in AAPL"));
        }

        @Test
        @DisplayName("only the first five articles reach the prompt")
        void capsPromptArticles() {
            RecordingClient client = new RecordingClient(Mono.just("{\"sentiment\":\"neutral\",\"confidence\":0.5}"));
            ReasoningAnalysisAdapter adapter =
                new ReasoningAnalysisAdapter(client, parser, "model-b", Duration.ofSeconds(1));

            ModelResult r = adapter.analyze("MSFT", articles(8)).block();

            assertEquals(5, r.articlesAnalyzed());
            assertEquals(List.of("Headline 0", "Headline 1", "Headline 2", "Headline 3", "Headline 4"),
                r.articleTitles());
            String prompt = client.prompts.get(0);
            assertTrue(prompt.startsWith("<think>"));
            assertTrue(prompt.contains("5. Headline 4"));
            assertFalse(prompt.contains("Headline 5"));
        }
    }

    @Nested
    @DisplayName("no data and failures")
    class FailureTests {

        @Test
        @DisplayName("empty articles → 'No data' without calling the model")
        void noData() {
            RecordingClient client = new RecordingClient(Mono.just("unused"));
            ContextualAnalysisAdapter adapter =
                new ContextualAnalysisAdapter(client, parser, "model-a", Duration.ofSeconds(1));

            ModelResult r = adapter.analyze("AAPL", List.of()).block();

            assertEquals(ModelResult.NO_DATA, r.error());
            assertEquals(Direction.NEUTRAL, r.direction());
            assertEquals(0.0, r.confidence());
            assertFalse(r.isValid());
            assertFalse(r.isRemoteFailure());
            assertEquals(0, client.calls.get());
        }

        @Test
        @DisplayName("slow model → TIMEOUT with null confidence")
        void timeout() {
            RecordingClient client = new RecordingClient(Mono.never());
            ReasoningAnalysisAdapter adapter =
                new ReasoningAnalysisAdapter(client, parser, "model-b", Duration.ofMillis(50));

            ModelResult r = adapter.analyze("AAPL", articles(2)).block(Duration.ofSeconds(5));

            assertEquals(AbstractSentimentModelAdapter.TIMEOUT_ERROR, r.error());
            assertNull(r.confidence());
            assertTrue(r.isRemoteFailure());
        }

        @Test
        @DisplayName("transport read timeout wrapped by the HTTP client → TIMEOUT")
        void wrappedReadTimeout() {
            WebClientRequestException wrapped = new WebClientRequestException(ReadTimeoutException.INSTANCE,
                HttpMethod.POST, URI.create("http://localhost/ai/run/model-a"), new HttpHeaders());
            RecordingClient client = new RecordingClient(Mono.error(wrapped));
            ContextualAnalysisAdapter adapter =
                new ContextualAnalysisAdapter(client, parser, "model-a", Duration.ofSeconds(1));

            ModelResult r = adapter.analyze("AAPL", articles(2)).block(Duration.ofSeconds(5));

            assertEquals(AbstractSentimentModelAdapter.TIMEOUT_ERROR, r.error());
            assertEquals("Model timed out - temporary issue", r.reasoning());
            assertNull(r.confidence());
        }

        @Test
        @DisplayName("remote error → failed result, exactly one call, no retry")
        void remoteError() {
            RecordingClient client = new RecordingClient(Mono.error(new IllegalStateException("429 Too Many Requests")));
            ContextualAnalysisAdapter adapter =
                new ContextualAnalysisAdapter(client, parser, "model-a", Duration.ofSeconds(1));

            ModelResult r = adapter.analyze("AAPL", articles(2)).block();

            assertEquals("429 Too Many Requests", r.error());
            assertEquals(Direction.NEUTRAL, r.direction());
            assertNull(r.confidence());
            assertEquals(1, client.calls.get());
        }

        @Test
        @DisplayName("blank reply → 'Empty response' failure")
        void blankReply() {
            RecordingClient client = new RecordingClient(Mono.just("   "));
            ContextualAnalysisAdapter adapter =
                new ContextualAnalysisAdapter(client, parser, "model-a", Duration.ofSeconds(1));

            assertEquals("Empty response", adapter.analyze("AAPL", articles(1)).block().error());
        }
    }
}
