package com.sentimentfusion.sentiment.adapter;

import com.sentimentfusion.common.exception.ModelInvocationException;
import com.sentimentfusion.common.model.Article;
import com.sentimentfusion.common.model.ModelResult;
import com.sentimentfusion.sentiment.client.InferenceClient;
import com.sentimentfusion.sentiment.parse.ParsedSentiment;
import com.sentimentfusion.sentiment.parse.SentimentResponseParser;
import io.netty.handler.timeout.ReadTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Shared adapter flow: cap the articles, build the prompt, make exactly one time-bounded call,
 * parse the reply. Subclasses only shape the prompt.
 */
public abstract class AbstractSentimentModelAdapter implements SentimentModelAdapter {

    public static final int MAX_PROMPT_ARTICLES = 5;
    public static final String TIMEOUT_ERROR = "TIMEOUT";

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final InferenceClient client;
    private final SentimentResponseParser parser;
    private final String modelId;
    private final Duration timeout;

    protected AbstractSentimentModelAdapter(InferenceClient client, SentimentResponseParser parser,
                                            String modelId, Duration timeout) {
        this.client  = client;
        this.parser  = parser;
        this.modelId = modelId;
        this.timeout = timeout;
    }

    @Override
    public String modelId() {
        return modelId;
    }

    protected abstract String analysisType();

    protected abstract String buildPrompt(String symbol, String newsContext);

    @Override
    public Mono<ModelResult> analyze(String symbol, List<Article> articles) {
        if (articles == null || articles.isEmpty()) {
            log.debug("No articles, skipping model call. role={} symbol={}", role().key(), symbol);
            return Mono.just(ModelResult.noData(role(), modelId));
        }
        List<Article> top = articles.subList(0, Math.min(MAX_PROMPT_ARTICLES, articles.size()));
        List<String> titles = top.stream().map(Article::title).toList();
        String prompt = buildPrompt(symbol, newsContext(top));

        return Mono.defer(() -> {
            long start = System.currentTimeMillis();
            return client.complete(modelId, prompt)
                .timeout(timeout)
                .filter(text -> !text.isBlank())
                .switchIfEmpty(Mono.error(() -> new ModelInvocationException(role(), "Empty response")))
                .map(text -> {
                    ParsedSentiment parsed = parser.parse(text);
                    return ModelResult.of(role(), modelId, parsed.direction(), parsed.confidence(), parsed.reasoning())
                        .withTiming(System.currentTimeMillis() - start, titles, analysisType());
                })
                .doOnSuccess(r -> log.info("Model analysis complete. role={} symbol={} direction={} confidence={} ms={}",
                    role().key(), symbol, r.direction().label(), r.confidence(), r.responseTimeMs()))
                .onErrorResume(e -> Mono.just(failure(symbol, e)));
        });
    }

    private ModelResult failure(String symbol, Throwable e) {
        if (isTimeout(e)) {
            log.warn("Model call timed out. role={} symbol={} timeoutMs={}", role().key(), symbol, timeout.toMillis());
            return ModelResult.failed(role(), modelId, TIMEOUT_ERROR, "Model timed out - temporary issue");
        }
        String message = e instanceof ModelInvocationException mie ? mie.getDetail()
            : e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        log.warn("Model call failed. role={} symbol={} reason={}", role().key(), symbol, message);
        return ModelResult.failed(role(), modelId, message, "Analysis failed: " + message);
    }

    // Transport read timeouts arrive wrapped, e.g. in WebClientRequestException.
    private static boolean isTimeout(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof TimeoutException || t instanceof ReadTimeoutException) {
                return true;
            }
            if (t.getCause() == t) break;
        }
        return false;
    }

    static String newsContext(List<Article> articles) {
        return IntStream.range(0, articles.size())
            .mapToObj(i -> {
                Article a = articles.get(i);
                return (i + 1) + ". " + a.title() + "\n   " + a.summary() + "\n   Source: " + a.source();
            })
            .collect(Collectors.joining("\n\n"));
    }

    protected static final String RESPONSE_FORMAT = """
        Based on your analysis, respond with ONLY this JSON format:
        {
          "sentiment": "bullish" | "bearish" | "neutral",
          "confidence": 0.XX,
          "reasoning": "brief explanation of key factors"
        }""";
}
