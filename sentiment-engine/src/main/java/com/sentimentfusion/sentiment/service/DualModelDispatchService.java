package com.sentimentfusion.sentiment.service;

import com.sentimentfusion.common.model.Article;
import com.sentimentfusion.common.model.ModelPair;
import com.sentimentfusion.common.model.ModelResult;
import com.sentimentfusion.common.model.ModelRole;
import com.sentimentfusion.sentiment.adapter.SentimentModelAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs both model adapters concurrently on the same articles and pairs the results.
 * Neither adapter can fail the pair: an escaped error becomes a failed {@link ModelResult}.
 */
public class DualModelDispatchService {

    private static final Logger log = LoggerFactory.getLogger(DualModelDispatchService.class);

    private final Map<ModelRole, SentimentModelAdapter> adapters = new EnumMap<>(ModelRole.class);

    public DualModelDispatchService(List<SentimentModelAdapter> adapters) {
        adapters.forEach(a -> this.adapters.put(a.role(), a));
        for (ModelRole role : ModelRole.values()) {
            if (!this.adapters.containsKey(role)) {
                throw new IllegalArgumentException("No sentiment adapter registered for " + role.key());
            }
        }
    }

    public Mono<ModelPair> dispatch(String symbol, List<Article> articles) {
        log.info("Dispatching dual model analysis. symbol={} articles={}", symbol, articles.size());
        return Mono.zip(
                guarded(adapters.get(ModelRole.MODEL_A), symbol, articles),
                guarded(adapters.get(ModelRole.MODEL_B), symbol, articles))
            .map(t -> new ModelPair(t.getT1(), t.getT2()));
    }

    private Mono<ModelResult> guarded(SentimentModelAdapter adapter, String symbol, List<Article> articles) {
        ModelResult missing = ModelResult.failed(adapter.role(), adapter.modelId(),
            "Empty response", "Analysis failed: Empty response");
        return Mono.defer(() -> adapter.analyze(symbol, articles))
            .defaultIfEmpty(missing)
            .onErrorResume(e -> {
                log.error("Adapter={} failed for symbol={}", adapter.role().key(), symbol, e);
                String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                return Mono.just(ModelResult.failed(adapter.role(), adapter.modelId(), message,
                    "Analysis failed: " + message));
            });
    }
}
