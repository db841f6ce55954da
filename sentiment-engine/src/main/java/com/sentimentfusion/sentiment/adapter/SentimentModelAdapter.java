package com.sentimentfusion.sentiment.adapter;

import com.sentimentfusion.common.model.Article;
import com.sentimentfusion.common.model.ModelResult;
import com.sentimentfusion.common.model.ModelRole;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * One independent sentiment classifier.
 *
 * <p>{@link #analyze} never errors: an empty article list short-circuits to a "No data" result
 * without calling the model, and any remote failure becomes a result with a null confidence.
 */
public interface SentimentModelAdapter {

    ModelRole role();

    String modelId();

    Mono<ModelResult> analyze(String symbol, List<Article> articles);
}
