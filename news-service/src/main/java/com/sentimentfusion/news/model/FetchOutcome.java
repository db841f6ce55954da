package com.sentimentfusion.news.model;

import com.sentimentfusion.common.error.ErrorAggregator;
import com.sentimentfusion.common.model.Article;
import com.sentimentfusion.common.model.ErrorSummary;
import com.sentimentfusion.common.model.NewsProvider;
import com.sentimentfusion.common.model.ProviderError;

import java.util.List;

/**
 * Result of one walk down the provider chain.
 *
 * @param articles       articles from the first provider that returned any; empty when all failed
 * @param providerErrors one entry per failed attempt, in attempt order
 * @param servedBy       provider that supplied {@code articles}, or {@code null}
 */
public record FetchOutcome(List<Article> articles, List<ProviderError> providerErrors, NewsProvider servedBy) {

    public FetchOutcome {
        articles       = List.copyOf(articles);
        providerErrors = List.copyOf(providerErrors);
    }

    public boolean hasArticles() {
        return !articles.isEmpty();
    }

    /** Summary of provider failures, present only when no provider produced articles. */
    public ErrorSummary errorSummaryIfFailed() {
        return hasArticles() ? null : ErrorAggregator.aggregate(providerErrors);
    }
}
