package com.sentimentfusion.news.provider;

import com.sentimentfusion.common.model.Article;
import com.sentimentfusion.common.model.NewsProvider;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Strategy interface for one news source in the fallback chain.
 *
 * <p>Implementations signal failure with an error ({@code ProviderException} where the cause is
 * known) and may complete with an empty list when the source has nothing for the symbol.
 */
public interface NewsContentProvider {

    NewsProvider provider();

    Mono<List<Article>> fetchArticles(String symbol);
}
