package com.sentimentfusion.news.service;

import com.sentimentfusion.common.error.ErrorAggregator;
import com.sentimentfusion.common.error.ProviderErrorCode;
import com.sentimentfusion.common.error.ProviderErrors;
import com.sentimentfusion.common.model.Article;
import com.sentimentfusion.common.model.ErrorSummary;
import com.sentimentfusion.common.model.NewsProvider;
import com.sentimentfusion.common.model.ProviderError;
import com.sentimentfusion.common.trace.TraceContextUtil;
import com.sentimentfusion.news.error.ProviderErrorClassifier;
import com.sentimentfusion.news.model.FetchOutcome;
import com.sentimentfusion.news.provider.NewsContentProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Provider-fallback content fetcher.
 *
 * <p><strong>Flow:</strong>
 * <ol>
 *   <li>Walk {@code priorityOrder} strictly in order, one provider at a time.</li>
 *   <li>Each attempt is bounded by {@code perProviderTimeout}; a timeout is a transient error.</li>
 *   <li>An attempt that errors or returns zero articles is recorded as a {@link ProviderError}.</li>
 *   <li>Stop at the first provider with at least one article; later providers are never called.</li>
 * </ol>
 *
 * <p>Never errors. When every provider is exhausted the outcome has no articles and the caller
 * decides whether to aggregate the errors.
 */
public class ContentFetchService {

    private static final Logger log = LoggerFactory.getLogger(ContentFetchService.class);

    private final Map<NewsProvider, NewsContentProvider> providers;
    private final List<NewsProvider> priorityOrder;
    private final Duration perProviderTimeout;

    public ContentFetchService(List<NewsContentProvider> providers,
                               List<NewsProvider> priorityOrder,
                               Duration perProviderTimeout) {
        this.providers = new EnumMap<>(NewsProvider.class);
        providers.forEach(p -> this.providers.put(p.provider(), p));
        this.priorityOrder      = List.copyOf(priorityOrder);
        this.perProviderTimeout = perProviderTimeout;
    }

    public Mono<FetchOutcome> fetch(String symbol) {
        return Flux.fromIterable(priorityOrder)
            .concatMap(provider -> attempt(provider, symbol))
            .takeUntil(Attempt::succeeded)
            .collectList()
            .map(ContentFetchService::toOutcome)
            .flatMap(outcome -> Mono.deferContextual(ctx -> {
                logOutcome(symbol, outcome, TraceContextUtil.getTraceId(ctx));
                return Mono.just(outcome);
            }));
    }

    private Mono<Attempt> attempt(NewsProvider provider, String symbol) {
        NewsContentProvider client = providers.get(provider);
        if (client == null) {
            return Mono.just(Attempt.failed(provider, ProviderErrors.create(provider,
                ProviderErrorCode.NOT_CONFIGURED, provider.displayName() + " has no client registered", null)));
        }
        return Mono.defer(() -> client.fetchArticles(symbol))
            .timeout(perProviderTimeout)
            .map(articles -> articles.isEmpty()
                ? Attempt.failed(provider, ProviderErrors.emptyResult(provider, symbol))
                : Attempt.succeeded(provider, articles))
            .defaultIfEmpty(Attempt.failed(provider, ProviderErrors.emptyResult(provider, symbol)))
            .onErrorResume(e -> Mono.just(Attempt.failed(provider,
                ProviderErrorClassifier.fromThrowable(provider, e, perProviderTimeout.toMillis()))))
            .doOnNext(a -> {
                if (!a.succeeded()) {
                    log.warn("Provider attempt failed. symbol={} provider={} code={} severity={} message={}",
                        symbol, provider.displayName(), a.error().code(), a.error().severity().label(),
                        a.error().message());
                }
            });
    }

    private static FetchOutcome toOutcome(List<Attempt> attempts) {
        List<ProviderError> errors = new ArrayList<>();
        for (Attempt a : attempts) {
            if (a.succeeded()) {
                return new FetchOutcome(a.articles(), errors, a.provider());
            }
            errors.add(a.error());
        }
        return new FetchOutcome(List.of(), errors, null);
    }

    private void logOutcome(String symbol, FetchOutcome outcome, String traceId) {
        TraceContextUtil.withMdc(traceId, () -> {
            if (outcome.hasArticles()) {
                log.info("Content fetched. symbol={} provider={} articles={} failedAttempts={}",
                    symbol, outcome.servedBy().displayName(), outcome.articles().size(),
                    outcome.providerErrors().size());
                return;
            }
            ErrorSummary summary = outcome.errorSummaryIfFailed();
            if (summary.permanentErrors() > 0) {
                log.error("All providers failed. symbol={} {}", symbol, ErrorAggregator.format(summary));
            } else if (summary.totalErrors() > 0) {
                log.warn("All providers failed. symbol={} {}", symbol, ErrorAggregator.format(summary));
            } else {
                log.debug("No providers configured. symbol={}", symbol);
            }
        });
    }

    private record Attempt(NewsProvider provider, List<Article> articles, ProviderError error) {

        static Attempt succeeded(NewsProvider provider, List<Article> articles) {
            return new Attempt(provider, articles, null);
        }

        static Attempt failed(NewsProvider provider, ProviderError error) {
            return new Attempt(provider, List.of(), error);
        }

        boolean succeeded() {
            return error == null;
        }
    }
}
