package com.sentimentfusion.news.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentimentfusion.common.model.Article;
import com.sentimentfusion.common.model.NewsProvider;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Yahoo Finance search news. No key; the endpoint rejects requests without a browser-like
 * User-Agent.
 */
public class YahooNewsClient extends AbstractNewsClient {

    private static final String USER_AGENT = "Mozilla/5.0 (compatible; SentimentFusion/1.0)";

    public YahooNewsClient(WebClient webClient, ObjectMapper objectMapper) {
        super(webClient, objectMapper, null);
    }

    @Override
    public NewsProvider provider() {
        return NewsProvider.FEED_C;
    }

    @Override
    protected boolean requiresApiKey() {
        return false;
    }

    @Override
    protected WebClient.RequestHeadersSpec<?> request(String symbol) {
        return webClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/v1/finance/search")
                .queryParam("q", symbol)
                .queryParam("lang", "en-US")
                .queryParam("region", "US")
                .queryParam("quotesCount", 1)
                .queryParam("newsCount", MAX_ARTICLES)
                .build())
            .header(HttpHeaders.USER_AGENT, USER_AGENT);
    }

    @Override
    protected List<Article> parse(String symbol, JsonNode root) {
        List<Article> articles = new ArrayList<>();
        for (JsonNode item : root.path("news")) {
            JsonNode published = item.path("providerPublishTime");
            articles.add(Article.of(
                text(item, "title"),
                text(item, "summary"),
                item.path("publisher").asText("Yahoo Finance"),
                text(item, "link"),
                published.isNumber() ? Instant.ofEpochSecond(published.asLong()) : null));
        }
        return articles;
    }
}
