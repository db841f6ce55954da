package com.sentimentfusion.news.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentimentfusion.common.error.ProviderErrorCode;
import com.sentimentfusion.common.exception.ProviderException;
import com.sentimentfusion.common.model.Article;
import com.sentimentfusion.common.model.NewsProvider;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Curated article pool: {@code GET /api/admin/article-pool/accessor/stock/{symbol}}.
 * Response shape {@code {success, articles: [...], error, errorMessage}}.
 */
public class PrimaryPoolClient extends AbstractNewsClient {

    public PrimaryPoolClient(WebClient webClient, ObjectMapper objectMapper, String apiKey) {
        super(webClient, objectMapper, apiKey);
    }

    @Override
    public NewsProvider provider() {
        return NewsProvider.PRIMARY_POOL;
    }

    @Override
    protected WebClient.RequestHeadersSpec<?> request(String symbol) {
        return webClient.get()
            .uri("/api/admin/article-pool/accessor/stock/{symbol}", symbol.toUpperCase(Locale.ROOT))
            .header("X-API-Key", apiKey);
    }

    @Override
    protected List<Article> parse(String symbol, JsonNode root) {
        if (!root.path("success").asBoolean(false)) {
            String error = root.path("errorMessage").asText(root.path("error").asText("request unsuccessful"));
            throw new ProviderException(provider(), ProviderErrorCode.UNKNOWN, error);
        }
        List<Article> articles = new ArrayList<>();
        for (JsonNode item : root.path("articles")) {
            String title = text(item, "headline");
            articles.add(Article.of(
                title != null ? title : text(item, "title"),
                text(item, "summary"),
                item.path("source").asText(provider().displayName()),
                text(item, "url"),
                parseInstant(text(item, "publishedAt"))));
        }
        return articles;
    }
}
