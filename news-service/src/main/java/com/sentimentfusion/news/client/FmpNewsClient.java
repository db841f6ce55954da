package com.sentimentfusion.news.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentimentfusion.common.error.ProviderErrorCode;
import com.sentimentfusion.common.exception.ProviderException;
import com.sentimentfusion.common.model.Article;
import com.sentimentfusion.common.model.NewsProvider;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Financial Modeling Prep {@code /api/v3/stock_news}. Returns a bare JSON array; failures come
 * back as {@code {"Error Message": "..."}} with HTTP 200.
 */
public class FmpNewsClient extends AbstractNewsClient {

    private static final DateTimeFormatter FMP_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public FmpNewsClient(WebClient webClient, ObjectMapper objectMapper, String apiKey) {
        super(webClient, objectMapper, apiKey);
    }

    @Override
    public NewsProvider provider() {
        return NewsProvider.FEED_A;
    }

    @Override
    protected WebClient.RequestHeadersSpec<?> request(String symbol) {
        return webClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/api/v3/stock_news")
                .queryParam("tickers", symbol)
                .queryParam("limit", MAX_ARTICLES)
                .queryParam("apikey", apiKey)
                .build());
    }

    @Override
    protected List<Article> parse(String symbol, JsonNode root) {
        if (root.has("Error Message")) {
            String message = root.path("Error Message").asText();
            ProviderErrorCode kind = message.toLowerCase(Locale.ROOT).contains("key")
                ? ProviderErrorCode.INVALID_KEY
                : ProviderErrorCode.UNKNOWN;
            throw new ProviderException(provider(), kind, message);
        }
        if (!root.isArray()) {
            return List.of();
        }
        List<Article> articles = new ArrayList<>();
        for (JsonNode item : root) {
            articles.add(Article.of(
                text(item, "title"),
                text(item, "text"),
                item.path("site").asText("FMP"),
                text(item, "url"),
                parseFmpDate(text(item, "publishedDate"))));
        }
        return articles;
    }

    // FMP timestamps are "yyyy-MM-dd HH:mm:ss", treated as UTC
    private static Instant parseFmpDate(String text) {
        if (text == null) return null;
        try {
            return LocalDateTime.parse(text, FMP_FMT).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return parseInstant(text);
        }
    }
}
