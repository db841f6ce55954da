package com.sentimentfusion.news.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentimentfusion.common.error.ProviderErrorCode;
import com.sentimentfusion.common.exception.ProviderException;
import com.sentimentfusion.common.model.Article;
import com.sentimentfusion.common.model.NewsProvider;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.ArrayList;
import java.util.List;

/**
 * NewsAPI {@code /v2/everything}. Errors arrive as {@code {status:"error", code, message}}.
 */
public class NewsApiClient extends AbstractNewsClient {

    public NewsApiClient(WebClient webClient, ObjectMapper objectMapper, String apiKey) {
        super(webClient, objectMapper, apiKey);
    }

    @Override
    public NewsProvider provider() {
        return NewsProvider.FEED_B;
    }

    @Override
    protected WebClient.RequestHeadersSpec<?> request(String symbol) {
        return webClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/v2/everything")
                .queryParam("q", symbol)
                .queryParam("sortBy", "publishedAt")
                .queryParam("pageSize", MAX_ARTICLES)
                .queryParam("apiKey", apiKey)
                .build());
    }

    @Override
    protected ProviderException statusError(int status, String body) {
        ProviderException fromBody = bodyError(body, status);
        return fromBody != null ? fromBody : super.statusError(status, body);
    }

    @Override
    protected List<Article> parse(String symbol, JsonNode root) {
        if ("error".equals(root.path("status").asText())) {
            throw errorFor(root, null);
        }
        List<Article> articles = new ArrayList<>();
        for (JsonNode item : root.path("articles")) {
            articles.add(Article.of(
                text(item, "title"),
                text(item, "description"),
                item.path("source").path("name").asText("NewsAPI"),
                text(item, "url"),
                parseInstant(text(item, "publishedAt"))));
        }
        return articles;
    }

    private ProviderException bodyError(String body, int status) {
        if (body == null || body.isBlank()) return null;
        try {
            JsonNode root = objectMapper.readTree(body);
            return "error".equals(root.path("status").asText()) ? errorFor(root, status) : null;
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON. provider={} status={}", provider().displayName(), status);
            return null;
        }
    }

    private ProviderException errorFor(JsonNode root, Integer status) {
        String code = root.path("code").asText("");
        ProviderErrorCode kind = switch (code) {
            case "rateLimited"                                 -> ProviderErrorCode.RATE_LIMIT;
            case "apiKeyInvalid", "apiKeyMissing", "apiKeyDisabled", "apiKeyExhausted"
                                                               -> ProviderErrorCode.INVALID_KEY;
            case "maximumResultsReached"                       -> ProviderErrorCode.QUOTA_EXCEEDED;
            default -> {
                ProviderErrorCode byStatus = status == null ? null : ProviderErrorCode.fromHttpStatus(status);
                yield byStatus == null ? ProviderErrorCode.UNKNOWN : byStatus;
            }
        };
        return new ProviderException(provider(), kind,
            root.path("message").asText("NewsAPI error " + code), status);
    }
}
