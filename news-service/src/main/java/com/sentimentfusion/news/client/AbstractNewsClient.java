package com.sentimentfusion.news.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentimentfusion.common.error.ProviderErrorCode;
import com.sentimentfusion.common.exception.ProviderException;
import com.sentimentfusion.common.model.Article;
import com.sentimentfusion.news.provider.NewsContentProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Shared request/response handling for the HTTP news clients.
 *
 * <p>Subclasses supply the request and a {@link JsonNode} parser. This class handles the
 * missing-key short-circuit, maps non-2xx statuses to {@link ProviderException} and caps the
 * result at {@link #MAX_ARTICLES}.
 */
public abstract class AbstractNewsClient implements NewsContentProvider {

    public static final int MAX_ARTICLES = 10;

    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final WebClient webClient;
    protected final ObjectMapper objectMapper;
    protected final String apiKey;

    protected AbstractNewsClient(WebClient webClient, ObjectMapper objectMapper, String apiKey) {
        this.webClient    = webClient;
        this.objectMapper = objectMapper;
        this.apiKey       = apiKey;
    }

    protected boolean requiresApiKey() {
        return true;
    }

    public boolean isConfigured() {
        return !requiresApiKey() || (apiKey != null && !apiKey.isBlank());
    }

    @Override
    public Mono<List<Article>> fetchArticles(String symbol) {
        return Mono.defer(() -> {
            if (!isConfigured()) {
                return Mono.error(new ProviderException(provider(), ProviderErrorCode.NOT_CONFIGURED,
                    "API key not configured"));
            }
            log.debug("Fetching news. provider={} symbol={}", provider().displayName(), symbol);
            return request(symbol)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                    .defaultIfEmpty("")
                    .map(body -> statusError(response.statusCode().value(), body)))
                .bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> cap(parse(symbol, readTree(body))))
                .doOnSuccess(articles -> log.debug("News fetched. provider={} symbol={} count={}",
                    provider().displayName(), symbol, articles.size()));
        });
    }

    protected abstract WebClient.RequestHeadersSpec<?> request(String symbol);

    protected abstract List<Article> parse(String symbol, JsonNode root);

    protected ProviderException statusError(int status, String body) {
        ProviderErrorCode kind = ProviderErrorCode.fromHttpStatus(status);
        String detail = body == null || body.isBlank() ? "" : ": " + abbreviate(body, 200);
        return new ProviderException(provider(), kind == null ? ProviderErrorCode.UNKNOWN : kind,
            "HTTP " + status + detail, status);
    }

    private JsonNode readTree(String body) {
        if (body.isBlank()) {
            return objectMapper.missingNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ProviderException(provider(), ProviderErrorCode.UNKNOWN,
                "Malformed response: " + e.getOriginalMessage());
        }
    }

    private static List<Article> cap(List<Article> articles) {
        return articles.size() > MAX_ARTICLES ? List.copyOf(articles.subList(0, MAX_ARTICLES)) : articles;
    }

    /** ISO-8601 with offset or zone; {@code null} when absent or unparseable. */
    protected static Instant parseInstant(String text) {
        if (text == null || text.isBlank()) return null;
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return Instant.parse(text);
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
    }

    protected static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isValueNode() && !value.isNull() ? value.asText() : null;
    }

    private static String abbreviate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }
}
