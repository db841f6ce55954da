package com.sentimentfusion.sentiment.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Workers AI REST: {@code POST /accounts/{accountId}/ai/run/{model}} with a bearer token.
 *
 * <p>Reply text is taken from the first of {@code result.choices[0].message.content},
 * {@code result.response}, {@code choices[0].message.content} or {@code response}; any other
 * shape is passed on as raw JSON so the parser can still try it.
 */
public class WorkersAiInferenceClient implements InferenceClient {

    private static final Logger log = LoggerFactory.getLogger(WorkersAiInferenceClient.class);

    private static final double TEMPERATURE = 0.1;
    private static final int MAX_TOKENS = 800;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String accountId;
    private final String apiToken;

    public WorkersAiInferenceClient(WebClient webClient, ObjectMapper objectMapper,
                                    String accountId, String apiToken) {
        this.webClient    = webClient;
        this.objectMapper = objectMapper;
        this.accountId    = accountId;
        this.apiToken     = apiToken;
    }

    @Override
    public Mono<String> complete(String model, String prompt) {
        if (apiToken == null || apiToken.isBlank() || accountId == null || accountId.isBlank()) {
            return Mono.error(new IllegalStateException("Workers AI credentials not configured"));
        }
        Map<String, Object> requestBody = Map.of(
            "messages", List.of(Map.of("role", "user", "content", prompt)),
            "temperature", TEMPERATURE,
            "max_tokens", MAX_TOKENS
        );

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody))
            .flatMap(bodyJson -> webClient.post()
                // model ids contain '/' and '@' that must stay literal path characters
                .uri("/accounts/" + accountId + "/ai/run/" + model)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiToken)
                .header(HttpHeaders.CONTENT_TYPE, "application/json")
                .bodyValue(bodyJson)
                .retrieve()
                .bodyToMono(String.class))
            .map(this::extractResponseText)
            .doOnSuccess(text -> log.debug("Inference complete. model={} chars={}", model,
                text == null ? 0 : text.length()));
    }

    String extractResponseText(String body) {
        try {
            return extractResponseText(objectMapper.readTree(body));
        } catch (JsonProcessingException e) {
            return body;
        }
    }

    static String extractResponseText(JsonNode root) {
        if (root == null || root.isMissingNode() || root.isNull()) return "";
        if (root.isTextual()) return root.asText();

        JsonNode result = root.path("result");
        for (JsonNode node : List.of(result, root)) {
            JsonNode content = node.path("choices").path(0).path("message").path("content");
            if (content.isTextual() && !content.asText().isEmpty()) return content.asText();
            JsonNode response = node.path("response");
            if (response.isTextual() && !response.asText().isEmpty()) return response.asText();
        }
        return root.toString();
    }
}
