package com.sentimentfusion.sentiment.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentimentfusion.sentiment.adapter.ContextualAnalysisAdapter;
import com.sentimentfusion.sentiment.adapter.ReasoningAnalysisAdapter;
import com.sentimentfusion.sentiment.adapter.SentimentModelAdapter;
import com.sentimentfusion.sentiment.client.InferenceClient;
import com.sentimentfusion.sentiment.client.WorkersAiInferenceClient;
import com.sentimentfusion.sentiment.parse.SentimentResponseParser;
import com.sentimentfusion.sentiment.service.DualModelDispatchService;
import io.netty.channel.ChannelOption;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.List;

@Configuration
public class SentimentEngineConfig {

    @Value("${sentiment.workers-ai.base-url:https://api.cloudflare.com/client/v4}")
    private String baseUrl;

    @Value("${sentiment.workers-ai.account-id:}")
    private String accountId;

    @Value("${sentiment.workers-ai.api-token:}")
    private String apiToken;

    @Value("${sentiment.model-timeout-ms:45000}")
    private long modelTimeoutMs;

    @Bean
    public InferenceClient inferenceClient(WebClient.Builder builder, ObjectMapper objectMapper) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .responseTimeout(Duration.ofMillis(modelTimeoutMs + 5_000));

        WebClient webClient = builder.clone()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .codecs(c -> c.defaultCodecs().maxInMemorySize(2 * 1024 * 1024))
            .build();
        return new WorkersAiInferenceClient(webClient, objectMapper, accountId, apiToken);
    }

    @Bean
    public SentimentResponseParser sentimentResponseParser(ObjectMapper objectMapper) {
        return new SentimentResponseParser(objectMapper);
    }

    @Bean
    public ContextualAnalysisAdapter contextualAnalysisAdapter(
            InferenceClient inferenceClient, SentimentResponseParser parser,
            @Value("${sentiment.model-a.id:@cf/openai/gpt-oss-120b}") String modelId) {
        return new ContextualAnalysisAdapter(inferenceClient, parser, modelId, Duration.ofMillis(modelTimeoutMs));
    }

    @Bean
    public ReasoningAnalysisAdapter reasoningAnalysisAdapter(
            InferenceClient inferenceClient, SentimentResponseParser parser,
            @Value("${sentiment.model-b.id:@cf/deepseek-ai/deepseek-r1-distill-qwen-32b}") String modelId) {
        return new ReasoningAnalysisAdapter(inferenceClient, parser, modelId, Duration.ofMillis(modelTimeoutMs));
    }

    @Bean
    public DualModelDispatchService dualModelDispatchService(List<SentimentModelAdapter> adapters) {
        return new DualModelDispatchService(adapters);
    }
}
