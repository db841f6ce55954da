package com.sentimentfusion.news.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentimentfusion.news.client.FmpNewsClient;
import com.sentimentfusion.news.client.NewsApiClient;
import com.sentimentfusion.news.client.PrimaryPoolClient;
import com.sentimentfusion.news.client.YahooNewsClient;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

@Configuration
public class NewsClientConfig {

    private static final Logger log = LoggerFactory.getLogger(NewsClientConfig.class);

    private static final Pattern API_KEY_PARAM = Pattern.compile("(?i)(apikey=)[^&]+");

    @Value("${news.http.connect-timeout-ms:5000}")
    private int connectTimeoutMs;

    @Value("${news.http.read-timeout-ms:10000}")
    private int readTimeoutMs;

    @Bean
    public PrimaryPoolClient primaryPoolClient(WebClient.Builder builder, ObjectMapper objectMapper,
                                               @Value("${news.primary-pool.base-url:http://localhost:8787}") String baseUrl,
                                               @Value("${news.primary-pool.api-key:}") String apiKey) {
        return new PrimaryPoolClient(newsWebClient(builder, baseUrl), objectMapper, apiKey);
    }

    @Bean
    public FmpNewsClient fmpNewsClient(WebClient.Builder builder, ObjectMapper objectMapper,
                                       @Value("${news.feed-a.base-url:https://financialmodelingprep.com}") String baseUrl,
                                       @Value("${news.feed-a.api-key:}") String apiKey) {
        return new FmpNewsClient(newsWebClient(builder, baseUrl), objectMapper, apiKey);
    }

    @Bean
    public NewsApiClient newsApiClient(WebClient.Builder builder, ObjectMapper objectMapper,
                                       @Value("${news.feed-b.base-url:https://newsapi.org}") String baseUrl,
                                       @Value("${news.feed-b.api-key:}") String apiKey) {
        return new NewsApiClient(newsWebClient(builder, baseUrl), objectMapper, apiKey);
    }

    @Bean
    public YahooNewsClient yahooNewsClient(WebClient.Builder builder, ObjectMapper objectMapper,
                                           @Value("${news.feed-c.base-url:https://query1.finance.yahoo.com}") String baseUrl) {
        return new YahooNewsClient(newsWebClient(builder, baseUrl), objectMapper);
    }

    private WebClient newsWebClient(WebClient.Builder builder, String baseUrl) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
            .responseTimeout(Duration.ofMillis(readTimeoutMs))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(readTimeoutMs, TimeUnit.MILLISECONDS))
            );

        return builder.clone()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(loggingFilter())
            .build();
    }

    static String redact(String uri) {
        return API_KEY_PARAM.matcher(uri).replaceAll("$1***");
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("Outbound request: {} {}", clientRequest.method(), redact(clientRequest.url().toString()));
            return Mono.just(clientRequest);
        });
    }
}
