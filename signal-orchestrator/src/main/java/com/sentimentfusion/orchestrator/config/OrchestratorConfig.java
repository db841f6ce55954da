package com.sentimentfusion.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sentimentfusion.common.consensus.AgreementResolver;
import com.sentimentfusion.common.consensus.SignalGenerator;
import com.sentimentfusion.news.provider.NewsContentProvider;
import com.sentimentfusion.news.service.ContentFetchService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

@Configuration
public class OrchestratorConfig {

    @Bean
    public ContentFetchService contentFetchService(List<NewsContentProvider> providers,
                                                   FusionProperties properties) {
        return new ContentFetchService(providers,
            properties.getProviderPriorityOrder(), properties.perProviderTimeout());
    }

    @Bean
    public AgreementResolver agreementResolver() {
        return new AgreementResolver();
    }

    @Bean
    public SignalGenerator signalGenerator(FusionProperties properties) {
        return new SignalGenerator(properties.getConfidenceStrengthBands().toBanding());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
