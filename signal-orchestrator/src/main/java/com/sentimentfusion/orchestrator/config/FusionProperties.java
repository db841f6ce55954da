package com.sentimentfusion.orchestrator.config;

import com.sentimentfusion.common.consensus.SignalBanding;
import com.sentimentfusion.common.consensus.StrengthBands;
import com.sentimentfusion.common.model.NewsProvider;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Options of the fusion pipeline, bound from {@code fusion.*}.
 */
@Data
@ConfigurationProperties(prefix = "fusion")
public class FusionProperties {

    private List<NewsProvider> providerPriorityOrder = new ArrayList<>(List.of(
        NewsProvider.PRIMARY_POOL, NewsProvider.FEED_A, NewsProvider.FEED_B, NewsProvider.FEED_C));

    private int batchSize = 2;
    private long interBatchDelayMs = 1000;
    private long perProviderTimeoutMs = 10_000;

    /** Extra runs of the model stage when both models fail remotely. */
    private int modelRetryAttempts = 2;
    private long modelRetryBackoffMs = 5000;

    private ConfidenceStrengthBands confidenceStrengthBands = new ConfidenceStrengthBands();

    public Duration perProviderTimeout() {
        return Duration.ofMillis(perProviderTimeoutMs);
    }

    public Duration interBatchDelay() {
        return Duration.ofMillis(interBatchDelayMs);
    }

    public Duration modelRetryBackoff() {
        return Duration.ofMillis(modelRetryBackoffMs);
    }

    @Data
    public static class ConfidenceStrengthBands {
        private double agreementStrong = 0.70;
        private double agreementModerate = 0.60;
        private double decisiveStrong = 0.80;
        private double decisiveModerate = 0.60;

        public SignalBanding toBanding() {
            return new SignalBanding(
                new StrengthBands(agreementStrong, agreementModerate),
                new StrengthBands(decisiveStrong, decisiveModerate));
        }
    }
}
