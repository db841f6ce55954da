package com.sentimentfusion.sentiment.adapter;

import com.sentimentfusion.common.model.ModelRole;
import com.sentimentfusion.sentiment.client.InferenceClient;
import com.sentimentfusion.sentiment.parse.SentimentResponseParser;

import java.time.Duration;

/**
 * Model A: a general instruction model asked to take a position headline by headline.
 */
public class ContextualAnalysisAdapter extends AbstractSentimentModelAdapter {

    public ContextualAnalysisAdapter(InferenceClient client, SentimentResponseParser parser,
                                     String modelId, Duration timeout) {
        super(client, parser, modelId, timeout);
    }

    @Override
    public ModelRole role() {
        return ModelRole.MODEL_A;
    }

    @Override
    protected String analysisType() {
        return "contextual_analysis";
    }

    @Override
    protected String buildPrompt(String symbol, String newsContext) {
        return """
            You are a financial analyst specializing in %s.
            Analyze each headline step by step:
            - What does this mean for the stock price?
            - Is it positive, negative, or truly neutral for investors?
            - Consider earnings, guidance, market positioning, and risk factors.
            Do NOT default to neutral - take a position based on evidence.

            Analyze these financial news articles for %s:

            %s

            """.formatted(symbol, symbol, newsContext) + RESPONSE_FORMAT;
    }
}
