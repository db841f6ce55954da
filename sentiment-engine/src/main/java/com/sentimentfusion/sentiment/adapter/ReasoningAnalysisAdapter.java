package com.sentimentfusion.sentiment.adapter;

import com.sentimentfusion.common.model.ModelRole;
import com.sentimentfusion.sentiment.client.InferenceClient;
import com.sentimentfusion.sentiment.parse.SentimentResponseParser;

import java.time.Duration;

/**
 * Model B: a reasoning model primed with a {@code <think>} preamble. Its own think block is
 * stripped by the parser before the verdict is read.
 */
public class ReasoningAnalysisAdapter extends AbstractSentimentModelAdapter {

    public ReasoningAnalysisAdapter(InferenceClient client, SentimentResponseParser parser,
                                    String modelId, Duration timeout) {
        super(client, parser, modelId, timeout);
    }

    @Override
    public ModelRole role() {
        return ModelRole.MODEL_B;
    }

    @Override
    protected String analysisType() {
        return "reasoning_analysis";
    }

    @Override
    protected String buildPrompt(String symbol, String newsContext) {
        return """
            <think>
            You are analyzing financial news for %s to determine market sentiment.
            Consider: earnings impact, analyst sentiment, market positioning, risk factors.
            Think step by step about what each headline means for investors.
            </think>

            Analyze these financial news articles for %s:

            %s

            """.formatted(symbol, symbol, newsContext) + RESPONSE_FORMAT;
    }
}
