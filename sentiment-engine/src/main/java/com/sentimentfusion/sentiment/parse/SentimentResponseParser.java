package com.sentimentfusion.sentiment.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentimentfusion.common.model.Direction;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a sentiment verdict out of free-form model output.
 *
 * <ol>
 *   <li>Strip {@code <think>} blocks and markdown fences.</li>
 *   <li>If the text contains a JSON object with a {@code sentiment} field, use it.</li>
 *   <li>Otherwise take the first {@code bullish|bearish|neutral} word and any
 *       {@code confidence: x} figure; defaults are neutral and 0.5.</li>
 * </ol>
 * Confidence is always clamped to [0,1]. Never throws.
 */
public class SentimentResponseParser {

    static final double DEFAULT_CONFIDENCE = 0.5;
    private static final int MAX_REASONING = 200;

    private static final Pattern THINK_BLOCK = Pattern.compile("(?is)<think>.*?</think>");
    private static final Pattern DIRECTION_WORD = Pattern.compile("(?i)\\b(bullish|bearish|neutral)\\b");
    private static final Pattern CONFIDENCE = Pattern.compile("(?i)confidence\"?[:\\s]*(\\d*\\.?\\d+)");

    private final ObjectMapper objectMapper;

    public SentimentResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ParsedSentiment parse(String responseText) {
        String text = clean(responseText);

        JsonNode json = findJsonObject(text);
        if (json != null && json.hasNonNull("sentiment")) {
            Direction direction = Direction.fromLabel(json.path("sentiment").asText());
            double confidence = json.path("confidence").asDouble(DEFAULT_CONFIDENCE);
            String reasoning = json.path("reasoning").asText("");
            return new ParsedSentiment(direction, clamp(confidence),
                reasoning.isBlank() ? "No detailed reasoning provided" : reasoning);
        }

        Matcher dir = DIRECTION_WORD.matcher(text);
        Direction direction = dir.find() ? Direction.fromLabel(dir.group(1)) : Direction.NEUTRAL;
        Matcher conf = CONFIDENCE.matcher(text);
        double confidence = DEFAULT_CONFIDENCE;
        if (conf.find()) {
            try {
                confidence = Double.parseDouble(conf.group(1));
            } catch (NumberFormatException e) {
                confidence = DEFAULT_CONFIDENCE;
            }
        }
        String reasoning = text.length() > MAX_REASONING ? text.substring(0, MAX_REASONING) : text;
        return new ParsedSentiment(direction, clamp(confidence),
            reasoning.isBlank() ? "No detailed reasoning provided" : reasoning);
    }

    private static String clean(String responseText) {
        if (responseText == null) return "";
        return THINK_BLOCK.matcher(responseText).replaceAll("")
            .replace("```json", "")
            .replace("```", "")
            .trim();
    }

    private JsonNode findJsonObject(String text) {
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) return null;
        try {
            JsonNode node = objectMapper.readTree(text.substring(start, end + 1));
            return node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    static double clamp(double confidence) {
        if (Double.isNaN(confidence)) return DEFAULT_CONFIDENCE;
        // some models answer in percent
        double value = confidence > 1.0 && confidence <= 100.0 ? confidence / 100.0 : confidence;
        return Math.max(0.0, Math.min(1.0, value));
    }
}
