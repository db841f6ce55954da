package com.sentimentfusion.sentiment.parse;

import com.sentimentfusion.common.model.Direction;

/** Direction, confidence in [0,1] and reasoning read out of one model reply. */
public record ParsedSentiment(Direction direction, double confidence, String reasoning) {}
