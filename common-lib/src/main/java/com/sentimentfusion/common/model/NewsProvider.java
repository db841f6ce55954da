package com.sentimentfusion.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Identity of a news content provider.
 *
 * <ul>
 *   <li>PRIMARY_POOL: curated article pool, highest priority</li>
 *   <li>FEED_A: Financial Modeling Prep stock news</li>
 *   <li>FEED_B: NewsAPI everything search</li>
 *   <li>FEED_C: Yahoo Finance search news</li>
 *   <li>UNKNOWN: failures that cannot be attributed</li>
 * </ul>
 */
public enum NewsProvider {

    PRIMARY_POOL("PrimaryPool", "PRIMARY_POOL"),
    FEED_A("FeedA", "FEED_A"),
    FEED_B("FeedB", "FEED_B"),
    FEED_C("FeedC", "FEED_C"),
    UNKNOWN("Unknown", "UNKNOWN");

    private final String displayName;
    private final String codePrefix;

    NewsProvider(String displayName, String codePrefix) {
        this.displayName = displayName;
        this.codePrefix  = codePrefix;
    }

    @JsonValue
    public String displayName() {
        return displayName;
    }

    public String codePrefix() {
        return codePrefix;
    }

    /** Accepts either the display name ({@code FeedA}) or the constant name ({@code FEED_A}). */
    @JsonCreator
    public static NewsProvider fromName(String name) {
        if (name == null) return UNKNOWN;
        String trimmed = name.trim();
        for (NewsProvider p : values()) {
            if (p.displayName.equalsIgnoreCase(trimmed) || p.name().equalsIgnoreCase(trimmed)) {
                return p;
            }
        }
        return UNKNOWN;
    }
}
