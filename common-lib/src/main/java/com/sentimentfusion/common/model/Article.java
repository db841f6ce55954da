package com.sentimentfusion.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A news article normalised from any content provider. Immutable once fetched.
 */
public record Article(
    @JsonProperty("title")       String title,
    @JsonProperty("summary")     String summary,
    @JsonProperty("source")      String source,
    @JsonProperty("url")         String url,
    @JsonProperty("publishedAt") Instant publishedAt
) {
    private static final int MAX_SUMMARY_LENGTH = 500;

    /**
     * Normalising factory: blank titles become {@code "(untitled)"}, a missing summary falls back
     * to the title, summaries are truncated, and a missing timestamp becomes {@link Instant#EPOCH}.
     */
    public static Article of(String title, String summary, String source, String url, Instant publishedAt) {
        String safeTitle = (title == null || title.isBlank()) ? "(untitled)" : title.trim();
        String safeSummary = (summary == null || summary.isBlank()) ? safeTitle : summary.trim();
        if (safeSummary.length() > MAX_SUMMARY_LENGTH) {
            safeSummary = safeSummary.substring(0, MAX_SUMMARY_LENGTH);
        }
        return new Article(
            safeTitle,
            safeSummary,
            source == null ? "" : source,
            url == null ? "" : url,
            publishedAt == null ? Instant.EPOCH : publishedAt);
    }
}
