package com.pulse.trending.model;

import java.time.Instant;

/**
 * A news article as handed over by the ingestion side. Source credibility is precomputed
 * elsewhere; a missing value is treated as {@link #DEFAULT_CREDIBILITY}.
 *
 * <p>Fields may be absent: {@link #isWellFormed()} decides whether the article can be
 * analysed at all.
 */
public record Article(
    String id,
    String title,
    String description,
    String link,
    Instant publishedAt,
    String sourceName,
    Double sourceCredibility
) {

    public static final double DEFAULT_CREDIBILITY = 0.5;
    public static final String UNKNOWN_SOURCE = "Unknown";

    public static Article of(String id, String title, Instant publishedAt, String sourceName, double credibility) {
        return new Article(id, title, null, null, publishedAt, sourceName, credibility);
    }

    /** Title and description joined; the text keywords are extracted from. */
    public String text() {
        String t = title == null ? "" : title;
        String d = description == null ? "" : description;
        return (t + " " + d).strip();
    }

    public boolean isWellFormed() {
        return publishedAt != null && !text().isBlank();
    }

    /** Credibility clamped to [0,1], defaulting when absent or not a number. */
    public double credibility() {
        if (sourceCredibility == null || sourceCredibility.isNaN()) return DEFAULT_CREDIBILITY;
        return Math.max(0.0, Math.min(1.0, sourceCredibility));
    }

    public String source() {
        return sourceName == null || sourceName.isBlank() ? UNKNOWN_SOURCE : sourceName;
    }
}
