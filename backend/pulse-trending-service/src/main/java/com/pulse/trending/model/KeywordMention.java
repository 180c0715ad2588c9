package com.pulse.trending.model;

import java.time.Instant;

/**
 * One occurrence of a keyword in one article.
 */
public record KeywordMention(
    String keyword,
    ArticleReference article,
    Instant timestamp,
    double credibility
) {}
