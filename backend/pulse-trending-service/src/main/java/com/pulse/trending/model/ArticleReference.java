package com.pulse.trending.model;

import java.time.Instant;

public record ArticleReference(
    String id,
    String title,
    String link,
    String sourceName,
    Instant publishedAt,
    double credibility
) {

    public static ArticleReference from(Article article) {
        return new ArticleReference(
            article.id(),
            article.title(),
            article.link(),
            article.source(),
            article.publishedAt(),
            article.credibility());
    }
}
