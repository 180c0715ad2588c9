package com.pulse.trending.model;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Immutable view of a topic as published in an {@link AnalysisResult}.
 * {@code lifecycle} is null when the cycle was run without lifecycle reporting.
 */
public record TrendingTopic(
    String keyword,
    int mentions,
    TopicScores scores,
    MentionDistribution distribution,
    Instant firstSeen,
    Instant lastSeen,
    LifecycleAssessment lifecycle,
    List<ArticleReference> articles
) {

    /** Trend score descending, then more mentions, then keyword. */
    public static final Comparator<TrendingTopic> BY_TREND_SCORE =
        Comparator.comparingDouble(TrendingTopic::trendScore).reversed()
            .thenComparing(Comparator.comparingInt(TrendingTopic::mentions).reversed())
            .thenComparing(TrendingTopic::keyword);

    public TrendingTopic {
        articles = articles == null ? List.of() : List.copyOf(articles);
    }

    public double trendScore() {
        return scores.trendScore();
    }

    public double velocity() {
        return scores.velocityRaw();
    }
}
