package com.pulse.trending.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one analysis cycle. Immutable, safe to share with concurrent readers.
 */
public record AnalysisResult(
    List<TrendingTopic> trending,
    List<TopicCluster> clusters,
    Map<LifecycleStage, Integer> lifecycleDistribution,
    Summary summary,
    Metadata metadata
) {

    public AnalysisResult {
        trending = List.copyOf(trending);
        clusters = List.copyOf(clusters);
        lifecycleDistribution = lifecycleDistribution.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(lifecycleDistribution));
    }

    public record Summary(double avgVelocity, double avgTrendScore) {
        public static final Summary EMPTY = new Summary(0.0, 0.0);
    }

    public record Windows(Duration shortWindow, Duration mediumWindow, Duration longWindow) {}

    public record Metadata(
        int totalTopics,
        int qualifiedCount,
        int trendingCount,
        int articlesAnalyzed,
        int skippedArticles,
        int purgedTopics,
        Windows windows,
        Instant generatedAt
    ) {}
}
