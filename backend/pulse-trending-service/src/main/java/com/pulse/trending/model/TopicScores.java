package com.pulse.trending.model;

/**
 * Current scores of a topic. Everything except {@code velocityRaw} (mentions per hour)
 * and {@code acceleration} lies in [0,1].
 */
public record TopicScores(
    double velocityRaw,
    double velocityNormalized,
    double acceleration,
    double volumeScore,
    double recencyScore,
    double credibilityScore,
    double trendScore
) {

    public static final TopicScores ZERO = new TopicScores(0, 0, 1, 0, 0, 0, 0);
}
