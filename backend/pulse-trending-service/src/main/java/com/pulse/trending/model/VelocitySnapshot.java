package com.pulse.trending.model;

import java.time.Instant;

/**
 * One entry of a topic's history buffer, appended once per analysis cycle.
 */
public record VelocitySnapshot(
    Instant timestamp,
    int mentionCount,
    double velocityRaw,
    double velocityNormalized,
    double trendScore
) {}
