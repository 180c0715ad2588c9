package com.pulse.trending.model;

import com.pulse.trending.config.TrendingProperties;

public record EngineStats(
    int trackedTopics,
    int lastClusterCount,
    long cyclesCompleted,
    TrendingProperties configuration
) {}
