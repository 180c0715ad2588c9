package com.pulse.trending.model;

public record LifecycleAssessment(
    LifecycleStage stage,
    double confidence,
    String description,
    double velocityChange,
    double velocityChangePercent,
    int historyLength
) {}
