package com.pulse.trending.model;

/**
 * Trajectory of a topic, judged from the change in normalized velocity since the
 * previous cycle.
 */
public enum LifecycleStage {
    EMERGING,
    RISING,
    PEAK,
    DECLINING,
    FADING
}
