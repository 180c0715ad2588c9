package com.pulse.trending.scoring;

/**
 * Mention velocity of a topic.
 *
 * @param raw            mentions per hour inside the short window
 * @param mediumVelocity mentions per hour inside the medium window
 * @param acceleration   raw / medium velocity; above 1 means the topic is speeding up
 * @param normalized     acceleration-boosted velocity scaled into [0,1]
 * @param shortCount     mentions the raw velocity was computed from
 * @param mediumCount    mentions the medium velocity was computed from
 */
public record Velocity(
    double raw,
    double mediumVelocity,
    double acceleration,
    double normalized,
    int shortCount,
    int mediumCount
) {}
