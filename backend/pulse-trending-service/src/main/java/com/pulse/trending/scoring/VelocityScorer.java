package com.pulse.trending.scoring;

import com.pulse.trending.aggregation.MentionWindows;
import com.pulse.trending.config.TrendingProperties;
import org.springframework.stereotype.Component;


/**
 * Raw and normalized mention velocity with an acceleration boost.
 *
 * <pre>
 *   raw          = shortCount  / shortWindowHours
 *   medium       = mediumCount / mediumWindowHours
 *   acceleration = min(raw / max(medium, EPSILON), MAX_ACCELERATION)
 *   normalized   = clamp(raw * acceleration / VELOCITY_SATURATION, 0, 1)
 * </pre>
 *
 * A topic without short-window mentions always scores 0. Stateless.
 */
@Component
public class VelocityScorer {

    public static final double EPSILON = 1e-9;
    public static final double MAX_ACCELERATION = 10.0;

    /** Mentions per hour at which the normalized velocity saturates (before acceleration). */
    public static final double VELOCITY_SATURATION = 5.0;

    private final double shortHours;
    private final double mediumHours;

    public VelocityScorer(TrendingProperties properties) {
        this.shortHours = properties.shortWindowHours();
        this.mediumHours = properties.mediumWindowHours();
    }

    public Velocity score(MentionWindows windows) {
        int shortCount = windows.shortCount();
        int mediumCount = windows.mediumCount();
        double medium = mediumCount / mediumHours;

        if (shortCount == 0) {
            return new Velocity(0.0, medium, medium > 0.0 ? 0.0 : 1.0, 0.0, 0, mediumCount);
        }

        double raw = shortCount / shortHours;
        double acceleration = Math.min(raw / Math.max(medium, EPSILON), MAX_ACCELERATION);
        double normalized = ScoreMath.clamp01((raw * acceleration) / VELOCITY_SATURATION);
        return new Velocity(raw, medium, acceleration, normalized, shortCount, mediumCount);
    }
}
