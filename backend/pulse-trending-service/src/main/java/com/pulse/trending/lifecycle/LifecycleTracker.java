package com.pulse.trending.lifecycle;

import com.pulse.trending.model.LifecycleAssessment;
import com.pulse.trending.model.LifecycleStage;
import com.pulse.trending.model.TrendingTopic;
import com.pulse.trending.model.VelocitySnapshot;
import com.pulse.trending.store.TopicRecord;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Classifies a topic's lifecycle stage from the change in normalized velocity since the
 * previous cycle's snapshot.
 *
 * <pre>
 *   change = (now - prev) / max(prev, EPSILON)
 *   change &gt;= +0.50          → EMERGING
 *   +0.10 &lt; change &lt; +0.50   → RISING
 *   -0.10 &lt;= change &lt;= +0.10 → PEAK
 *   -0.50 &lt; change &lt; -0.10   → DECLINING
 *   change &lt;= -0.50          → FADING
 * </pre>
 *
 * With fewer than {@link #MIN_HISTORY} snapshots the topic is EMERGING with reduced
 * confidence. Confidence grows with the number of snapshots and is capped per stage.
 */
@Component
public class LifecycleTracker {

    public static final int MIN_HISTORY = 2;
    private static final double EPSILON = 1e-9;

    private static final double EMERGING_CHANGE = 0.50;
    private static final double RISING_CHANGE = 0.10;
    private static final double DECLINING_CHANGE = -0.10;
    private static final double FADING_CHANGE = -0.50;

    private static final double INSUFFICIENT_BASE = 0.3;
    private static final double INSUFFICIENT_STEP = 0.1;
    private static final double CONFIDENCE_BASE = 0.5;
    private static final double CONFIDENCE_STEP = 0.05;

    private static final Map<LifecycleStage, Double> CONFIDENCE_CAP = Map.of(
        LifecycleStage.EMERGING,  0.8,
        LifecycleStage.RISING,    0.9,
        LifecycleStage.PEAK,      0.9,
        LifecycleStage.DECLINING, 0.8,
        LifecycleStage.FADING,    0.7
    );

    /**
     * Classifies {@code record} against its stored history, then appends {@code current}.
     * The new snapshot never takes part in its own classification.
     */
    public LifecycleAssessment track(TopicRecord record, VelocitySnapshot current) {
        LifecycleAssessment assessment = classify(record.history(), current.velocityNormalized());
        record.updateLifecycle(assessment);
        record.appendHistory(current);
        return assessment;
    }

    public LifecycleAssessment classify(List<VelocitySnapshot> history, double velocityNow) {
        int size = history == null ? 0 : history.size();
        if (size < MIN_HISTORY) {
            return new LifecycleAssessment(
                LifecycleStage.EMERGING,
                INSUFFICIENT_BASE + INSUFFICIENT_STEP * size,
                "Newly detected trend",
                0.0,
                0.0,
                size);
        }

        double previous = history.get(size - 1).velocityNormalized();
        double change = velocityNow - previous;
        double ratio = change / Math.max(previous, EPSILON);
        LifecycleStage stage = stageFor(ratio);
        double confidence = Math.min(CONFIDENCE_CAP.get(stage), CONFIDENCE_BASE + CONFIDENCE_STEP * size);

        return new LifecycleAssessment(stage, confidence, describe(stage, ratio), change, ratio * 100.0, size);
    }

    static LifecycleStage stageFor(double ratio) {
        if (ratio >= EMERGING_CHANGE) return LifecycleStage.EMERGING;
        if (ratio > RISING_CHANGE) return LifecycleStage.RISING;
        if (ratio >= DECLINING_CHANGE) return LifecycleStage.PEAK;
        if (ratio > FADING_CHANGE) return LifecycleStage.DECLINING;
        return LifecycleStage.FADING;
    }

    public Map<LifecycleStage, Integer> distribution(Collection<TrendingTopic> topics) {
        Map<LifecycleStage, Integer> counts = new EnumMap<>(LifecycleStage.class);
        for (TrendingTopic topic : topics) {
            if (topic.lifecycle() != null) {
                counts.merge(topic.lifecycle().stage(), 1, Integer::sum);
            }
        }
        return counts;
    }

    private static String describe(LifecycleStage stage, double ratio) {
        String pct = String.format(Locale.ROOT, "%+.0f%%", ratio * 100.0);
        return switch (stage) {
            case EMERGING -> "Rapidly rising (" + pct + ")";
            case RISING -> "Gaining momentum (" + pct + ")";
            case PEAK -> "At peak popularity";
            case DECLINING -> "Losing momentum (" + pct + ")";
            case FADING -> "Rapidly declining (" + pct + ")";
        };
    }
}
