package com.pulse.trending.lifecycle;

import com.pulse.trending.model.LifecycleAssessment;
import com.pulse.trending.model.LifecycleStage;
import com.pulse.trending.model.MentionDistribution;
import com.pulse.trending.model.TopicScores;
import com.pulse.trending.model.TrendingTopic;
import com.pulse.trending.model.VelocitySnapshot;
import com.pulse.trending.store.TopicRecord;
import com.pulse.trending.store.TopicStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static com.pulse.trending.support.TestArticles.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertEquals;

class LifecycleTrackerTest {

    private final LifecycleTracker tracker = new LifecycleTracker();

    private static VelocitySnapshot snapshot(double normalized) {
        return new VelocitySnapshot(NOW, 5, normalized * 5, normalized, normalized);
    }

    private static List<VelocitySnapshot> history(int size, double normalized) {
        return new ArrayList<>(Collections.nCopies(size, snapshot(normalized)));
    }

    @Nested
    @DisplayName("classify() with too little history")
    class InsufficientHistory {

        @Test
        @DisplayName("no history → EMERGING at 0.3")
        void empty() {
            LifecycleAssessment a = tracker.classify(List.of(), 0.9);
            assertEquals(LifecycleStage.EMERGING, a.stage());
            assertEquals(0.3, a.confidence(), 1e-9);
            assertEquals(0, a.historyLength());
            assertEquals("Newly detected trend", a.description());
        }

        @Test
        @DisplayName("one snapshot → EMERGING at 0.4 even when velocity collapsed")
        void single() {
            LifecycleAssessment a = tracker.classify(history(1, 1.0), 0.0);
            assertEquals(LifecycleStage.EMERGING, a.stage());
            assertEquals(0.4, a.confidence(), 1e-9);
        }
    }

    @Nested
    @DisplayName("classify() against the previous snapshot")
    class Stages {

        @ParameterizedTest(name = "{0} → {1} → {2}")
        @CsvSource({
            "0.5, 1.0,  EMERGING",
            "0.5, 0.75, EMERGING",
            "0.5, 0.6,  RISING",
            "0.5, 0.52, PEAK",
            "0.5, 0.5,  PEAK",
            "0.5, 0.48, PEAK",
            "0.5, 0.4,  DECLINING",
            "0.5, 0.25, FADING",
            "0.5, 0.1,  FADING",
            "0.0, 0.0,  PEAK",
            "0.0, 0.3,  EMERGING"
        })
        void stageFromChange(double previous, double now, LifecycleStage expected) {
            assertEquals(expected, tracker.classify(history(3, previous), now).stage());
        }

        @Test
        @DisplayName("reports the velocity change as value and percentage")
        void reportsChange() {
            LifecycleAssessment a = tracker.classify(history(2, 0.5), 0.6);
            assertThat(a.velocityChange()).isCloseTo(0.1, within(1e-9));
            assertThat(a.velocityChangePercent()).isCloseTo(20.0, within(1e-9));
            assertThat(a.description()).isEqualTo("Gaining momentum (+20%)");
        }

        @Test
        @DisplayName("confidence grows with history and is capped per stage")
        void confidence() {
            assertEquals(0.6, tracker.classify(history(2, 0.5), 0.5).confidence(), 1e-9);
            assertEquals(0.75, tracker.classify(history(5, 0.5), 0.5).confidence(), 1e-9);
            assertEquals(0.9, tracker.classify(history(20, 0.5), 0.5).confidence(), 1e-9);
            assertEquals(0.7, tracker.classify(history(20, 0.5), 0.1).confidence(), 1e-9);
            assertEquals(0.8, tracker.classify(history(20, 0.5), 1.0).confidence(), 1e-9);
        }
    }

    @Test
    @DisplayName("stage thresholds sit on the documented boundaries")
    void thresholds() {
        assertEquals(LifecycleStage.EMERGING, LifecycleTracker.stageFor(0.5));
        assertEquals(LifecycleStage.RISING, LifecycleTracker.stageFor(0.1000001));
        assertEquals(LifecycleStage.PEAK, LifecycleTracker.stageFor(0.1));
        assertEquals(LifecycleStage.PEAK, LifecycleTracker.stageFor(-0.1));
        assertEquals(LifecycleStage.DECLINING, LifecycleTracker.stageFor(-0.1000001));
        assertEquals(LifecycleStage.FADING, LifecycleTracker.stageFor(-0.5));
    }

    @Test
    @DisplayName("track() classifies before appending the new snapshot")
    void trackAppendsAfterClassifying() {
        TopicStore store = new TopicStore();
        LifecycleAssessment[] seen = new LifecycleAssessment[3];
        TopicRecord record = store.write(() -> {
            TopicRecord r = store.getOrCreate("ai");
            seen[0] = tracker.track(r, snapshot(0.5));
            seen[1] = tracker.track(r, snapshot(0.5));
            seen[2] = tracker.track(r, snapshot(1.0));
            return r;
        });

        assertThat(seen[0].historyLength()).isZero();
        assertThat(seen[1].stage()).isEqualTo(LifecycleStage.EMERGING);
        assertThat(seen[1].confidence()).isCloseTo(0.4, within(1e-9));
        assertThat(seen[2].historyLength()).isEqualTo(2);
        assertThat(seen[2].stage()).isEqualTo(LifecycleStage.EMERGING);
        assertThat(store.history("ai")).hasSize(3);
        assertThat(store.write(record::lifecycle)).isEqualTo(seen[2]);
    }

    @Test
    @DisplayName("distribution() counts topics per stage and ignores missing lifecycles")
    void distribution() {
        LifecycleAssessment rising = new LifecycleAssessment(LifecycleStage.RISING, 0.6, "", 0, 0, 2);
        LifecycleAssessment peak = new LifecycleAssessment(LifecycleStage.PEAK, 0.6, "", 0, 0, 2);
        List<TrendingTopic> topics = List.of(
            topic("a", rising), topic("b", rising), topic("c", peak), topic("d", null));

        Map<LifecycleStage, Integer> counts = tracker.distribution(topics);

        assertThat(counts).containsOnly(
            Map.entry(LifecycleStage.RISING, 2),
            Map.entry(LifecycleStage.PEAK, 1));
    }

    private static TrendingTopic topic(String keyword, LifecycleAssessment lifecycle) {
        return new TrendingTopic(keyword, 3, TopicScores.ZERO, MentionDistribution.EMPTY, NOW, NOW, lifecycle, List.of());
    }
}
