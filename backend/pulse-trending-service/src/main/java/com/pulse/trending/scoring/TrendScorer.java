package com.pulse.trending.scoring;

import com.pulse.trending.aggregation.MentionWindows;
import com.pulse.trending.config.TrendingProperties;
import com.pulse.trending.model.KeywordMention;
import com.pulse.trending.model.TopicScores;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Weighted composite of velocity, volume, recency and source credibility.
 *
 * <pre>
 *   volume      = clamp(mentions / VOLUME_SATURATION)
 *   recency     = clamp(1 - avgMentionAge / mediumWindow)
 *   credibility = mean(mention credibility)
 *   trend       = clamp(velocity*wV + volume*wVol + recency*wR + credibility*wC)
 * </pre>
 *
 * All mentions inside the long window count towards volume, recency and credibility.
 */
@Component
public class TrendScorer {

    public static final int VOLUME_SATURATION = 10;

    private final double velocityWeight;
    private final double volumeWeight;
    private final double recencyWeight;
    private final double credibilityWeight;
    private final double mediumWindowMillis;

    public TrendScorer(TrendingProperties properties) {
        this.velocityWeight = properties.velocityWeight();
        this.volumeWeight = properties.volumeWeight();
        this.recencyWeight = properties.recencyWeight();
        this.credibilityWeight = properties.credibilityWeight();
        this.mediumWindowMillis = properties.mediumWindow().toMillis();
    }

    public TopicScores score(MentionWindows windows, Velocity velocity, Instant now) {
        List<KeywordMention> mentions = windows.longWindow();

        double volume = ScoreMath.clamp01(mentions.size() / (double) VOLUME_SATURATION);
        double recency = recency(mentions, now);
        double credibility = credibility(mentions);

        double trend = ScoreMath.clamp01(
            velocity.normalized() * velocityWeight
                + volume * volumeWeight
                + recency * recencyWeight
                + credibility * credibilityWeight);

        return new TopicScores(
            velocity.raw(),
            velocity.normalized(),
            velocity.acceleration(),
            volume,
            recency,
            credibility,
            trend);
    }

    double recency(List<KeywordMention> mentions, Instant now) {
        if (mentions.isEmpty()) return 0.0;
        double totalAge = 0.0;
        for (KeywordMention m : mentions) {
            totalAge += Duration.between(m.timestamp(), now).toMillis();
        }
        double averageAge = totalAge / mentions.size();
        return ScoreMath.clamp01(1.0 - averageAge / mediumWindowMillis);
    }

    double credibility(List<KeywordMention> mentions) {
        if (mentions.isEmpty()) return 0.0;
        double total = 0.0;
        for (KeywordMention m : mentions) {
            total += m.credibility();
        }
        return ScoreMath.clamp01(total / mentions.size());
    }
}
