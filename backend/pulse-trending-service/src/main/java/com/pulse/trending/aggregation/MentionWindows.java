package com.pulse.trending.aggregation;

import com.pulse.trending.model.KeywordMention;
import com.pulse.trending.model.MentionDistribution;

import java.util.List;

/**
 * A topic's mentions split into the three overlapping trailing windows. Every short
 * mention is also a medium one and every medium mention also a long one.
 */
public record MentionWindows(
    List<KeywordMention> shortWindow,
    List<KeywordMention> mediumWindow,
    List<KeywordMention> longWindow
) {

    public MentionWindows {
        shortWindow = List.copyOf(shortWindow);
        mediumWindow = List.copyOf(mediumWindow);
        longWindow = List.copyOf(longWindow);
    }

    public int shortCount() {
        return shortWindow.size();
    }

    public int mediumCount() {
        return mediumWindow.size();
    }

    public int longCount() {
        return longWindow.size();
    }

    public MentionDistribution distribution() {
        return new MentionDistribution(shortCount(), mediumCount(), longCount());
    }
}
