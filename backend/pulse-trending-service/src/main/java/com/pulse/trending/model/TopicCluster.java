package com.pulse.trending.model;

import java.util.List;

/**
 * Related topics grouped around a representative keyword. Members start with the
 * representative topic.
 */
public record TopicCluster(
    String id,
    String representative,
    List<TrendingTopic> members,
    int totalMentions,
    double averageTrendScore
) {

    public TopicCluster {
        members = List.copyOf(members);
    }

    public double representativeTrendScore() {
        return members.isEmpty() ? 0.0 : members.get(0).trendScore();
    }

    public int size() {
        return members.size();
    }
}
