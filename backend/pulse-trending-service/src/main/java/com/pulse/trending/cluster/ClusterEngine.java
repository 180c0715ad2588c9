package com.pulse.trending.cluster;

import com.pulse.trending.config.TrendingProperties;
import com.pulse.trending.model.TopicCluster;
import com.pulse.trending.model.TrendingTopic;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Greedy single-pass clustering of trending topics by keyword similarity.
 *
 * <p>Topics are visited by descending trend score. Each topic not yet clustered seeds a
 * new cluster and absorbs the remaining unclustered topics whose similarity to the seed
 * reaches the threshold, until the cluster is full. Clusters are ranked by their seed's
 * trend score.
 */
@Component
public class ClusterEngine {

    private final double similarityThreshold;
    private final double prefixBoost;
    private final int maxClusterSize;

    public ClusterEngine(TrendingProperties properties) {
        this.similarityThreshold = properties.similarityThreshold();
        this.prefixBoost = properties.prefixBoost();
        this.maxClusterSize = properties.maxClusterSize();
    }

    public double similarity(String a, String b) {
        return KeywordSimilarity.similarity(a, b, prefixBoost);
    }

    public List<TopicCluster> cluster(List<TrendingTopic> topics) {
        if (topics == null || topics.isEmpty()) return List.of();

        List<TrendingTopic> ordered = new ArrayList<>(topics);
        ordered.sort(TrendingTopic.BY_TREND_SCORE);
        boolean[] clustered = new boolean[ordered.size()];

        List<TopicCluster> clusters = new ArrayList<>();
        for (int i = 0; i < ordered.size(); i++) {
            if (clustered[i]) continue;
            TrendingTopic seed = ordered.get(i);
            clustered[i] = true;

            List<TrendingTopic> members = new ArrayList<>();
            members.add(seed);
            for (int j = i + 1; j < ordered.size() && members.size() < maxClusterSize; j++) {
                if (clustered[j]) continue;
                TrendingTopic candidate = ordered.get(j);
                if (similarity(seed.keyword(), candidate.keyword()) >= similarityThreshold) {
                    members.add(candidate);
                    clustered[j] = true;
                }
            }
            clusters.add(toCluster(clusters.size() + 1, seed, members));
        }

        clusters.sort(Comparator.comparingDouble(TopicCluster::representativeTrendScore).reversed());
        return clusters;
    }

    private static TopicCluster toCluster(int index, TrendingTopic seed, List<TrendingTopic> members) {
        int totalMentions = 0;
        double scoreSum = 0.0;
        for (TrendingTopic t : members) {
            totalMentions += t.mentions();
            scoreSum += t.trendScore();
        }
        return new TopicCluster(
            "cluster_" + index,
            seed.keyword(),
            members,
            totalMentions,
            scoreSum / members.size());
    }
}
