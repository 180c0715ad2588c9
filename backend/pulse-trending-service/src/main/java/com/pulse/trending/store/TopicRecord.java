package com.pulse.trending.store;

import com.pulse.trending.model.ArticleReference;
import com.pulse.trending.model.KeywordMention;
import com.pulse.trending.model.LifecycleAssessment;
import com.pulse.trending.model.MentionDistribution;
import com.pulse.trending.model.TopicScores;
import com.pulse.trending.model.TrendingTopic;
import com.pulse.trending.model.VelocitySnapshot;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable per-keyword state owned by a {@link TopicStore}. Only touched while the
 * store's write lock is held; everything handed out is a copy.
 */
public final class TopicRecord {

    public static final int HISTORY_CAPACITY = 24;
    static final int MAX_ARTICLE_REFERENCES = 10;

    private final String keyword;
    private final List<KeywordMention> mentions = new ArrayList<>();
    private final Set<String> articleIds = new HashSet<>();
    private final Deque<VelocitySnapshot> history = new ArrayDeque<>(HISTORY_CAPACITY);

    private TopicScores scores = TopicScores.ZERO;
    private MentionDistribution distribution = MentionDistribution.EMPTY;
    private LifecycleAssessment lifecycle;

    TopicRecord(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    /** True when mentions from this article id are already held. */
    public boolean hasArticle(String articleId) {
        return articleId != null && articleIds.contains(articleId);
    }

    public void addMention(KeywordMention mention) {
        mentions.add(mention);
        String id = mention.article().id();
        if (id != null) {
            articleIds.add(id);
        }
    }

    public List<KeywordMention> mentions() {
        return List.copyOf(mentions);
    }

    public int mentionCount() {
        return mentions.size();
    }

    /**
     * Drops mentions strictly older than {@code cutoff}.
     *
     * @return number of mentions removed
     */
    int evictBefore(Instant cutoff) {
        int before = mentions.size();
        mentions.removeIf(m -> m.timestamp().isBefore(cutoff));
        int removed = before - mentions.size();
        if (removed > 0) {
            articleIds.clear();
            for (KeywordMention m : mentions) {
                if (m.article().id() != null) articleIds.add(m.article().id());
            }
        }
        return removed;
    }

    boolean hasMentionSince(Instant cutoff) {
        for (KeywordMention m : mentions) {
            if (!m.timestamp().isBefore(cutoff)) return true;
        }
        return false;
    }

    public Instant firstSeen() {
        return mentions.stream().map(KeywordMention::timestamp).min(Comparator.naturalOrder()).orElse(null);
    }

    public Instant lastSeen() {
        return mentions.stream().map(KeywordMention::timestamp).max(Comparator.naturalOrder()).orElse(null);
    }

    public TopicScores scores() {
        return scores;
    }

    public MentionDistribution distribution() {
        return distribution;
    }

    public void updateScores(TopicScores scores, MentionDistribution distribution) {
        this.scores = scores;
        this.distribution = distribution;
    }

    public LifecycleAssessment lifecycle() {
        return lifecycle;
    }

    public void updateLifecycle(LifecycleAssessment lifecycle) {
        this.lifecycle = lifecycle;
    }

    /** Appends a snapshot, evicting the oldest once {@link #HISTORY_CAPACITY} is reached. */
    public void appendHistory(VelocitySnapshot snapshot) {
        while (history.size() >= HISTORY_CAPACITY) {
            history.pollFirst();
        }
        history.addLast(snapshot);
    }

    public List<VelocitySnapshot> history() {
        return List.copyOf(history);
    }

    /**
     * Mention count, first/last seen and articles all come from the mentions the record holds,
     * which after the cycle's eviction are exactly the ones inside the long window.
     */
    public TrendingTopic toTrendingTopic(boolean includeLifecycle) {
        return new TrendingTopic(
            keyword,
            mentions.size(),
            scores,
            distribution,
            firstSeen(),
            lastSeen(),
            includeLifecycle ? lifecycle : null,
            recentArticles());
    }

    private List<ArticleReference> recentArticles() {
        // one reference per article, newest first
        Map<Object, ArticleReference> distinct = new LinkedHashMap<>();
        mentions.stream()
            .sorted(Comparator.comparing(KeywordMention::timestamp).reversed())
            .forEach(m -> {
                ArticleReference ref = m.article();
                distinct.putIfAbsent(ref.id() != null ? ref.id() : ref, ref);
            });
        return distinct.values().stream().limit(MAX_ARTICLE_REFERENCES).toList();
    }
}
