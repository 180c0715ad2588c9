package com.pulse.trending.service;

import com.pulse.trending.aggregation.AggregationOutcome;
import com.pulse.trending.aggregation.MentionAggregator;
import com.pulse.trending.aggregation.MentionWindows;
import com.pulse.trending.cluster.ClusterEngine;
import com.pulse.trending.config.TrendingProperties;
import com.pulse.trending.lifecycle.LifecycleTracker;
import com.pulse.trending.model.AnalysisOptions;
import com.pulse.trending.model.AnalysisResult;
import com.pulse.trending.model.Article;
import com.pulse.trending.model.EngineStats;
import com.pulse.trending.model.LifecycleStage;
import com.pulse.trending.model.TopicCluster;
import com.pulse.trending.model.TopicScores;
import com.pulse.trending.model.TrendingTopic;
import com.pulse.trending.model.VelocitySnapshot;
import com.pulse.trending.scoring.TrendScorer;
import com.pulse.trending.scoring.Velocity;
import com.pulse.trending.scoring.VelocityScorer;
import com.pulse.trending.store.TopicRecord;
import com.pulse.trending.store.TopicStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs one trending analysis cycle over a batch of articles.
 *
 * <p>Each cycle holds the store's write lock from eviction to result assembly, so
 * overlapping callers are serialised. The returned {@link AnalysisResult} is immutable
 * and is also published to {@link LatestAnalysisHolder}.
 *
 * <h3>Cycle</h3>
 * <ol>
 *   <li>evict mentions older than the long window</li>
 *   <li>extract keywords and append mentions</li>
 *   <li>for every keyword seen in the batch: score velocity and trend, classify the
 *       lifecycle stage, append a history snapshot</li>
 *   <li>purge topics with no mention inside the long window</li>
 *   <li>keep the re-observed topics that meet {@code minMentions} and {@code minVelocity},
 *       rank them, cluster them and summarise</li>
 * </ol>
 */
@Service
public class TrendingAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(TrendingAnalysisService.class);

    private final TrendingProperties properties;
    private final TopicStore store;
    private final MentionAggregator aggregator;
    private final VelocityScorer velocityScorer;
    private final TrendScorer trendScorer;
    private final LifecycleTracker lifecycleTracker;
    private final ClusterEngine clusterEngine;
    private final LatestAnalysisHolder latest;
    private final Clock clock;
    private final MeterRegistry metrics;

    private final Counter cyclesCompleted;
    private final Counter articlesSkipped;
    private final Counter topicsPurged;
    private final Timer cycleDuration;

    private final AtomicLong cycles = new AtomicLong();
    private final AtomicInteger lastClusterCount = new AtomicInteger();

    public TrendingAnalysisService(TrendingProperties properties,
                                   TopicStore store,
                                   MentionAggregator aggregator,
                                   VelocityScorer velocityScorer,
                                   TrendScorer trendScorer,
                                   LifecycleTracker lifecycleTracker,
                                   ClusterEngine clusterEngine,
                                   LatestAnalysisHolder latest,
                                   Clock clock,
                                   MeterRegistry metrics) {
        this.properties = properties;
        this.store = store;
        this.aggregator = aggregator;
        this.velocityScorer = velocityScorer;
        this.trendScorer = trendScorer;
        this.lifecycleTracker = lifecycleTracker;
        this.clusterEngine = clusterEngine;
        this.latest = latest;
        this.clock = clock;
        this.metrics = metrics;
        this.cyclesCompleted = metrics.counter("pulse_trending_cycles_total");
        this.articlesSkipped = metrics.counter("pulse_trending_articles_skipped_total");
        this.topicsPurged = metrics.counter("pulse_trending_topics_purged_total");
        this.cycleDuration = metrics.timer("pulse_trending_cycle_duration_seconds");
        Gauge.builder("pulse_trending_tracked_topics", store, TopicStore::size).register(metrics);

        if (!properties.weightsNormalized()) {
            log.warn("Trend score weights sum to {} instead of 1; scores are clamped to [0,1]",
                String.format("%.3f", properties.weightSum()));
        }
    }

    public AnalysisResult analyze(Collection<Article> articles) {
        return analyze(articles, AnalysisOptions.DEFAULT);
    }

    public AnalysisResult analyze(Collection<Article> articles, AnalysisOptions options) {
        AnalysisOptions opts = options == null ? AnalysisOptions.DEFAULT : options;
        Collection<Article> batch = articles == null ? List.of() : articles;

        Instant start = Instant.now();
        Timer.Sample sample = Timer.start(metrics);
        AnalysisResult result;
        try {
            result = store.write(() -> runCycle(batch, opts, clock.instant()));
        } finally {
            sample.stop(cycleDuration);
        }

        cycles.incrementAndGet();
        cyclesCompleted.increment();
        articlesSkipped.increment(result.metadata().skippedArticles());
        topicsPurged.increment(result.metadata().purgedTopics());
        lastClusterCount.set(result.clusters().size());
        latest.publish(result);

        long ms = Duration.between(start, Instant.now()).toMillis();
        log.info("[analyze] Cycle finished in {} ms: articles={} skipped={} trending={} clusters={} tracked={}",
            ms, result.metadata().articlesAnalyzed(), result.metadata().skippedArticles(),
            result.trending().size(), result.clusters().size(), result.metadata().totalTopics());
        return result;
    }

    private AnalysisResult runCycle(Collection<Article> batch, AnalysisOptions opts, Instant now) {
        Instant horizon = now.minus(properties.longWindow());

        int evicted = store.evictExpired(horizon);
        if (evicted > 0) {
            log.debug("[analyze] Evicted {} mentions older than {}", evicted, horizon);
        }

        AggregationOutcome outcome = aggregator.aggregate(batch, store, now);
        if (outcome.duplicateArticles() > 0) {
            log.debug("[analyze] Ignored {} already counted article/keyword pairs", outcome.duplicateArticles());
        }
        if (outcome.expiredArticles() > 0) {
            log.debug("[analyze] Ignored {} articles older than the long window", outcome.expiredArticles());
        }

        for (String keyword : outcome.touchedKeywords()) {
            store.find(keyword).ifPresent(record -> refresh(record, now));
        }

        List<String> purged = store.purgeInactive(horizon);
        if (!purged.isEmpty()) {
            log.debug("[analyze] Purged {} inactive topics", purged.size());
        }

        List<TrendingTopic> qualified = new ArrayList<>();
        for (String keyword : outcome.touchedKeywords()) {
            store.find(keyword)
                .filter(this::qualifies)
                .map(record -> record.toTrendingTopic(opts.includeLifecycle()))
                .ifPresent(qualified::add);
        }
        qualified.sort(TrendingTopic.BY_TREND_SCORE);

        List<TrendingTopic> trending = qualified.subList(0, Math.min(opts.effectiveLimit(), qualified.size()));
        List<TopicCluster> clusters = opts.includeClusters() ? clusterEngine.cluster(qualified) : List.of();
        Map<LifecycleStage, Integer> distribution = opts.includeLifecycle()
            ? lifecycleTracker.distribution(qualified)
            : Map.of();

        return new AnalysisResult(
            trending,
            clusters,
            distribution,
            summarize(qualified),
            new AnalysisResult.Metadata(
                store.size(),
                qualified.size(),
                trending.size(),
                outcome.articlesAnalyzed(),
                outcome.skippedArticles(),
                purged.size(),
                new AnalysisResult.Windows(
                    properties.shortWindow(), properties.mediumWindow(), properties.longWindow()),
                now));
    }

    private void refresh(TopicRecord record, Instant now) {
        MentionWindows windows = aggregator.partition(record, now);
        Velocity velocity = velocityScorer.score(windows);
        TopicScores scores = trendScorer.score(windows, velocity, now);
        if (log.isDebugEnabled()) {
            log.debug("[analyze] {}: short={} medium={} velocity={}/h acceleration={}",
                record.keyword(), velocity.shortCount(), velocity.mediumCount(),
                velocity.raw(), velocity.acceleration());
        }
        record.updateScores(scores, windows.distribution());
        lifecycleTracker.track(record, new VelocitySnapshot(
            now, windows.longCount(), scores.velocityRaw(), scores.velocityNormalized(), scores.trendScore()));
    }

    private boolean qualifies(TopicRecord record) {
        return record.distribution().longWindow() >= properties.minMentions()
            && record.scores().velocityRaw() >= properties.minVelocity();
    }

    private static AnalysisResult.Summary summarize(List<TrendingTopic> topics) {
        if (topics.isEmpty()) return AnalysisResult.Summary.EMPTY;
        double velocity = 0.0;
        double trend = 0.0;
        for (TrendingTopic t : topics) {
            velocity += t.velocity();
            trend += t.trendScore();
        }
        return new AnalysisResult.Summary(velocity / topics.size(), trend / topics.size());
    }

    /** Snapshot history of a keyword, oldest first; empty when the keyword is not tracked. */
    public List<VelocitySnapshot> history(String keyword) {
        return store.history(keyword);
    }

    public Optional<AnalysisResult> latestResult() {
        return latest.latest();
    }

    public EngineStats stats() {
        return new EngineStats(store.size(), lastClusterCount.get(), cycles.get(), properties);
    }

    /** Drops all tracked topics and the last result. Idempotent; runs at shutdown. */
    @PreDestroy
    public void cleanup() {
        store.cleanup();
        latest.clear();
        lastClusterCount.set(0);
    }
}
