package com.pulse.trending.service;

import com.pulse.trending.consumer.ArticleBuffer;
import com.pulse.trending.model.AnalysisOptions;
import com.pulse.trending.model.AnalysisResult;
import com.pulse.trending.model.Article;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drains the article buffer into an analysis cycle on a fixed delay. At most one cycle is
 * in flight; a tick that finds one running is skipped.
 */
@Component
@ConditionalOnProperty(prefix = "pulse.scheduler", name = "enabled", havingValue = "true")
public class TrendingAnalysisJob {

    private static final Logger log = LoggerFactory.getLogger(TrendingAnalysisJob.class);

    private final ArticleBuffer buffer;
    private final TrendingAnalysisService analysisService;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public TrendingAnalysisJob(ArticleBuffer buffer, TrendingAnalysisService analysisService) {
        this.buffer = buffer;
        this.analysisService = analysisService;
    }

    @Scheduled(fixedDelayString = "${pulse.scheduler.analysis-interval-ms:300000}")
    public void scheduledRun() {
        runOnce();
    }

    /**
     * @return false when skipped because another cycle was still running
     */
    public boolean runOnce() {
        if (!running.compareAndSet(false, true)) {
            log.info("[runOnce] Skipped: previous analysis cycle still running.");
            return false;
        }
        Instant start = Instant.now();
        try {
            List<Article> batch = buffer.drain();
            AnalysisResult result = analysisService.analyze(batch, AnalysisOptions.DEFAULT);
            log.info("[runOnce] Analysed {} buffered articles, {} trending topics",
                batch.size(), result.trending().size());
            return true;
        } catch (RuntimeException e) {
            log.error("Error in trending analysis cycle: {}", e.getMessage(), e);
            return true;
        } finally {
            running.set(false);
            long ms = Duration.between(start, Instant.now()).toMillis();
            log.debug("[runOnce] Finished in {} ms", ms);
        }
    }
}
