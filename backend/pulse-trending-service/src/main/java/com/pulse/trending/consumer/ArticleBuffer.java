package com.pulse.trending.consumer;

import com.pulse.trending.model.Article;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Bounded hand-off between the ingestion side and the analysis cycle. Producers never
 * block: when the buffer is full the article is dropped and counted.
 */
@Component
public class ArticleBuffer {

    private static final Logger log = LoggerFactory.getLogger(ArticleBuffer.class);

    private final LinkedBlockingQueue<Article> queue;
    private final Counter articlesDropped;

    public ArticleBuffer(@Value("${pulse.buffer.capacity:10000}") int capacity, MeterRegistry metrics) {
        if (capacity < 1) {
            throw new IllegalArgumentException("pulse.buffer.capacity must be >= 1, was " + capacity);
        }
        this.queue = new LinkedBlockingQueue<>(capacity);
        this.articlesDropped = metrics.counter("pulse_buffer_articles_dropped_total");
    }

    public boolean offer(Article article) {
        if (article == null) return false;
        boolean accepted = queue.offer(article);
        if (!accepted) {
            articlesDropped.increment();
            log.warn("Article buffer full, dropped article id={}", article.id());
        }
        return accepted;
    }

    /** Removes and returns everything buffered so far. */
    public List<Article> drain() {
        List<Article> out = new ArrayList<>(queue.size());
        queue.drainTo(out);
        return out;
    }

    public int size() {
        return queue.size();
    }
}
