package com.pulse.trending.aggregation;

import com.pulse.trending.config.TrendingProperties;
import com.pulse.trending.model.Article;
import com.pulse.trending.model.ArticleReference;
import com.pulse.trending.model.KeywordMention;
import com.pulse.trending.store.TopicRecord;
import com.pulse.trending.store.TopicStore;
import com.pulse.trending.text.KeywordExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Feeds keyword occurrences from a batch of articles into the topic store and splits a
 * topic's mentions into the short / medium / long windows.
 *
 * <p>Articles published before {@code now - longWindow} are dropped on arrival, so a record
 * only ever holds mentions inside the long window once the cycle's eviction has run.
 *
 * <p>Cost is linear in the number of (article, keyword occurrence) pairs. Must run inside
 * {@link TopicStore#write}.
 */
@Component
public class MentionAggregator {

    private static final Logger log = LoggerFactory.getLogger(MentionAggregator.class);

    private final KeywordExtractor extractor;
    private final Duration shortWindow;
    private final Duration mediumWindow;
    private final Duration longWindow;

    public MentionAggregator(KeywordExtractor extractor, TrendingProperties properties) {
        this.extractor = extractor;
        this.shortWindow = properties.shortWindow();
        this.mediumWindow = properties.mediumWindow();
        this.longWindow = properties.longWindow();
    }

    public AggregationOutcome aggregate(Collection<Article> articles, TopicStore store, Instant now) {
        Set<String> touched = new LinkedHashSet<>();
        int analyzed = 0;
        int skipped = 0;
        int added = 0;
        int duplicates = 0;
        int expired = 0;

        if (articles == null) {
            return new AggregationOutcome(touched, 0, 0, 0, 0, 0);
        }
        Instant horizon = now.minus(longWindow);

        for (Article article : articles) {
            if (article == null || !article.isWellFormed()) {
                skipped++;
                if (log.isDebugEnabled()) {
                    log.debug("Skipping malformed article id={}", article == null ? null : article.id());
                }
                continue;
            }
            analyzed++;
            if (article.publishedAt().isBefore(horizon)) {
                expired++;
                log.debug("Ignoring article id={} published {} before the long window", article.id(), article.publishedAt());
                continue;
            }

            Map<String, Integer> occurrences = new LinkedHashMap<>();
            for (String token : extractor.tokens(article.text())) {
                occurrences.merge(token, 1, Integer::sum);
            }
            if (occurrences.isEmpty()) continue;

            ArticleReference ref = ArticleReference.from(article);
            double credibility = article.credibility();

            for (Map.Entry<String, Integer> e : occurrences.entrySet()) {
                String keyword = e.getKey();
                touched.add(keyword);
                TopicRecord record = store.getOrCreate(keyword);
                if (record.hasArticle(article.id())) {
                    duplicates++;
                    continue;
                }
                for (int i = 0; i < e.getValue(); i++) {
                    record.addMention(new KeywordMention(keyword, ref, article.publishedAt(), credibility));
                    added++;
                }
            }
        }

        return new AggregationOutcome(touched, analyzed, skipped, added, duplicates, expired);
    }

    /**
     * Splits the record's mentions by age relative to {@code now}. A mention belongs to a
     * window when {@code now - timestamp <= window}; mentions dated after {@code now} fall in
     * every window.
     */
    public MentionWindows partition(TopicRecord record, Instant now) {
        List<KeywordMention> s = new ArrayList<>();
        List<KeywordMention> m = new ArrayList<>();
        List<KeywordMention> l = new ArrayList<>();
        for (KeywordMention mention : record.mentions()) {
            Duration age = Duration.between(mention.timestamp(), now);
            if (age.compareTo(longWindow) > 0) continue;
            l.add(mention);
            if (age.compareTo(mediumWindow) > 0) continue;
            m.add(mention);
            if (age.compareTo(shortWindow) > 0) continue;
            s.add(mention);
        }
        return new MentionWindows(s, m, l);
    }
}
