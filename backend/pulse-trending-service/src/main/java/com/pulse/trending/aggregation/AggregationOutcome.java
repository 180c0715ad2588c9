package com.pulse.trending.aggregation;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * What one aggregation pass did.
 *
 * @param touchedKeywords keywords observed in this batch, in order of first appearance
 * @param duplicateArticles article/keyword pairs ignored because the article was already counted
 * @param expiredArticles well-formed articles published before the long window; they add no mentions
 */
public record AggregationOutcome(
    Set<String> touchedKeywords,
    int articlesAnalyzed,
    int skippedArticles,
    int mentionsAdded,
    int duplicateArticles,
    int expiredArticles
) {

    public AggregationOutcome {
        touchedKeywords = Collections.unmodifiableSet(new LinkedHashSet<>(touchedKeywords));
    }
}
