package com.pulse.trending.model;

/**
 * Per-call switches for one analysis cycle.
 *
 * @param limit maximum number of trending entries returned, {@code null} for no limit
 */
public record AnalysisOptions(Integer limit, boolean includeLifecycle, boolean includeClusters) {

    public static final AnalysisOptions DEFAULT = new AnalysisOptions(null, true, true);

    public AnalysisOptions {
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0, was " + limit);
        }
    }

    public static AnalysisOptions limitedTo(int limit) {
        return new AnalysisOptions(limit, true, true);
    }

    public int effectiveLimit() {
        return limit == null ? Integer.MAX_VALUE : limit;
    }
}
