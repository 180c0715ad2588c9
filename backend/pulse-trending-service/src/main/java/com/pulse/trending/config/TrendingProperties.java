package com.pulse.trending.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;

/**
 * Every recognised option of the trending engine, bound from {@code pulse.trending.*}.
 *
 * <p>Validated on construction; an instance that exists is always usable. Unknown keys
 * under the prefix fail binding. Weights are taken as given: when they do not add up to 1
 * the trend score is still clamped to [0,1], normalising them is left to the caller.
 */
@ConfigurationProperties(prefix = "pulse.trending", ignoreUnknownFields = false)
public record TrendingProperties(
    @DefaultValue("3") int minMentions,
    @DefaultValue("0.5") double minVelocity,
    @DefaultValue("1h") Duration shortWindow,
    @DefaultValue("4h") Duration mediumWindow,
    @DefaultValue("24h") Duration longWindow,
    @DefaultValue("0.4") double velocityWeight,
    @DefaultValue("0.3") double volumeWeight,
    @DefaultValue("0.2") double recencyWeight,
    @DefaultValue("0.1") double credibilityWeight,
    @DefaultValue("0.6") double similarityThreshold,
    @DefaultValue("0.1") double prefixBoost,
    @DefaultValue("10") int maxClusterSize,
    @DefaultValue("2") int minKeywordLength,
    @DefaultValue("20") int maxKeywordLength,
    @DefaultValue("/stopwords-en.txt") String stopwordsFile,
    List<String> extraStopwords
) {

    /** Upper bound for the Winkler prefix scale; above it the similarity could leave [0,1]. */
    public static final double MAX_PREFIX_BOOST = 0.25;

    private static final double WEIGHT_SUM_TOLERANCE = 1e-6;

    public TrendingProperties {
        extraStopwords = extraStopwords == null ? List.of() : List.copyOf(extraStopwords);

        if (minMentions < 0) {
            throw new TrendingConfigurationException("minMentions must be >= 0, was " + minMentions);
        }
        if (!(minVelocity >= 0.0)) {
            throw new TrendingConfigurationException("minVelocity must be >= 0, was " + minVelocity);
        }
        requirePositive("shortWindow", shortWindow);
        requirePositive("mediumWindow", mediumWindow);
        requirePositive("longWindow", longWindow);
        if (shortWindow.compareTo(mediumWindow) > 0) {
            throw new TrendingConfigurationException(
                "shortWindow (" + shortWindow + ") must not exceed mediumWindow (" + mediumWindow + ")");
        }
        if (mediumWindow.compareTo(longWindow) > 0) {
            throw new TrendingConfigurationException(
                "mediumWindow (" + mediumWindow + ") must not exceed longWindow (" + longWindow + ")");
        }

        requireNonNegative("velocityWeight", velocityWeight);
        requireNonNegative("volumeWeight", volumeWeight);
        requireNonNegative("recencyWeight", recencyWeight);
        requireNonNegative("credibilityWeight", credibilityWeight);
        if (velocityWeight + volumeWeight + recencyWeight + credibilityWeight <= 0.0) {
            throw new TrendingConfigurationException("at least one scoring weight must be positive");
        }

        if (!(similarityThreshold >= 0.0 && similarityThreshold <= 1.0)) {
            throw new TrendingConfigurationException(
                "similarityThreshold must be within [0,1], was " + similarityThreshold);
        }
        if (!(prefixBoost >= 0.0 && prefixBoost <= MAX_PREFIX_BOOST)) {
            throw new TrendingConfigurationException(
                "prefixBoost must be within [0," + MAX_PREFIX_BOOST + "], was " + prefixBoost);
        }
        if (maxClusterSize < 1) {
            throw new TrendingConfigurationException("maxClusterSize must be >= 1, was " + maxClusterSize);
        }
        if (minKeywordLength < 1) {
            throw new TrendingConfigurationException("minKeywordLength must be >= 1, was " + minKeywordLength);
        }
        if (maxKeywordLength < minKeywordLength) {
            throw new TrendingConfigurationException(
                "maxKeywordLength (" + maxKeywordLength + ") must be >= minKeywordLength (" + minKeywordLength + ")");
        }
    }

    public static TrendingProperties defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public double weightSum() {
        return velocityWeight + volumeWeight + recencyWeight + credibilityWeight;
    }

    public boolean weightsNormalized() {
        return Math.abs(weightSum() - 1.0) <= WEIGHT_SUM_TOLERANCE;
    }

    public double shortWindowHours() {
        return shortWindow.toMillis() / 3_600_000.0;
    }

    public double mediumWindowHours() {
        return mediumWindow.toMillis() / 3_600_000.0;
    }

    public Builder toBuilder() {
        return new Builder()
            .minMentions(minMentions)
            .minVelocity(minVelocity)
            .shortWindow(shortWindow)
            .mediumWindow(mediumWindow)
            .longWindow(longWindow)
            .velocityWeight(velocityWeight)
            .volumeWeight(volumeWeight)
            .recencyWeight(recencyWeight)
            .credibilityWeight(credibilityWeight)
            .similarityThreshold(similarityThreshold)
            .prefixBoost(prefixBoost)
            .maxClusterSize(maxClusterSize)
            .minKeywordLength(minKeywordLength)
            .maxKeywordLength(maxKeywordLength)
            .stopwordsFile(stopwordsFile)
            .extraStopwords(extraStopwords);
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new TrendingConfigurationException(name + " must be a positive duration, was " + value);
        }
    }

    private static void requireNonNegative(String name, double value) {
        if (!(value >= 0.0) || Double.isInfinite(value)) {
            throw new TrendingConfigurationException(name + " must be a finite value >= 0, was " + value);
        }
    }

    /**
     * Programmatic construction for callers that do not go through Spring binding.
     */
    public static final class Builder {
        private int minMentions = 3;
        private double minVelocity = 0.5;
        private Duration shortWindow = Duration.ofHours(1);
        private Duration mediumWindow = Duration.ofHours(4);
        private Duration longWindow = Duration.ofHours(24);
        private double velocityWeight = 0.4;
        private double volumeWeight = 0.3;
        private double recencyWeight = 0.2;
        private double credibilityWeight = 0.1;
        private double similarityThreshold = 0.6;
        private double prefixBoost = 0.1;
        private int maxClusterSize = 10;
        private int minKeywordLength = 2;
        private int maxKeywordLength = 20;
        private String stopwordsFile = "/stopwords-en.txt";
        private List<String> extraStopwords = List.of();

        private Builder() {}

        public Builder minMentions(int v) { this.minMentions = v; return this; }
        public Builder minVelocity(double v) { this.minVelocity = v; return this; }
        public Builder shortWindow(Duration v) { this.shortWindow = v; return this; }
        public Builder mediumWindow(Duration v) { this.mediumWindow = v; return this; }
        public Builder longWindow(Duration v) { this.longWindow = v; return this; }
        public Builder velocityWeight(double v) { this.velocityWeight = v; return this; }
        public Builder volumeWeight(double v) { this.volumeWeight = v; return this; }
        public Builder recencyWeight(double v) { this.recencyWeight = v; return this; }
        public Builder credibilityWeight(double v) { this.credibilityWeight = v; return this; }
        public Builder similarityThreshold(double v) { this.similarityThreshold = v; return this; }
        public Builder prefixBoost(double v) { this.prefixBoost = v; return this; }
        public Builder maxClusterSize(int v) { this.maxClusterSize = v; return this; }
        public Builder minKeywordLength(int v) { this.minKeywordLength = v; return this; }
        public Builder maxKeywordLength(int v) { this.maxKeywordLength = v; return this; }
        public Builder stopwordsFile(String v) { this.stopwordsFile = v; return this; }
        public Builder extraStopwords(List<String> v) { this.extraStopwords = v; return this; }

        public TrendingProperties build() {
            return new TrendingProperties(
                minMentions, minVelocity,
                shortWindow, mediumWindow, longWindow,
                velocityWeight, volumeWeight, recencyWeight, credibilityWeight,
                similarityThreshold, prefixBoost, maxClusterSize,
                minKeywordLength, maxKeywordLength,
                stopwordsFile, extraStopwords);
        }
    }
}
