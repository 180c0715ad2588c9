package com.pulse.trending.config;

/**
 * Raised when the trending engine is configured with values it cannot run with.
 * No engine component is created from a rejected configuration.
 */
public class TrendingConfigurationException extends IllegalArgumentException {

    public TrendingConfigurationException(String message) {
        super(message);
    }
}
