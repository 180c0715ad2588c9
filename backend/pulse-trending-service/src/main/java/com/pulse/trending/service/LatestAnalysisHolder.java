package com.pulse.trending.service;

import com.pulse.trending.model.AnalysisResult;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Last completed {@link AnalysisResult}. Results are immutable, so readers need no lock.
 */
@Component
public class LatestAnalysisHolder {

    private final AtomicReference<AnalysisResult> latest = new AtomicReference<>();

    public void publish(AnalysisResult result) {
        latest.set(result);
    }

    public Optional<AnalysisResult> latest() {
        return Optional.ofNullable(latest.get());
    }

    public void clear() {
        latest.set(null);
    }
}
