package com.pulse.trending.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.pulse.trending.model.AnalysisResult;
import org.springframework.stereotype.Component;

/**
 * Renders analysis results as JSON for whatever stores or serves them.
 */
@Component
public class AnalysisResultWriter {

    private final ObjectMapper mapper;

    public AnalysisResultWriter(ObjectMapper objectMapper) {
        this.mapper = objectMapper.copy()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
    }

    public String write(AnalysisResult result) {
        try {
            return mapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise analysis result", e);
        }
    }
}
