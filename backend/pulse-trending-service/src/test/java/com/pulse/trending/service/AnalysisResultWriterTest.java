package com.pulse.trending.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulse.trending.model.AnalysisResult;
import com.pulse.trending.support.TrendingEngineFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.pulse.trending.support.TestArticles.NOW;
import static com.pulse.trending.support.TestArticles.sampleNewsBatch;
import static org.assertj.core.api.Assertions.assertThat;

class AnalysisResultWriterTest {

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();

    @Test
    @DisplayName("renders results with ISO timestamps and stage names")
    void rendersResult() throws Exception {
        AnalysisResult result = TrendingEngineFixture.create().service.analyze(sampleNewsBatch(NOW));

        JsonNode json = mapper.readTree(new AnalysisResultWriter(mapper).write(result));

        assertThat(json.path("trending").get(0).path("keyword").asText()).isEqualTo("ai");
        assertThat(json.path("trending").get(0).path("lifecycle").path("stage").asText()).isEqualTo("EMERGING");
        assertThat(json.path("metadata").path("generatedAt").asText()).isEqualTo("2024-05-01T12:00:00Z");
        assertThat(json.path("metadata").path("windows").path("shortWindow").asText()).isEqualTo("PT1H");
        assertThat(json.path("lifecycleDistribution").has("EMERGING")).isTrue();
        assertThat(json.path("clusters").isArray()).isTrue();
    }
}
