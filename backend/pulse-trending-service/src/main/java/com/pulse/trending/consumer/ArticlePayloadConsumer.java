package com.pulse.trending.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulse.trending.model.Article;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * Reads JSON article payloads handed over by the ingestion side and queues them for the
 * next analysis cycle.
 *
 * <p>Accepted shape:
 * <pre>
 * { "id": "...", "title": "...", "description": "...", "link": "...",
 *   "publishedAt": "2024-05-01T10:00:00Z",
 *   "source": { "name": "Reuters", "credibility": 0.97 } }
 * </pre>
 * {@code text} is accepted in place of {@code description}, flat {@code sourceName} /
 * {@code sourceCredibility} in place of {@code source}, and {@code link} doubles as the id.
 * An unreadable timestamp is left empty; the engine then skips the article and counts it.
 */
@Component
public class ArticlePayloadConsumer {

    private static final Logger log = LoggerFactory.getLogger(ArticlePayloadConsumer.class);

    private final ObjectMapper objectMapper;
    private final ArticleBuffer buffer;
    private final Counter payloadsConsumed;
    private final Counter payloadsFailed;

    public ArticlePayloadConsumer(ObjectMapper objectMapper, ArticleBuffer buffer, MeterRegistry metrics) {
        this.objectMapper = objectMapper;
        this.buffer = buffer;
        this.payloadsConsumed = metrics.counter("pulse_stream_payloads_consumed_total");
        this.payloadsFailed = metrics.counter("pulse_stream_payloads_failed_total");
    }

    /**
     * Parses and buffers one payload.
     *
     * @return true when the article was queued
     */
    public boolean onPayload(String payload) {
        try {
            Article article = parse(payload);
            boolean queued = buffer.offer(article);
            if (queued) {
                payloadsConsumed.increment();
            }
            return queued;
        } catch (ArticlePayloadException ex) {
            payloadsFailed.increment();
            log.debug("Failed to read article payload: {}", ex.getMessage());
            return false;
        }
    }

    public Article parse(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new ArticlePayloadException("empty payload");
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new ArticlePayloadException("payload is not valid JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new ArticlePayloadException("payload is not a JSON object");
        }

        String link = text(node, "link");
        String id = text(node, "id");
        String description = text(node, "description");

        String sourceName;
        Double credibility;
        JsonNode source = node.get("source");
        if (source != null && source.isObject()) {
            sourceName = text(source, "name");
            credibility = number(source, "credibility");
        } else {
            sourceName = source != null && source.isTextual() ? source.asText() : text(node, "sourceName");
            credibility = number(node, "sourceCredibility");
        }

        return new Article(
            id != null ? id : link,
            text(node, "title"),
            description != null ? description : text(node, "text"),
            link,
            instant(node.get("publishedAt")),
            sourceName,
            credibility);
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) return null;
        String s = v.asText();
        return s.isBlank() ? null : s;
    }

    private static Double number(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) return null;
        if (v.isNumber()) return v.asDouble();
        if (v.isTextual()) {
            try {
                return Double.valueOf(v.asText().strip());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Instant instant(JsonNode v) {
        if (v == null || v.isNull()) return null;
        if (v.isNumber()) return Instant.ofEpochMilli(v.asLong());
        String s = v.asText().strip();
        try {
            return Instant.parse(s);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(s).toInstant();
            } catch (DateTimeParseException again) {
                return null;
            }
        }
    }
}
