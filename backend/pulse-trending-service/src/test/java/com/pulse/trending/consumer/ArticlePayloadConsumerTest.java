package com.pulse.trending.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulse.trending.model.Article;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArticlePayloadConsumerTest {

    private final SimpleMeterRegistry metrics = new SimpleMeterRegistry();
    private final ArticleBuffer buffer = new ArticleBuffer(2, metrics);
    private final ArticlePayloadConsumer consumer =
        new ArticlePayloadConsumer(new ObjectMapper().findAndRegisterModules(), buffer, metrics);

    @Nested
    @DisplayName("parse()")
    class Parse {

        @Test
        @DisplayName("reads the nested source form")
        void nestedSource() {
            Article a = consumer.parse("""
                {"id":"a1","title":"AI Safety","description":"Researchers warn",
                 "link":"https://example.com/a1","publishedAt":"2024-05-01T10:00:00Z",
                 "source":{"name":"Reuters","credibility":0.97}}
                """);

            assertThat(a.id()).isEqualTo("a1");
            assertThat(a.text()).isEqualTo("AI Safety Researchers warn");
            assertThat(a.publishedAt()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
            assertThat(a.source()).isEqualTo("Reuters");
            assertThat(a.credibility()).isEqualTo(0.97);
        }

        @Test
        @DisplayName("reads the flat form, falls back to link as id and text as description")
        void flatForm() {
            Article a = consumer.parse("""
                {"title":"Drought","text":"Rivers run dry","link":"https://example.com/d",
                 "publishedAt":"2024-05-01T12:00:00+02:00","sourceName":"Wire","sourceCredibility":"0.4"}
                """);

            assertThat(a.id()).isEqualTo("https://example.com/d");
            assertThat(a.description()).isEqualTo("Rivers run dry");
            assertThat(a.publishedAt()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
            assertThat(a.sourceName()).isEqualTo("Wire");
            assertThat(a.credibility()).isEqualTo(0.4);
        }

        @Test
        @DisplayName("an unreadable timestamp or credibility leaves the field empty")
        void lenientFields() {
            Article a = consumer.parse("{\"id\":\"x\",\"title\":\"Drought\",\"publishedAt\":\"yesterday\","
                + "\"source\":{\"credibility\":\"high\"}}");

            assertThat(a.publishedAt()).isNull();
            assertThat(a.isWellFormed()).isFalse();
            assertThat(a.credibility()).isEqualTo(Article.DEFAULT_CREDIBILITY);
            assertThat(a.source()).isEqualTo(Article.UNKNOWN_SOURCE);
        }

        @Test
        @DisplayName("epoch milliseconds are accepted")
        void epochMillis() {
            Article a = consumer.parse("{\"id\":\"x\",\"title\":\"Drought\",\"publishedAt\":1714557600000}");
            assertThat(a.publishedAt()).isEqualTo(Instant.ofEpochMilli(1714557600000L));
        }

        @Test
        @DisplayName("anything that is not a JSON object is rejected")
        void rejectsNonObjects() {
            assertThatThrownBy(() -> consumer.parse("not json")).isInstanceOf(ArticlePayloadException.class);
            assertThatThrownBy(() -> consumer.parse("[1,2]")).isInstanceOf(ArticlePayloadException.class);
            assertThatThrownBy(() -> consumer.parse("")).isInstanceOf(ArticlePayloadException.class);
            assertThatThrownBy(() -> consumer.parse(null)).isInstanceOf(ArticlePayloadException.class);
        }
    }

    @Nested
    @DisplayName("onPayload()")
    class OnPayload {

        @Test
        @DisplayName("queues readable payloads and counts bad ones")
        void queuesAndCounts() {
            assertThat(consumer.onPayload("{\"id\":\"a\",\"title\":\"Drought\",\"publishedAt\":\"2024-05-01T10:00:00Z\"}"))
                .isTrue();
            assertThat(consumer.onPayload("{broken")).isFalse();

            assertThat(buffer.size()).isEqualTo(1);
            assertThat(metrics.get("pulse_stream_payloads_failed_total").counter().count()).isEqualTo(1.0);
            assertThat(metrics.get("pulse_stream_payloads_consumed_total").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("a full buffer drops and counts")
        void fullBuffer() {
            String payload = "{\"id\":\"a\",\"title\":\"Drought\",\"publishedAt\":\"2024-05-01T10:00:00Z\"}";
            consumer.onPayload(payload);
            consumer.onPayload(payload);

            assertThat(consumer.onPayload(payload)).isFalse();
            assertThat(metrics.get("pulse_buffer_articles_dropped_total").counter().count()).isEqualTo(1.0);
            assertThat(buffer.drain()).hasSize(2);
            assertThat(buffer.size()).isZero();
        }
    }

    @Test
    @DisplayName("the buffer rejects a non-positive capacity")
    void bufferCapacity() {
        assertThatThrownBy(() -> new ArticleBuffer(0, metrics)).isInstanceOf(IllegalArgumentException.class);
    }
}
