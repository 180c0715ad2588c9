package com.pulse.trending.config;

import com.pulse.trending.store.TopicStore;
import com.pulse.trending.text.KeywordExtractor;
import com.pulse.trending.text.Stopwords;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class TrendingEngineConfigTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
        .withUserConfiguration(TrendingEngineConfig.class);

    @Test
    @DisplayName("binds defaults when nothing is configured")
    void bindsDefaults() {
        runner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context.getBean(TrendingProperties.class)).isEqualTo(TrendingProperties.defaults());
            assertThat(context).hasSingleBean(KeywordExtractor.class);
            assertThat(context).hasSingleBean(TopicStore.class);
            assertThat(context.getBean(Stopwords.class).contains("said")).isTrue();
        });
    }

    @Test
    @DisplayName("binds kebab-case keys, durations and extra stopwords")
    void bindsOverrides() {
        runner.withPropertyValues(
                "pulse.trending.min-mentions=5",
                "pulse.trending.short-window=30m",
                "pulse.trending.extra-stopwords=breaking,live")
            .run(context -> {
                TrendingProperties p = context.getBean(TrendingProperties.class);
                assertThat(p.minMentions()).isEqualTo(5);
                assertThat(p.shortWindow()).isEqualTo(Duration.ofMinutes(30));
                assertThat(p.extraStopwords()).containsExactly("breaking", "live");
                assertThat(context.getBean(Stopwords.class).contains("breaking")).isTrue();
            });
    }

    @Test
    @DisplayName("unknown keys fail startup")
    void unknownKeyFails() {
        runner.withPropertyValues("pulse.trending.min-mentionz=5")
            .run(context -> assertThat(context).hasFailed());
    }

    @Test
    @DisplayName("invalid values fail startup with a configuration error")
    void invalidValueFails() {
        runner.withPropertyValues("pulse.trending.similarity-threshold=1.5")
            .run(context -> {
                assertThat(context).hasFailed();
                assertThat(context.getStartupFailure())
                    .hasRootCauseInstanceOf(TrendingConfigurationException.class);
            });
    }
}
