package com.pulse.trending.config;

import com.pulse.trending.store.TopicStore;
import com.pulse.trending.text.KeywordExtractor;
import com.pulse.trending.text.Stopwords;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Optional;

@Configuration
@EnableConfigurationProperties(TrendingProperties.class)
public class TrendingEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(TrendingEngineConfig.class);

    @Bean
    public Clock trendingClock() {
        return Clock.systemUTC();
    }

    @Bean
    public Stopwords stopwords(TrendingProperties properties) {
        Stopwords sw = Stopwords.load(Optional.ofNullable(properties.stopwordsFile()), properties.extraStopwords());
        log.info("Loaded {} stopwords (Lucene English + {} + {} extras)",
            sw.size(), properties.stopwordsFile(), properties.extraStopwords().size());
        return sw;
    }

    @Bean
    public KeywordExtractor keywordExtractor(Stopwords stopwords, TrendingProperties properties) {
        return new KeywordExtractor(stopwords, properties.minKeywordLength(), properties.maxKeywordLength());
    }

    @Bean(destroyMethod = "cleanup")
    public TopicStore topicStore() {
        return new TopicStore();
    }
}
