package com.pulse.trending.text;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StopwordsTest {

    @Test
    @DisplayName("Lucene English defaults are always present")
    void luceneDefaults() {
        Stopwords sw = Stopwords.load(Optional.empty(), List.of());
        assertThat(sw.contains("the")).isTrue();
        assertThat(sw.contains("such")).isTrue();
        assertThat(sw.contains("said")).isFalse();
    }

    @Test
    @DisplayName("classpath list and runtime extras are merged in, lower-cased")
    void mergesFileAndExtras() {
        Stopwords base = Stopwords.load(Optional.empty(), List.of());
        Stopwords sw = Stopwords.load(Optional.of("/stopwords-en.txt"), List.of(" Breaking ", "", "LIVE"));

        assertThat(sw.contains("said")).isTrue();
        assertThat(sw.contains("breaking")).isTrue();
        assertThat(sw.contains("live")).isTrue();
        assertThat(sw.size()).isGreaterThan(base.size());
        assertThat(sw.asSet()).doesNotContain("");
    }

    @Test
    @DisplayName("comment lines in the word list are ignored")
    void ignoresComments() {
        Stopwords sw = Stopwords.load(Optional.of("/stopwords-en.txt"), List.of());
        assertThat(sw.asSet()).noneMatch(w -> w.startsWith("#"));
    }

    @Test
    @DisplayName("a missing word list fails loudly")
    void missingFile() {
        assertThatThrownBy(() -> Stopwords.load(Optional.of("/no-such-stopwords.txt"), List.of()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("/no-such-stopwords.txt");
    }
}
