package com.pulse.trending.text;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.en.EnglishAnalyzer;

/**
 * Merged stopword set: Lucene's English defaults, an optional classpath word list
 * and runtime extras from configuration. All entries are lower case.
 */
public final class Stopwords {

    private final Set<String> merged;

    private Stopwords(Set<String> merged) {
        this.merged = merged;
    }

    public static Stopwords load(Optional<String> classpathFile, Collection<String> runtimeExtras) {
        Set<String> out = new HashSet<>();

        CharArraySet defaults = EnglishAnalyzer.getDefaultStopSet();
        for (Object token : defaults) {
            if (token instanceof char[] chars) {
                out.add(new String(chars));
            } else if (token != null) {
                out.add(token.toString());
            }
        }

        classpathFile.filter(path -> !path.isBlank()).ifPresent(path -> readWordList(path, out));

        if (runtimeExtras != null) {
            runtimeExtras.stream()
                .filter(s -> s != null && !s.isBlank())
                .map(s -> s.strip().toLowerCase(Locale.ROOT))
                .forEach(out::add);
        }

        return new Stopwords(out);
    }

    private static void readWordList(String path, Set<String> out) {
        try (InputStream in = Stopwords.class.getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("Stopword list not found on classpath: " + path);
            }
            try (var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    line = line.strip();
                    if (!line.isEmpty() && !line.startsWith("#")) {
                        out.add(line.toLowerCase(Locale.ROOT));
                    }
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read stopword list: " + path, e);
        }
    }

    public boolean contains(String token) {
        return merged.contains(token);
    }

    public int size() {
        return merged.size();
    }

    Set<String> asSet() {
        return Set.copyOf(merged);
    }
}
