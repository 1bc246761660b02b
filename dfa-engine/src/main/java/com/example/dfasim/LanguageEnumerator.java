package com.example.dfasim;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Lists accepted strings of a {@link Dfa}, shortest first.
 *
 * <p>Breadth-first search over {@code (state, string so far)} configurations.
 * Same-length strings come out in the order of the alphabet. The search stops
 * once {@code maxResults} strings are found or nothing is left to expand;
 * configurations whose string already has {@code maxLength} symbols are not
 * expanded.
 *
 * <p>Lengths are counted in alphabet symbols, not characters: {@code maxLength}
 * bounds the number of symbols consumed, and results are ordered by that
 * count. For single-character alphabets the two measures coincide; with
 * multi-character symbols a result may have more than {@code maxLength}
 * characters and character lengths need not be non-decreasing.
 */
public final class LanguageEnumerator {

    private static final Logger logger = LoggerFactory.getLogger(LanguageEnumerator.class);

    public static final int DEFAULT_MAX_RESULTS = 10;
    public static final int DEFAULT_MAX_LENGTH = 20;

    private LanguageEnumerator() {}

    private static final class Configuration {
        final int state;
        final String word;
        final int length;

        Configuration(int state, String word, int length) {
            this.state = state;
            this.word = word;
            this.length = length;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Configuration)) return false;
            Configuration that = (Configuration) o;
            return state == that.state && word.equals(that.word);
        }

        @Override
        public int hashCode() {
            return 31 * state + word.hashCode();
        }
    }

    public static List<String> enumerateAccepted(Dfa dfa) {
        return enumerateAccepted(dfa, DEFAULT_MAX_RESULTS, DEFAULT_MAX_LENGTH);
    }

    /**
     * @param maxResults upper bound on the number of strings returned
     * @param maxLength  upper bound on the number of symbols per string
     * @return accepted strings in non-decreasing length, possibly fewer than
     *         {@code maxResults} (or none) if the bounded language is smaller
     */
    public static List<String> enumerateAccepted(Dfa dfa, int maxResults, int maxLength) {
        if (maxResults < 0) {
            throw new IllegalArgumentException("maxResults must not be negative: " + maxResults);
        }
        if (maxLength < 0) {
            throw new IllegalArgumentException("maxLength must not be negative: " + maxLength);
        }

        // Insertion-ordered: with multi-character symbols two paths may spell the same string
        Set<String> results = new LinkedHashSet<>();
        if (maxResults == 0 || dfa.initialState() == Dfa.NO_STATE) {
            return Collections.emptyList();
        }

        Deque<Configuration> frontier = new ArrayDeque<>();
        Set<Configuration> visited = new HashSet<>();
        frontier.add(new Configuration(dfa.initialState(), "", 0));

        while (!frontier.isEmpty() && results.size() < maxResults) {
            Configuration current = frontier.poll();
            if (!visited.add(current)) {
                continue;
            }
            if (dfa.isAccepting(current.state) && results.add(current.word) && results.size() >= maxResults) {
                break;
            }
            if (current.length >= maxLength) {
                continue;
            }
            for (int symbol = 0; symbol < dfa.symbolCount(); symbol++) {
                int next = dfa.next(current.state, symbol);
                if (next != Dfa.NO_STATE) {
                    frontier.add(new Configuration(next, current.word + dfa.symbol(symbol), current.length + 1));
                }
            }
        }

        logger.debug("Enumerated {} accepted strings (maxResults={}, maxLength={})",
            results.size(), maxResults, maxLength);
        return Collections.unmodifiableList(new ArrayList<>(results));
    }
}
