package com.example.dfasim.cli;

import com.example.dfasim.AutomatonSerializer;
import com.example.dfasim.DfaDefinition;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Built-in sample automata, read once from {@code examples.json} on the classpath.
 */
public final class ExampleAutomata {

    private static final String RESOURCE = "/examples.json";

    private static final Map<String, DfaDefinition> EXAMPLES = load();

    private ExampleAutomata() {}

    private static Map<String, DfaDefinition> load() {
        try (InputStream in = ExampleAutomata.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing resource " + RESOURCE);
            }
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                return Collections.unmodifiableMap(AutomatonSerializer.readCatalog(reader));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE, e);
        }
    }

    /**
     * @return example names in catalog order
     */
    public static List<String> names() {
        return new ArrayList<>(EXAMPLES.keySet());
    }

    /**
     * @return a fresh copy of the named example, or empty if there is none
     */
    public static Optional<DfaDefinition> get(String name) {
        DfaDefinition example = EXAMPLES.get(name);
        return example == null ? Optional.empty() : Optional.of(example.copy());
    }
}
