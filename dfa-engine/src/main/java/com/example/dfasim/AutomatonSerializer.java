package com.example.dfasim;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.*;

/**
 * Converts a {@link DfaDefinition} to and from its flat JSON record.
 *
 * <p>No validation happens here; the result of {@link #fromRecord} still has
 * to be applied.
 */
public final class AutomatonSerializer {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    private AutomatonSerializer() {}

    /**
     * The persisted shape: only lists of strings, a string and a map of maps.
     * Unknown keys (a {@code _comment}, for instance) are ignored on read.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AutomatonRecord {
        @JsonProperty("states")
        private List<String> states;

        @JsonProperty("alphabet")
        private List<String> alphabet;

        @JsonProperty("initial_state")
        private String initialState;

        @JsonProperty("accepting_states")
        private List<String> acceptingStates;

        @JsonProperty("transitions")
        private Map<String, Map<String, String>> transitions;

        public AutomatonRecord() {}

        public AutomatonRecord(List<String> states, List<String> alphabet, String initialState,
                               List<String> acceptingStates, Map<String, Map<String, String>> transitions) {
            this.states = states;
            this.alphabet = alphabet;
            this.initialState = initialState;
            this.acceptingStates = acceptingStates;
            this.transitions = transitions;
        }

        public List<String> getStates() { return states; }
        public void setStates(List<String> states) { this.states = states; }

        public List<String> getAlphabet() { return alphabet; }
        public void setAlphabet(List<String> alphabet) { this.alphabet = alphabet; }

        public String getInitialState() { return initialState; }
        public void setInitialState(String initialState) { this.initialState = initialState; }

        public List<String> getAcceptingStates() { return acceptingStates; }
        public void setAcceptingStates(List<String> acceptingStates) { this.acceptingStates = acceptingStates; }

        public Map<String, Map<String, String>> getTransitions() { return transitions; }
        public void setTransitions(Map<String, Map<String, String>> transitions) { this.transitions = transitions; }
    }

    public static AutomatonRecord toRecord(DfaDefinition definition) {
        return new AutomatonRecord(
            new ArrayList<>(definition.getStates()),
            new ArrayList<>(definition.getAlphabet()),
            definition.getInitialState(),
            new ArrayList<>(definition.getAcceptingStates()),
            orderedTransitions(definition));
    }

    /**
     * Missing fields become empty collections, a missing initial state stays absent.
     */
    public static DfaDefinition fromRecord(AutomatonRecord record) {
        return new DfaDefinition(
            record.getStates(),
            record.getAlphabet(),
            record.getInitialState(),
            record.getAcceptingStates(),
            record.getTransitions());
    }

    public static String toJson(DfaDefinition definition) throws IOException {
        return MAPPER.writeValueAsString(toRecord(definition));
    }

    public static DfaDefinition fromJson(String json) throws IOException {
        return fromRecord(readRecord(json));
    }

    public static void write(DfaDefinition definition, Writer writer) throws IOException {
        MAPPER.writeValue(writer, toRecord(definition));
    }

    public static DfaDefinition read(Reader reader) throws IOException {
        AutomatonRecord record = MAPPER.readValue(reader, AutomatonRecord.class);
        if (record == null) {
            throw new IOException("Empty automaton document");
        }
        return fromRecord(record);
    }

    /**
     * Reads a map of named records, as used by catalogs of sample automata.
     */
    public static Map<String, DfaDefinition> readCatalog(Reader reader) throws IOException {
        Map<String, AutomatonRecord> records = MAPPER.readValue(reader,
            MAPPER.getTypeFactory().constructMapType(LinkedHashMap.class, String.class, AutomatonRecord.class));
        Map<String, DfaDefinition> catalog = new LinkedHashMap<>();
        for (Map.Entry<String, AutomatonRecord> entry : records.entrySet()) {
            catalog.put(entry.getKey(), fromRecord(entry.getValue()));
        }
        return catalog;
    }

    private static AutomatonRecord readRecord(String json) throws IOException {
        AutomatonRecord record = MAPPER.readValue(json, AutomatonRecord.class);
        if (record == null) {
            throw new IOException("Empty automaton document");
        }
        return record;
    }

    // Rows in state order, symbols in alphabet order; anything undeclared goes last
    private static Map<String, Map<String, String>> orderedTransitions(DfaDefinition definition) {
        Map<String, Map<String, String>> source = definition.getTransitions();
        Map<String, Map<String, String>> ordered = new LinkedHashMap<>();
        for (String state : sortedKeys(source.keySet(), definition.getStates())) {
            Map<String, String> row = source.get(state);
            Map<String, String> orderedRow = new LinkedHashMap<>();
            for (String symbol : sortedKeys(row.keySet(), definition.getAlphabet())) {
                orderedRow.put(symbol, row.get(symbol));
            }
            ordered.put(state, orderedRow);
        }
        return ordered;
    }

    private static List<String> sortedKeys(Set<String> keys, Collection<String> declaredOrder) {
        List<String> declared = new ArrayList<>(declaredOrder);
        List<String> sorted = new ArrayList<>(keys);
        sorted.sort((a, b) -> {
            int ia = declared.indexOf(a);
            int ib = declared.indexOf(b);
            if (ia < 0) ia = Integer.MAX_VALUE;
            if (ib < 0) ib = Integer.MAX_VALUE;
            return Integer.compare(ia, ib);
        });
        return sorted;
    }
}
