package com.example.dfasim.cli;

import com.example.dfasim.DfaDefinition;

import java.util.*;

/**
 * Builds a {@link DfaDefinition} from the five text fields a user types in.
 *
 * <p>List fields are comma separated; entries are trimmed and blanks dropped.
 * Transition rows are {@code source,symbol,target}. A row with a blank or
 * missing cell is skipped, and a later row for the same source and symbol
 * replaces an earlier one.
 *
 * <p>The initial state is picked from the states field: a typed initial
 * state that is one of the states is kept, otherwise the first state is
 * used. Only an empty states field leaves the initial state unset.
 */
public final class RawFieldParser {

    private RawFieldParser() {}

    public static List<String> splitList(String field) {
        List<String> items = new ArrayList<>();
        if (field == null) {
            return items;
        }
        for (String item : field.split(",")) {
            String trimmed = item.trim();
            if (!trimmed.isEmpty()) {
                items.add(trimmed);
            }
        }
        return items;
    }

    public static DfaDefinition parse(String states, String alphabet, String initialState,
                                      String acceptingStates, List<String> transitionRows) {
        DfaDefinition definition = new DfaDefinition();
        List<String> stateList = splitList(states);
        definition.setStates(stateList);
        definition.setAlphabet(splitList(alphabet));
        definition.setInitialState(pickInitialState(stateList, initialState));
        definition.setAcceptingStates(splitList(acceptingStates));
        if (transitionRows != null) {
            for (String row : transitionRows) {
                addRow(definition, row);
            }
        }
        return definition;
    }

    private static String pickInitialState(List<String> states, String typed) {
        String trimmed = typed == null ? "" : typed.trim();
        if (states.contains(trimmed)) {
            return trimmed;
        }
        return states.isEmpty() ? null : states.get(0);
    }

    private static void addRow(DfaDefinition definition, String row) {
        if (row == null) {
            return;
        }
        String[] cells = row.split(",", -1);
        if (cells.length != 3) {
            return;
        }
        String source = cells[0].trim();
        String symbol = cells[1].trim();
        String target = cells[2].trim();
        if (source.isEmpty() || symbol.isEmpty() || target.isEmpty()) {
            return;
        }
        definition.putTransition(source, symbol, target);
    }
}
