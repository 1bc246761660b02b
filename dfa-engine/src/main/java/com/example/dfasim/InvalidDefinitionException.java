package com.example.dfasim;

/**
 * Thrown when a {@link DfaDefinition} breaks one of the structural rules of a DFA.
 */
public class InvalidDefinitionException extends Exception {

    /** Which rule was broken, in the order the validator checks them. */
    public enum Reason {
        INITIAL_STATE_NOT_IN_STATES,
        ACCEPTING_STATES_NOT_SUBSET,
        TRANSITION_SOURCE_UNKNOWN,
        SYMBOL_NOT_IN_ALPHABET,
        TRANSITION_TARGET_UNKNOWN
    }

    private final Reason reason;
    private final String identifier;

    public InvalidDefinitionException(Reason reason, String identifier, String message) {
        super(message);
        this.reason = reason;
        this.identifier = identifier;
    }

    public Reason getReason() { return reason; }

    /**
     * @return the state or symbol that broke the rule
     */
    public String getIdentifier() { return identifier; }
}
