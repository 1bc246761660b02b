package com.example.dfasim;

/**
 * Thrown when the string under test contains a symbol outside the alphabet.
 * Rejection by a missing transition is not an error and never raises this.
 */
public class InvalidInputException extends Exception {

    private final String symbol;
    private final int position;

    public InvalidInputException(String symbol, int position) {
        super("Symbol '" + symbol + "' at position " + position + " is not in the alphabet");
        this.symbol = symbol;
        this.position = position;
    }

    public String getSymbol() { return symbol; }

    /** 1-based position of the offending symbol. */
    public int getPosition() { return position; }
}
