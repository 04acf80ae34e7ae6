package com.trigger.exception;

/**
 * Exception thrown when a symbol is neither bound in a scope nor stored as a variable.
 */
public class UndefinedSymbolException extends EvaluationException {

    private final String symbol;

    public UndefinedSymbolException(String symbol) {
        super("undefined symbol: " + symbol);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
