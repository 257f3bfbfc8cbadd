package com.gene.evidence.api;

/**
 * A well-formed symbol that matches no gene in any served tier.
 */
public class GeneNotFoundException extends RuntimeException {

    private final String symbol;

    public GeneNotFoundException(String symbol) {
        super("Gene " + symbol + " not found in any tier");
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
