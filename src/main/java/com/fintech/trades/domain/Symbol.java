package com.fintech.trades.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Instruments relayed from the exchange feed, keyed by their wire value.
 */
public enum Symbol {
    BTC_USD("BTC-USD"),
    ETH_USD("ETH-USD"),
    SOL_USD("SOL-USD"),
    ADA_USD("ADA-USD"),
    DOT_USD("DOT-USD");

    private final String wireValue;

    Symbol(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /**
     * Parses a wire value such as {@code "BTC-USD"}, ignoring case and surrounding whitespace.
     *
     * @throws IllegalArgumentException for an unsupported symbol
     */
    @JsonCreator
    public static Symbol fromWireValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Symbol is required");
        }
        String normalized = value.trim();
        for (Symbol symbol : values()) {
            if (symbol.wireValue.equalsIgnoreCase(normalized)) {
                return symbol;
            }
        }
        throw new IllegalArgumentException(String.format(
            "Unsupported symbol '%s'. Allowed: %s", value, supportedValues()));
    }

    public static String supportedValues() {
        return Arrays.stream(values()).map(Symbol::wireValue).collect(Collectors.joining(", "));
    }

    @Override
    public String toString() {
        return wireValue;
    }
}
