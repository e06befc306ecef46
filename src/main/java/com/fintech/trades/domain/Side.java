package com.fintech.trades.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Aggressor side of a trade. */
public enum Side {
    BUY,
    SELL;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @throws IllegalArgumentException for anything other than buy/sell
     */
    public static Side fromWireValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Side is required");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "buy" -> BUY;
            case "sell" -> SELL;
            default -> throw new IllegalArgumentException("Unsupported side: " + value);
        };
    }
}
