package com.fintech.trades.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Event kinds carried in the {@code event} field of upstream channel messages.
 */
public enum FeedEvent {
    SUBSCRIBED("subscribed"),
    UNSUBSCRIBED("unsubscribed"),
    REJECTED("rejected"),
    SNAPSHOT("snapshot"),
    UPDATED("updated");

    private final String wireValue;

    FeedEvent(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /** Empty for heartbeats and event kinds the relay does not understand. */
    public static Optional<FeedEvent> fromWireValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (FeedEvent event : values()) {
            if (event.wireValue.equalsIgnoreCase(value.trim())) {
                return Optional.of(event);
            }
        }
        return Optional.empty();
    }

    /** True for events that confirm or refuse a subscription request. */
    public boolean isSubscriptionAck() {
        return this == SUBSCRIBED || this == UNSUBSCRIBED || this == REJECTED;
    }
}
