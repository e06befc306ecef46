package com.fintech.trades.domain;

import java.time.Instant;

/**
 * Upstream connectivity change.
 *
 * @param type lost or restored
 * @param occurredAt detection time
 * @param reason close reason or failure message, may be null
 */
public record ConnectionEvent(Type type, Instant occurredAt, String reason) {

    public enum Type { LOST, RESTORED }

    public static ConnectionEvent lost(String reason) {
        return new ConnectionEvent(Type.LOST, Instant.now(), reason);
    }

    public static ConnectionEvent restored() {
        return new ConnectionEvent(Type.RESTORED, Instant.now(), null);
    }
}
