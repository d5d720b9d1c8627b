package com.example.streampanel.domain;

/**
 * Lifecycle of one relayed stream.
 * <pre>
 * REQUESTED -> ADMITTED -> RELAYING -> CLOSED
 * REQUESTED -> REJECTED
 * </pre>
 * Only ADMITTED, RELAYING and CLOSED are ever persisted; REQUESTED and REJECTED exist
 * for the duration of a start call.
 */
public enum StreamState {

    REQUESTED,

    ADMITTED,

    RELAYING,

    CLOSED,

    REJECTED;

    public boolean isActive() {
        return this == ADMITTED || this == RELAYING;
    }
}
