package com.example.streampanel.domain;

/**
 * Why a stream session reached CLOSED. Stored in {@code stream_logs.close_reason}.
 */
public enum StreamCloseReason {

    /** The owning account called stop. */
    STOPPED,

    /** An administrator force-stopped the stream. */
    FORCE_STOPPED,

    /** Upstream reached end of stream. */
    UPSTREAM_END,

    /** Upstream could not be reached before any byte was relayed. */
    UPSTREAM_UNAVAILABLE,

    /** Upstream failed after bytes had started flowing. */
    UPSTREAM_INTERRUPTED,

    /** The client went away mid-relay. */
    CLIENT_DISCONNECT,

    /** The play handle was never claimed by a relay request. */
    UNCLAIMED,

    /** The relay stopped reporting, usually because its instance died. */
    ORPHANED
}
