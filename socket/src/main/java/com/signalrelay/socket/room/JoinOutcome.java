package com.signalrelay.socket.room;

/**
 * Result of a join attempt.
 */
public enum JoinOutcome {
    /** Fresh room, the joiner is the initiator. */
    CREATED,
    /** Existing room with a free slot, the joiner is a responder. */
    JOINED,
    /** Room already at capacity, nothing changed. */
    FULL,
    /** The connection already belongs to a room, nothing changed. */
    ALREADY_IN_ROOM;

    public boolean isAdmitted() {
        return this == CREATED || this == JOINED;
    }
}
