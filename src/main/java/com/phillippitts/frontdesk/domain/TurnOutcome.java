package com.phillippitts.frontdesk.domain;

/**
 * Terminal outcome of one turn. Every finalized transcript ends in exactly one.
 */
public enum TurnOutcome {
    DIRECT_ANSWER,
    GROUNDED_REPLY,
    OPEN_REPLY,
    FALLBACK,
    CANCELLED
}
