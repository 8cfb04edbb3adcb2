package com.incoresoft.presenceTracker.domain.session.dto;

/**
 * What a single sighting or miss did to a presence session.
 */
public enum SessionTransition {
    NONE,
    /** Idle -> Pending */
    STARTED,
    /** Pending -> Confirmed */
    CONFIRMED,
    /** Pending -> Idle */
    CLEARED
}
