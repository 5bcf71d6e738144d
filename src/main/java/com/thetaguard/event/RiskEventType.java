package com.thetaguard.event;

/**
 * Classifies the condition behind a {@link RiskEvent}. Listeners filter on it, for example to
 * page on PROTOCOL_ESCALATION at EMERGENCY but only log ADMISSION_DENIED.
 */
public enum RiskEventType {

    /** A candidate entry was refused by one of the admission gates. */
    ADMISSION_DENIED,

    /** A symbol with no correlation group was seen; the group table is incomplete. */
    POLICY_GAP,

    /** The emergency protocol moved up the ladder. */
    PROTOCOL_ESCALATION,

    /** The emergency protocol returned to NORMAL. */
    PROTOCOL_RESET,

    /** A tracked position was ordered to defend, roll or close. */
    DEFENSIVE_ACTION,

    /** A market value needed for a decision was unavailable. */
    DATA_UNAVAILABLE,

    /** The decision core stopped admitting new positions. */
    CORE_HALTED,

    /** The decision core was resumed after a halt. */
    CORE_RESUMED
}
