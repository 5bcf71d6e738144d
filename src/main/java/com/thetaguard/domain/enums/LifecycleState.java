package com.thetaguard.domain.enums;

/**
 * Defensive lifecycle of a tracked position.
 *
 * <pre>
 * PENDING    -> OPEN                 entry fill confirmed
 * OPEN       -> CHALLENGED           defend rule fired
 * OPEN       -> CLOSED               profit target or stop loss filled
 * CHALLENGED -> DEFENDED             roll planned
 * CHALLENGED -> CLOSED               close filled
 * DEFENDED   -> OPEN                 roll filled
 * </pre>
 *
 * <p>PENDING is a reservation made at admission time; it counts against correlation limits
 * until the entry fill arrives or the reservation is released.
 */
public enum LifecycleState {
    PENDING,
    OPEN,
    CHALLENGED,
    DEFENDED,
    CLOSED;

    public boolean isTerminal() {
        return this == CLOSED;
    }
}
