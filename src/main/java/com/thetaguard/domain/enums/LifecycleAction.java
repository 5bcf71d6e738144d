package com.thetaguard.domain.enums;

/**
 * Instruction emitted to the execution layer for a tracked position.
 * REDUCE is only produced by the emergency protocol when it shrinks exposure.
 */
public enum LifecycleAction {
    HOLD,
    DEFEND,
    ROLL,
    CLOSE,
    REDUCE,
    EMERGENCY_CLOSE
}
