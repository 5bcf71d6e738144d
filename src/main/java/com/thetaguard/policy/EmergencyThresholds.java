package com.thetaguard.policy;

import lombok.Builder;
import lombok.Getter;

/**
 * VIX thresholds of the escalation ladder and the directive parameters attached to each level.
 * The three thresholds must be strictly ascending.
 */
@Getter
@Builder
public class EmergencyThresholds {

    private final double preventive;
    private final double elevated;
    private final double emergency;

    /** Multiplier applied to the max buying-power fraction from PREVENTIVE upward. */
    private final double headroomMultiplier;

    /** Share of each position's quantity to cut from ELEVATED upward. */
    private final double exposureReduction;

    /** The ladder resets once VIX falls below {@code preventive - hysteresis}. */
    private final double hysteresis;
}
