package com.thetaguard.domain.enums;

/**
 * Volatility regimes, ordered from calmest to most stressed.
 *
 * <pre>
 * VERY_LOW   [0, 15)   complacent market, thin premium
 * LOW        [15, 20)  optimal premium selling
 * NORMAL     [20, 30)  standard operations
 * HIGH       [30, 40)  reduced exposure, correlation limits shrink
 * VERY_HIGH  [40, inf) crisis, preserve capital
 * </pre>
 *
 * <p>The numeric boundaries live in the risk parameters; the ordinal order here is what
 * {@link #isAtLeast(VixRegime)} compares.
 */
public enum VixRegime {
    VERY_LOW("Very low volatility", "Limited premium, smaller sizes"),
    LOW("Low volatility", "Optimal premium collection"),
    NORMAL("Normal volatility", "Standard operations"),
    HIGH("High volatility", "Reduce exposure, defensive adjustments"),
    VERY_HIGH("Very high volatility", "Crisis posture, preserve capital");

    private final String description;
    private final String posture;

    VixRegime(String description, String posture) {
        this.description = description;
        this.posture = posture;
    }

    public String getDescription() {
        return description;
    }

    public String getPosture() {
        return posture;
    }

    public boolean isAtLeast(VixRegime other) {
        return this.ordinal() >= other.ordinal();
    }
}
