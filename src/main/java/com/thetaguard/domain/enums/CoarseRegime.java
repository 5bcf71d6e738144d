package com.thetaguard.domain.enums;

/** Two-band regime used by simplified policies: NORMAL below the coarse threshold, HIGH at or above. */
public enum CoarseRegime {
    NORMAL,
    HIGH
}
