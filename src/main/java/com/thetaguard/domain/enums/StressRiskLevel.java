package com.thetaguard.domain.enums;

public enum StressRiskLevel {
    NORMAL,
    ELEVATED,
    HIGH,
    EXTREME
}
