package com.thetaguard.domain.enums;

public enum SizingOutcome {
    OK,
    CAPPED,
    NEGATIVE_EDGE,
    DEGENERATE_INPUT,
    STRATEGY_NOT_ALLOWED
}
