package com.thetaguard.domain.enums;

public enum OptionRight {
    PUT,
    CALL
}
