package com.thetaguard.domain.enums;

/** Kind of execution report the execution layer sends back through RegisterFill. */
public enum FillType {
    ENTRY,
    ROLL,
    CLOSE,
    REDUCE
}
