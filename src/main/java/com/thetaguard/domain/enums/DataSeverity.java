package com.thetaguard.domain.enums;

/**
 * How bad a missing market value is, given when it went missing.
 *
 * <ul>
 *   <li>EXPECTED: market closed, last value is fine</li>
 *   <li>WARNING: session just opened, feeds still warming up</li>
 *   <li>CRITICAL: active session, decisions on this instrument stop</li>
 *   <li>FATAL: active session and a major index is missing, the core halts</li>
 * </ul>
 */
public enum DataSeverity {
    EXPECTED,
    WARNING,
    CRITICAL,
    FATAL;

    public boolean allowsFallback() {
        return this == EXPECTED || this == WARNING;
    }
}
