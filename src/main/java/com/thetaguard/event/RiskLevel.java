package com.thetaguard.event;

/**
 * Severity level for a {@link RiskEvent}.
 *
 * <p>INFO is for transitions worth recording, WARNING for denials and policy gaps that need
 * attention, and CRITICAL for conditions where the core has taken protective action on its
 * own (emergency protocol, halt).
 */
public enum RiskLevel {

    /** Informational, no action required. */
    INFO,

    /** Something needs attention: a denied entry, a gap in the policy table. */
    WARNING,

    /** Protective action taken: emergency directive issued or the core halted. */
    CRITICAL
}
