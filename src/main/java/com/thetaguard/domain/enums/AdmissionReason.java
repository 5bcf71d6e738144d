package com.thetaguard.domain.enums;

/**
 * Which gate decided an admission query. Allowed outcomes carry OK or UNMAPPED_SYMBOL.
 */
public enum AdmissionReason {
    OK,
    UNMAPPED_SYMBOL,
    UNMAPPED_SYMBOL_REJECTED,
    GROUP_LIMIT,
    EQUITY_AGGREGATE_LIMIT,
    BELOW_MINIMUM_PHASE,
    STRATEGY_NOT_ALLOWED,
    MAX_POSITIONS,
    EMERGENCY_ENTRY_BLOCK,
    BUYING_POWER_BUDGET,
    DUPLICATE_POSITION;

    public boolean isAllowed() {
        return this == OK || this == UNMAPPED_SYMBOL;
    }
}
