package com.thetaguard.domain.enums;

/**
 * Emergency escalation ladder. Each level includes every directive of the levels below it.
 */
public enum ProtocolLevel {
    NORMAL("No restrictions"),
    PREVENTIVE("New-entry buying-power headroom reduced"),
    ELEVATED("New entries blocked, exposure reduced"),
    EMERGENCY("Same-day expirations force-closed, critical alert raised");

    private final String description;

    ProtocolLevel(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isAtLeast(ProtocolLevel other) {
        return this.ordinal() >= other.ordinal();
    }
}
