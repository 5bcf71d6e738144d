package com.thetaguard.domain.model;

import com.thetaguard.domain.enums.AdmissionReason;
import lombok.Builder;
import lombok.Getter;

/**
 * Outcome of an admission query: allow or deny, the gate that decided it, and the group/limit
 * pair involved. Denials are normal outcomes, not errors.
 *
 * <p>{@code groupId}, {@code limit} and {@code currentCount} are null when the deciding gate
 * was not a correlation gate (phase, buying power, emergency block).
 */
@Getter
@Builder
public class AdmissionDecision {

    private final boolean allowed;
    private final AdmissionReason reason;
    private final String message;
    private final String symbol;
    private final String groupId;
    private final Integer limit;
    private final Integer currentCount;

    public static AdmissionDecision allow(String symbol, String groupId, int limit, int currentCount) {
        return AdmissionDecision.builder()
                .allowed(true)
                .reason(AdmissionReason.OK)
                .message(String.format("Admitted into group %s (%d/%d)", groupId, currentCount, limit))
                .symbol(symbol)
                .groupId(groupId)
                .limit(limit)
                .currentCount(currentCount)
                .build();
    }

    public static AdmissionDecision allowUnmapped(String symbol) {
        return AdmissionDecision.builder()
                .allowed(true)
                .reason(AdmissionReason.UNMAPPED_SYMBOL)
                .message("Symbol " + symbol + " not in correlation groups, admitted without group limit")
                .symbol(symbol)
                .build();
    }

    public static AdmissionDecision deny(AdmissionReason reason, String symbol, String message) {
        return AdmissionDecision.builder()
                .allowed(false)
                .reason(reason)
                .message(message)
                .symbol(symbol)
                .build();
    }

    public static AdmissionDecision denyAtLimit(
            AdmissionReason reason, String symbol, String groupId, int limit, int currentCount, String message) {
        return AdmissionDecision.builder()
                .allowed(false)
                .reason(reason)
                .message(message)
                .symbol(symbol)
                .groupId(groupId)
                .limit(limit)
                .currentCount(currentCount)
                .build();
    }

    @Override
    public String toString() {
        return (allowed ? "ALLOW " : "DENY ") + reason + ": " + message;
    }
}
