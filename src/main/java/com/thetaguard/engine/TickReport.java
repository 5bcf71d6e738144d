package com.thetaguard.engine;

import com.thetaguard.domain.model.AccountState;
import com.thetaguard.emergency.ProtocolDirective;
import com.thetaguard.lifecycle.LifecycleDecision;
import java.time.ZonedDateTime;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of one decision tick. {@code instructions} holds the protocol's portfolio-wide orders
 * (same-day closes first, then reductions) and {@code decisions} the per-position lifecycle
 * results. Positions whose data was unavailable at CRITICAL severity appear in {@code errors}
 * instead of {@code decisions}.
 */
@Getter
@Builder
@ToString
public class TickReport {

    private final ZonedDateTime asOf;
    private final AccountState accountState;
    private final ProtocolDirective directive;
    private final List<LifecycleDecision> instructions;
    private final List<LifecycleDecision> decisions;
    private final List<String> errors;
    private final boolean halted;

    /** Everything the executor must act on, protocol instructions first. */
    public int actionableCount() {
        int count = instructions.size();
        for (LifecycleDecision decision : decisions) {
            if (decision.requiresExecution()) {
                count++;
            }
        }
        return count;
    }
}
