package com.thetaguard.event;

import java.math.BigDecimal;
import java.time.Instant;
import org.springframework.context.ApplicationEvent;

/**
 * Published when the account phase computed from equity differs from the previously cached one.
 *
 * <p>For observability only. Nothing in the core gates on this event; consumers re-query the
 * phase instead of tracking edges.
 */
public class PhaseTransitionEvent extends ApplicationEvent {

    private final int previousPhase;
    private final int currentPhase;
    private final BigDecimal equity;
    private final Instant transitionTime;

    public PhaseTransitionEvent(Object source, int previousPhase, int currentPhase, BigDecimal equity) {
        super(source);
        this.previousPhase = previousPhase;
        this.currentPhase = currentPhase;
        this.equity = equity;
        this.transitionTime = Instant.now();
    }

    public int getPreviousPhase() {
        return previousPhase;
    }

    public int getCurrentPhase() {
        return currentPhase;
    }

    public BigDecimal getEquity() {
        return equity;
    }

    public Instant getTransitionTime() {
        return transitionTime;
    }
}
