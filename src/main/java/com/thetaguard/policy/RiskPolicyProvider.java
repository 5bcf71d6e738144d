package com.thetaguard.policy;

import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the active {@link RiskParameters}. Components read {@link #current()} once per decision,
 * so a reload never splits a single decision across two policy versions.
 */
public class RiskPolicyProvider {

    private static final Logger log = LoggerFactory.getLogger(RiskPolicyProvider.class);

    private final RiskParametersValidator validator;
    private final AtomicReference<RiskParameters> current;

    public RiskPolicyProvider(RiskParameters initial, RiskParametersValidator validator) {
        this.validator = validator;
        validator.validate(initial);
        this.current = new AtomicReference<>(initial);
    }

    public RiskParameters current() {
        return current.get();
    }

    /** Validates and swaps in a new table. The old table stays active if validation fails. */
    public void reload(RiskParameters replacement) {
        validator.validate(replacement);
        RiskParameters previous = current.getAndSet(replacement);
        log.info("Risk parameters reloaded: {} -> {}", previous.getVersion(), replacement.getVersion());
    }
}
