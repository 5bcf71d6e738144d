package com.thetaguard.exception;

import java.util.List;
import java.util.Map;
import lombok.Getter;

/**
 * Raised when the risk policy table is malformed (overlapping bands, unordered thresholds,
 * non-positive limits). Thrown while the configuration loads, so the process refuses to start.
 */
@Getter
public class PolicyViolationException extends BaseException {

    private final List<String> violations;

    public PolicyViolationException(List<String> violations) {
        super(
                ErrorCode.POLICY_VIOLATION,
                "Invalid risk parameters: " + String.join("; ", violations),
                Map.of("violations", List.copyOf(violations)));
        this.violations = List.copyOf(violations);
    }

    public PolicyViolationException(String violation) {
        this(List.of(violation));
    }
}
