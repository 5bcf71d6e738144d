package com.thetaguard.exception;

import java.util.Map;

public class DecisionCoreHaltedException extends BaseException {

    public DecisionCoreHaltedException(String haltReason) {
        super(
                ErrorCode.DECISION_CORE_HALTED,
                "Decision core halted, new admissions refused: " + haltReason,
                Map.of("haltReason", haltReason));
    }
}
