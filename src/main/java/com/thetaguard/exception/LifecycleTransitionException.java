package com.thetaguard.exception;

import com.thetaguard.domain.enums.LifecycleState;
import java.util.Map;

public class LifecycleTransitionException extends BaseException {

    public LifecycleTransitionException(String positionId, LifecycleState from, LifecycleState to) {
        super(
                ErrorCode.INVALID_STATE_TRANSITION,
                String.format("Position %s cannot move from %s to %s", positionId, from, to),
                Map.of("positionId", positionId, "from", String.valueOf(from), "to", String.valueOf(to)));
    }
}
