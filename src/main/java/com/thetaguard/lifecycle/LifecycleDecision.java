package com.thetaguard.lifecycle;

import com.thetaguard.domain.enums.LifecycleAction;
import com.thetaguard.domain.enums.LifecycleState;
import com.thetaguard.domain.model.OptionContract;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * An instruction for the execution layer about one tracked position, with its justification.
 *
 * <p>{@code replacement} is set only for ROLL; {@code quantity} only for REDUCE.
 */
@Getter
@Builder
@ToString
public class LifecycleDecision {

    private final String positionId;
    private final LifecycleAction action;
    private final String reason;
    private final LifecycleState state;
    private final boolean challenged;
    private final OptionContract replacement;
    private final Integer quantity;

    public boolean requiresExecution() {
        return action != LifecycleAction.HOLD;
    }
}
