package com.thetaguard.policy;

import java.util.Set;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class CorrelationGroupDefinition {

    private final String id;
    private final String name;
    private final Set<String> symbols;

    /** Correlation to equities observed in crisis; scores risk, never blocks. */
    private final double crisisWeight;
}
