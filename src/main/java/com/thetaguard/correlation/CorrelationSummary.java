package com.thetaguard.correlation;

import com.thetaguard.domain.enums.VixRegime;
import java.util.List;
import java.util.Set;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class CorrelationSummary {

    private final long version;
    private final VixRegime regime;
    private final String equityTier;
    private final int totalPositions;
    private final int unmappedPositions;
    private final int equityLikePositions;
    private final int equityAggregateCap;
    private final double riskScore;
    private final double crisisVaR;
    private final List<GroupUsage> groups;
    private final List<String> warnings;
    private final Set<String> policyGaps;

    @Getter
    @Builder
    public static class GroupUsage {
        private final String groupId;
        private final String name;
        private final int count;
        private final int limit;
        private final double crisisWeight;
        private final List<String> symbols;
    }
}
