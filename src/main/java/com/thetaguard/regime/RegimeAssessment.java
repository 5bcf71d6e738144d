package com.thetaguard.regime;

import com.thetaguard.domain.enums.CoarseRegime;
import com.thetaguard.domain.enums.VixRegime;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class RegimeAssessment {

    private final double vix;
    private final int phase;
    private final VixRegime regime;
    private final CoarseRegime coarseRegime;
    private final double maxBuyingPower;
    private final String posture;
}
