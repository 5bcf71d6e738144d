package com.thetaguard.emergency;

import com.thetaguard.domain.enums.ProtocolLevel;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Portfolio-wide directive for a protocol level. Directives are cumulative: every flag set at a
 * lower level is also set at the higher ones.
 */
@Getter
@Builder
@ToString
public class ProtocolDirective {

    private final ProtocolLevel level;

    /** Multiplier on the max buying-power fraction for new entries; 1.0 means no cut. */
    private final double headroomMultiplier;

    private final boolean blockNewEntries;

    /** Share of each position's quantity to cut; 0 means none. */
    private final double exposureReduction;

    private final boolean closeSameDayExpirations;
    private final boolean criticalAlert;
    private final List<String> actions;
}
