package com.thetaguard.correlation;

import com.thetaguard.domain.enums.VixRegime;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Serializable image of the controller's counters and the context their limits were computed in.
 * Restoring it reproduces the same admission outcomes as the instance it was taken from.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CorrelationSnapshot {

    private long version;
    private String parametersVersion;
    private BigDecimal equity;
    private VixRegime regime;
    private Instant takenAt;
    private Map<String, List<Entry>> groups;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Entry {
        private String positionId;
        private String symbol;
    }
}
