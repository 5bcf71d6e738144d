package com.thetaguard.config;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Session hours used to classify how serious a missing market value is.
 *
 * <p>Properties prefix: {@code thetaguard.market.*}. Defaults match the US equity session.
 */
@Data
@ConfigurationProperties(prefix = "thetaguard.market")
public class MarketSessionProperties {

    private String zone = "America/New_York";
    private LocalTime open = LocalTime.of(9, 30);
    private LocalTime close = LocalTime.of(16, 0);

    /** Minutes after the open during which missing values are only a warning. */
    private int warmupMinutes = 5;

    /** Instruments whose absence during the session halts the decision core. */
    private List<String> majorIndices = new ArrayList<>(List.of("VIX", "SPY", "ES"));

    /** Values older than this are usable but flagged as degraded. */
    private int staleAfterSeconds = 60;

    /** Full exchange holidays; weekends are always closed. */
    private List<LocalDate> holidays = new ArrayList<>();
}
