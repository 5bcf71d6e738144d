package com.thetaguard.exception;

import com.thetaguard.domain.enums.DataSeverity;
import java.util.Map;
import lombok.Getter;

/**
 * A market value needed for a decision is missing or untrustworthy.
 * The severity tells the caller whether the whole core was halted (FATAL) or only this query failed.
 */
@Getter
public class DataUnavailableException extends BaseException {

    private final String instrument;
    private final DataSeverity severity;

    public DataUnavailableException(String instrument, DataSeverity severity, String reason) {
        super(
                ErrorCode.DATA_UNAVAILABLE,
                "Market data unavailable for " + instrument + " (" + severity + "): " + reason,
                Map.of("instrument", instrument, "severity", severity.name()));
        this.instrument = instrument;
        this.severity = severity;
    }
}
