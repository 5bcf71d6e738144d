package com.thetaguard.marketdata;

import com.thetaguard.config.MarketSessionProperties;
import com.thetaguard.domain.vo.MarketReading;
import com.thetaguard.policy.RiskPolicyProvider;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import org.springframework.stereotype.Component;

/**
 * Default quality gate: missing, non-finite or implausible values become UNAVAILABLE with a
 * time-of-day severity; stale values are passed through as DEGRADED.
 */
@Component
public class SessionAwareDataQualityGate implements MarketDataQualityGate {

    static final String VIX = "VIX";

    private final DataSeverityClassifier dataSeverityClassifier;
    private final MarketSessionProperties marketSessionProperties;
    private final RiskPolicyProvider riskPolicyProvider;

    public SessionAwareDataQualityGate(
            DataSeverityClassifier dataSeverityClassifier,
            MarketSessionProperties marketSessionProperties,
            RiskPolicyProvider riskPolicyProvider) {
        this.dataSeverityClassifier = dataSeverityClassifier;
        this.marketSessionProperties = marketSessionProperties;
        this.riskPolicyProvider = riskPolicyProvider;
    }

    @Override
    public MarketReading assess(String instrument, Double rawValue, Instant observedAt, ZonedDateTime now) {
        if (rawValue == null) {
            return MarketReading.unavailable(dataSeverityClassifier.classify(instrument, now), "not reported");
        }
        if (!Double.isFinite(rawValue) || rawValue <= 0.0) {
            return MarketReading.unavailable(
                    dataSeverityClassifier.classify(instrument, now), "invalid value " + rawValue);
        }
        if (VIX.equalsIgnoreCase(instrument) && rawValue < riskPolicyProvider.current().getMinValidVix()) {
            return MarketReading.unavailable(
                    dataSeverityClassifier.classify(instrument, now), "implausible VIX " + rawValue);
        }
        if (observedAt != null) {
            long ageSeconds = Duration.between(observedAt, now.toInstant()).getSeconds();
            if (ageSeconds > marketSessionProperties.getStaleAfterSeconds()) {
                return MarketReading.degraded(rawValue, "stale by " + ageSeconds + "s");
            }
        }
        return MarketReading.value(rawValue);
    }
}
