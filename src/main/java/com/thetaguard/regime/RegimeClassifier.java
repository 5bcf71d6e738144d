package com.thetaguard.regime;

import com.thetaguard.domain.enums.CoarseRegime;
import com.thetaguard.domain.enums.VixRegime;
import com.thetaguard.policy.RegimeBand;
import com.thetaguard.policy.RiskParameters;
import com.thetaguard.policy.RiskPolicyProvider;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Maps a VIX reading to a {@link VixRegime} and a maximum buying-power fraction.
 *
 * <p>Bands are half-open {@code [lower, next lower)}: a reading exactly on a boundary belongs to
 * the higher band, so 20.0 is NORMAL, never LOW. Stateless apart from reading the current policy.
 *
 * <p>Readings are expected to be resolved already. A missing index is the caller's problem
 * (see {@code MarketDataResolver}); a non-finite or implausibly low value passed here is a
 * programming error.
 */
@Component
public class RegimeClassifier {

    private final RiskPolicyProvider riskPolicyProvider;

    public RegimeClassifier(RiskPolicyProvider riskPolicyProvider) {
        this.riskPolicyProvider = riskPolicyProvider;
    }

    public VixRegime classify(double vix) {
        return classify(vix, riskPolicyProvider.current());
    }

    public RegimeAssessment assess(double vix, int phase) {
        RiskParameters parameters = riskPolicyProvider.current();
        VixRegime regime = classify(vix, parameters);
        return RegimeAssessment.builder()
                .vix(vix)
                .phase(phase)
                .regime(regime)
                .coarseRegime(vix >= parameters.getCoarseHighThreshold() ? CoarseRegime.HIGH : CoarseRegime.NORMAL)
                .maxBuyingPower(parameters.band(regime).maxBuyingPower(phase))
                .posture(regime.getPosture())
                .build();
    }

    public CoarseRegime classifyCoarse(double vix) {
        requireValid(vix, riskPolicyProvider.current());
        return vix >= riskPolicyProvider.current().getCoarseHighThreshold() ? CoarseRegime.HIGH : CoarseRegime.NORMAL;
    }

    /** Phase 0 always gets 0: an account below the minimum may not commit buying power. */
    public double maxBuyingPower(VixRegime regime, int phase) {
        return riskPolicyProvider.current().band(regime).maxBuyingPower(phase);
    }

    public boolean isValidReading(double vix) {
        return Double.isFinite(vix) && vix >= riskPolicyProvider.current().getMinValidVix();
    }

    private VixRegime classify(double vix, RiskParameters parameters) {
        requireValid(vix, parameters);
        List<RegimeBand> bands = parameters.getRegimeBands();
        VixRegime regime = bands.get(0).getRegime();
        for (RegimeBand band : bands) {
            if (vix >= band.getLowerBound()) {
                regime = band.getRegime();
            }
        }
        return regime;
    }

    private void requireValid(double vix, RiskParameters parameters) {
        if (!Double.isFinite(vix) || vix < parameters.getMinValidVix()) {
            throw new IllegalArgumentException("VIX reading " + vix + " is not a valid index value");
        }
    }
}
