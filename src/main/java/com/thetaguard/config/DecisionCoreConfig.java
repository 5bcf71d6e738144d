package com.thetaguard.config;

import com.thetaguard.lifecycle.OptionChainProvider;
import com.thetaguard.policy.RiskParameters;
import com.thetaguard.policy.RiskParametersValidator;
import com.thetaguard.policy.RiskPolicyProvider;
import java.time.Clock;
import java.time.ZoneId;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the risk policy, the session clock and a fallback option-chain source.
 *
 * <p>The policy bean is validated eagerly while the context starts; a
 * {@link com.thetaguard.exception.PolicyViolationException} aborts startup.
 */
@Configuration
@EnableConfigurationProperties({RiskParametersProperties.class, MarketSessionProperties.class})
public class DecisionCoreConfig {

    private static final Logger log = LoggerFactory.getLogger(DecisionCoreConfig.class);

    @Bean
    public RiskPolicyProvider riskPolicyProvider(
            RiskParametersProperties riskParametersProperties, RiskParametersValidator riskParametersValidator) {
        RiskParameters parameters = RiskParametersFactory.from(riskParametersProperties);
        log.info("Loading risk parameters version {}", parameters.getVersion());
        return new RiskPolicyProvider(parameters, riskParametersValidator);
    }

    @Bean
    public Clock decisionClock(MarketSessionProperties marketSessionProperties) {
        return Clock.system(ZoneId.of(marketSessionProperties.getZone()));
    }

    /**
     * Used when no market-data integration supplies a chain. Every roll then degrades to a close.
     */
    @Bean
    @ConditionalOnMissingBean(OptionChainProvider.class)
    public OptionChainProvider emptyOptionChainProvider() {
        log.warn("No OptionChainProvider configured: defensive rolls will fall back to closes");
        return (underlying, fromExpiry, toExpiry) -> List.of();
    }
}
