package com.thetaguard.lifecycle;

import com.thetaguard.domain.enums.LifecycleAction;
import com.thetaguard.domain.model.OptionContract;
import com.thetaguard.domain.model.Position;
import com.thetaguard.policy.RiskParameters;
import com.thetaguard.policy.RiskPolicyProvider;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Plans the defense of a challenged position: roll to the same strike and right in the
 * configured DTE window (30-45 by default), or close outright when no such contract exists.
 * A roll is close-then-reopen as one instruction, so the position is never left without its leg.
 */
@Component
public class RollPlanner {

    private static final Logger log = LoggerFactory.getLogger(RollPlanner.class);

    private final OptionChainProvider optionChainProvider;
    private final RiskPolicyProvider riskPolicyProvider;

    public RollPlanner(OptionChainProvider optionChainProvider, RiskPolicyProvider riskPolicyProvider) {
        this.optionChainProvider = optionChainProvider;
        this.riskPolicyProvider = riskPolicyProvider;
    }

    public LifecycleDecision plan(Position position, LocalDate today) {
        if (!position.isOption()) {
            return close(position, "Not an option position, no roll target; closing");
        }

        RiskParameters parameters = riskPolicyProvider.current();
        LocalDate from = today.plusDays(parameters.getRollMinDte());
        LocalDate to = today.plusDays(parameters.getRollMaxDte());

        Optional<OptionContract> replacement = findReplacement(position, from, to);
        if (replacement.isEmpty()) {
            log.warn(
                    "Could not roll {} ({} {} {}): no contract {}-{} DTE, position will be closed",
                    position.getId(), position.getSymbol(), position.getStrike(), position.getOptionRight(),
                    parameters.getRollMinDte(), parameters.getRollMaxDte());
            return close(position, String.format(
                    "No replacement at strike %s %s within %d-%d DTE; rolled to close",
                    position.getStrike(), position.getOptionRight(), parameters.getRollMinDte(), parameters.getRollMaxDte()));
        }

        OptionContract target = replacement.get();
        log.info("Roll planned for {}: {} -> {}", position.getId(), position.getExpiry(), target.getExpiry());
        return LifecycleDecision.builder()
                .positionId(position.getId())
                .action(LifecycleAction.ROLL)
                .reason(String.format(
                        "Roll %s %s %s from %s to %s", position.getSymbol(), position.getStrike(),
                        position.getOptionRight(), position.getExpiry(), target.getExpiry()))
                .state(position.getLifecycleState())
                .replacement(target)
                .build();
    }

    private Optional<OptionContract> findReplacement(Position position, LocalDate from, LocalDate to) {
        List<OptionContract> chain;
        try {
            chain = optionChainProvider.contracts(position.getSymbol(), from, to);
        } catch (RuntimeException e) {
            log.error("Option chain lookup failed for {}, treating as no replacement", position.getSymbol(), e);
            return Optional.empty();
        }
        return chain.stream()
                .filter(c -> c.getRight() == position.getOptionRight())
                .filter(c -> c.getStrike() != null && c.getStrike().compareTo(position.getStrike()) == 0)
                .filter(c -> !c.getExpiry().isBefore(from) && !c.getExpiry().isAfter(to))
                .min(Comparator.comparing(OptionContract::getExpiry));
    }

    private LifecycleDecision close(Position position, String reason) {
        return LifecycleDecision.builder()
                .positionId(position.getId())
                .action(LifecycleAction.CLOSE)
                .reason(reason)
                .state(position.getLifecycleState())
                .build();
    }
}
