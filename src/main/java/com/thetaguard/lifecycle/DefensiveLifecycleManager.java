package com.thetaguard.lifecycle;

import com.thetaguard.domain.enums.FillType;
import com.thetaguard.domain.enums.LifecycleAction;
import com.thetaguard.domain.enums.LifecycleState;
import com.thetaguard.domain.enums.OptionRight;
import com.thetaguard.domain.model.FillDetails;
import com.thetaguard.domain.model.MarketSnapshot;
import com.thetaguard.domain.model.Position;
import com.thetaguard.marketdata.MarketDataResolver;
import com.thetaguard.policy.RiskParameters;
import com.thetaguard.policy.RiskPolicyProvider;
import com.thetaguard.policy.StrategyRule;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Defensive lifecycle state machine for tracked positions.
 *
 * <p>Evaluation order, first match wins:
 * <ol>
 *   <li>Days to expiry at or below the management threshold (never below 21): DEFEND, whatever the
 *       P&amp;L. A short option that is also at assignment risk escalates to EMERGENCY_CLOSE.</li>
 *   <li>Profit target reached: CLOSE</li>
 *   <li>Stop loss reached: CLOSE</li>
 *   <li>Otherwise HOLD</li>
 * </ol>
 *
 * <p>Assignment risk can only occur within a day of expiry, which is always inside the DTE
 * window, so it is checked there. The DEFEND outcome is stable: a position stays in the window
 * until it is rolled out or closed, and every evaluation in between re-emits DEFEND.
 */
@Service
public class DefensiveLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(DefensiveLifecycleManager.class);

    private final PositionBook positionBook;
    private final RollPlanner rollPlanner;
    private final MarketDataResolver marketDataResolver;
    private final RiskPolicyProvider riskPolicyProvider;

    public DefensiveLifecycleManager(
            PositionBook positionBook,
            RollPlanner rollPlanner,
            MarketDataResolver marketDataResolver,
            RiskPolicyProvider riskPolicyProvider) {
        this.positionBook = positionBook;
        this.rollPlanner = rollPlanner;
        this.marketDataResolver = marketDataResolver;
        this.riskPolicyProvider = riskPolicyProvider;
    }

    // ========================
    // EVALUATION
    // ========================

    /**
     * Resolves the position's mark and underlying from the snapshot, evaluates it, and moves it to
     * CHALLENGED when the outcome is defensive.
     *
     * @throws com.thetaguard.exception.DataUnavailableException when the mark is missing at
     *     CRITICAL or FATAL severity
     */
    public LifecycleDecision evaluate(String positionId, MarketSnapshot marketSnapshot) {
        Position position = positionBook.get(positionId);
        if (position.getLifecycleState() == LifecycleState.PENDING || position.getLifecycleState().isTerminal()) {
            return hold(position, "Not active (" + position.getLifecycleState() + ")");
        }

        OptionalDouble mark = marketDataResolver.resolve(
                "mark:" + position.getId(),
                position.getSymbol(),
                marketSnapshot.optionMark(position.getId()),
                marketSnapshot.getAsOf());
        if (mark.isPresent()) {
            position = positionBook.mark(position.getId(), BigDecimal.valueOf(mark.getAsDouble()));
        }

        OptionalDouble underlying = OptionalDouble.empty();
        if (position.isOption() && position.isShort()) {
            underlying = marketDataResolver.resolve(
                    position.getSymbol(),
                    position.getSymbol(),
                    marketSnapshot.underlying(position.getSymbol()),
                    marketSnapshot.getAsOf());
        }

        LocalDate today = marketDataResolver.tradeDate(marketSnapshot.getAsOf());
        LifecycleDecision decision = evaluate(position, today, underlying);
        boolean defensive = decision.getAction() == LifecycleAction.DEFEND
                || decision.getAction() == LifecycleAction.EMERGENCY_CLOSE;
        if (defensive && position.getLifecycleState() == LifecycleState.OPEN) {
            Position challenged = positionBook.transition(position.getId(), LifecycleState.CHALLENGED);
            decision = LifecycleDecision.builder()
                    .positionId(decision.getPositionId())
                    .action(decision.getAction())
                    .reason(decision.getReason())
                    .state(challenged.getLifecycleState())
                    .challenged(decision.isChallenged())
                    .build();
        }
        if (decision.requiresExecution()) {
            log.info("Position {} {}: {}", position.getId(), decision.getAction(), decision.getReason());
        }
        return decision;
    }

    /** Pure evaluation against an explicit date and underlying price; no book mutation. */
    public LifecycleDecision evaluate(Position position, LocalDate today, OptionalDouble underlying) {
        RiskParameters parameters = riskPolicyProvider.current();
        StrategyRule rule = parameters.ruleFor(position.getStrategy());
        if (position.getExpiry() == null) {
            return evaluateProfitAndLoss(position, rule, "no expiry", isChallenged(position, underlying, parameters));
        }
        long dte = position.daysToExpiry(today);
        int threshold = Math.max(
                RiskParameters.DEFENSIVE_DTE_FLOOR, Math.max(parameters.getDefensiveDte(), rule.getDteManagement()));
        boolean challenged = isChallenged(position, underlying, parameters);

        if (dte <= threshold) {
            String assignment = assignmentRisk(position, underlying, dte, parameters);
            if (assignment != null) {
                return decision(position, LifecycleAction.EMERGENCY_CLOSE, assignment, challenged);
            }
            return decision(
                    position,
                    LifecycleAction.DEFEND,
                    String.format("%d DTE at or below the %d-DTE rule: defend regardless of P&L%s",
                            dte, threshold, challenged ? " (strike challenged)" : ""),
                    challenged);
        }

        return evaluateProfitAndLoss(position, rule, dte + " DTE", challenged);
    }

    private LifecycleDecision evaluateProfitAndLoss(
            Position position, StrategyRule rule, String expiryText, boolean challenged) {
        Double profitRatio = profitRatio(position);
        if (profitRatio != null) {
            if (profitRatio >= rule.getProfitTarget()) {
                return decision(
                        position,
                        LifecycleAction.CLOSE,
                        String.format("Profit target reached: %.0f%% of max profit (target %.0f%%)",
                                profitRatio * 100, rule.getProfitTarget() * 100),
                        challenged);
            }
            if (rule.hasStopLoss() && -profitRatio >= rule.getStopLossMultiple()) {
                return decision(
                        position,
                        LifecycleAction.CLOSE,
                        String.format("Stop loss hit: loss %.2fx entry premium (stop %.2fx)",
                                -profitRatio, rule.getStopLossMultiple()),
                        challenged);
            }
        }

        return decision(
                position,
                LifecycleAction.HOLD,
                String.format("%s, P&L %s%s", expiryText,
                        profitRatio != null ? String.format("%.0f%%", profitRatio * 100) : "unknown",
                        challenged ? ", strike challenged" : ""),
                challenged);
    }

    // ========================
    // DEFENSE
    // ========================

    /**
     * Plans the defense of a CHALLENGED position. A ROLL moves it to DEFENDED until the roll fill
     * arrives; a CLOSE leaves it CHALLENGED until the close fill arrives.
     */
    public LifecycleDecision planDefense(String positionId, LocalDate today) {
        Position position = positionBook.get(positionId);
        if (position.getLifecycleState() != LifecycleState.CHALLENGED
                && position.getLifecycleState() != LifecycleState.DEFENDED) {
            return hold(position, "No defense needed in state " + position.getLifecycleState());
        }
        LifecycleDecision plan = rollPlanner.plan(position, today);
        if (plan.getAction() == LifecycleAction.ROLL) {
            Position defended = positionBook.transition(positionId, LifecycleState.DEFENDED);
            return LifecycleDecision.builder()
                    .positionId(positionId)
                    .action(plan.getAction())
                    .reason(plan.getReason())
                    .state(defended.getLifecycleState())
                    .replacement(plan.getReplacement())
                    .build();
        }
        return plan;
    }

    // ========================
    // FILLS
    // ========================

    public Position applyFill(FillDetails fill) {
        Position position = positionBook.get(fill.getPositionId());
        FillType type = fill.getFillType();
        switch (type) {
            case ENTRY:
                positionBook.update(position.getId(), b -> b.entryPrice(fill.getPrice()).currentMark(fill.getPrice()));
                return positionBook.transition(position.getId(), LifecycleState.OPEN);
            case ROLL:
                positionBook.update(position.getId(), b -> b.expiry(fill.getExpiry())
                        .strike(fill.getStrike() != null ? fill.getStrike() : position.getStrike())
                        .optionRight(fill.getOptionRight() != null ? fill.getOptionRight() : position.getOptionRight())
                        .entryPrice(fill.getPrice())
                        .currentMark(fill.getPrice()));
                if (position.getLifecycleState() == LifecycleState.CHALLENGED) {
                    positionBook.transition(position.getId(), LifecycleState.DEFENDED);
                }
                log.info("Roll filled for {}: new expiry {}", position.getId(), fill.getExpiry());
                return positionBook.transition(position.getId(), LifecycleState.OPEN);
            case REDUCE:
                int remaining = reduceTowardsZero(position.getQuantity(), fill.getQuantity());
                if (remaining != 0) {
                    return positionBook.update(position.getId(), b -> b.quantity(remaining));
                }
                return close(position);
            case CLOSE:
                return close(position);
            default:
                throw new IllegalArgumentException("Unsupported fill type " + type);
        }
    }

    private Position close(Position position) {
        Position closed = positionBook.transition(position.getId(), LifecycleState.CLOSED);
        positionBook.unregister(position.getId());
        marketDataResolver.forget("mark:" + position.getId());
        return closed;
    }

    // ========================
    // RULES
    // ========================

    /**
     * Fraction of the entry premium captured: for a short (credit) position
     * {@code (entry - mark) / entry}, for a long (debit) position {@code (mark - entry) / entry}.
     * Null when there is no usable entry price or mark.
     */
    Double profitRatio(Position position) {
        BigDecimal entry = position.getEntryPrice();
        BigDecimal mark = position.getCurrentMark();
        if (entry == null || mark == null || entry.signum() == 0) {
            return null;
        }
        BigDecimal change = position.isShort() ? entry.subtract(mark) : mark.subtract(entry);
        return change.divide(entry.abs(), MathContext.DECIMAL64).doubleValue();
    }

    private String assignmentRisk(Position position, OptionalDouble underlying, long dte, RiskParameters parameters) {
        if (!position.isOption() || !position.isShort() || underlying.isEmpty()) {
            return null;
        }
        if (dte > parameters.getAssignmentWindowDays()) {
            return null;
        }
        double strike = position.getStrike().doubleValue();
        double spot = underlying.getAsDouble();
        if (position.getOptionRight() == OptionRight.PUT) {
            double itm = (strike - spot) / strike;
            if (itm > parameters.getPutAssignmentBuffer()) {
                return String.format("Assignment risk: short put %.1f%% in the money with %d DTE", itm * 100, dte);
            }
        } else {
            double itm = (spot - strike) / strike;
            if (itm > parameters.getCallAssignmentBuffer()) {
                return String.format("Assignment risk: short call %.1f%% in the money with %d DTE", itm * 100, dte);
            }
        }
        return null;
    }

    private boolean isChallenged(Position position, OptionalDouble underlying, RiskParameters parameters) {
        if (!position.isOption() || !position.isShort() || underlying.isEmpty()) {
            return false;
        }
        double strike = position.getStrike().doubleValue();
        double spot = underlying.getAsDouble();
        if (position.getOptionRight() == OptionRight.PUT) {
            return spot <= strike * (1.0 + parameters.getChallengeBuffer());
        }
        return spot >= strike * (1.0 - parameters.getChallengeBuffer());
    }

    private int reduceTowardsZero(int quantity, int reduceBy) {
        int magnitude = Math.max(0, Math.abs(quantity) - Math.abs(reduceBy));
        return quantity < 0 ? -magnitude : magnitude;
    }

    private LifecycleDecision decision(Position position, LifecycleAction action, String reason, boolean challenged) {
        return LifecycleDecision.builder()
                .positionId(position.getId())
                .action(action)
                .reason(reason)
                .state(position.getLifecycleState())
                .challenged(challenged)
                .build();
    }

    private LifecycleDecision hold(Position position, String reason) {
        return decision(position, LifecycleAction.HOLD, reason, false);
    }
}
