package com.thetaguard.lifecycle;

import com.thetaguard.correlation.CorrelationAdmissionController;
import com.thetaguard.domain.enums.LifecycleState;
import com.thetaguard.domain.model.AdmissionDecision;
import com.thetaguard.domain.model.Position;
import com.thetaguard.exception.LifecycleTransitionException;
import com.thetaguard.exception.ResourceNotFoundException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Arena of tracked positions indexed by id.
 *
 * <p>All mutation goes through {@link #reserve}, {@link #adopt}, {@link #transition},
 * {@link #update} and {@link #unregister}; the first two and the last keep the correlation
 * counters in step, so the counters always describe exactly the positions held here.
 * Readers receive copies.
 */
@Component
public class PositionBook {

    private static final Logger log = LoggerFactory.getLogger(PositionBook.class);

    private static final Map<LifecycleState, Set<LifecycleState>> ALLOWED_TRANSITIONS =
            new EnumMap<>(LifecycleState.class);

    static {
        ALLOWED_TRANSITIONS.put(LifecycleState.PENDING, EnumSet.of(LifecycleState.OPEN, LifecycleState.CLOSED));
        ALLOWED_TRANSITIONS.put(LifecycleState.OPEN, EnumSet.of(LifecycleState.CHALLENGED, LifecycleState.CLOSED));
        ALLOWED_TRANSITIONS.put(
                LifecycleState.CHALLENGED, EnumSet.of(LifecycleState.DEFENDED, LifecycleState.CLOSED));
        ALLOWED_TRANSITIONS.put(
                LifecycleState.DEFENDED,
                EnumSet.of(LifecycleState.OPEN, LifecycleState.CHALLENGED, LifecycleState.CLOSED));
        ALLOWED_TRANSITIONS.put(LifecycleState.CLOSED, EnumSet.noneOf(LifecycleState.class));
    }

    private final CorrelationAdmissionController correlationAdmissionController;
    private final Map<String, Position> positions = new ConcurrentHashMap<>();

    public PositionBook(CorrelationAdmissionController correlationAdmissionController) {
        this.correlationAdmissionController = correlationAdmissionController;
    }

    /**
     * Runs the correlation gates and, if they admit, stores the position as PENDING. The counter
     * increment and the gate check are one critical section inside the controller.
     */
    public AdmissionDecision reserve(Position candidate, int accountPhase) {
        AdmissionDecision decision =
                correlationAdmissionController.tryAdmit(candidate.getId(), candidate.getSymbol(), accountPhase);
        if (!decision.isAllowed()) {
            return decision;
        }
        Position reserved = candidate.toBuilder()
                .correlationGroup(decision.getGroupId())
                .lifecycleState(LifecycleState.PENDING)
                .lastUpdated(Instant.now())
                .build();
        if (positions.putIfAbsent(reserved.getId(), reserved) != null) {
            correlationAdmissionController.unregister(reserved.getId());
            throw new IllegalStateException("Position " + reserved.getId() + " already tracked");
        }
        log.info("Reserved {} {} ({}), group {}", reserved.getId(), reserved.getSymbol(), reserved.getStrategy(),
                reserved.getCorrelationGroup());
        return decision;
    }

    /** Tracks a position that already exists at the broker, bypassing the gates. */
    public void adopt(Position position) {
        Position adopted = position.toBuilder()
                .correlationGroup(correlationAdmissionController.resolveGroup(position.getSymbol()).orElse(null))
                .lifecycleState(position.getLifecycleState() != null ? position.getLifecycleState() : LifecycleState.OPEN)
                .lastUpdated(Instant.now())
                .build();
        if (positions.putIfAbsent(adopted.getId(), adopted) != null) {
            log.warn("Position {} already tracked, adopt ignored", adopted.getId());
            return;
        }
        correlationAdmissionController.register(adopted.getId(), adopted.getSymbol());
        log.info("Adopted {} {} as {}", adopted.getId(), adopted.getSymbol(), adopted.getLifecycleState());
    }

    /**
     * Moves a position to {@code target}. A transition to the current state is a no-op, so
     * repeated defensive evaluations stay idempotent.
     */
    public Position transition(String positionId, LifecycleState target) {
        Position updated = positions.computeIfPresent(positionId, (id, current) -> {
            LifecycleState from = current.getLifecycleState();
            if (from == target) {
                return current;
            }
            if (!ALLOWED_TRANSITIONS.get(from).contains(target)) {
                throw new LifecycleTransitionException(id, from, target);
            }
            log.info("Position {} {} -> {}", id, from, target);
            return current.toBuilder().lifecycleState(target).lastUpdated(Instant.now()).build();
        });
        if (updated == null) {
            throw new ResourceNotFoundException("Position", positionId);
        }
        return updated.toBuilder().build();
    }

    /** Applies a field update that does not change the lifecycle state (mark, roll details, quantity). */
    public Position update(String positionId, UnaryOperator<Position.PositionBuilder> change) {
        Position updated = positions.computeIfPresent(positionId, (id, current) -> {
            Position next = change.apply(current.toBuilder()).lastUpdated(Instant.now()).build();
            if (next.getLifecycleState() != current.getLifecycleState() || !id.equals(next.getId())) {
                throw new IllegalArgumentException("update may not change id or lifecycle state of " + id);
            }
            return next;
        });
        if (updated == null) {
            throw new ResourceNotFoundException("Position", positionId);
        }
        return updated.toBuilder().build();
    }

    public Position mark(String positionId, BigDecimal mark) {
        return update(positionId, b -> b.currentMark(mark));
    }

    /**
     * Removes a CLOSED position, or releases a PENDING reservation, and decrements the
     * correlation counters.
     */
    public Position unregister(String positionId) {
        Position current = positions.get(positionId);
        if (current == null) {
            throw new ResourceNotFoundException("Position", positionId);
        }
        LifecycleState state = current.getLifecycleState();
        if (state != LifecycleState.CLOSED && state != LifecycleState.PENDING) {
            throw new LifecycleTransitionException(positionId, state, LifecycleState.CLOSED);
        }
        if (positions.remove(positionId, current)) {
            correlationAdmissionController.unregister(positionId);
            log.info("Unregistered {} ({})", positionId, state);
            return current.toBuilder().build();
        }
        // Changed between read and remove; retry against the new value.
        return unregister(positionId);
    }

    /** Replaces the whole book with the broker's view and rebuilds the counters from it. */
    public void synchronize(Collection<Position> brokerPositions) {
        positions.clear();
        for (Position position : brokerPositions) {
            positions.put(position.getId(), position.toBuilder()
                    .correlationGroup(correlationAdmissionController.resolveGroup(position.getSymbol()).orElse(null))
                    .lifecycleState(position.getLifecycleState() != null ? position.getLifecycleState() : LifecycleState.OPEN)
                    .build());
        }
        correlationAdmissionController.synchronize(positions.values());
        log.info("Position book synchronized: {} positions", positions.size());
    }

    public Optional<Position> find(String positionId) {
        return Optional.ofNullable(positions.get(positionId)).map(p -> p.toBuilder().build());
    }

    public Position get(String positionId) {
        return find(positionId).orElseThrow(() -> new ResourceNotFoundException("Position", positionId));
    }

    /** Positions that are neither PENDING nor CLOSED. */
    public List<Position> activePositions() {
        return positions.values().stream()
                .filter(p -> p.getLifecycleState() != LifecycleState.PENDING && !p.getLifecycleState().isTerminal())
                .map(p -> p.toBuilder().build())
                .collect(Collectors.toList());
    }

    /** Positions that count against limits: everything tracked, reservations included. */
    public int trackedCount() {
        return positions.size();
    }
}
