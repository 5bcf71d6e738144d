package com.thetaguard.event;

import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published when the decision core detects or acts on a risk condition.
 *
 * <p>Risk events carry the type of condition, its severity, a human-readable message and a
 * details map for condition-specific data (group id and limit for a denial, VIX and level for
 * an escalation).
 *
 * <p>The core itself never listens to these; they exist for the execution layer, alerting and
 * dashboards.
 */
public class RiskEvent extends ApplicationEvent {

    private final RiskEventType eventType;
    private final RiskLevel level;
    private final String message;
    private final Map<String, Object> details;

    public RiskEvent(Object source, RiskEventType eventType, RiskLevel level, String message) {
        super(source);
        this.eventType = eventType;
        this.level = level;
        this.message = message;
        this.details = new HashMap<>();
    }

    public RiskEvent(
            Object source, RiskEventType eventType, RiskLevel level, String message, Map<String, Object> details) {
        super(source);
        this.eventType = eventType;
        this.level = level;
        this.message = message;
        this.details = details != null ? new HashMap<>(details) : new HashMap<>();
    }

    public RiskEventType getEventType() {
        return eventType;
    }

    public RiskLevel getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Condition-specific details. For example:
     * <ul>
     *   <li>ADMISSION_DENIED: {"symbol": "MES", "group": "A1", "limit": 2, "count": 2}</li>
     *   <li>PROTOCOL_ESCALATION: {"vix": 41.2, "previous": "ELEVATED", "current": "EMERGENCY"}</li>
     * </ul>
     */
    public Map<String, Object> getDetails() {
        return details;
    }
}
