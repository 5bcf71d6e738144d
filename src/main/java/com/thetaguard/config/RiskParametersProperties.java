package com.thetaguard.config;

import com.thetaguard.domain.enums.VixRegime;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds the risk policy table from application.yml ({@code thetaguard.risk.*}).
 *
 * <p>This is the mutable binding target only. {@link RiskParametersFactory} turns it into the
 * immutable {@link com.thetaguard.policy.RiskParameters} the decision components read.
 *
 * <p>Strategy rules and correlation groups are lists rather than maps so that tags like
 * {@code FRIDAY_0DTE} survive relaxed binding untouched.
 */
@Data
@ConfigurationProperties(prefix = "thetaguard.risk")
public class RiskParametersProperties {

    private String version;
    private Regime regime = new Regime();
    private List<Phase> phases = new ArrayList<>();
    private Sizing sizing = new Sizing();
    private List<Strategy> strategies = new ArrayList<>();
    private Strategy defaultStrategy = new Strategy();
    private Correlation correlation = new Correlation();
    private Defensive defensive = new Defensive();
    private Emergency emergency = new Emergency();

    @Data
    public static class Regime {
        private double coarseHighThreshold = 25.0;
        private double minValidVix = 5.0;
        private List<Band> bands = new ArrayList<>();
    }

    @Data
    public static class Band {
        private VixRegime regime;
        private double lowerBound;
        private List<Double> maxBuyingPower = new ArrayList<>();
    }

    @Data
    public static class Phase {
        private int phase;
        private BigDecimal minEquity;
        private int maxPositions;
        private double maxRiskPerTrade;
        private int defaultUnitSize = 1;
        private List<String> strategies = new ArrayList<>();
        private String description;
    }

    @Data
    public static class Sizing {
        private double kellyMultiplier = 0.25;
        private double defaultPerTradeRiskCap = 0.05;
    }

    @Data
    public static class Strategy {
        private String name = "DEFAULT";
        private double profitTarget = 0.50;
        /** Null means the strategy has no stop loss. */
        private Double stopLossMultiple;
        private int dteManagement = 21;
        private double winRate = 0.70;
        private double averageWin = 1.0;
        private double averageLoss = 2.0;
        private Double kellyMultiplier;
    }

    @Data
    public static class Correlation {
        private boolean strictGroupMapping = false;
        private List<String> equityLikeGroups = new ArrayList<>();
        private int equityAggregateCap = 3;
        private List<Tier> tiers = new ArrayList<>();
        private List<Group> groups = new ArrayList<>();
    }

    @Data
    public static class Tier {
        private String name;
        private BigDecimal minEquity;
    }

    @Data
    public static class Group {
        private String id;
        private String name;
        private List<String> symbols = new ArrayList<>();
        private double crisisWeight;

        /** Base limit per equity tier, aligned with {@link Correlation#getTiers()}. */
        private List<Integer> tierLimits = new ArrayList<>();
    }

    @Data
    public static class Defensive {
        private int defensiveDte = 21;
        private int rollMinDte = 30;
        private int rollMaxDte = 45;
        private int assignmentWindowDays = 1;
        private double putAssignmentBuffer = 0.02;
        private double callAssignmentBuffer = 0.01;
        private double challengeBuffer = 0.02;
    }

    @Data
    public static class Emergency {
        private double preventive = 25.0;
        private double elevated = 30.0;
        private double emergency = 40.0;
        private double headroomMultiplier = 0.75;
        private double exposureReduction = 0.50;
        private double hysteresis = 2.0;
    }
}
