package com.gurukul.karmaLedger.config;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Static karma tables, loaded once at startup from a classpath JSON resource.
 *
 * All collections are copied into immutable views on construction, so a loaded
 * config can be shared freely between the evaluator, aggregator and recommender.
 *
 * Contains:
 * - Severity multipliers (minor/medium/major/maha) with a fallback label
 * - Paap action table (action -> severity + base value)
 * - Reward map (action -> value + token + stability class)
 * - Positive/negative distribution fractions
 * - Purushartha category mappings
 * - Corrective practice weights and guidance thresholds
 * - Aggregation, merit and weighted-score weights
 * - Role ladder used to derive the next role from merit
 */
public record KarmaConfig(
        Map<String, Double> severityMultipliers,
        String fallbackSeverity,
        Map<String, PaapAction> paapActions,
        Map<String, RewardRule> rewardMap,
        double defaultRewardValue,
        Distribution defaultDistribution,
        Distribution positiveDistribution,
        Distribution negativeDistribution,
        NetWeights netWeights,
        Map<String, Double> meritWeights,
        Map<String, Double> tokenWeights,
        Map<String, PurusharthaRule> purushartha,
        Map<String, CorrectivePractice> correctivePractices,
        GuidanceThresholds guidanceThresholds,
        List<RoleTier> roleLadder) {

    public static final String DEFAULT_FALLBACK_SEVERITY = "major";

    /**
     * Demerit tier with no Rnanubandhan counterpart; debt created by it is booked as "major".
     */
    public static final String MAHA_SEVERITY = "maha";

    public KarmaConfig {
        severityMultipliers = copy(severityMultipliers);
        fallbackSeverity = fallbackSeverity == null || fallbackSeverity.isBlank()
                ? DEFAULT_FALLBACK_SEVERITY
                : fallbackSeverity;
        paapActions = copy(paapActions);
        rewardMap = copy(rewardMap);
        defaultDistribution = defaultDistribution == null ? Distribution.NONE : defaultDistribution;
        positiveDistribution = positiveDistribution == null ? Distribution.NONE : positiveDistribution;
        negativeDistribution = negativeDistribution == null ? Distribution.NONE : negativeDistribution;
        netWeights = netWeights == null ? new NetWeights(1.0, 1.0) : netWeights;
        meritWeights = copy(meritWeights);
        tokenWeights = copy(tokenWeights);
        purushartha = copy(purushartha);
        correctivePractices = copy(correctivePractices);
        guidanceThresholds = guidanceThresholds == null ? GuidanceThresholds.DEFAULTS : guidanceThresholds;
        roleLadder = roleLadder == null ? List.of() : List.copyOf(roleLadder);
    }

    /**
     * Resolves a severity label to its multiplier.
     * Unknown or null labels resolve through the fallback severity ("major");
     * if even the fallback is missing from the table the multiplier is 1.0.
     */
    public double multiplier(String severity) {
        Double value = severity == null ? null : severityMultipliers.get(severity);
        if (value != null) {
            return value;
        }
        return severityMultipliers.getOrDefault(fallbackSeverity, 1.0);
    }

    /**
     * Multiplier for karmic debt created by a demerit of the given severity.
     * The debt tiers stop at "major", so "maha" resolves as "major".
     */
    public double debtMultiplier(String severity) {
        return multiplier(MAHA_SEVERITY.equals(severity) ? "major" : severity);
    }

    /**
     * Returns the static weight of a corrective practice, 1.0 when the practice is not configured.
     */
    public double practiceWeight(String practice) {
        CorrectivePractice cp = correctivePractices.get(practice);
        return cp == null ? 1.0 : cp.weight();
    }

    public double meritWeight(String tokenKey) {
        return meritWeights.getOrDefault(tokenKey, 0.0);
    }

    public double tokenWeight(String tokenKey) {
        return tokenWeights.getOrDefault(tokenKey, 0.0);
    }

    private static <K, V> Map<K, V> copy(Map<K, V> source) {
        return source == null ? Map.of() : Map.copyOf(source);
    }

    /**
     * Demerit action: severity tier plus base value before intensity scaling.
     */
    public record PaapAction(String severity, double base) {
    }

    /**
     * Meritorious action: base value, credited token and stability class.
     */
    public record RewardRule(double value, String token, Stability stability) {

        public RewardRule {
            stability = stability == null ? Stability.VOLATILE : stability;
        }

        public boolean isStable() {
            return stability == Stability.STABLE;
        }
    }

    public enum Stability {
        STABLE,
        VOLATILE
    }

    /**
     * Fractions used to split an impact across the karma buckets.
     */
    public record Distribution(double sanchita, double prarabdha, double dridha, double adridha) {
        public static final Distribution NONE = new Distribution(0.0, 0.0, 0.0, 0.0);
    }

    /**
     * Weights applied to Dridha/Adridha balances in the net karma roll-up.
     */
    public record NetWeights(double dridha, double adridha) {
    }

    public record PurusharthaRule(double modifier, Set<String> positiveActions, Set<String> negativeActions) {

        public PurusharthaRule {
            positiveActions = positiveActions == null ? Set.of() : Set.copyOf(positiveActions);
            negativeActions = negativeActions == null ? Set.of() : Set.copyOf(negativeActions);
        }
    }

    public record CorrectivePractice(double weight, String description) {
    }

    public record RoleTier(String role, double minMerit) {
    }

    /**
     * Trigger thresholds for the corrective guidance rules.
     */
    public record GuidanceThresholds(
            double highNegativeImpact,
            double lowPositiveImpact,
            double spiritualGrowthImpact,
            double highPaapTotal,
            double lowDharmaPoints,
            double lowSevaPoints,
            double highPunyaTokens,
            double volatileDridhaRatio,
            double stableDridhaRatio,
            double karmicDebt) {

        public static final GuidanceThresholds DEFAULTS =
                new GuidanceThresholds(10.0, 5.0, 15.0, 20.0, 10.0, 15.0, 50.0, 0.3, 0.7, 30.0);
    }
}
