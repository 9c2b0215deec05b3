package com.gurukul.karmaLedger.karma.service;

import com.gurukul.karmaLedger.config.KarmaConfig;
import com.gurukul.karmaLedger.config.KarmaConfig.GuidanceThresholds;
import com.gurukul.karmaLedger.karma.model.ActionEvaluation;
import com.gurukul.karmaLedger.karma.model.BalanceSheet;
import com.gurukul.karmaLedger.karma.model.CorrectiveRecommendation;
import com.gurukul.karmaLedger.karma.model.Purushartha;
import com.gurukul.karmaLedger.karma.model.Urgency;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Rule-based corrective guidance.
 *
 * Responsibilities:
 * - Match a single action evaluation against the per-action rules
 * - Match a whole balance sheet against the profile rules, including the
 *   Dridha ratio and karmic debt signals
 * - Rank matches by static practice weight, then urgency
 *
 * Rules are evaluated in a fixed order and the sort is stable, so two matches with
 * the same weight and urgency keep their encounter order. There is no cap on the
 * number of recommendations returned.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CorrectiveGuidanceRecommender {

    static final String TAP = "Tap";
    static final String SEVA = "Seva";
    static final String MEDITATION = "Meditation";
    static final String BHAKTI = "Bhakti";
    static final String DAILY_PRACTICE = "Daily Practice";
    static final String ADVANCED_PRACTICE = "Advanced Practice";
    static final String ATONEMENT = "Atonement";

    static final Comparator<CorrectiveRecommendation> RANKING =
            Comparator.comparingDouble(CorrectiveRecommendation::getWeight)
                    .thenComparingInt(r -> r.getUrgency() == null ? 0 : r.getUrgency().rank())
                    .reversed();

    private final KarmaConfig karmaConfig;
    private final KarmicSignals karmicSignals;
    private final NetKarmaAggregator netKarmaAggregator;

    /**
     * Recommendations for one evaluated action.
     *
     * @param evaluation evaluation produced by the karma evaluator (recommendations not yet set)
     * @param sheet balance sheet the action was evaluated against
     * @return ranked recommendations, possibly empty
     */
    public List<CorrectiveRecommendation> recommendForAction(ActionEvaluation evaluation, BalanceSheet sheet) {
        GuidanceThresholds t = karmaConfig.guidanceThresholds();
        List<CorrectiveRecommendation> matches = new ArrayList<>();

        if (evaluation.getNegativeImpact() > t.highNegativeImpact()) {
            add(matches, TAP, "High negative karma requires austerity to balance", Urgency.HIGH);
        }
        if (evaluation.getPositiveImpact() < t.lowPositiveImpact()) {
            add(matches, SEVA, "Increase positive karma through selfless service", Urgency.MEDIUM);
        }
        if (evaluation.getPurusharthaAlignment() != null
                && evaluation.getPurusharthaAlignment().get(Purushartha.KAMA) < 0) {
            add(matches, MEDITATION, "Balance desires through mindfulness practice", Urgency.MEDIUM);
        }
        if (evaluation.getPositiveImpact() > t.spiritualGrowthImpact()) {
            add(matches, BHAKTI, "Channel positive energy into devotional practice", Urgency.LOW);
        }

        return rank(matches);
    }

    /**
     * Recommendations for a user's overall karma profile.
     *
     * @param sheet balance sheet to profile
     * @return ranked recommendations, possibly empty
     */
    public List<CorrectiveRecommendation> recommendForSheet(BalanceSheet sheet) {
        BalanceSheet balances = sheet == null ? BalanceSheet.EMPTY : sheet;
        GuidanceThresholds t = karmaConfig.guidanceThresholds();
        double netKarma = netKarmaAggregator.aggregate(balances).getNetKarma();
        double dridhaRatio = karmicSignals.dridhaRatio(balances);
        double totalDebt = karmicSignals.totalDebt(balances);

        List<CorrectiveRecommendation> matches = new ArrayList<>();

        if (netKarma < 0) {
            add(matches, SEVA, "Overall negative karma balance, focus on selfless service", Urgency.HIGH);
        }
        if (balances.totalPaap() > t.highPaapTotal()) {
            add(matches, TAP, "High accumulation of negative actions, practice austerity", Urgency.HIGH);
        }
        if (balances.getDharmaPoints() < t.lowDharmaPoints()) {
            add(matches, MEDITATION, "Low dharmic foundation, strengthen through meditation", Urgency.MEDIUM);
        }
        if (balances.getSevaPoints() < t.lowSevaPoints()) {
            add(matches, SEVA, "Insufficient service to others, increase seva activities", Urgency.MEDIUM);
        }
        if (balances.getPunyaTokens() > t.highPunyaTokens()) {
            add(matches, BHAKTI, "Strong positive karma foundation, channel into devotional practice", Urgency.LOW);
        }
        if (dridhaRatio < t.volatileDridhaRatio()) {
            add(matches, DAILY_PRACTICE, "Unstable karma patterns detected, establish daily spiritual practices",
                    Urgency.HIGH);
        } else if (dridhaRatio > t.stableDridhaRatio()) {
            add(matches, ADVANCED_PRACTICE, "Stable karma patterns detected, ready for advanced spiritual practices",
                    Urgency.MEDIUM);
        }
        if (totalDebt > t.karmicDebt()) {
            add(matches, ATONEMENT, "Significant karmic debt detected, prioritize atonement practices", Urgency.HIGH);
        }

        log.debug("Sheet guidance - netKarma: {}, dridhaRatio: {}, totalDebt: {}, matches: {}",
                netKarma, dridhaRatio, totalDebt, matches.size());
        return rank(matches);
    }

    /**
     * Sorts by weight descending, then urgency descending; stable beyond that.
     */
    static List<CorrectiveRecommendation> rank(List<CorrectiveRecommendation> matches) {
        List<CorrectiveRecommendation> ranked = new ArrayList<>(matches);
        ranked.sort(RANKING);
        return ranked;
    }

    private void add(List<CorrectiveRecommendation> matches, String practice, String reason, Urgency urgency) {
        if (!karmaConfig.correctivePractices().containsKey(practice)) {
            // unconfigured practices are never recommended
            return;
        }
        matches.add(CorrectiveRecommendation.builder()
                .practice(practice)
                .reason(reason)
                .urgency(urgency)
                .weight(karmaConfig.practiceWeight(practice))
                .build());
    }
}
