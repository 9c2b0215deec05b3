package com.gurukul.karmaLedger.karma.service;

import com.gurukul.karmaLedger.config.KarmaConfig;
import com.gurukul.karmaLedger.config.KarmaConfig.Distribution;
import com.gurukul.karmaLedger.config.KarmaConfig.PaapAction;
import com.gurukul.karmaLedger.config.KarmaConfig.PurusharthaRule;
import com.gurukul.karmaLedger.config.KarmaConfig.RewardRule;
import com.gurukul.karmaLedger.karma.model.ActionClass;
import com.gurukul.karmaLedger.karma.model.ActionEvaluation;
import com.gurukul.karmaLedger.karma.model.BalanceSheet;
import com.gurukul.karmaLedger.karma.model.Purushartha;
import com.gurukul.karmaLedger.karma.model.PurusharthaVector;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Karma evaluator - maps (balance sheet, action, intensity) to the karmic impact of the action.
 *
 * Workflow:
 * CLASSIFY (demerit table -> reward map -> default) -> SPLIT IMPACT INTO BUCKETS
 * -> PURUSHARTHA ALIGNMENT -> NET KARMA -> CORRECTIVE GUIDANCE
 *
 * The evaluator is total and pure: any action string, including empty, unknown or
 * null, yields a well-formed evaluation, and nothing is written anywhere. Callers
 * apply the returned deltas to their own store and record the event in the ledger.
 *
 * Intensity is applied as given, without clamping.
 */
@Service
@RequiredArgsConstructor
public class KarmaEvaluator {

    public static final double DEFAULT_INTENSITY = 1.0;

    private final KarmaConfig karmaConfig;
    private final CorrectiveGuidanceRecommender recommender;

    public ActionEvaluation evaluate(BalanceSheet sheet, String action) {
        return evaluate(sheet, action, DEFAULT_INTENSITY);
    }

    /**
     * Evaluates the karmic impact of an action.
     *
     * @param sheet current balances (read only); null is treated as an empty sheet
     * @param action action name; null is treated as the empty string
     * @param intensity multiplier applied to the action's base value
     * @return complete evaluation including ranked corrective recommendations
     */
    public ActionEvaluation evaluate(BalanceSheet sheet, String action, double intensity) {
        BalanceSheet balances = sheet == null ? BalanceSheet.EMPTY : sheet;
        String actionName = action == null ? "" : action;

        ActionEvaluation evaluation = ActionEvaluation.builder()
                .action(actionName)
                .intensity(intensity)
                .build();

        PaapAction paap = karmaConfig.paapActions().get(actionName);
        RewardRule reward = karmaConfig.rewardMap().get(actionName);
        if (paap != null) {
            applyDemerit(evaluation, paap, intensity);
        } else if (reward != null) {
            applyMerit(evaluation, reward, intensity);
        } else {
            applyDefault(evaluation, intensity);
        }

        evaluation.setPurusharthaAlignment(alignment(actionName));
        evaluation.setNetKarma((evaluation.getPositiveImpact() - evaluation.getNegativeImpact()) * intensity);
        evaluation.setCorrectiveRecommendations(recommender.recommendForAction(evaluation, balances));
        return evaluation;
    }

    private void applyDemerit(ActionEvaluation evaluation, PaapAction paap, double intensity) {
        double negativeImpact = paap.base() * intensity;
        evaluation.setClassification(ActionClass.DEMERIT);
        evaluation.setSeverity(paap.severity());
        evaluation.setNegativeImpact(negativeImpact);
        evaluation.setRnanubandhanDelta(negativeImpact * karmaConfig.debtMultiplier(paap.severity()));
        evaluation.setAdridhaDelta(-negativeImpact * karmaConfig.negativeDistribution().adridha());
    }

    private void applyMerit(ActionEvaluation evaluation, RewardRule reward, double intensity) {
        double positiveImpact = reward.value() * intensity;
        Distribution split = karmaConfig.positiveDistribution();
        evaluation.setClassification(ActionClass.MERIT);
        evaluation.setPositiveImpact(positiveImpact);
        evaluation.setSanchitaDelta(positiveImpact * split.sanchita());
        evaluation.setPrarabdhaDelta(positiveImpact * split.prarabdha());
        if (reward.isStable()) {
            evaluation.setDridhaDelta(positiveImpact * split.dridha());
        } else {
            evaluation.setAdridhaDelta(positiveImpact * split.adridha());
        }
    }

    private void applyDefault(ActionEvaluation evaluation, double intensity) {
        double positiveImpact = karmaConfig.defaultRewardValue() * intensity;
        Distribution split = karmaConfig.defaultDistribution();
        evaluation.setClassification(ActionClass.UNKNOWN);
        evaluation.setPositiveImpact(positiveImpact);
        evaluation.setSanchitaDelta(positiveImpact * split.sanchita());
        evaluation.setPrarabdhaDelta(positiveImpact * split.prarabdha());
        evaluation.setDridhaDelta(positiveImpact * split.dridha());
        evaluation.setAdridhaDelta(positiveImpact * split.adridha());
    }

    private PurusharthaVector alignment(String action) {
        return PurusharthaVector.builder()
                .dharma(component(Purushartha.DHARMA, action))
                .artha(component(Purushartha.ARTHA, action))
                .kama(component(Purushartha.KAMA, action))
                .moksha(component(Purushartha.MOKSHA, action))
                .build();
    }

    private double component(Purushartha category, String action) {
        PurusharthaRule rule = karmaConfig.purushartha().get(category.label());
        if (rule == null) {
            return 0.0;
        }
        if (rule.positiveActions().contains(action)) {
            return rule.modifier();
        }
        if (rule.negativeActions().contains(action)) {
            return -rule.modifier();
        }
        return 0.0;
    }
}
