package com.gurukul.karmaLedger.karma.service;

import com.gurukul.karmaLedger.config.KarmaConfig;
import com.gurukul.karmaLedger.karma.model.ActionEvaluation;
import com.gurukul.karmaLedger.karma.model.AdaptedReward;
import com.gurukul.karmaLedger.karma.model.BalanceSheet;
import com.gurukul.karmaLedger.karma.model.TokenKind;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Adjusts a Q-learning reward by the karmic evaluation of the action and picks the next role.
 *
 * adjusted = base * (1 + net_karma / 100); the next role comes from the weighted merit
 * of the current balances (Dharma, Seva, Punya) run through the role ladder.
 */
@Service
@RequiredArgsConstructor
public class RewardAdapter {

    private final KarmaConfig karmaConfig;
    private final KarmaEvaluator karmaEvaluator;
    private final RoleLadder roleLadder;

    public AdaptedReward adapt(BalanceSheet sheet, String action, double baseReward) {
        BalanceSheet balances = sheet == null ? BalanceSheet.EMPTY : sheet;
        ActionEvaluation evaluation = karmaEvaluator.evaluate(balances, action);

        double netKarma = evaluation.getNetKarma();
        double karmicFactor = netKarma != 0 ? netKarma / 100.0 : 0.0;
        double adjustedReward = baseReward * (1 + karmicFactor);

        double merit = merit(balances);

        return AdaptedReward.builder()
                .action(evaluation.getAction())
                .baseReward(baseReward)
                .karmicFactor(karmicFactor)
                .adjustedReward(adjustedReward)
                .merit(merit)
                .nextRole(roleLadder.roleFor(merit))
                .build();
    }

    /**
     * Weighted merit of the current balances: Dharma, Seva and Punya times their merit weights.
     */
    public double merit(BalanceSheet sheet) {
        BalanceSheet balances = sheet == null ? BalanceSheet.EMPTY : sheet;
        return balances.getDharmaPoints() * karmaConfig.meritWeight(TokenKind.DHARMA_POINTS.key())
                + balances.getSevaPoints() * karmaConfig.meritWeight(TokenKind.SEVA_POINTS.key())
                + balances.getPunyaTokens() * karmaConfig.meritWeight(TokenKind.PUNYA_TOKENS.key());
    }
}
