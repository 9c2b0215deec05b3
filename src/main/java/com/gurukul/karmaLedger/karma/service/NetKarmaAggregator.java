package com.gurukul.karmaLedger.karma.service;

import com.gurukul.karmaLedger.config.KarmaConfig;
import com.gurukul.karmaLedger.karma.model.BalanceSheet;
import com.gurukul.karmaLedger.karma.model.DebtRecord;
import com.gurukul.karmaLedger.karma.model.KarmaBreakdown;
import com.gurukul.karmaLedger.karma.model.NetKarmaResult;
import com.gurukul.karmaLedger.karma.model.Purushartha;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;

/**
 * Rolls a whole balance sheet up into a single net karma scalar.
 *
 * net = positive - negative + dridha * w_d + adridha * w_a + sanchita + prarabdha - rnanubandhan
 *
 * where positive is the unweighted sum of the merit tokens, negative is the
 * severity-weighted PaapTokens total and rnanubandhan is the severity-weighted debt
 * total. Shape tolerance lives in {@link BalanceSheet#from}, so this never throws.
 */
@Service
@RequiredArgsConstructor
public class NetKarmaAggregator {

    private final KarmaConfig karmaConfig;
    private final KarmaWeighting karmaWeighting;

    public NetKarmaResult aggregate(BalanceSheet sheet) {
        BalanceSheet balances = sheet == null ? BalanceSheet.EMPTY : sheet;

        double positiveKarma = balances.getDharmaPoints() + balances.getSevaPoints() + balances.getPunyaTokens();

        double negativeKarma = 0.0;
        for (Map.Entry<String, Double> tier : balances.getPaapTokens().entrySet()) {
            negativeKarma += tier.getValue() * karmaConfig.multiplier(tier.getKey());
        }

        double rnanubandhanTotal = weightedDebt(balances);

        KarmaConfig.NetWeights weights = karmaConfig.netWeights();
        double netKarma = positiveKarma
                - negativeKarma
                + balances.getDridhaKarma() * weights.dridha()
                + balances.getAdridhaKarma() * weights.adridha()
                + balances.getSanchitaKarma()
                + balances.getPrarabdhaKarma()
                - rnanubandhanTotal;

        return NetKarmaResult.builder()
                .netKarma(netKarma)
                .weightedScore(karmaWeighting.weightedScore(balances))
                .breakdown(KarmaBreakdown.builder()
                        .positiveKarma(positiveKarma)
                        .negativeKarma(negativeKarma)
                        .dridhaKarma(balances.getDridhaKarma())
                        .adridhaKarma(balances.getAdridhaKarma())
                        .sanchitaKarma(balances.getSanchitaKarma())
                        .prarabdhaKarma(balances.getPrarabdhaKarma())
                        .rnanubandhan(rnanubandhanTotal)
                        .build())
                .build();
    }

    /**
     * Severity-weighted Rnanubandhan total; unknown severities use the fallback multiplier.
     */
    public double weightedDebt(BalanceSheet sheet) {
        double total = 0.0;
        for (DebtRecord debt : sheet.getRnanubandhan()) {
            total += debt.getAmount() * karmaConfig.multiplier(debt.getSeverity());
        }
        return total;
    }

    /**
     * Purushartha scores derived from merit balances, each scaled by its category modifier.
     */
    public Map<Purushartha, Double> purusharthaScores(BalanceSheet sheet) {
        BalanceSheet balances = sheet == null ? BalanceSheet.EMPTY : sheet;
        double dharma = balances.getDharmaPoints();
        double seva = balances.getSevaPoints();
        double punya = balances.getPunyaTokens();

        Map<Purushartha, Double> scores = new EnumMap<>(Purushartha.class);
        scores.put(Purushartha.DHARMA, dharma * 1.0 + seva * 0.5);
        scores.put(Purushartha.ARTHA, seva * 0.3 + punya * 0.2);
        scores.put(Purushartha.KAMA, seva * 0.4 + dharma * 0.2);
        scores.put(Purushartha.MOKSHA, dharma * 1.2 + punya * 0.8);

        scores.replaceAll((category, score) -> score * modifier(category));
        return scores;
    }

    private double modifier(Purushartha category) {
        KarmaConfig.PurusharthaRule rule = karmaConfig.purushartha().get(category.label());
        return rule == null ? 0.0 : rule.modifier();
    }
}
