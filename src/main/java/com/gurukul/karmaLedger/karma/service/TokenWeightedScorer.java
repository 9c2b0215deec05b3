package com.gurukul.karmaLedger.karma.service;

import com.gurukul.karmaLedger.config.KarmaConfig;
import com.gurukul.karmaLedger.karma.model.BalanceSheet;
import com.gurukul.karmaLedger.karma.model.DebtRecord;
import com.gurukul.karmaLedger.karma.model.TokenKind;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Default weighting: each bucket times its configured token weight.
 * Demerit and debt buckets are severity-weighted before the token weight applies.
 */
@Service
@RequiredArgsConstructor
public class TokenWeightedScorer implements KarmaWeighting {

    private final KarmaConfig karmaConfig;

    @Override
    public double weightedScore(BalanceSheet sheet) {
        if (sheet == null) {
            return 0.0;
        }
        double paap = 0.0;
        for (Map.Entry<String, Double> tier : sheet.getPaapTokens().entrySet()) {
            paap += tier.getValue() * karmaConfig.multiplier(tier.getKey());
        }
        double debt = 0.0;
        for (DebtRecord entry : sheet.getRnanubandhan()) {
            debt += entry.getAmount() * karmaConfig.multiplier(entry.getSeverity());
        }
        return sheet.getDharmaPoints() * weight(TokenKind.DHARMA_POINTS)
                + sheet.getSevaPoints() * weight(TokenKind.SEVA_POINTS)
                + sheet.getPunyaTokens() * weight(TokenKind.PUNYA_TOKENS)
                + paap * weight(TokenKind.PAAP_TOKENS)
                + sheet.getDridhaKarma() * weight(TokenKind.DRIDHA_KARMA)
                + sheet.getAdridhaKarma() * weight(TokenKind.ADRIDHA_KARMA)
                + sheet.getSanchitaKarma() * weight(TokenKind.SANCHITA_KARMA)
                + sheet.getPrarabdhaKarma() * weight(TokenKind.PRARABDHA_KARMA)
                + debt * weight(TokenKind.RNANUBANDHAN);
    }

    private double weight(TokenKind kind) {
        return karmaConfig.tokenWeight(kind.key());
    }
}
