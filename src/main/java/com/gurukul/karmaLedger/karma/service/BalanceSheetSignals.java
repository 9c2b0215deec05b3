package com.gurukul.karmaLedger.karma.service;

import com.gurukul.karmaLedger.karma.model.BalanceSheet;
import org.springframework.stereotype.Service;

/**
 * Computes guidance signals directly from the balance sheet.
 */
@Service
public class BalanceSheetSignals implements KarmicSignals {

    /**
     * Ratio reported when the sheet carries no Dridha/Adridha karma at all.
     */
    static final double NEUTRAL_RATIO = 0.5;

    @Override
    public double dridhaRatio(BalanceSheet sheet) {
        if (sheet == null) {
            return NEUTRAL_RATIO;
        }
        double dridha = Math.abs(sheet.getDridhaKarma());
        double adridha = Math.abs(sheet.getAdridhaKarma());
        double total = dridha + adridha;
        if (total == 0.0) {
            return NEUTRAL_RATIO;
        }
        return dridha / total;
    }

    @Override
    public double totalDebt(BalanceSheet sheet) {
        return sheet == null ? 0.0 : sheet.totalDebt();
    }
}
