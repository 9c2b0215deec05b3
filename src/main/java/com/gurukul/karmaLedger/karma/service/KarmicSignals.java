package com.gurukul.karmaLedger.karma.service;

import com.gurukul.karmaLedger.karma.model.BalanceSheet;

/**
 * Derived signals folded into whole-sheet corrective guidance.
 */
public interface KarmicSignals {

    /**
     * Fraction of committed (Dridha) karma among Dridha + Adridha, in [0, 1].
     */
    double dridhaRatio(BalanceSheet sheet);

    /**
     * Total outstanding karmic debt (unweighted Rnanubandhan amounts).
     */
    double totalDebt(BalanceSheet sheet);
}
