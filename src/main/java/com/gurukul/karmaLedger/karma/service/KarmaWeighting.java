package com.gurukul.karmaLedger.karma.service;

import com.gurukul.karmaLedger.karma.model.BalanceSheet;

/**
 * Produces the weighted karma score reported next to the net karma scalar.
 */
public interface KarmaWeighting {

    double weightedScore(BalanceSheet sheet);
}
