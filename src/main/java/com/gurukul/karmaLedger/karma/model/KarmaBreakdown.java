package com.gurukul.karmaLedger.karma.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-bucket components of a net karma roll-up.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class KarmaBreakdown {

    private double positiveKarma;
    private double negativeKarma;
    private double dridhaKarma;
    private double adridhaKarma;
    private double sanchitaKarma;
    private double prarabdhaKarma;

    /**
     * Multiplier-weighted Rnanubandhan total.
     */
    private double rnanubandhan;
}
