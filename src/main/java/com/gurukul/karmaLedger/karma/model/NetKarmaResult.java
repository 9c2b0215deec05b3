package com.gurukul.karmaLedger.karma.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class NetKarmaResult {

    private double netKarma;
    private double weightedScore;
    private KarmaBreakdown breakdown;
}
