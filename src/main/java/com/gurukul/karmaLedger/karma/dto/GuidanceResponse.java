package com.gurukul.karmaLedger.karma.dto;

import com.gurukul.karmaLedger.karma.model.CorrectiveRecommendation;
import com.gurukul.karmaLedger.karma.model.Purushartha;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Whole-sheet guidance together with the signals the rules were matched on.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GuidanceResponse {

    private double netKarma;
    private double dridhaRatio;
    private double totalDebt;
    private Map<Purushartha, Double> purusharthaScores;
    private List<CorrectiveRecommendation> recommendations;
}
