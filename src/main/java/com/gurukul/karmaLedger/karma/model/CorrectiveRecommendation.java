package com.gurukul.karmaLedger.karma.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A suggested remedial practice with its static weight.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CorrectiveRecommendation {

    private String practice;
    private String reason;
    private Urgency urgency;

    /**
     * Static weight from the corrective practice table; primary sort key.
     */
    private double weight;
}
