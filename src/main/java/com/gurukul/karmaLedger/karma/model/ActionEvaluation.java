package com.gurukul.karmaLedger.karma.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Result of evaluating one action against a balance sheet.
 *
 * Ephemeral: nothing here is persisted by the engine. Callers apply the deltas to
 * their own store and record the event in the ledger separately.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ActionEvaluation {

    private String action;
    private double intensity;

    /**
     * How the action was classified (merit, demerit or unknown).
     */
    private ActionClass classification;

    /**
     * Severity tier for demerit actions, null otherwise.
     */
    private String severity;

    private double positiveImpact;
    private double negativeImpact;

    private double dridhaDelta;
    private double adridhaDelta;
    private double sanchitaDelta;
    private double prarabdhaDelta;
    private double rnanubandhanDelta;

    private PurusharthaVector purusharthaAlignment;

    /**
     * (positiveImpact - negativeImpact) * intensity.
     */
    private double netKarma;

    /**
     * Ranked by weight, then urgency.
     */
    private List<CorrectiveRecommendation> correctiveRecommendations;
}
