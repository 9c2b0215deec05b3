package com.gurukul.karmaLedger.karma.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Reinforcement-learning reward adjusted by the karmic evaluation of an action.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AdaptedReward {

    private String action;
    private double baseReward;

    /**
     * net_karma / 100, or 0 when net karma is exactly zero.
     */
    private double karmicFactor;

    private double adjustedReward;

    /**
     * Weighted merit of the current balances, used to pick the next role.
     */
    private double merit;

    private String nextRole;
}
