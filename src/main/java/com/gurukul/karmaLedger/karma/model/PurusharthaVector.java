package com.gurukul.karmaLedger.karma.model;

import lombok.Builder;
import lombok.Value;

/**
 * Signed alignment of an action with each Purushartha category.
 * Each component is +modifier, -modifier or 0.
 */
@Value
@Builder
public class PurusharthaVector {

    double dharma;
    double artha;
    double kama;
    double moksha;

    public double get(Purushartha category) {
        return switch (category) {
            case DHARMA -> dharma;
            case ARTHA -> artha;
            case KAMA -> kama;
            case MOKSHA -> moksha;
        };
    }
}
