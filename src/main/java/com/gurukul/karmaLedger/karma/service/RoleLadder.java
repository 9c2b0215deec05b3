package com.gurukul.karmaLedger.karma.service;

import com.gurukul.karmaLedger.config.KarmaConfig;
import com.gurukul.karmaLedger.config.KarmaConfig.RoleTier;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Step function from merit score to role.
 * The highest tier whose minimum merit is reached wins; merit below every tier
 * (including NaN) maps to the first tier.
 */
@Service
@RequiredArgsConstructor
public class RoleLadder {

    private final KarmaConfig karmaConfig;

    public String roleFor(double merit) {
        String role = karmaConfig.roleLadder().get(0).role();
        double reached = Double.NEGATIVE_INFINITY;
        for (RoleTier tier : karmaConfig.roleLadder()) {
            if (merit >= tier.minMerit() && tier.minMerit() >= reached) {
                role = tier.role();
                reached = tier.minMerit();
            }
        }
        return role;
    }
}
