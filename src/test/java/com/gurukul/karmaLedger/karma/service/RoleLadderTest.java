package com.gurukul.karmaLedger.karma.service;

import com.gurukul.karmaLedger.config.KarmaConfigLoader;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class RoleLadderTest {

    private final RoleLadder roleLadder = new RoleLadder(KarmaConfigLoader.load(KarmaConfigLoader.DEFAULT_RESOURCE));

    @Test
    void meritMapsToHighestTierReached() {
        assertEquals("learner", roleLadder.roleFor(0));
        assertEquals("learner", roleLadder.roleFor(99.9));
        assertEquals("volunteer", roleLadder.roleFor(100));
        assertEquals("mentor", roleLadder.roleFor(250));
        assertEquals("guru", roleLadder.roleFor(10_000));
    }

    @Test
    void meritBelowEveryTierMapsToFirstTier() {
        assertEquals("learner", roleLadder.roleFor(-5));
        assertEquals("learner", roleLadder.roleFor(Double.NaN));
    }
}
