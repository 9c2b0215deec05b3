package com.gurukul.karmaLedger.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class UserIdMaskerTest {

    @Test
    void keepsTwoCharactersAtEachEnd() {
        assertEquals("te****01", UserIdMasker.mask("test_user_001"));
    }

    @Test
    void shortOrNullIdsAreFullyMasked() {
        assertEquals("****", UserIdMasker.mask("abcd"));
        assertEquals("****", UserIdMasker.mask(null));
    }
}
