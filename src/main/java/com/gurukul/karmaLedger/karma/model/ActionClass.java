package com.gurukul.karmaLedger.karma.model;

public enum ActionClass {
    /** Found in the reward map. */
    MERIT,
    /** Found in the Paap action table. */
    DEMERIT,
    /** Neither; scored with the default reward. */
    UNKNOWN
}
