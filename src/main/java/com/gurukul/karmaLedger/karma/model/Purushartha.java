package com.gurukul.karmaLedger.karma.model;

/**
 * The four life-goal categories used as an action-alignment axis.
 */
public enum Purushartha {
    DHARMA("Dharma"),
    ARTHA("Artha"),
    KAMA("Kama"),
    MOKSHA("Moksha");

    private final String label;

    Purushartha(String label) {
        this.label = label;
    }

    /**
     * Label used as the key in the configuration tables.
     */
    public String label() {
        return label;
    }
}
