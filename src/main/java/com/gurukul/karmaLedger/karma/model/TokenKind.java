package com.gurukul.karmaLedger.karma.model;

/**
 * Named currencies of a balance sheet, keyed by the field names used in stored user documents.
 */
public enum TokenKind {
    DHARMA_POINTS("DharmaPoints"),
    SEVA_POINTS("SevaPoints"),
    PUNYA_TOKENS("PunyaTokens"),
    PAAP_TOKENS("PaapTokens"),
    DRIDHA_KARMA("DridhaKarma"),
    ADRIDHA_KARMA("AdridhaKarma"),
    SANCHITA_KARMA("SanchitaKarma"),
    PRARABDHA_KARMA("PrarabdhaKarma"),
    RNANUBANDHAN("Rnanubandhan");

    private final String key;

    TokenKind(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
