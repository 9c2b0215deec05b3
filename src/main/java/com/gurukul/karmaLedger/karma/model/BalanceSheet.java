package com.gurukul.karmaLedger.karma.model;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only snapshot of a user's token balances, normalized once at the boundary.
 *
 * Stored user documents are loosely shaped: buckets may be missing, hold numeric
 * strings, or (for Rnanubandhan) be a severity map, a list of records or a legacy
 * scalar. {@link #from(Map)} folds all of these into one canonical form so that
 * scoring code never branches on shape:
 * - missing or non-numeric scalar buckets read as 0
 * - PaapTokens become a severity -> amount map, non-numeric tiers are dropped
 * - Rnanubandhan becomes a list of {@link DebtRecord}, poison entries are dropped
 *
 * The sheet is owned by the external persistence layer; this type is never mutated.
 */
@Value
@Builder(toBuilder = true)
public class BalanceSheet {

    public static final BalanceSheet EMPTY = BalanceSheet.builder().build();

    static final String DEFAULT_DEBT_SEVERITY = "major";

    double dharmaPoints;
    double sevaPoints;
    double punyaTokens;

    @Builder.Default
    Map<String, Double> paapTokens = Map.of();

    double dridhaKarma;
    double adridhaKarma;
    double sanchitaKarma;
    double prarabdhaKarma;

    @Builder.Default
    List<DebtRecord> rnanubandhan = List.of();

    /**
     * Normalizes a raw balances map (for example a BSON document's "balances" field).
     *
     * @param balances token-kind -> number or nested structure; may be null
     * @return canonical balance sheet, {@link #EMPTY} for null input
     */
    public static BalanceSheet from(Map<String, ?> balances) {
        if (balances == null || balances.isEmpty()) {
            return EMPTY;
        }
        return BalanceSheet.builder()
                .dharmaPoints(scalar(balances.get(TokenKind.DHARMA_POINTS.key())))
                .sevaPoints(scalar(balances.get(TokenKind.SEVA_POINTS.key())))
                .punyaTokens(scalar(balances.get(TokenKind.PUNYA_TOKENS.key())))
                .paapTokens(severityMap(balances.get(TokenKind.PAAP_TOKENS.key())))
                .dridhaKarma(scalar(balances.get(TokenKind.DRIDHA_KARMA.key())))
                .adridhaKarma(scalar(balances.get(TokenKind.ADRIDHA_KARMA.key())))
                .sanchitaKarma(scalar(balances.get(TokenKind.SANCHITA_KARMA.key())))
                .prarabdhaKarma(scalar(balances.get(TokenKind.PRARABDHA_KARMA.key())))
                .rnanubandhan(debtRecords(balances.get(TokenKind.RNANUBANDHAN.key())))
                .build();
    }

    /**
     * Normalizes a whole user document, reading balances from its "balances" field.
     */
    public static BalanceSheet fromUserDocument(Map<String, ?> userDocument) {
        if (userDocument == null) {
            return EMPTY;
        }
        Object balances = userDocument.get("balances");
        if (balances instanceof Map<?, ?> map) {
            return from(stringKeyed(map));
        }
        return EMPTY;
    }

    /**
     * Sum of all PaapTokens tiers, unweighted.
     */
    public double totalPaap() {
        return paapTokens.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    /**
     * Sum of all Rnanubandhan amounts, unweighted.
     */
    public double totalDebt() {
        return rnanubandhan.stream().mapToDouble(DebtRecord::getAmount).sum();
    }

    /**
     * Parses a balance value leniently. Returns null for anything that is not a
     * finite number or a numeric string.
     */
    static Double parseAmount(Object value) {
        double parsed;
        if (value instanceof Number number) {
            parsed = number.doubleValue();
        } else if (value instanceof String text) {
            try {
                parsed = Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return Double.isFinite(parsed) ? parsed : null;
    }

    private static double scalar(Object value) {
        Double parsed = parseAmount(value);
        return parsed == null ? 0.0 : parsed;
    }

    private static Map<String, Double> severityMap(Object value) {
        if (!(value instanceof Map<?, ?> raw)) {
            return Map.of();
        }
        Map<String, Double> tiers = new LinkedHashMap<>();
        raw.forEach((severity, amount) -> {
            Double parsed = parseAmount(amount);
            if (severity != null && parsed != null) {
                tiers.put(severity.toString(), parsed);
            }
        });
        return Collections.unmodifiableMap(tiers);
    }

    private static List<DebtRecord> debtRecords(Object value) {
        if (value == null) {
            return List.of();
        }
        List<DebtRecord> records = new ArrayList<>();
        if (value instanceof Map<?, ?> bySeverity) {
            bySeverity.forEach((severity, amount) -> {
                Double parsed = parseAmount(amount);
                if (parsed != null) {
                    records.add(DebtRecord.of(severity == null ? DEFAULT_DEBT_SEVERITY : severity.toString(), parsed));
                }
            });
        } else if (value instanceof List<?> entries) {
            for (Object entry : entries) {
                if (entry instanceof Map<?, ?> debt) {
                    Object severity = debt.get("severity");
                    Object amount = debt.containsKey("amount") ? debt.get("amount") : 0;
                    Double parsed = parseAmount(amount);
                    if (parsed != null) {
                        records.add(DebtRecord.of(severity == null ? DEFAULT_DEBT_SEVERITY : severity.toString(), parsed));
                    }
                } else {
                    // bare numbers in the list are legacy amounts
                    Double parsed = parseAmount(entry);
                    if (parsed != null) {
                        records.add(DebtRecord.of(DEFAULT_DEBT_SEVERITY, parsed));
                    }
                }
            }
        } else {
            Double parsed = parseAmount(value);
            if (parsed != null) {
                records.add(DebtRecord.of(DEFAULT_DEBT_SEVERITY, parsed));
            }
        }
        return List.copyOf(records);
    }

    private static Map<String, Object> stringKeyed(Map<?, ?> raw) {
        Map<String, Object> copy = new LinkedHashMap<>();
        raw.forEach((k, v) -> {
            if (k != null) {
                copy.put(k.toString(), v);
            }
        });
        return copy;
    }
}
