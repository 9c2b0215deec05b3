package com.gurukul.karmaLedger.ledger.service;

import com.gurukul.karmaLedger.ledger.model.LedgerEntry;
import com.gurukul.karmaLedger.ledger.model.LedgerEventType;
import com.gurukul.karmaLedger.ledger.model.LedgerLevel;
import com.gurukul.karmaLedger.ledger.model.LedgerRecordRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Typed entry points over {@link LedgerLogger}, one per event type.
 * Each method fixes the component, level and payload shape for its event.
 */
@Service
@RequiredArgsConstructor
public class KarmaChainLogger {

    private final LedgerLogger ledgerLogger;

    public Optional<LedgerEntry> logApiRequest(String requestId, String method, String path,
                                               String userId, String sessionId, Map<String, Object> requestData) {
        return ledgerLogger.record(LedgerRecordRequest.builder()
                .eventType(LedgerEventType.API_REQUEST)
                .component("api")
                .requestId(requestId)
                .userId(userId)
                .sessionId(sessionId)
                .message("API Request: " + method + " " + path)
                .data(payload("method", method, "path", path, "request_data", requestData))
                .build());
    }

    public Optional<LedgerEntry> logApiResponse(String requestId, int statusCode, Duration responseTime,
                                                Map<String, Object> responseData) {
        double responseTimeMs = responseTime == null ? 0.0 : responseTime.toNanos() / 1_000_000.0;
        return ledgerLogger.record(LedgerRecordRequest.builder()
                .eventType(LedgerEventType.API_RESPONSE)
                .component("api")
                .requestId(requestId)
                .message("API Response: " + statusCode)
                .data(payload("status_code", statusCode, "response_data", responseData))
                .performanceMetrics(payload("response_time_ms", responseTimeMs, "status_code", statusCode))
                .build());
    }

    public Optional<LedgerEntry> logValidationError(String requestId, String errorType, String field,
                                                    String errorMessage, String userId) {
        return ledgerLogger.record(LedgerRecordRequest.builder()
                .eventType(LedgerEventType.VALIDATION_ERROR)
                .component("validation")
                .requestId(requestId)
                .userId(userId)
                .message("Validation failed: " + errorMessage)
                .data(payload("error_type", errorType, "field", field, "error_message", errorMessage))
                .build());
    }

    public Optional<LedgerEntry> logKarmaAction(String requestId, String userId, String action, double karmaImpact,
                                                String role, String intent, Map<String, Object> additionalData) {
        return ledgerLogger.record(LedgerRecordRequest.builder()
                .eventType(LedgerEventType.KARMA_ACTION)
                .component("karma_engine")
                .requestId(requestId)
                .userId(userId)
                .message("Karma action logged: " + action)
                .data(payload("action", action, "karma_impact", karmaImpact, "role", role,
                        "intent", intent, "additional_data", additionalData))
                .build());
    }

    /**
     * Records an atonement outcome. Failed atonements are logged at ERROR and are not
     * counted as completions.
     */
    public Optional<LedgerEntry> logAtonement(String requestId, String userId, String planId, String atonementType,
                                              double karmaAdjustment, double paapReduction, boolean success) {
        return ledgerLogger.record(LedgerRecordRequest.builder()
                .eventType(LedgerEventType.ATONEMENT)
                .level(success ? LedgerLevel.INFO : LedgerLevel.ERROR)
                .component("atonement")
                .requestId(requestId)
                .userId(userId)
                .message("Atonement " + (success ? "completed" : "failed") + ": " + atonementType)
                .data(payload("plan_id", planId, "atonement_type", atonementType,
                        "karma_adjustment", karmaAdjustment, "paap_reduction", paapReduction, "success", success))
                .build());
    }

    public Optional<LedgerEntry> logSystemError(String requestId, String errorType, String errorMessage,
                                                String stackTrace, String userId) {
        return ledgerLogger.record(LedgerRecordRequest.builder()
                .eventType(LedgerEventType.SYSTEM_ERROR)
                .component("system")
                .requestId(requestId)
                .userId(userId)
                .message("System error: " + errorMessage)
                .data(payload("error_type", errorType, "error_message", errorMessage))
                .errorDetails(payload("stack_trace", stackTrace))
                .build());
    }

    /**
     * Records a security event; "low" and "medium" severities are WARNING, anything else ERROR.
     */
    public Optional<LedgerEntry> logSecurityEvent(String requestId, String securityEventType, String description,
                                                  String severity, String userId, Map<String, Object> additionalData) {
        String resolvedSeverity = severity == null ? "medium" : severity;
        LedgerLevel level = "low".equals(resolvedSeverity) || "medium".equals(resolvedSeverity)
                ? LedgerLevel.WARNING : LedgerLevel.ERROR;
        return ledgerLogger.record(LedgerRecordRequest.builder()
                .eventType(LedgerEventType.SECURITY_EVENT)
                .level(level)
                .component("security")
                .requestId(requestId)
                .userId(userId)
                .message("Security event: " + description)
                .data(payload("event_type", securityEventType, "description", description,
                        "severity", resolvedSeverity, "additional_data", additionalData))
                .build());
    }

    public Optional<LedgerEntry> logPerformanceMetric(String requestId, String metricName, double value,
                                                      String unit, String userId) {
        String resolvedUnit = unit == null ? "ms" : unit;
        return ledgerLogger.record(LedgerRecordRequest.builder()
                .eventType(LedgerEventType.PERFORMANCE_METRIC)
                .component("performance")
                .requestId(requestId)
                .userId(userId)
                .message("Performance metric: " + metricName + " = " + value + " " + resolvedUnit)
                .data(payload("metric_name", metricName, "value", value, "unit", resolvedUnit))
                .performanceMetrics(payload("metric_name", metricName, "value", value, "unit", resolvedUnit))
                .build());
    }

    // Map.of rejects null values, optional payload fields are kept as explicit nulls
    private static Map<String, Object> payload(Object... keyValues) {
        Map<String, Object> payload = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            payload.put((String) keyValues[i], keyValues[i + 1]);
        }
        return payload;
    }
}
