package com.gurukul.karmaLedger.karma.controller;

import com.gurukul.karmaLedger.karma.exception.UserNotFoundException;
import com.gurukul.karmaLedger.ledger.exception.InvalidLedgerQueryException;
import com.gurukul.karmaLedger.ledger.service.KarmaChainLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Global exception handler for the REST API.
 * Validation and unexpected errors are also recorded in the ledger.
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final KarmaChainLogger karmaChainLogger;

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException ex,
                                                                   WebRequest request) {
        FieldError fieldError = ex.getBindingResult().getFieldErrors().stream().findFirst().orElse(null);
        String field = fieldError == null ? "request" : fieldError.getField();
        String message = fieldError == null ? "Validation failed" : field + ": " + fieldError.getDefaultMessage();

        log.warn("Validation error: {}", message);
        karmaChainLogger.logValidationError(requestId(request), "invalid_field", field, message, null);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("VALIDATION_ERROR", message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex, WebRequest request) {
        log.warn("Malformed request body: {}", ex.getMostSpecificCause().getMessage());
        karmaChainLogger.logValidationError(requestId(request), "malformed_body", "body",
                "Request body could not be parsed", null);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("VALIDATION_ERROR", "Request body could not be parsed"));
    }

    @ExceptionHandler(InvalidLedgerQueryException.class)
    public ResponseEntity<ErrorResponse> handleInvalidLedgerQuery(InvalidLedgerQueryException ex) {
        log.warn("Invalid ledger query: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("VALIDATION_ERROR", ex.getMessage()));
    }

    @ExceptionHandler(UserNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleUserNotFound(UserNotFoundException ex) {
        log.warn("User not found: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("USER_NOT_FOUND", ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, WebRequest request) {
        log.error("Unexpected error", ex);
        karmaChainLogger.logSystemError(requestId(request), ex.getClass().getSimpleName(),
                String.valueOf(ex.getMessage()), stackTrace(ex), null);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("INTERNAL_ERROR", "An unexpected error occurred"));
    }

    private static String requestId(WebRequest request) {
        return request == null ? null : request.getHeader(KarmaController.REQUEST_ID_HEADER);
    }

    private static String stackTrace(Throwable ex) {
        StringWriter writer = new StringWriter();
        ex.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }

    record ErrorResponse(String code, String message) {}
}
