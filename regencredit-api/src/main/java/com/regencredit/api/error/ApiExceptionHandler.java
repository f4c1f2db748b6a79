package com.regencredit.api.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.regencredit.core.error.ConfigurationException;
import com.regencredit.core.error.ConsistencyViolationException;
import com.regencredit.core.error.PreconditionViolationException;
import com.regencredit.core.error.ReasonCode;
import com.regencredit.core.error.TemporalGateException;
import com.regencredit.core.ledger.LedgerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Maps protocol rejections to HTTP responses. The body carries the reason code so
 * clients can branch on it; temporal gates also report the block at which the call
 * becomes possible.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    private static final Set<ReasonCode> NOT_FOUND = EnumSet.of(
            ReasonCode.INSPECTION_NOT_FOUND,
            ReasonCode.RESOURCE_NOT_FOUND,
            ReasonCode.DELATION_NOT_FOUND);

    @ExceptionHandler(PreconditionViolationException.class)
    public ResponseEntity<ErrorResponse> handlePrecondition(PreconditionViolationException e) {
        HttpStatus status;
        if (NOT_FOUND.contains(e.getReason())) {
            status = HttpStatus.NOT_FOUND;
        } else if (e.getReason() == ReasonCode.PROTOCOL_NOT_RUNNING) {
            status = HttpStatus.SERVICE_UNAVAILABLE;
        } else {
            status = HttpStatus.CONFLICT;
        }
        return ResponseEntity.status(status)
            .body(new ErrorResponse(e.getReason().name(), e.getMessage(), null));
    }

    @ExceptionHandler(TemporalGateException.class)
    public ResponseEntity<ErrorResponse> handleTemporalGate(TemporalGateException e) {
        return ResponseEntity.status(HttpStatus.TOO_EARLY)
            .body(new ErrorResponse(e.getReason().name(), e.getMessage(), e.getAvailableAtBlock()));
    }

    @ExceptionHandler(ConsistencyViolationException.class)
    public ResponseEntity<ErrorResponse> handleConsistency(ConsistencyViolationException e) {
        log.error("Protocol bookkeeping violation: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse(e.getReason().name(), e.getMessage(), null));
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleConfiguration(ConfigurationException e) {
        log.error("Protocol configuration error: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse(e.getReason().name(), e.getMessage(), null));
    }

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ErrorResponse> handleLedger(LedgerException e) {
        log.error("Token ledger failure: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
            .body(new ErrorResponse("LEDGER_FAILURE", e.getMessage(), null));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException e) {
        String fields = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(new ErrorResponse("INVALID_REQUEST", fields, null));
    }

    @ExceptionHandler({MissingRequestHeaderException.class, MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(new ErrorResponse("INVALID_REQUEST", e.getMessage(), null));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorResponse(String code, String message, Long availableAtBlock) {}
}
