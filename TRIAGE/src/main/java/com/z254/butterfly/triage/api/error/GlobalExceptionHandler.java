package com.z254.butterfly.triage.api.error;

import com.z254.butterfly.triage.exception.GroupNotFoundException;
import com.z254.butterfly.triage.exception.InvalidAlertException;
import com.z254.butterfly.triage.exception.TriageValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.MessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.validation.method.ParameterValidationResult;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.server.ServerWebExchange;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String CORRELATION_HEADER = "X-Correlation-Id";

    private final Clock clock;

    public GlobalExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    private ApiError build(ErrorCode code, String msg, String cid, Map<String, Object> details) {
        return new ApiError(clock.instant(), code, msg, cid, details);
    }

    private String cid(ServerWebExchange exchange) {
        return exchange.getRequest().getHeaders().getFirst(CORRELATION_HEADER);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ApiError> handleBinding(WebExchangeBindException ex, ServerWebExchange exchange) {
        Map<String, Object> fieldErrors = new LinkedHashMap<>();
        for (FieldError error : ex.getFieldErrors()) {
            fieldErrors.put(error.getField(), String.valueOf(error.getDefaultMessage()));
        }
        return ResponseEntity.badRequest().body(
                build(ErrorCode.BAD_REQUEST, "Validation error", cid(exchange), Map.of("fieldErrors", fieldErrors))
        );
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ApiError> handleParameters(HandlerMethodValidationException ex, ServerWebExchange exchange) {
        Map<String, Object> parameterErrors = new LinkedHashMap<>();
        for (ParameterValidationResult result : ex.getAllValidationResults()) {
            parameterErrors.put(String.valueOf(result.getMethodParameter().getParameterName()),
                    result.getResolvableErrors().stream().map(MessageSourceResolvable::getDefaultMessage).toList());
        }
        return ResponseEntity.badRequest().body(
                build(ErrorCode.BAD_REQUEST, "Invalid request parameters", cid(exchange),
                        Map.of("parameterErrors", parameterErrors))
        );
    }

    @ExceptionHandler(InvalidAlertException.class)
    public ResponseEntity<ApiError> handleInvalidAlert(InvalidAlertException ex, ServerWebExchange exchange) {
        return ResponseEntity.badRequest().body(
                build(ErrorCode.INVALID_ALERT, ex.getMessage(), cid(exchange), Map.of("violations", ex.getViolations()))
        );
    }

    @ExceptionHandler(TriageValidationException.class)
    public ResponseEntity<ApiError> handleValidation(TriageValidationException ex, ServerWebExchange exchange) {
        return ResponseEntity.badRequest().body(
                build(ErrorCode.BAD_REQUEST, ex.getMessage(), cid(exchange), Map.of())
        );
    }

    @ExceptionHandler(GroupNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(GroupNotFoundException ex, ServerWebExchange exchange) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(
                build(ErrorCode.GROUP_NOT_FOUND, ex.getMessage(), cid(exchange), Map.of("groupId", ex.getGroupId()))
        );
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleAny(Exception ex, ServerWebExchange exchange) {
        log.error("Unhandled API error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(
                build(ErrorCode.INTERNAL_ERROR, ex.getMessage(), cid(exchange), Map.of())
        );
    }
}
