package com.cuttlefish.backend.exception;

import com.cuttlefish.backend.dto.ApiError;
import com.cuttlefish.backend.dto.ApiErrorDetail;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        List<ApiErrorDetail> details = ex.getBindingResult().getFieldErrors().stream()
                .map(this::toDetail)
                .collect(Collectors.toList());
        return buildError(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Validation failed", details, request, ex);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraint(ConstraintViolationException ex, HttpServletRequest request) {
        List<ApiErrorDetail> details = ex.getConstraintViolations().stream()
                .map(violation -> ApiErrorDetail.builder()
                        .field(violation.getPropertyPath().toString())
                        .issue(violation.getMessage())
                        .build())
                .collect(Collectors.toList());
        return buildError(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Validation failed", details, request, ex);
    }

    @ExceptionHandler({BadRequestException.class, PredictionDecodeException.class})
    public ResponseEntity<ApiError> handleBadRequest(RuntimeException ex, HttpServletRequest request) {
        return buildError(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage(), List.of(), request, ex);
    }

    @ExceptionHandler({MissingRequestHeaderException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ApiError> handleUnreadable(Exception ex, HttpServletRequest request) {
        return buildError(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage(), List.of(), request, ex);
    }

    @ExceptionHandler(AuthenticationException.class)
    public ResponseEntity<ApiError> handleAuthentication(AuthenticationException ex, HttpServletRequest request) {
        return buildError(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED", ex.getMessage(), List.of(), request, ex);
    }

    @ExceptionHandler(UnauthorizedActorException.class)
    public ResponseEntity<ApiError> handleUnauthorized(UnauthorizedActorException ex, HttpServletRequest request) {
        return buildError(HttpStatus.FORBIDDEN, "MISSING_CAPABILITY_" + ex.getCapability(), ex.getMessage(), List.of(),
                request, ex);
    }

    @ExceptionHandler(ReentrantCallException.class)
    public ResponseEntity<ApiError> handleReentrant(ReentrantCallException ex, HttpServletRequest request) {
        return buildError(HttpStatus.CONFLICT, "REENTRANT_CALL", ex.getMessage(), List.of(), request, ex);
    }

    @ExceptionHandler(TradeRejectedException.class)
    public ResponseEntity<ApiError> handleRejected(TradeRejectedException ex, HttpServletRequest request) {
        return buildError(HttpStatus.UNPROCESSABLE_ENTITY, ex.getReason().name(), ex.getMessage(), List.of(), request, ex);
    }

    @ExceptionHandler(CustodyExecutionException.class)
    public ResponseEntity<ApiError> handleCustody(CustodyExecutionException ex, HttpServletRequest request) {
        return buildError(HttpStatus.BAD_GATEWAY, "CUSTODY_EXECUTION_FAILED", ex.getReason(), List.of(), request, ex);
    }

    @ExceptionHandler(TradingException.class)
    public ResponseEntity<ApiError> handleTrading(TradingException ex, HttpServletRequest request) {
        return buildError(HttpStatus.UNPROCESSABLE_ENTITY, "TRADING_ERROR", ex.getMessage(), List.of(), request, ex);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unhandled error on {} {}", request.getMethod(), request.getRequestURI(), ex);
        return buildError(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error", List.of(), request, ex);
    }

    private ApiErrorDetail toDetail(FieldError error) {
        return ApiErrorDetail.builder()
                .field(error.getField())
                .issue(error.getDefaultMessage())
                .build();
    }

    private ResponseEntity<ApiError> buildError(HttpStatus status, String errorCode, String message,
                                                List<ApiErrorDetail> details, HttpServletRequest request, Exception ex) {
        ApiError error = ApiError.builder()
                .timestamp(Instant.now())
                .path(request.getRequestURI())
                .status(status.value())
                .error(status.getReasonPhrase())
                .errorCode(errorCode)
                .message(message)
                .requestId(MDC.get("requestId"))
                .correlationId(MDC.get("correlationId"))
                .details(details)
                .build();
        log.warn("{} {} -> {} {} {}", request.getMethod(), request.getRequestURI(), status.value(), errorCode, message);
        return ResponseEntity.status(status).body(error);
    }
}
