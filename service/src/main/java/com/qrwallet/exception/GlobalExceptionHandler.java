package com.qrwallet.exception;

import com.qrwallet.api.model.ErrorCode;
import com.qrwallet.api.response.ErrorResponse;
import com.qrwallet.error.WalletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(WalletException.class)
    public ResponseEntity<ErrorResponse> handleWalletException(WalletException ex, HttpServletRequest request) {
        return respond(ex.getCode(), ex.getMessage(), ex.getDetails(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            fields.put(fieldError.getField(), fieldError.getDefaultMessage());
        }
        return respond(ErrorCode.SYSTEM_VALIDATION_FAILED, null, Map.of("fields", fields), request);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(ConstraintViolationException ex, HttpServletRequest request) {
        Map<String, Object> fields = new LinkedHashMap<>();
        ex.getConstraintViolations().forEach(violation ->
                fields.put(violation.getPropertyPath().toString(), violation.getMessage()));
        return respond(ErrorCode.SYSTEM_VALIDATION_FAILED, null, Map.of("fields", fields), request);
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MissingRequestHeaderException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        log.debug("Malformed request [path={}]: {}", request.getRequestURI(), ex.getMessage());
        return respond(ErrorCode.SYSTEM_VALIDATION_FAILED, null, null, request);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(
            HttpRequestMethodNotSupportedException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Method not allowed [correlationId={}]: method={}, path={}",
                correlationId, ex.getMethod(), request.getRequestURI());

        ErrorResponse error = ErrorResponse.of(
                ErrorCode.SYSTEM_VALIDATION_FAILED.name(),
                "method-not-allowed",
                "Method Not Allowed",
                null,
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Unexpected error [correlationId={}]", correlationId, ex);
        return respond(ErrorCode.SYSTEM_INTERNAL_ERROR, null, null, request);
    }

    private ResponseEntity<ErrorResponse> respond(ErrorCode code, String message, Map<String, Object> details,
                                                  HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        String effectiveMessage = message != null ? message : code.defaultMessage();

        log.error("Application error [correlationId={}]: errorCode={}, message={}, details={}, timestamp={}",
                correlationId, code, effectiveMessage, details, Instant.now());

        ErrorResponse error = ErrorResponse.of(
                code.name(),
                code.transportStatus().wireName(),
                effectiveMessage,
                details,
                request.getRequestURI()
        );
        return ResponseEntity.status(code.transportStatus().httpStatus()).body(error);
    }
}
