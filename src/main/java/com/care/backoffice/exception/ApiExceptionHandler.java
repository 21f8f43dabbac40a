package com.care.backoffice.exception;

import com.care.backoffice.dto.ErrorResponse;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns every failure into {@code {"error": ..., "details": [{field, message}]}}.
 * Client errors are logged at WARN, server errors at ERROR with the stack trace.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    static final String VALIDATION_FAILED = "Validation failed.";
    static final String INVALID_JSON = "Invalid JSON payload.";

    private final ConflictTranslator conflictTranslator;

    public ApiExceptionHandler(ConflictTranslator conflictTranslator) {
        this.conflictTranslator = conflictTranslator;
    }

    @ExceptionHandler(BackofficeException.class)
    public ResponseEntity<ErrorResponse> handleBackoffice(BackofficeException ex, HttpServletRequest request) {
        return respond(ex, request);
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleIntegrity(DataIntegrityViolationException ex, HttpServletRequest request) {
        return respond(conflictTranslator.translate(ex), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalid(MethodArgumentNotValidException ex, HttpServletRequest request) {
        List<FieldError> details = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> new FieldError(fieldName(e.getField()), e.getDefaultMessage()))
                .toList();
        log.warn("{} {} -> 400 {}", request.getMethod(), request.getRequestURI(), details);
        return ResponseEntity.badRequest().body(new ErrorResponse(VALIDATION_FAILED, details));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.warn("{} {} -> 400 unreadable body: {}", request.getMethod(), request.getRequestURI(), ex.getMostSpecificCause().getMessage());
        if (ex.getCause() instanceof JsonMappingException mapping && !mapping.getPath().isEmpty()) {
            String field = mapping.getPath().stream()
                    .map(ref -> ref.getFieldName() != null ? ref.getFieldName() : String.valueOf(ref.getIndex()))
                    .collect(Collectors.joining("."));
            String message = mapping instanceof InvalidFormatException ? "Invalid value" : "Invalid input";
            return ResponseEntity.badRequest()
                    .body(new ErrorResponse(VALIDATION_FAILED, List.of(new FieldError(field, message))));
        }
        return ResponseEntity.badRequest().body(ErrorResponse.of(INVALID_JSON));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        log.warn("{} {} -> 400 bad parameter {}", request.getMethod(), request.getRequestURI(), ex.getName());
        return ResponseEntity.badRequest()
                .body(new ErrorResponse(VALIDATION_FAILED, List.of(new FieldError(ex.getName(), "Invalid value"))));
    }

    @ExceptionHandler({MissingServletRequestPartException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponse> handleMissing(Exception ex, HttpServletRequest request) {
        String name = ex instanceof MissingServletRequestPartException part
                ? part.getRequestPartName()
                : ((MissingServletRequestParameterException) ex).getParameterName();
        log.warn("{} {} -> 400 missing {}", request.getMethod(), request.getRequestURI(), name);
        return ResponseEntity.badRequest()
                .body(new ErrorResponse(VALIDATION_FAILED, List.of(new FieldError(name, "Required"))));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleTooLarge(MaxUploadSizeExceededException ex, HttpServletRequest request) {
        log.warn("{} {} -> 413 upload over container limit", request.getMethod(), request.getRequestURI());
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE).body(ErrorResponse.of("File is too large."));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethod(HttpRequestMethodNotSupportedException ex) {
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED).body(ErrorResponse.of("Method not allowed"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        if (ex instanceof org.springframework.web.ErrorResponse framework && framework.getStatusCode().is4xxClientError()) {
            log.warn("{} {} -> {} {}", request.getMethod(), request.getRequestURI(), framework.getStatusCode().value(), ex.getMessage());
            String message = framework.getStatusCode().value() == 404 ? "Not found" : "Bad request";
            return ResponseEntity.status(framework.getStatusCode()).body(ErrorResponse.of(message));
        }
        log.error("{} {} -> 500", request.getMethod(), request.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.of("Internal server error"));
    }

    private static ResponseEntity<ErrorResponse> respond(BackofficeException ex, HttpServletRequest request) {
        HttpStatus status = ex.getStatus();
        if (status.is5xxServerError()) {
            log.error("{} {} -> {} {}", request.getMethod(), request.getRequestURI(), status.value(), ex.getMessage(), ex);
        } else {
            log.warn("{} {} -> {} {} {}", request.getMethod(), request.getRequestURI(), status.value(), ex.getMessage(), ex.getDetails());
        }
        return ResponseEntity.status(status).body(new ErrorResponse(ex.getMessage(), ex.getDetails()));
    }

    // "images[2]" reports as "images"
    private static String fieldName(String path) {
        int bracket = path.indexOf('[');
        return bracket > 0 ? path.substring(0, bracket) : path;
    }
}
