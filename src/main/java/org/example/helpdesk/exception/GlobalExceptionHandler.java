package org.example.helpdesk.exception;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.helpdesk.config.HelpdeskProperties;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.LocalDateTime;
import java.util.stream.Collectors;

/**
 * Global exception handler for the helpdesk API.
 *
 * <p>Business exceptions map to 400/404. Anything unexpected maps to 500 and only exposes
 * the exception message when {@code helpdesk.errors.include-details} is enabled.
 *
 * <p>No base package selector: unmatched routes have no handler and must reach this advice too.
 */
@Slf4j
@RestControllerAdvice
@Order(Ordered.HIGHEST_PRECEDENCE)
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    static final String GENERIC_MESSAGE = "Something went wrong";

    private final HelpdeskProperties properties;

    // ==================== SPRING MVC EXCEPTIONS ====================

    /**
     * Handles HttpMessageNotReadableException - thrown when the JSON body is malformed.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleHttpMessageNotReadable(
            HttpMessageNotReadableException ex, WebRequest request) {
        log.warn("❌ HTTP MESSAGE NOT READABLE - {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Bad Request",
                "Invalid request body. Please provide valid JSON.", request);
    }

    /**
     * Handles bean validation failures on bound form and JSON bodies.
     * MethodArgumentNotValidException is a BindException, so both land here.
     */
    @ExceptionHandler(BindException.class)
    public ResponseEntity<ErrorResponse> handleBindException(BindException ex, WebRequest request) {
        String message = "Validation failed: " + ex.getBindingResult().getAllErrors().stream()
                .map(error -> error instanceof FieldError fieldError
                        ? fieldError.getField() + " - " + fieldError.getDefaultMessage()
                        : error.getDefaultMessage())
                .sorted()
                .collect(Collectors.joining("; "));
        log.warn("❌ VALIDATION FAILED - {}", message);
        return build(HttpStatus.BAD_REQUEST, "Validation Error", message, request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentTypeMismatch(
            MethodArgumentTypeMismatchException ex, WebRequest request) {
        String message = String.format("Parameter '%s' should be of type '%s' but received '%s'",
                ex.getName(),
                ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "unknown",
                ex.getValue());
        log.warn("❌ TYPE MISMATCH - {}", message);
        return build(HttpStatus.BAD_REQUEST, "Type Mismatch", message, request);
    }

    /**
     * Handles uploads rejected by the servlet container before reaching a controller.
     */
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleMaxUploadSize(
            MaxUploadSizeExceededException ex, WebRequest request) {
        log.warn("❌ UPLOAD TOO LARGE - {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Invalid Attachment",
                "File too large. Maximum size is " + properties.upload().maxFileSizeLabel(), request);
    }

    @ExceptionHandler(MultipartException.class)
    public ResponseEntity<ErrorResponse> handleMultipart(MultipartException ex, WebRequest request) {
        log.warn("❌ MULTIPART ERROR - {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Bad Request", "Malformed multipart request", request);
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleHttpMediaTypeNotSupported(
            HttpMediaTypeNotSupportedException ex, WebRequest request) {
        String message = String.format("Content type '%s' is not supported. Supported types: %s",
                ex.getContentType(), ex.getSupportedMediaTypes());
        log.warn("❌ UNSUPPORTED MEDIA TYPE - {}", message);
        return build(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "Unsupported Media Type", message, request);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleHttpRequestMethodNotSupported(
            HttpRequestMethodNotSupportedException ex, WebRequest request) {
        String message = String.format("HTTP method '%s' is not supported for this endpoint", ex.getMethod());
        log.warn("❌ METHOD NOT ALLOWED - {}", message);
        return build(HttpStatus.METHOD_NOT_ALLOWED, "Method Not Allowed", message, request);
    }

    /**
     * Unmatched routes. Spring 6.1 reports them as NoResourceFoundException, older
     * setups with throw-exception-if-no-handler-found as NoHandlerFoundException.
     */
    @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
    public ResponseEntity<ErrorResponse> handleNoEndpoint(Exception ex, WebRequest request) {
        log.debug("No endpoint for {}", request.getDescription(false));
        return build(HttpStatus.NOT_FOUND, "Not Found", "Endpoint not found", request);
    }

    // ==================== BUSINESS EXCEPTIONS ====================

    @ExceptionHandler(TicketNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleTicketNotFound(
            TicketNotFoundException ex, WebRequest request) {
        log.warn("⚠️ TICKET NOT FOUND - {}", ex.getMessage());
        return build(HttpStatus.NOT_FOUND, "Ticket Not Found", ex.getMessage(), request);
    }

    @ExceptionHandler(TicketValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(
            TicketValidationException ex, WebRequest request) {
        log.warn("❌ VALIDATION FAILED - {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Validation Error", ex.getMessage(), request);
    }

    @ExceptionHandler(InvalidAttachmentException.class)
    public ResponseEntity<ErrorResponse> handleInvalidAttachment(
            InvalidAttachmentException ex, WebRequest request) {
        log.warn("❌ INVALID ATTACHMENT ({}) - {}", ex.getReason(), ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Invalid Attachment", ex.getMessage(), request);
    }

    // ==================== SYSTEM EXCEPTIONS ====================

    /**
     * Fallback for everything else.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAllExceptions(Exception ex, WebRequest request) {
        log.error("💥 UNHANDLED EXCEPTION - {}", ex.getMessage(), ex);
        String message = properties.errors().includeDetails() && ex.getMessage() != null
                ? ex.getMessage()
                : GENERIC_MESSAGE;
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", message, request);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String error, String message,
                                                WebRequest request) {
        ErrorResponse body = new ErrorResponse(
                LocalDateTime.now(),
                status.value(),
                error,
                message,
                request.getDescription(false));
        return new ResponseEntity<>(body, status);
    }
}
