package com.eyelevel.paperprocessor.exception.handler;

import com.eyelevel.paperprocessor.dto.common.ApiResponse;
import com.eyelevel.paperprocessor.exception.PaperProcessingException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Converts exceptions escaping the paper endpoints into {@link ApiResponse} bodies.
 * <p>
 * Pipeline stage errors normally travel inside a {@link com.eyelevel.paperprocessor.model.ProcessingResult};
 * only request-shape problems and faults outside a pipeline run end up here.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String INVALID_INPUT = "Invalid input provided.";

    // --- 4xx Client Error Handlers ---

    /**
     * Request body is missing or is not valid JSON. (400 Bad Request)
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Object>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Rejected unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return respond(HttpStatus.BAD_REQUEST,
                ApiResponse.error("Malformed request body.", "The request body is missing or could not be parsed."));
    }

    /**
     * A {@code @Valid} request body failed bean validation, e.g. a blank paper ID or an empty batch. (400)
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Object>> handleInvalidBody(MethodArgumentNotValidException ex) {
        String fields = ex.getBindingResult().getFieldErrors().stream()
                .map(GlobalExceptionHandler::describe)
                .collect(Collectors.joining(", "));
        log.warn("Rejected request body: {}", fields);
        return respond(HttpStatus.BAD_REQUEST, ApiResponse.error(INVALID_INPUT, "Validation failed: " + fields));
    }

    /**
     * Method-level validation failed, e.g. an invalid element inside the batch ID list. (400)
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiResponse<Object>> handleConstraintViolation(ConstraintViolationException ex) {
        String violations = ex.getConstraintViolations().stream()
                .map(GlobalExceptionHandler::describe)
                .collect(Collectors.joining(", "));
        log.warn("Rejected request parameters: {}", violations);
        return respond(HttpStatus.BAD_REQUEST, ApiResponse.error(INVALID_INPUT, "Validation failed: " + violations));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiResponse<Object>> handleMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        String message = String.format("Request method '%s' is not supported here.", ex.getMethod());
        log.warn(message);
        return respond(HttpStatus.METHOD_NOT_ALLOWED, ApiResponse.error("Method not allowed.", message));
    }

    // --- Pipeline faults outside a run ---

    /**
     * A pipeline exception thrown outside the stage boundary. Identifier problems are the caller's fault;
     * anything else is reported as a server error carrying the error type.
     */
    @ExceptionHandler(PaperProcessingException.class)
    public ResponseEntity<ApiResponse<Object>> handlePipelineException(PaperProcessingException ex) {
        return switch (ex.getErrorType()) {
            case VALIDATION -> {
                log.warn("Rejected paper request: {}", ex.getMessage());
                yield respond(HttpStatus.BAD_REQUEST, ApiResponse.error(ex.getMessage()));
            }
            default -> {
                log.error("Pipeline error outside a processing run ({}).", ex.getErrorType(), ex);
                yield respond(HttpStatus.INTERNAL_SERVER_ERROR,
                        ApiResponse.error("Paper processing failed.", ex.getErrorType() + ": " + ex.getMessage()));
            }
        };
    }

    /**
     * The pipeline worker pool and its queue are full. (503 Service Unavailable)
     */
    @ExceptionHandler(TaskRejectedException.class)
    public ResponseEntity<ApiResponse<Object>> handleCapacityExhausted(TaskRejectedException ex) {
        log.warn("Pipeline worker pool rejected work: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE,
                ApiResponse.error("Processing capacity exhausted. Please retry later."));
    }

    // --- 5xx Server Error Handlers ---

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Object>> handleUnexpected(Exception ex) {
        log.error("Unhandled exception in paper API", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR,
                ApiResponse.error("An unexpected internal error occurred.", ex.getClass().getSimpleName()));
    }

    private static ResponseEntity<ApiResponse<Object>> respond(HttpStatus status, ApiResponse<Object> body) {
        return new ResponseEntity<>(body.toBuilder().statusCode(status.value()).build(), status);
    }

    private static String describe(FieldError error) {
        return String.format("'%s': %s", error.getField(), error.getDefaultMessage());
    }

    private static String describe(ConstraintViolation<?> violation) {
        String path = violation.getPropertyPath().toString();
        return String.format("'%s': %s", path.substring(path.lastIndexOf('.') + 1), violation.getMessage());
    }
}
