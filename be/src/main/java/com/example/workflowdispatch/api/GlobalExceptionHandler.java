package com.example.workflowdispatch.api;

import com.example.workflowdispatch.domain.InvalidTransitionException;
import com.example.workflowdispatch.queue.PublishException;
import com.example.workflowdispatch.store.DispatchAlreadyExistsException;
import com.example.workflowdispatch.store.StoreTimeoutException;
import com.example.workflowdispatch.validation.ValidationError;
import com.example.workflowdispatch.validation.WorkflowGraphValidationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Central exception handling for the REST API.
 * <p>
 * Maps exceptions to HTTP status and {@link ErrorResponse} body: validation → 400, unknown
 * or malformed dispatch id and unknown node → 404, status regression → 409, queue or store failure → 503.
 * No stack traces in responses.
 * </p>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(DispatchNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleDispatchNotFound(DispatchNotFoundException ex) {
        log.warn("Dispatch not found: {}", ex.getDispatchId());
        return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("Dispatch not found: " + ex.getDispatchId()));
    }

    @ExceptionHandler(NodeNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNodeNotFound(NodeNotFoundException ex) {
        log.warn("Node not found: dispatchId={} nodeId={}", ex.getDispatchId(), ex.getNodeId());
        return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse(ex.getMessage()));
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidTransition(InvalidTransitionException ex) {
        log.warn("Rejected node update: nodeId={} {} -> {}", ex.getNodeId(), ex.getFrom(), ex.getTo());
        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(new ErrorResponse(ex.getMessage()));
    }

    @ExceptionHandler(WorkflowGraphValidationException.class)
    public ResponseEntity<ErrorResponse> handleGraphValidation(WorkflowGraphValidationException ex) {
        log.warn("Workflow graph validation failed: {} errors={}", ex.getMessage(), ex.getErrors().size());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.withErrors(ex.getMessage(), ex.getErrors()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleBeanValidation(MethodArgumentNotValidException ex) {
        List<ValidationError> errors = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> new ValidationError(fe.getField(), fe.getDefaultMessage() != null ? fe.getDefaultMessage() : "invalid"))
                .collect(Collectors.toList());
        log.warn("Bean validation failed: {} field errors", errors.size());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.withErrors("Validation failed", errors));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Malformed request body: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("Malformed request body"));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        if (ex.getRequiredType() == UUID.class) {
            log.warn("Dispatch not found: malformed id {}", ex.getValue());
            return ResponseEntity
                    .status(HttpStatus.NOT_FOUND)
                    .body(new ErrorResponse("Dispatch not found: " + ex.getValue()));
        }
        log.warn("Invalid path parameter {}: {}", ex.getName(), ex.getValue());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("Invalid value for " + ex.getName() + ": " + ex.getValue()));
    }

    @ExceptionHandler(PublishException.class)
    public ResponseEntity<ErrorResponse> handlePublishFailure(PublishException ex) {
        log.error("Dispatch not enqueued: dispatchId={} {}", ex.getDispatchId(), ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse("Dispatch could not be enqueued; retry later"));
    }

    @ExceptionHandler(StoreTimeoutException.class)
    public ResponseEntity<ErrorResponse> handleStoreTimeout(StoreTimeoutException ex) {
        log.error("Result store unavailable: dispatchId={} {}", ex.getDispatchId(), ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse("Result store unavailable; retry later"));
    }

    @ExceptionHandler(DispatchAlreadyExistsException.class)
    public ResponseEntity<ErrorResponse> handleIdCollision(DispatchAlreadyExistsException ex) {
        log.error("Dispatch id collision persisted after retry: {}", ex.getDispatchId());
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("Could not allocate a dispatch id"));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResourceFound(NoResourceFoundException ex) {
        log.debug("Resource not found: {}", ex.getResourcePath());
        return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("Not found: " + ex.getResourcePath()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
        log.error("Unhandled error: {}", ex.getMessage(), ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("An internal error occurred"));
    }
}
