package com.fintech.recurring.controller;

import com.fintech.recurring.dto.ApiError;
import com.fintech.recurring.exception.CollaboratorException;
import com.fintech.recurring.exception.DuplicateTemplateNameException;
import com.fintech.recurring.exception.GenerationInProgressException;
import com.fintech.recurring.exception.NotAuthorizedException;
import com.fintech.recurring.exception.TemplateNotFoundException;
import com.fintech.recurring.exception.TemplateValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps exceptions to {@link ApiError} responses.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(TemplateValidationException.class)
    public ResponseEntity<ApiError> handleValidation(TemplateValidationException ex) {
        log.debug("Template rejected: {}", ex.getMessage());
        return buildResponse(HttpStatus.BAD_REQUEST, ex.getMessage(), ex.getError().name());
    }

    @ExceptionHandler(NotAuthorizedException.class)
    public ResponseEntity<ApiError> handleNotAuthorized(NotAuthorizedException ex) {
        log.warn("Not authorized: {}", ex.getMessage());
        return buildResponse(HttpStatus.FORBIDDEN, ex.getMessage(), "NOT_AUTHORIZED");
    }

    @ExceptionHandler(TemplateNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(TemplateNotFoundException ex) {
        return buildResponse(HttpStatus.NOT_FOUND, ex.getMessage(), "TEMPLATE_NOT_FOUND");
    }

    @ExceptionHandler(DuplicateTemplateNameException.class)
    public ResponseEntity<ApiError> handleDuplicateName(DuplicateTemplateNameException ex) {
        return buildResponse(HttpStatus.CONFLICT, ex.getMessage(), "DUPLICATE_NAME");
    }

    @ExceptionHandler(GenerationInProgressException.class)
    public ResponseEntity<ApiError> handleInProgress(GenerationInProgressException ex) {
        return buildResponse(HttpStatus.CONFLICT, ex.getMessage(), "GENERATION_IN_PROGRESS");
    }

    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ApiError> handleConcurrentUpdate(ObjectOptimisticLockingFailureException ex) {
        log.warn("Concurrent template update: {}", ex.getMessage());
        return buildResponse(HttpStatus.CONFLICT, "template was modified concurrently, retry the request",
                "CONCURRENT_UPDATE");
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ApiError> handleDataIntegrity(DataIntegrityViolationException ex) {
        log.warn("Data integrity violation: {}", ex.getMostSpecificCause().getMessage());
        return buildResponse(HttpStatus.CONFLICT, "the operation violates data integrity constraints",
                "DATA_INTEGRITY_VIOLATION");
    }

    @ExceptionHandler(CollaboratorException.class)
    public ResponseEntity<ApiError> handleCollaborator(CollaboratorException ex) {
        log.error("{} collaborator error: {}", ex.getCollaborator(), ex.getMessage(), ex);
        return buildResponse(HttpStatus.BAD_GATEWAY, ex.getMessage(), "COLLABORATOR_ERROR");
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiError> handleMissingHeader(MissingRequestHeaderException ex) {
        return buildResponse(HttpStatus.BAD_REQUEST, ex.getHeaderName() + " header is required", "MISSING_HEADER");
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiError> handleUnreadable(Exception ex) {
        log.debug("Malformed request: {}", ex.getMessage());
        return buildResponse(HttpStatus.BAD_REQUEST, "malformed request", "MALFORMED_REQUEST");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        log.error("Unhandled exception: {}", ex.getMessage(), ex);
        return buildResponse(HttpStatus.INTERNAL_SERVER_ERROR, "an unexpected error occurred", "INTERNAL_ERROR");
    }

    private ResponseEntity<ApiError> buildResponse(HttpStatus status, String message, String code) {
        return ResponseEntity.status(status).body(ApiError.of(message, code));
    }
}
