package com.strata.hierarchy.infrastructure.web;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.strata.database.session.SessionBindingException;
import com.strata.hierarchy.api.dto.ErrorResponse;
import com.strata.hierarchy.domain.ConflictException;
import com.strata.hierarchy.domain.ForbiddenException;
import com.strata.hierarchy.domain.HierarchyException;
import com.strata.hierarchy.domain.NotFoundException;
import com.strata.hierarchy.domain.UnauthenticatedException;
import com.strata.hierarchy.domain.ValidationFailedException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps exceptions to the failure envelope {@code {"success": false, "error", "error_code", ...}}.
 *
 * <table>
 *   <caption>Status mapping</caption>
 *   <tr><td>validation failures</td><td>422</td></tr>
 *   <tr><td>missing or malformed identity</td><td>401</td></tr>
 *   <tr><td>insufficient role</td><td>403</td></tr>
 *   <tr><td>invisible or missing entity</td><td>404</td></tr>
 *   <tr><td>invariant violations and duplicates</td><td>409</td></tr>
 *   <tr><td>malformed requests</td><td>400</td></tr>
 *   <tr><td>anything else</td><td>500, logged with its stack trace</td></tr>
 * </table>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final PropertyNamingStrategies.SnakeCaseStrategy SNAKE_CASE =
            new PropertyNamingStrategies.SnakeCaseStrategy();

    @ExceptionHandler(ValidationFailedException.class)
    public ResponseEntity<ErrorResponse> handleValidationFailed(ValidationFailedException ex) {
        log.debug("Validation failed: {}", ex.fieldErrors());
        return validationFailure(ex.messages(), ex.fieldErrors());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex) {
        var fieldErrors = new LinkedHashMap<String, List<String>>();
        ex.getBindingResult()
                .getFieldErrors()
                .forEach(
                        fe ->
                                fieldErrors
                                        .computeIfAbsent(
                                                SNAKE_CASE.translate(fe.getField()),
                                                f -> new ArrayList<>())
                                        .add(fe.getDefaultMessage()));
        log.debug("Request body rejected: {}", fieldErrors);
        var messages = new ArrayList<String>();
        fieldErrors.forEach((field, list) -> list.forEach(m -> messages.add(field + " " + m)));
        return validationFailure(messages, fieldErrors);
    }

    @ExceptionHandler(UnauthenticatedException.class)
    public ResponseEntity<ErrorResponse> handleUnauthenticated(UnauthenticatedException ex) {
        return failure(HttpStatus.UNAUTHORIZED, ex);
    }

    @ExceptionHandler(SessionBindingException.class)
    public ResponseEntity<ErrorResponse> handleSessionBinding(SessionBindingException ex) {
        log.warn("Rejected identity: {}", ex.problems());
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(ErrorResponse.of("unauthenticated", "Invalid identity"));
    }

    @ExceptionHandler(ForbiddenException.class)
    public ResponseEntity<ErrorResponse> handleForbidden(ForbiddenException ex) {
        return failure(HttpStatus.FORBIDDEN, ex);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException ex) {
        return failure(HttpStatus.NOT_FOUND, ex);
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflict(ConflictException ex) {
        log.info("Conflict: {}", ex.getMessage());
        return failure(HttpStatus.CONFLICT, ex);
    }

    @ExceptionHandler(DuplicateKeyException.class)
    public ResponseEntity<ErrorResponse> handleDuplicateKey(DuplicateKeyException ex) {
        log.warn("Duplicate key: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ErrorResponse.of("conflict", "The request conflicts with existing data"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        log.debug("Bad request: {}", ex.getMessage());
        return badRequest(ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        log.debug("Unreadable request body: {}", ex.getMessage());
        return badRequest("Malformed request body");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return badRequest(ex.getName() + " is malformed");
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(
            MissingServletRequestParameterException ex) {
        return badRequest(ex.getParameterName() + " is required");
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoRoute(NoResourceFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ErrorResponse.of("not_found", "No route for " + ex.getResourcePath()));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(
            HttpRequestMethodNotSupportedException ex) {
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED)
                .body(ErrorResponse.of("method_not_allowed", ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of("internal_error", "An unexpected error occurred"));
    }

    private static ResponseEntity<ErrorResponse> failure(
            HttpStatus status, HierarchyException ex) {
        return ResponseEntity.status(status).body(ErrorResponse.of(ex.errorCode(), ex.getMessage()));
    }

    private static ResponseEntity<ErrorResponse> badRequest(String message) {
        return ResponseEntity.badRequest().body(ErrorResponse.of("bad_request", message));
    }

    private static ResponseEntity<ErrorResponse> validationFailure(
            List<String> messages, Map<String, List<String>> fieldErrors) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(ErrorResponse.validation("Validation failed", messages, fieldErrors));
    }
}
