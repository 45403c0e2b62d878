package com.leadscoring.controller;

import com.leadscoring.exception.EngineException;
import com.leadscoring.exception.IntegrationNotFoundException;
import com.leadscoring.exception.ProspectNotFoundException;
import com.leadscoring.exception.SignalValidationException;
import com.leadscoring.exception.StageTransitionException;
import jakarta.persistence.OptimisticLockException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Maps engine and framework exceptions to {@link ErrorResponse}.
 *
 * <ul>
 *   <li>400: bean validation, {@link SignalValidationException}, bad arguments</li>
 *   <li>404: {@link ProspectNotFoundException}, {@link IntegrationNotFoundException}</li>
 *   <li>409: {@link StageTransitionException}, concurrent score updates</li>
 * </ul>
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationErrors(
            MethodArgumentNotValidException ex,
            HttpServletRequest request) {

        List<ErrorResponse.ValidationError> validationErrors = ex.getBindingResult()
            .getAllErrors()
            .stream()
            .map(error -> {
                String fieldName = error instanceof FieldError fieldError
                    ? fieldError.getField()
                    : error.getObjectName();
                Object rejectedValue = error instanceof FieldError fieldError
                    ? fieldError.getRejectedValue()
                    : null;

                return ErrorResponse.ValidationError.builder()
                    .field(fieldName)
                    .message(error.getDefaultMessage())
                    .rejectedValue(rejectedValue)
                    .build();
            })
            .collect(Collectors.toList());

        ErrorResponse errorResponse = baseResponse(HttpStatus.BAD_REQUEST, "Validation Failed",
                "Invalid request parameters", request)
            .validationErrors(validationErrors)
            .build();

        log.warn("Validation error: {} validation failures on {}", validationErrors.size(), request.getRequestURI());
        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler(SignalValidationException.class)
    public ResponseEntity<ErrorResponse> handleSignalValidation(
            SignalValidationException ex,
            HttpServletRequest request) {

        log.warn("Signal rejected by {} for {}: {}", ex.getComponent(), ex.getSubjectId(), ex.getMessage());
        return engineError(HttpStatus.BAD_REQUEST, "Invalid Signal", ex, request);
    }

    @ExceptionHandler({ProspectNotFoundException.class, IntegrationNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(
            EngineException ex,
            HttpServletRequest request) {

        log.warn("Not found in {}: {} on {}", ex.getComponent(), ex.getMessage(), request.getRequestURI());
        return engineError(HttpStatus.NOT_FOUND, "Not Found", ex, request);
    }

    @ExceptionHandler(StageTransitionException.class)
    public ResponseEntity<ErrorResponse> handleStageTransition(
            StageTransitionException ex,
            HttpServletRequest request) {

        log.warn("Stage move {} -> {} refused for {}: {}",
                 ex.getCurrentStage(), ex.getTargetStage(), ex.getSubjectId(), ex.getMessage());
        return engineError(HttpStatus.CONFLICT, "Invalid Stage Transition", ex, request);
    }

    @ExceptionHandler({OptimisticLockException.class, ObjectOptimisticLockingFailureException.class})
    public ResponseEntity<ErrorResponse> handleOptimisticLock(
            RuntimeException ex,
            HttpServletRequest request) {

        ErrorResponse errorResponse = baseResponse(HttpStatus.CONFLICT, "Concurrent Modification",
                "The prospect was recomputed by another request. Please retry.", request)
            .build();

        log.warn("Optimistic lock exception on {}", request.getRequestURI());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(errorResponse);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            IllegalArgumentException ex,
            HttpServletRequest request) {

        ErrorResponse errorResponse = baseResponse(HttpStatus.BAD_REQUEST, "Bad Request",
                "Invalid request: " + ex.getMessage(), request)
            .build();

        log.warn("Illegal argument: {} on {}", ex.getMessage(), request.getRequestURI());
        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            HttpServletRequest request) {

        ErrorResponse errorResponse = baseResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred", request)
            .build();

        log.error("Unhandled exception on {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    private ResponseEntity<ErrorResponse> engineError(HttpStatus status, String error, EngineException ex,
                                                      HttpServletRequest request) {
        ErrorResponse errorResponse = baseResponse(status, error, ex.getMessage(), request)
            .subjectId(ex.getSubjectId())
            .component(ex.getComponent())
            .build();
        return ResponseEntity.status(status).body(errorResponse);
    }

    private ErrorResponse.ErrorResponseBuilder baseResponse(HttpStatus status, String error, String message,
                                                            HttpServletRequest request) {
        return ErrorResponse.builder()
            .requestId(UUID.randomUUID())
            .timestamp(Instant.now())
            .status(status.value())
            .error(error)
            .message(message)
            .path(request.getRequestURI());
    }
}
