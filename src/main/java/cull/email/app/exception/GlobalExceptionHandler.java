package cull.email.app.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.io.IOException;

/**
 * Maps rule configuration errors to HTTP responses.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler({RuleNotFoundException.class, LabelNotFoundInRulesException.class,
        NoLabelsFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(RetentionException ex, HttpServletRequest request) {
        log.warn("Not found: {}", ex.getMessage());
        return build(HttpStatus.NOT_FOUND, ex, request);
    }

    @ExceptionHandler(InvalidMessageAgeException.class)
    public ResponseEntity<ErrorResponse> handleInvalidAge(InvalidMessageAgeException ex, HttpServletRequest request) {
        log.warn("Invalid retention period ({}): {}", ex.getReason(), ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, ex, request);
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        log.warn("Bad request: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, ex, request);
    }

    @ExceptionHandler(RulePersistenceException.class)
    public ResponseEntity<ErrorResponse> handlePersistence(RulePersistenceException ex, HttpServletRequest request) {
        log.error("Rules file error: {}", ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, ex, request);
    }

    @ExceptionHandler(IOException.class)
    public ResponseEntity<ErrorResponse> handleGmail(IOException ex, HttpServletRequest request) {
        log.error("Gmail call failed: {}", ex.getMessage(), ex);
        return build(HttpStatus.BAD_GATEWAY, ex, request);
    }

    @ExceptionHandler(RetentionException.class)
    public ResponseEntity<ErrorResponse> handleRetention(RetentionException ex, HttpServletRequest request) {
        log.error("Retention error: {}", ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, ex, request);
    }

    private static ResponseEntity<ErrorResponse> build(HttpStatus status, Exception ex, HttpServletRequest request) {
        ErrorResponse error = ErrorResponse.builder()
            .errorType(ex.getClass().getSimpleName())
            .message(ex.getMessage())
            .status(status.value())
            .path(request.getRequestURI())
            .build();
        return ResponseEntity.status(status).body(error);
    }
}
