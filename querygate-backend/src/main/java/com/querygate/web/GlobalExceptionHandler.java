package com.querygate.web;

import com.querygate.model.ErrorKind;
import com.querygate.model.ExecutionResult;
import com.querygate.model.StructuredError;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Failures that never reach the gateway (malformed bodies, unknown routes) still answer with the
 * gateway's result envelope.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ExecutionResult> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getAllErrors().stream()
                .map(error -> error.getDefaultMessage())
                .collect(Collectors.joining(", "));

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ExecutionResult.failure(null,
                StructuredError.builder()
                        .kind(ErrorKind.VALIDATION_FAILED)
                        .message("Input validation failed: " + details)
                        .build()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ExecutionResult> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.info("Rejected unreadable request body: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ExecutionResult.failure(null,
                StructuredError.builder()
                        .kind(ErrorKind.VALIDATION_FAILED)
                        .message("Request body is missing or malformed")
                        .suggestion("Send a JSON object with snake_case field names")
                        .build()));
    }

    @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
    public ResponseEntity<ExecutionResult> handleNotFoundException(Exception ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ExecutionResult.failure(null,
                StructuredError.builder()
                        .kind(ErrorKind.VALIDATION_FAILED)
                        .message("Not found")
                        .suggestion("GET /v1/operations lists the available operations")
                        .build()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ExecutionResult> handleAllExceptions(Exception ex) {
        log.error("Unhandled exception occurred", ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ExecutionResult.failure(null,
                StructuredError.builder()
                        .kind(ErrorKind.INTERNAL_ERROR)
                        .message("An unexpected error occurred")
                        .suggestions(List.of("Retry the operation", "Check server logs using the request trace id"))
                        .build()));
    }
}
