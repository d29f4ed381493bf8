package com.example.reelfetch_backend.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

import java.net.URI;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders every failure of the API as an RFC 7807 problem with the {@link ErrorKind} name in {@code kind}.
 * Collaborator exceptions are logged here and never leak into the body.
 */
@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String KIND_PROPERTY = "kind";
    private static final String TIMESTAMP_PROPERTY = "timestamp";
    private static final String ERRORS_PROPERTY = "errors";

    @ExceptionHandler(RetrievalException.class)
    public ResponseEntity<ProblemDetail> handleRetrievalException(RetrievalException ex, WebRequest request) {
        ErrorKind kind = ex.getKind();
        if (kind.status().is5xxServerError()) {
            LOGGER.error("Request failed kind={} uri={} msg={}", kind, request.getDescription(false), ex.getMessage(), ex);
        } else {
            LOGGER.warn("Request rejected kind={} uri={} msg={}", kind, request.getDescription(false), ex.getMessage());
        }
        ProblemDetail problem = problem(kind, ex.getMessage(), request);
        return ResponseEntity.status(kind.status()).body(problem);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleUnexpected(Exception ex, WebRequest request) {
        LOGGER.error("Unhandled error uri={} err={}", request.getDescription(false), ex.toString(), ex);
        ProblemDetail problem = problem(ErrorKind.UNEXPECTED, "An unexpected error occurred.", request);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
    }

    // @Valid on @RequestBody
    @Override
    protected ResponseEntity<Object> handleMethodArgumentNotValid(
            @NonNull MethodArgumentNotValidException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request) {
        Map<String, String> errors = new LinkedHashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String field = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            errors.putIfAbsent(field, error.getDefaultMessage());
        });
        LOGGER.warn("Validation failed uri={} errors={}", request.getDescription(false), errors);

        ProblemDetail problem = problem(ErrorKind.INVALID_INPUT, "A valid Instagram post URL is required.", request);
        problem.setProperty(ERRORS_PROPERTY, errors);
        return new ResponseEntity<>(problem, headers, HttpStatus.BAD_REQUEST);
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(
            @NonNull HttpMessageNotReadableException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request) {
        LOGGER.warn("Unreadable request body uri={} err={}", request.getDescription(false), ex.getMessage());
        ProblemDetail problem = problem(ErrorKind.INVALID_INPUT, "Request body must be JSON with a 'url' field.", request);
        return new ResponseEntity<>(problem, headers, HttpStatus.BAD_REQUEST);
    }

    private static ProblemDetail problem(ErrorKind kind, String detail, WebRequest request) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(kind.status(), detail);
        problem.setTitle(kind.status().getReasonPhrase());
        problem.setInstance(URI.create(request.getDescription(false).replaceFirst("^uri=", "")));
        problem.setProperty(KIND_PROPERTY, kind.name());
        problem.setProperty(TIMESTAMP_PROPERTY, Instant.now());
        return problem;
    }
}
