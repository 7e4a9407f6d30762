package io.github.drompincen.mockjira.gateway.web;

import io.github.drompincen.mockjira.protocol.api.ErrorResponse;
import io.github.drompincen.mockjira.runtime.error.ErrorKind;
import io.github.drompincen.mockjira.runtime.error.MockJiraException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Renders every failure as the protocol error envelope {@code {errorMessages, errors}}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    private static final Map<ErrorKind, HttpStatus> STATUS_BY_KIND = new EnumMap<>(ErrorKind.class);

    static {
        STATUS_BY_KIND.put(ErrorKind.VALIDATION, HttpStatus.BAD_REQUEST);
        STATUS_BY_KIND.put(ErrorKind.UNAUTHORIZED, HttpStatus.UNAUTHORIZED);
        STATUS_BY_KIND.put(ErrorKind.FORBIDDEN, HttpStatus.FORBIDDEN);
        STATUS_BY_KIND.put(ErrorKind.NOT_FOUND, HttpStatus.NOT_FOUND);
        STATUS_BY_KIND.put(ErrorKind.CONFLICT, HttpStatus.CONFLICT);
        STATUS_BY_KIND.put(ErrorKind.RATE_LIMITED, HttpStatus.TOO_MANY_REQUESTS);
        STATUS_BY_KIND.put(ErrorKind.INTERNAL, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    public static HttpStatus statusOf(ErrorKind kind) {
        return STATUS_BY_KIND.getOrDefault(kind, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @ExceptionHandler(MockJiraException.class)
    public ResponseEntity<ErrorResponse> handleDomain(MockJiraException e) {
        HttpStatus status = statusOf(e.getKind());
        if (status.is5xxServerError()) {
            log.error("Request failed: {}", e.getMessage(), e);
        } else {
            log.debug("Request rejected with {}: {}", status.value(), e.getMessage());
        }
        HttpHeaders headers = new HttpHeaders();
        e.getHeaders().forEach(headers::set);
        return ResponseEntity.status(status).headers(headers)
                .body(new ErrorResponse(e.getMessages(), e.getFieldErrors()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        log.debug("Malformed request body: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponse.of("Request body is not valid JSON"));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse(
                List.of("Invalid value '" + e.getValue() + "' for " + e.getName()),
                Map.of(e.getName(), "Invalid value")));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse(
                List.of("Missing parameter " + e.getParameterName()),
                Map.of(e.getParameterName(), "This parameter is required")));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoRoute(NoResourceFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ErrorResponse.of("No route for /" + e.getResourcePath()));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethod(HttpRequestMethodNotSupportedException e) {
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED)
                .body(ErrorResponse.of("Method " + e.getMethod() + " is not allowed here"));
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMediaType(HttpMediaTypeNotSupportedException e) {
        return ResponseEntity.status(HttpStatus.UNSUPPORTED_MEDIA_TYPE)
                .body(ErrorResponse.of("Content type " + e.getContentType() + " is not supported"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("Unhandled error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of("Internal server error"));
    }
}
