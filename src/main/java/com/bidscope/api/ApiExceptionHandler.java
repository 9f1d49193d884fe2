package com.bidscope.api;

import com.bidscope.error.BidScopeException;
import com.bidscope.error.ErrorKind;
import com.bidscope.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps the error taxonomy to HTTP statuses.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(BidScopeException.class)
    public ResponseEntity<ErrorResponse> handle(BidScopeException e) {
        HttpStatus status = statusFor(e.getKind());
        if (status.is5xxServerError()) {
            log.error("Request failed: {}", e.getMessage(), e);
        } else {
            log.debug("Request rejected ({}): {}", e.getKind().getValue(), e.getMessage());
        }
        String field = e instanceof ValidationException ? ((ValidationException) e).getField() : null;
        return ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON)
            .body(new ErrorResponse(e.getKind().getValue(), e.getReason(), field));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> unreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest().contentType(MediaType.APPLICATION_JSON)
            .body(new ErrorResponse(ErrorKind.VALIDATION.getValue(), "Malformed request body", "body"));
    }

    static HttpStatus statusFor(ErrorKind kind) {
        switch (kind) {
            case VALIDATION:
                return HttpStatus.BAD_REQUEST;
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case CAPACITY:
                return HttpStatus.PAYLOAD_TOO_LARGE;
            case CANCELLED:
                return HttpStatus.CONFLICT;
            case BACKING_STORE:
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
