package org.rostilos.labgate.webserver.exception;

import org.rostilos.labgate.core.exception.TargetNotFoundException;
import org.rostilos.labgate.core.exception.UpstreamException;
import org.rostilos.labgate.core.exception.UserNotFoundException;
import org.rostilos.labgate.core.exception.ValidationException;
import org.rostilos.labgate.webserver.dto.message.ErrorMessageResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String INTERNAL_ERROR_CODE = "INTERNAL_ERROR";
    static final String HTTP_ERROR_CODE = "HTTP_ERROR";

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorMessageResponse> handleValidation(ValidationException ex) {
        log.debug("Rejected request: {}", ex.getMessage());
        return ResponseEntity
                .badRequest()
                .body(new ErrorMessageResponse(ex.getErrorCode(), ex.getMessage(), HttpStatus.BAD_REQUEST)
                        .withDetails(ex.getErrors()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorMessageResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        List<String> errors = ex.getBindingResult().getAllErrors().stream()
                .map(error -> error.getDefaultMessage())
                .toList();
        return ResponseEntity
                .badRequest()
                .body(new ErrorMessageResponse(ValidationException.ERROR_CODE, String.join("; ", errors), HttpStatus.BAD_REQUEST)
                        .withDetails(errors));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, HttpMediaTypeNotSupportedException.class})
    public ResponseEntity<ErrorMessageResponse> handleUnreadableBody(Exception ex) {
        log.debug("Unreadable request body: {}", ex.getMessage());
        return ResponseEntity
                .badRequest()
                .body(new ErrorMessageResponse(ValidationException.ERROR_CODE,
                        "Request body must be a JSON object with username, target and role", HttpStatus.BAD_REQUEST));
    }

    @ExceptionHandler(TargetNotFoundException.class)
    public ResponseEntity<ErrorMessageResponse> handleTargetNotFound(TargetNotFoundException ex) {
        return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(new ErrorMessageResponse(ex.getErrorCode(), ex.getMessage(), HttpStatus.NOT_FOUND));
    }

    @ExceptionHandler(UserNotFoundException.class)
    public ResponseEntity<ErrorMessageResponse> handleUserNotFound(UserNotFoundException ex) {
        return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(new ErrorMessageResponse(ex.getErrorCode(), ex.getMessage(), HttpStatus.NOT_FOUND));
    }

    @ExceptionHandler(UpstreamException.class)
    public ResponseEntity<ErrorMessageResponse> handleUpstream(UpstreamException ex) {
        log.warn("Upstream failure: status={}, retryAfter={}s, message={}",
                ex.getUpstreamStatus(), ex.getRetryAfterSeconds(), ex.getMessage());

        ErrorMessageResponse body = new ErrorMessageResponse(ex.getErrorCode(), ex.getMessage(), HttpStatus.BAD_GATEWAY)
                .withUpstreamStatus(ex.getUpstreamStatus() == UpstreamException.NO_STATUS ? null : ex.getUpstreamStatus())
                .withRetryAfterSeconds(ex.getRetryAfterSeconds());

        ResponseEntity.BodyBuilder response = ResponseEntity.status(HttpStatus.BAD_GATEWAY);
        if (ex.getRetryAfterSeconds() != null) {
            response.header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()));
        }
        return response.body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorMessageResponse> handleGeneric(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            // framework-level failures such as unknown routes or wrong methods keep their own status
            HttpStatusCode status = errorResponse.getStatusCode();
            return ResponseEntity
                    .status(status)
                    .body(new ErrorMessageResponse(HTTP_ERROR_CODE, ex.getMessage(), status));
        }
        log.error("Unhandled exception: {}", ex.getMessage(), ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorMessageResponse(INTERNAL_ERROR_CODE,
                        "An unexpected error occurred. Please try again later.", HttpStatus.INTERNAL_SERVER_ERROR));
    }
}
