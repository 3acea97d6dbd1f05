package org.pgstudio.kernel.api;

import org.pgstudio.kernel.connection.ConnectionException;
import org.pgstudio.kernel.connection.UnknownProfileException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(UnknownProfileException.class)
    public ResponseEntity<ApiModels.ErrorResponse> unknownProfile(UnknownProfileException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ApiModels.ErrorResponse("unknown_connection", e.getMessage()));
    }

    @ExceptionHandler(ConnectionException.class)
    public ResponseEntity<ApiModels.ErrorResponse> connectionFailed(ConnectionException e) {
        log.warn("Connection failure: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(new ApiModels.ErrorResponse("connection_failed", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiModels.ErrorResponse> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest()
                .body(new ApiModels.ErrorResponse("bad_request", e.getMessage()));
    }
}
