package com.neuroassist.stroke.controller;

import com.neuroassist.stroke.exception.ClassificationUnavailableException;
import com.neuroassist.stroke.exception.ConfigurationException;
import com.neuroassist.stroke.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class AssessmentExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> onValidation(ValidationException e) {
        return respond(HttpStatus.BAD_REQUEST, new ErrorResponse(e.kind(), e.getMessage(), e.getField()));
    }

    @ExceptionHandler(ClassificationUnavailableException.class)
    public ResponseEntity<ErrorResponse> onUnavailable(ClassificationUnavailableException e) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, new ErrorResponse(e.kind(), e.getMessage(), null));
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ErrorResponse> onConfiguration(ConfigurationException e) {
        log.error("Engine configuration error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, new ErrorResponse(e.kind(), e.getMessage(), null));
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, ErrorResponse body) {
        return ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON).body(body);
    }
}
