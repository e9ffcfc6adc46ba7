package com.peerlend.api.controller;

import com.peerlend.api.dto.ErrorBody;
import com.peerlend.matching.error.CapExceededException;
import com.peerlend.matching.error.InvalidInputException;
import com.peerlend.matching.error.MarketPausedException;
import com.peerlend.matching.error.MatchingEngineException;
import com.peerlend.matching.error.PermissionDeniedException;
import com.peerlend.matching.error.UnauthorizedActionException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.util.Optional;

/**
 * Maps engine rejections and validation failures to ErrorBody (error, message, timestamp).
 * MARKET_NOT_CREATED → 404, other input errors and validation → 400, permission → 403,
 * pause → 409, caps and risk checks → 422.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(MatchingEngineException.class)
    public ResponseEntity<ErrorBody> handleEngine(MatchingEngineException ex) {
        return ResponseEntity.status(statusOf(ex)).body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorBody> handleConstraint(ConstraintViolationException ex) {
        String error = ex.getConstraintViolations().stream()
                .map(ConstraintViolation::getMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .findFirst()
                .orElse("VALIDATION_ERROR");
        return ResponseEntity.badRequest().body(ErrorBody.of(error, userFacingMessage(error)));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .orElse("VALIDATION_ERROR");
        return ResponseEntity.badRequest().body(ErrorBody.of(error, userFacingMessage(error)));
    }

    static HttpStatus statusOf(MatchingEngineException ex) {
        if (ex instanceof InvalidInputException) {
            return InvalidInputException.MARKET_NOT_CREATED.equals(ex.getErrorCode())
                    ? HttpStatus.NOT_FOUND
                    : HttpStatus.BAD_REQUEST;
        }
        if (ex instanceof PermissionDeniedException) {
            return HttpStatus.FORBIDDEN;
        }
        if (ex instanceof MarketPausedException) {
            return HttpStatus.CONFLICT;
        }
        if (ex instanceof CapExceededException || ex instanceof UnauthorizedActionException) {
            return HttpStatus.UNPROCESSABLE_ENTITY;
        }
        return HttpStatus.BAD_REQUEST;
    }

    private static String userFacingMessage(String errorCode) {
        return switch (errorCode) {
            case "INVALID_ADDRESS" -> "Invalid address format";
            default -> "Validation failed";
        };
    }
}
