package com.synapse.x.exceptions;

import com.synapse.x.dto.enums.ActivationError;
import com.synapse.x.models.Error;
import com.synapse.x.utils.basic.ErrorUtility;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;


/**
 * Global exception handler for handling various exceptions in the application.
 * <p>
 * Each exception type is mapped to a specific HTTP status code and an {@link Error} body.
 * </p>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Handles {@link BadRequestException} (including {@link TooLargeException}) with HTTP 400.
     *
     * @param e the {@link BadRequestException} to be handled.
     * @return a {@link ResponseEntity} containing the error details and a HTTP 400 status.
     */
    @ExceptionHandler(BadRequestException.class)
    public ResponseEntity<Error> handleBadRequestException(BadRequestException e) {
        String code = e instanceof TooLargeException ? "TOO_LARGE" : "INVALID_ARGUMENT";
        return ErrorUtility.respond(code, e.getMessage(), HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles {@link MethodArgumentNotValidException} and returns a HTTP 400 Bad Request response with validation errors.
     *
     * @param ex the {@link MethodArgumentNotValidException} to be handled.
     * @return a {@link ResponseEntity} containing the validation errors and a HTTP 400 status.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Error> handleValidationException(MethodArgumentNotValidException ex) {
        BindingResult bindingResult = ex.getBindingResult();
        StringBuilder errorMessage = new StringBuilder("Invalid request parameters:");

        for (FieldError fieldError : bindingResult.getFieldErrors()) {
            errorMessage.append(" Field '").append(fieldError.getField())
                    .append("' ").append(fieldError.getDefaultMessage()).append("; ");
        }
        return ErrorUtility.respond("INVALID_ARGUMENT", errorMessage.toString(), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<Error> handleConstraintViolation(ConstraintViolationException e) {
        return ErrorUtility.respond("INVALID_ARGUMENT", e.getMessage(), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Error> handleUnreadableBody(HttpMessageNotReadableException e) {
        return ErrorUtility.respond("INVALID_ARGUMENT", "Malformed request body", HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Error> handleNotFoundException(NotFoundException e) {
        return ErrorUtility.respond("NOT_FOUND", e.getMessage(), HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<Error> handleConflictException(ConflictException e) {
        return ErrorUtility.respond("CONFLICT", e.getMessage(), HttpStatus.CONFLICT);
    }

    /**
     * Rejected activations keep the old version active. An unknown version is a 404, every
     * other rejection a 409.
     */
    @ExceptionHandler(ModelActivationException.class)
    public ResponseEntity<Error> handleModelActivationException(ModelActivationException e) {
        HttpStatus status = e.getError() == ActivationError.NOT_FOUND ? HttpStatus.NOT_FOUND : HttpStatus.CONFLICT;
        return ErrorUtility.respond(e.getError().name(), e.getMessage(), status);
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<Error> handleStoreUnavailableException(StoreUnavailableException e) {
        log.warn("Store unavailable: {}", e.getMessage());
        return ErrorUtility.respond("UNAVAILABLE", e.getMessage(), HttpStatus.SERVICE_UNAVAILABLE);
    }

    @ExceptionHandler(RequestTimeoutException.class)
    public ResponseEntity<Error> handleRequestTimeoutException(RequestTimeoutException e) {
        return ErrorUtility.respond("DEADLINE_EXCEEDED", e.getMessage(), HttpStatus.GATEWAY_TIMEOUT);
    }

    /**
     * Handles {@link InternalServerErrorException} and returns a HTTP 500 Internal Server Error response with the error details.
     *
     * @param e the {@link InternalServerErrorException} to be handled.
     * @return a {@link ResponseEntity} containing the error details and a HTTP 500 status.
     */
    @ExceptionHandler(InternalServerErrorException.class)
    public ResponseEntity<Error> handleInternalServerErrorException(InternalServerErrorException e) {
        log.error("Internal error", e);
        return ErrorUtility.respond("INTERNAL", e.getMessage(), HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
