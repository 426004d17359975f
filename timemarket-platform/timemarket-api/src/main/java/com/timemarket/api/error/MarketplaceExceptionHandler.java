package com.timemarket.api.error;

import com.timemarket.core.error.AuthorizationException;
import com.timemarket.core.error.MarketplaceException;
import com.timemarket.core.error.OfferNotFoundException;
import com.timemarket.core.error.PaymentException;
import com.timemarket.core.error.ProofVerificationException;
import com.timemarket.core.error.PurchaseNotFoundException;
import com.timemarket.core.error.ValidationException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps marketplace errors to HTTP statuses for every controller.
 */
@RestControllerAdvice
public class MarketplaceExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(MarketplaceExceptionHandler.class);

    @ExceptionHandler({OfferNotFoundException.class, PurchaseNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(MarketplaceException e) {
        return respond(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException e) {
        return respond(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(AuthorizationException.class)
    public ResponseEntity<ErrorResponse> handleAuthorization(AuthorizationException e, HttpServletRequest request) {
        log.warn("Unauthorized call: path={}, method={}, reason={}",
                request.getRequestURI(), request.getMethod(), e.getMessage());
        return respond(HttpStatus.FORBIDDEN, e);
    }

    @ExceptionHandler(ProofVerificationException.class)
    public ResponseEntity<ErrorResponse> handleProof(ProofVerificationException e) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, e);
    }

    @ExceptionHandler(PaymentException.class)
    public ResponseEntity<ErrorResponse> handlePayment(PaymentException e) {
        return respond(HttpStatus.PAYMENT_REQUIRED, e);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .orElse("Invalid request body");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(new ErrorResponse("MKT_VALIDATION", message));
    }

    @ExceptionHandler(MarketplaceException.class)
    public ResponseEntity<ErrorResponse> handleOther(MarketplaceException e) {
        log.error("Marketplace operation failed", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, MarketplaceException e) {
        return ResponseEntity.status(status).body(new ErrorResponse(e.getCode(), e.getMessage()));
    }
}
