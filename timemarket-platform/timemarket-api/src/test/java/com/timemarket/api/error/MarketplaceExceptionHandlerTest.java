package com.timemarket.api.error;

import com.timemarket.core.error.AuthorizationException;
import com.timemarket.core.error.MarketplaceException;
import com.timemarket.core.error.OfferNotFoundException;
import com.timemarket.core.error.PaymentException;
import com.timemarket.core.error.ProofVerificationException;
import com.timemarket.core.error.PurchaseNotFoundException;
import com.timemarket.core.error.ReconciliationException;
import com.timemarket.core.error.ReentrancyException;
import com.timemarket.core.error.ValidationException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.lang.reflect.Method;

import static org.assertj.core.api.Assertions.assertThat;

class MarketplaceExceptionHandlerTest {

    private final MarketplaceExceptionHandler handler = new MarketplaceExceptionHandler();

    @Test
    void unknownOffer_mapsToNotFound() {
        ResponseEntity<ErrorResponse> response = handler.handleNotFound(new OfferNotFoundException(9));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody()).isEqualTo(new ErrorResponse("MKT_OFFER_NOT_FOUND", "Offer not found: 9"));
    }

    @Test
    void unknownPurchase_mapsToNotFound() {
        ResponseEntity<ErrorResponse> response = handler.handleNotFound(new PurchaseNotFoundException(3));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().code()).isEqualTo("MKT_PURCHASE_NOT_FOUND");
    }

    @Test
    void notFoundHandler_acceptsAnyMarketplaceException() throws NoSuchMethodException {
        Method method = MarketplaceExceptionHandler.class.getMethod("handleNotFound", MarketplaceException.class);

        assertThat(method.getAnnotation(ExceptionHandler.class).value())
                .containsExactlyInAnyOrder(OfferNotFoundException.class, PurchaseNotFoundException.class);
    }

    @Test
    void validation_mapsToBadRequest() {
        ResponseEntity<ErrorResponse> response = handler.handleValidation(new ValidationException("Title required"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().code()).isEqualTo("MKT_VALIDATION");
    }

    @Test
    void authorization_mapsToForbidden() {
        MockHttpServletRequest request = new MockHttpServletRequest("PUT", "/api/v1/admin/fee");

        ResponseEntity<ErrorResponse> response =
                handler.handleAuthorization(new AuthorizationException("Only the owner"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(response.getBody().code()).isEqualTo("MKT_UNAUTHORIZED");
    }

    @Test
    void proofAndPayment_mapToTheirStatuses() {
        assertThat(handler.handleProof(new ProofVerificationException("bad proof")).getStatusCode())
                .isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(handler.handlePayment(new PaymentException("Insufficient payment")).getStatusCode())
                .isEqualTo(HttpStatus.PAYMENT_REQUIRED);
        assertThat(handler.handlePayment(new ReentrancyException("nested")).getBody().code())
                .isEqualTo("MKT_REENTRANT_CALL");
    }

    @Test
    void otherMarketplaceErrors_mapToServerError() {
        ResponseEntity<ErrorResponse> response = handler.handleOther(new ReconciliationException("node down"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().code()).isEqualTo("MKT_RECONCILIATION");
    }
}
