package com.tourbooking.booking.client;

import com.tourbooking.booking.client.dto.CreatePaymentSessionRequest;
import com.tourbooking.booking.client.dto.PaymentSessionResponse;
import com.tourbooking.booking.client.dto.PaymentStatusResponse;
import com.tourbooking.booking.client.dto.RefundRequest;
import com.tourbooking.booking.client.dto.RefundResponse;
import com.tourbooking.booking.domain.model.Booking;
import com.tourbooking.booking.exception.CollaboratorUnavailableException;
import com.tourbooking.booking.exception.PaymentNotCompletedException;
import feign.FeignException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Payment calls wrapped with Resilience4j retry and circuit breaker
 * (instance {@code payment-service}). Once retries are exhausted or the
 * circuit is open, callers get {@link CollaboratorUnavailableException}.
 * Idempotency keys are derived from the booking so retried calls are safe.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentGateway {

    static final String PAYMENT_SERVICE = "payment-service";

    private final PaymentClient paymentClient;

    @CircuitBreaker(name = PAYMENT_SERVICE, fallbackMethod = "createSessionFallback")
    @Retry(name = PAYMENT_SERVICE)
    public PaymentSessionResponse createSession(Booking booking) {
        log.info("Requesting payment session for booking {} ({} {})",
                booking.getBookingReference(), booking.getTotalAmount(), booking.getCurrency());
        return paymentClient.createSession(new CreatePaymentSessionRequest(
                booking.getId(),
                booking.getBookingReference(),
                booking.getTotalAmount(),
                booking.getCurrency(),
                booking.getGuestEmail(),
                "booking-" + booking.getId()));
    }

    @CircuitBreaker(name = PAYMENT_SERVICE, fallbackMethod = "getPaymentFallback")
    @Retry(name = PAYMENT_SERVICE)
    public PaymentStatusResponse getPayment(String paymentId) {
        return paymentClient.getPayment(paymentId);
    }

    @CircuitBreaker(name = PAYMENT_SERVICE, fallbackMethod = "refundFallback")
    @Retry(name = PAYMENT_SERVICE)
    public RefundResponse refund(Booking booking, String reason) {
        log.info("Requesting refund of {} {} for booking {}",
                booking.getTotalAmount(), booking.getCurrency(), booking.getBookingReference());
        return paymentClient.refund(booking.getPaymentId(), new RefundRequest(
                booking.getTotalAmount(), booking.getCurrency(), reason, "refund-" + booking.getId()));
    }

    private PaymentSessionResponse createSessionFallback(Booking booking, Throwable t) {
        log.warn("Payment session for booking {} failed: {}", booking.getId(), t.toString());
        throw new CollaboratorUnavailableException(PAYMENT_SERVICE, t);
    }

    private PaymentStatusResponse getPaymentFallback(String paymentId, Throwable t) {
        if (t instanceof FeignException.NotFound) {
            throw new PaymentNotCompletedException(paymentId, "unknown");
        }
        log.warn("Payment status lookup for {} failed: {}", paymentId, t.toString());
        throw new CollaboratorUnavailableException(PAYMENT_SERVICE, t);
    }

    private RefundResponse refundFallback(Booking booking, String reason, Throwable t) {
        log.warn("Refund for booking {} failed: {}", booking.getId(), t.toString());
        throw new CollaboratorUnavailableException(PAYMENT_SERVICE, t);
    }
}
