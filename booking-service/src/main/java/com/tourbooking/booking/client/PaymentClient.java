package com.tourbooking.booking.client;

import com.tourbooking.booking.client.dto.CreatePaymentSessionRequest;
import com.tourbooking.booking.client.dto.PaymentSessionResponse;
import com.tourbooking.booking.client.dto.PaymentStatusResponse;
import com.tourbooking.booking.client.dto.RefundRequest;
import com.tourbooking.booking.client.dto.RefundResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

/**
 * Payment collaborator. Called only through {@link PaymentGateway}.
 */
@FeignClient(name = "payment-service", url = "${booking.clients.payment-service.url}", path = "/api/v1/payments")
public interface PaymentClient {

    @PostMapping
    PaymentSessionResponse createSession(@RequestBody CreatePaymentSessionRequest request);

    @GetMapping("/{paymentId}")
    PaymentStatusResponse getPayment(@PathVariable("paymentId") String paymentId);

    @PostMapping("/{paymentId}/refunds")
    RefundResponse refund(@PathVariable("paymentId") String paymentId, @RequestBody RefundRequest request);
}
