package com.tourbooking.booking.client.dto;

public record PaymentSessionResponse(String paymentId, String redirectUrl, String status) {
}
