package com.tourbooking.booking.client.dto;

public record RefundResponse(String refundId, String status) {
}
