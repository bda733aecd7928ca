package com.tourbooking.booking.domain.model;

public record RefundOutcome(boolean requested, boolean succeeded, String refundId, String error) {

    public static RefundOutcome notRequired() {
        return new RefundOutcome(false, false, null, null);
    }

    public static RefundOutcome succeeded(String refundId) {
        return new RefundOutcome(true, true, refundId, null);
    }

    public static RefundOutcome failed(String error) {
        return new RefundOutcome(true, false, null, error);
    }
}
