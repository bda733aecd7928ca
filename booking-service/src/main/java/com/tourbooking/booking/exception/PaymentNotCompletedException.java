package com.tourbooking.booking.exception;

import com.tourbooking.common.exception.BusinessException;
import org.springframework.http.HttpStatus;

public class PaymentNotCompletedException extends BusinessException {

    public PaymentNotCompletedException(String paymentId, String status) {
        super(String.format("Payment incomplete, please retry (payment %s is %s)", paymentId, status),
                "PAYMENT_NOT_COMPLETED", HttpStatus.PAYMENT_REQUIRED);
    }
}
