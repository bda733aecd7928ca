package com.tourbooking.booking.api.controller;

import com.tourbooking.booking.api.dto.TicketClaimsResponse;
import com.tourbooking.booking.api.dto.ValidateTicketRequest;
import com.tourbooking.booking.api.dto.VerifyTicketRequest;
import com.tourbooking.booking.domain.model.TicketValidation;
import com.tourbooking.booking.domain.service.TicketIssuer;
import com.tourbooking.common.dto.BaseResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Gate endpoints. {@code verify} only checks the signature; {@code validate} redeems the ticket.
 */
@RestController
@RequestMapping("/api/v1/tickets")
@RequiredArgsConstructor
public class TicketController {

    private final TicketIssuer ticketIssuer;

    @PostMapping("/validate")
    public ResponseEntity<BaseResponse<TicketValidation>> validateTicket(
            @Valid @RequestBody ValidateTicketRequest request) {
        TicketValidation validation = ticketIssuer.validate(
                request.payload(), request.resourceId(), request.validatorId());
        return ResponseEntity.ok(BaseResponse.success("Ticket valid", validation));
    }

    @PostMapping("/verify")
    public ResponseEntity<BaseResponse<TicketClaimsResponse>> verifyTicket(
            @Valid @RequestBody VerifyTicketRequest request) {
        return ResponseEntity.ok(BaseResponse.success(
                TicketClaimsResponse.from(ticketIssuer.verify(request.payload()))));
    }
}
