package com.tourbooking.booking.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.tourbooking.booking.domain.model.TicketClaims;
import com.tourbooking.booking.exception.TamperedTicketException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;

/**
 * Scannable ticket payload: {@code base64url(claims-json) "." base64url(HMAC-SHA256(claims-json))}.
 *
 * <p>Decoding needs only the shared secret, so a scanner can check a ticket
 * without a database round trip. The decoder accepts only the exact string
 * the encoder would produce for the decoded claims; any other input,
 * including a single changed bit, is rejected as tampered.
 */
@Component
public class TicketPayloadCodec {

    private static final String ALGORITHM = "HmacSHA256";
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final ObjectMapper mapper = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
            .build();
    private final SecretKeySpec key;

    public TicketPayloadCodec(@Value("${booking.ticket.secret}") String secret) {
        if (secret == null || secret.length() < 32) {
            throw new IllegalArgumentException("booking.ticket.secret must be at least 32 characters");
        }
        this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM);
    }

    public String encode(TicketClaims claims) {
        byte[] json;
        try {
            json = mapper.writeValueAsBytes(claims);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Ticket claims could not be serialized", e);
        }
        return ENCODER.encodeToString(json) + "." + ENCODER.encodeToString(sign(json));
    }

    public TicketClaims decode(String payload) {
        if (payload == null || payload.isEmpty()) {
            throw new TamperedTicketException("empty payload");
        }
        int dot = payload.indexOf('.');
        if (dot <= 0 || dot != payload.lastIndexOf('.') || dot == payload.length() - 1) {
            throw new TamperedTicketException("malformed payload");
        }
        String body = payload.substring(0, dot);
        String signature = payload.substring(dot + 1);

        byte[] json;
        byte[] presented;
        try {
            json = DECODER.decode(body);
            presented = DECODER.decode(signature);
        } catch (IllegalArgumentException e) {
            throw new TamperedTicketException("payload is not base64url", e);
        }
        if (!MessageDigest.isEqual(sign(json), presented)) {
            throw new TamperedTicketException("signature mismatch");
        }

        TicketClaims claims;
        try {
            claims = mapper.readValue(json, TicketClaims.class);
        } catch (IOException e) {
            throw new TamperedTicketException("unreadable claims", e);
        }
        if (claims == null || claims.ticketNumber() == null || claims.resourceId() == null) {
            throw new TamperedTicketException("incomplete claims");
        }
        if (!encode(claims).equals(payload)) {
            throw new TamperedTicketException("non-canonical encoding");
        }
        return claims;
    }

    private byte[] sign(byte[] data) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            return mac.doFinal(data);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }
}
