package com.tourbooking.booking.domain.service;

import com.tourbooking.booking.domain.model.TicketClaims;
import com.tourbooking.booking.exception.TamperedTicketException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TicketPayloadCodecTest {

    private static final String SECRET = "test-secret-that-is-long-enough-for-hmac";
    private static final TicketClaims CLAIMS = new TicketClaims(
            "HB-2026-123456-01", 7L, 1_782_856_800L, 1_782_943_200L, 1_780_000_000L);

    private final TicketPayloadCodec codec = new TicketPayloadCodec(SECRET);

    @Test
    @DisplayName("decode returns the claims that were encoded")
    void decode_returnsEncodedClaims() {
        String payload = codec.encode(CLAIMS);

        assertThat(payload).containsOnlyOnce(".");
        assertThat(codec.decode(payload)).isEqualTo(CLAIMS);
    }

    @Test
    @DisplayName("every single-bit change of the payload is rejected")
    void decode_rejectsEverySingleBitFlip() {
        String payload = codec.encode(CLAIMS);

        for (int i = 0; i < payload.length(); i++) {
            for (int bit = 0; bit < 8; bit++) {
                char[] chars = payload.toCharArray();
                chars[i] = (char) (chars[i] ^ (1 << bit));
                String tampered = new String(chars);

                assertThatThrownBy(() -> codec.decode(tampered))
                        .as("flip of bit %d at position %d", bit, i)
                        .isInstanceOf(TamperedTicketException.class);
            }
        }
    }

    @Test
    @DisplayName("a payload signed with another secret is rejected")
    void decode_rejectsForeignSignature() {
        TicketPayloadCodec other = new TicketPayloadCodec("another-secret-that-is-long-enough-too");
        String payload = other.encode(CLAIMS);

        assertThatThrownBy(() -> codec.decode(payload))
                .isInstanceOf(TamperedTicketException.class)
                .hasMessageContaining("signature mismatch");
    }

    @Test
    @DisplayName("claims swapped between two genuine payloads are rejected")
    void decode_rejectsSpliced() {
        String first = codec.encode(CLAIMS);
        String second = codec.encode(new TicketClaims("HB-2026-123456-02", 7L,
                CLAIMS.validFrom(), CLAIMS.validUntil(), CLAIMS.issuedAt()));
        String spliced = first.substring(0, first.indexOf('.')) + second.substring(second.indexOf('.'));

        assertThatThrownBy(() -> codec.decode(spliced)).isInstanceOf(TamperedTicketException.class);
    }

    @Test
    @DisplayName("malformed input is rejected without decoding")
    void decode_rejectsMalformed() {
        assertThatThrownBy(() -> codec.decode(null)).isInstanceOf(TamperedTicketException.class);
        assertThatThrownBy(() -> codec.decode("")).isInstanceOf(TamperedTicketException.class);
        assertThatThrownBy(() -> codec.decode("no-dot-here")).isInstanceOf(TamperedTicketException.class);
        assertThatThrownBy(() -> codec.decode(".abc")).isInstanceOf(TamperedTicketException.class);
        assertThatThrownBy(() -> codec.decode("abc.")).isInstanceOf(TamperedTicketException.class);
        assertThatThrownBy(() -> codec.decode("a.b.c")).isInstanceOf(TamperedTicketException.class);
        assertThatThrownBy(() -> codec.decode("!!!.???")).isInstanceOf(TamperedTicketException.class);
    }

    @Test
    @DisplayName("a correctly signed body without a ticket number is rejected")
    void decode_rejectsIncompleteClaims() throws Exception {
        byte[] json = "{\"ticketNumber\":null,\"resourceId\":7,\"validFrom\":1,\"validUntil\":2,\"issuedAt\":0}"
                .getBytes(StandardCharsets.UTF_8);
        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec(SECRET.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
        Base64.Encoder encoder = Base64.getUrlEncoder().withoutPadding();
        String payload = encoder.encodeToString(json) + "." + encoder.encodeToString(mac.doFinal(json));

        assertThatThrownBy(() -> codec.decode(payload))
                .isInstanceOf(TamperedTicketException.class)
                .hasMessageContaining("incomplete claims");
    }

    @Test
    @DisplayName("a short secret is refused at startup")
    void constructor_rejectsShortSecret() {
        assertThatThrownBy(() -> new TicketPayloadCodec("short"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
