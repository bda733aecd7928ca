package com.tourbooking.booking.domain.repository;

import com.tourbooking.booking.domain.model.Booking;
import com.tourbooking.booking.domain.model.Booking.BookingStatus;
import com.tourbooking.booking.domain.model.CapacityCommitment;
import com.tourbooking.booking.domain.model.CapacityCommitment.CommitmentState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration test for the orphaned-reservation lookup of {@link CapacityCommitmentRepository}.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Testcontainers
class CapacityCommitmentRepositoryIntegrationTest {

    private static final List<BookingStatus> LIVE = List.of(BookingStatus.PENDING, BookingStatus.CONFIRMED);

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("tour_booking")
            .withUsername("postgres")
            .withPassword("postgres");

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "none");
    }

    @Configuration
    @EntityScan("com.tourbooking.booking.domain.model")
    @EnableJpaRepositories("com.tourbooking.booking.domain.repository")
    static class JpaConfig {
    }

    @Autowired
    private CapacityCommitmentRepository commitmentRepository;

    @Autowired
    private BookingRepository bookingRepository;

    @AfterEach
    void cleanUp() {
        commitmentRepository.deleteAll();
        bookingRepository.deleteAll();
    }

    @Test
    @DisplayName("findOrphaned returns reservations of missing, expired and cancelled bookings only")
    void findOrphaned_skipsLiveBookings() {
        // given
        Long pending = reserved(booking("BK-2026-000001", BookingStatus.PENDING));
        Long confirmed = reserved(booking("BK-2026-000002", BookingStatus.CONFIRMED));
        Long expired = reserved(booking("BK-2026-000003", BookingStatus.EXPIRED));
        Long cancelled = reserved(booking("BK-2026-000004", BookingStatus.CANCELLED));
        Long missing = reserved(999_999L);

        // when
        List<CapacityCommitment> orphaned = commitmentRepository.findOrphaned(
                CommitmentState.RESERVED, LIVE, LocalDateTime.now().plusMinutes(1));

        // then
        assertThat(orphaned).extracting(CapacityCommitment::getBookingId)
                .containsExactlyInAnyOrder(expired, cancelled, missing)
                .doesNotContain(pending, confirmed);
    }

    @Test
    @DisplayName("findOrphaned ignores reservations younger than the threshold")
    void findOrphaned_respectsThreshold() {
        reserved(booking("BK-2026-000005", BookingStatus.EXPIRED));

        List<CapacityCommitment> orphaned = commitmentRepository.findOrphaned(
                CommitmentState.RESERVED, LIVE, LocalDateTime.now().minusMinutes(5));

        assertThat(orphaned).isEmpty();
    }

    private Long booking(String reference, BookingStatus status) {
        return bookingRepository.saveAndFlush(Booking.builder()
                .bookingReference(reference)
                .userId(100L)
                .resourceId(7L)
                .slotDate(LocalDate.of(2026, 7, 1))
                .timeslot("")
                .quantity(1)
                .unitPrice(BigDecimal.valueOf(25))
                .subtotal(BigDecimal.valueOf(25))
                .taxes(BigDecimal.ZERO)
                .fees(BigDecimal.ZERO)
                .discount(BigDecimal.ZERO)
                .totalAmount(BigDecimal.valueOf(25))
                .commission(BigDecimal.ZERO)
                .currency("EUR")
                .guestName("Ada Lovelace")
                .guestEmail("ada@example.com")
                .status(status)
                .paymentStatus(Booking.PaymentStatus.PENDING)
                .build()).getId();
    }

    private Long reserved(Long bookingId) {
        commitmentRepository.saveAndFlush(CapacityCommitment.builder()
                .bookingId(bookingId)
                .resourceId(7L)
                .slotDate(LocalDate.of(2026, 7, 1))
                .timeslot("")
                .quantity(1)
                .state(CommitmentState.RESERVED)
                .build());
        return bookingId;
    }
}
