package com.tourbooking.booking.domain.repository;

import com.tourbooking.booking.domain.model.InventorySlot;
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
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration test for the guarded capacity updates of {@link InventorySlotRepository}
 * against a real PostgreSQL (schema from the Flyway migration).
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Testcontainers
class InventorySlotRepositoryIntegrationTest {

    private static final Long RESOURCE_ID = 999L;
    private static final LocalDate DATE = LocalDate.of(2026, 7, 1);
    private static final String TIMESLOT = "10:00";

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
    private InventorySlotRepository repository;

    @AfterEach
    void cleanUp() {
        repository.deleteAll();
    }

    @Test
    @DisplayName("reserveCapacity takes the last free places and refuses one more")
    void reserveCapacity_refusesBeyondTotal() {
        // given
        saveSlot(10);

        // when
        int first = repository.reserveCapacity(RESOURCE_ID, DATE, TIMESLOT, 10);
        int second = repository.reserveCapacity(RESOURCE_ID, DATE, TIMESLOT, 1);

        // then
        assertThat(first).isEqualTo(1);
        assertThat(second).isZero();
        InventorySlot reloaded = reload();
        assertThat(reloaded.getReservedCapacity()).isEqualTo(10);
        assertThat(reloaded.getAvailableCapacity()).isZero();
    }

    @Test
    @DisplayName("reserveCapacity never oversells under concurrent callers")
    void reserveCapacity_neverOversellsConcurrently() throws Exception {
        // given
        int capacity = 5;
        int callers = 20;
        saveSlot(capacity);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Callable<Integer>> tasks = new ArrayList<>();
        for (int i = 0; i < callers; i++) {
            tasks.add(() -> {
                start.await();
                return repository.reserveCapacity(RESOURCE_ID, DATE, TIMESLOT, 1);
            });
        }

        // when
        List<Future<Integer>> futures = new ArrayList<>();
        for (Callable<Integer> task : tasks) {
            futures.add(pool.submit(task));
        }
        start.countDown();
        int succeeded = 0;
        for (Future<Integer> future : futures) {
            succeeded += future.get();
        }
        pool.shutdown();

        // then
        assertThat(succeeded).isEqualTo(capacity);
        InventorySlot reloaded = reload();
        assertThat(reloaded.getReservedCapacity()).isEqualTo(capacity);
        assertThat(reloaded.getBookedCapacity() + reloaded.getReservedCapacity())
                .isLessThanOrEqualTo(reloaded.getTotalCapacity());
    }

    @Test
    @DisplayName("confirmCapacity moves reserved places to booked")
    void confirmCapacity_movesReservedToBooked() {
        // given
        saveSlot(10);
        repository.reserveCapacity(RESOURCE_ID, DATE, TIMESLOT, 3);

        // when
        int updated = repository.confirmCapacity(RESOURCE_ID, DATE, TIMESLOT, 3);

        // then
        assertThat(updated).isEqualTo(1);
        InventorySlot reloaded = reload();
        assertThat(reloaded.getReservedCapacity()).isZero();
        assertThat(reloaded.getBookedCapacity()).isEqualTo(3);
        assertThat(reloaded.getAvailableCapacity()).isEqualTo(7);
    }

    @Test
    @DisplayName("releaseReserved refuses to go negative; floorReserved clamps to zero")
    void releaseReserved_neverGoesNegative() {
        // given
        saveSlot(10);
        repository.reserveCapacity(RESOURCE_ID, DATE, TIMESLOT, 2);

        // when
        int release = repository.releaseReserved(RESOURCE_ID, DATE, TIMESLOT, 5);
        int floor = repository.floorReserved(RESOURCE_ID, DATE, TIMESLOT);

        // then
        assertThat(release).isZero();
        assertThat(floor).isEqualTo(1);
        assertThat(reload().getReservedCapacity()).isZero();
    }

    @Test
    @DisplayName("reserveCapacity ignores inactive slots")
    void reserveCapacity_inactiveSlot() {
        // given
        InventorySlot slot = saveSlot(10);
        slot.setActive(false);
        repository.saveAndFlush(slot);

        // when
        int updated = repository.reserveCapacity(RESOURCE_ID, DATE, TIMESLOT, 1);

        // then
        assertThat(updated).isZero();
    }

    private InventorySlot saveSlot(int capacity) {
        return repository.saveAndFlush(InventorySlot.builder()
                .resourceId(RESOURCE_ID)
                .slotDate(DATE)
                .timeslot(TIMESLOT)
                .totalCapacity(capacity)
                .basePrice(BigDecimal.valueOf(25))
                .finalPrice(BigDecimal.valueOf(25))
                .build());
    }

    private InventorySlot reload() {
        return repository.findByResourceIdAndSlotDateAndTimeslot(RESOURCE_ID, DATE, TIMESLOT).orElseThrow();
    }
}
