package com.staydesk.booking.domain.service;

import com.staydesk.booking.api.dto.RoomPricingResponse;
import com.staydesk.booking.config.PricingEngineConfig;
import com.staydesk.booking.domain.model.Room;
import com.staydesk.booking.domain.repository.RoomNightOccupancyRepository;
import com.staydesk.booking.domain.repository.RoomRepository;
import com.staydesk.pricing.calendar.StayRange;
import com.staydesk.pricing.model.Quote;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Fail-open pricing against a real PostgreSQL instance: a failing seasonal rate query must leave
 * the surrounding booking or quote transaction able to run further statements and commit.
 * The rate table is renamed away to make the query fail for real.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Testcontainers(disabledWithoutDocker = true)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({PricingEngineConfig.class, PricingService.class, SeasonalRateLookup.class, RoomService.class})
class PricingServiceIntegrationTest {

    private static final UUID TENANT = UUID.fromString("6f1c2a1e-0000-4000-8000-000000000002");

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("staydesk")
            .withUsername("postgres")
            .withPassword("postgres");

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
        registry.add("spring.flyway.enabled", () -> "false");
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create");
        registry.add("booking.pricing.rate-lookup-failure-mode", () -> "fail-open");
    }

    @Autowired
    private PricingService pricingService;
    @Autowired
    private RoomRepository roomRepository;
    @Autowired
    private RoomNightOccupancyRepository occupancyRepository;
    @Autowired
    private JdbcTemplate jdbcTemplate;
    @Autowired
    private PlatformTransactionManager transactionManager;

    private Room room;

    @BeforeEach
    void setUp() {
        room = roomRepository.save(Room.builder()
                .tenantId(TENANT)
                .name("Garden Room")
                .basePricePerNight(new BigDecimal("1000"))
                .currency("ZAR")
                .totalUnits(2)
                .maxGuests(2)
                .minStayNights(1)
                .active(true)
                .build());
        jdbcTemplate.execute("ALTER TABLE seasonal_rates RENAME TO seasonal_rates_offline");
    }

    @AfterEach
    void restoreRateTable() {
        jdbcTemplate.execute("ALTER TABLE IF EXISTS seasonal_rates_offline RENAME TO seasonal_rates");
    }

    @Test
    @DisplayName("failed rate lookup inside a booking transaction: base price, ledger insert still runs, commit succeeds")
    void rateLookupFails_bookingTransactionStillCommits() {
        StayRange stay = StayRange.of(LocalDate.of(2026, 12, 23), LocalDate.of(2026, 12, 25));
        TransactionTemplate bookingTransaction = new TransactionTemplate(transactionManager);

        Quote quote = bookingTransaction.execute(status -> {
            Quote priced = pricingService.priceStay(room, stay, List.of(), 1);
            for (LocalDate night : stay.nights()) {
                occupancyRepository.insertNightIfAbsent(TENANT, room.getId(), night);
            }
            return priced;
        });

        assertThat(quote.grandTotal()).isEqualByComparingTo("2000");
        assertThat(quote.nights()).allSatisfy(night -> assertThat(night.rateName()).isNull());
        assertThat(occupancyRepository.findByTenantIdAndRoomIdAndNightDateBetweenOrderByNightDate(
                TENANT, room.getId(), stay.checkIn(), stay.checkOut().minusDays(1))).hasSize(2);
    }

    @Test
    @DisplayName("failed rate lookup on the pricing endpoint returns base prices instead of a rollback error")
    void rateLookupFails_nightlyPricingCommits() {
        RoomPricingResponse pricing = pricingService.getNightlyPricing(
                TENANT, room.getId(), LocalDate.of(2026, 12, 23), LocalDate.of(2026, 12, 26));

        assertThat(pricing.nightCount()).isEqualTo(3);
        assertThat(pricing.subtotal()).isEqualByComparingTo("3000");
    }
}
