package com.staydesk.booking.domain.service;

import com.staydesk.booking.domain.model.Booking;
import com.staydesk.booking.domain.model.Room;
import com.staydesk.booking.domain.repository.RoomNightOccupancyRepository;
import com.staydesk.booking.domain.strategy.NightClaim;
import com.staydesk.booking.domain.strategy.ReservationStrategy;
import com.staydesk.pricing.calendar.StayRange;
import com.staydesk.pricing.model.BookingStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RoomNightLedgerTest {

    private static final UUID TENANT = UUID.fromString("6f1c2a1e-0000-4000-8000-000000000001");
    private static final StayRange STAY = StayRange.of(LocalDate.of(2027, 3, 1), LocalDate.of(2027, 3, 4));

    @Mock
    private ReservationStrategy distributed;
    @Mock
    private ReservationStrategy pessimistic;
    @Mock
    private RoomNightOccupancyRepository occupancyRepository;

    private RoomNightLedger ledger;
    private Room room;

    @BeforeEach
    void setUp() {
        ledger = new RoomNightLedger(Map.of("distributed", distributed, "pessimistic", pessimistic), occupancyRepository);
        ReflectionTestUtils.setField(ledger, "strategyType", "pessimistic");
        room = Room.builder().id(10L).tenantId(TENANT).name("Loft").totalUnits(3).build();
    }

    @Test
    @DisplayName("claim: creates missing night rows, then claims through the configured strategy")
    void claim_insertsNightsThenDelegates() {
        ledger.claim(room, STAY);

        verify(occupancyRepository).insertNightIfAbsent(TENANT, 10L, LocalDate.of(2027, 3, 1));
        verify(occupancyRepository).insertNightIfAbsent(TENANT, 10L, LocalDate.of(2027, 3, 2));
        verify(occupancyRepository).insertNightIfAbsent(TENANT, 10L, LocalDate.of(2027, 3, 3));
        verify(pessimistic).claimNights(new NightClaim(TENANT, 10L, 3, STAY));
        verifyNoInteractions(distributed);
    }

    @Test
    @DisplayName("claim: unknown strategy name falls back to distributed")
    void claim_unknownStrategy_fallsBackToDistributed() {
        ReflectionTestUtils.setField(ledger, "strategyType", "sharded");

        ledger.claim(room, STAY);

        verify(distributed).claimNights(any(NightClaim.class));
        verifyNoInteractions(pessimistic);
    }

    @Test
    @DisplayName("release: gives back one unit on each night of the booking, check-out day excluded")
    void release_releasesEveryNight() {
        Booking booking = Booking.builder()
                .id(4L)
                .tenantId(TENANT)
                .roomId(10L)
                .reference("BK-4")
                .checkInDate(STAY.checkIn())
                .checkOutDate(STAY.checkOut())
                .status(BookingStatus.CONFIRMED)
                .build();
        when(occupancyRepository.releaseNight(eq(TENANT), eq(10L), any(LocalDate.class))).thenReturn(1);

        ledger.release(booking);

        verify(occupancyRepository, times(3)).releaseNight(eq(TENANT), eq(10L), any(LocalDate.class));
        verify(occupancyRepository, never()).releaseNight(TENANT, 10L, STAY.checkOut());
    }
}
