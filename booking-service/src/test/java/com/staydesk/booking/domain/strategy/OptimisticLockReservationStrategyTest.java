package com.staydesk.booking.domain.strategy;

import com.staydesk.booking.domain.model.RoomNightOccupancy;
import com.staydesk.booking.domain.repository.RoomNightOccupancyRepository;
import com.staydesk.booking.exception.BookingConflictException;
import com.staydesk.pricing.calendar.StayRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class OptimisticLockReservationStrategyTest {

    private static final UUID TENANT = UUID.fromString("6f1c2a1e-0000-4000-8000-000000000001");
    private static final LocalDate CHECK_IN = LocalDate.of(2026, 12, 23);

    @Mock
    private RoomNightOccupancyRepository repository;

    @InjectMocks
    private OptimisticLockReservationStrategy strategy;

    @Test
    @DisplayName("claimNights() increments and flushes every night with capacity")
    void claimNights_success() {
        RoomNightOccupancy first = night(CHECK_IN, 0);
        RoomNightOccupancy second = night(CHECK_IN.plusDays(1), 1);
        given(repository.findByTenantIdAndRoomIdAndNightDate(TENANT, 101L, CHECK_IN)).willReturn(Optional.of(first));
        given(repository.findByTenantIdAndRoomIdAndNightDate(TENANT, 101L, CHECK_IN.plusDays(1)))
                .willReturn(Optional.of(second));

        strategy.claimNights(new NightClaim(TENANT, 101L, 2, StayRange.of(CHECK_IN, CHECK_IN.plusDays(2))));

        assertThat(first.getBookedUnits()).isEqualTo(1);
        assertThat(second.getBookedUnits()).isEqualTo(2);
        verify(repository, times(2)).saveAndFlush(any(RoomNightOccupancy.class));
    }

    @Test
    @DisplayName("claimNights() reports a version clash as CONFLICT_AT_COMMIT without trying later nights")
    void claimNights_versionClash_throwsBookingConflict() {
        given(repository.findByTenantIdAndRoomIdAndNightDate(TENANT, 101L, CHECK_IN))
                .willReturn(Optional.of(night(CHECK_IN, 0)));
        given(repository.saveAndFlush(any(RoomNightOccupancy.class)))
                .willThrow(new ObjectOptimisticLockingFailureException(RoomNightOccupancy.class, 7L));

        assertThatThrownBy(() -> strategy.claimNights(
                new NightClaim(TENANT, 101L, 1, StayRange.of(CHECK_IN, CHECK_IN.plusDays(2)))))
                .isInstanceOf(BookingConflictException.class)
                .hasFieldOrPropertyWithValue("errorCode", BookingConflictException.ERROR_CODE)
                .hasCauseInstanceOf(ObjectOptimisticLockingFailureException.class);
        verify(repository, never()).findByTenantIdAndRoomIdAndNightDate(TENANT, 101L, CHECK_IN.plusDays(1));
    }

    @Test
    @DisplayName("claimNights() refuses a full night before writing")
    void claimNights_fullNight_throwsBookingConflict() {
        given(repository.findByTenantIdAndRoomIdAndNightDate(TENANT, 101L, CHECK_IN))
                .willReturn(Optional.of(night(CHECK_IN, 1)));

        assertThatThrownBy(() -> strategy.claimNights(
                new NightClaim(TENANT, 101L, 1, StayRange.of(CHECK_IN, CHECK_IN.plusDays(1)))))
                .isInstanceOf(BookingConflictException.class);
        verify(repository, never()).saveAndFlush(any());
    }

    private RoomNightOccupancy night(LocalDate date, int bookedUnits) {
        return RoomNightOccupancy.builder()
                .id(7L)
                .tenantId(TENANT)
                .roomId(101L)
                .nightDate(date)
                .bookedUnits(bookedUnits)
                .version(0L)
                .build();
    }
}
