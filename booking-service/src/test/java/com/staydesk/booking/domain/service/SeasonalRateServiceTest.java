package com.staydesk.booking.domain.service;

import com.staydesk.booking.api.dto.SeasonalRateRequest;
import com.staydesk.booking.api.dto.SeasonalRateResponse;
import com.staydesk.booking.domain.model.Room;
import com.staydesk.booking.domain.model.SeasonalRate;
import com.staydesk.booking.domain.repository.SeasonalRateRepository;
import com.staydesk.common.exception.ResourceNotFoundException;
import com.staydesk.pricing.calendar.InvalidStayException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SeasonalRateServiceTest {

    private static final UUID TENANT = UUID.fromString("6f1c2a1e-0000-4000-8000-000000000001");

    @Mock
    private SeasonalRateRepository rateRepository;
    @Mock
    private RoomService roomService;

    @InjectMocks
    private SeasonalRateService service;

    @Test
    @DisplayName("createRate: a one-day window is valid and priority defaults to 0")
    void createRate_singleDay_defaultsPriority() {
        when(roomService.findRoom(TENANT, 10L)).thenReturn(Room.builder().id(10L).tenantId(TENANT).build());
        when(rateRepository.save(any(SeasonalRate.class))).thenAnswer(invocation -> invocation.getArgument(0));
        LocalDate newYearsEve = LocalDate.of(2026, 12, 31);

        SeasonalRateResponse result = service.createRate(TENANT, 10L,
                new SeasonalRateRequest("New Year's Eve", newYearsEve, newYearsEve, new BigDecimal("4000"), null));

        assertThat(result).isNotNull();
        verify(rateRepository).save(argThat(rate -> rate.getPriority() == 0 && rate.getRoomId().equals(10L)));
    }

    @Test
    @DisplayName("createRate: end before start is rejected and nothing is stored")
    void createRate_reversedWindow_throws() {
        when(roomService.findRoom(TENANT, 10L)).thenReturn(Room.builder().id(10L).tenantId(TENANT).build());

        assertThatThrownBy(() -> service.createRate(TENANT, 10L, new SeasonalRateRequest("Broken",
                LocalDate.of(2026, 12, 31), LocalDate.of(2026, 12, 1), new BigDecimal("2000"), 1)))
                .isInstanceOf(InvalidStayException.class);
        verify(rateRepository, never()).save(any());
    }

    @Test
    @DisplayName("deleteRate: rates of another room are not found")
    void deleteRate_otherRoom_throws() {
        when(rateRepository.findByIdAndTenantIdAndRoomId(5L, TENANT, 11L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.deleteRate(TENANT, 11L, 5L))
                .isInstanceOf(ResourceNotFoundException.class);
        verify(rateRepository, never()).delete(any());
    }
}
