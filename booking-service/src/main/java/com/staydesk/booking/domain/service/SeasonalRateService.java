package com.staydesk.booking.domain.service;

import com.staydesk.booking.api.dto.SeasonalRateRequest;
import com.staydesk.booking.api.dto.SeasonalRateResponse;
import com.staydesk.booking.domain.model.SeasonalRate;
import com.staydesk.booking.domain.repository.SeasonalRateRepository;
import com.staydesk.common.exception.ResourceNotFoundException;
import com.staydesk.pricing.calendar.DateWindow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Staff management of seasonal rates. Rates are read fresh on every quote, so changes apply
 * to the next quote and never to existing bookings.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SeasonalRateService {

    private final SeasonalRateRepository rateRepository;
    private final RoomService roomService;

    @Transactional
    public SeasonalRateResponse createRate(UUID tenantId, Long roomId, SeasonalRateRequest request) {
        roomService.findRoom(tenantId, roomId);
        DateWindow.of(request.startDate(), request.endDate());

        SeasonalRate rate = SeasonalRate.builder()
                .tenantId(tenantId)
                .roomId(roomId)
                .name(request.name())
                .startDate(request.startDate())
                .endDate(request.endDate())
                .pricePerNight(request.pricePerNight())
                .priority(request.priority() == null ? 0 : request.priority())
                .build();
        rate = rateRepository.save(rate);
        log.info("Created seasonal rate '{}' {}..{} (priority {}) for room {}",
                rate.getName(), rate.getStartDate(), rate.getEndDate(), rate.getPriority(), roomId);
        return SeasonalRateResponse.from(rate);
    }

    @Transactional
    public SeasonalRateResponse updateRate(UUID tenantId, Long roomId, Long rateId, SeasonalRateRequest request) {
        SeasonalRate rate = findRate(tenantId, roomId, rateId);
        DateWindow.of(request.startDate(), request.endDate());

        rate.setName(request.name());
        rate.setStartDate(request.startDate());
        rate.setEndDate(request.endDate());
        rate.setPricePerNight(request.pricePerNight());
        if (request.priority() != null) {
            rate.setPriority(request.priority());
        }
        return SeasonalRateResponse.from(rateRepository.save(rate));
    }

    @Transactional
    public void deleteRate(UUID tenantId, Long roomId, Long rateId) {
        rateRepository.delete(findRate(tenantId, roomId, rateId));
        log.info("Deleted seasonal rate {} of room {}", rateId, roomId);
    }

    @Transactional(readOnly = true)
    public List<SeasonalRateResponse> listRates(UUID tenantId, Long roomId) {
        roomService.findRoom(tenantId, roomId);
        return rateRepository.findByTenantIdAndRoomIdOrderByStartDateAscPriorityDesc(tenantId, roomId).stream()
                .map(SeasonalRateResponse::from)
                .toList();
    }

    private SeasonalRate findRate(UUID tenantId, Long roomId, Long rateId) {
        return rateRepository.findByIdAndTenantIdAndRoomId(rateId, tenantId, roomId)
                .orElseThrow(() -> new ResourceNotFoundException("Seasonal rate", rateId));
    }
}
