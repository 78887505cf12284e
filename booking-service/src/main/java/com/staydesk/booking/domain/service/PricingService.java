package com.staydesk.booking.domain.service;

import com.staydesk.booking.api.dto.AddOnSelectionRequest;
import com.staydesk.booking.api.dto.QuoteRequest;
import com.staydesk.booking.api.dto.QuoteResponse;
import com.staydesk.booking.api.dto.RoomPricingResponse;
import com.staydesk.booking.domain.model.AddOn;
import com.staydesk.booking.domain.model.Room;
import com.staydesk.booking.domain.repository.AddOnRepository;
import com.staydesk.common.exception.BusinessException;
import com.staydesk.common.exception.ResourceNotFoundException;
import com.staydesk.common.exception.ServiceUnavailableException;
import com.staydesk.pricing.calendar.StayRange;
import com.staydesk.pricing.engine.QuoteAggregator;
import com.staydesk.pricing.model.AddOnSelection;
import com.staydesk.pricing.model.Quote;
import com.staydesk.pricing.model.RateOverride;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Prices stays for the quote endpoints, booking creation and add-on edits.
 *
 * Seasonal rates are loaded fresh for every call. When loading them fails the behaviour follows
 * {@code booking.pricing.rate-lookup-failure-mode}:
 * - fail-open (default): price every night at the base price and log a warning
 * - fail-closed: reject the quote with 503
 * The lookup runs in its own transaction ({@link SeasonalRateLookup}), so fail-open never leaves
 * the caller's transaction marked rollback-only.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PricingService {

    static final String FAIL_CLOSED = "fail-closed";

    private final RoomService roomService;
    private final SeasonalRateLookup rateLookup;
    private final AddOnRepository addOnRepository;
    private final QuoteAggregator quoteAggregator;

    @Value("${booking.pricing.rate-lookup-failure-mode:fail-open}")
    private String rateLookupFailureMode;

    @Transactional(readOnly = true)
    public RoomPricingResponse getNightlyPricing(UUID tenantId, Long roomId, LocalDate checkIn, LocalDate checkOut) {
        StayRange stay = StayRange.of(checkIn, checkOut);
        Room room = roomService.requireActiveRoom(tenantId, roomId);
        Quote quote = priceStay(room, stay, List.of(), 1);
        return RoomPricingResponse.from(room.getId(), room.getName(), quote);
    }

    @Transactional(readOnly = true)
    public QuoteResponse quote(UUID tenantId, Long roomId, QuoteRequest request) {
        StayRange stay = StayRange.of(request.checkIn(), request.checkOut());
        Room room = roomService.requireActiveRoom(tenantId, roomId);
        int guests = request.guests() == null ? 1 : request.guests();
        requireGuestsFit(room, guests);

        List<AddOnSelection> addOns = resolveAddOns(tenantId, room, request.addons());
        Quote quote = priceStay(room, stay, addOns, guests);
        return QuoteResponse.from(room.getId(), room.getName(), stay.checkIn(), stay.checkOut(), quote);
    }

    public Quote priceStay(Room room, StayRange stay, Collection<AddOnSelection> addOns, int guests) {
        List<RateOverride> rates = loadRates(room, stay);
        return quoteAggregator.buildQuote(room.toPricedRoom(), stay, rates, addOns, guests);
    }

    /**
     * Turns requested add-on ids into priced selections, checking each is active, offered with
     * the room and within its maximum quantity.
     */
    public List<AddOnSelection> resolveAddOns(UUID tenantId, Room room, List<AddOnSelectionRequest> requested) {
        if (requested == null || requested.isEmpty()) {
            return List.of();
        }
        List<Long> ids = requested.stream().map(AddOnSelectionRequest::addonId).distinct().toList();
        Map<Long, AddOn> catalog = addOnRepository.findByTenantIdAndActiveTrueAndIdIn(tenantId, ids).stream()
                .collect(Collectors.toMap(AddOn::getId, Function.identity()));

        List<AddOnSelection> selections = new ArrayList<>();
        for (AddOnSelectionRequest selection : requested) {
            AddOn addOn = catalog.get(selection.addonId());
            if (addOn == null) {
                throw new ResourceNotFoundException("Add-on", selection.addonId());
            }
            if (!addOn.isOfferedWith(room.getId())) {
                throw new BusinessException(
                        String.format("Add-on '%s' is not available for room %s", addOn.getName(), room.getName()),
                        "ADDON_NOT_AVAILABLE");
            }
            if (selection.quantity() > addOn.getMaxQuantity()) {
                throw new BusinessException(
                        String.format("At most %d of add-on '%s' can be ordered", addOn.getMaxQuantity(), addOn.getName()),
                        "ADDON_QUANTITY_EXCEEDED");
            }
            selections.add(addOn.select(selection.quantity()));
        }
        return selections;
    }

    public void requireGuestsFit(Room room, int guests) {
        if (guests > room.getMaxGuests()) {
            throw new BusinessException(
                    String.format("Room %s sleeps at most %d guests", room.getName(), room.getMaxGuests()),
                    "MAX_GUESTS_EXCEEDED");
        }
    }

    private List<RateOverride> loadRates(Room room, StayRange stay) {
        try {
            return rateLookup.findCoveringRates(room, stay);
        } catch (DataAccessException | TransactionException e) {
            if (FAIL_CLOSED.equalsIgnoreCase(rateLookupFailureMode)) {
                log.error("Seasonal rate lookup failed for room {}; rejecting quote", room.getId(), e);
                throw new ServiceUnavailableException("Pricing temporarily unavailable. Please try again.", e);
            }
            log.warn("Seasonal rate lookup failed for room {}; pricing {} at base price", room.getId(), stay, e);
            return List.of();
        }
    }
}
