package com.staydesk.booking.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.staydesk.booking.api.dto.BookingResponse;
import com.staydesk.booking.api.dto.CancelBookingRequest;
import com.staydesk.booking.api.dto.CreateBookingRequest;
import com.staydesk.booking.api.dto.RetryAvailabilityResponse;
import com.staydesk.booking.api.dto.UpdateAddOnsRequest;
import com.staydesk.booking.api.dto.UpdateBookingStatusRequest;
import com.staydesk.booking.domain.model.Booking;
import com.staydesk.booking.domain.model.BookingAddOnItem;
import com.staydesk.booking.domain.model.BookingChannel;
import com.staydesk.booking.domain.model.BookingIdempotency;
import com.staydesk.booking.domain.model.BookingLifecycle;
import com.staydesk.booking.domain.model.PaymentStatus;
import com.staydesk.booking.domain.model.Room;
import com.staydesk.booking.domain.repository.BookingIdempotencyRepository;
import com.staydesk.booking.domain.repository.BookingRepository;
import com.staydesk.booking.events.BookingEventPublisher;
import com.staydesk.booking.exception.RoomUnavailableException;
import com.staydesk.common.exception.BusinessException;
import com.staydesk.common.exception.ResourceNotFoundException;
import com.staydesk.common.exception.ServiceUnavailableException;
import com.staydesk.common.util.Constants;
import com.staydesk.pricing.calendar.StayRange;
import com.staydesk.pricing.engine.QuoteAggregator;
import com.staydesk.pricing.model.AddOnSelection;
import com.staydesk.pricing.model.AvailabilityVerdict;
import com.staydesk.pricing.model.BookingStatus;
import com.staydesk.pricing.model.Quote;
import com.staydesk.pricing.model.StayRequestState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Booking lifecycle: creation, lookup, cancellation, status changes, add-on edits and the
 * retry check for failed bookings.
 *
 * Creation walks a stay request through DRAFT, then REJECTED_UNAVAILABLE or PRICED, then BOOKED.
 * None of these states is stored: the room-night claims and the booking row are written in one
 * transaction, and any failure after pricing rolls both back so the caller starts again from DRAFT.
 *
 * Idempotency is stored in the DB in the same transaction as the booking; Redis is an optional
 * read-through cache in front of it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingService {

    static final int MAX_RETRIES = 3;
    private static final BigDecimal PRICING_DRIFT_TOLERANCE = BigDecimal.ONE;
    private static final String IDEMPOTENCY_UNAVAILABLE_MSG =
            "Idempotency check temporarily unavailable. Retry with same key later.";
    private static final Duration REDIS_IDEMPOTENCY_TTL = Duration.ofHours(24);

    private final BookingRepository bookingRepository;
    private final BookingIdempotencyRepository idempotencyRepository;
    private final RoomService roomService;
    private final AvailabilityService availabilityService;
    private final PricingService pricingService;
    private final QuoteAggregator quoteAggregator;
    private final RoomNightLedger roomNightLedger;
    private final BookingReferenceGenerator referenceGenerator;
    private final BookingEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired(required = false)
    private StringRedisTemplate stringRedisTemplate;

    @Value("${booking.idempotency.redis-cache:true}")
    private boolean idempotencyRedisCacheEnabled;

    @Transactional
    public BookingResponse createBooking(UUID tenantId, CreateBookingRequest request, String idempotencyKey) {
        String storageKey = idempotencyStorageKey(tenantId, idempotencyKey);
        if (storageKey != null) {
            Optional<BookingResponse> cached = getCachedResponse(storageKey);
            if (cached.isPresent()) {
                log.info("Replaying booking {} for idempotency key {}", cached.get().reference(), idempotencyKey);
                return cached.get();
            }
        }

        StayRange stay = StayRange.of(request.checkIn(), request.checkOut());
        Room room = roomService.requireActiveRoom(tenantId, request.roomId());
        log.debug("Stay request {} for room {} is {}", stay, room.getId(), StayRequestState.DRAFT);
        pricingService.requireGuestsFit(room, request.guests());
        requireStayLength(room, stay);

        AvailabilityVerdict verdict = availabilityService.verdict(room, stay, null);
        if (!verdict.available()) {
            log.info("Stay request {} for room {} is {}: {} of {} units taken",
                    stay, room.getId(), StayRequestState.REJECTED_UNAVAILABLE,
                    verdict.peakOccupancy(), verdict.totalUnits());
            throw new RoomUnavailableException("Room is not available for the selected dates", verdict);
        }

        List<AddOnSelection> addOns = pricingService.resolveAddOns(tenantId, room, request.addons());
        Quote quote = pricingService.priceStay(room, stay, addOns, request.guests());
        log.debug("Stay request {} for room {} is {} at {} {}",
                stay, room.getId(), StayRequestState.PRICED, quote.grandTotal(), quote.currency());

        roomNightLedger.claim(room, stay);
        Booking booking = bookingRepository.save(newBooking(tenantId, room, stay, request, quote));
        log.info("Booking {} is {}: room {} {} total {} {}", booking.getReference(), StayRequestState.BOOKED,
                room.getId(), stay, booking.getTotalAmount(), booking.getCurrency());

        BookingResponse response = BookingResponse.from(booking);
        if (storageKey != null) {
            saveIdempotencyToDb(storageKey, tenantId, response);
            warmRedisCache(storageKey, response);
        }
        eventPublisher.publishBookingCreated(booking);
        return response;
    }

    @Transactional(readOnly = true)
    public BookingResponse getBookingByReference(UUID tenantId, String reference) {
        Booking booking = bookingRepository.findByTenantIdAndReference(tenantId, reference)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", reference));
        return BookingResponse.from(booking);
    }

    /**
     * Guest cancellation. Allowed until the day before check-in, for bookings not yet cancelled,
     * checked in, checked out or completed.
     */
    @Transactional
    public BookingResponse cancelBooking(UUID tenantId, Long bookingId, CancelBookingRequest request) {
        Booking booking = findBooking(tenantId, bookingId);
        if (!BookingLifecycle.isCancellable(booking.getStatus())) {
            throw new BusinessException("This booking cannot be cancelled in its current status.",
                    "CANCELLATION_NOT_ALLOWED");
        }
        if (!today().isBefore(booking.getCheckInDate())) {
            throw new BusinessException("Cannot cancel a booking after the check-in date has passed.",
                    "CANCELLATION_NOT_ALLOWED");
        }
        String reason = request == null || request.reason() == null || request.reason().isBlank()
                ? "Cancelled by guest"
                : request.reason();
        return BookingResponse.from(markCancelled(booking, reason));
    }

    /**
     * Staff status change. Leaving pending/confirmed/checked-in frees the nights; reviving a failed
     * booking re-checks availability and claims them again.
     */
    @Transactional
    public BookingResponse updateStatus(UUID tenantId, Long bookingId, UpdateBookingStatusRequest request) {
        Booking booking = findBooking(tenantId, bookingId);
        BookingStatus current = booking.getStatus();
        BookingStatus target = parseStatus(request.status());

        if (!BookingLifecycle.canTransition(current, target)) {
            throw new BusinessException(String.format("Cannot move booking %s from %s to %s",
                    booking.getReference(), current.code(), target.code()), "INVALID_STATUS_TRANSITION");
        }
        if (request.paymentStatus() != null) {
            booking.setPaymentStatus(request.paymentStatus());
        }
        if (target == BookingStatus.CANCELLED) {
            return BookingResponse.from(markCancelled(booking, "Cancelled by staff"));
        }

        if (BookingLifecycle.reclaims(current, target)) {
            reviveInventory(booking);
        } else if (BookingLifecycle.releases(current, target)) {
            roomNightLedger.release(booking);
        }
        booking.setStatus(target);
        booking = bookingRepository.save(booking);
        log.info("Booking {} moved from {} to {}", booking.getReference(), current.code(), target.code());
        return BookingResponse.from(booking);
    }

    /**
     * Replaces the add-ons of a booking before check-in. The room charge stays what it was at
     * booking time; only the add-on lines are priced again.
     */
    @Transactional
    public BookingResponse updateAddOns(UUID tenantId, Long bookingId, UpdateAddOnsRequest request) {
        Booking booking = findBooking(tenantId, bookingId);
        BookingStatus status = booking.getStatus();
        if (status != BookingStatus.PENDING && status != BookingStatus.CONFIRMED) {
            throw new BusinessException("Add-ons cannot be changed for a booking that is " + status.code(),
                    "MODIFICATION_NOT_ALLOWED");
        }
        if (!today().isBefore(booking.getCheckInDate())) {
            throw new BusinessException("Add-ons can only be changed before check-in", "MODIFICATION_NOT_ALLOWED");
        }

        Room room = roomService.findRoom(tenantId, booking.getRoomId());
        List<AddOnSelection> selections = pricingService.resolveAddOns(tenantId, room, request.addons());
        BigDecimal frozenBase = booking.roomCharge();
        Quote quote = quoteAggregator.repriceAddOns(frozenBase, booking.getCurrency(),
                booking.stay().nightCount(), booking.getGuests(), selections);

        booking.setBaseTotal(frozenBase);
        booking.getAddOns().clear();
        quote.addOns().forEach(line -> booking.getAddOns().add(BookingAddOnItem.from(line)));
        booking.setAddonsTotal(quote.addOnTotal());
        booking.setTotalAmount(quote.grandTotal());
        Booking saved = bookingRepository.save(booking);
        log.info("Booking {} add-ons updated: {} lines, total now {} {}", saved.getReference(),
                quote.addOns().size(), saved.getTotalAmount(), saved.getCurrency());
        return BookingResponse.from(saved);
    }

    /**
     * Whether a payment-failed or abandoned booking can be retried: the room must still have a
     * free unit (the booking itself is not counted against it) and the price is re-derived from
     * current rates to report drift of more than one currency unit.
     */
    @Transactional(readOnly = true)
    public RetryAvailabilityResponse checkRetryAvailability(UUID tenantId, Long bookingId) {
        Booking booking = findBooking(tenantId, bookingId);
        if (!booking.getStatus().isFailure()) {
            if (booking.getStatus() == BookingStatus.CONFIRMED && booking.getPaymentStatus() == PaymentStatus.PAID) {
                throw new BusinessException("This booking has already been completed successfully",
                        "ALREADY_COMPLETED");
            }
            throw new BusinessException("This is not a failed booking", "NOT_A_FAILED_BOOKING");
        }
        if (booking.getCheckInDate().isBefore(today())) {
            throw new BusinessException("The check-in date for this booking has passed", "CHECK_IN_PASSED");
        }
        if (booking.retriesSoFar() >= MAX_RETRIES) {
            throw new BusinessException("Multiple payment attempts have failed. Please contact support "
                    + "or try a different payment method.", "TOO_MANY_RETRIES");
        }

        StayRange stay = booking.stay();
        Room room = roomService.findRoom(tenantId, booking.getRoomId());
        boolean available = room.isActive() && availabilityService.verdict(room, stay, booking.getId()).available();

        BigDecimal newTotal = null;
        boolean pricingChanged = false;
        if (available) {
            List<AddOnSelection> addOns = booking.getAddOns().stream().map(BookingAddOnItem::toSelection).toList();
            newTotal = pricingService.priceStay(room, stay, addOns, booking.getGuests()).grandTotal();
            pricingChanged = newTotal.subtract(booking.getTotalAmount()).abs().compareTo(PRICING_DRIFT_TOLERANCE) > 0;
        }
        return new RetryAvailabilityResponse(
                booking.getId(),
                booking.getReference(),
                available,
                pricingChanged,
                booking.getTotalAmount(),
                newTotal,
                booking.getCurrency(),
                booking.retriesSoFar(),
                MAX_RETRIES - booking.retriesSoFar()
        );
    }

    private Booking newBooking(UUID tenantId, Room room, StayRange stay, CreateBookingRequest request, Quote quote) {
        BookingChannel channel = request.channel() == null ? BookingChannel.ONLINE : request.channel();
        Booking booking = Booking.builder()
                .tenantId(tenantId)
                .reference(referenceGenerator.nextReference())
                .roomId(room.getId())
                .roomName(room.getName())
                .guestName(request.guestName())
                .guestEmail(request.guestEmail())
                .guestPhone(request.guestPhone())
                .guests(request.guests())
                .checkInDate(stay.checkIn())
                .checkOutDate(stay.checkOut())
                .status(channel == BookingChannel.STAFF ? BookingStatus.CONFIRMED : BookingStatus.PENDING)
                .paymentStatus(PaymentStatus.PENDING)
                .channel(channel)
                .baseTotal(quote.baseTotal())
                .addonsTotal(quote.addOnTotal())
                .totalAmount(quote.grandTotal())
                .currency(quote.currency())
                .specialRequests(request.specialRequests())
                .retryCount(0)
                .createdAt(LocalDateTime.now(clock))
                .build();
        quote.addOns().forEach(line -> booking.getAddOns().add(BookingAddOnItem.from(line)));
        return booking;
    }

    private void requireStayLength(Room room, StayRange stay) {
        int nights = stay.nightCount();
        if (!room.meetsMinStay(nights)) {
            throw new BusinessException(String.format("Minimum stay for %s is %d nights",
                    room.getName(), room.getMinStayNights()), "MIN_STAY_NOT_MET");
        }
        if (!room.meetsMaxStay(nights)) {
            throw new BusinessException(String.format("Maximum stay for %s is %d nights",
                    room.getName(), room.getMaxStayNights()), "MAX_STAY_EXCEEDED");
        }
    }

    private void reviveInventory(Booking booking) {
        if (booking.retriesSoFar() >= MAX_RETRIES) {
            throw new BusinessException("Booking " + booking.getReference() + " has used all retries",
                    "TOO_MANY_RETRIES");
        }
        Room room = roomService.requireActiveRoom(booking.getTenantId(), booking.getRoomId());
        StayRange stay = booking.stay();
        AvailabilityVerdict verdict = availabilityService.verdict(room, stay, booking.getId());
        if (!verdict.available()) {
            throw new RoomUnavailableException("Room is no longer available for this booking's dates", verdict);
        }
        roomNightLedger.claim(room, stay);
        booking.setRetryCount(booking.retriesSoFar() + 1);
    }

    private Booking markCancelled(Booking booking, String reason) {
        if (booking.getStatus().occupiesInventory()) {
            roomNightLedger.release(booking);
        }
        booking.setStatus(BookingStatus.CANCELLED);
        booking.setCancellationReason(reason);
        booking.setCancelledAt(LocalDateTime.now(clock));
        Booking saved = bookingRepository.save(booking);
        log.info("Booking {} cancelled: {}", saved.getReference(), reason);
        eventPublisher.publishBookingCancelled(saved, reason);
        return saved;
    }

    private Booking findBooking(UUID tenantId, Long bookingId) {
        return bookingRepository.findByIdAndTenantId(bookingId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
    }

    private static BookingStatus parseStatus(String status) {
        try {
            return BookingStatus.fromCode(status);
        } catch (IllegalArgumentException e) {
            throw new BusinessException(e.getMessage(), e, "VALIDATION_ERROR");
        }
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }

    private static String idempotencyStorageKey(UUID tenantId, String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            return null;
        }
        return tenantId + ":" + idempotencyKey;
    }

    /**
     * Read: Redis first if enabled; on miss or error fall back to DB (source of truth).
     */
    private Optional<BookingResponse> getCachedResponse(String storageKey) {
        if (idempotencyRedisCacheEnabled && stringRedisTemplate != null) {
            try {
                String json = stringRedisTemplate.opsForValue().get(Constants.BOOKING_IDEMPOTENCY_PREFIX + storageKey);
                if (json != null) {
                    log.debug("Idempotency hit from Redis for key: {}", storageKey);
                    return Optional.of(objectMapper.readValue(json, BookingResponse.class));
                }
            } catch (Exception e) {
                log.debug("Redis idempotency read missed or failed, falling back to DB: {}", e.getMessage());
            }
        }
        return getCachedResponseFromDb(storageKey);
    }

    private Optional<BookingResponse> getCachedResponseFromDb(String storageKey) {
        try {
            return idempotencyRepository.findById(storageKey)
                    .map(row -> {
                        try {
                            return objectMapper.readValue(row.getResponseJson(), BookingResponse.class);
                        } catch (JsonProcessingException e) {
                            log.warn("Failed to deserialize cached booking for key: {}", storageKey, e);
                            throw new ServiceUnavailableException(IDEMPOTENCY_UNAVAILABLE_MSG, e);
                        }
                    });
        } catch (DataAccessException e) {
            log.warn("Idempotency store (DB) unavailable for key: {}", storageKey, e);
            throw new ServiceUnavailableException(IDEMPOTENCY_UNAVAILABLE_MSG, e);
        }
    }

    private void saveIdempotencyToDb(String storageKey, UUID tenantId, BookingResponse response) {
        try {
            String json = objectMapper.writeValueAsString(response);
            idempotencyRepository.save(new BookingIdempotency(storageKey, tenantId, json, LocalDateTime.now(clock)));
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize booking for idempotency key: {}", storageKey, e);
            throw new IllegalStateException("Idempotency save failed", e);
        }
    }

    /**
     * Best-effort: a Redis failure does not affect the booking transaction.
     */
    private void warmRedisCache(String storageKey, BookingResponse response) {
        if (!idempotencyRedisCacheEnabled || stringRedisTemplate == null) {
            return;
        }
        try {
            stringRedisTemplate.opsForValue().set(Constants.BOOKING_IDEMPOTENCY_PREFIX + storageKey,
                    objectMapper.writeValueAsString(response), REDIS_IDEMPOTENCY_TTL);
        } catch (Exception e) {
            log.warn("Failed to warm Redis idempotency cache for key: {} (non-fatal)", storageKey, e);
        }
    }
}
