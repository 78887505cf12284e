package com.staydesk.booking.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.staydesk.booking.api.dto.AddOnSelectionRequest;
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
import com.staydesk.booking.domain.model.PaymentStatus;
import com.staydesk.booking.domain.model.Room;
import com.staydesk.booking.domain.repository.BookingIdempotencyRepository;
import com.staydesk.booking.domain.repository.BookingRepository;
import com.staydesk.booking.events.BookingEventPublisher;
import com.staydesk.booking.exception.BookingConflictException;
import com.staydesk.booking.exception.RoomUnavailableException;
import com.staydesk.common.exception.BusinessException;
import com.staydesk.common.exception.ServiceUnavailableException;
import com.staydesk.pricing.calendar.StayRange;
import com.staydesk.pricing.engine.QuoteAggregator;
import com.staydesk.pricing.engine.RateResolver;
import com.staydesk.pricing.model.AddOnLine;
import com.staydesk.pricing.model.AddOnPricingType;
import com.staydesk.pricing.model.AddOnSelection;
import com.staydesk.pricing.model.AvailabilityVerdict;
import com.staydesk.pricing.model.BookingStatus;
import com.staydesk.pricing.model.Quote;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link BookingService}: creation through the availability check, pricing and
 * ledger claim; idempotent replay; cancellation and status rules; add-on edits on a frozen
 * room charge; and the retry check for failed bookings.
 */
@ExtendWith(MockitoExtension.class)
class BookingServiceTest {

    private static final UUID TENANT = UUID.fromString("6f1c2a1e-0000-4000-8000-000000000001");
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-12-01T08:00:00Z"), ZoneOffset.UTC);
    private static final LocalDate CHECK_IN = LocalDate.of(2026, 12, 23);
    private static final LocalDate CHECK_OUT = LocalDate.of(2026, 12, 27);
    private static final String KEY = "checkout-42";

    @Mock
    private BookingRepository bookingRepository;
    @Mock
    private BookingIdempotencyRepository idempotencyRepository;
    @Mock
    private RoomService roomService;
    @Mock
    private AvailabilityService availabilityService;
    @Mock
    private PricingService pricingService;
    @Mock
    private RoomNightLedger roomNightLedger;
    @Mock
    private BookingReferenceGenerator referenceGenerator;
    @Mock
    private BookingEventPublisher eventPublisher;
    @Mock
    private ObjectMapper objectMapper;
    @Mock
    private StringRedisTemplate stringRedisTemplate;
    @Mock
    private ValueOperations<String, String> valueOps;

    private BookingService service;
    private Room room;

    @BeforeEach
    void setUp() {
        lenient().when(stringRedisTemplate.opsForValue()).thenReturn(valueOps);
        lenient().when(bookingRepository.save(any(Booking.class))).thenAnswer(invocation -> invocation.getArgument(0));
        lenient().when(referenceGenerator.nextReference()).thenReturn("BK-MZ1-TEST");

        service = new BookingService(
                bookingRepository,
                idempotencyRepository,
                roomService,
                availabilityService,
                pricingService,
                new QuoteAggregator(new RateResolver()),
                roomNightLedger,
                referenceGenerator,
                eventPublisher,
                objectMapper,
                CLOCK
        );
        ReflectionTestUtils.setField(service, "idempotencyRedisCacheEnabled", true);
        ReflectionTestUtils.setField(service, "stringRedisTemplate", stringRedisTemplate);

        room = Room.builder()
                .id(10L)
                .tenantId(TENANT)
                .name("Sea View Suite")
                .basePricePerNight(new BigDecimal("1000"))
                .currency("ZAR")
                .totalUnits(1)
                .maxGuests(4)
                .minStayNights(2)
                .maxStayNights(14)
                .active(true)
                .build();
    }

    @Test
    @DisplayName("createBooking: available room is priced, claimed and saved as pending with frozen totals")
    void createBooking_available_claimsNightsAndSavesPending() {
        CreateBookingRequest request = bookingRequest(null, List.of(new AddOnSelectionRequest(7L, 2)));
        List<AddOnSelection> selections = List.of(AddOnSelection.perBooking(7L, "Breakfast", new BigDecimal("150"), 2));
        givenRoomAvailable();
        when(pricingService.resolveAddOns(TENANT, room, request.addons())).thenReturn(selections);
        when(pricingService.priceStay(room, StayRange.of(CHECK_IN, CHECK_OUT), selections, 2)).thenReturn(quote());

        BookingResponse result = service.createBooking(TENANT, request, null);

        assertThat(result.reference()).isEqualTo("BK-MZ1-TEST");
        assertThat(result.status()).isEqualTo("pending");
        assertThat(result.channel()).isEqualTo("online");
        assertThat(result.baseTotal()).isEqualByComparingTo("8500");
        assertThat(result.addonsTotal()).isEqualByComparingTo("300");
        assertThat(result.totalAmount()).isEqualByComparingTo("8800");
        assertThat(result.addons()).hasSize(1);
        assertThat(result.createdAt()).isEqualTo(LocalDateTime.of(2026, 12, 1, 8, 0));
        verify(roomNightLedger).claim(room, StayRange.of(CHECK_IN, CHECK_OUT));
        verify(eventPublisher).publishBookingCreated(any(Booking.class));
        verify(idempotencyRepository, never()).save(any());
    }

    @Test
    @DisplayName("createBooking: staff channel bookings start confirmed")
    void createBooking_staffChannel_startsConfirmed() {
        CreateBookingRequest request = bookingRequest(BookingChannel.STAFF, null);
        givenRoomAvailable();
        when(pricingService.resolveAddOns(TENANT, room, null)).thenReturn(List.of());
        when(pricingService.priceStay(any(), any(), anyCollection(), anyInt())).thenReturn(quote());

        BookingResponse result = service.createBooking(TENANT, request, null);

        assertThat(result.status()).isEqualTo("confirmed");
        assertThat(result.channel()).isEqualTo("staff");
    }

    @Test
    @DisplayName("createBooking: full room is rejected before pricing and nothing is claimed")
    void createBooking_unavailable_throwsRoomUnavailable() {
        CreateBookingRequest request = bookingRequest(null, null);
        AvailabilityVerdict full = new AvailabilityVerdict(false, 1, 1, 0, List.of(99L));
        when(roomService.requireActiveRoom(TENANT, 10L)).thenReturn(room);
        when(availabilityService.verdict(room, StayRange.of(CHECK_IN, CHECK_OUT), null)).thenReturn(full);

        assertThatThrownBy(() -> service.createBooking(TENANT, request, null))
                .isInstanceOf(RoomUnavailableException.class)
                .satisfies(ex -> assertThat(((RoomUnavailableException) ex).getVerdict().conflictingBookingIds())
                        .containsExactly(99L));

        verify(pricingService, never()).priceStay(any(), any(), anyCollection(), anyInt());
        verifyNoInteractions(roomNightLedger);
        verify(bookingRepository, never()).save(any());
    }

    @Test
    @DisplayName("createBooking: a concurrent booking taking the last unit surfaces as a commit conflict")
    void createBooking_ledgerConflict_propagatesAndSavesNothing() {
        CreateBookingRequest request = bookingRequest(null, null);
        givenRoomAvailable();
        when(pricingService.resolveAddOns(TENANT, room, null)).thenReturn(List.of());
        when(pricingService.priceStay(any(), any(), anyCollection(), anyInt())).thenReturn(quote());
        doThrow(new BookingConflictException("taken")).when(roomNightLedger).claim(any(), any());

        assertThatThrownBy(() -> service.createBooking(TENANT, request, null))
                .isInstanceOf(BookingConflictException.class);

        verify(bookingRepository, never()).save(any());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("createBooking: stays shorter than the room minimum are refused")
    void createBooking_belowMinStay_throws() {
        CreateBookingRequest request = new CreateBookingRequest(10L, CHECK_IN, CHECK_IN.plusDays(1), 2,
                "Thandi Nkosi", "thandi@example.com", null, null, null, null);
        when(roomService.requireActiveRoom(TENANT, 10L)).thenReturn(room);

        assertThatThrownBy(() -> service.createBooking(TENANT, request, null))
                .isInstanceOf(BusinessException.class)
                .hasFieldOrPropertyWithValue("errorCode", "MIN_STAY_NOT_MET");
        verifyNoInteractions(availabilityService, roomNightLedger);
    }

    @Test
    @DisplayName("createBooking with key, cache miss: idempotency row saved under tenant-scoped key and Redis warmed")
    void createBooking_withKey_cacheMiss_savesIdempotency() throws JsonProcessingException {
        CreateBookingRequest request = bookingRequest(null, null);
        String storageKey = TENANT + ":" + KEY;
        when(valueOps.get("idempotency:booking:" + storageKey)).thenReturn(null);
        when(idempotencyRepository.findById(storageKey)).thenReturn(Optional.empty());
        givenRoomAvailable();
        when(pricingService.resolveAddOns(TENANT, room, null)).thenReturn(List.of());
        when(pricingService.priceStay(any(), any(), anyCollection(), anyInt())).thenReturn(quote());
        when(objectMapper.writeValueAsString(any(BookingResponse.class))).thenReturn("{\"reference\":\"BK-MZ1-TEST\"}");

        service.createBooking(TENANT, request, KEY);

        verify(idempotencyRepository).save(argThat(row ->
                row.getIdempotencyKey().equals(storageKey) && row.getTenantId().equals(TENANT)));
        verify(valueOps).set(eq("idempotency:booking:" + storageKey), eq("{\"reference\":\"BK-MZ1-TEST\"}"), any());
    }

    @Test
    @DisplayName("createBooking with key, DB hit: first booking replayed and no second booking created")
    void createBooking_withKey_dbHit_replaysWithoutBooking() throws JsonProcessingException {
        String storageKey = TENANT + ":" + KEY;
        BookingResponse first = BookingResponse.from(booking(BookingStatus.PENDING));
        when(valueOps.get("idempotency:booking:" + storageKey)).thenReturn(null);
        when(idempotencyRepository.findById(storageKey)).thenReturn(Optional.of(
                new BookingIdempotency(storageKey, TENANT, "{json}", null)));
        when(objectMapper.readValue("{json}", BookingResponse.class)).thenReturn(first);

        BookingResponse result = service.createBooking(TENANT, bookingRequest(null, null), KEY);

        assertThat(result).isEqualTo(first);
        verifyNoInteractions(roomService, availabilityService, roomNightLedger, eventPublisher);
    }

    @Test
    @DisplayName("createBooking with key: idempotency store down yields 503 instead of risking a duplicate")
    void createBooking_withKey_dbFailure_throwsServiceUnavailable() {
        String storageKey = TENANT + ":" + KEY;
        ReflectionTestUtils.setField(service, "idempotencyRedisCacheEnabled", false);
        when(idempotencyRepository.findById(storageKey)).thenThrow(new DataAccessResourceFailureException("down"));

        assertThatThrownBy(() -> service.createBooking(TENANT, bookingRequest(null, null), KEY))
                .isInstanceOf(ServiceUnavailableException.class);
        verifyNoInteractions(roomNightLedger);
    }

    @Test
    @DisplayName("cancelBooking: pending booking before check-in is cancelled and its nights released")
    void cancelBooking_beforeCheckIn_releasesNights() {
        Booking booking = booking(BookingStatus.PENDING);
        when(bookingRepository.findByIdAndTenantId(1L, TENANT)).thenReturn(Optional.of(booking));

        BookingResponse result = service.cancelBooking(TENANT, 1L, new CancelBookingRequest("Change of plans"));

        assertThat(result.status()).isEqualTo("cancelled");
        assertThat(booking.getCancellationReason()).isEqualTo("Change of plans");
        assertThat(booking.getCancelledAt()).isNotNull();
        verify(roomNightLedger).release(booking);
        verify(eventPublisher).publishBookingCancelled(booking, "Change of plans");
    }

    @Test
    @DisplayName("cancelBooking: failed bookings hold no nights so nothing is released")
    void cancelBooking_paymentFailed_doesNotRelease() {
        Booking booking = booking(BookingStatus.PAYMENT_FAILED);
        when(bookingRepository.findByIdAndTenantId(1L, TENANT)).thenReturn(Optional.of(booking));

        BookingResponse result = service.cancelBooking(TENANT, 1L, null);

        assertThat(result.status()).isEqualTo("cancelled");
        assertThat(booking.getCancellationReason()).isEqualTo("Cancelled by guest");
        verifyNoInteractions(roomNightLedger);
    }

    @Test
    @DisplayName("cancelBooking: refused on the check-in day")
    void cancelBooking_onCheckInDay_throws() {
        Booking booking = booking(BookingStatus.CONFIRMED);
        booking.setCheckInDate(LocalDate.now(CLOCK));
        booking.setCheckOutDate(LocalDate.now(CLOCK).plusDays(2));
        when(bookingRepository.findByIdAndTenantId(1L, TENANT)).thenReturn(Optional.of(booking));

        assertThatThrownBy(() -> service.cancelBooking(TENANT, 1L, null))
                .isInstanceOf(BusinessException.class)
                .hasFieldOrPropertyWithValue("errorCode", "CANCELLATION_NOT_ALLOWED");
        verifyNoInteractions(roomNightLedger);
    }

    @Test
    @DisplayName("cancelBooking: checked-in bookings cannot be cancelled")
    void cancelBooking_checkedIn_throws() {
        Booking booking = booking(BookingStatus.CHECKED_IN);
        when(bookingRepository.findByIdAndTenantId(1L, TENANT)).thenReturn(Optional.of(booking));

        assertThatThrownBy(() -> service.cancelBooking(TENANT, 1L, null))
                .isInstanceOf(BusinessException.class)
                .hasFieldOrPropertyWithValue("errorCode", "CANCELLATION_NOT_ALLOWED");
    }

    @Test
    @DisplayName("updateStatus: pending to payment_failed frees the nights")
    void updateStatus_toPaymentFailed_releasesNights() {
        Booking booking = booking(BookingStatus.PENDING);
        when(bookingRepository.findByIdAndTenantId(1L, TENANT)).thenReturn(Optional.of(booking));

        BookingResponse result = service.updateStatus(TENANT, 1L, new UpdateBookingStatusRequest("payment_failed", null));

        assertThat(result.status()).isEqualTo("payment_failed");
        verify(roomNightLedger).release(booking);
    }

    @Test
    @DisplayName("updateStatus: confirmed to checked_in keeps the nights and records payment")
    void updateStatus_toCheckedIn_keepsNights() {
        Booking booking = booking(BookingStatus.CONFIRMED);
        when(bookingRepository.findByIdAndTenantId(1L, TENANT)).thenReturn(Optional.of(booking));

        BookingResponse result = service.updateStatus(TENANT, 1L,
                new UpdateBookingStatusRequest("checked_in", PaymentStatus.PAID));

        assertThat(result.status()).isEqualTo("checked_in");
        assertThat(result.paymentStatus()).isEqualTo("paid");
        verifyNoInteractions(roomNightLedger);
    }

    @Test
    @DisplayName("updateStatus: reviving a failed booking re-checks availability without counting itself")
    void updateStatus_revive_reclaimsNightsAndCountsRetry() {
        Booking booking = booking(BookingStatus.PAYMENT_FAILED);
        when(bookingRepository.findByIdAndTenantId(1L, TENANT)).thenReturn(Optional.of(booking));
        when(roomService.requireActiveRoom(TENANT, 10L)).thenReturn(room);
        when(availabilityService.verdict(room, booking.stay(), 1L))
                .thenReturn(new AvailabilityVerdict(true, 1, 0, 1, List.of()));

        BookingResponse result = service.updateStatus(TENANT, 1L, new UpdateBookingStatusRequest("pending", null));

        assertThat(result.status()).isEqualTo("pending");
        assertThat(result.retryCount()).isEqualTo(1);
        verify(roomNightLedger).claim(room, booking.stay());
    }

    @Test
    @DisplayName("updateStatus: transitions outside the lifecycle are refused")
    void updateStatus_invalidTransition_throws() {
        Booking booking = booking(BookingStatus.COMPLETED);
        when(bookingRepository.findByIdAndTenantId(1L, TENANT)).thenReturn(Optional.of(booking));

        assertThatThrownBy(() -> service.updateStatus(TENANT, 1L, new UpdateBookingStatusRequest("pending", null)))
                .isInstanceOf(BusinessException.class)
                .hasFieldOrPropertyWithValue("errorCode", "INVALID_STATUS_TRANSITION");
    }

    @Test
    @DisplayName("updateStatus: unknown status codes are a validation error")
    void updateStatus_unknownStatus_throwsValidation() {
        when(bookingRepository.findByIdAndTenantId(1L, TENANT)).thenReturn(Optional.of(booking(BookingStatus.PENDING)));

        assertThatThrownBy(() -> service.updateStatus(TENANT, 1L, new UpdateBookingStatusRequest("on_hold", null)))
                .isInstanceOf(BusinessException.class)
                .hasFieldOrPropertyWithValue("errorCode", "VALIDATION_ERROR");
    }

    @Test
    @DisplayName("updateAddOns: room charge stays frozen while add-ons are priced again")
    void updateAddOns_keepsFrozenRoomCharge() {
        Booking booking = booking(BookingStatus.CONFIRMED);
        List<AddOnSelectionRequest> requested = List.of(new AddOnSelectionRequest(8L, 1));
        List<AddOnSelection> selections = List.of(
                new AddOnSelection(8L, "Airport transfer", new BigDecimal("600"), 1, AddOnPricingType.PER_BOOKING));
        when(bookingRepository.findByIdAndTenantId(1L, TENANT)).thenReturn(Optional.of(booking));
        when(roomService.findRoom(TENANT, 10L)).thenReturn(room);
        when(pricingService.resolveAddOns(TENANT, room, requested)).thenReturn(selections);

        BookingResponse result = service.updateAddOns(TENANT, 1L, new UpdateAddOnsRequest(requested));

        assertThat(result.baseTotal()).isEqualByComparingTo("8500");
        assertThat(result.addonsTotal()).isEqualByComparingTo("600");
        assertThat(result.totalAmount()).isEqualByComparingTo("9100");
        assertThat(result.addons()).singleElement()
                .satisfies(line -> assertThat(line.name()).isEqualTo("Airport transfer"));
        verify(pricingService, never()).priceStay(any(), any(), anyCollection(), anyInt());
    }

    @Test
    @DisplayName("updateAddOns: rows without a stored base total derive it from total minus add-ons")
    void updateAddOns_legacyRow_derivesRoomCharge() {
        Booking booking = booking(BookingStatus.PENDING);
        booking.setBaseTotal(null);
        booking.setAddonsTotal(new BigDecimal("300"));
        booking.setTotalAmount(new BigDecimal("8800"));
        when(bookingRepository.findByIdAndTenantId(1L, TENANT)).thenReturn(Optional.of(booking));
        when(roomService.findRoom(TENANT, 10L)).thenReturn(room);
        when(pricingService.resolveAddOns(TENANT, room, List.of())).thenReturn(List.of());

        BookingResponse result = service.updateAddOns(TENANT, 1L, new UpdateAddOnsRequest(List.of()));

        assertThat(result.baseTotal()).isEqualByComparingTo("8500");
        assertThat(result.addonsTotal()).isEqualByComparingTo("0");
        assertThat(result.totalAmount()).isEqualByComparingTo("8500");
        assertThat(booking.getBaseTotal()).isEqualByComparingTo("8500");
    }

    @Test
    @DisplayName("updateAddOns: not allowed once the guest has checked in")
    void updateAddOns_checkedIn_throws() {
        when(bookingRepository.findByIdAndTenantId(1L, TENANT)).thenReturn(Optional.of(booking(BookingStatus.CHECKED_IN)));

        assertThatThrownBy(() -> service.updateAddOns(TENANT, 1L, new UpdateAddOnsRequest(List.of())))
                .isInstanceOf(BusinessException.class)
                .hasFieldOrPropertyWithValue("errorCode", "MODIFICATION_NOT_ALLOWED");
    }

    @Test
    @DisplayName("checkRetryAvailability: available again at a new price reports the drift")
    void checkRetryAvailability_priceDrift_reportsChange() {
        Booking booking = booking(BookingStatus.PAYMENT_FAILED);
        booking.setRetryCount(1);
        when(bookingRepository.findByIdAndTenantId(1L, TENANT)).thenReturn(Optional.of(booking));
        when(roomService.findRoom(TENANT, 10L)).thenReturn(room);
        when(availabilityService.verdict(room, booking.stay(), 1L))
                .thenReturn(new AvailabilityVerdict(true, 1, 0, 1, List.of()));
        when(pricingService.priceStay(eq(room), eq(booking.stay()), anyCollection(), eq(2)))
                .thenReturn(quoteWithTotal("9300"));

        RetryAvailabilityResponse result = service.checkRetryAvailability(TENANT, 1L);

        assertThat(result.available()).isTrue();
        assertThat(result.pricingChanged()).isTrue();
        assertThat(result.originalTotal()).isEqualByComparingTo("8800");
        assertThat(result.newTotal()).isEqualByComparingTo("9300");
        assertThat(result.retryCount()).isEqualTo(1);
        assertThat(result.retriesRemaining()).isEqualTo(2);
    }

    @Test
    @DisplayName("checkRetryAvailability: differences of one currency unit or less are not a price change")
    void checkRetryAvailability_withinTolerance_unchanged() {
        Booking booking = booking(BookingStatus.CART_ABANDONED);
        when(bookingRepository.findByIdAndTenantId(1L, TENANT)).thenReturn(Optional.of(booking));
        when(roomService.findRoom(TENANT, 10L)).thenReturn(room);
        when(availabilityService.verdict(room, booking.stay(), 1L))
                .thenReturn(new AvailabilityVerdict(true, 1, 0, 1, List.of()));
        when(pricingService.priceStay(any(), any(), anyCollection(), anyInt())).thenReturn(quoteWithTotal("8800.75"));

        RetryAvailabilityResponse result = service.checkRetryAvailability(TENANT, 1L);

        assertThat(result.pricingChanged()).isFalse();
    }

    @Test
    @DisplayName("checkRetryAvailability: room taken meanwhile reports unavailable without a new price")
    void checkRetryAvailability_roomTaken_noNewTotal() {
        Booking booking = booking(BookingStatus.PAYMENT_FAILED);
        when(bookingRepository.findByIdAndTenantId(1L, TENANT)).thenReturn(Optional.of(booking));
        when(roomService.findRoom(TENANT, 10L)).thenReturn(room);
        when(availabilityService.verdict(room, booking.stay(), 1L))
                .thenReturn(new AvailabilityVerdict(false, 1, 1, 0, List.of(2L)));

        RetryAvailabilityResponse result = service.checkRetryAvailability(TENANT, 1L);

        assertThat(result.available()).isFalse();
        assertThat(result.pricingChanged()).isFalse();
        assertThat(result.newTotal()).isNull();
        verify(pricingService, never()).priceStay(any(), any(), anyCollection(), anyInt());
    }

    @Test
    @DisplayName("checkRetryAvailability: refused after three retries")
    void checkRetryAvailability_tooManyRetries_throws() {
        Booking booking = booking(BookingStatus.PAYMENT_FAILED);
        booking.setRetryCount(BookingService.MAX_RETRIES);
        when(bookingRepository.findByIdAndTenantId(1L, TENANT)).thenReturn(Optional.of(booking));

        assertThatThrownBy(() -> service.checkRetryAvailability(TENANT, 1L))
                .isInstanceOf(BusinessException.class)
                .hasFieldOrPropertyWithValue("errorCode", "TOO_MANY_RETRIES");
    }

    @Test
    @DisplayName("checkRetryAvailability: refused once the check-in date has passed")
    void checkRetryAvailability_checkInPassed_throws() {
        Booking booking = booking(BookingStatus.PAYMENT_FAILED);
        booking.setCheckInDate(LocalDate.of(2026, 11, 28));
        booking.setCheckOutDate(LocalDate.of(2026, 11, 30));
        when(bookingRepository.findByIdAndTenantId(1L, TENANT)).thenReturn(Optional.of(booking));

        assertThatThrownBy(() -> service.checkRetryAvailability(TENANT, 1L))
                .isInstanceOf(BusinessException.class)
                .hasFieldOrPropertyWithValue("errorCode", "CHECK_IN_PASSED");
    }

    @Test
    @DisplayName("checkRetryAvailability: a paid confirmed booking is already complete")
    void checkRetryAvailability_paidBooking_throws() {
        Booking booking = booking(BookingStatus.CONFIRMED);
        booking.setPaymentStatus(PaymentStatus.PAID);
        when(bookingRepository.findByIdAndTenantId(1L, TENANT)).thenReturn(Optional.of(booking));

        assertThatThrownBy(() -> service.checkRetryAvailability(TENANT, 1L))
                .isInstanceOf(BusinessException.class)
                .hasFieldOrPropertyWithValue("errorCode", "ALREADY_COMPLETED");
    }

    private void givenRoomAvailable() {
        when(roomService.requireActiveRoom(TENANT, 10L)).thenReturn(room);
        when(availabilityService.verdict(room, StayRange.of(CHECK_IN, CHECK_OUT), null))
                .thenReturn(new AvailabilityVerdict(true, 1, 0, 1, List.of()));
    }

    private static CreateBookingRequest bookingRequest(BookingChannel channel, List<AddOnSelectionRequest> addons) {
        return new CreateBookingRequest(10L, CHECK_IN, CHECK_OUT, 2, "Thandi Nkosi", "thandi@example.com",
                "+27 82 555 0101", null, channel, addons);
    }

    private static Quote quote() {
        AddOnLine breakfast = new AddOnLine(7L, "Breakfast", new BigDecimal("150"), 2,
                AddOnPricingType.PER_BOOKING, new BigDecimal("300"));
        return new Quote(List.of(), List.of(breakfast), new BigDecimal("8500"), new BigDecimal("300"),
                new BigDecimal("8800"), "ZAR", 4);
    }

    private static Quote quoteWithTotal(String grandTotal) {
        BigDecimal total = new BigDecimal(grandTotal);
        return new Quote(List.of(), List.of(), total, BigDecimal.ZERO, total, "ZAR", 4);
    }

    private static Booking booking(BookingStatus status) {
        List<BookingAddOnItem> addOns = new ArrayList<>();
        addOns.add(new BookingAddOnItem(7L, "Breakfast", new BigDecimal("150"), 2,
                AddOnPricingType.PER_BOOKING, new BigDecimal("300")));
        return Booking.builder()
                .id(1L)
                .tenantId(TENANT)
                .reference("BK-MZ0-ABCD")
                .roomId(10L)
                .roomName("Sea View Suite")
                .guestName("Thandi Nkosi")
                .guestEmail("thandi@example.com")
                .guests(2)
                .checkInDate(CHECK_IN)
                .checkOutDate(CHECK_OUT)
                .status(status)
                .paymentStatus(PaymentStatus.PENDING)
                .channel(BookingChannel.ONLINE)
                .baseTotal(new BigDecimal("8500"))
                .addonsTotal(new BigDecimal("300"))
                .totalAmount(new BigDecimal("8800"))
                .currency("ZAR")
                .addOns(addOns)
                .retryCount(0)
                .build();
    }
}
