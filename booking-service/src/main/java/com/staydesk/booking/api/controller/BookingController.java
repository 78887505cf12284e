package com.staydesk.booking.api.controller;

import com.staydesk.booking.api.dto.BookingResponse;
import com.staydesk.booking.api.dto.CancelBookingRequest;
import com.staydesk.booking.api.dto.ConflictCheckRequest;
import com.staydesk.booking.api.dto.ConflictCheckResponse;
import com.staydesk.booking.api.dto.CreateBookingRequest;
import com.staydesk.booking.api.dto.RetryAvailabilityResponse;
import com.staydesk.booking.api.dto.UpdateAddOnsRequest;
import com.staydesk.booking.api.dto.UpdateBookingStatusRequest;
import com.staydesk.booking.domain.service.AvailabilityService;
import com.staydesk.booking.domain.service.BookingService;
import com.staydesk.common.dto.BaseResponse;
import com.staydesk.common.util.Constants;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/tenants/{tenantId}/bookings")
@RequiredArgsConstructor
public class BookingController {

    private final BookingService bookingService;
    private final AvailabilityService availabilityService;

    /**
     * Creates a booking. Repeating the call with the same {@code Idempotency-Key} returns the
     * first booking instead of creating another.
     */
    @PostMapping
    public ResponseEntity<BaseResponse<BookingResponse>> createBooking(
            @PathVariable UUID tenantId,
            @RequestHeader(value = Constants.IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @Valid @RequestBody CreateBookingRequest request) {
        BookingResponse response = bookingService.createBooking(tenantId, request, idempotencyKey);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Booking created successfully", response));
    }

    @GetMapping("/{reference}")
    public ResponseEntity<BaseResponse<BookingResponse>> getBooking(
            @PathVariable UUID tenantId, @PathVariable String reference) {
        return ResponseEntity.ok(BaseResponse.success(bookingService.getBookingByReference(tenantId, reference)));
    }

    @PostMapping("/check-conflicts")
    public ResponseEntity<BaseResponse<ConflictCheckResponse>> checkConflicts(
            @PathVariable UUID tenantId, @Valid @RequestBody ConflictCheckRequest request) {
        return ResponseEntity.ok(BaseResponse.success(availabilityService.checkConflicts(tenantId, request)));
    }

    @PatchMapping("/{bookingId}/status")
    public ResponseEntity<BaseResponse<BookingResponse>> updateStatus(
            @PathVariable UUID tenantId, @PathVariable Long bookingId,
            @Valid @RequestBody UpdateBookingStatusRequest request) {
        return ResponseEntity.ok(BaseResponse.success("Booking status updated",
                bookingService.updateStatus(tenantId, bookingId, request)));
    }

    @PostMapping("/{bookingId}/cancel")
    public ResponseEntity<BaseResponse<BookingResponse>> cancelBooking(
            @PathVariable UUID tenantId, @PathVariable Long bookingId,
            @Valid @RequestBody(required = false) CancelBookingRequest request) {
        return ResponseEntity.ok(BaseResponse.success("Booking cancelled",
                bookingService.cancelBooking(tenantId, bookingId, request)));
    }

    @PutMapping("/{bookingId}/addons")
    public ResponseEntity<BaseResponse<BookingResponse>> updateAddOns(
            @PathVariable UUID tenantId, @PathVariable Long bookingId,
            @Valid @RequestBody UpdateAddOnsRequest request) {
        return ResponseEntity.ok(BaseResponse.success("Add-ons updated",
                bookingService.updateAddOns(tenantId, bookingId, request)));
    }

    @GetMapping("/{bookingId}/retry-availability")
    public ResponseEntity<BaseResponse<RetryAvailabilityResponse>> retryAvailability(
            @PathVariable UUID tenantId, @PathVariable Long bookingId) {
        return ResponseEntity.ok(BaseResponse.success(bookingService.checkRetryAvailability(tenantId, bookingId)));
    }
}
