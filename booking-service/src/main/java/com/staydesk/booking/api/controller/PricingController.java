package com.staydesk.booking.api.controller;

import com.staydesk.booking.api.dto.AvailabilityResponse;
import com.staydesk.booking.api.dto.QuoteRequest;
import com.staydesk.booking.api.dto.QuoteResponse;
import com.staydesk.booking.api.dto.RoomPricingResponse;
import com.staydesk.booking.domain.service.AvailabilityService;
import com.staydesk.booking.domain.service.PricingService;
import com.staydesk.common.dto.BaseResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Guest-facing price and availability lookups for the booking wizard.
 */
@RestController
@RequestMapping("/api/v1/tenants/{tenantId}/rooms/{roomId}")
@RequiredArgsConstructor
public class PricingController {

    private final PricingService pricingService;
    private final AvailabilityService availabilityService;

    @GetMapping("/pricing")
    public ResponseEntity<BaseResponse<RoomPricingResponse>> getPricing(
            @PathVariable UUID tenantId,
            @PathVariable Long roomId,
            @RequestParam("check_in") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate checkIn,
            @RequestParam("check_out") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate checkOut) {
        return ResponseEntity.ok(BaseResponse.success(
                pricingService.getNightlyPricing(tenantId, roomId, checkIn, checkOut)));
    }

    @PostMapping("/quote")
    public ResponseEntity<BaseResponse<QuoteResponse>> quote(
            @PathVariable UUID tenantId,
            @PathVariable Long roomId,
            @Valid @RequestBody QuoteRequest request) {
        return ResponseEntity.ok(BaseResponse.success(pricingService.quote(tenantId, roomId, request)));
    }

    @GetMapping("/availability")
    public ResponseEntity<BaseResponse<AvailabilityResponse>> getAvailability(
            @PathVariable UUID tenantId,
            @PathVariable Long roomId,
            @RequestParam("check_in") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate checkIn,
            @RequestParam("check_out") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate checkOut) {
        return ResponseEntity.ok(BaseResponse.success(
                availabilityService.checkAvailability(tenantId, roomId, checkIn, checkOut)));
    }
}
