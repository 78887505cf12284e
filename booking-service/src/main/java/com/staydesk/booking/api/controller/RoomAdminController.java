package com.staydesk.booking.api.controller;

import com.staydesk.booking.api.dto.RoomRequest;
import com.staydesk.booking.api.dto.RoomResponse;
import com.staydesk.booking.api.dto.SeasonalRateRequest;
import com.staydesk.booking.api.dto.SeasonalRateResponse;
import com.staydesk.booking.domain.service.RoomService;
import com.staydesk.booking.domain.service.SeasonalRateService;
import com.staydesk.common.dto.BaseResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Staff management of rooms and their seasonal rates.
 */
@RestController
@RequestMapping("/api/v1/tenants/{tenantId}/rooms")
@RequiredArgsConstructor
public class RoomAdminController {

    private final RoomService roomService;
    private final SeasonalRateService seasonalRateService;

    @PostMapping
    public ResponseEntity<BaseResponse<RoomResponse>> createRoom(
            @PathVariable UUID tenantId, @Valid @RequestBody RoomRequest request) {
        RoomResponse response = roomService.createRoom(tenantId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(BaseResponse.success("Room created", response));
    }

    @GetMapping
    public ResponseEntity<BaseResponse<List<RoomResponse>>> listRooms(@PathVariable UUID tenantId) {
        return ResponseEntity.ok(BaseResponse.success(roomService.listRooms(tenantId)));
    }

    @GetMapping("/{roomId}")
    public ResponseEntity<BaseResponse<RoomResponse>> getRoom(@PathVariable UUID tenantId, @PathVariable Long roomId) {
        return ResponseEntity.ok(BaseResponse.success(roomService.getRoom(tenantId, roomId)));
    }

    @PutMapping("/{roomId}")
    public ResponseEntity<BaseResponse<RoomResponse>> updateRoom(
            @PathVariable UUID tenantId, @PathVariable Long roomId, @Valid @RequestBody RoomRequest request) {
        return ResponseEntity.ok(BaseResponse.success("Room updated", roomService.updateRoom(tenantId, roomId, request)));
    }

    /**
     * Deactivates the room; existing bookings keep pointing at it.
     */
    @DeleteMapping("/{roomId}")
    public ResponseEntity<BaseResponse<Void>> deactivateRoom(@PathVariable UUID tenantId, @PathVariable Long roomId) {
        roomService.deactivateRoom(tenantId, roomId);
        return ResponseEntity.ok(BaseResponse.success("Room deactivated", null));
    }

    @PostMapping("/{roomId}/seasonal-rates")
    public ResponseEntity<BaseResponse<SeasonalRateResponse>> createRate(
            @PathVariable UUID tenantId, @PathVariable Long roomId, @Valid @RequestBody SeasonalRateRequest request) {
        SeasonalRateResponse response = seasonalRateService.createRate(tenantId, roomId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(BaseResponse.success("Seasonal rate created", response));
    }

    @GetMapping("/{roomId}/seasonal-rates")
    public ResponseEntity<BaseResponse<List<SeasonalRateResponse>>> listRates(
            @PathVariable UUID tenantId, @PathVariable Long roomId) {
        return ResponseEntity.ok(BaseResponse.success(seasonalRateService.listRates(tenantId, roomId)));
    }

    @PutMapping("/{roomId}/seasonal-rates/{rateId}")
    public ResponseEntity<BaseResponse<SeasonalRateResponse>> updateRate(
            @PathVariable UUID tenantId, @PathVariable Long roomId, @PathVariable Long rateId,
            @Valid @RequestBody SeasonalRateRequest request) {
        SeasonalRateResponse response = seasonalRateService.updateRate(tenantId, roomId, rateId, request);
        return ResponseEntity.ok(BaseResponse.success("Seasonal rate updated", response));
    }

    @DeleteMapping("/{roomId}/seasonal-rates/{rateId}")
    public ResponseEntity<BaseResponse<Void>> deleteRate(
            @PathVariable UUID tenantId, @PathVariable Long roomId, @PathVariable Long rateId) {
        seasonalRateService.deleteRate(tenantId, roomId, rateId);
        return ResponseEntity.ok(BaseResponse.success("Seasonal rate deleted", null));
    }
}
