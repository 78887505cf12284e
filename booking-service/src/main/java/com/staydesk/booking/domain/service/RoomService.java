package com.staydesk.booking.domain.service;

import com.staydesk.booking.api.dto.RoomRequest;
import com.staydesk.booking.api.dto.RoomResponse;
import com.staydesk.booking.domain.model.Room;
import com.staydesk.booking.domain.repository.RoomRepository;
import com.staydesk.common.exception.BusinessException;
import com.staydesk.common.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Staff management of a tenant's rooms.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoomService {

    private final RoomRepository roomRepository;

    @Value("${booking.pricing.default-currency:ZAR}")
    private String defaultCurrency;

    @Transactional
    public RoomResponse createRoom(UUID tenantId, RoomRequest request) {
        Room room = Room.builder()
                .tenantId(tenantId)
                .active(request.active() == null || request.active())
                .build();
        apply(room, request);
        room = roomRepository.save(room);
        log.info("Created room {} ({}) for tenant {}", room.getId(), room.getName(), tenantId);
        return RoomResponse.from(room);
    }

    @Transactional
    public RoomResponse updateRoom(UUID tenantId, Long roomId, RoomRequest request) {
        Room room = findRoom(tenantId, roomId);
        apply(room, request);
        if (request.active() != null) {
            room.setActive(request.active());
        }
        return RoomResponse.from(roomRepository.save(room));
    }

    /**
     * Soft delete: the room stays referenced by its bookings.
     */
    @Transactional
    public void deactivateRoom(UUID tenantId, Long roomId) {
        Room room = findRoom(tenantId, roomId);
        room.setActive(false);
        roomRepository.save(room);
        log.info("Deactivated room {} of tenant {}", roomId, tenantId);
    }

    @Transactional(readOnly = true)
    public RoomResponse getRoom(UUID tenantId, Long roomId) {
        return RoomResponse.from(findRoom(tenantId, roomId));
    }

    @Transactional(readOnly = true)
    public List<RoomResponse> listRooms(UUID tenantId) {
        return roomRepository.findByTenantIdOrderByNameAsc(tenantId).stream()
                .map(RoomResponse::from)
                .toList();
    }

    public Room findRoom(UUID tenantId, Long roomId) {
        return roomRepository.findByIdAndTenantId(roomId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Room", roomId));
    }

    /**
     * An inactive room is reported as missing; no price is ever derived for it.
     */
    public Room requireActiveRoom(UUID tenantId, Long roomId) {
        return roomRepository.findByIdAndTenantIdAndActiveTrue(roomId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Room", roomId));
    }

    private void apply(Room room, RoomRequest request) {
        Integer minStay = request.minStayNights() == null ? 1 : request.minStayNights();
        if (request.maxStayNights() != null && request.maxStayNights() < minStay) {
            throw new BusinessException(
                    String.format("Maximum stay %d is shorter than minimum stay %d", request.maxStayNights(), minStay),
                    "INVALID_STAY_RULES");
        }
        room.setName(request.name());
        room.setDescription(request.description());
        room.setBasePricePerNight(request.basePricePerNight());
        room.setCurrency(request.currency() == null ? defaultCurrency : request.currency());
        room.setTotalUnits(request.totalUnits() == null ? 1 : request.totalUnits());
        room.setMaxGuests(request.maxGuests());
        room.setMinStayNights(minStay);
        room.setMaxStayNights(request.maxStayNights());
    }
}
