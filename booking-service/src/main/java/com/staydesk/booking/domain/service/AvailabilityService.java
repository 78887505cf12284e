package com.staydesk.booking.domain.service;

import com.staydesk.booking.api.dto.AvailabilityResponse;
import com.staydesk.booking.api.dto.ConflictCheckRequest;
import com.staydesk.booking.api.dto.ConflictCheckResponse;
import com.staydesk.booking.domain.model.Booking;
import com.staydesk.booking.domain.model.Room;
import com.staydesk.booking.domain.repository.BookingRepository;
import com.staydesk.pricing.calendar.StayRange;
import com.staydesk.pricing.engine.AvailabilityChecker;
import com.staydesk.pricing.model.AvailabilityVerdict;
import com.staydesk.pricing.model.BookingStatus;
import com.staydesk.pricing.model.OccupiedStay;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class AvailabilityService {

    private final RoomService roomService;
    private final BookingRepository bookingRepository;
    private final AvailabilityChecker availabilityChecker;

    /**
     * Capacity plus stay-length rules for a prospective stay.
     */
    @Transactional(readOnly = true)
    public AvailabilityResponse checkAvailability(UUID tenantId, Long roomId, LocalDate checkIn,
                                                  LocalDate checkOut) {
        StayRange stay = StayRange.of(checkIn, checkOut);
        Room room = roomService.requireActiveRoom(tenantId, roomId);
        AvailabilityVerdict verdict = verdict(room, stay, null);

        int nights = stay.nightCount();
        boolean meetsMinStay = room.meetsMinStay(nights);
        boolean meetsMaxStay = room.meetsMaxStay(nights);
        return new AvailabilityResponse(
                room.getId(),
                stay.checkIn(),
                stay.checkOut(),
                verdict.available() && meetsMinStay && meetsMaxStay,
                nights,
                verdict.totalUnits(),
                verdict.peakOccupancy(),
                verdict.availableUnits(),
                room.getMinStayNights(),
                room.getMaxStayNights(),
                meetsMinStay,
                meetsMaxStay
        );
    }

    /**
     * Staff check before moving or creating a booking by hand. The booking being edited is
     * passed as {@code excludeBookingId} so it does not conflict with itself.
     */
    @Transactional(readOnly = true)
    public ConflictCheckResponse checkConflicts(UUID tenantId, ConflictCheckRequest request) {
        StayRange stay = StayRange.of(request.checkIn(), request.checkOut());
        Room room = roomService.findRoom(tenantId, request.roomId());
        List<Booking> overlapping = findOccupying(room, stay);
        AvailabilityVerdict verdict = availabilityChecker.check(
                room.toPricedRoom(), toStays(overlapping), stay, request.excludeBookingId());

        Set<Long> conflictingIds = new HashSet<>(verdict.conflictingBookingIds());
        List<ConflictCheckResponse.ConflictingBooking> conflicts = overlapping.stream()
                .filter(booking -> conflictingIds.contains(booking.getId()))
                .map(ConflictCheckResponse.ConflictingBooking::from)
                .toList();
        return new ConflictCheckResponse(!conflicts.isEmpty(), verdict.available(),
                verdict.totalUnits(), verdict.availableUnits(), conflicts);
    }

    /**
     * Availability of {@code room} for {@code stay} against bookings that currently hold a unit.
     */
    public AvailabilityVerdict verdict(Room room, StayRange stay, Long excludingBookingId) {
        AvailabilityVerdict verdict = availabilityChecker.check(
                room.toPricedRoom(), toStays(findOccupying(room, stay)), stay, excludingBookingId);
        log.debug("Room {} for {}: peak {} of {} units", room.getId(), stay, verdict.peakOccupancy(), verdict.totalUnits());
        return verdict;
    }

    private List<Booking> findOccupying(Room room, StayRange stay) {
        return bookingRepository.findOverlapping(
                room.getTenantId(), room.getId(), stay.checkIn(), stay.checkOut(), BookingStatus.OCCUPYING);
    }

    private static List<OccupiedStay> toStays(List<Booking> bookings) {
        return bookings.stream().map(Booking::toOccupiedStay).toList();
    }
}
