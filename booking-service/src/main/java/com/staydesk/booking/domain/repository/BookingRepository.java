package com.staydesk.booking.domain.repository;

import com.staydesk.booking.domain.model.Booking;
import com.staydesk.booking.domain.model.BookingChannel;
import com.staydesk.booking.domain.model.PaymentStatus;
import com.staydesk.pricing.model.BookingStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface BookingRepository extends JpaRepository<Booking, Long> {

    Optional<Booking> findByIdAndTenantId(Long id, UUID tenantId);

    Optional<Booking> findByTenantIdAndReference(UUID tenantId, String reference);

    boolean existsByReference(String reference);

    /**
     * Bookings of the room in one of {@code statuses} sharing at least one night with
     * {@code [checkIn, checkOut)}.
     */
    @Query("""
           SELECT b FROM Booking b
           WHERE b.tenantId = :tenantId
             AND b.roomId = :roomId
             AND b.status IN :statuses
             AND b.checkInDate < :checkOut
             AND b.checkOutDate > :checkIn
           ORDER BY b.checkInDate
           """)
    List<Booking> findOverlapping(@Param("tenantId") UUID tenantId,
                                  @Param("roomId") Long roomId,
                                  @Param("checkIn") LocalDate checkIn,
                                  @Param("checkOut") LocalDate checkOut,
                                  @Param("statuses") Collection<BookingStatus> statuses);

    /** For the abandonment job: unpaid bookings of a channel still in {@code status} since before the cutoff. */
    List<Booking> findByStatusAndChannelAndPaymentStatusAndCreatedAtBefore(
            BookingStatus status, BookingChannel channel, PaymentStatus paymentStatus, LocalDateTime before);
}
