package com.staydesk.booking.domain.service;

import com.staydesk.booking.domain.model.Booking;
import com.staydesk.booking.domain.model.BookingChannel;
import com.staydesk.booking.domain.model.PaymentStatus;
import com.staydesk.booking.domain.repository.BookingRepository;
import com.staydesk.pricing.model.BookingStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Online bookings still unpaid after the hold period become {@code cart_abandoned}; their nights
 * go back to the ledger. Runs across all tenants; every release is scoped to the booking's own tenant.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AbandonedCheckoutJob {

    private final BookingRepository bookingRepository;
    private final RoomNightLedger roomNightLedger;
    private final Clock clock;

    @Value("${booking.abandonment.hold-ttl-minutes:30}")
    private int holdTtlMinutes;

    @Scheduled(fixedDelayString = "${booking.abandonment.job-interval-ms:60000}")
    @Transactional
    public void releaseAbandonedCheckouts() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusMinutes(holdTtlMinutes);
        List<Booking> abandoned = bookingRepository.findByStatusAndChannelAndPaymentStatusAndCreatedAtBefore(
                BookingStatus.PENDING, BookingChannel.ONLINE, PaymentStatus.PENDING, cutoff);
        if (abandoned.isEmpty()) {
            return;
        }
        for (Booking booking : abandoned) {
            roomNightLedger.release(booking);
            booking.setStatus(BookingStatus.CART_ABANDONED);
            bookingRepository.save(booking);
        }
        log.info("Marked {} unpaid online bookings older than {} min as cart_abandoned", abandoned.size(), holdTtlMinutes);
    }
}
