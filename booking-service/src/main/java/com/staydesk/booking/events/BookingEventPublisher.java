package com.staydesk.booking.events;

import com.staydesk.booking.domain.model.Booking;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;

/**
 * Kafka publisher for booking events, keyed by booking reference.
 *
 * Events published:
 * - BookingCreatedEvent: when a booking is committed
 * - BookingCancelledEvent: when a booking is cancelled
 *
 * Inside a transaction the send is deferred until commit, so a rolled-back booking never
 * produces an event.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingEventPublisher {

    static final String TOPIC_BOOKING_CREATED = "booking-created";
    static final String TOPIC_BOOKING_CANCELLED = "booking-cancelled";

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final Clock clock;

    public void publishBookingCreated(Booking booking) {
        BookingCreatedEvent event = BookingCreatedEvent.builder()
                .bookingId(booking.getId())
                .reference(booking.getReference())
                .tenantId(booking.getTenantId())
                .roomId(booking.getRoomId())
                .checkIn(booking.getCheckInDate())
                .checkOut(booking.getCheckOutDate())
                .guests(booking.getGuests())
                .baseTotal(booking.roomCharge())
                .addonsTotal(booking.getAddonsTotal())
                .totalAmount(booking.getTotalAmount())
                .currency(booking.getCurrency())
                .status(booking.getStatus().code())
                .channel(booking.getChannel().name().toLowerCase())
                .timestamp(clock.instant())
                .build();

        publishAfterCommit(TOPIC_BOOKING_CREATED, booking.getReference(), event);
    }

    public void publishBookingCancelled(Booking booking, String reason) {
        BookingCancelledEvent event = BookingCancelledEvent.builder()
                .bookingId(booking.getId())
                .reference(booking.getReference())
                .tenantId(booking.getTenantId())
                .roomId(booking.getRoomId())
                .checkIn(booking.getCheckInDate())
                .checkOut(booking.getCheckOutDate())
                .totalAmount(booking.getTotalAmount())
                .currency(booking.getCurrency())
                .reason(reason)
                .timestamp(clock.instant())
                .build();

        publishAfterCommit(TOPIC_BOOKING_CANCELLED, booking.getReference(), event);
    }

    private void publishAfterCommit(String topic, String key, Object event) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    publishEvent(topic, key, event);
                }
            });
        } else {
            publishEvent(topic, key, event);
        }
    }

    private void publishEvent(String topic, String key, Object event) {
        log.info("Publishing event to topic {}: {}", topic, event);

        CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, key, event);

        future.whenComplete((result, ex) -> {
            if (ex == null) {
                log.info("Event published successfully to topic {}: offset={}",
                        topic, result.getRecordMetadata().offset());
            } else {
                log.error("Failed to publish event to topic {}", topic, ex);
            }
        });
    }
}
