package com.staydesk.booking.domain.repository;

import com.staydesk.booking.domain.model.BookingIdempotency;
import org.springframework.data.jpa.repository.JpaRepository;

public interface BookingIdempotencyRepository extends JpaRepository<BookingIdempotency, String> {
}
