package com.staydesk.booking.api.dto;

import com.staydesk.booking.domain.model.BookingChannel;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;
import java.util.List;

public record CreateBookingRequest(
        @NotNull(message = "Room ID cannot be null")
        Long roomId,

        @NotNull(message = "Check-in date cannot be null")
        LocalDate checkIn,

        @NotNull(message = "Check-out date cannot be null")
        LocalDate checkOut,

        @NotNull(message = "Guests cannot be null")
        @Positive(message = "Guests must be positive")
        Integer guests,

        @NotBlank(message = "Guest name cannot be blank")
        @Size(max = 150)
        String guestName,

        @NotBlank(message = "Guest email cannot be blank")
        @Email(message = "Guest email must be a valid address")
        String guestEmail,

        @Size(max = 50)
        String guestPhone,

        @Size(max = 2000)
        String specialRequests,

        BookingChannel channel,

        List<@Valid AddOnSelectionRequest> addons
) {
}
