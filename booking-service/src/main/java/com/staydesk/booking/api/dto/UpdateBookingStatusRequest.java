package com.staydesk.booking.api.dto;

import com.staydesk.booking.domain.model.PaymentStatus;
import jakarta.validation.constraints.NotBlank;

public record UpdateBookingStatusRequest(
        @NotBlank(message = "Status cannot be blank")
        String status,

        PaymentStatus paymentStatus
) {
}
