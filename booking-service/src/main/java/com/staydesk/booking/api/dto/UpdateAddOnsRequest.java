package com.staydesk.booking.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record UpdateAddOnsRequest(
        @NotNull(message = "Add-ons cannot be null")
        List<@Valid AddOnSelectionRequest> addons
) {
}
