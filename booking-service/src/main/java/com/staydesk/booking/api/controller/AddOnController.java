package com.staydesk.booking.api.controller;

import com.staydesk.booking.api.dto.AddOnRequest;
import com.staydesk.booking.api.dto.AddOnResponse;
import com.staydesk.booking.domain.service.AddOnService;
import com.staydesk.common.dto.BaseResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/tenants/{tenantId}/addons")
@RequiredArgsConstructor
public class AddOnController {

    private final AddOnService addOnService;

    @PostMapping
    public ResponseEntity<BaseResponse<AddOnResponse>> createAddOn(
            @PathVariable UUID tenantId, @Valid @RequestBody AddOnRequest request) {
        AddOnResponse response = addOnService.createAddOn(tenantId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(BaseResponse.success("Add-on created", response));
    }

    @GetMapping
    public ResponseEntity<BaseResponse<List<AddOnResponse>>> listAddOns(@PathVariable UUID tenantId) {
        return ResponseEntity.ok(BaseResponse.success(addOnService.listAddOns(tenantId)));
    }

    @PutMapping("/{addOnId}")
    public ResponseEntity<BaseResponse<AddOnResponse>> updateAddOn(
            @PathVariable UUID tenantId, @PathVariable Long addOnId, @Valid @RequestBody AddOnRequest request) {
        return ResponseEntity.ok(BaseResponse.success("Add-on updated", addOnService.updateAddOn(tenantId, addOnId, request)));
    }

    @DeleteMapping("/{addOnId}")
    public ResponseEntity<BaseResponse<Void>> deactivateAddOn(@PathVariable UUID tenantId, @PathVariable Long addOnId) {
        addOnService.deactivateAddOn(tenantId, addOnId);
        return ResponseEntity.ok(BaseResponse.success("Add-on deactivated", null));
    }
}
