package com.staydesk.booking.domain.service;

import com.staydesk.booking.api.dto.AddOnRequest;
import com.staydesk.booking.api.dto.AddOnResponse;
import com.staydesk.booking.domain.model.AddOn;
import com.staydesk.booking.domain.repository.AddOnRepository;
import com.staydesk.common.exception.ResourceNotFoundException;
import com.staydesk.pricing.model.AddOnPricingType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class AddOnService {

    private final AddOnRepository addOnRepository;

    @Value("${booking.pricing.default-currency:ZAR}")
    private String defaultCurrency;

    @Transactional
    public AddOnResponse createAddOn(UUID tenantId, AddOnRequest request) {
        AddOn addOn = AddOn.builder()
                .tenantId(tenantId)
                .active(request.active() == null || request.active())
                .build();
        apply(addOn, request);
        addOn = addOnRepository.save(addOn);
        log.info("Created add-on {} ({}) for tenant {}", addOn.getId(), addOn.getName(), tenantId);
        return AddOnResponse.from(addOn);
    }

    @Transactional
    public AddOnResponse updateAddOn(UUID tenantId, Long addOnId, AddOnRequest request) {
        AddOn addOn = findAddOn(tenantId, addOnId);
        apply(addOn, request);
        if (request.active() != null) {
            addOn.setActive(request.active());
        }
        return AddOnResponse.from(addOnRepository.save(addOn));
    }

    @Transactional
    public void deactivateAddOn(UUID tenantId, Long addOnId) {
        AddOn addOn = findAddOn(tenantId, addOnId);
        addOn.setActive(false);
        addOnRepository.save(addOn);
    }

    @Transactional(readOnly = true)
    public List<AddOnResponse> listAddOns(UUID tenantId) {
        return addOnRepository.findByTenantIdOrderByNameAsc(tenantId).stream()
                .map(AddOnResponse::from)
                .toList();
    }

    private AddOn findAddOn(UUID tenantId, Long addOnId) {
        return addOnRepository.findByIdAndTenantId(addOnId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Add-on", addOnId));
    }

    private void apply(AddOn addOn, AddOnRequest request) {
        addOn.setName(request.name());
        addOn.setDescription(request.description());
        addOn.setPrice(request.price());
        addOn.setCurrency(request.currency() == null ? defaultCurrency : request.currency());
        addOn.setPricingType(AddOnPricingType.fromCode(request.pricingType()));
        addOn.setMaxQuantity(request.maxQuantity() == null ? 1 : request.maxQuantity());
        addOn.setAvailableForRooms(request.availableForRooms() == null
                ? new HashSet<>()
                : new HashSet<>(request.availableForRooms()));
    }
}
