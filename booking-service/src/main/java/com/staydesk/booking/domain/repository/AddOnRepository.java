package com.staydesk.booking.domain.repository;

import com.staydesk.booking.domain.model.AddOn;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface AddOnRepository extends JpaRepository<AddOn, Long> {

    Optional<AddOn> findByIdAndTenantId(Long id, UUID tenantId);

    List<AddOn> findByTenantIdOrderByNameAsc(UUID tenantId);

    List<AddOn> findByTenantIdAndActiveTrueAndIdIn(UUID tenantId, Collection<Long> ids);
}
