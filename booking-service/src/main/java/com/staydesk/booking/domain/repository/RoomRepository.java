package com.staydesk.booking.domain.repository;

import com.staydesk.booking.domain.model.Room;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface RoomRepository extends JpaRepository<Room, Long> {

    Optional<Room> findByIdAndTenantId(Long id, UUID tenantId);

    Optional<Room> findByIdAndTenantIdAndActiveTrue(Long id, UUID tenantId);

    List<Room> findByTenantIdOrderByNameAsc(UUID tenantId);
}
