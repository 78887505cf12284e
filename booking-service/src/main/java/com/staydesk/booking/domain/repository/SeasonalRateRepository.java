package com.staydesk.booking.domain.repository;

import com.staydesk.booking.domain.model.SeasonalRate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SeasonalRateRepository extends JpaRepository<SeasonalRate, Long> {

    List<SeasonalRate> findByTenantIdAndRoomIdOrderByStartDateAscPriorityDesc(UUID tenantId, Long roomId);

    Optional<SeasonalRate> findByIdAndTenantIdAndRoomId(Long id, UUID tenantId, Long roomId);

    /**
     * Rates whose inclusive window shares at least one night with {@code [firstNight, lastNight]}.
     */
    @Query("""
           SELECT r FROM SeasonalRate r
           WHERE r.tenantId = :tenantId
             AND r.roomId = :roomId
             AND r.startDate <= :lastNight
             AND r.endDate >= :firstNight
           ORDER BY r.priority DESC
           """)
    List<SeasonalRate> findCoveringNights(@Param("tenantId") UUID tenantId,
                                          @Param("roomId") Long roomId,
                                          @Param("firstNight") LocalDate firstNight,
                                          @Param("lastNight") LocalDate lastNight);
}
