package com.ekkalavya.artraining.repository;

import com.ekkalavya.artraining.domain.SafetyIncident;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface SafetyIncidentRepository extends JpaRepository<SafetyIncident, UUID> {

    List<SafetyIncident> findBySessionIdOrderByOccurredAtAsc(UUID sessionId);

    List<SafetyIncident> findBySessionIdIn(Collection<UUID> sessionIds);

    @Modifying
    @Query("DELETE FROM SafetyIncident i WHERE i.sessionId = :sessionId")
    int deleteBySessionId(@Param("sessionId") UUID sessionId);
}
