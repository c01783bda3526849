package com.ekkalavya.artraining.repository;

import com.ekkalavya.artraining.domain.BounceEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface BounceEventRepository extends JpaRepository<BounceEvent, UUID> {

    /**
     * Events in impact order; creation time breaks timestamp ties so replays are stable.
     */
    List<BounceEvent> findBySessionIdOrderByTimestampMsAscCreatedAtAsc(UUID sessionId);

    @Modifying
    @Query("DELETE FROM BounceEvent e WHERE e.sessionId = :sessionId")
    int deleteBySessionId(@Param("sessionId") UUID sessionId);
}
