package com.ekkalavya.artraining.repository;

import com.ekkalavya.artraining.domain.RoomConstraints;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface RoomConstraintsRepository extends JpaRepository<RoomConstraints, UUID> {

    Optional<RoomConstraints> findFirstBySessionIdOrderByAnalyzedAtDesc(UUID sessionId);

    List<RoomConstraints> findBySessionIdIn(Collection<UUID> sessionIds);

    @Modifying
    @Query("DELETE FROM RoomConstraints r WHERE r.sessionId = :sessionId")
    int deleteBySessionId(@Param("sessionId") UUID sessionId);
}
