package com.ekkalavya.artraining.repository;

import com.ekkalavya.artraining.domain.SessionStatus;
import com.ekkalavya.artraining.domain.TrainingSession;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface TrainingSessionRepository extends JpaRepository<TrainingSession, UUID> {

    Page<TrainingSession> findByUserIdOrderByStartedAtDesc(UUID userId, Pageable pageable);

    Page<TrainingSession> findByUserIdAndSportOrderByStartedAtDesc(UUID userId, String sport, Pageable pageable);

    List<TrainingSession> findByUserIdAndStatusOrderByStartedAtDesc(UUID userId, SessionStatus status);
}
