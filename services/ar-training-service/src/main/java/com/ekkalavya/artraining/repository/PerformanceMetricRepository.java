package com.ekkalavya.artraining.repository;

import com.ekkalavya.artraining.domain.MetricType;
import com.ekkalavya.artraining.domain.PerformanceMetric;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface PerformanceMetricRepository extends JpaRepository<PerformanceMetric, UUID> {

    List<PerformanceMetric> findBySessionId(UUID sessionId);

    List<PerformanceMetric> findByUserIdAndSportAndMetricTypeOrderByCalculatedAtDesc(
            UUID userId, String sport, MetricType metricType);

    @Query("SELECT AVG(m.value) FROM PerformanceMetric m WHERE m.userId = :userId " +
           "AND m.sport = :sport AND m.metricType = :metricType")
    Double averageValue(@Param("userId") UUID userId,
                        @Param("sport") String sport,
                        @Param("metricType") MetricType metricType);

    @Modifying
    @Query("DELETE FROM PerformanceMetric m WHERE m.sessionId = :sessionId")
    int deleteBySessionId(@Param("sessionId") UUID sessionId);
}
