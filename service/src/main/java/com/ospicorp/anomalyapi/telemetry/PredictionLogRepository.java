package com.ospicorp.anomalyapi.telemetry;

import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PredictionLogRepository extends JpaRepository<PredictionLog, Long> {

  List<PredictionLog> findBySeriesIdOrderByCreatedAtDescIdDesc(String seriesId, Pageable pageable);

  List<PredictionLog> findAllByOrderByCreatedAtDescIdDesc(Pageable pageable);
}
