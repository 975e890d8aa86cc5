package com.ospicorp.anomalyapi.telemetry;

import java.util.List;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
public class PredictionLogService {
  public static final int MAX_LIMIT = 1000;

  private final PredictionLogRepository repository;

  public PredictionLogService(PredictionLogRepository repository) {
    this.repository = repository;
  }

  // newest first
  @Transactional(readOnly = true)
  public List<PredictionLog> recent(String seriesId, int limit) {
    if (limit < 1 || limit > MAX_LIMIT) {
      throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
    }
    PageRequest page = PageRequest.of(0, limit);
    return StringUtils.hasText(seriesId)
        ? repository.findBySeriesIdOrderByCreatedAtDescIdDesc(seriesId, page)
        : repository.findAllByOrderByCreatedAtDescIdDesc(page);
  }
}
