package com.ospicorp.anomalyapi.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.ospicorp.anomalyapi.model.DataPoint;
import com.ospicorp.anomalyapi.model.TrainingRecord;
import com.ospicorp.anomalyapi.model.TrainingStatistics;
import java.util.List;

public record TrainingDataResponse(
    @JsonProperty("series_id") String seriesId,
    @JsonProperty("version") String version,
    @JsonProperty("statistics") Statistics statistics,
    List<List<Object>> points
) {

  static TrainingDataResponse from(TrainingRecord record) {
    List<List<Object>> tuples = record.points().stream()
        .map(p -> List.<Object>of(p.timestamp(), p.value()))
        .toList();
    return new TrainingDataResponse(record.seriesId(), record.label(),
        Statistics.from(record.statistics()), tuples);
  }

  public record Statistics(
      @JsonProperty("count") int count,
      @JsonProperty("mean") double mean,
      @JsonProperty("std") double std,
      @JsonProperty("min") double min,
      @JsonProperty("max") double max,
      @JsonProperty("start_time") long startTime,
      @JsonProperty("end_time") long endTime
  ) {

    static Statistics from(TrainingStatistics stats) {
      return new Statistics(stats.count(), stats.mean(), stats.std(), stats.min(), stats.max(),
          stats.startTime(), stats.endTime());
    }
  }

  // one CSV row
  @JsonPropertyOrder({"timestamp", "value"})
  public record Row(
      @JsonProperty("timestamp") long timestamp,
      @JsonProperty("value") double value
  ) {

    static List<Row> of(List<DataPoint> points) {
      return points.stream().map(p -> new Row(p.timestamp(), p.value())).toList();
    }
  }
}
