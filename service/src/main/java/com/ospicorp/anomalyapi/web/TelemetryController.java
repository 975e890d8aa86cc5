package com.ospicorp.anomalyapi.web;

import com.ospicorp.anomalyapi.telemetry.PredictionLogService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/telemetry")
@Tag(name = "Telemetry")
public class TelemetryController {
  private final PredictionLogService logService;

  public TelemetryController(PredictionLogService logService) {
    this.logService = logService;
  }

  @GetMapping("/predictions")
  @Operation(summary = "Recent predictions", description = "Prediction log, newest first.")
  public List<PredictionLogResponse> predictions(
      @RequestParam(name = "series_id", required = false)
      @Parameter(description = "Only this series", example = "sensor_001") String seriesId,
      @RequestParam(defaultValue = "100")
      @Parameter(description = "Maximum rows", example = "100") int limit) {
    if (limit < 1 || limit > PredictionLogService.MAX_LIMIT) {
      throw new InvalidParameterException(
          "Invalid limit parameter. Supported range: 1-" + PredictionLogService.MAX_LIMIT + ".", 1102);
    }
    return logService.recent(seriesId, limit).stream().map(PredictionLogResponse::from).toList();
  }
}
