package com.ospicorp.anomalyapi.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;

public record TrainRequest(
    @JsonProperty("timestamps")
    @Schema(description = "Unix timestamps in seconds, ascending", example = "[1700000000, 1700000060]")
    List<Long> timestamps,
    @JsonProperty("values")
    @Schema(description = "Observed values, one per timestamp", example = "[42.5, 43.1]")
    List<Double> values,
    @JsonProperty("threshold")
    @Schema(description = "Threshold multiplier k; defaults to 3.0", example = "3.0")
    Double threshold
) {}
