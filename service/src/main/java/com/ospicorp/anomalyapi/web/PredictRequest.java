package com.ospicorp.anomalyapi.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

public record PredictRequest(
    @JsonProperty("timestamp") @NotNull Long timestamp,
    @JsonProperty("value") @NotNull Double value
) {}
