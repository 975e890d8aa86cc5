package com.ospicorp.anomalyapi.web;

import com.ospicorp.anomalyapi.catalog.ModelCatalogService;
import com.ospicorp.anomalyapi.inference.PredictionOutcome;
import com.ospicorp.anomalyapi.inference.PredictionService;
import com.ospicorp.anomalyapi.model.DataPoint;
import com.ospicorp.anomalyapi.model.TrainingBatch;
import com.ospicorp.anomalyapi.model.TrainingRecord;
import com.ospicorp.anomalyapi.model.VersionSelector;
import com.ospicorp.anomalyapi.training.TrainingResult;
import com.ospicorp.anomalyapi.training.TrainingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Pattern;
import java.util.Comparator;
import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/series")
@Validated
@Tag(name = "Models")
public class ModelController {
  static final String SERIES_ID_REGEX = "^[A-Za-z0-9_.-]{1,64}$";

  private final TrainingService trainingService;
  private final PredictionService predictionService;
  private final ModelCatalogService catalog;

  public ModelController(TrainingService trainingService, PredictionService predictionService,
      ModelCatalogService catalog) {
    this.trainingService = trainingService;
    this.predictionService = predictionService;
    this.catalog = catalog;
  }

  @PostMapping("/{id}/models")
  @Operation(summary = "Train a model version",
      description = "Fit a new model version on the submitted batch and make it the active version.")
  @ApiResponses({
      @ApiResponse(responseCode = "201", description = "Version trained and activated",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = TrainResponse.class))),
      @ApiResponse(responseCode = "422", description = "Batch rejected by validation"),
      @ApiResponse(responseCode = "504", description = "Model store timed out",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<TrainResponse> train(@PathVariable @Pattern(regexp = SERIES_ID_REGEX)
      @Parameter(description = "Series identifier", example = "sensor_001") String id,
      @RequestBody TrainRequest request) {
    TrainingResult result = trainingService.train(id,
        new TrainingBatch(request.timestamps(), request.values()), request.threshold());
    return ResponseEntity.status(HttpStatus.CREATED)
        .header(HttpHeaders.LOCATION, "/v1/series/" + id + "/models/" + result.label())
        .body(TrainResponse.from(result));
  }

  @PostMapping("/{id}/predict")
  @Operation(summary = "Classify a point",
      description = "Check one point against the active model version, or a pinned one.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Verdict",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = PredictResponse.class))),
      @ApiResponse(responseCode = "404", description = "No such model",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "503", description = "Model store unavailable",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public PredictResponse predict(@PathVariable @Pattern(regexp = SERIES_ID_REGEX)
      @Parameter(description = "Series identifier", example = "sensor_001") String id,
      @RequestParam(required = false)
      @Parameter(description = "Pinned version label", example = "v1") String version,
      @Valid @RequestBody PredictRequest request) {
    PredictionOutcome outcome = predictionService.predict(id,
        new DataPoint(request.timestamp(), request.value()), parseSelector(version));
    return PredictResponse.from(outcome);
  }

  @GetMapping("/{id}/models")
  @Operation(summary = "List model versions", description = "All versions of a series, oldest first.")
  public List<ModelVersionResponse> listVersions(@PathVariable @Pattern(regexp = SERIES_ID_REGEX)
      @Parameter(description = "Series identifier", example = "sensor_001") String id) {
    return catalog.listVersions(id).stream().map(ModelVersionResponse::from).toList();
  }

  @GetMapping("/{id}/models/{version}")
  @Operation(summary = "Get a model version",
      description = "One version by label, or the active version when the label is 'active'.")
  public ModelVersionResponse getVersion(@PathVariable @Pattern(regexp = SERIES_ID_REGEX)
      @Parameter(description = "Series identifier", example = "sensor_001") String id,
      @PathVariable @Parameter(description = "Version label", example = "v1") String version) {
    return ModelVersionResponse.from(catalog.getVersion(id, parseSelector(version)));
  }

  @GetMapping("/{id}/models/{version}/training-data")
  @Operation(summary = "Get training data",
      description = "Raw points and summary statistics a version was fitted on.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Training data",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = TrainingDataResponse.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "404", description = "No such model",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<?> trainingData(@PathVariable @Pattern(regexp = SERIES_ID_REGEX)
      @Parameter(description = "Series identifier", example = "sensor_001") String id,
      @PathVariable @Parameter(description = "Version label", example = "v1") String version,
      @RequestParam(name = "format", required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    MediaType contentType = selectMediaType(format, accept);
    TrainingRecord record = catalog.getTrainingRecord(id, parseSelector(version));
    Object body = contentType.isCompatibleWith(CsvHttpMessageConverter.TEXT_CSV)
        ? TrainingDataResponse.Row.of(record.points())
        : TrainingDataResponse.from(record);
    return ResponseEntity.ok().contentType(contentType).body(body);
  }

  private static VersionSelector parseSelector(String version) {
    try {
      return VersionSelector.fromLabel(version);
    } catch (IllegalArgumentException ex) {
      throw new InvalidParameterException(
          "Invalid version label '" + version + "'. Expected 'active' or v<N>, e.g. v3.", 1101);
    }
  }

  private static MediaType selectMediaType(String format, String accept) {
    if (StringUtils.hasText(format)) {
      if ("csv".equalsIgnoreCase(format)) {
        return CsvHttpMessageConverter.TEXT_CSV;
      }
      if ("json".equalsIgnoreCase(format)) {
        return MediaType.APPLICATION_JSON;
      }
      throw new InvalidParameterException("Invalid format value. Supported values: json,csv.", 1103);
    }
    if (!StringUtils.hasText(accept)) {
      return MediaType.APPLICATION_JSON;
    }
    List<MediaType> mediaTypes = MediaType.parseMediaTypes(accept);
    mediaTypes.sort(Comparator.comparingDouble(MediaType::getQualityValue).reversed());
    MimeTypeUtils.sortBySpecificity(mediaTypes);
    for (MediaType mediaType : mediaTypes) {
      if (mediaType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
        return MediaType.APPLICATION_JSON;
      }
      if (mediaType.isCompatibleWith(CsvHttpMessageConverter.TEXT_CSV)) {
        return CsvHttpMessageConverter.TEXT_CSV;
      }
    }
    return MediaType.APPLICATION_JSON;
  }
}
