package com.ospicorp.anomalyapi.store;

import com.ospicorp.anomalyapi.model.ModelStatus;
import com.ospicorp.anomalyapi.model.ModelVersion;
import com.ospicorp.anomalyapi.model.TrainingBatch;
import com.ospicorp.anomalyapi.model.TrainingRecord;
import com.ospicorp.anomalyapi.support.Deadline;
import com.ospicorp.anomalyapi.training.FittedModel;
import java.util.List;
import java.util.OptionalInt;

/**
 * Durable, per-series ordered collection of model versions and the training records behind
 * them. Versions are immutable apart from their status, and status changes go through
 * {@link VersionManager} only.
 */
public interface ModelStore {

  /**
   * Persists a new version together with its training record. The version number is assigned
   * here and is strictly greater than every number previously handed out for the series.
   *
   * @return the stored version, still {@link ModelStatus#PENDING}
   * @throws ModelPersistenceException when nothing could be written
   */
  ModelVersion append(String seriesId, FittedModel fitted, TrainingBatch batch,
      double trainingLatencyMs);

  /**
   * @throws ModelNotFoundException when the series has no active version
   */
  ModelVersion loadActive(String seriesId);

  /**
   * {@link #loadActive(String)} with the query bounded by {@code deadline}.
   *
   * @throws com.ospicorp.anomalyapi.support.BackendTimeoutException when the deadline passes
   */
  ModelVersion loadActive(String seriesId, Deadline deadline);

  /**
   * Loads a version in any status, superseded ones included.
   *
   * @throws ModelNotFoundException when the version does not exist
   */
  ModelVersion loadVersion(String seriesId, int version);

  ModelVersion loadVersion(String seriesId, int version, Deadline deadline);

  /**
   * Loads a version and locks its row for the rest of the current transaction. Part of a
   * status change, so failures are reported like failed writes.
   *
   * @throws ModelNotFoundException when the version does not exist
   * @throws ModelPersistenceException when the store fails
   */
  ModelVersion loadVersionForUpdate(String seriesId, int version);

  // ascending by version, empty for unknown series
  List<ModelVersion> listVersions(String seriesId);

  TrainingRecord loadTrainingRecord(String seriesId, int version);

  /**
   * Takes the per-series lock for the rest of the current transaction and reports which
   * version is active at that point.
   */
  OptionalInt lockActiveVersion(String seriesId);

  /**
   * Compare-and-set on the status column.
   *
   * @return false when the version was not in {@code expected}
   */
  boolean transitionStatus(String seriesId, int version, ModelStatus expected, ModelStatus target);
}
