package com.ospicorp.anomalyapi.store;

import com.ospicorp.anomalyapi.model.DataPoint;
import com.ospicorp.anomalyapi.model.ModelStatus;
import com.ospicorp.anomalyapi.model.ModelVersion;
import com.ospicorp.anomalyapi.model.TrainingBatch;
import com.ospicorp.anomalyapi.model.TrainingRecord;
import com.ospicorp.anomalyapi.model.TrainingStatistics;
import com.ospicorp.anomalyapi.model.VersionLabels;
import com.ospicorp.anomalyapi.support.BackendTimeoutException;
import com.ospicorp.anomalyapi.support.BackendUnavailableException;
import com.ospicorp.anomalyapi.support.Deadline;
import com.ospicorp.anomalyapi.training.FittedModel;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.core.ArgumentPreparedStatementSetter;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.RowMapperResultSetExtractor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.annotation.Transactional;

@Repository
public class JdbcModelStore implements ModelStore {
  private static final Logger log = LoggerFactory.getLogger(JdbcModelStore.class);

  private static final String VERSION_COLUMNS = """
      series_id, version, mean, std, threshold_multiplier, status,
      training_points, training_latency_ms, created_at
      """;

  private static final RowMapper<ModelVersion> VERSION_MAPPER = (rs, i) -> new ModelVersion(
      rs.getString("series_id"),
      rs.getInt("version"),
      rs.getDouble("mean"),
      rs.getDouble("std"),
      rs.getDouble("threshold_multiplier"),
      ModelStatus.valueOf(rs.getString("status")),
      rs.getInt("training_points"),
      (Double) rs.getObject("training_latency_ms"),
      rs.getTimestamp("created_at").toInstant());

  private static final String ACTIVE_SQL = "SELECT " + VERSION_COLUMNS + """
      FROM model_version
      WHERE series_id = ? AND status = 'ACTIVE'
      """;

  private static final String VERSION_SQL = "SELECT " + VERSION_COLUMNS + """
      FROM model_version
      WHERE series_id = ? AND version = ?
      """;

  private final JdbcTemplate jdbc;

  public JdbcModelStore(JdbcTemplate jdbc) {
    this.jdbc = jdbc;
  }

  @Override
  @Transactional
  public ModelVersion append(String seriesId, FittedModel fitted, TrainingBatch batch,
      double trainingLatencyMs) {
    try {
      int version = nextVersion(seriesId);
      Instant createdAt = insertVersion(seriesId, version, fitted, batch.size(), trainingLatencyMs);
      insertTrainingRecord(seriesId, version, fitted.statistics());
      insertTrainingPoints(seriesId, version, batch.points());
      log.debug("Stored {} for series {} ({} points)", VersionLabels.format(version), seriesId,
          batch.size());
      return new ModelVersion(seriesId, version, fitted.mean(), fitted.std(),
          fitted.thresholdMultiplier(), ModelStatus.PENDING, batch.size(), trainingLatencyMs,
          createdAt);
    } catch (DataAccessException | TransactionTimedOutException ex) {
      throw writeFailure("storing a new model version", seriesId, ex);
    }
  }

  @Override
  public ModelVersion loadActive(String seriesId) {
    List<ModelVersion> rows = read(seriesId,
        () -> jdbc.query(ACTIVE_SQL, VERSION_MAPPER, seriesId));
    return first(rows, () -> ModelNotFoundException.noActiveModel(seriesId));
  }

  @Override
  public ModelVersion loadActive(String seriesId, Deadline deadline) {
    List<ModelVersion> rows = read(seriesId,
        () -> queryBefore(deadline, ACTIVE_SQL, seriesId));
    return first(rows, () -> ModelNotFoundException.noActiveModel(seriesId));
  }

  @Override
  public ModelVersion loadVersion(String seriesId, int version) {
    List<ModelVersion> rows = read(seriesId,
        () -> jdbc.query(VERSION_SQL, VERSION_MAPPER, seriesId, version));
    return first(rows, () -> ModelNotFoundException.noSuchVersion(seriesId,
        VersionLabels.format(version)));
  }

  @Override
  public ModelVersion loadVersion(String seriesId, int version, Deadline deadline) {
    List<ModelVersion> rows = read(seriesId,
        () -> queryBefore(deadline, VERSION_SQL, seriesId, version));
    return first(rows, () -> ModelNotFoundException.noSuchVersion(seriesId,
        VersionLabels.format(version)));
  }

  @Override
  public ModelVersion loadVersionForUpdate(String seriesId, int version) {
    List<ModelVersion> rows;
    try {
      rows = jdbc.query(VERSION_SQL + "FOR UPDATE\n", VERSION_MAPPER, seriesId, version);
    } catch (DataAccessException | TransactionTimedOutException ex) {
      throw writeFailure("locking " + VersionLabels.format(version), seriesId, ex);
    }
    return first(rows, () -> ModelNotFoundException.noSuchVersion(seriesId,
        VersionLabels.format(version)));
  }

  @Override
  public List<ModelVersion> listVersions(String seriesId) {
    String sql = "SELECT " + VERSION_COLUMNS + """
        FROM model_version
        WHERE series_id = ?
        ORDER BY version
        """;
    return read(seriesId, () -> jdbc.query(sql, VERSION_MAPPER, seriesId));
  }

  @Override
  @Transactional(readOnly = true)
  public TrainingRecord loadTrainingRecord(String seriesId, int version) {
    String recordSql = """
        SELECT point_count, mean, std, min_value, max_value, start_time, end_time, created_at
        FROM training_record
        WHERE series_id = ? AND version = ?
        """;
    String pointsSql = """
        SELECT ts, value
        FROM training_point
        WHERE series_id = ? AND version = ?
        ORDER BY seq
        """;
    return read(seriesId, () -> {
      List<TrainingRecord> records = jdbc.query(recordSql, (rs, i) -> new TrainingRecord(
          seriesId, version, List.of(), statistics(rs), rs.getTimestamp("created_at").toInstant()),
          seriesId, version);
      if (records.isEmpty()) {
        throw ModelNotFoundException.noSuchVersion(seriesId, VersionLabels.format(version));
      }
      TrainingRecord header = records.get(0);
      List<DataPoint> points = jdbc.query(pointsSql,
          (rs, i) -> new DataPoint(rs.getLong("ts"), rs.getDouble("value")), seriesId, version);
      return new TrainingRecord(seriesId, version, points, header.statistics(), header.createdAt());
    });
  }

  @Override
  public OptionalInt lockActiveVersion(String seriesId) {
    String lockSql = """
        SELECT last_version FROM series_head
        WHERE series_id = ?
        FOR UPDATE
        """;
    String activeSql = """
        SELECT version FROM model_version
        WHERE series_id = ? AND status = 'ACTIVE'
        """;
    try {
      jdbc.queryForList(lockSql, Integer.class, seriesId);
      List<Integer> active = jdbc.queryForList(activeSql, Integer.class, seriesId);
      return active.isEmpty() ? OptionalInt.empty() : OptionalInt.of(active.get(0));
    } catch (DataAccessException | TransactionTimedOutException ex) {
      throw writeFailure("locking the series", seriesId, ex);
    }
  }

  @Override
  public boolean transitionStatus(String seriesId, int version, ModelStatus expected,
      ModelStatus target) {
    if (!expected.canTransitionTo(target)) {
      throw new IllegalStateException("Illegal status transition " + expected + " -> " + target);
    }
    String sql = """
        UPDATE model_version
        SET status = ?
        WHERE series_id = ? AND version = ? AND status = ?
        """;
    try {
      return jdbc.update(sql, target.name(), seriesId, version, expected.name()) == 1;
    } catch (DataAccessException | TransactionTimedOutException ex) {
      throw writeFailure("changing the status of " + VersionLabels.format(version), seriesId, ex);
    }
  }

  // Upsert doubles as the per-series sequence; the row stays locked until commit.
  private int nextVersion(String seriesId) {
    String sql = """
        INSERT INTO series_head (series_id, last_version)
        VALUES (?, 1)
        ON CONFLICT (series_id)
        DO UPDATE SET last_version = series_head.last_version + 1
        RETURNING last_version
        """;
    Integer version = jdbc.queryForObject(sql, Integer.class, seriesId);
    if (version == null) {
      throw new ModelPersistenceException("No version number assigned for series " + seriesId);
    }
    return version;
  }

  private Instant insertVersion(String seriesId, int version, FittedModel fitted, int points,
      double trainingLatencyMs) {
    String sql = """
        INSERT INTO model_version (series_id, version, mean, std, threshold_multiplier, status,
                                   training_points, training_latency_ms)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?)
        RETURNING created_at
        """;
    return jdbc.queryForObject(sql, (rs, i) -> rs.getTimestamp(1).toInstant(),
        seriesId, version, fitted.mean(), fitted.std(), fitted.thresholdMultiplier(),
        ModelStatus.PENDING.name(), points, trainingLatencyMs);
  }

  private void insertTrainingRecord(String seriesId, int version, TrainingStatistics stats) {
    String sql = """
        INSERT INTO training_record (series_id, version, point_count, mean, std,
                                     min_value, max_value, start_time, end_time)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;
    jdbc.update(sql, seriesId, version, stats.count(), stats.mean(), stats.std(), stats.min(),
        stats.max(), stats.startTime(), stats.endTime());
  }

  private void insertTrainingPoints(String seriesId, int version, List<DataPoint> points) {
    String sql = """
        INSERT INTO training_point (series_id, version, seq, ts, value)
        VALUES (?, ?, ?, ?, ?)
        """;
    List<Object[]> args = new ArrayList<>(points.size());
    for (int i = 0; i < points.size(); i++) {
      DataPoint point = points.get(i);
      args.add(new Object[] {seriesId, version, i, point.timestamp(), point.value()});
    }
    jdbc.batchUpdate(sql, args);
  }

  private static TrainingStatistics statistics(ResultSet rs) throws SQLException {
    return new TrainingStatistics(
        rs.getInt("point_count"),
        rs.getDouble("mean"),
        rs.getDouble("std"),
        rs.getDouble("min_value"),
        rs.getDouble("max_value"),
        rs.getLong("start_time"),
        rs.getLong("end_time"));
  }

  // JDBC timeouts are whole seconds; the caller enforces the exact deadline on its side
  private List<ModelVersion> queryBefore(Deadline deadline, String sql, Object... args) {
    if (deadline.isExpired()) {
      throw new QueryTimeoutException("Deadline expired before querying: " + deadline);
    }
    int timeoutSeconds = (int) Math.max(1L, (deadline.remainingMillis() + 999L) / 1000L);
    return jdbc.execute((ConnectionCallback<List<ModelVersion>>) connection -> {
      try (PreparedStatement statement = connection.prepareStatement(sql)) {
        statement.setQueryTimeout(timeoutSeconds);
        new ArgumentPreparedStatementSetter(args).setValues(statement);
        try (ResultSet rs = statement.executeQuery()) {
          return new RowMapperResultSetExtractor<>(VERSION_MAPPER).extractData(rs);
        }
      }
    });
  }

  private static <T> T first(List<T> rows, Supplier<ModelNotFoundException> notFound) {
    if (rows.isEmpty()) {
      throw notFound.get();
    }
    return rows.get(0);
  }

  private static <T> T read(String seriesId, Supplier<T> operation) {
    try {
      return operation.get();
    } catch (QueryTimeoutException | TransactionTimedOutException ex) {
      throw new BackendTimeoutException("Timed out reading models for series " + seriesId, ex);
    } catch (DataAccessException ex) {
      throw new BackendUnavailableException("Model store unavailable for series " + seriesId, ex);
    }
  }

  private static RuntimeException writeFailure(String action, String seriesId, RuntimeException ex) {
    if (ex instanceof QueryTimeoutException || ex instanceof TransactionTimedOutException) {
      return new BackendTimeoutException("Timed out " + action + " for series " + seriesId, ex);
    }
    return new ModelPersistenceException("Failed " + action + " for series " + seriesId, ex);
  }
}
