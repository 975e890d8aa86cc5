package com.ospicorp.anomalyapi.catalog;

import com.ospicorp.anomalyapi.model.ModelVersion;
import com.ospicorp.anomalyapi.model.TrainingRecord;
import com.ospicorp.anomalyapi.model.VersionSelector;
import com.ospicorp.anomalyapi.store.ModelNotFoundException;
import com.ospicorp.anomalyapi.store.ModelStore;
import java.util.List;
import org.springframework.stereotype.Service;

// Read-only view over stored versions; bypasses the cache.
@Service
public class ModelCatalogService {
  private final ModelStore store;

  public ModelCatalogService(ModelStore store) {
    this.store = store;
  }

  public List<ModelVersion> listVersions(String seriesId) {
    List<ModelVersion> versions = store.listVersions(seriesId);
    if (versions.isEmpty()) {
      throw new ModelNotFoundException("No models trained for series " + seriesId);
    }
    return versions;
  }

  public ModelVersion getVersion(String seriesId, VersionSelector selector) {
    return selector.isActive()
        ? store.loadActive(seriesId)
        : store.loadVersion(seriesId, selector.pinnedVersion());
  }

  public TrainingRecord getTrainingRecord(String seriesId, VersionSelector selector) {
    int version = selector.isActive()
        ? store.loadActive(seriesId).version()
        : selector.pinnedVersion();
    return store.loadTrainingRecord(seriesId, version);
  }
}
