package com.ospicorp.anomalyapi.store;

import com.ospicorp.anomalyapi.model.ModelStatus;
import com.ospicorp.anomalyapi.model.VersionLabels;

/**
 * Result of {@link VersionManager#activate}. {@code status} is where the requested version
 * ended up; {@code previousActive} is the version it replaced, if any.
 */
public record ActivationOutcome(String seriesId, int version, ModelStatus status,
    Integer previousActive) {

  public boolean activated() {
    return status == ModelStatus.ACTIVE;
  }

  public String label() {
    return VersionLabels.format(version);
  }
}
