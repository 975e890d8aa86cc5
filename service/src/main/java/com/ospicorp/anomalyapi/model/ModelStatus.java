package com.ospicorp.anomalyapi.model;

/**
 * Lifecycle of a {@link ModelVersion}. {@code PENDING} only exists inside the training
 * transaction, between the version row being written and its activation, so readers never
 * observe it after commit.
 */
public enum ModelStatus {
  PENDING,
  ACTIVE,
  SUPERSEDED;

  public boolean canTransitionTo(ModelStatus target) {
    return switch (this) {
      case PENDING -> target == ACTIVE || target == SUPERSEDED;
      case ACTIVE -> target == SUPERSEDED;
      case SUPERSEDED -> false;
    };
  }
}
