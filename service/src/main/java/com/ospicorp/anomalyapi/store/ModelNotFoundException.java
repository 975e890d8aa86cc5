package com.ospicorp.anomalyapi.store;

import java.util.NoSuchElementException;

public class ModelNotFoundException extends NoSuchElementException {

  public ModelNotFoundException(String message) {
    super(message);
  }

  public static ModelNotFoundException noActiveModel(String seriesId) {
    return new ModelNotFoundException(
        "No active model for series " + seriesId + ". Train a model first.");
  }

  public static ModelNotFoundException noSuchVersion(String seriesId, String label) {
    return new ModelNotFoundException("Model version " + label + " not found for series " + seriesId);
  }
}
