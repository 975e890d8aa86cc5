package com.ospicorp.anomalyapi.store;

public class ModelPersistenceException extends RuntimeException {

  public ModelPersistenceException(String message) {
    super(message);
  }

  public ModelPersistenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
