package com.ospicorp.anomalyapi.support;

// Transient infrastructure failure. The core never retries; callers decide.
public class BackendUnavailableException extends RuntimeException {

  public BackendUnavailableException(String message) {
    super(message);
  }

  public BackendUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
