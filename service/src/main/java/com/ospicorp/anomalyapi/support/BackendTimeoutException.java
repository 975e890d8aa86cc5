package com.ospicorp.anomalyapi.support;

public class BackendTimeoutException extends BackendUnavailableException {

  public BackendTimeoutException(String message) {
    super(message);
  }

  public BackendTimeoutException(String message, Throwable cause) {
    super(message, cause);
  }
}
