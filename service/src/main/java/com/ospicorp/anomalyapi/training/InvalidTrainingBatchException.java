package com.ospicorp.anomalyapi.training;

public class InvalidTrainingBatchException extends RuntimeException {
  private static final String ERROR_DOCS_BASE = "https://developers.company.com/docs/errors/";

  private final ValidationFailure reason;

  public InvalidTrainingBatchException(ValidationFailure reason, String message) {
    super(message);
    this.reason = reason;
  }

  public ValidationFailure reason() {
    return reason;
  }

  public int errorCode() {
    return reason.errorCode();
  }

  public String moreInfo() {
    return ERROR_DOCS_BASE + reason.errorCode();
  }
}
