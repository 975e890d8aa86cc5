package com.ospicorp.anomalyapi.training;

public enum ValidationFailure {
  SHAPE_MISMATCH(2001),
  INSUFFICIENT_DATA(2002),
  INVALID_VALUE(2003),
  CONSTANT_SERIES(2004),
  UNORDERED_TIMESTAMPS(2005),
  INVALID_THRESHOLD(2006);

  private final int errorCode;

  ValidationFailure(int errorCode) {
    this.errorCode = errorCode;
  }

  public int errorCode() {
    return errorCode;
  }
}
