package com.ospicorp.anomalyapi.web;

public class InvalidParameterException extends RuntimeException {
  private static final String ERROR_DOCS_BASE = "https://developers.company.com/docs/errors/";

  private final int errorCode;

  public InvalidParameterException(String message, int errorCode) {
    super(message);
    this.errorCode = errorCode;
  }

  public int errorCode() {
    return errorCode;
  }

  public String moreInfo() {
    return ERROR_DOCS_BASE + errorCode;
  }
}
