package com.acme.rmq.retrieval.core;

/** Retrieval options that cannot be run as given. Raised before any broker call. */
public class RetrievalConfigurationException extends PermanentException {
  private final ErrorInfo errorInfo;

  public RetrievalConfigurationException(String message, String suggestion) {
    super(message);
    this.errorInfo = ErrorInfo.invalidConfiguration(message, suggestion);
  }

  public ErrorInfo getErrorInfo() {
    return errorInfo;
  }
}
