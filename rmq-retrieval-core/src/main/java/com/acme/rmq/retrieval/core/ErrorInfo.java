package com.acme.rmq.retrieval.core;

/**
 * Structured description of a failure, suitable for rendering to an operator.
 *
 * @param category broad area of the failure, e.g. {@code routing} or {@code validation}
 * @param code stable machine readable code
 * @param error human readable message
 * @param suggestion optional hint for fixing the problem
 */
public record ErrorInfo(String category, String code, String error, String suggestion) {

  public static ErrorInfo queueNotFound(String queue) {
    return new ErrorInfo(
        "routing",
        "QUEUE_NOT_FOUND",
        "Queue '" + queue + "' not found",
        "Check if the queue exists and is correctly configured");
  }

  public static ErrorInfo invalidConfiguration(String error, String suggestion) {
    return new ErrorInfo("validation", "INVALID_CONFIGURATION", error, suggestion);
  }
}
