package com.flamingo.ai.graphrag.exception;

/** Exception thrown when a graph scan or traversal fails or times out. */
public class GraphQueryFailedException extends RuntimeException {

  private final String userMessage;

  public GraphQueryFailedException(String message) {
    super(message);
    this.userMessage = "Graph retrieval failed. Please try again.";
  }

  public GraphQueryFailedException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Graph retrieval failed. Please try again.";
  }

  protected GraphQueryFailedException(String message, Throwable cause, String userMessage) {
    super(message, cause);
    this.userMessage = userMessage;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
