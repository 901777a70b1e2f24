package com.flamingo.ai.graphrag.exception;

/** Thrown when a retrieval request is rejected before any pipeline stage runs. */
public class InvalidInputException extends RuntimeException {

  private final String field;

  public InvalidInputException(String field, String message) {
    super(field + ": " + message);
    this.field = field;
  }

  public String getField() {
    return field;
  }
}
