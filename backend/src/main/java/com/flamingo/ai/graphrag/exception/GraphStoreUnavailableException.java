package com.flamingo.ai.graphrag.exception;

/**
 * The graph store cannot be reached at all. Unlike a single failed query this is a process-level
 * condition: it is propagated to the caller and reported through health checks.
 */
public class GraphStoreUnavailableException extends GraphQueryFailedException {

  public GraphStoreUnavailableException(String message, Throwable cause) {
    super(message, cause, "Graph store is unavailable. Please try again later.");
  }
}
