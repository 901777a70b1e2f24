package com.flamingo.ai.graphrag.exception;

/** Thrown when the embedding or cross-encoder model cannot be loaded or fails to score. */
public class ProviderUnavailableException extends RuntimeException {

  private final String provider;

  public ProviderUnavailableException(String provider, String message) {
    super(message);
    this.provider = provider;
  }

  public ProviderUnavailableException(String provider, String message, Throwable cause) {
    super(message, cause);
    this.provider = provider;
  }

  /** Name of the failing provider, e.g. {@code embedding} or {@code cross-encoder}. */
  public String getProvider() {
    return provider;
  }
}
