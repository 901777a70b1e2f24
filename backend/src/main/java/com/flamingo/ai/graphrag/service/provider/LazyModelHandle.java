package com.flamingo.ai.graphrag.service.provider;

import com.flamingo.ai.graphrag.exception.ProviderUnavailableException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads a model on first use, once per process.
 *
 * <p>Concurrent first callers block on a single load. A failed load is not cached: the caller gets
 * a {@link ProviderUnavailableException} and the next call tries again.
 *
 * @param <T> the model type
 */
@Slf4j
public class LazyModelHandle<T> {

  private final String name;
  private final Supplier<T> loader;
  private final ReentrantLock lock = new ReentrantLock();
  private volatile T model;

  public LazyModelHandle(String name, Supplier<T> loader) {
    this.name = name;
    this.loader = loader;
  }

  /** A handle whose every load fails, for providers that are switched off. */
  public static <T> LazyModelHandle<T> unavailable(String name, String reason) {
    return new LazyModelHandle<>(
        name,
        () -> {
          throw new IllegalStateException(reason);
        });
  }

  public T get() {
    T loaded = model;
    if (loaded != null) {
      return loaded;
    }
    lock.lock();
    try {
      if (model == null) {
        log.info("Loading {} model", name);
        try {
          model = loader.get();
        } catch (RuntimeException e) {
          log.error("Failed to load {} model: {}", name, e.getMessage());
          throw new ProviderUnavailableException(
              name, "Failed to load " + name + " model: " + e.getMessage(), e);
        }
        log.info("{} model loaded", name);
      }
      return model;
    } finally {
      lock.unlock();
    }
  }

  public boolean isLoaded() {
    return model != null;
  }
}
