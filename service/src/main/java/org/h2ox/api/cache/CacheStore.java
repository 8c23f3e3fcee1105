package org.h2ox.api.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key-value store holding serialized query results. Implementations are safe for concurrent
 * use; failures surface as runtime exceptions and are handled by {@link CacheAsideFetcher}.
 */
public interface CacheStore {

  Optional<String> get(String key);

  void set(String key, String value, Duration ttl);

  /** @return whether a key was removed */
  boolean delete(String key);
}
