package org.h2ox.api.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps a fetch function with a read-through cache. A call returns either the whole cached
 * value or the whole freshly fetched value.
 *
 * <p>Cache-store failures never reach the caller: a failed read is a miss and a failed write is
 * logged. Values rejected by the {@code cacheable} predicate are returned without being stored.
 * Concurrent misses on the same key may each run the fetch; writes are
 * last-writer-wins with identical content.
 *
 * @param <K> call parameters
 * @param <V> fetched value, serialized to JSON in the store
 */
public final class CacheAsideFetcher<K, V> {
  private static final Logger log = LoggerFactory.getLogger(CacheAsideFetcher.class);

  private final String operation;
  private final Function<K, String> keyBuilder;
  private final Function<K, V> loader;
  private final JavaType valueType;
  private final CacheStore store;
  private final ObjectMapper mapper;
  private final CachePolicy policy;
  private final Predicate<? super V> cacheable;

  CacheAsideFetcher(String operation, Function<K, String> keyBuilder, Function<K, V> loader,
      JavaType valueType, CacheStore store, ObjectMapper mapper, CachePolicy policy,
      Predicate<? super V> cacheable) {
    this.operation = operation;
    this.keyBuilder = keyBuilder;
    this.loader = loader;
    this.valueType = valueType;
    this.store = store;
    this.mapper = mapper;
    this.policy = policy;
    this.cacheable = cacheable;
  }

  public String operation() {
    return operation;
  }

  public String keyFor(K parameters) {
    return keyBuilder.apply(parameters);
  }

  public V fetch(K parameters) {
    if (policy.bypass()) {
      log.debug("Cache bypass enabled, loading {} directly", operation);
      return loader.apply(parameters);
    }
    String key = keyFor(parameters);
    Optional<V> cached = read(key);
    if (cached.isPresent()) {
      log.debug("Cache hit for {}", key);
      return cached.get();
    }
    log.debug("Cache miss for {}", key);
    V value = loader.apply(parameters);
    if (cacheable.test(value)) {
      write(key, value);
    } else {
      log.debug("Not caching {}: result rejected by cache condition", key);
    }
    return value;
  }

  /** @return whether an entry was removed; store failures are logged and reported as false */
  public boolean evict(K parameters) {
    String key = keyFor(parameters);
    try {
      return store.delete(key);
    } catch (RuntimeException ex) {
      log.warn("Cache eviction of {} failed: {}", key, ex.getMessage());
      return false;
    }
  }

  private Optional<V> read(String key) {
    Optional<String> payload;
    try {
      payload = store.get(key);
    } catch (RuntimeException ex) {
      log.warn("Cache read of {} failed, treating as miss: {}", key, ex.getMessage());
      return Optional.empty();
    }
    if (payload.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(mapper.readValue(payload.get(), valueType));
    } catch (JsonProcessingException ex) {
      log.warn("Discarding unreadable cache entry {}: {}", key, ex.getOriginalMessage());
      return Optional.empty();
    }
  }

  private void write(String key, V value) {
    String payload;
    try {
      payload = mapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      log.warn("Could not serialize {} for caching: {}", key, ex.getOriginalMessage());
      return;
    }
    try {
      store.set(key, payload, policy.ttl());
      log.debug("Cached {} (ttl {})", key, policy.ttl());
    } catch (RuntimeException ex) {
      log.warn("Cache write of {} failed: {}", key, ex.getMessage());
    }
  }
}
