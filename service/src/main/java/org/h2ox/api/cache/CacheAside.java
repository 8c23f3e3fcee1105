package org.h2ox.api.cache;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.function.Function;
import java.util.function.Predicate;
import org.springframework.stereotype.Component;

/**
 * Creates {@link CacheAsideFetcher}s that share the process-wide store, JSON mapper and policy.
 */
@Component
public class CacheAside {
  private final CacheStore store;
  private final ObjectMapper mapper;
  private final CachePolicy policy;

  public CacheAside(CacheStore store, ObjectMapper mapper, CachePolicy policy) {
    this.store = store;
    this.mapper = mapper;
    this.policy = policy;
  }

  public <K, V> CacheAsideFetcher<K, V> fetcher(String operation, Function<K, String> keyBuilder,
      JavaType valueType, Function<K, V> loader) {
    return fetcher(operation, keyBuilder, valueType, loader, value -> true);
  }

  /**
   * Like {@link #fetcher(String, Function, JavaType, Function)}, but only stores loaded values
   * that satisfy {@code cacheable}.
   */
  public <K, V> CacheAsideFetcher<K, V> fetcher(String operation, Function<K, String> keyBuilder,
      JavaType valueType, Function<K, V> loader, Predicate<? super V> cacheable) {
    return new CacheAsideFetcher<>(operation, keyBuilder, loader, valueType, store, mapper,
        policy, cacheable);
  }

  public <K, V> CacheAsideFetcher<K, V> fetcher(String operation, Function<K, String> keyBuilder,
      Class<V> valueType, Function<K, V> loader) {
    return fetcher(operation, keyBuilder, mapper.constructType(valueType), loader);
  }

  public ObjectMapper mapper() {
    return mapper;
  }

  public CachePolicy policy() {
    return policy;
  }
}
