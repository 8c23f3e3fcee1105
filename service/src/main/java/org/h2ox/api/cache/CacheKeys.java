package org.h2ox.api.cache;

import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Builds cache keys of the form {@code "{operation}.{values}"}, where values are the parameter
 * values ordered by parameter name and joined with commas. With a single {@code reservoir}
 * parameter this is {@code "forecast.Kabini"}; with none it is {@code "levels."}. Eviction
 * tooling relies on this format.
 */
public final class CacheKeys {
  private CacheKeys() {
  }

  public static String key(String operation, Map<String, ?> parameters) {
    String suffix = new TreeMap<>(parameters).values().stream()
        .map(value -> Objects.toString(value, ""))
        .collect(Collectors.joining(","));
    return operation + "." + suffix;
  }
}
