package org.h2ox.api.cache;

import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Process-wide cache settings. The bypass flag starts from {@code cache.bust} and can be flipped
 * at runtime for a forced refresh.
 */
@Component
public class CachePolicy {
  private final Duration ttl;
  private volatile boolean bypass;

  public CachePolicy(@Value("${cache.bust:false}") boolean bypass,
      @Value("${cache.ttl:48h}") Duration ttl) {
    if (ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("cache.ttl must be positive, got " + ttl);
    }
    this.bypass = bypass;
    this.ttl = ttl;
  }

  public Duration ttl() {
    return ttl;
  }

  public boolean bypass() {
    return bypass;
  }

  public void setBypass(boolean bypass) {
    this.bypass = bypass;
  }
}
