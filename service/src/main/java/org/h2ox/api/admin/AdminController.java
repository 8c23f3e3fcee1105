package org.h2ox.api.admin;

import java.util.Map;
import org.h2ox.api.cache.CachePolicy;
import org.h2ox.api.reservoir.ReservoirService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/cache")
public class AdminController {
  private static final Logger log = LoggerFactory.getLogger(AdminController.class);

  private final ReservoirService reservoirService;
  private final CachePolicy cachePolicy;

  public AdminController(ReservoirService reservoirService, CachePolicy cachePolicy) {
    this.reservoirService = reservoirService;
    this.cachePolicy = cachePolicy;
  }

  @DeleteMapping
  public ResponseEntity<Map<String, Object>> evict(@RequestParam(required = false) String operation,
      @RequestParam(required = false) String reservoir) {
    Map<String, Object> result = reservoirService.evict(operation, reservoir);
    log.info("Cache eviction {}", result);
    return ResponseEntity.ok(result);
  }

  @GetMapping("/bypass")
  public Map<String, Object> bypass() {
    return Map.of("bypass", cachePolicy.bypass(), "ttl", cachePolicy.ttl().toString());
  }

  @PutMapping("/bypass")
  public Map<String, Object> setBypass(@RequestParam boolean enabled) {
    cachePolicy.setBypass(enabled);
    log.info("Cache bypass set to {}", enabled);
    return bypass();
  }
}
