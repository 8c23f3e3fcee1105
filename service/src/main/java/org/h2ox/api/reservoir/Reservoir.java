package org.h2ox.api.reservoir;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Catalog entry: latest level, capacity in million cubic meters, and the outline as a GeoJSON
 * geometry ({@code null} when the warehouse has none).
 */
public record Reservoir(
    String name,
    Level level,
    @JsonProperty("full_level") double fullLevel,
    JsonNode geom
) {
  public Reservoir {
    if (geom != null && geom.isNull()) {
      geom = null;
    }
  }
}
