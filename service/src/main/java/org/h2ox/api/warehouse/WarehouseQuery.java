package org.h2ox.api.warehouse;

import java.util.Set;

/**
 * The logical queries the service runs against the warehouse. Every value that varies per
 * call is a named bind parameter; nothing is interpolated into the SQL text. Rows without a
 * measurement are skipped, so a gap in one reservoir never fails another's result.
 */
public enum WarehouseQuery {

  LATEST_FORECAST("latest-forecast-for-reservoir", Set.of("reservoir"), """
      SELECT issue_date, forecast_bcm
      FROM prediction
      WHERE reservoir_name = :reservoir
      ORDER BY issue_date DESC, issued_at DESC
      LIMIT 1
      """),

  HISTORIC_LEVELS("historic-levels-for-reservoir", Set.of("reservoir", "historyDays"), """
      SELECT obs_date, water_volume_bcm
      FROM reservoir_level
      WHERE reservoir_name = :reservoir
        AND water_volume_bcm IS NOT NULL
        AND obs_date > (
          SELECT MAX(obs_date) FROM reservoir_level
          WHERE reservoir_name = :reservoir AND water_volume_bcm IS NOT NULL
        ) - CAST(:historyDays AS INTEGER)
      ORDER BY obs_date
      """),

  HISTORIC_BASELINE("historic-baseline-for-reservoir", Set.of("reservoir"), """
      SELECT CAST(EXTRACT(DOY FROM obs_date) AS INTEGER) AS day_of_year,
             AVG(water_volume_bcm) AS avg_volume
      FROM reservoir_level
      WHERE reservoir_name = :reservoir
      GROUP BY 1
      ORDER BY 1
      """),

  PRECIP("precip-for-reservoir", Set.of("reservoir"), """
      SELECT obs_date, precip_mm
      FROM reservoir_precip
      WHERE reservoir_name = :reservoir
        AND precip_mm IS NOT NULL
      ORDER BY obs_date
      """),

  RESERVOIR_CATALOG("reservoir-catalog", Set.of(), """
      SELECT r.name, latest.obs_date, latest.water_volume_bcm, baseline.avg_volume,
             r.full_volume_bcm, r.geom_geojson
      FROM reservoir r
      JOIN LATERAL (
        SELECT l.obs_date, l.water_volume_bcm
        FROM reservoir_level l
        WHERE l.reservoir_name = r.name
          AND l.water_volume_bcm IS NOT NULL
        ORDER BY l.obs_date DESC
        LIMIT 1
      ) latest ON TRUE
      JOIN LATERAL (
        SELECT AVG(b.water_volume_bcm) AS avg_volume
        FROM reservoir_level b
        WHERE b.reservoir_name = r.name
          AND EXTRACT(DOY FROM b.obs_date) = EXTRACT(DOY FROM latest.obs_date)
      ) baseline ON TRUE
      ORDER BY r.name
      """);

  private final String queryName;
  private final Set<String> parameters;
  private final String sql;

  WarehouseQuery(String queryName, Set<String> parameters, String sql) {
    this.queryName = queryName;
    this.parameters = parameters;
    this.sql = sql;
  }

  public String queryName() {
    return queryName;
  }

  public Set<String> parameters() {
    return parameters;
  }

  public String sql() {
    return sql;
  }

  /**
   * Rejects a call whose bound parameter names differ from the ones the query declares.
   */
  public void checkParameters(Set<String> supplied) {
    if (!parameters.equals(supplied)) {
      throw new IllegalArgumentException("Query " + queryName + " expects parameters "
          + parameters + " but got " + supplied);
    }
  }
}
