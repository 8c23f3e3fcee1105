package org.h2ox.api.reservoir;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Turns raw warehouse records into the normalized reservoir model. Pure: no I/O, and the same
 * input always yields an equal (and identically serialized) result.
 */
@Component
public class TimeseriesAssembler {

  /** Billion cubic meters to million cubic meters. */
  static final double BCM_TO_MCM = 1000d;
  static final int ROUNDING_SCALE = 3;

  private final ObjectMapper mapper;

  public TimeseriesAssembler(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  public Timeseries<Level> forecast(String reservoir, ForecastRun run) {
    if (run.issueDate() == null) {
      throw new AssemblyException("Forecast for " + reservoir + " has no issue date");
    }
    List<Double> raw = run.values();
    if (raw == null || raw.isEmpty()) {
      throw new AssemblyException("Forecast for " + reservoir + " has no values");
    }
    List<Level> levels = new ArrayList<>(raw.size());
    for (int i = 0; i < raw.size(); i++) {
      Double value = raw.get(i);
      if (value == null) {
        throw new AssemblyException("Forecast for " + reservoir + " is missing day offset " + i);
      }
      levels.add(new Level(run.issueDate().plusDays(i), value * BCM_TO_MCM, 0d));
    }
    return new Timeseries<>(reservoir, run.issueDate(), levels);
  }

  /**
   * Joins daily volumes with the day-of-year baseline. Both are scaled to million cubic meters.
   */
  public Timeseries<Level> historic(String reservoir, List<DataPoint> rows,
      Map<Integer, Double> baseline) {
    List<DataPoint> sorted = sortedDistinct(reservoir, rows);
    List<Level> levels = new ArrayList<>(sorted.size());
    for (DataPoint point : sorted) {
      Double average = baseline.get(point.date().getDayOfYear());
      if (average == null) {
        throw new AssemblyException("No baseline for " + reservoir + " on day "
            + point.date().getDayOfYear());
      }
      levels.add(new Level(point.date(), point.value() * BCM_TO_MCM, average * BCM_TO_MCM));
    }
    return new Timeseries<>(reservoir, lastDate(levels), levels);
  }

  /**
   * Computes year-to-date cumulative precipitation and its day-of-year average over the full
   * history, then keeps the trailing {@code historyDays} days.
   */
  public Timeseries<Precip> precip(String reservoir, List<DataPoint> rows, int historyDays) {
    List<DataPoint> sorted = sortedDistinct(reservoir, rows);
    double[] cumulative = new double[sorted.size()];
    Map<Integer, double[]> sums = new HashMap<>();

    int currentYear = Integer.MIN_VALUE;
    double running = 0d;
    for (int i = 0; i < sorted.size(); i++) {
      DataPoint point = sorted.get(i);
      if (point.date().getYear() != currentYear) {
        currentYear = point.date().getYear();
        running = 0d;
      }
      running += point.value();
      cumulative[i] = running;
      double[] acc = sums.computeIfAbsent(point.date().getDayOfYear(), k -> new double[2]);
      acc[0] += running;
      acc[1] += 1;
    }

    if (sorted.isEmpty()) {
      return new Timeseries<>(reservoir, null, List.of());
    }
    LocalDate cutoff = sorted.get(sorted.size() - 1).date().minusDays(historyDays);
    List<Precip> out = new ArrayList<>();
    for (int i = 0; i < sorted.size(); i++) {
      DataPoint point = sorted.get(i);
      if (!point.date().isAfter(cutoff)) {
        continue;
      }
      double[] acc = sums.get(point.date().getDayOfYear());
      out.add(new Precip(point.date(), point.value(), round(cumulative[i]),
          round(acc[0] / acc[1])));
    }
    return new Timeseries<>(reservoir, lastDate(out), out);
  }

  /**
   * Builds the catalog. A reservoir without geometry keeps {@code geom = null}; geometry text
   * that is not valid JSON fails the whole catalog.
   */
  public ReservoirList catalog(List<CatalogEntry> entries) {
    Set<String> names = new HashSet<>();
    List<Reservoir> reservoirs = new ArrayList<>(entries.size());
    for (CatalogEntry entry : entries) {
      if (!StringUtils.hasText(entry.name())) {
        throw new AssemblyException("Catalog row without a reservoir name");
      }
      if (!names.add(entry.name())) {
        throw new AssemblyException("Reservoir " + entry.name() + " appears twice in the catalog");
      }
      if (entry.latestDate() == null || entry.latestVolume() == null
          || entry.latestBaseline() == null) {
        throw new AssemblyException("Reservoir " + entry.name() + " has no latest level");
      }
      if (entry.fullVolume() == null) {
        throw new AssemblyException("Reservoir " + entry.name() + " has no full volume");
      }
      Level level = new Level(entry.latestDate(), entry.latestVolume() * BCM_TO_MCM,
          entry.latestBaseline() * BCM_TO_MCM);
      reservoirs.add(new Reservoir(entry.name(), level, entry.fullVolume() * BCM_TO_MCM,
          parseGeometry(entry)));
    }
    return new ReservoirList(reservoirs);
  }

  private JsonNode parseGeometry(CatalogEntry entry) {
    if (!StringUtils.hasText(entry.geomJson())) {
      return null;
    }
    try {
      return mapper.readTree(entry.geomJson());
    } catch (JsonProcessingException ex) {
      throw new AssemblyException("Geometry of " + entry.name() + " is not valid GeoJSON", ex);
    }
  }

  private static List<DataPoint> sortedDistinct(String reservoir, List<DataPoint> rows) {
    List<DataPoint> sorted = new ArrayList<>(rows.size());
    for (DataPoint point : rows) {
      if (point.date() == null || point.value() == null) {
        throw new AssemblyException("Incomplete observation for " + reservoir + ": " + point);
      }
      sorted.add(point);
    }
    sorted.sort(Comparator.comparing(DataPoint::date));
    for (int i = 1; i < sorted.size(); i++) {
      if (sorted.get(i).date().equals(sorted.get(i - 1).date())) {
        throw new AssemblyException("Duplicate observation for " + reservoir + " on "
            + sorted.get(i).date());
      }
    }
    return sorted;
  }

  private static LocalDate lastDate(List<? extends TimeValue> series) {
    return series.isEmpty() ? null : series.get(series.size() - 1).date();
  }

  static double round(double value) {
    return BigDecimal.valueOf(value).setScale(ROUNDING_SCALE, RoundingMode.HALF_UP).doubleValue();
  }
}
