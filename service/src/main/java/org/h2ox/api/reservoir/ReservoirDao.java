package org.h2ox.api.reservoir;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.h2ox.api.warehouse.QueryException;
import org.h2ox.api.warehouse.WarehouseClient;
import org.h2ox.api.warehouse.WarehouseQuery;
import org.h2ox.api.warehouse.WarehouseRow;
import org.springframework.stereotype.Repository;

/**
 * Reads raw reservoir rows from the warehouse and maps each tuple onto a typed record. A row
 * whose shape does not match the query's projection is reported as a {@link QueryException}.
 */
@Repository
public class ReservoirDao {
  private final WarehouseClient warehouse;

  public ReservoirDao(WarehouseClient warehouse) {
    this.warehouse = warehouse;
  }

  public ForecastRun latestForecast(String reservoir) {
    WarehouseQuery query = WarehouseQuery.LATEST_FORECAST;
    WarehouseRow row = warehouse.querySingle(query, Map.of("reservoir", reservoir));
    return map(query, row, r -> new ForecastRun(r.getDate(0), r.getDoubleList(1)));
  }

  public List<DataPoint> historicLevels(String reservoir, int historyDays) {
    WarehouseQuery query = WarehouseQuery.HISTORIC_LEVELS;
    List<WarehouseRow> rows = warehouse.query(query,
        Map.of("reservoir", reservoir, "historyDays", historyDays));
    return mapAll(query, rows, r -> new DataPoint(r.getDate(0), r.getDouble(1)));
  }

  /** Mean volume per day of year (1-366) over every year on record. */
  public Map<Integer, Double> levelBaseline(String reservoir) {
    WarehouseQuery query = WarehouseQuery.HISTORIC_BASELINE;
    List<WarehouseRow> rows = warehouse.query(query, Map.of("reservoir", reservoir));
    Map<Integer, Double> baseline = new LinkedHashMap<>();
    for (WarehouseRow row : rows) {
      Integer dayOfYear = map(query, row, r -> r.getInteger(0));
      Double volume = map(query, row, r -> r.getDouble(1));
      if (dayOfYear == null) {
        throw new QueryException(query.queryName(), "Baseline row without day of year", null);
      }
      baseline.put(dayOfYear, volume);
    }
    return baseline;
  }

  public List<DataPoint> precipitation(String reservoir) {
    WarehouseQuery query = WarehouseQuery.PRECIP;
    List<WarehouseRow> rows = warehouse.query(query, Map.of("reservoir", reservoir));
    return mapAll(query, rows, r -> new DataPoint(r.getDate(0), r.getDouble(1)));
  }

  public List<CatalogEntry> catalog() {
    WarehouseQuery query = WarehouseQuery.RESERVOIR_CATALOG;
    List<WarehouseRow> rows = warehouse.query(query, Map.of());
    return mapAll(query, rows, r -> new CatalogEntry(
        r.getString(0),
        r.getDate(1),
        r.getDouble(2),
        r.getDouble(3),
        r.getDouble(4),
        r.getString(5)));
  }

  private static <T> List<T> mapAll(WarehouseQuery query, List<WarehouseRow> rows,
      Function<WarehouseRow, T> mapper) {
    List<T> out = new ArrayList<>(rows.size());
    for (WarehouseRow row : rows) {
      out.add(map(query, row, mapper));
    }
    return out;
  }

  private static <T> T map(WarehouseQuery query, WarehouseRow row,
      Function<WarehouseRow, T> mapper) {
    try {
      return mapper.apply(row);
    } catch (IllegalStateException ex) {
      throw new QueryException(query.queryName(), "Malformed warehouse row: " + ex.getMessage(),
          ex);
    }
  }
}
