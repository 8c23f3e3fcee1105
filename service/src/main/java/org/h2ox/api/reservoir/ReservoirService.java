package org.h2ox.api.reservoir;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.type.TypeFactory;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.h2ox.api.cache.CacheAside;
import org.h2ox.api.cache.CacheAsideFetcher;
import org.h2ox.api.cache.CacheKeys;
import org.h2ox.api.warehouse.QueryException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Reservoir query operations. Each one validates its parameters, then goes through a
 * {@link CacheAsideFetcher} whose loader reads the warehouse and assembles the result.
 */
@Service
public class ReservoirService {
  public static final String FORECAST = "forecast";
  public static final String HISTORIC = "historic";
  public static final String PRECIP = "precip";
  public static final String LEVELS = "levels";

  static final String RESERVOIR_PARAM = "reservoir";
  // identifiers come from the warehouse catalog; only their length is bounded here
  static final int MAX_RESERVOIR_LENGTH = 128;
  private static final String ERROR_DOCS_BASE = "https://h2ox.org/docs/api/errors/";

  private final CacheAsideFetcher<Map<String, String>, Timeseries<Level>> prediction;
  private final CacheAsideFetcher<Map<String, String>, Timeseries<Level>> historic;
  private final CacheAsideFetcher<Map<String, String>, Timeseries<Precip>> precip;
  private final CacheAsideFetcher<Map<String, String>, ReservoirList> catalog;

  public ReservoirService(ReservoirDao dao, TimeseriesAssembler assembler, CacheAside cacheAside,
      @Value("${reservoirs.history-days:365}") int historyDays) {
    if (historyDays < 1) {
      throw new IllegalArgumentException("reservoirs.history-days must be positive");
    }
    TypeFactory types = cacheAside.mapper().getTypeFactory();
    JavaType levelSeries = types.constructParametricType(Timeseries.class, Level.class);
    JavaType precipSeries = types.constructParametricType(Timeseries.class, Precip.class);

    this.prediction = cacheAside.fetcher(FORECAST, params -> CacheKeys.key(FORECAST, params),
        levelSeries, params -> {
          String reservoir = params.get(RESERVOIR_PARAM);
          return assembler.forecast(reservoir, dao.latestForecast(reservoir));
        });
    this.historic = cacheAside.fetcher(HISTORIC, params -> CacheKeys.key(HISTORIC, params),
        levelSeries, params -> {
          String reservoir = params.get(RESERVOIR_PARAM);
          return assembler.historic(reservoir, dao.historicLevels(reservoir, historyDays),
              dao.levelBaseline(reservoir));
        }, ReservoirService::hasEntries);
    this.precip = cacheAside.fetcher(PRECIP, params -> CacheKeys.key(PRECIP, params),
        precipSeries, params -> {
          String reservoir = params.get(RESERVOIR_PARAM);
          return assembler.precip(reservoir, dao.precipitation(reservoir), historyDays);
        }, ReservoirService::hasEntries);
    this.catalog = cacheAside.fetcher(LEVELS, params -> CacheKeys.key(LEVELS, params),
        ReservoirList.class, params -> assembler.catalog(dao.catalog()));
  }

  public Timeseries<Level> fetchPrediction(String reservoir) {
    Map<String, String> params = reservoirParams(reservoir);
    return run(FORECAST, () -> prediction.fetch(params));
  }

  public Timeseries<Level> fetchHistoric(String reservoir) {
    Map<String, String> params = reservoirParams(reservoir);
    return run(HISTORIC, () -> historic.fetch(params));
  }

  public Timeseries<Precip> fetchPrecip(String reservoir) {
    Map<String, String> params = reservoirParams(reservoir);
    return run(PRECIP, () -> precip.fetch(params));
  }

  public ReservoirList fetchReservoirCatalog() {
    return run(LEVELS, () -> catalog.fetch(Map.of()));
  }

  /**
   * Latest forecast of every reservoir in the catalog, in catalog order.
   */
  public List<ReservoirPrediction> fetchAllPredictions() {
    ReservoirList reservoirs = fetchReservoirCatalog();
    List<ReservoirPrediction> out = new ArrayList<>(reservoirs.reservoirs().size());
    for (Reservoir reservoir : reservoirs.reservoirs()) {
      out.add(new ReservoirPrediction(reservoir.name(), fetchPrediction(reservoir.name())));
    }
    return out;
  }

  /**
   * Removes the cached result of one operation. The reservoir is ignored for {@code levels}.
   *
   * @return the evicted key and whether an entry existed
   */
  public Map<String, Object> evict(String operation, String reservoir) {
    CacheAsideFetcher<Map<String, String>, ?> fetcher = fetcherFor(operation);
    Map<String, String> params = LEVELS.equals(operation) ? Map.of() : reservoirParams(reservoir);
    boolean evicted = fetcher.evict(params);
    return Map.of("key", fetcher.keyFor(params), "evicted", evicted);
  }

  private CacheAsideFetcher<Map<String, String>, ?> fetcherFor(String operation) {
    if (operation == null) {
      throw invalidParameter("operation", "operation must be provided", 1003);
    }
    return switch (operation) {
      case FORECAST -> prediction;
      case HISTORIC -> historic;
      case PRECIP -> precip;
      case LEVELS -> catalog;
      default -> throw invalidParameter("operation",
          "Unknown operation. Supported values: forecast,historic,precip,levels.", 1003);
    };
  }

  // an empty series usually means an unknown name; caching it would hide data loaded later
  private static boolean hasEntries(Timeseries<?> series) {
    return !series.timeseries().isEmpty();
  }

  private static Map<String, String> reservoirParams(String reservoir) {
    if (!StringUtils.hasText(reservoir)) {
      throw invalidParameter(RESERVOIR_PARAM, "reservoir must be provided", 1001);
    }
    if (reservoir.length() > MAX_RESERVOIR_LENGTH) {
      throw invalidParameter(RESERVOIR_PARAM,
          "reservoir must be at most " + MAX_RESERVOIR_LENGTH + " characters", 1002);
    }
    return Map.of(RESERVOIR_PARAM, reservoir);
  }

  private static <V> V run(String operation, Supplier<V> call) {
    try {
      return call.get();
    } catch (QueryException ex) {
      throw ex.withOperation(operation);
    } catch (AssemblyException ex) {
      throw ex.withOperation(operation);
    }
  }

  private static InvalidParameterException invalidParameter(String parameter, String message,
      int errorCode) {
    return new InvalidParameterException(parameter, message, errorCode,
        ERROR_DOCS_BASE + errorCode);
  }
}
