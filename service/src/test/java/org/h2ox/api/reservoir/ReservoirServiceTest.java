package org.h2ox.api.reservoir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.h2ox.api.TestMappers;
import org.h2ox.api.cache.CacheAside;
import org.h2ox.api.cache.CachePolicy;
import org.h2ox.api.cache.InMemoryCacheStore;
import org.h2ox.api.warehouse.FakeWarehouseClient;
import org.h2ox.api.warehouse.QueryException;
import org.h2ox.api.warehouse.WarehouseQuery;
import org.h2ox.api.warehouse.WarehouseRow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

class ReservoirServiceTest {

  private static final LocalDate ISSUED = LocalDate.of(2022, 1, 10);

  private final ObjectMapper mapper = TestMappers.json();
  private FakeWarehouseClient warehouse;
  private InMemoryCacheStore store;
  private CachePolicy policy;
  private ReservoirService service;

  @BeforeEach
  void setUp() {
    warehouse = new FakeWarehouseClient()
        .returning(WarehouseQuery.LATEST_FORECAST,
            WarehouseRow.of(ISSUED, List.of(0.31, 0.32, 0.33)))
        .returning(WarehouseQuery.HISTORIC_LEVELS,
            WarehouseRow.of(LocalDate.of(2022, 1, 8), 0.30),
            WarehouseRow.of(LocalDate.of(2022, 1, 9), 0.305),
            WarehouseRow.of(LocalDate.of(2022, 1, 10), 0.31))
        .returning(WarehouseQuery.HISTORIC_BASELINE,
            WarehouseRow.of(8, 0.28), WarehouseRow.of(9, 0.29), WarehouseRow.of(10, 0.29))
        .returning(WarehouseQuery.PRECIP,
            WarehouseRow.of(LocalDate.of(2021, 12, 31), 4.0),
            WarehouseRow.of(LocalDate.of(2022, 1, 1), 2.5))
        .returning(WarehouseQuery.RESERVOIR_CATALOG,
            WarehouseRow.of("Harangi", ISSUED, 0.1, 0.12, 0.23, null),
            WarehouseRow.of("Kabini", ISSUED, 0.31, 0.29, 0.55,
                "{\"type\":\"Point\",\"coordinates\":[76.35,11.95]}"));
    store = new InMemoryCacheStore();
    policy = new CachePolicy(false, Duration.ofHours(48));
    service = newService(365);
  }

  private ReservoirService newService(int historyDays) {
    return new ReservoirService(new ReservoirDao(warehouse), new TimeseriesAssembler(mapper),
        new CacheAside(store, mapper, policy), historyDays);
  }

  @Test
  void predictionIsServedFromCacheOnSecondCall() throws Exception {
    Timeseries<Level> first = service.fetchPrediction("Kabini");
    Timeseries<Level> second = service.fetchPrediction("Kabini");

    assertThat(warehouse.calls(WarehouseQuery.LATEST_FORECAST)).isEqualTo(1);
    assertThat(mapper.writeValueAsString(second)).isEqualTo(mapper.writeValueAsString(first));
    assertThat(second.refDate()).isEqualTo(ISSUED);
    assertThat(second.timeseries()).hasSize(3);
    assertThat(store.entries).containsKey("forecast.Kabini");
  }

  @Test
  void bypassQueriesWarehouseEveryTime() {
    policy.setBypass(true);

    service.fetchPrediction("Kabini");
    service.fetchPrediction("Kabini");

    assertThat(warehouse.calls(WarehouseQuery.LATEST_FORECAST)).isEqualTo(2);
    assertThat(store.calls()).isZero();
  }

  @Test
  void blankReservoirIsRejectedBeforeAnyIo() {
    assertThatThrownBy(() -> service.fetchHistoric(""))
        .isInstanceOfSatisfying(InvalidParameterException.class, ex -> {
          assertThat(ex.parameter()).isEqualTo("reservoir");
          assertThat(ex.errorCode()).isEqualTo(1001);
        });
    assertThatThrownBy(() -> service.fetchPrediction(null))
        .isInstanceOf(InvalidParameterException.class);

    assertThat(warehouse.totalCalls()).isZero();
    assertThat(store.calls()).isZero();
  }

  @Test
  void overlongReservoirIsRejected() {
    assertThatThrownBy(() -> service.fetchPrecip("K".repeat(129)))
        .isInstanceOfSatisfying(InvalidParameterException.class,
            ex -> assertThat(ex.errorCode()).isEqualTo(1002));
    assertThat(warehouse.totalCalls()).isZero();
  }

  @Test
  void punctuatedReservoirIsQueriedVerbatim() {
    service.fetchPrecip("KRS'; DROP TABLE reservoir;--");

    assertThat(warehouse.parameters).contains(Map.of("reservoir", "KRS'; DROP TABLE reservoir;--"));
  }

  @Test
  void allPredictionsAcceptCatalogNamesWithPunctuation() {
    warehouse.returning(WarehouseQuery.RESERVOIR_CATALOG,
        WarehouseRow.of("Kabini", ISSUED, 0.31, 0.29, 0.55, null),
        WarehouseRow.of("Tungabhadra (TB)", ISSUED, 2.1, 1.9, 3.3, null));

    List<ReservoirPrediction> predictions = service.fetchAllPredictions();

    assertThat(predictions).extracting(ReservoirPrediction::reservoir)
        .containsExactly("Kabini", "Tungabhadra (TB)");
    assertThat(predictions.get(1).prediction().reservoir()).isEqualTo("Tungabhadra (TB)");
    assertThat(store.entries).containsKey("forecast.Tungabhadra (TB)");
  }

  @Test
  void emptySeriesIsNotCached() {
    warehouse.returning(WarehouseQuery.HISTORIC_LEVELS)
        .returning(WarehouseQuery.PRECIP);

    Timeseries<Level> historic = service.fetchHistoric("kabini");
    service.fetchHistoric("kabini");
    Timeseries<Precip> precip = service.fetchPrecip("kabini");

    assertThat(historic.timeseries()).isEmpty();
    assertThat(historic.refDate()).isNull();
    assertThat(precip.timeseries()).isEmpty();
    assertThat(warehouse.calls(WarehouseQuery.HISTORIC_LEVELS)).isEqualTo(2);
    assertThat(store.entries).doesNotContainKeys("historic.kabini", "precip.kabini");
  }

  @Test
  void reservoirIsPassedAsBindParameter() {
    service.fetchHistoric("Kabini");

    assertThat(warehouse.parameters).contains(
        Map.of("reservoir", "Kabini", "historyDays", 365),
        Map.of("reservoir", "Kabini"));
  }

  @Test
  void historicIsAscendingWithRefDateOfLastObservation() {
    Timeseries<Level> series = service.fetchHistoric("Kabini");

    assertThat(series.timeseries()).extracting(Level::date).isSorted();
    assertThat(series.refDate()).isEqualTo(LocalDate.of(2022, 1, 10));
    assertThat(series.timeseries().get(0).baseline()).isEqualTo(280d,
        org.assertj.core.data.Offset.offset(1e-9));
  }

  @Test
  void precipCumulativeRestartsInJanuary() {
    Timeseries<Precip> series = service.fetchPrecip("Harangi");

    assertThat(series.timeseries()).extracting(Precip::cumulative).containsExactly(4.0, 2.5);
  }

  @Test
  void storeOutageDoesNotFailTheRequest() {
    store.failReads = true;
    store.failWrites = true;

    ReservoirList catalog = service.fetchReservoirCatalog();

    assertThat(catalog.reservoirs()).extracting(Reservoir::name)
        .containsExactly("Harangi", "Kabini");
    assertThat(warehouse.calls(WarehouseQuery.RESERVOIR_CATALOG)).isEqualTo(1);
  }

  @Test
  void cachedCatalogKeepsMissingGeometryAsNull() {
    ReservoirList fresh = service.fetchReservoirCatalog();
    ReservoirList cached = service.fetchReservoirCatalog();

    assertThat(cached).isEqualTo(fresh);
    assertThat(cached.reservoirs().get(0).geom()).isNull();
    assertThat(store.entries).containsKey("levels.");
  }

  @Test
  void warehouseFailureCarriesOperationName() {
    warehouse.failing(WarehouseQuery.LATEST_FORECAST,
        new QueryException("latest-forecast-for-reservoir", "Warehouse query failed",
            new DataAccessResourceFailureException("connection refused")));

    assertThatThrownBy(() -> service.fetchPrediction("Kabini"))
        .isInstanceOfSatisfying(QueryException.class, ex -> {
          assertThat(ex.operation()).isEqualTo(ReservoirService.FORECAST);
          assertThat(ex.queryName()).isEqualTo("latest-forecast-for-reservoir");
        });
    assertThat(store.entries).isEmpty();
  }

  @Test
  void missingForecastIsQueryFailure() {
    warehouse.returning(WarehouseQuery.LATEST_FORECAST);

    assertThatThrownBy(() -> service.fetchPrediction("Nowhere"))
        .isInstanceOf(QueryException.class);
  }

  @Test
  void assemblyFailureCarriesOperationName() {
    warehouse.returning(WarehouseQuery.HISTORIC_BASELINE, WarehouseRow.of(8, 0.28));

    assertThatThrownBy(() -> service.fetchHistoric("Kabini"))
        .isInstanceOfSatisfying(AssemblyException.class,
            ex -> assertThat(ex.operation()).isEqualTo(ReservoirService.HISTORIC));
  }

  @Test
  void allPredictionsFollowCatalogOrder() {
    List<ReservoirPrediction> predictions = service.fetchAllPredictions();

    assertThat(predictions).extracting(ReservoirPrediction::reservoir)
        .containsExactly("Harangi", "Kabini");
    assertThat(warehouse.calls(WarehouseQuery.LATEST_FORECAST)).isEqualTo(2);
  }

  @Test
  void evictDropsCachedEntry() {
    service.fetchPrediction("Kabini");

    Map<String, Object> result = service.evict("forecast", "Kabini");
    service.fetchPrediction("Kabini");

    assertThat(result).containsEntry("key", "forecast.Kabini").containsEntry("evicted", true);
    assertThat(warehouse.calls(WarehouseQuery.LATEST_FORECAST)).isEqualTo(2);
  }

  @Test
  void evictRejectsUnknownOperation() {
    assertThatThrownBy(() -> service.evict("everything", "Kabini"))
        .isInstanceOfSatisfying(InvalidParameterException.class,
            ex -> assertThat(ex.errorCode()).isEqualTo(1003));
  }

  @Test
  void historyDaysMustBePositive() {
    assertThatThrownBy(() -> newService(0)).isInstanceOf(IllegalArgumentException.class);
  }
}
