package org.h2ox.api.warehouse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class WarehouseQueryTest {

  @ParameterizedTest
  @EnumSource(WarehouseQuery.class)
  void everyDeclaredParameterIsBoundByName(WarehouseQuery query) {
    for (String parameter : query.parameters()) {
      assertThat(query.sql()).contains(":" + parameter);
    }
    assertThat(query.sql()).doesNotContain("'");
  }

  @Test
  void rowsWithoutMeasurementAreSkipped() {
    assertThat(WarehouseQuery.RESERVOIR_CATALOG.sql()).contains("l.water_volume_bcm IS NOT NULL");
    assertThat(WarehouseQuery.HISTORIC_LEVELS.sql()).containsSubsequence(
        "water_volume_bcm IS NOT NULL", "MAX(obs_date)", "water_volume_bcm IS NOT NULL");
    assertThat(WarehouseQuery.PRECIP.sql()).contains("precip_mm IS NOT NULL");
  }

  @Test
  void rejectsUndeclaredParameters() {
    assertThatThrownBy(() -> WarehouseQuery.PRECIP.checkParameters(Set.of("reservoir", "days")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("precip-for-reservoir");
  }

  @Test
  void querySingleFailsOnEmptyResult() {
    WarehouseClient empty = new FakeWarehouseClient();

    assertThatThrownBy(() -> empty.querySingle(WarehouseQuery.LATEST_FORECAST,
        java.util.Map.of("reservoir", "KRS")))
        .isInstanceOfSatisfying(QueryException.class,
            ex -> assertThat(ex.queryName()).isEqualTo("latest-forecast-for-reservoir"));
  }
}
