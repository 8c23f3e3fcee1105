package org.h2ox.api.reservoir;

import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.httpBasic;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.LocalDate;
import java.util.List;
import org.h2ox.api.config.SecurityConfig;
import org.h2ox.api.config.WebConfig;
import org.h2ox.api.warehouse.QueryException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = ReservoirController.class, properties = {
    "security.basic.username=h2ox",
    "security.basic.password=s3cret"
})
@Import({SecurityConfig.class, WebConfig.class})
class ReservoirControllerWebTest {

  private static final LocalDate ISSUED = LocalDate.of(2022, 1, 10);

  @Autowired
  private MockMvc mvc;

  @MockBean
  private ReservoirService svc;

  @Test
  void predictionSerializesSnakeCaseRefDate() throws Exception {
    when(svc.fetchPrediction("Kabini")).thenReturn(new Timeseries<>("Kabini", ISSUED, List.of(
        new Level(ISSUED, 1000d, 0d),
        new Level(ISSUED.plusDays(1), 2000d, 0d))));

    mvc.perform(get("/api/prediction").param("reservoir", "Kabini").with(httpBasic("h2ox", "s3cret")))
        .andExpect(status().isOk())
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
        .andExpect(header().exists("X-Request-Id"))
        .andExpect(jsonPath("$.reservoir").value("Kabini"))
        .andExpect(jsonPath("$.ref_date").value("2022-01-10"))
        .andExpect(jsonPath("$.timeseries[1].date").value("2022-01-11"))
        .andExpect(jsonPath("$.timeseries[1].value").value(2000.0))
        .andExpect(jsonPath("$.timeseries[1].baseline").value(0.0));
  }

  @Test
  void precipUsesCumulativeBaselineField() throws Exception {
    when(svc.fetchPrecip("KRS")).thenReturn(new Timeseries<>("KRS", ISSUED, List.of(
        new Precip(ISSUED, 1.5, 12.25, 10.5))));

    mvc.perform(get("/api/precip").param("reservoir", "KRS").with(httpBasic("h2ox", "s3cret")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.timeseries[0].cumulative").value(12.25))
        .andExpect(jsonPath("$.timeseries[0].cumulative_baseline").value(10.5));
  }

  @Test
  void levelsAliasServesCatalog() throws Exception {
    when(svc.fetchReservoirCatalog()).thenReturn(new ReservoirList(List.of(
        new Reservoir("Harangi", new Level(ISSUED, 100d, 120d), 230d, null))));

    mvc.perform(get("/api/levels").with(httpBasic("h2ox", "s3cret")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.reservoirs[0].name").value("Harangi"))
        .andExpect(jsonPath("$.reservoirs[0].full_level").value(230.0))
        .andExpect(jsonPath("$.reservoirs[0].geom").isEmpty());
  }

  @Test
  void invalidReservoirReturnsErrorCode() throws Exception {
    when(svc.fetchHistoric("")).thenThrow(new InvalidParameterException("reservoir",
        "reservoir must be provided", 1001, "https://h2ox.org/docs/api/errors/1001"));

    mvc.perform(get("/api/historic").param("reservoir", "").with(httpBasic("h2ox", "s3cret")))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorCode").value(1001))
        .andExpect(jsonPath("$.parameter").value("reservoir"))
        .andExpect(jsonPath("$.path").value("/api/historic"));
  }

  @Test
  void warehouseFailureIsBadGatewayWithoutInternals() throws Exception {
    when(svc.fetchPrediction("Kabini")).thenThrow(
        new QueryException("latest-forecast-for-reservoir", "connection refused to 10.0.0.5", null)
            .withOperation(ReservoirService.FORECAST));

    mvc.perform(get("/api/prediction").param("reservoir", "Kabini").with(httpBasic("h2ox", "s3cret")))
        .andExpect(status().isBadGateway())
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_PROBLEM_JSON))
        .andExpect(jsonPath("$.status").value(502))
        .andExpect(jsonPath("$.detail").value("The data warehouse could not answer operation 'forecast'"));
  }

  @Test
  void assemblyFailureIsServerError() throws Exception {
    when(svc.fetchHistoric("KRS")).thenThrow(
        new AssemblyException("No baseline for KRS on day 60").withOperation(ReservoirService.HISTORIC));

    mvc.perform(get("/api/historic").param("reservoir", "KRS").with(httpBasic("h2ox", "s3cret")))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.detail").value("Warehouse data could not be assembled for operation 'historic'"));
  }

  @Test
  void requiresCredentials() throws Exception {
    mvc.perform(get("/api/reservoirs"))
        .andExpect(status().isUnauthorized());
    mvc.perform(get("/api/reservoirs").with(httpBasic("h2ox", "wrong")))
        .andExpect(status().isUnauthorized());
  }
}
