package org.h2ox.api.reservoir;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@Tag(name = "Reservoirs")
public class ReservoirController {

  private final ReservoirService svc;

  public ReservoirController(ReservoirService svc) {
    this.svc = svc;
  }

  @GetMapping({"/reservoirs", "/levels"})
  @Operation(summary = "List reservoirs", description = "Latest level, capacity and outline of every reservoir.")
  public ReservoirList reservoirs() {
    return svc.fetchReservoirCatalog();
  }

  @GetMapping("/prediction")
  @Operation(summary = "Latest forecast", description = "Most recently issued daily level forecast for one reservoir.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Forecast series"),
      @ApiResponse(responseCode = "400", description = "Missing or invalid reservoir"),
      @ApiResponse(responseCode = "502", description = "Warehouse unavailable",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = org.springframework.http.ProblemDetail.class)))
  })
  public Timeseries<Level> prediction(@RequestParam(required = false)
      @Parameter(description = "Reservoir identifier", example = "Kabini") String reservoir) {
    return svc.fetchPrediction(reservoir);
  }

  @GetMapping("/predictions")
  @Operation(summary = "Latest forecasts", description = "Latest forecast of every reservoir in the catalog.")
  public List<ReservoirPrediction> predictions() {
    return svc.fetchAllPredictions();
  }

  @GetMapping("/historic")
  @Operation(summary = "Historic levels", description = "Daily levels with day-of-year baseline, ending at the latest observation.")
  public Timeseries<Level> historic(@RequestParam(required = false)
      @Parameter(description = "Reservoir identifier", example = "Kabini") String reservoir) {
    return svc.fetchHistoric(reservoir);
  }

  @GetMapping("/precip")
  @Operation(summary = "Precipitation", description = "Daily precipitation with year-to-date cumulative and its baseline.")
  public Timeseries<Precip> precip(@RequestParam(required = false)
      @Parameter(description = "Reservoir identifier", example = "Kabini") String reservoir) {
    return svc.fetchPrecip(reservoir);
  }
}
