package org.h2ox.api.reservoir;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDate;
import java.util.List;

/**
 * Chronologically ascending series for one reservoir. {@code refDate} is the issuance date for
 * forecasts and the most recent observation date for historic and precipitation series; it is
 * {@code null} only when the series is empty.
 */
public record Timeseries<T extends TimeValue>(
    String reservoir,
    @JsonProperty("ref_date") LocalDate refDate,
    List<T> timeseries
) {

  public Timeseries {
    timeseries = List.copyOf(timeseries);
  }
}
