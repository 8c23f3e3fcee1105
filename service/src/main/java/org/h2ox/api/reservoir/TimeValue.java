package org.h2ox.api.reservoir;

import java.time.LocalDate;

/**
 * A single dated observation of a time series. Entries of a {@link Timeseries} implement this.
 */
public interface TimeValue {

  LocalDate date();

  double value();
}
