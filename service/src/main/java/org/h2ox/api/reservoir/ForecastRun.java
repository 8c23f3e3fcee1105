package org.h2ox.api.reservoir;

import java.time.LocalDate;
import java.util.List;

// values.get(i) is the forecast for issueDate + i days, in billion cubic meters
public record ForecastRun(LocalDate issueDate, List<Double> values) {}
