package org.h2ox.api.reservoir;

import java.time.LocalDate;

/**
 * Water volume in million cubic meters, with the day-of-year climatological average for the
 * same date. Forecast levels carry a zero baseline.
 */
public record Level(LocalDate date, double value, double baseline) implements TimeValue {}
