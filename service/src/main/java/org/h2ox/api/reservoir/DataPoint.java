package org.h2ox.api.reservoir;

import java.time.LocalDate;

// Raw warehouse observation before normalization; value may be missing
public record DataPoint(LocalDate date, Double value) {}
