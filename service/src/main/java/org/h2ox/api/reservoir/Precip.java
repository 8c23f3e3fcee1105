package org.h2ox.api.reservoir;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDate;

// cumulative resets on January 1st
public record Precip(
    LocalDate date,
    double value,
    double cumulative,
    @JsonProperty("cumulative_baseline") double cumulativeBaseline
) implements TimeValue {}
