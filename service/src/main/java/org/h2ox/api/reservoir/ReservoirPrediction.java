package org.h2ox.api.reservoir;

public record ReservoirPrediction(String reservoir, Timeseries<Level> prediction) {}
