package org.h2ox.api.reservoir;

import java.util.List;

public record ReservoirList(List<Reservoir> reservoirs) {

  public ReservoirList {
    reservoirs = List.copyOf(reservoirs);
  }
}
