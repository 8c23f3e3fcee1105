package org.h2ox.api.reservoir;

import java.time.LocalDate;

/**
 * One raw catalog row as read from the warehouse. Volumes are in billion cubic meters;
 * {@code geomJson} is GeoJSON text or {@code null}.
 */
public record CatalogEntry(
    String name,
    LocalDate latestDate,
    Double latestVolume,
    Double latestBaseline,
    Double fullVolume,
    String geomJson
) {}
