package org.h2ox.api.warehouse;

import java.util.List;
import java.util.Map;

/**
 * Executes the logical {@link WarehouseQuery queries} with bound parameters. Implementations
 * are safe for concurrent use and perform no retries.
 */
public interface WarehouseClient {

  /**
   * @throws QueryException when the warehouse cannot be reached or rejects the query
   */
  List<WarehouseRow> query(WarehouseQuery query, Map<String, ?> parameters);

  /**
   * Runs a query whose result must contain at least one row and returns the first.
   *
   * @throws QueryException when the result set is empty
   */
  default WarehouseRow querySingle(WarehouseQuery query, Map<String, ?> parameters) {
    List<WarehouseRow> rows = query(query, parameters);
    if (rows.isEmpty()) {
      throw new QueryException(query.queryName(), "Expected a row but the result was empty", null);
    }
    return rows.get(0);
  }
}
