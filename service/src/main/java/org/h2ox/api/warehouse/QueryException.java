package org.h2ox.api.warehouse;

/**
 * A warehouse query failed: connectivity, a malformed response, or no row where one was
 * required. Never retried by the client.
 */
public class QueryException extends RuntimeException {
  private final String queryName;
  private final String operation;

  public QueryException(String queryName, String message, Throwable cause) {
    this(queryName, null, message, cause);
  }

  private QueryException(String queryName, String operation, String message, Throwable cause) {
    super(message, cause);
    this.queryName = queryName;
    this.operation = operation;
  }

  /** Logical query name, e.g. {@code latest-forecast-for-reservoir}. */
  public String queryName() {
    return queryName;
  }

  /** Name of the service operation that failed, or {@code null} below the service layer. */
  public String operation() {
    return operation;
  }

  public QueryException withOperation(String operation) {
    QueryException copy = new QueryException(queryName, operation, getMessage(), getCause());
    copy.setStackTrace(getStackTrace());
    return copy;
  }

  @Override
  public String toString() {
    return getClass().getName() + ": " + getMessage() + " [query=" + queryName
        + (operation != null ? ", operation=" + operation : "") + "]";
  }
}
