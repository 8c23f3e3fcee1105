package org.h2ox.api.reservoir;

/**
 * Raw warehouse rows could not be normalized into the reservoir domain model.
 */
public class AssemblyException extends RuntimeException {
  private final String operation;

  public AssemblyException(String message) {
    this(null, message, null);
  }

  public AssemblyException(String message, Throwable cause) {
    this(null, message, cause);
  }

  private AssemblyException(String operation, String message, Throwable cause) {
    super(message, cause);
    this.operation = operation;
  }

  /** Name of the service operation that failed, or {@code null} below the service layer. */
  public String operation() {
    return operation;
  }

  public AssemblyException withOperation(String operation) {
    AssemblyException copy = new AssemblyException(operation, getMessage(), getCause());
    copy.setStackTrace(getStackTrace());
    return copy;
  }
}
