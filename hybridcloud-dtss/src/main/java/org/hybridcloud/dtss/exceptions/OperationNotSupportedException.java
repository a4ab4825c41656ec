package org.hybridcloud.dtss.exceptions;

/**
 * Thrown when an operation is not supported by a device or broker.
 */
public final class OperationNotSupportedException extends RuntimeException {
  public OperationNotSupportedException(final String message) {
    super(message);
  }

  public OperationNotSupportedException(
      final String message, final Throwable throwable) {
    super(message, throwable);
  }
}
