package org.hybridcloud.dtss.exceptions;

/**
 * Thrown when a resource primitive is used in a structurally invalid way,
 * e.g. acquiring more than its capacity or releasing above capacity.
 */
public final class ResourceException extends RuntimeException {
  public ResourceException(final String message) {
    super(message);
  }

  public ResourceException(
      final String message, final Throwable throwable) {
    super(message, throwable);
  }
}
