package org.hybridcloud.dtss.exceptions;

/**
 * Thrown when a component or job process is asked to move to an invalid state.
 */
public final class StateException extends RuntimeException {
  public StateException(final String message) {
    super(message);
  }

  public StateException(
      final String message, final Throwable throwable) {
    super(message, throwable);
  }
}
