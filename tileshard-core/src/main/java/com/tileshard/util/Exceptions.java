package com.tileshard.util;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletionException;

/**
 * Exception-handling utilities.
 */
public class Exceptions {
  private Exceptions() {}

  /**
   * Re-throw a caught exception, unwrapping {@link CompletionException}, handling interrupts and wrapping in a
   * {@link FatalTileShardException} if checked.
   *
   * @param exception The original exception
   * @param <T>       Return type if caller requires it
   */
  public static <T> T throwFatalException(Throwable exception) {
    if (exception instanceof CompletionException completion && completion.getCause() != null) {
      return throwFatalException(completion.getCause());
    }
    if (exception instanceof InterruptedException) {
      Thread.currentThread().interrupt();
    }
    if (exception instanceof RuntimeException runtimeException) {
      throw runtimeException;
    } else if (exception instanceof IOException ioe) {
      throw new UncheckedIOException(ioe);
    } else if (exception instanceof Error error) {
      throw error;
    }
    throw new FatalTileShardException(exception);
  }

  /**
   * Throws an {@link InvariantViolation} with {@code message} if {@code condition} is false.
   * <p>
   * Unlike a java {@code assert} statement this check always runs.
   */
  public static void checkInvariant(boolean condition, String message, Object... args) {
    if (!condition) {
      throw new InvariantViolation(message.formatted(args));
    }
  }

  /**
   * Fatal exception that will result in the current job exiting early and shutting down.
   */
  public static class FatalTileShardException extends RuntimeException {
    public FatalTileShardException(Throwable exception) {
      super(exception);
    }
  }

  /**
   * An internal consistency check failed, which indicates a bug rather than bad input. Never caught and retried.
   */
  public static class InvariantViolation extends AssertionError {
    public InvariantViolation(String message) {
      super(message);
    }
  }
}
