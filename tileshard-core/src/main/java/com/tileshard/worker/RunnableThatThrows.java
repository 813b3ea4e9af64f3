package com.tileshard.worker;

/**
 * The body of one worker thread, which may throw checked exceptions.
 */
@FunctionalInterface
public interface RunnableThatThrows {

  @SuppressWarnings("java:S112")
  void run() throws Exception;
}
