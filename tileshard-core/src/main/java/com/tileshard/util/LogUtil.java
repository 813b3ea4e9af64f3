package com.tileshard.util;

import java.util.function.Supplier;
import org.slf4j.MDC;

/**
 * Prepends {@code [stage]} or {@code [stage:detail]} to log output through the SLF4J {@link MDC}.
 * <p>
 * The log4j2 pattern reads the value back with {@code %X{stage}}.
 */
public class LogUtil {

  private static final String STAGE_KEY = "stage";

  private LogUtil() {}

  /** Prepends {@code [stage]} to all subsequent logs from this thread. */
  public static void setStage(String stage) {
    MDC.put(STAGE_KEY, "[%s] ".formatted(stage));
  }

  /** Prepends {@code [parent:child]} to all subsequent logs from this thread, or {@code [child]} without a parent. */
  public static void setStage(String parent, String child) {
    setStage(parent == null ? child : parent + ":" + child);
  }

  /** Removes the stage prefix from subsequent logs from this thread. */
  public static void clearStage() {
    MDC.remove(STAGE_KEY);
  }

  /** Returns the stage currently prepended to logs from this thread, without brackets. */
  public static String getStage() {
    String stage = MDC.get(STAGE_KEY);
    return stage == null ? null : stage.substring(1, stage.length() - 2);
  }

  /**
   * Runs {@code task} with {@code [current:detail]} prepended to its logs then restores the previous stage.
   */
  public static <T> T withStageDetail(String detail, Supplier<T> task) {
    String previous = getStage();
    setStage(previous, detail);
    try {
      return task.get();
    } finally {
      if (previous == null) {
        clearStage();
      } else {
        setStage(previous);
      }
    }
  }
}
