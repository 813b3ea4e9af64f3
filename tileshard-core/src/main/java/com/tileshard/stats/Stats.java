package com.tileshard.stats;

import com.tileshard.util.FileUtils;
import com.tileshard.util.LogUtil;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects timings and counts for a tiling or sharding job and reports them in the logs at the end.
 */
public interface Stats extends AutoCloseable {

  /** Returns a new stat collector that stores stats in-memory to report through {@link #printSummary()}. */
  static Stats inMemory() {
    return new InMemory();
  }

  /** Logs the elapsed time of each stage, every tracked counter and the size of each monitored file. */
  default void printSummary() {
    Logger logger = LoggerFactory.getLogger(getClass());
    logger.info("");
    logger.info("-".repeat(40));
    timers().printSummary();
    logger.info("-".repeat(40));
    for (var entry : counters().entrySet()) {
      logger.info("\t{}\t{}", entry.getKey(), entry.getValue().getAsLong());
    }
    for (var entry : monitoredFiles().entrySet()) {
      long size = FileUtils.size(entry.getValue());
      if (size > 0) {
        logger.info("\t{}\t{}B", entry.getKey(), size);
      }
    }
  }

  /**
   * Records that a long-running stage with {@code name} has started, sets the {@code [name]} log prefix and returns a
   * handle to call when finished.
   */
  default Timers.Finishable startStage(String name) {
    LogUtil.setStage(name);
    var timer = timers().startTimer(name, true);
    return () -> {
      timer.stop();
      LogUtil.clearStage();
    };
  }

  /** Returns the timers for all stages started with {@link #startStage(String)}. */
  Timers timers();

  /** Returns all counters registered through {@link #longCounter(String)}. */
  Map<String, LongSupplier> counters();

  /** Returns all the files being monitored. */
  Map<String, Path> monitoredFiles();

  /** Adds a stat that will track the size of a file or directory located at {@code path}. */
  default void monitorFile(String name, Path path) {
    monitoredFiles().put(name, path);
  }

  /** Returns and starts tracking a new counter with {@code name} that can be incremented from many threads. */
  default Counter longCounter(String name) {
    Counter counter = Counter.create();
    counters().put(name, counter);
    return counter;
  }

  @Override
  default void close() {}

  /**
   * A stat collector that stores metrics in-memory to report through {@link #printSummary()}.
   */
  class InMemory implements Stats {

    private final Timers timers = new Timers();
    private final Map<String, Path> monitoredFiles = new ConcurrentSkipListMap<>();
    private final Map<String, LongSupplier> counters = new ConcurrentSkipListMap<>();

    /** use {@link #inMemory()} */
    private InMemory() {}

    @Override
    public Timers timers() {
      return timers;
    }

    @Override
    public Map<String, LongSupplier> counters() {
      return counters;
    }

    @Override
    public Map<String, Path> monitoredFiles() {
      return monitoredFiles;
    }
  }
}
