package com.tileshard.stats;

import com.tileshard.util.Format;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import javax.annotation.concurrent.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A registry of stages that are being timed, along with the workers that ran in each one.
 */
@ThreadSafe
public class Timers {

  private static final Logger LOGGER = LoggerFactory.getLogger(Timers.class);
  private static final Format FORMAT = Format.defaultInstance();
  private final Map<String, Stage> stages = Collections.synchronizedMap(new LinkedHashMap<>());

  /** Logs the elapsed time of every stage started so far. */
  public void printSummary() {
    Map<String, Stage> all = all();
    int maxLength = all.keySet().stream().mapToInt(String::length).max().orElse(0);
    for (var entry : all.entrySet()) {
      LOGGER.info("\t{} {}", Format.padRight(entry.getKey(), maxLength), entry.getValue());
    }
  }

  /** Starts timing {@code name} and returns a handle to call when it finishes. */
  public Finishable startTimer(String name, boolean log) {
    Stage stage = new Stage(System.nanoTime());
    stages.put(name, stage);
    if (log) {
      LOGGER.info("Starting...");
    }
    return () -> {
      stage.stop();
      if (log) {
        LOGGER.info("Finished in {}", stage);
      }
    };
  }

  /** Records that one worker thread in the most recently started stage finished after {@code elapsed}. */
  public void finishedWorker(String prefix, Duration elapsed) {
    Stage stage = null;
    synchronized (stages) {
      for (Stage s : stages.values()) {
        stage = s;
      }
    }
    if (stage != null) {
      stage.workers.incrementAndGet();
      stage.workerNanos.addAndGet(elapsed.toNanos());
    }
  }

  /** Returns a snapshot of all stages started so far. */
  public Map<String, Stage> all() {
    synchronized (stages) {
      return new LinkedHashMap<>(stages);
    }
  }

  /** A handle that callers can use to indicate a stage has finished. */
  @FunctionalInterface
  public interface Finishable {

    void stop();
  }

  /** Wall time of one stage, and the number and total busy time of workers that ran inside it. */
  public static final class Stage {

    private final long start;
    private volatile long end = -1;
    private final AtomicInteger workers = new AtomicInteger();
    private final AtomicLong workerNanos = new AtomicLong();

    private Stage(long start) {
      this.start = start;
    }

    private void stop() {
      end = System.nanoTime();
    }

    public Duration elapsed() {
      return Duration.ofNanos((end < 0 ? System.nanoTime() : end) - start);
    }

    public int workers() {
      return workers.get();
    }

    @Override
    public String toString() {
      String result = FORMAT.duration(elapsed());
      int num = workers();
      if (num > 0) {
        result += " (" + num + " workers, avg " + FORMAT.duration(Duration.ofNanos(workerNanos.get() / num)) + ")";
      }
      return result;
    }
  }
}
