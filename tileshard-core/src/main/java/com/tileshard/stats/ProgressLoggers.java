package com.tileshard.stats;

import static com.tileshard.util.Exceptions.throwFatalException;
import static com.tileshard.util.Format.padLeft;

import com.tileshard.util.Format;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.LongSupplier;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a one-line progress report like {@code tiles: [ 12 25% 3/s ] rows: [ 1.2M 250k/s ]} and logs it
 * periodically while a task runs.
 */
public class ProgressLoggers {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProgressLoggers.class);
  private final Format format = Format.defaultInstance();
  private final List<Supplier<String>> segments = new ArrayList<>();

  private ProgressLoggers() {}

  public static ProgressLoggers create() {
    return new ProgressLoggers();
  }

  /** Adds {@code name: [ count rate/s ]}. */
  public ProgressLoggers addRateCounter(String name, LongSupplier value) {
    return addRatePercentCounter(name, 0, value);
  }

  /** Adds {@code name: [ count percent rate/s ]}, leaving out the percent when {@code total} is 0. */
  public ProgressLoggers addRatePercentCounter(String name, long total, LongSupplier value) {
    Rate rate = new Rate(value.getAsLong());
    return add(name, () -> {
      long current = value.getAsLong();
      StringBuilder text = new StringBuilder("[ ").append(padLeft(format.numeric(current), 4));
      if (total > 0) {
        text.append(' ').append(padLeft(format.percent((double) current / total), 4));
      }
      return text.append(' ').append(padLeft(format.numeric(rate.perSecond(current)), 4)).append("/s ]").toString();
    });
  }

  /** Adds a value computed again every time the report is built. */
  public ProgressLoggers add(String name, Supplier<String> value) {
    segments.add(() -> " " + name + ": " + value.get());
    return this;
  }

  public String getLog() {
    return segments.stream().map(Supplier::get).collect(Collectors.joining());
  }

  public void log() {
    LOGGER.info("{}", getLog());
  }

  /**
   * Logs the report every {@code interval} until {@code future} completes, then once more.
   *
   * @throws RuntimeException if interrupted or if {@code future} fails
   */
  public void awaitAndLog(Future<?> future, Duration interval) {
    boolean finished = false;
    while (!finished) {
      try {
        future.get(interval.toNanos(), TimeUnit.NANOSECONDS);
        finished = true;
      } catch (TimeoutException e) {
        log();
      } catch (ExecutionException e) {
        throwFatalException(e.getCause());
      } catch (InterruptedException e) {
        throwFatalException(e);
      }
    }
    log();
  }

  /** Tracks the change in a count per second since the previous report. */
  private static final class Rate {

    private long lastValue;
    private long lastNanos = System.nanoTime();

    private Rate(long initialValue) {
      this.lastValue = initialValue;
    }

    synchronized double perSecond(long value) {
      long now = System.nanoTime();
      double seconds = (now - lastNanos) / 1e9;
      long change = value < lastValue ? value : value - lastValue;
      lastValue = value;
      lastNanos = now;
      return seconds > 0 ? change / seconds : 0;
    }
  }
}
