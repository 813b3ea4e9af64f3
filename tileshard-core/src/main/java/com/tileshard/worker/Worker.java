package com.tileshard.worker;

import static com.tileshard.util.Exceptions.throwFatalException;

import com.tileshard.stats.ProgressLoggers;
import com.tileshard.stats.Stats;
import com.tileshard.util.LogUtil;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the same task on a fixed number of daemon threads.
 * <p>
 * The task is expected to drain a queue shared by all threads. The first thread to fail fails the whole worker and
 * interrupts the others.
 */
public class Worker {

  private static final Logger LOGGER = LoggerFactory.getLogger(Worker.class);
  private final CompletableFuture<Void> done = new CompletableFuture<>();

  /**
   * Starts {@code threads} threads named {@code name-1}, {@code name-2}, ... all running {@code task}.
   * <p>
   * Each thread logs under the caller's stage, with {@code name} appended, and records its run time with
   * {@code stats}.
   */
  public Worker(String name, Stats stats, int threads, RunnableThatThrows task) {
    AtomicInteger running = new AtomicInteger(threads);
    AtomicInteger threadIds = new AtomicInteger();
    ExecutorService executor = Executors.newFixedThreadPool(threads, runnable -> {
      Thread thread = new Thread(runnable, name + "-" + threadIds.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    });
    String parentStage = LogUtil.getStage();
    for (int i = 0; i < threads; i++) {
      executor.execute(() -> {
        LogUtil.setStage(parentStage, name);
        long start = System.nanoTime();
        try {
          task.run();
          stats.timers().finishedWorker(name, Duration.ofNanos(System.nanoTime() - start));
          if (running.decrementAndGet() == 0) {
            done.complete(null);
          }
        } catch (Throwable e) {
          if (done.completeExceptionally(e)) {
            LOGGER.error("{} failed, stopping the other threads", Thread.currentThread().getName(), e);
            executor.shutdownNow();
          } else {
            LOGGER.debug("{} stopped after another thread failed", Thread.currentThread().getName(), e);
          }
        } finally {
          LogUtil.clearStage();
        }
      });
    }
    executor.shutdown();
  }

  /**
   * Blocks until every thread finishes, logging {@code loggers} every {@code logInterval}.
   *
   * @throws RuntimeException if interrupted or if one of the threads throws
   */
  public void awaitAndLog(ProgressLoggers loggers, Duration logInterval) {
    loggers.awaitAndLog(done, logInterval);
  }

  /**
   * Blocks until every thread finishes.
   *
   * @throws RuntimeException if interrupted or if one of the threads throws
   */
  public void await() {
    try {
      done.get();
    } catch (ExecutionException e) {
      throwFatalException(e.getCause());
    } catch (InterruptedException e) {
      throwFatalException(e);
    }
  }
}
