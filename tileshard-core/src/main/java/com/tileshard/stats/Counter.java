package com.tileshard.stats;

import java.util.concurrent.atomic.LongAdder;
import java.util.function.LongSupplier;

/**
 * A count that only goes up, incremented by many shard threads and read by progress logs.
 */
public final class Counter implements LongSupplier {

  private final LongAdder sum = new LongAdder();

  public static Counter create() {
    return new Counter();
  }

  private Counter() {}

  public void inc() {
    sum.increment();
  }

  public void incBy(long value) {
    sum.add(value);
  }

  public long get() {
    return sum.sum();
  }

  @Override
  public long getAsLong() {
    return get();
  }

  @Override
  public String toString() {
    return Long.toString(get());
  }
}
