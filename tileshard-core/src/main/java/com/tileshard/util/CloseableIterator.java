package com.tileshard.util;

import java.io.Closeable;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * An iterator over rows that may hold open files until {@link #close()} is called.
 * <p>
 * Views returned by {@link #map(Function)} and {@link #filter(Predicate)} close the iterator they wrap.
 */
public interface CloseableIterator<T> extends Closeable, Iterator<T> {

  /** Wraps an in-memory iterator that has nothing to release. */
  static <T> CloseableIterator<T> of(Iterator<T> iterator) {
    return new CloseableIterator<>() {
      @Override
      public boolean hasNext() {
        return iterator.hasNext();
      }

      @Override
      public T next() {
        return iterator.next();
      }

      @Override
      public void close() {}
    };
  }

  /**
   * Returns one iterator over every source in order, opening each one only after the previous one is drained and
   * closed.
   */
  static <S, T> CloseableIterator<T> concat(List<S> sources, Function<S, CloseableIterator<T>> open) {
    return new Chained<>(sources.iterator(), open);
  }

  @Override
  void close();

  default <O> CloseableIterator<O> map(Function<? super T, ? extends O> mapper) {
    CloseableIterator<T> source = this;
    return new CloseableIterator<>() {
      @Override
      public boolean hasNext() {
        return source.hasNext();
      }

      @Override
      public O next() {
        return mapper.apply(source.next());
      }

      @Override
      public void close() {
        source.close();
      }
    };
  }

  default CloseableIterator<T> filter(Predicate<? super T> predicate) {
    return new Filtered<>(this, predicate);
  }

  /** Skips ahead to the next matching element on {@link #hasNext()}, so null elements pass through too. */
  final class Filtered<T> implements CloseableIterator<T> {

    private final CloseableIterator<T> source;
    private final Predicate<? super T> predicate;
    private boolean pending = false;
    private T upcoming;

    private Filtered(CloseableIterator<T> source, Predicate<? super T> predicate) {
      this.source = source;
      this.predicate = predicate;
    }

    @Override
    public boolean hasNext() {
      while (!pending && source.hasNext()) {
        T candidate = source.next();
        if (predicate.test(candidate)) {
          upcoming = candidate;
          pending = true;
        }
      }
      return pending;
    }

    @Override
    public T next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      pending = false;
      T result = upcoming;
      upcoming = null;
      return result;
    }

    @Override
    public void close() {
      source.close();
    }
  }

  final class Chained<S, T> implements CloseableIterator<T> {

    private final Iterator<S> sources;
    private final Function<S, CloseableIterator<T>> open;
    private CloseableIterator<T> current;
    private boolean closed = false;

    private Chained(Iterator<S> sources, Function<S, CloseableIterator<T>> open) {
      this.sources = sources;
      this.open = open;
    }

    @Override
    public boolean hasNext() {
      while (!closed && (current == null || !current.hasNext())) {
        closeCurrent();
        if (!sources.hasNext()) {
          return false;
        }
        current = open.apply(sources.next());
      }
      return !closed;
    }

    @Override
    public T next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      return current.next();
    }

    private void closeCurrent() {
      if (current != null) {
        CloseableIterator<T> toClose = current;
        current = null;
        toClose.close();
      }
    }

    @Override
    public void close() {
      closed = true;
      closeCurrent();
    }
  }
}
