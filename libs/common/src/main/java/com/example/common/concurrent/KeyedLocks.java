/*
 * Where: Common concurrency utilities
 * What: Per-key mutual exclusion backed by Guava lock striping
 * Why: Updates for one device or incident serialize while unrelated keys proceed in parallel
 */
package com.example.common.concurrent;

import com.google.common.util.concurrent.Striped;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

public final class KeyedLocks {

  private final Striped<Lock> stripes;

  public KeyedLocks(int stripes) {
    if (stripes <= 0) {
      throw new IllegalArgumentException("stripes must be positive");
    }
    this.stripes = Striped.lazyWeakLock(stripes);
  }

  public <T> T withLock(Object key, Supplier<T> action) {
    final Lock lock = stripes.get(key);
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  public void withLock(Object key, Runnable action) {
    withLock(
        key,
        () -> {
          action.run();
          return null;
        });
  }
}
