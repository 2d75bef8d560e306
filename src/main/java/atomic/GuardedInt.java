package atomic;

import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.IntBinaryOperator;
import java.util.function.IntUnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An int value guarded by a read/write lock. Every operation, compound ones included,
 * runs as a single critical section, so the operations on one instance are linearizable.
 * Reads take the read lock and may overlap each other, everything else takes the write lock.
 * <p>
 * Arithmetic wraps around on overflow the same way plain {@code int} arithmetic does.
 * Functions passed to the update methods run while the write lock is held: they must not
 * call back into the same instance.
 */
public class GuardedInt {
  private static final Logger log = LoggerFactory.getLogger(GuardedInt.class);

  private final ReentrantReadWriteLock lock;
  private int value;

  public GuardedInt() {
    this(0);
  }

  public GuardedInt(int initialValue) {
    this(initialValue, false);
  }

  public GuardedInt(int initialValue, boolean fair) {
    this.lock = new ReentrantReadWriteLock(fair);
    this.value = initialValue;
    log.trace("Created with value {}, fair lock: {}", initialValue, fair);
  }

  public int get() {
    Lock readLock = lock.readLock();
    readLock.lock();
    try {
      return value;
    } finally {
      readLock.unlock();
    }
  }

  public void set(int newValue) {
    Lock writeLock = lock.writeLock();
    writeLock.lock();
    try {
      value = newValue;
    } finally {
      writeLock.unlock();
    }
  }

  public int getAndSet(int newValue) {
    Lock writeLock = lock.writeLock();
    writeLock.lock();
    try {
      int old = value;
      value = newValue;
      return old;
    } finally {
      writeLock.unlock();
    }
  }

  public int addAndGet(int delta) {
    Lock writeLock = lock.writeLock();
    writeLock.lock();
    try {
      value += delta;
      return value;
    } finally {
      writeLock.unlock();
    }
  }

  public int getAndAdd(int delta) {
    Lock writeLock = lock.writeLock();
    writeLock.lock();
    try {
      int old = value;
      value += delta;
      return old;
    } finally {
      writeLock.unlock();
    }
  }

  public int incrementAndGet() {
    return addAndGet(1);
  }

  public int getAndIncrement() {
    return getAndAdd(1);
  }

  public int decrementAndGet() {
    return addAndGet(-1);
  }

  public int getAndDecrement() {
    return getAndAdd(-1);
  }

  /**
   * Sets the value to {@code update} if it currently equals {@code expect}.
   *
   * @return {@code true} if the value was replaced, {@code false} if the current value
   * did not match, in which case nothing changes
   */
  public boolean compareAndSet(int expect, int update) {
    int observed;
    Lock writeLock = lock.writeLock();
    writeLock.lock();
    try {
      observed = value;
      if (observed == expect) {
        value = update;
        return true;
      }
    } finally {
      writeLock.unlock();
    }
    log.trace("compareAndSet missed: expected {} but was {}", expect, observed);
    return false;
  }

  public int updateAndGet(IntUnaryOperator updateFunction) {
    Objects.requireNonNull(updateFunction, "updateFunction");
    Lock writeLock = lock.writeLock();
    writeLock.lock();
    try {
      value = updateFunction.applyAsInt(value);
      return value;
    } finally {
      writeLock.unlock();
    }
  }

  public int getAndUpdate(IntUnaryOperator updateFunction) {
    Objects.requireNonNull(updateFunction, "updateFunction");
    Lock writeLock = lock.writeLock();
    writeLock.lock();
    try {
      int old = value;
      value = updateFunction.applyAsInt(old);
      return old;
    } finally {
      writeLock.unlock();
    }
  }

  public int accumulateAndGet(int x, IntBinaryOperator accumulatorFunction) {
    Objects.requireNonNull(accumulatorFunction, "accumulatorFunction");
    Lock writeLock = lock.writeLock();
    writeLock.lock();
    try {
      value = accumulatorFunction.applyAsInt(value, x);
      return value;
    } finally {
      writeLock.unlock();
    }
  }

  public int getAndAccumulate(int x, IntBinaryOperator accumulatorFunction) {
    Objects.requireNonNull(accumulatorFunction, "accumulatorFunction");
    Lock writeLock = lock.writeLock();
    writeLock.lock();
    try {
      int old = value;
      value = accumulatorFunction.applyAsInt(old, x);
      return old;
    } finally {
      writeLock.unlock();
    }
  }

  public boolean isFair() {
    return lock.isFair();
  }

  public long longValue() {
    return get();
  }

  public double doubleValue() {
    return get();
  }

  @Override
  public String toString() {
    return Integer.toString(get());
  }
}
