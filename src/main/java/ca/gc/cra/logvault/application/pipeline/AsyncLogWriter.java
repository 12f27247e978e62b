package ca.gc.cra.logvault.application.pipeline;

import ca.gc.cra.logvault.application.metrics.LogMetricsCollector;
import ca.gc.cra.logvault.application.port.LogSink;
import ca.gc.cra.logvault.domain.entry.LogEntry;
import ca.gc.cra.logvault.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.logvault.logging.FallbackLog;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.LockSupport;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded buffer with one consumer thread that batches entries into a {@link LogSink}.
 *
 * <p>Lifecycle: {@code STOPPED -> RUNNING} on {@link #start()}, {@code RUNNING -> DRAINING} on {@link #shutdown()},
 * {@code DRAINING -> CLOSED} once the queue is drained or the shutdown timeout elapses. While {@code STOPPED}
 * every write is synchronous; once {@code DRAINING} or {@code CLOSED} writes are rejected.</p>
 *
 * <p>{@link #write(LogEntry)} never blocks on a full queue. It writes the overflowing entry synchronously
 * through the same sink, after any entries still queued, so one producer's entries stay in order. That
 * fallback and the consumer's batch writes share one lock. An overflowing producer waits for the in-flight
 * batch, then writes everything still queued (at most {@code capacity} entries) plus its own entry, so the
 * cost of one overflow is bounded by the buffer size rather than by a single line.</p>
 *
 * <p>The consumer writes when the queue holds a full batch, when the flush interval elapses, when
 * {@link #flush()} is requested and during shutdown. Accounting: every accepted entry is counted exactly once
 * as written, overflow-written or dropped on shutdown.</p>
 *
 * @since 0.1.0
 */
public final class AsyncLogWriter implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(AsyncLogWriter.class);

  static final int MAX_BATCH_SIZE = 100;
  private static final long IDLE_PARK_NANOS = TimeUnit.MILLISECONDS.toNanos(50);
  private static final Duration FLUSH_WAIT = Duration.ofSeconds(2);
  private static final Duration FORCED_STOP_WAIT = Duration.ofMillis(500);

  /** Writer lifecycle. */
  public enum State {
    STOPPED,
    RUNNING,
    DRAINING,
    CLOSED
  }

  /** How a write was handled. */
  public enum Outcome {
    /** Queued for the consumer. */
    ENQUEUED,
    /** Written synchronously because the writer is not running. */
    WRITTEN,
    /** Queue was full; written synchronously and counted as overflow. */
    OVERFLOW_WRITTEN,
    /** Writer is draining or closed; the entry was not accepted. */
    REJECTED
  }

  /**
   * Buffer sizing and lifecycle timing.
   *
   * @param capacity fixed queue capacity
   * @param flushInterval period of the forced flush
   * @param shutdownTimeout bound on the shutdown drain
   */
  public record Settings(int capacity, Duration flushInterval, Duration shutdownTimeout) {
    public Settings {
      Objects.requireNonNull(flushInterval, "flushInterval");
      Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
      if (capacity <= 0) {
        throw new IllegalArgumentException("capacity must be positive");
      }
      if (flushInterval.isZero() || flushInterval.isNegative()) {
        throw new IllegalArgumentException("flushInterval must be positive");
      }
      if (shutdownTimeout.isZero() || shutdownTimeout.isNegative()) {
        throw new IllegalArgumentException("shutdownTimeout must be positive");
      }
    }
  }

  private final LogSink sink;
  private final LogMetricsCollector metrics;
  private final FallbackLog fallback;
  private final Settings settings;
  private final BlockingQueue<LogEntry> queue;
  private final int batchSize;
  private final AtomicReference<State> state = new AtomicReference<>(State.STOPPED);
  private final ReentrantLock writeLock = new ReentrantLock();
  private final AtomicLong flushRequests = new AtomicLong();
  private final Object flushMonitor = new Object();
  private final AtomicBoolean abandon = new AtomicBoolean();
  private final CountDownLatch terminated = new CountDownLatch(1);

  private long flushCompleted;
  private volatile Thread consumerThread;
  private ExecutorService executor;

  /**
   * Creates a stopped writer; the queue capacity is fixed here.
   *
   * @param sink destination for batches and synchronous writes
   * @param settings buffer sizing and timing
   * @param metrics collector receiving buffer counters
   * @param fallback error path for unexpected consumer failures
   */
  public AsyncLogWriter(LogSink sink, Settings settings, LogMetricsCollector metrics, FallbackLog fallback) {
    this(sink, settings, metrics, fallback, true);
  }

  private AsyncLogWriter(
      LogSink sink, Settings settings, LogMetricsCollector metrics, FallbackLog fallback, boolean buffered) {
    this.sink = Objects.requireNonNull(sink, "sink");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.fallback = Objects.requireNonNull(fallback, "fallback");
    this.queue = new ArrayBlockingQueue<>(settings.capacity());
    this.batchSize = Math.min(MAX_BATCH_SIZE, settings.capacity());
    if (buffered) {
      metrics.bindBuffer(queue::size, settings.capacity());
    }
  }

  /**
   * Creates a writer that is never started: every write goes straight to the sink on the caller's thread,
   * and writes after {@link #shutdown()} are rejected.
   *
   * @param sink destination for writes
   * @param metrics collector receiving write counts
   * @param fallback error path for sink failures
   * @return stopped writer
   */
  public static AsyncLogWriter synchronous(LogSink sink, LogMetricsCollector metrics, FallbackLog fallback) {
    Settings unused = new Settings(1, Duration.ofSeconds(1), Duration.ofSeconds(1));
    return new AsyncLogWriter(sink, unused, metrics, fallback, false);
  }

  public State state() {
    return state.get();
  }

  public int capacity() {
    return settings.capacity();
  }

  /**
   * Returns the number of queued entries.
   *
   * @return current occupancy
   */
  public int occupancy() {
    return queue.size();
  }

  /**
   * Starts the consumer thread.
   *
   * @throws IllegalStateException if the writer is not {@code STOPPED}
   */
  public void start() {
    if (!state.compareAndSet(State.STOPPED, State.RUNNING)) {
      throw new IllegalStateException("Async writer already started (state=" + state.get() + ")");
    }
    executor = ExecutorFactories.newWorkerPool(1, "logvault-async", this::handleConsumerCrash);
    executor.execute(new Consumer());
    log.debug(
        "Async writer started (capacity={}, batch={}, flushInterval={})",
        settings.capacity(),
        batchSize,
        settings.flushInterval());
  }

  /**
   * Hands one entry to the buffer, or writes it synchronously when the buffer cannot take it.
   *
   * @param entry entry to write; must not be {@code null}
   * @return how the entry was handled
   */
  public Outcome write(LogEntry entry) {
    Objects.requireNonNull(entry, "entry");
    State current = state.get();
    if (current == State.STOPPED) {
      return writeSynchronously(entry);
    }
    if (current != State.RUNNING) {
      return Outcome.REJECTED;
    }
    if (queue.offer(entry)) {
      if (state.get() == State.CLOSED && queue.remove(entry)) {
        return Outcome.REJECTED;
      }
      if (queue.size() >= batchSize) {
        wakeConsumer();
      }
      return Outcome.ENQUEUED;
    }
    writeOverflow(entry);
    return Outcome.OVERFLOW_WRITTEN;
  }

  /**
   * Requests an out-of-band batch flush and waits briefly for the consumer to perform it.
   *
   * @return {@code true} when every entry queued before the call has been written
   */
  public boolean flush() {
    State current = state.get();
    if (current != State.RUNNING && current != State.DRAINING) {
      return true;
    }
    long target = flushRequests.incrementAndGet();
    wakeConsumer();
    long deadline = System.nanoTime() + FLUSH_WAIT.toNanos();
    synchronized (flushMonitor) {
      while (flushCompleted < target) {
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0L) {
          log.debug("Flush request {} not completed within {} ms", target, FLUSH_WAIT.toMillis());
          return false;
        }
        try {
          TimeUnit.NANOSECONDS.timedWait(flushMonitor, remaining);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          return false;
        }
      }
    }
    return true;
  }

  /**
   * Drains the buffer and stops the consumer, waiting at most the shutdown timeout.
   *
   * <p>Entries still queued when the timeout elapses are discarded and counted as dropped.</p>
   *
   * @return number of entries dropped
   */
  public int shutdown() {
    if (state.compareAndSet(State.STOPPED, State.CLOSED)) {
      // wait out synchronous writes already holding the lock
      writeLock.lock();
      writeLock.unlock();
      return 0;
    }
    if (!state.compareAndSet(State.RUNNING, State.DRAINING)) {
      return 0;
    }
    wakeConsumer();
    boolean graceful;
    try {
      graceful = terminated.await(settings.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      graceful = false;
    }
    if (!graceful) {
      abandon.set(true);
    }
    state.set(State.CLOSED);

    List<LogEntry> leftovers = new ArrayList<>();
    queue.drainTo(leftovers);
    int dropped = 0;
    if (graceful) {
      if (!leftovers.isEmpty()) {
        writeNow(leftovers);
      }
    } else {
      dropped = leftovers.size();
      metrics.recordDropped(dropped);
      log.warn(
          "Async drain exceeded {} ms; dropped {} queued entries",
          settings.shutdownTimeout().toMillis(),
          dropped);
    }
    stopExecutor(graceful);
    return dropped;
  }

  /**
   * Same as {@link #shutdown()}, discarding the dropped count.
   */
  @Override
  public void close() {
    shutdown();
  }

  private void writeOverflow(LogEntry entry) {
    metrics.recordOverflow();
    writeLock.lock();
    try {
      List<LogEntry> pending = new ArrayList<>(queue.size() + 1);
      queue.drainTo(pending);
      int queued = pending.size();
      pending.add(entry);
      writeToSink(pending);
      metrics.recordWritten(queued);
    } finally {
      writeLock.unlock();
    }
  }

  private Outcome writeSynchronously(LogEntry entry) {
    writeLock.lock();
    try {
      if (state.get() == State.CLOSED) {
        return Outcome.REJECTED;
      }
      writeToSink(List.of(entry));
      metrics.recordWritten(1);
      return Outcome.WRITTEN;
    } finally {
      writeLock.unlock();
    }
  }

  private void writeNow(List<LogEntry> entries) {
    writeLock.lock();
    try {
      writeToSink(entries);
      metrics.recordWritten(entries.size());
    } finally {
      writeLock.unlock();
    }
  }

  private void writeToSink(List<LogEntry> entries) {
    try {
      sink.writeBatch(entries);
    } catch (RuntimeException ex) {
      fallback.error("Log sink failed while writing {} entries", entries.size(), ex);
    }
  }

  private int drainQueue(List<LogEntry> batch) {
    int total = 0;
    while (!abandon.get()) {
      writeLock.lock();
      try {
        queue.drainTo(batch, batchSize);
        if (batch.isEmpty()) {
          return total;
        }
        writeToSink(batch);
        metrics.recordWritten(batch.size());
        total += batch.size();
      } finally {
        batch.clear();
        writeLock.unlock();
      }
    }
    return total;
  }

  private void completeFlush(long target) {
    synchronized (flushMonitor) {
      if (target > flushCompleted) {
        flushCompleted = target;
      }
      flushMonitor.notifyAll();
    }
  }

  private void wakeConsumer() {
    Thread consumer = consumerThread;
    if (consumer != null) {
      LockSupport.unpark(consumer);
    }
  }

  private void stopExecutor(boolean graceful) {
    ExecutorService current = executor;
    if (current == null) {
      return;
    }
    if (graceful) {
      current.shutdown();
    } else {
      current.shutdownNow();
    }
    try {
      if (!current.awaitTermination(FORCED_STOP_WAIT.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Async consumer did not stop within {} ms", FORCED_STOP_WAIT.toMillis());
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  private void handleConsumerCrash(Thread thread, Throwable throwable) {
    fallback.error("Async consumer {} threw an uncaught exception", thread.getName(), throwable);
  }

  private final class Consumer implements Runnable {
    @Override
    public void run() {
      consumerThread = Thread.currentThread();
      long intervalNanos = settings.flushInterval().toNanos();
      long nextFlushNanos = System.nanoTime() + intervalNanos;
      List<LogEntry> batch = new ArrayList<>(batchSize);
      try {
        while (!abandon.get()) {
          boolean draining = state.get() != State.RUNNING;
          long flushTarget = flushRequests.get();
          long now = System.nanoTime();
          boolean timerDue = now - nextFlushNanos >= 0L;
          boolean flushDue = flushTarget > flushCompletedSnapshot();
          if (draining || flushDue || timerDue || queue.size() >= batchSize) {
            int written = drainQueue(batch);
            if (written > 0) {
              metrics.recordFlush();
            }
            if (flushDue) {
              completeFlush(flushTarget);
            }
            if (timerDue) {
              nextFlushNanos = now + intervalNanos;
            }
            if (draining) {
              break;
            }
            continue;
          }
          LockSupport.parkNanos(this, Math.min(IDLE_PARK_NANOS, nextFlushNanos - now));
        }
        flushSink();
      } finally {
        completeFlush(Long.MAX_VALUE);
        terminated.countDown();
      }
    }
  }

  private long flushCompletedSnapshot() {
    synchronized (flushMonitor) {
      return flushCompleted;
    }
  }

  private void flushSink() {
    try {
      sink.flush();
    } catch (Exception ex) {
      fallback.error("Final flush of log sink failed", ex);
    }
  }
}
