package ca.gc.cra.logdrop.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the named threads the router runs on ({@code dispatcher}, {@code output-<name>},
 * {@code input-tcp-<n>}, {@code bulk-timer-<name>}).
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds an executor backed by exactly one named thread, used for long-running loops such as an output worker.
   *
   * @param threadName exact name of the worker thread
   * @param handler uncaught exception handler installed on the thread; {@code null} ignores crashes
   * @return executor accepting a single long-running task
   */
  public static ExecutorService newSingleWorker(String threadName, UncaughtExceptionHandler handler) {
    if (threadName == null || threadName.isBlank()) {
      throw new IllegalArgumentException("threadName must not be blank");
    }
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(threadName);
          thread.setDaemon(false);
          thread.setUncaughtExceptionHandler(effectiveHandler);
          return thread;
        };

    return new ThreadPoolExecutor(
        1,
        1,
        0L,
        TimeUnit.MILLISECONDS,
        new SynchronousQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Builds a scheduler backed by one named daemon thread. Cancelled tasks are removed from its queue at once.
   *
   * @param threadName exact name of the scheduler thread
   * @param handler uncaught exception handler installed on the thread; {@code null} ignores crashes
   * @return single-threaded scheduler
   */
  public static ScheduledExecutorService newScheduledWorker(String threadName, UncaughtExceptionHandler handler) {
    if (threadName == null || threadName.isBlank()) {
      throw new IllegalArgumentException("threadName must not be blank");
    }
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(threadName);
          thread.setDaemon(true);
          thread.setUncaughtExceptionHandler(effectiveHandler);
          return thread;
        };

    ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(1, factory);
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    return scheduler;
  }

  /**
   * Builds an unbounded pool for per-connection handlers. Threads are named {@code prefix-<n>} and idle threads
   * retire after one minute.
   *
   * @param prefix thread-name prefix
   * @param handler uncaught exception handler installed on each thread; {@code null} ignores crashes
   * @return configured executor service
   */
  public static ExecutorService newConnectionPool(String prefix, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "logdrop-conn" : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(threadPrefix + "-" + index.getAndIncrement());
          thread.setDaemon(true);
          thread.setUncaughtExceptionHandler(effectiveHandler);
          return thread;
        };

    return new ThreadPoolExecutor(
        0,
        Integer.MAX_VALUE,
        60L,
        TimeUnit.SECONDS,
        new SynchronousQueue<>(),
        factory);
  }
}
