package com.consullo.supervisor.loop;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EventLoop} backed by a single daemon thread.
 *
 * <p>
 * A task that throws is logged; the loop keeps running.
 * </p>
 *
 * @since 1.0
 */
public final class SingleThreadEventLoop implements EventLoop {

  private static final Logger LOGGER = LoggerFactory.getLogger(SingleThreadEventLoop.class);

  private final String name;
  private final ScheduledExecutorService executor;

  /**
   * Creates and starts a loop.
   *
   * @param name thread name
   */
  public SingleThreadEventLoop(final String name) {
    Validate.notBlank(name, "name must not be blank");
    this.name = name;
    final ScheduledThreadPoolExecutor pool = new ScheduledThreadPoolExecutor(1, runnable -> {
      final Thread thread = new Thread(runnable, name);
      thread.setDaemon(true);
      return thread;
    });
    pool.setRemoveOnCancelPolicy(true);
    pool.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    this.executor = pool;
  }

  @Override
  public void execute(final Runnable task) {
    Validate.notNull(task, "task must not be null");
    if (this.executor.isShutdown()) {
      LOGGER.debug("Event loop {} is closed, dropping task", this.name);
      return;
    }
    this.executor.execute(guard(task));
  }

  @Override
  public Scheduled schedule(final Runnable task, final long delayMillis) {
    Validate.notNull(task, "task must not be null");
    Validate.isTrue(delayMillis >= 0, "delayMillis must not be negative");
    return new FutureHandle(this.executor.schedule(guard(task), delayMillis, TimeUnit.MILLISECONDS));
  }

  @Override
  public Scheduled scheduleAtFixedRate(final Runnable task, final long initialDelayMillis, final long periodMillis) {
    Validate.notNull(task, "task must not be null");
    Validate.isTrue(periodMillis > 0, "periodMillis must be positive");
    return new FutureHandle(this.executor.scheduleAtFixedRate(
        guard(task), Math.max(0L, initialDelayMillis), periodMillis, TimeUnit.MILLISECONDS));
  }

  @Override
  public long currentTimeMillis() {
    return System.currentTimeMillis();
  }

  @Override
  public void close() {
    this.executor.shutdownNow();
  }

  private Runnable guard(final Runnable task) {
    return () -> {
      try {
        task.run();
      } catch (final RuntimeException e) {
        LOGGER.error("Task failed on event loop {}", this.name, e);
      }
    };
  }

  private static final class FutureHandle implements Scheduled {

    private final ScheduledFuture<?> future;

    private FutureHandle(final ScheduledFuture<?> future) {
      this.future = future;
    }

    @Override
    public void cancel() {
      this.future.cancel(false);
    }

    @Override
    public boolean isCancelled() {
      return this.future.isCancelled();
    }
  }
}
