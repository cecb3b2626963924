package com.consullo.supervisor.loop;

/**
 * Single-threaded task executor with timers.
 *
 * <p>
 * Components that own mutable registries (pending requests, session maps, metric
 * histories) confine every mutation to their loop. I/O threads only post events.
 * </p>
 *
 * @since 1.0
 */
public interface EventLoop extends AutoCloseable {

  /**
   * Queues a task for execution on the loop.
   *
   * @param task task to run
   */
  void execute(Runnable task);

  /**
   * Runs a task once after a delay.
   *
   * @param task task to run
   * @param delayMillis delay in milliseconds
   * @return handle used to cancel the task
   */
  Scheduled schedule(Runnable task, long delayMillis);

  /**
   * Runs a task repeatedly at a fixed period.
   *
   * @param task task to run
   * @param initialDelayMillis delay before the first run
   * @param periodMillis period between runs
   * @return handle used to cancel the task
   */
  Scheduled scheduleAtFixedRate(Runnable task, long initialDelayMillis, long periodMillis);

  /**
   * @return the loop's notion of the current time, in epoch milliseconds
   */
  long currentTimeMillis();

  /**
   * Stops the loop. Queued and scheduled tasks are discarded.
   */
  @Override
  void close();

  /**
   * Handle to a scheduled task.
   */
  interface Scheduled {

    void cancel();

    boolean isCancelled();
  }
}
