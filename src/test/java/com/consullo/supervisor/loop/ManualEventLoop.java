package com.consullo.supervisor.loop;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

/**
 * Deterministic {@link EventLoop} for tests.
 *
 * <p>
 * Executed tasks run synchronously on the calling thread in FIFO order. Timers fire
 * only when the virtual clock is moved with {@link #advance(long)}.
 * </p>
 */
public final class ManualEventLoop implements EventLoop {

  private final Deque<Runnable> queue = new ArrayDeque<>();
  private final List<Timer> timers = new ArrayList<>();
  private long now;
  private long sequence;
  private boolean draining;
  private boolean closed;

  public ManualEventLoop() {
    this(1_700_000_000_000L);
  }

  public ManualEventLoop(final long startMillis) {
    this.now = startMillis;
  }

  @Override
  public void execute(final Runnable task) {
    if (this.closed) {
      return;
    }
    this.queue.addLast(task);
    drain();
  }

  @Override
  public Scheduled schedule(final Runnable task, final long delayMillis) {
    final Timer timer = new Timer(task, this.now + delayMillis, 0L, this.sequence++);
    this.timers.add(timer);
    return timer;
  }

  @Override
  public Scheduled scheduleAtFixedRate(final Runnable task, final long initialDelayMillis, final long periodMillis) {
    final Timer timer = new Timer(task, this.now + initialDelayMillis, periodMillis, this.sequence++);
    this.timers.add(timer);
    return timer;
  }

  @Override
  public long currentTimeMillis() {
    return this.now;
  }

  @Override
  public void close() {
    this.closed = true;
    this.queue.clear();
    this.timers.clear();
  }

  /**
   * Moves the clock forward, firing every timer that becomes due on the way.
   *
   * @param millis amount of virtual time to advance
   */
  public void advance(final long millis) {
    final long target = this.now + millis;
    while (true) {
      final Timer next = this.timers.stream()
          .filter(t -> !t.cancelled && t.due <= target)
          .min(Comparator.comparingLong((Timer t) -> t.due).thenComparingLong(t -> t.seq))
          .orElse(null);
      if (next == null) {
        break;
      }
      this.now = next.due;
      if (next.period > 0) {
        next.due += next.period;
      } else {
        this.timers.remove(next);
      }
      execute(next.task);
    }
    this.now = target;
    this.timers.removeIf(t -> t.cancelled);
  }

  /**
   * @return remaining delays of active one-shot and periodic timers, in creation order
   */
  public List<Long> pendingDelays() {
    final List<Long> out = new ArrayList<>();
    for (final Timer timer : this.timers) {
      if (!timer.cancelled) {
        out.add(timer.due - this.now);
      }
    }
    return out;
  }

  public int pendingTimerCount() {
    return pendingDelays().size();
  }

  private void drain() {
    if (this.draining) {
      return;
    }
    this.draining = true;
    try {
      Runnable task;
      while ((task = this.queue.pollFirst()) != null) {
        task.run();
      }
    } finally {
      this.draining = false;
    }
  }

  private static final class Timer implements Scheduled {

    private final Runnable task;
    private final long period;
    private final long seq;
    private long due;
    private boolean cancelled;

    private Timer(final Runnable task, final long due, final long period, final long seq) {
      this.task = task;
      this.due = due;
      this.period = period;
      this.seq = seq;
    }

    @Override
    public void cancel() {
      this.cancelled = true;
    }

    @Override
    public boolean isCancelled() {
      return this.cancelled;
    }
  }
}
