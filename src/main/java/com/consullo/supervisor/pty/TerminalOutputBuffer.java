package com.consullo.supervisor.pty;

import com.consullo.supervisor.monitor.BufferHealth;
import com.consullo.supervisor.monitor.BufferMetrics;
import com.consullo.supervisor.monitor.HealthStatus;
import com.consullo.supervisor.monitor.Instrumented;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Batches terminal output between the reader thread and listeners.
 *
 * <p>
 * Output is stored as chunks. A non-urgent flush delivers at most
 * {@code maxChunksPerFlush} chunks joined into one string; urgent data (short
 * interactive output such as prompts, echo and bells) flushes everything at once.
 * When utilization exceeds the drop threshold the oldest 30 % of pending chunks are
 * discarded.
 * </p>
 *
 * <p>
 * {@link #add(String)} and {@link #flush(boolean)} are called from a single reader
 * thread. Statistics may be read from any thread.
 * </p>
 */
public final class TerminalOutputBuffer implements Instrumented {

  private static final Logger LOGGER = LoggerFactory.getLogger(TerminalOutputBuffer.class);

  private static final double DROP_FRACTION = 0.3;
  private static final int URGENT_MAX_LENGTH = 100;

  private final String terminalId;
  private final OutputBufferConfig config;
  private final Consumer<String> sink;
  private final Deque<Chunk> pending = new ArrayDeque<>();

  private long pendingBytes;
  private long totalChunks;
  private long totalBytes;
  private long droppedChunks;
  private long flushCount;
  private double averageLatencyMillis;

  public TerminalOutputBuffer(final String terminalId, final OutputBufferConfig config, final Consumer<String> sink) {
    Validate.notNull(config, "config must not be null");
    Validate.notNull(sink, "sink must not be null");
    Validate.isTrue(config.chunkSize() > 0, "chunkSize must be positive");
    Validate.isTrue(config.maxChunksPerFlush() > 0, "maxChunksPerFlush must be positive");
    Validate.isTrue(config.maxBufferSize() > 0, "maxBufferSize must be positive");
    this.terminalId = terminalId;
    this.config = config;
    this.sink = sink;
  }

  /**
   * Stores output. Urgent data is flushed immediately.
   *
   * @param data output text
   */
  public void add(final String data) {
    if (data == null || data.isEmpty()) {
      return;
    }
    synchronized (this) {
      if (utilizationPercent() > this.config.dropThreshold() * 100.0) {
        dropOldest();
      }
      final long now = System.nanoTime();
      int start = 0;
      while (start < data.length()) {
        int end = Math.min(data.length(), start + this.config.chunkSize());
        if (end < data.length() && end - start > 1 && Character.isHighSurrogate(data.charAt(end - 1))) {
          end--;
        }
        final String piece = data.substring(start, end);
        final int bytes = piece.getBytes(StandardCharsets.UTF_8).length;
        this.pending.addLast(new Chunk(piece, bytes, now));
        this.pendingBytes += bytes;
        this.totalChunks++;
        this.totalBytes += bytes;
        start = end;
      }
    }
    if (isUrgent(data)) {
      flush(true);
    }
  }

  /**
   * Delivers pending output to the sink.
   *
   * @param all true to deliver everything, false for at most one batch
   */
  public void flush(final boolean all) {
    while (true) {
      final StringBuilder batch = new StringBuilder();
      final long oldest;
      synchronized (this) {
        if (this.pending.isEmpty()) {
          return;
        }
        oldest = this.pending.peekFirst().enqueuedNanos();
        int taken = 0;
        while (!this.pending.isEmpty() && (all || taken < this.config.maxChunksPerFlush())) {
          final Chunk chunk = this.pending.pollFirst();
          this.pendingBytes -= chunk.bytes();
          batch.append(chunk.data());
          taken++;
        }
      }
      this.sink.accept(batch.toString());
      synchronized (this) {
        final double latency = (System.nanoTime() - oldest) / 1_000_000.0;
        this.flushCount++;
        this.averageLatencyMillis += (latency - this.averageLatencyMillis) / this.flushCount;
      }
      if (!all) {
        return;
      }
    }
  }

  /**
   * Discards pending output without delivering it.
   */
  public synchronized void clear() {
    this.pending.clear();
    this.pendingBytes = 0L;
  }

  @Override
  public synchronized BufferHealth bufferHealth() {
    final double utilization = utilizationPercent();
    final double dropped = this.totalChunks == 0 ? 0.0 : this.droppedChunks * 100.0 / this.totalChunks;
    final double latency = this.averageLatencyMillis;
    final HealthStatus status;
    if (utilization > 80.0 || dropped > 5.0 || latency > 50.0) {
      status = HealthStatus.CRITICAL;
    } else if (utilization > 60.0 || dropped > 1.0 || latency > 20.0) {
      status = HealthStatus.WARNING;
    } else {
      status = HealthStatus.HEALTHY;
    }
    return new BufferHealth(status, utilization, latency, dropped);
  }

  @Override
  public synchronized BufferMetrics bufferMetrics() {
    final double averageChunk = this.totalChunks == 0 ? 0.0 : (double) this.totalBytes / this.totalChunks;
    return new BufferMetrics(this.totalChunks, this.totalBytes, this.droppedChunks, averageChunk,
        this.config.maxBufferSize(), this.pendingBytes, this.averageLatencyMillis);
  }

  static boolean isUrgent(final String data) {
    if (data.length() >= URGENT_MAX_LENGTH) {
      return false;
    }
    return data.contains("\u001b[") || data.indexOf('\r') >= 0 || data.indexOf('\n') >= 0
        || data.indexOf('\u0007') >= 0 || data.contains("\u001b]0;");
  }

  private double utilizationPercent() {
    return this.pendingBytes * 100.0 / this.config.maxBufferSize();
  }

  private void dropOldest() {
    final int count = Math.max(1, (int) (this.pending.size() * DROP_FRACTION));
    int dropped = 0;
    while (dropped < count && !this.pending.isEmpty()) {
      this.pendingBytes -= this.pending.pollFirst().bytes();
      dropped++;
    }
    this.droppedChunks += dropped;
    LOGGER.warn("Terminal {} output buffer over capacity, dropped {} oldest chunks", this.terminalId, dropped);
  }

  private record Chunk(String data, int bytes, long enqueuedNanos) {
  }
}
