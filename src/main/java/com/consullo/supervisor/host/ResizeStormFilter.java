package com.consullo.supervisor.host;

import org.apache.commons.lang3.Validate;

/**
 * Detects runaway resize redraw loops in one terminal's output.
 *
 * <p>
 * A chunk is a resize signal when it is short and contains the configured pattern.
 * Output is kept in a bounded window; once the pattern occurs {@code threshold} times
 * in it, matching chunks are suppressed until a chunk that is not a resize signal
 * arrives or the quiet period passes. Signals separated by more than the quiet period
 * start counting from zero and end any storm.
 * No regex is used.
 * </p>
 *
 * <p>
 * Not thread-safe; owned by the host loop.
 * </p>
 */
public final class ResizeStormFilter {

  /**
   * Outcome for one chunk.
   */
  public enum Verdict {
    /** Forward the chunk. */
    FORWARD,
    /** Drop the chunk; a storm just started. */
    SUPPRESS_STORM_START,
    /** Drop the chunk; the storm continues. */
    SUPPRESS
  }

  private final ResizeStormConfig config;
  private final StringBuilder window = new StringBuilder();
  private long lastSignalMillis = Long.MIN_VALUE;
  private boolean storm;

  public ResizeStormFilter(final ResizeStormConfig config) {
    Validate.notNull(config, "config must not be null");
    this.config = config;
  }

  /**
   * @param data output chunk
   * @param nowMillis current time
   * @return what to do with the chunk
   */
  public Verdict inspect(final String data, final long nowMillis) {
    if (!isResizeSignal(data)) {
      reset();
      return Verdict.FORWARD;
    }
    if (this.lastSignalMillis != Long.MIN_VALUE
        && nowMillis - this.lastSignalMillis > this.config.quietPeriodMillis()) {
      this.window.setLength(0);
      this.storm = false;
    }
    this.lastSignalMillis = nowMillis;
    this.window.append(data);
    if (this.window.length() > this.config.windowChars()) {
      this.window.delete(0, this.window.length() - this.config.windowTrimChars());
    }
    if (this.storm) {
      return Verdict.SUPPRESS;
    }
    if (occurrences() >= this.config.threshold()) {
      this.storm = true;
      return Verdict.SUPPRESS_STORM_START;
    }
    return Verdict.FORWARD;
  }

  public boolean inStorm() {
    return this.storm;
  }

  /**
   * @return pattern occurrences currently in the window
   */
  public int occurrences() {
    final String pattern = this.config.pattern();
    int count = 0;
    int from = this.window.indexOf(pattern);
    while (from >= 0) {
      count++;
      from = this.window.indexOf(pattern, from + pattern.length());
    }
    return count;
  }

  private boolean isResizeSignal(final String data) {
    return data != null && data.length() < this.config.maxSignalLength() && data.contains(this.config.pattern());
  }

  private void reset() {
    this.window.setLength(0);
    this.storm = false;
    this.lastSignalMillis = Long.MIN_VALUE;
  }
}
