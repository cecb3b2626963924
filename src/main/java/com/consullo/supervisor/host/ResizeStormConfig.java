package com.consullo.supervisor.host;

import org.apache.commons.lang3.Validate;

/**
 * Tuning for {@link ResizeStormFilter}.
 *
 * @param pattern escape sequence a shell redraws after a window change
 * @param threshold occurrences within the window that start a storm
 * @param windowChars window length that triggers trimming
 * @param windowTrimChars characters kept after trimming
 * @param maxSignalLength only chunks shorter than this count as resize signals
 * @param quietPeriodMillis gap between signals after which the window is forgotten
 * @since 1.0
 */
public record ResizeStormConfig(
    String pattern,
    int threshold,
    int windowChars,
    int windowTrimChars,
    int maxSignalLength,
    long quietPeriodMillis) {

  public static final String DEFAULT_PATTERN = "\r\r\u001b[m\u001b[m\u001b[m\u001b[J";

  public static final ResizeStormConfig DEFAULTS =
      new ResizeStormConfig(DEFAULT_PATTERN, 3, 1000, 500, 200, 1000L);

  public ResizeStormConfig {
    Validate.notEmpty(pattern, "pattern must not be empty");
    Validate.isTrue(threshold > 0, "threshold must be positive");
    Validate.isTrue(windowTrimChars > 0 && windowTrimChars <= windowChars,
        "windowTrimChars must be in 1..windowChars");
    Validate.isTrue(maxSignalLength > 0, "maxSignalLength must be positive");
    Validate.isTrue(quietPeriodMillis >= 0, "quietPeriodMillis must not be negative");
  }
}
