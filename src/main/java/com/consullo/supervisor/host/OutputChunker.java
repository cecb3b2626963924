package com.consullo.supervisor.host;

/**
 * Cuts pending output into bounded {@code data} messages.
 */
final class OutputChunker {

  private OutputChunker() {
  }

  /**
   * Removes and returns the next chunk. A surrogate pair is never split.
   *
   * @param pending pending output, modified in place
   * @param maxChars chunk ceiling, at least 2
   * @return next chunk, empty when nothing is pending
   */
  static String take(final StringBuilder pending, final int maxChars) {
    int end = Math.min(pending.length(), maxChars);
    if (end < pending.length() && end > 1 && Character.isHighSurrogate(pending.charAt(end - 1))) {
      end--;
    }
    final String chunk = pending.substring(0, end);
    pending.delete(0, end);
    return chunk;
  }
}
