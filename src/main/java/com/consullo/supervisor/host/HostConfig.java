package com.consullo.supervisor.host;

import org.apache.commons.lang3.Validate;

/**
 * Terminal host settings.
 *
 * @param chunkSize maximum characters per {@code data} message
 * @param resizeStorm resize-storm suppression tuning
 */
public record HostConfig(int chunkSize, ResizeStormConfig resizeStorm) {

  public static final int DEFAULT_CHUNK_SIZE = 1024;

  public static final HostConfig DEFAULTS = new HostConfig(DEFAULT_CHUNK_SIZE, ResizeStormConfig.DEFAULTS);

  public HostConfig {
    Validate.isTrue(chunkSize > 1, "chunkSize must be greater than 1");
    Validate.notNull(resizeStorm, "resizeStorm must not be null");
  }
}
