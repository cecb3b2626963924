package com.consullo.supervisor.config;

import com.consullo.supervisor.bridge.BridgeConfig;
import com.consullo.supervisor.host.HostConfig;
import com.consullo.supervisor.host.ResizeStormConfig;
import com.consullo.supervisor.manager.HostMode;
import com.consullo.supervisor.manager.ManagerConfig;
import com.consullo.supervisor.monitor.AlertThresholds;
import com.consullo.supervisor.monitor.MonitorConfig;
import com.consullo.supervisor.remote.RemoteServerConfig;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads {@link SupervisorConfig} from YAML.
 *
 * <p>
 * The classpath resource {@value #RESOURCE} provides defaults. An external file, named
 * by the {@value #CONFIG_PROPERTY} system property or passed explicitly, overrides
 * individual keys. Keys absent from both fall back to the records' built-in defaults.
 * </p>
 *
 * @since 1.0
 */
public final class SupervisorConfigLoader {

  private static final Logger LOGGER = LoggerFactory.getLogger(SupervisorConfigLoader.class);

  public static final String RESOURCE = "terminal-supervisor.yml";
  public static final String CONFIG_PROPERTY = "supervisor.config";

  private SupervisorConfigLoader() {
  }

  /**
   * Loads classpath defaults, overridden by the file named in {@value #CONFIG_PROPERTY}
   * if set.
   *
   * @return configuration
   * @throws IOException if the external file cannot be read
   * @throws IllegalArgumentException if a document is not valid configuration
   */
  public static SupervisorConfig loadDefault() throws IOException {
    final String external = System.getProperty(CONFIG_PROPERTY);
    if (StringUtils.isBlank(external)) {
      return build(classpathDefaults());
    }
    return load(Path.of(external));
  }

  /**
   * Loads classpath defaults overridden by {@code path}.
   *
   * @param path YAML file
   * @return configuration
   * @throws IOException if the file cannot be read
   * @throws IllegalArgumentException if a document is not valid configuration
   */
  public static SupervisorConfig load(final Path path) throws IOException {
    Validate.notNull(path, "path must not be null");
    final Map<String, Object> values = classpathDefaults();
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      values.putAll(parse(reader, path.toString()));
    }
    LOGGER.info("Loaded configuration from {}", path);
    return build(values);
  }

  /**
   * Parses a YAML document without classpath defaults.
   *
   * @param reader YAML source
   * @return configuration
   */
  public static SupervisorConfig parse(final Reader reader) {
    return build(parse(reader, "document"));
  }

  private static Map<String, Object> classpathDefaults() throws IOException {
    final ClassLoader loader = SupervisorConfigLoader.class.getClassLoader();
    try (InputStream in = loader.getResourceAsStream(RESOURCE)) {
      if (in == null) {
        LOGGER.debug("No {} on the classpath, using built-in defaults", RESOURCE);
        return new LinkedHashMap<>();
      }
      return parse(new InputStreamReader(in, StandardCharsets.UTF_8), "classpath:" + RESOURCE);
    }
  }

  private static Map<String, Object> parse(final Reader reader, final String source) {
    try {
      final Object document = new Yaml().load(reader);
      final Map<String, Object> flattened = new LinkedHashMap<>();
      if (document != null) {
        flatten(asMap(document, "root"), "", flattened);
      }
      return flattened;
    } catch (final YAMLException e) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + source, e);
    }
  }

  private static Map<String, Object> asMap(final Object node, final String context) {
    if (!(node instanceof Map)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    final Map<String, Object> map = new LinkedHashMap<>();
    for (final Map.Entry<?, ?> entry : ((Map<?, ?>) node).entrySet()) {
      if (!(entry.getKey() instanceof String)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put((String) entry.getKey(), entry.getValue());
    }
    return map;
  }

  private static void flatten(final Map<String, Object> source, final String prefix,
      final Map<String, Object> target) {
    for (final Map.Entry<String, Object> entry : source.entrySet()) {
      final String key = prefix.isEmpty() ? entry.getKey() : prefix + '.' + entry.getKey();
      final Object value = entry.getValue();
      if (value instanceof Map) {
        flatten(asMap(value, key), key, target);
      } else {
        target.put(key, value);
      }
    }
  }

  private static SupervisorConfig build(final Map<String, Object> values) {
    final Values v = new Values(values);
    final ResizeStormConfig storm = ResizeStormConfig.DEFAULTS;
    final HostConfig host = new HostConfig(
        v.integer("host.chunkSize", HostConfig.DEFAULTS.chunkSize()),
        new ResizeStormConfig(
            v.string("host.resizeStorm.pattern", storm.pattern()),
            v.integer("host.resizeStorm.threshold", storm.threshold()),
            v.integer("host.resizeStorm.windowChars", storm.windowChars()),
            v.integer("host.resizeStorm.windowTrimChars", storm.windowTrimChars()),
            v.integer("host.resizeStorm.maxSignalLength", storm.maxSignalLength()),
            v.longValue("host.resizeStorm.quietPeriodMillis", storm.quietPeriodMillis())));

    final ManagerConfig managerDefaults = ManagerConfig.DEFAULTS;
    final ManagerConfig manager = new ManagerConfig(
        v.longValue("manager.restartDelayMillis", managerDefaults.restartDelayMillis()),
        HostMode.fromWireName(v.string("manager.hostMode", managerDefaults.hostMode().wireName())),
        v.strings("manager.hostJvmArgs", managerDefaults.hostJvmArgs()));

    final MonitorConfig monitorDefaults = MonitorConfig.DEFAULTS;
    final AlertThresholds t = monitorDefaults.thresholds();
    final MonitorConfig monitor = new MonitorConfig(
        v.longValue("monitor.intervalMillis", monitorDefaults.intervalMillis()),
        v.integer("monitor.maxMetricsHistory", monitorDefaults.maxMetricsHistory()),
        v.integer("monitor.maxAlertsHistory", monitorDefaults.maxAlertsHistory()),
        new AlertThresholds(
            v.longValue("monitor.thresholds.memoryWarning", t.memoryWarning()),
            v.longValue("monitor.thresholds.memoryCritical", t.memoryCritical()),
            v.decimal("monitor.thresholds.latencyWarning", t.latencyWarning()),
            v.decimal("monitor.thresholds.latencyCritical", t.latencyCritical()),
            v.decimal("monitor.thresholds.bufferUtilizationWarning", t.bufferUtilizationWarning()),
            v.decimal("monitor.thresholds.bufferUtilizationCritical", t.bufferUtilizationCritical()),
            v.decimal("monitor.thresholds.droppedChunksWarning", t.droppedChunksWarning()),
            v.decimal("monitor.thresholds.droppedChunksCritical", t.droppedChunksCritical())));

    final BridgeConfig bridgeDefaults = BridgeConfig.DEFAULTS;
    final BridgeConfig bridge = new BridgeConfig(
        v.integer("bridge.maxReconnectAttempts", bridgeDefaults.maxReconnectAttempts()),
        v.longValue("bridge.baseDelayMillis", bridgeDefaults.baseDelayMillis()),
        v.longValue("bridge.maxDelayMillis", bridgeDefaults.maxDelayMillis()),
        v.integer("bridge.maxQueuedMessages", bridgeDefaults.maxQueuedMessages()));

    final RemoteServerConfig remoteDefaults = RemoteServerConfig.DEFAULTS;
    final RemoteServerConfig remote = new RemoteServerConfig(
        v.bool("remote.enabled", remoteDefaults.enabled()),
        v.string("remote.host", remoteDefaults.host()),
        v.integer("remote.port", remoteDefaults.port()));

    return new SupervisorConfig(host, manager, monitor, bridge, remote);
  }

  /**
   * Typed access to flattened keys.
   */
  private static final class Values {

    private final Map<String, Object> values;

    private Values(final Map<String, Object> values) {
      this.values = values;
    }

    String string(final String key, final String fallback) {
      final Object value = this.values.get(key);
      return value == null ? fallback : value.toString();
    }

    int integer(final String key, final int fallback) {
      final Object value = this.values.get(key);
      if (value == null) {
        return fallback;
      }
      try {
        return value instanceof Number ? ((Number) value).intValue() : Integer.parseInt(value.toString().trim());
      } catch (final NumberFormatException e) {
        throw new IllegalArgumentException("Config key " + key + " must be an integer: " + value, e);
      }
    }

    long longValue(final String key, final long fallback) {
      final Object value = this.values.get(key);
      if (value == null) {
        return fallback;
      }
      try {
        return value instanceof Number ? ((Number) value).longValue() : Long.parseLong(value.toString().trim());
      } catch (final NumberFormatException e) {
        throw new IllegalArgumentException("Config key " + key + " must be an integer: " + value, e);
      }
    }

    double decimal(final String key, final double fallback) {
      final Object value = this.values.get(key);
      if (value == null) {
        return fallback;
      }
      try {
        return value instanceof Number ? ((Number) value).doubleValue() : Double.parseDouble(value.toString().trim());
      } catch (final NumberFormatException e) {
        throw new IllegalArgumentException("Config key " + key + " must be a number: " + value, e);
      }
    }

    boolean bool(final String key, final boolean fallback) {
      final Object value = this.values.get(key);
      if (value == null) {
        return fallback;
      }
      return value instanceof Boolean ? (Boolean) value : Boolean.parseBoolean(value.toString().trim());
    }

    List<String> strings(final String key, final List<String> fallback) {
      final Object value = this.values.get(key);
      if (value == null) {
        return fallback;
      }
      if (!(value instanceof Iterable)) {
        throw new IllegalArgumentException("Config key " + key + " must be a list");
      }
      final List<String> out = new ArrayList<>();
      for (final Object item : (Iterable<?>) value) {
        out.add(String.valueOf(item));
      }
      return out;
    }
  }
}
