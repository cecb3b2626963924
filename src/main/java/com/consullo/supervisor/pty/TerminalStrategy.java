package com.consullo.supervisor.pty;

import com.consullo.supervisor.backend.BackendDetector;
import com.consullo.supervisor.backend.Reliability;
import com.consullo.supervisor.backend.TerminalBackend;
import com.consullo.supervisor.backend.TerminalCapabilities;
import java.util.EnumMap;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TerminalFactory} that uses the detected backend and falls back to a
 * subprocess when the preferred backend cannot start.
 *
 * <p>
 * Detection runs once and is cached until {@link #refreshStrategy()}.
 * </p>
 *
 * @since 1.0
 */
public final class TerminalStrategy implements TerminalFactory {

  private static final Logger LOGGER = LoggerFactory.getLogger(TerminalStrategy.class);

  private final BackendDetector detector;
  private final ShellDefaults defaults;
  private final Map<TerminalBackend, TerminalProvider> providers;
  private TerminalCapabilities detected;

  public TerminalStrategy(final BackendDetector detector) {
    this(detector, ShellDefaults.system(), defaultProviders());
  }

  public TerminalStrategy(final BackendDetector detector, final ShellDefaults defaults,
      final Map<TerminalBackend, TerminalProvider> providers) {
    Validate.notNull(detector, "detector must not be null");
    Validate.notNull(defaults, "defaults must not be null");
    Validate.notNull(providers, "providers must not be null");
    Validate.isTrue(providers.containsKey(TerminalBackend.SUBPROCESS), "a subprocess provider is required");
    this.detector = detector;
    this.defaults = defaults;
    this.providers = new EnumMap<>(providers);
  }

  /**
   * Providers that start real processes: pty4j for the PTY backends, pipes for subprocess.
   *
   * @return provider per backend
   */
  public static Map<TerminalBackend, TerminalProvider> defaultProviders() {
    final Map<TerminalBackend, TerminalProvider> map = new EnumMap<>(TerminalBackend.class);
    for (final TerminalBackend backend : TerminalBackend.values()) {
      if (backend == TerminalBackend.SUBPROCESS) {
        map.put(backend, (id, options) -> {
          final SubprocessTerminal terminal = new SubprocessTerminal(id, options);
          terminal.launch();
          return terminal;
        });
      } else {
        map.put(backend, (id, options) -> {
          final Pty4jTerminal terminal = new Pty4jTerminal(id, options, backend);
          terminal.launch();
          return terminal;
        });
      }
    }
    return map;
  }

  /**
   * @return cached detection result, detecting on first use
   */
  public synchronized TerminalCapabilities detectBestStrategy() {
    if (this.detected == null) {
      this.detected = this.detector.detectBestBackend();
      LOGGER.info("Terminal strategy: {}", BackendDetector.describe(this.detected));
    }
    return this.detected;
  }

  /**
   * Discards the cached detection and detects again.
   *
   * @return new detection result
   */
  public synchronized TerminalCapabilities refreshStrategy() {
    this.detected = null;
    return detectBestStrategy();
  }

  /**
   * @return backend new terminals are created on
   */
  public TerminalBackend activeBackend() {
    return detectBestStrategy().backend();
  }

  @Override
  public TerminalCreateResult createTerminal(final String id, final TerminalOptions options) throws Exception {
    Validate.notBlank(id, "id must not be blank");
    final TerminalOptions resolved = this.defaults.resolve(options);
    final TerminalCapabilities preferred = detectBestStrategy();
    try {
      final Terminal terminal = provider(preferred.backend()).open(id, resolved);
      return new TerminalCreateResult(terminal, resolved, preferred.backend(), preferred, degradedReason(preferred));
    } catch (final Exception e) {
      if (preferred.backend() == TerminalBackend.SUBPROCESS) {
        throw e;
      }
      LOGGER.warn("Failed to create {} terminal {}, falling back to subprocess: {}",
          preferred.backend(), id, e.getMessage());
      final TerminalCapabilities fallback = TerminalCapabilities.of(TerminalBackend.SUBPROCESS);
      final Terminal terminal = provider(TerminalBackend.SUBPROCESS).open(id, resolved);
      final String reason = preferred.backend().wireName() + " unavailable ("
          + StringUtils.defaultIfBlank(e.getMessage(), e.getClass().getSimpleName()) + "), using subprocess backend";
      return new TerminalCreateResult(terminal, resolved, TerminalBackend.SUBPROCESS, fallback, reason);
    }
  }

  private TerminalProvider provider(final TerminalBackend backend) {
    final TerminalProvider provider = this.providers.get(backend);
    Validate.validState(provider != null, "no provider for backend %s", backend);
    return provider;
  }

  private static String degradedReason(final TerminalCapabilities capabilities) {
    if (capabilities.reliability() == Reliability.HIGH) {
      return null;
    }
    return "Using " + capabilities.backend().wireName() + " backend (" + capabilities.reliability().wireName()
        + " reliability)";
  }
}
