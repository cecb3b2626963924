package com.consullo.supervisor.app;

import com.consullo.supervisor.backend.BackendDetector;
import com.consullo.supervisor.backend.SystemPlatformProbe;
import com.consullo.supervisor.config.SupervisorConfig;
import com.consullo.supervisor.config.SupervisorConfigLoader;
import com.consullo.supervisor.pty.TerminalStrategy;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point. Runs the supervisor until the JVM is asked to stop.
 *
 * @since 1.0
 */
public final class SupervisorApplication {

  private static final Logger LOGGER = LoggerFactory.getLogger(SupervisorApplication.class);

  private SupervisorApplication() {
  }

  /**
   * Entry point.
   *
   * @param args unused
   * @throws Exception if startup fails
   */
  public static void main(final String[] args) throws Exception {
    final SupervisorConfig config = SupervisorConfigLoader.loadDefault();
    final BackendDetector detector = new BackendDetector(new SystemPlatformProbe());
    final TerminalStrategy strategy = new TerminalStrategy(detector);
    LOGGER.info("Terminal backend: {}", BackendDetector.describe(strategy.detectBestStrategy()));

    final Supervisor supervisor = new Supervisor(config, strategy);
    final CountDownLatch stopped = new CountDownLatch(1);
    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      supervisor.close();
      stopped.countDown();
    }, "supervisor-shutdown"));

    supervisor.start();
    supervisor.remoteServer().ifPresent(server ->
        LOGGER.info("Remote terminal server listening on port {}", server.getStatus().port()));
    stopped.await();
  }
}
