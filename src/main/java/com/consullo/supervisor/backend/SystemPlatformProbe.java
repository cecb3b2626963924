package com.consullo.supervisor.backend;

import com.pty4j.PtyProcess;
import com.pty4j.PtyProcessBuilder;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link PlatformProbe} that inspects the running machine.
 *
 * @since 1.0
 */
public final class SystemPlatformProbe implements PlatformProbe {

  private static final Logger LOGGER = LoggerFactory.getLogger(SystemPlatformProbe.class);

  private static final Pattern WINDOWS_VERSION = Pattern.compile("(\\d+\\.\\d+\\.\\d+)");
  private static final long PROBE_TIMEOUT_SECONDS = 5L;

  @Override
  public boolean isWindows() {
    return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");
  }

  @Override
  public String osRelease() {
    final String fallback = System.getProperty("os.version", "");
    if (!isWindows()) {
      return fallback;
    }
    // os.version omits the build number on Windows; "ver" prints e.g. "[Version 10.0.19045.3803]".
    try {
      final Process process = new ProcessBuilder("cmd.exe", "/c", "ver").redirectErrorStream(true).start();
      final String output;
      try (InputStream in = process.getInputStream()) {
        output = new String(in.readAllBytes(), StandardCharsets.UTF_8);
      }
      process.waitFor(PROBE_TIMEOUT_SECONDS, TimeUnit.SECONDS);
      final Matcher matcher = WINDOWS_VERSION.matcher(output);
      if (matcher.find()) {
        return matcher.group(1);
      }
    } catch (final IOException e) {
      LOGGER.debug("Could not run 'ver': {}", e.getMessage());
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    return fallback;
  }

  @Override
  public boolean nativePtyUsable() {
    final String[] command = isWindows()
        ? new String[] {"cmd.exe", "/c", "exit"}
        : new String[] {"/bin/sh", "-c", "exit 0"};
    try {
      final PtyProcess process = new PtyProcessBuilder(command).setConsole(false).start();
      process.waitFor(PROBE_TIMEOUT_SECONDS, TimeUnit.SECONDS);
      process.destroy();
      return true;
    } catch (final IOException | RuntimeException | LinkageError e) {
      LOGGER.debug("Native PTY probe failed: {}", e.toString());
      return false;
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  @Override
  public boolean commandResolvable(final String command) {
    if (StringUtils.isBlank(command)) {
      return false;
    }
    final String path = System.getenv("PATH");
    if (StringUtils.isBlank(path)) {
      return false;
    }
    final List<String> suffixes = new ArrayList<>();
    suffixes.add("");
    if (isWindows()) {
      final String pathExt = StringUtils.defaultIfBlank(System.getenv("PATHEXT"), ".COM;.EXE;.BAT;.CMD");
      for (final String ext : pathExt.split(";")) {
        if (!ext.isEmpty()) {
          suffixes.add(ext.toLowerCase(Locale.ROOT));
        }
      }
    }
    for (final String dir : path.split(File.pathSeparator)) {
      if (dir.isEmpty()) {
        continue;
      }
      for (final String suffix : suffixes) {
        final Path candidate = Path.of(dir, command + suffix);
        if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
          return true;
        }
      }
    }
    return false;
  }
}
