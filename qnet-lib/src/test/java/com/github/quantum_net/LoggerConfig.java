// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.quantum_net;

import java.util.Optional;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/// Routes JUL output to stdout at the level named by the `LOG_LEVEL` environment variable, else the
/// `java.util.logging.ConsoleHandler.level` system property, else WARNING.
public class LoggerConfig {

  static {
    final Logger rootLogger = Logger.getLogger("");
    for (Handler handler : rootLogger.getHandlers()) {
      rootLogger.removeHandler(handler);
    }
    final ConsoleHandler consoleHandler = new ConsoleHandler() {{
      setOutputStream(System.out);
    }};
    final var levelString = Optional.ofNullable(System.getenv("LOG_LEVEL"))
        .orElse(System.getProperty("java.util.logging.ConsoleHandler.level", "WARNING"));
    final Level level = Level.parse(levelString);
    consoleHandler.setLevel(level);
    rootLogger.setLevel(level);
    QuantumNetLogger.LOGGER.setLevel(level);
    rootLogger.addHandler(consoleHandler);
    consoleHandler.setFormatter(new SimpleFormatter() {
      @Override
      public String format(LogRecord record) {
        return String.format("[%s] %s %s%n", record.getLevel().getName(), Thread.currentThread().getName(),
            record.getMessage());
      }
    });
  }

  public static void initialize() {
    // triggers the static block
  }
}
