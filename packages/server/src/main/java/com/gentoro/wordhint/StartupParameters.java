package com.gentoro.wordhint;

import com.gentoro.wordhint.exception.ConfigException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Command line parameters in {@code --name=value} form. A bare {@code --flag} is recorded with the
 * value {@code true}.
 *
 * <p>Recognized parameters: {@code --mode} (server, interactive, simulate; default server), {@code
 * --config} (YAML file replacing the bundled application.yaml) and {@code --target} (word played
 * in simulate mode).
 */
public class StartupParameters {
  private static final Map<String, String> DEFAULTS = Map.of("mode", "server");

  private final Map<String, String> parameters = new HashMap<>(DEFAULTS);

  public StartupParameters(String[] args) {
    if (args == null) return;
    for (String arg : args) {
      if (arg == null || !arg.startsWith("--") || arg.length() == 2) {
        throw new ConfigException("Invalid startup parameter: " + arg);
      }
      String body = arg.substring(2);
      int eq = body.indexOf('=');
      if (eq < 0) {
        parameters.put(body, "true");
      } else {
        parameters.put(body.substring(0, eq), body.substring(eq + 1));
      }
    }
  }

  public <T> T getParameter(String name, Class<T> type) {
    String value = parameters.get(name);
    if (value == null) {
      return null;
    }
    if (type == String.class) {
      return type.cast(value);
    }
    throw new IllegalArgumentException("Unsupported parameter type: " + type.getName());
  }

  /** Explicit configuration file, or {@code null} to use the bundled one. */
  public Path configFile() {
    String value = parameters.get("config");
    if (value == null || value.isBlank()) {
      return null;
    }
    Path path = Path.of(value.trim());
    if (!Files.isRegularFile(path)) {
      throw new ConfigException("Configuration file does not exist: " + path);
    }
    return path;
  }

  public Map<String, String> asMap() {
    return Collections.unmodifiableMap(parameters);
  }
}
