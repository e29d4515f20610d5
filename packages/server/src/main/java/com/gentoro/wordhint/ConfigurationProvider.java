package com.gentoro.wordhint;

import com.gentoro.wordhint.exception.ConfigException;
import com.gentoro.wordhint.logging.LoggingService;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.SystemConfiguration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;

/**
 * Loads the application configuration. Values come from the YAML file given on the command line,
 * or the bundled {@code application.yaml}; JVM system properties prefixed with {@code wordhint.}
 * take precedence, e.g. {@code -Dwordhint.http.port=9090}.
 */
public class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      LoggingService.getLogger(ConfigurationProvider.class);

  static final String DEFAULT_RESOURCE = "application.yaml";
  static final String SYSTEM_PROPERTY_PREFIX = "wordhint";

  private final Configuration config;

  public ConfigurationProvider(Path configFile) {
    YAMLConfiguration yaml = configFile == null ? loadBundled() : loadFile(configFile);
    Configuration overrides = new SystemConfiguration().subset(SYSTEM_PROPERTY_PREFIX);
    this.config = new CompositeConfiguration(List.of(overrides, yaml));
  }

  public Configuration config() {
    return config;
  }

  private static YAMLConfiguration loadBundled() {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = ConfigurationProvider.class.getClassLoader();
    InputStream in = cl.getResourceAsStream(DEFAULT_RESOURCE);
    if (in == null) {
      throw new ConfigException("Bundled configuration not found: " + DEFAULT_RESOURCE);
    }
    log.trace("Loading bundled configuration {}", DEFAULT_RESOURCE);
    try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      return read(reader);
    } catch (IOException | ConfigurationException e) {
      throw new ConfigException("Failed to read bundled configuration " + DEFAULT_RESOURCE, e);
    }
  }

  private static YAMLConfiguration loadFile(Path file) {
    log.trace("Loading configuration from {}", file);
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      return read(reader);
    } catch (IOException | ConfigurationException e) {
      throw new ConfigException("Failed to read configuration file " + file, e);
    }
  }

  private static YAMLConfiguration read(Reader reader) throws ConfigurationException, IOException {
    YAMLConfiguration yaml = new YAMLConfiguration();
    yaml.read(reader);
    return yaml;
  }
}
