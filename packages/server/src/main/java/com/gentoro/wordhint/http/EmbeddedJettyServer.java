package com.gentoro.wordhint.http;

import com.gentoro.wordhint.exception.ConfigException;
import com.gentoro.wordhint.exception.ExceptionUtil;
import com.gentoro.wordhint.exception.NetworkException;
import com.gentoro.wordhint.exception.StateException;
import com.gentoro.wordhint.logging.LoggingService;
import java.util.Objects;
import org.apache.commons.configuration2.Configuration;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.util.thread.QueuedThreadPool;

/**
 * Embedded Jetty 12 server with a root {@link ServletContextHandler}.
 *
 * <p>This class owns the Jetty lifecycle (prepare/start/stop) and exposes the context handler
 * so that endpoint components can register their servlets before {@link #start()}.
 */
public class EmbeddedJettyServer implements AutoCloseable {
  private static final org.slf4j.Logger log =
      LoggingService.getLogger(EmbeddedJettyServer.class);

  static final int DEFAULT_PORT = 8088;
  private static final long STOP_TIMEOUT_MILLIS = 2000;

  private final Configuration configuration;
  private final Object lifecycleLock = new Object();
  private Server server;
  private ServerConnector connector;
  private ServletContextHandler contextHandler;

  public EmbeddedJettyServer(Configuration configuration) {
    this.configuration = configuration;
  }

  /** Prepare the Jetty Server and root ServletContextHandler without starting it. */
  public void prepare() {
    log.trace("Initializing Jetty server");
    synchronized (lifecycleLock) {
      if (server != null) {
        log.trace("Server already prepared");
        return;
      }

      int port;
      try {
        port = configuration.getInt("http.port", DEFAULT_PORT);
        log.trace("Resolving http.port: {}", port);
      } catch (Exception e) {
        throw new ConfigException("Failed to resolve http.port configuration", e);
      }
      if (port < 0 || port > 65535) {
        throw new ConfigException("http.port out of range: " + port);
      }

      String hostname;
      try {
        hostname = configuration.getString("http.hostname", "0.0.0.0");
        if (Objects.isNull(hostname) || hostname.isBlank()) {
          throw new ConfigException("Missing http.hostname configuration");
        }
        hostname = hostname.trim();
        log.trace("Resolving http.hostname: {}", hostname);
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e, (ex) -> new ConfigException("Failed to resolve http.hostname configuration", ex));
      }

      try {
        QueuedThreadPool threadPool = new QueuedThreadPool();
        threadPool.setDaemon(true);
        threadPool.setName("jetty-http");
        server = new Server(threadPool);

        connector = new ServerConnector(server);
        if (!hostname.equals("0.0.0.0")) {
          connector.setHost(hostname);
        }
        connector.setPort(port);
        server.addConnector(connector);

        contextHandler = new ServletContextHandler();
        contextHandler.setContextPath("/");
        server.setHandler(contextHandler);
      } catch (Exception e) {
        throw new NetworkException(
            "There was a problem while attempting to initialize jetty service. "
                + "Please, check if the chosen port and hostname are available",
            e);
      }
    }
  }

  /** Start Jetty if not already started. */
  public void start() {
    log.trace("Starting Jetty server");
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        log.trace("Server already started");
        return;
      }

      if (server == null) {
        log.warn("Called start() before prepare()");
        prepare();
      }

      try {
        server.start();
        log.info("Jetty listening on http://localhost:{}", getPort());
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e,
            (ex) ->
                new NetworkException(
                    "There was a problem while attempting to start jetty service. "
                        + "Please, check if the chosen port and hostname are available",
                    ex));
      }
    }
  }

  public void stop() {
    log.trace("Stopping Jetty server");
    synchronized (lifecycleLock) {
      if (server == null) {
        return;
      }
      Server s = server;
      try {
        if (s.isRunning() || s.isStarting()) {
          s.setStopTimeout(STOP_TIMEOUT_MILLIS);
          s.stop();
        }
      } catch (Exception e) {
        log.error(
            "Error stopping jetty server; exception was logged but not rethrown so that other"
                + " services can still stop.",
            e);
      } finally {
        server = null;
        connector = null;
        contextHandler = null;
      }
    }
  }

  public boolean isRunning() {
    synchronized (lifecycleLock) {
      return server != null && server.isRunning();
    }
  }

  public int getPort() {
    synchronized (lifecycleLock) {
      // http.port may be 0, in which case the bound port is only known after start()
      if (server != null && server.isStarted()) {
        return connector.getLocalPort();
      }
      return configuration.getInt("http.port", DEFAULT_PORT);
    }
  }

  public ServletContextHandler getContextHandler() {
    synchronized (lifecycleLock) {
      if (contextHandler == null) {
        throw new StateException(
            "Jetty server not prepared. Call prepare() first.");
      }
      return contextHandler;
    }
  }

  @Override
  public void close() {
    stop();
  }
}
