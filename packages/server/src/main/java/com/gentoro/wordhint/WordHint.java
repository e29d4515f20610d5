package com.gentoro.wordhint;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.FileAppender;
import com.gentoro.wordhint.console.InteractiveConsole;
import com.gentoro.wordhint.console.SimulationRunner;
import com.gentoro.wordhint.dictionary.DictionaryLoader;
import com.gentoro.wordhint.endpoints.SolverServer;
import com.gentoro.wordhint.exception.ConfigException;
import com.gentoro.wordhint.exception.ExceptionUtil;
import com.gentoro.wordhint.exception.NetworkException;
import com.gentoro.wordhint.exception.StateException;
import com.gentoro.wordhint.http.EmbeddedJettyServer;
import com.gentoro.wordhint.logging.LoggingService;
import com.gentoro.wordhint.solver.CandidateSet;
import com.gentoro.wordhint.solver.GuessPoolMode;
import com.gentoro.wordhint.solver.SolverSession;
import java.io.File;
import java.util.Iterator;
import java.util.Locale;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;

/**
 * Application root. Loads configuration and the dictionary, creates the solver session and, in
 * server mode, exposes it over HTTP.
 */
public class WordHint {

  private static final org.slf4j.Logger log = LoggingService.getLogger(WordHint.class);

  static final String DEFAULT_DICTIONARY = "classpath:dictionary/words.txt";

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private EmbeddedJettyServer httpServer;
  private SolverSession session;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public WordHint(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    LoggingService.applyConfiguration(configuration());
    log.debug("Startup parameters: {}", startupParameters.asMap());

    String mode = mode();
    if (!mode.equals("server") && !mode.equals("interactive") && !mode.equals("simulate")) {
      throw new ConfigException("Invalid mode: " + mode);
    }

    // Dictionary load failures are fatal, nothing is served without a word list.
    CandidateSet dictionary =
        DictionaryLoader.load(configuration().getString("dictionary.location", DEFAULT_DICTIONARY));
    GuessPoolMode poolMode =
        GuessPoolMode.fromConfig(configuration().getString("solver.guess-pool", "fixed"));
    this.session = new SolverSession(dictionary, poolMode);
    log.info("Solver ready: {} words, guess pool {}", dictionary.size(), poolMode);

    switch (mode) {
      case "server":
        startHttp();
        break;
      case "interactive":
        configureFileOnlyLogging();
        try {
          new InteractiveConsole(session, System.in, System.out).run();
        } finally {
          shutdown();
        }
        break;
      case "simulate":
        try {
          new SimulationRunner(session, configuration().getInt("solver.simulate.max-turns", 20))
              .run(startupParameters.getParameter("target", String.class), System.out);
        } finally {
          shutdown();
        }
        break;
      default:
        throw new ConfigException("Invalid mode: " + mode);
    }
  }

  private void startHttp() {
    this.httpServer = new EmbeddedJettyServer(configuration());
    httpServer.prepare();
    try {
      new SolverServer(configuration(), session).register(httpServer.getContextHandler());
      httpServer.start();
    } catch (RuntimeException e) {
      shutdown();
      throw ExceptionUtil.rethrowIfUnchecked(
          e, (ex) -> new NetworkException("Could not start http server", ex));
    }
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM termination).
   * Returns immediately when the application already shut down.
   */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "wordhint-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }

    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      try {
        if (httpServer != null) {
          httpServer.close();
        }
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  public String mode() {
    String mode = startupParameters.getParameter("mode", String.class);
    return mode == null ? "server" : mode.trim().toLowerCase(Locale.ROOT);
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("WordHint not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }

  public SolverSession session() {
    return session;
  }

  /**
   * Detach console appenders and log to a file instead, keeping the console free for the
   * interactive prompt. The directory comes from {@code WORDHINT_LOG_DIR}, falling back to {@code
   * ~/.wordhint/logs}.
   */
  private void configureFileOnlyLogging() {
    if (!(org.slf4j.LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
      return;
    }
    ch.qos.logback.classic.Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    for (Iterator<Appender<ILoggingEvent>> it = root.iteratorForAppenders(); it.hasNext(); ) {
      Appender<ILoggingEvent> app = it.next();
      if (app instanceof ConsoleAppender) {
        root.detachAppender(app);
      }
    }

    String logDirEnv = System.getenv("WORDHINT_LOG_DIR");
    File logsDir;
    if (logDirEnv != null && !logDirEnv.isBlank()) {
      logsDir = new File(logDirEnv);
    } else {
      String userHome = System.getProperty("user.home");
      logsDir =
          new File(
              userHome != null ? userHome : System.getProperty("java.io.tmpdir"),
              ".wordhint/logs");
    }
    if (!logsDir.exists() && !logsDir.mkdirs()) {
      log.warn("Could not create log directory {}, file logging disabled", logsDir);
      return;
    }

    PatternLayoutEncoder encoder = new PatternLayoutEncoder();
    encoder.setContext(context);
    encoder.setPattern("%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n");
    encoder.start();

    FileAppender<ILoggingEvent> fileAppender = new FileAppender<>();
    fileAppender.setContext(context);
    fileAppender.setName("FILE");
    fileAppender.setFile(new File(logsDir, "wordhint.log").getPath());
    fileAppender.setEncoder(encoder);
    fileAppender.start();

    root.addAppender(fileAppender);
    log.info("Interactive mode: console logging disabled; file logging enabled at {}", logsDir);
  }
}
