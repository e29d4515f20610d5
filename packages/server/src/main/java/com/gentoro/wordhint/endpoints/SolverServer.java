package com.gentoro.wordhint.endpoints;

import com.gentoro.wordhint.exception.ConfigException;
import com.gentoro.wordhint.logging.LoggingService;
import com.gentoro.wordhint.solver.SolverSession;
import org.apache.commons.configuration2.Configuration;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/** Registers the solver servlets under {@code http.solver.context-path}. */
public final class SolverServer {
  private static final org.slf4j.Logger log = LoggingService.getLogger(SolverServer.class);

  private final Configuration configuration;
  private final SolverSession session;

  public SolverServer(Configuration configuration, SolverSession session) {
    this.configuration = configuration;
    this.session = session;
  }

  String contextPath() {
    String contextPath = configuration.getString("http.solver.context-path", "");
    if (contextPath == null) {
      return "";
    }
    contextPath = contextPath.trim();
    if (contextPath.endsWith("/")) {
      contextPath = contextPath.substring(0, contextPath.length() - 1);
    }
    if (!contextPath.isEmpty() && !contextPath.startsWith("/")) {
      throw new ConfigException("Invalid http.solver.context-path: " + contextPath);
    }
    return contextPath;
  }

  public void register(ServletContextHandler ctx) {
    String base = contextPath();
    ctx.addServlet(new ServletHolder(new ResetServlet(session)), "%s/reset/*".formatted(base));
    ctx.addServlet(new ServletHolder(new HintServlet(session)), "%s/hint/*".formatted(base));
    ctx.addServlet(new ServletHolder(new HealthServlet(session)), "%s/health".formatted(base));
    log.info("Solver servlets registered under {}/*", base);
  }
}
