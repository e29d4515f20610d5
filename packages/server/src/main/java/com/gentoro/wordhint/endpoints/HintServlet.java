package com.gentoro.wordhint.endpoints;

import com.gentoro.wordhint.exception.WordHintException;
import com.gentoro.wordhint.logging.LoggingService;
import com.gentoro.wordhint.solver.GuessOutcome;
import com.gentoro.wordhint.solver.SolverSession;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/**
 * GET {ctx}/hint/{guess}/{feedback}
 *
 * <p>Applies the feedback received for a guess and returns the next suggestion.
 */
public final class HintServlet extends HttpServlet {
  private static final org.slf4j.Logger log = LoggingService.getLogger(HintServlet.class);

  private final transient SolverSession session;

  public HintServlet(SolverSession session) {
    this.session = session;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String path = req.getPathInfo();
    String[] segments = path == null ? new String[0] : path.substring(1).split("/", -1);
    if (segments.length != 2 || segments[0].isEmpty() || segments[1].isEmpty()) {
      resp.sendError(400, "Expected /hint/{guess}/{feedback}");
      return;
    }

    try {
      GuessOutcome outcome = session.applyFeedback(segments[0], segments[1]);
      log.info("Feedback '{}' for '{}': {}", segments[1], segments[0], outcome);
      JsonResponses.send(resp, 200, JsonResponses.outcome(outcome));
    } catch (WordHintException e) {
      log.debug("Rejected hint request: {}", e.getMessage());
      JsonResponses.send(resp, 400, JsonResponses.error(e));
    } catch (Exception e) {
      log.error("Failed to apply feedback", e);
      JsonResponses.send(resp, 500, JsonResponses.error(e));
    }
  }
}
