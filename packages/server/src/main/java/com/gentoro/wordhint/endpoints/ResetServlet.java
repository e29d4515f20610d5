package com.gentoro.wordhint.endpoints;

import com.gentoro.wordhint.exception.FeedbackValidationException;
import com.gentoro.wordhint.exception.WordHintException;
import com.gentoro.wordhint.logging.LoggingService;
import com.gentoro.wordhint.solver.GuessOutcome;
import com.gentoro.wordhint.solver.SolverSession;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/** GET {ctx}/reset/{letter} - starts a new session anchored on the first letter. */
public final class ResetServlet extends HttpServlet {
  private static final org.slf4j.Logger log = LoggingService.getLogger(ResetServlet.class);

  private final transient SolverSession session;

  public ResetServlet(SolverSession session) {
    this.session = session;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String letter = req.getPathInfo();
    if (letter == null || letter.length() <= 1) {
      resp.sendError(400, "Missing letter");
      return;
    }
    letter = letter.substring(1);

    try {
      if (letter.length() != 1) {
        throw FeedbackValidationException.lengthMismatch("letter", letter, 1);
      }
      GuessOutcome outcome = session.reset(letter.charAt(0));
      log.info("Session reset on '{}': {}", letter, outcome);
      JsonResponses.send(resp, 200, JsonResponses.outcome(outcome));
    } catch (WordHintException e) {
      log.debug("Rejected reset request: {}", e.getMessage());
      JsonResponses.send(resp, 400, JsonResponses.error(e));
    } catch (Exception e) {
      log.error("Failed to reset session", e);
      JsonResponses.send(resp, 500, JsonResponses.error(e));
    }
  }
}
