package com.gentoro.wordhint.endpoints;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.wordhint.solver.SolverSession;
import com.gentoro.wordhint.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Instant;

/** GET {ctx}/health */
public final class HealthServlet extends HttpServlet {
  private final transient SolverSession session;

  public HealthServlet(SolverSession session) {
    this.session = session;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    ObjectNode response = JacksonUtility.getJsonMapper().createObjectNode();
    response.put("status", "healthy");
    response.put("dictionarySize", session.dictionarySize());
    response.put("remaining", session.remaining());
    response.put("guessPool", session.guessPoolMode().name());
    response.put("timestamp", Instant.now().toString());
    JsonResponses.send(resp, 200, response);
  }
}
