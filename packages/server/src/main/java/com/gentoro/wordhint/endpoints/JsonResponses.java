package com.gentoro.wordhint.endpoints;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.wordhint.exception.ErrorDetails;
import com.gentoro.wordhint.exception.ExceptionUtil;
import com.gentoro.wordhint.logging.LoggingService;
import com.gentoro.wordhint.solver.GuessOutcome;
import com.gentoro.wordhint.utility.JacksonUtility;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.Map;

/** JSON bodies shared by the solver servlets. */
final class JsonResponses {
  private static final org.slf4j.Logger log = LoggingService.getLogger(JsonResponses.class);

  private JsonResponses() {}

  static ObjectNode outcome(GuessOutcome outcome) {
    ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
    node.put("status", outcome.status().name());
    if (outcome.word() != null) node.put("word", outcome.word());
    node.put("remaining", outcome.remaining());
    return node;
  }

  static ObjectNode error(Throwable t) {
    ErrorDetails details = ExceptionUtil.toErrorDetails(t);
    ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
    node.put("type", details.type());
    node.put("message", details.message());
    node.put("code", details.code().name());
    if (details.context() != null && !details.context().isEmpty()) {
      ObjectNode context = node.putObject("context");
      for (Map.Entry<String, Object> e : details.context().entrySet()) {
        context.put(e.getKey(), String.valueOf(e.getValue()));
      }
    }
    node.put("timestamp", details.timestamp().toString());
    return node;
  }

  static void send(HttpServletResponse resp, int code, Object body) throws IOException {
    String json = JacksonUtility.toJson(body);
    log.debug("Sending response ({}): {}", code, json);
    resp.setStatus(code);
    resp.setContentType("application/json");
    resp.setCharacterEncoding("UTF-8");
    try (PrintWriter out = resp.getWriter()) {
      out.println(json);
    }
  }
}
