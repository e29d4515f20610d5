package com.gentoro.wordhint.endpoints;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.wordhint.solver.CandidateSet;
import com.gentoro.wordhint.solver.CandidateWord;
import com.gentoro.wordhint.solver.SolverSession;
import com.gentoro.wordhint.utility.JacksonUtility;
import java.util.Arrays;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.eclipse.jetty.ee10.servlet.ServletTester;
import org.eclipse.jetty.http.HttpTester;
import org.junit.jupiter.api.*;

class SolverServletsTest {

  private ServletTester tester;
  private SolverSession session;

  @BeforeEach
  void setUp() throws Exception {
    session =
        new SolverSession(
            new CandidateSet(
                Arrays.stream(new String[] {"crane", "crate", "caste", "cider", "mound", "plumb"})
                    .map(CandidateWord::new)
                    .toList()));
    tester = new ServletTester();
    tester.addServlet(new ServletHolder(new ResetServlet(session)), "/reset/*");
    tester.addServlet(new ServletHolder(new HintServlet(session)), "/hint/*");
    tester.addServlet(new ServletHolder(new HealthServlet(session)), "/health");
    tester.start();
  }

  @AfterEach
  void tearDown() throws Exception {
    tester.stop();
  }

  private HttpTester.Response get(String uri) throws Exception {
    HttpTester.Request req = HttpTester.newRequest();
    req.setMethod("GET");
    req.setURI(uri);
    req.setVersion("HTTP/1.1");
    req.setHeader("Host", "tester");
    return HttpTester.parseResponse(tester.getResponses(req.generate()));
  }

  private static JsonNode json(HttpTester.Response resp) throws Exception {
    return JacksonUtility.getJsonMapper().readTree(resp.getContent());
  }

  @Test
  void resetReturnsFirstSuggestion() throws Exception {
    HttpTester.Response resp = get("/reset/c");

    assertEquals(200, resp.getStatus());
    assertTrue(resp.get("Content-Type").startsWith("application/json"));
    JsonNode body = json(resp);
    assertEquals("GUESS", body.get("status").asText());
    assertEquals("crate", body.get("word").asText());
    assertEquals(4, body.get("remaining").asInt());
  }

  @Test
  void hintNarrowsUntilSolved() throws Exception {
    get("/reset/c");

    JsonNode body = json(get("/hint/crate/cccac"));

    assertEquals("SOLVED", body.get("status").asText());
    assertEquals("crane", body.get("word").asText());
    assertEquals(1, body.get("remaining").asInt());
  }

  @Test
  void contradictoryFeedbackReportsNoCandidates() throws Exception {
    get("/reset/c");

    JsonNode body = json(get("/hint/crate/cccaa"));

    assertEquals("NO_CANDIDATES", body.get("status").asText());
    assertFalse(body.has("word"));
    assertEquals(0, body.get("remaining").asInt());
  }

  @Test
  void invalidFeedbackIsABadRequest() throws Exception {
    get("/reset/c");

    HttpTester.Response resp = get("/hint/crate/cccq");

    assertEquals(400, resp.getStatus());
    JsonNode body = json(resp);
    assertEquals("INPUT_LENGTH_MISMATCH", body.get("code").asText());
    assertEquals("feedback", body.get("context").get("field").asText());
    assertEquals(4, session.remaining());
  }

  @Test
  void invalidResetLetterIsABadRequest() throws Exception {
    HttpTester.Response resp = get("/reset/7");
    assertEquals(400, resp.getStatus());
    assertEquals("INVALID_CHARACTER", json(resp).get("code").asText());

    resp = get("/reset/ab");
    assertEquals(400, resp.getStatus());
    assertEquals("INPUT_LENGTH_MISMATCH", json(resp).get("code").asText());
  }

  @Test
  void malformedPathsAreRejected() throws Exception {
    assertEquals(400, get("/hint/crate").getStatus());
    assertEquals(400, get("/hint/crate/cccac/extra").getStatus());
    assertEquals(400, get("/reset/").getStatus());
  }

  @Test
  void healthReportsSessionState() throws Exception {
    get("/reset/m");

    HttpTester.Response resp = get("/health");

    assertEquals(200, resp.getStatus());
    JsonNode body = json(resp);
    assertEquals("healthy", body.get("status").asText());
    assertEquals(6, body.get("dictionarySize").asInt());
    assertEquals(1, body.get("remaining").asInt());
    assertEquals("FIXED", body.get("guessPool").asText());
  }
}
