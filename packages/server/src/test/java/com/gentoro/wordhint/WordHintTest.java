package com.gentoro.wordhint;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.wordhint.exception.ConfigException;
import com.gentoro.wordhint.exception.DictionaryException;
import com.gentoro.wordhint.exception.StateException;
import com.gentoro.wordhint.solver.GuessPoolMode;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WordHintTest {

  @TempDir Path temp;

  private Path config(String yaml) throws Exception {
    return Files.writeString(temp.resolve("application.yaml"), yaml);
  }

  @Test
  void configurationRequiresInitialize() {
    assertThrows(StateException.class, () -> new WordHint(new String[0]).configuration());
  }

  @Test
  void simulateModeRunsAndShutsDown() throws Exception {
    Path config =
        config(
            "dictionary:\n  location: classpath:dictionary/words.txt\n"
                + "solver:\n  guess-pool: narrowing\n");
    WordHint app =
        new WordHint(new String[] {"--mode=simulate", "--target=crane", "--config=" + config});

    app.initialize();

    assertEquals("simulate", app.mode());
    assertEquals(GuessPoolMode.NARROWING, app.session().guessPoolMode());
    assertNull(app.httpServer());
    // returns at once, the simulation already shut the application down
    app.waitShutdownSignal();
  }

  @Test
  void serverModeServesHealth() throws Exception {
    Path config = config("http:\n  port: 0\n  hostname: 127.0.0.1\n");
    WordHint app = new WordHint(new String[] {"--config=" + config});
    try {
      app.initialize();
      assertTrue(app.httpServer().isRunning());

      HttpResponse<String> resp =
          HttpClient.newHttpClient()
              .send(
                  HttpRequest.newBuilder(
                          URI.create("http://127.0.0.1:" + app.httpServer().getPort() + "/health"))
                      .GET()
                      .build(),
                  HttpResponse.BodyHandlers.ofString());
      assertEquals(200, resp.statusCode());
      assertTrue(resp.body().contains("\"guessPool\":\"FIXED\""));
    } finally {
      app.shutdown();
    }
    assertFalse(app.httpServer().isRunning());
  }

  @Test
  void invalidModeIsRejected() throws Exception {
    WordHint app = new WordHint(new String[] {"--mode=batch", "--config=" + config("{}\n")});
    assertThrows(ConfigException.class, app::initialize);
  }

  @Test
  void missingDictionaryFailsStartup() throws Exception {
    Path config = config("dictionary:\n  location: " + temp.resolve("none.txt") + "\n");
    WordHint app = new WordHint(new String[] {"--mode=simulate", "--config=" + config});
    assertThrows(DictionaryException.class, app::initialize);
  }

  @Test
  void invalidGuessPoolIsRejected() throws Exception {
    Path config = config("solver:\n  guess-pool: random\n");
    WordHint app = new WordHint(new String[] {"--mode=simulate", "--config=" + config});
    assertThrows(ConfigException.class, app::initialize);
  }
}
