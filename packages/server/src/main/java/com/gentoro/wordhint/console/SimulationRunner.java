package com.gentoro.wordhint.console;

import com.gentoro.wordhint.exception.ConfigException;
import com.gentoro.wordhint.logging.LoggingService;
import com.gentoro.wordhint.solver.FeedbackOracle;
import com.gentoro.wordhint.solver.GuessOutcome;
import com.gentoro.wordhint.solver.SolverSession;
import java.io.PrintStream;

/**
 * Plays one game against a known target word, answering each suggestion with honest feedback from
 * {@link FeedbackOracle}.
 */
public class SimulationRunner {
  private static final org.slf4j.Logger log = LoggingService.getLogger(SimulationRunner.class);

  private final SolverSession session;
  private final int maxTurns;

  public SimulationRunner(SolverSession session, int maxTurns) {
    if (maxTurns < 1) {
      throw new ConfigException("solver.simulate.max-turns must be positive: " + maxTurns);
    }
    this.session = session;
    this.maxTurns = maxTurns;
  }

  /**
   * @return the number of guesses needed, or {@code -1} when the target was not found within the
   *     turn limit or the candidates ran out
   */
  public int run(String target, PrintStream out) {
    if (target == null || target.isBlank()) {
      throw new ConfigException("simulate mode requires --target=<word>");
    }
    FeedbackOracle oracle = new FeedbackOracle(target.trim());
    GuessOutcome outcome = session.reset(oracle.target().charAt(0));

    for (int turn = 1; turn <= maxTurns; turn++) {
      if (outcome.status() == GuessOutcome.Status.NO_CANDIDATES) {
        out.println("No candidates left after " + (turn - 1) + " guess(es)");
        log.warn("Simulation for '{}' ran out of candidates", oracle.target());
        return -1;
      }
      String guess = outcome.word();
      if (oracle.isSolvedBy(guess)) {
        out.printf("Turn %d: %s - solved%n", turn, guess);
        return turn;
      }
      String feedback = oracle.feedbackFor(guess);
      out.printf("Turn %d: %s -> %s (%d candidates)%n", turn, guess, feedback, outcome.remaining());
      outcome = session.applyFeedback(guess, feedback);
    }
    out.println("Gave up after " + maxTurns + " guesses");
    log.warn("Simulation for '{}' did not finish within {} turns", oracle.target(), maxTurns);
    return -1;
  }
}
