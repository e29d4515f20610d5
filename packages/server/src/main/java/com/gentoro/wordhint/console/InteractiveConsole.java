package com.gentoro.wordhint.console;

import com.gentoro.wordhint.exception.WordHintException;
import com.gentoro.wordhint.logging.LoggingService;
import com.gentoro.wordhint.solver.FeedbackCodec;
import com.gentoro.wordhint.solver.GuessOutcome;
import com.gentoro.wordhint.solver.SolverSession;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.Scanner;

/**
 * Console front end: asks for the first letter, then alternates between printing a suggestion
 * and reading the feedback for it until the word is found, no candidates remain, or the user
 * types {@code exit}.
 */
public class InteractiveConsole {
  private static final org.slf4j.Logger log = LoggingService.getLogger(InteractiveConsole.class);

  private final SolverSession session;
  private final InputStream in;
  private final PrintStream out;

  public InteractiveConsole(SolverSession session, InputStream in, PrintStream out) {
    this.session = session;
    this.in = in;
    this.out = out;
  }

  public void run() {
    Scanner scanner = new Scanner(in);
    out.println("Feedback codes: c = right letter, right place; w = right letter, wrong place;");
    out.println("a, x or - = letter not (or no more) in the word. Type 'exit' to quit.");

    GuessOutcome outcome = null;
    while (outcome == null) {
      String input = prompt(scanner, "What is the first letter? ");
      if (input == null) return;
      try {
        outcome = session.reset(input.length() == 1 ? input.charAt(0) : '\0');
      } catch (WordHintException e) {
        out.println("Please type a single letter a-z.");
      }
    }

    while (!outcome.isTerminal()) {
      String guess = outcome.word();
      out.printf("I guess %s (%d candidates left)%n", guess, outcome.remaining());
      String feedback = prompt(scanner, "What is your hint? ");
      if (feedback == null) return;
      try {
        outcome = session.applyFeedback(guess, feedback);
      } catch (WordHintException e) {
        log.debug("Rejected feedback '{}': {}", feedback, e.getMessage());
        out.printf(
            "Could not read that hint: %s. Use %d of %s, %s or %s.%n",
            e.getMessage(),
            guess.length(),
            FeedbackCodec.CORRECT,
            FeedbackCodec.WRONG_PLACE,
            FeedbackCodec.ABSENT_CODES);
      }
    }

    if (outcome.status() == GuessOutcome.Status.SOLVED) {
      out.println("I got it! Your word is: " + outcome.word());
    } else {
      out.println("No more possible words! Did you make a mistake?");
    }
  }

  /** Returns the trimmed line, or {@code null} on end of input or {@code exit}. */
  private String prompt(Scanner scanner, String message) {
    out.print(message);
    if (!scanner.hasNextLine()) {
      return null;
    }
    String line = scanner.nextLine().trim();
    if (line.equalsIgnoreCase("exit")) {
      out.println("Goodbye!");
      return null;
    }
    return line;
  }
}
