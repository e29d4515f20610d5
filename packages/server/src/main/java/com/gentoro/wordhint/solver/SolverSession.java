package com.gentoro.wordhint.solver;

import com.gentoro.wordhint.logging.LoggingService;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;

/**
 * The solver's single mutable session: the full dictionary, the answers still consistent with all
 * feedback, and the pool of words the next guess is picked from.
 *
 * <p>Every public operation runs to completion while holding the session monitor, so concurrent
 * callers observe either the state before or after a call, never a partially filtered one. The
 * source dictionary is never modified.
 */
public final class SolverSession {
  private static final Logger log = LoggingService.getLogger(SolverSession.class);

  private final Object lock = new Object();
  private final CandidateSet source;
  private final GuessPoolMode guessPoolMode;
  private CandidateSet answers = CandidateSet.empty();
  private CandidateSet guessPool = CandidateSet.empty();

  public SolverSession(CandidateSet source, GuessPoolMode guessPoolMode) {
    this.source = Objects.requireNonNull(source, "source").copy();
    this.guessPoolMode = Objects.requireNonNull(guessPoolMode, "guessPoolMode");
  }

  public SolverSession(CandidateSet source) {
    this(source, GuessPoolMode.FIXED);
  }

  /**
   * Starts over with every dictionary word that begins with {@code seedLetter}. The guess pool is
   * re-seeded from the same words.
   */
  public GuessOutcome reset(char seedLetter) {
    char letter = FeedbackCodec.normalizeLetter(seedLetter);
    synchronized (lock) {
      CandidateSet seeded = source.copy();
      seeded.filter(Clue.firstLetter(letter));
      answers = seeded;
      guessPool = seeded.copy();
      log.debug("Session reset on '{}': {} candidate(s)", letter, answers.size());
      return nextGuessLocked();
    }
  }

  /**
   * Narrows the answers with the feedback received for {@code guess} and suggests the next word.
   * Input is validated before the session is touched.
   */
  public GuessOutcome applyFeedback(String guess, String feedback) {
    List<Clue> clues = FeedbackCodec.decode(guess, feedback);
    synchronized (lock) {
      int before = answers.size();
      for (Clue clue : clues) {
        answers.filter(clue);
        if (guessPoolMode == GuessPoolMode.NARROWING) {
          guessPool.filter(clue);
        }
      }
      log.debug(
          "Applied feedback '{}' for '{}': {} -> {} candidate(s)",
          feedback,
          guess,
          before,
          answers.size());
      return nextGuessLocked();
    }
  }

  public GuessOutcome nextGuess() {
    synchronized (lock) {
      return nextGuessLocked();
    }
  }

  private GuessOutcome nextGuessLocked() {
    if (answers.isEmpty()) {
      return GuessOutcome.noCandidates();
    }
    if (answers.size() == 1) {
      return GuessOutcome.solved(answers.words().get(0).value());
    }
    LetterFrequency frequency = answers.charFrequency();
    CandidateWord best = guessPool.rankBest(frequency);
    return GuessOutcome.guess(best.value(), answers.size());
  }

  public int remaining() {
    synchronized (lock) {
      return answers.size();
    }
  }

  public int dictionarySize() {
    return source.size();
  }

  public GuessPoolMode guessPoolMode() {
    return guessPoolMode;
  }

  /** Copy of the current answers. */
  public CandidateSet answers() {
    synchronized (lock) {
      return answers.copy();
    }
  }

  /** Copy of the current guess pool. */
  public CandidateSet guessPool() {
    synchronized (lock) {
      return guessPool.copy();
    }
  }
}
