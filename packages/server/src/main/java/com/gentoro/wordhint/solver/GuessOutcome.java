package com.gentoro.wordhint.solver;

/**
 * Result of asking the session for its next move.
 *
 * @param status what kind of answer this is
 * @param word the suggested or determined word; {@code null} for {@link Status#NO_CANDIDATES}
 * @param remaining number of words still consistent with every clue applied so far
 */
public record GuessOutcome(Status status, String word, int remaining) {

  public enum Status {
    /** Several answers remain; {@code word} is the suggested next guess. */
    GUESS,
    /** Exactly one answer remains and {@code word} is it. */
    SOLVED,
    /** No dictionary word is consistent with the feedback received. */
    NO_CANDIDATES
  }

  public static GuessOutcome guess(String word, int remaining) {
    return new GuessOutcome(Status.GUESS, word, remaining);
  }

  public static GuessOutcome solved(String word) {
    return new GuessOutcome(Status.SOLVED, word, 1);
  }

  public static GuessOutcome noCandidates() {
    return new GuessOutcome(Status.NO_CANDIDATES, null, 0);
  }

  public boolean isTerminal() {
    return status != Status.GUESS;
  }
}
