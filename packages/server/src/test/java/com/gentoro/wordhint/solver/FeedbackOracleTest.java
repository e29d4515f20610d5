package com.gentoro.wordhint.solver;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class FeedbackOracleTest {

  @Test
  void marksExactAndMisplacedLetters() {
    FeedbackOracle oracle = new FeedbackOracle("crane");
    assertEquals("cccac", oracle.feedbackFor("crate"));
    assertEquals("accwc", oracle.feedbackFor("trace"));
    assertEquals("ccccc", oracle.feedbackFor("crane"));
  }

  @Test
  void repeatedGuessLetterOnlyConsumesAvailableOccurrences() {
    FeedbackOracle oracle = new FeedbackOracle("steal");
    assertEquals("waaaa", oracle.feedbackFor("eerie"));
  }

  @Test
  void exactMatchesAreCountedBeforeMisplacedOnes() {
    // the single e of "crane" is matched at position 4, so the first e is absent
    assertEquals("aaaac", new FeedbackOracle("crane").feedbackFor("eeeee"));
  }

  @Test
  void solvedOnlyByTheTarget() {
    FeedbackOracle oracle = new FeedbackOracle("Crane");
    assertEquals("crane", oracle.target());
    assertTrue(oracle.isSolvedBy("crane"));
    assertFalse(oracle.isSolvedBy("crate"));
  }
}
