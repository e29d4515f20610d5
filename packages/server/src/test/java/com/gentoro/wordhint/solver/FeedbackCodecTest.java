package com.gentoro.wordhint.solver;

import static com.gentoro.wordhint.solver.Verdict.ABSENT;
import static com.gentoro.wordhint.solver.Verdict.MATCH;
import static com.gentoro.wordhint.solver.Verdict.PRESENT_ELSEWHERE_ALLOWED;
import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.wordhint.exception.FeedbackValidationException;
import com.gentoro.wordhint.exception.WordHintErrorCode;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class FeedbackCodecTest {

  private static final Verdict P = PRESENT_ELSEWHERE_ALLOWED;
  private static final Verdict A = ABSENT;
  private static final Verdict M = MATCH;

  @Test
  @DisplayName("crane / wacwa decodes to one clue per letter in ascending order")
  void decodesCraneExample() {
    List<Clue> clues = FeedbackCodec.decode("crane", "wacwa");

    assertEquals(
        List.of(
            Clue.of('a', 1, P, P, M, P, P),
            Clue.of('c', 1, A, P, P, P, P),
            Clue.of('e', 0, A, A, A, A, A),
            Clue.of('n', 1, P, P, P, A, P),
            Clue.of('r', 0, A, A, A, A, A)),
        clues);
  }

  @Test
  void absentReportResolvesTheLetter() {
    List<Clue> clues = FeedbackCodec.decode("crane", "wacwa");
    assertFalse(clues.get(0).isFullyResolved());
    assertTrue(clues.get(2).isFullyResolved());
    assertTrue(clues.get(4).isFullyResolved());
  }

  @Test
  void repeatedCorrectLettersCountEachOccurrence() {
    List<Clue> clues = FeedbackCodec.decode("level", "ccccc");

    assertEquals(
        List.of(
            Clue.of('e', 2, P, M, P, M, P),
            Clue.of('l', 2, M, P, P, P, M),
            Clue.of('v', 1, P, P, M, P, P)),
        clues);
  }

  @Test
  @DisplayName("Two wrong-place reports for one letter still count as a single occurrence")
  void wrongPlaceCountsOnce() {
    Clue e = FeedbackCodec.decode("eexyz", "wwaaa").get(0);
    assertEquals(Clue.of('e', 1, A, A, P, P, P), e);
  }

  @Test
  @DisplayName("Mixed wrong-place and absent reports rule the letter out of every open position")
  void mixedReportsCloseTheLetter() {
    Clue e = FeedbackCodec.decode("eerie", "waaaa").get(0);
    assertEquals(Clue.of('e', 1, A, A, A, A, A), e);
    assertTrue(e.isFullyResolved());
  }

  @Test
  void acceptsAllAbsentCodes() {
    assertEquals(
        FeedbackCodec.decode("crane", "aaaaa"), FeedbackCodec.decode("crane", "x-axa"));
  }

  @Test
  void normalizesCase() {
    assertEquals(FeedbackCodec.decode("crane", "wacwa"), FeedbackCodec.decode("CRANE", "WACWA"));
  }

  @Test
  void rejectsLengthMismatch() {
    var ex =
        assertThrows(
            FeedbackValidationException.class, () -> FeedbackCodec.decode("cran", "ccccc"));
    assertEquals(WordHintErrorCode.INPUT_LENGTH_MISMATCH, ex.getCode());
    assertEquals(
        WordHintErrorCode.INPUT_LENGTH_MISMATCH,
        assertThrows(
                FeedbackValidationException.class, () -> FeedbackCodec.decode("crane", "cccc"))
            .getCode());
    assertEquals(
        WordHintErrorCode.INPUT_LENGTH_MISMATCH,
        assertThrows(FeedbackValidationException.class, () -> FeedbackCodec.decode(null, "ccccc"))
            .getCode());
  }

  @Test
  void rejectsInvalidCharacters() {
    var guess =
        assertThrows(
            FeedbackValidationException.class, () -> FeedbackCodec.decode("cr4ne", "ccccc"));
    assertEquals(WordHintErrorCode.INVALID_CHARACTER, guess.getCode());
    assertEquals("guess", guess.getContext().get("field"));

    var feedback =
        assertThrows(
            FeedbackValidationException.class, () -> FeedbackCodec.decode("crane", "cccqc"));
    assertEquals(WordHintErrorCode.INVALID_CHARACTER, feedback.getCode());
    assertEquals("feedback", feedback.getContext().get("field"));
  }

  @Test
  void normalizesSeedLetter() {
    assertEquals('c', FeedbackCodec.normalizeLetter('C'));
    assertThrows(FeedbackValidationException.class, () -> FeedbackCodec.normalizeLetter('1'));
  }
}
