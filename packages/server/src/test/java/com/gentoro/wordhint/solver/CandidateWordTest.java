package com.gentoro.wordhint.solver;

import static com.gentoro.wordhint.solver.Verdict.ABSENT;
import static com.gentoro.wordhint.solver.Verdict.MATCH;
import static com.gentoro.wordhint.solver.Verdict.PRESENT_ELSEWHERE_ALLOWED;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CandidateWordTest {

  private static final Verdict P = PRESENT_ELSEWHERE_ALLOWED;

  @Test
  void matchAtPositionIsSatisfied() {
    CandidateWord crane = new CandidateWord("crane");
    assertTrue(crane.satisfies(Clue.of('a', 1, P, P, MATCH, P, P)));
  }

  @Test
  void absentAtOccupiedPositionIsRejected() {
    CandidateWord crane = new CandidateWord("crane");
    assertFalse(crane.satisfies(Clue.of('a', 1, P, P, ABSENT, P, P)));
  }

  @Test
  void matchRequiresTheLetter() {
    CandidateWord crane = new CandidateWord("crane");
    assertFalse(crane.satisfies(Clue.of('a', 1, MATCH, P, P, P, P)));
  }

  @Test
  @DisplayName("Occurrences below the minimum reject the word even when no position forbids it")
  void minimumOccurrences() {
    CandidateWord level = new CandidateWord("level");
    assertTrue(level.satisfies(Clue.of('e', 2, P, P, P, P, P)));
    assertFalse(level.satisfies(Clue.of('e', 3, P, P, P, P, P)));
    assertFalse(new CandidateWord("crane").satisfies(Clue.of('x', 1, P, P, P, P, P)));
  }

  @Test
  void absentEverywhereAcceptsWordsWithoutTheLetter() {
    Clue noT = Clue.of('t', 0, ABSENT, ABSENT, ABSENT, ABSENT, ABSENT);
    assertTrue(new CandidateWord("crane").satisfies(noT));
    assertFalse(new CandidateWord("crate").satisfies(noT));
  }

  @Test
  @DisplayName("Score weights the word's own positions by four and other positions by one")
  void scoreAgainstFrequencyTable() {
    LetterFrequency freq = new CandidateSet(words("crane", "crate")).charFrequency();

    assertEquals(36, new CandidateWord("crane").score(freq));
    assertEquals(36, new CandidateWord("crate").score(freq));
    // t: 1 (pos 3), r: 8, a: 8, c: 2 (pos 0), e: 8
    assertEquals(27, new CandidateWord("trace").score(freq));
  }

  @Test
  void repeatedLettersAreScoredOnce() {
    LetterFrequency freq = new CandidateSet(words("crane", "crate")).charFrequency();
    // e: 8 (pos 4 own), r: 2 (pos 1), i: 0
    assertEquals(10, new CandidateWord("eerie").score(freq));
  }

  @Test
  void rejectsWrongLength() {
    assertThrows(IllegalArgumentException.class, () -> new CandidateWord("cranes"));
  }

  static List<CandidateWord> words(String... values) {
    return Arrays.stream(values).map(CandidateWord::new).toList();
  }
}
