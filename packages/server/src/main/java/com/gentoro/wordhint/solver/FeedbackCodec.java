package com.gentoro.wordhint.solver;

import com.gentoro.wordhint.exception.FeedbackValidationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;

/**
 * Turns a guess and its per-position feedback codes into one {@link Clue} per distinct guessed
 * letter, in ascending letter order.
 *
 * <p>Feedback codes:
 *
 * <ul>
 *   <li>{@code c} - the letter is at this position
 *   <li>{@code w} - the letter is in the word, at another position
 *   <li>{@code a}, {@code x} or {@code -} - no further occurrence of the letter
 * </ul>
 *
 * <p>Both "wrong position" and "absent" put {@link Verdict#ABSENT} on the reported position; they
 * differ only in how the remaining positions and the occurrence count are derived. The occurrence
 * count is {@code correct + (wrongPlace > 0 ? 1 : 0)}, a lower bound that does not try to recover
 * the exact multiplicity of a letter reported "wrong position" more than once.
 */
public final class FeedbackCodec {

  public static final char CORRECT = 'c';
  public static final char WRONG_PLACE = 'w';
  public static final String ABSENT_CODES = "ax-";

  private FeedbackCodec() {}

  /**
   * Validates both inputs and decodes them into clues. Nothing is decoded when validation fails.
   *
   * @throws FeedbackValidationException when a string has the wrong length, the guess holds a
   *     character outside {@code a-z}, or the feedback holds an unknown code
   */
  public static List<Clue> decode(String guess, String feedback) {
    String word = normalizeGuess(guess);
    String codes = normalizeFeedback(feedback);

    TreeSet<Character> letters = new TreeSet<>();
    for (int i = 0; i < word.length(); i++) {
      letters.add(word.charAt(i));
    }

    List<Clue> clues = new ArrayList<>(letters.size());
    for (char letter : letters) {
      clues.add(decodeLetter(letter, word, codes));
    }
    return clues;
  }

  private static Clue decodeLetter(char letter, String word, String codes) {
    Clue.Builder builder = Clue.builder(letter);
    int correct = 0;
    int wrongPlace = 0;
    int wrong = 0;

    for (int i = 0; i < word.length(); i++) {
      if (word.charAt(i) != letter) continue;
      char code = codes.charAt(i);
      if (code == CORRECT) {
        correct++;
        builder.verdict(i, Verdict.MATCH);
      } else if (code == WRONG_PLACE) {
        wrongPlace++;
        builder.verdict(i, Verdict.ABSENT);
      } else {
        wrong++;
        builder.verdict(i, Verdict.ABSENT);
      }
    }

    // An occurrence reported absent rules the letter out of every position not yet decided.
    Verdict undecided = wrong > 0 ? Verdict.ABSENT : Verdict.PRESENT_ELSEWHERE_ALLOWED;
    return builder.minOccurrences(correct + (wrongPlace > 0 ? 1 : 0)).build(undecided);
  }

  /** Lowercases and validates a guessed word. */
  public static String normalizeGuess(String guess) {
    String word = requireLength("guess", guess);
    for (int i = 0; i < word.length(); i++) {
      char c = word.charAt(i);
      if (!isLetter(c)) {
        throw FeedbackValidationException.invalidCharacter("guess", guess, c);
      }
    }
    return word;
  }

  /** Lowercases and validates a feedback code string. */
  public static String normalizeFeedback(String feedback) {
    String codes = requireLength("feedback", feedback);
    for (int i = 0; i < codes.length(); i++) {
      char c = codes.charAt(i);
      if (c != CORRECT && c != WRONG_PLACE && ABSENT_CODES.indexOf(c) < 0) {
        throw FeedbackValidationException.invalidCharacter("feedback", feedback, c);
      }
    }
    return codes;
  }

  /** Lowercases and validates a single seed letter. */
  public static char normalizeLetter(char letter) {
    char c = Character.toLowerCase(letter);
    if (!isLetter(c)) {
      throw FeedbackValidationException.invalidCharacter("letter", String.valueOf(letter), letter);
    }
    return c;
  }

  private static String requireLength(String field, String value) {
    if (value == null || value.length() != CandidateWord.WORD_LENGTH) {
      throw FeedbackValidationException.lengthMismatch(field, value, CandidateWord.WORD_LENGTH);
    }
    return value.toLowerCase(Locale.ROOT);
  }

  static boolean isLetter(char c) {
    return c >= 'a' && c <= 'z';
  }
}
