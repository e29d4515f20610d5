package com.gentoro.wordhint.solver;

import java.util.Objects;

/** A dictionary word of {@link #WORD_LENGTH} lowercase letters. Immutable. */
public final class CandidateWord {

  public static final int WORD_LENGTH = 5;

  /** Weight of a letter's frequency at the position the word actually uses it. */
  static final int EXACT_POSITION_WEIGHT = 4;

  private final String word;

  public CandidateWord(String word) {
    Objects.requireNonNull(word, "word");
    if (word.length() != WORD_LENGTH) {
      throw new IllegalArgumentException(
          "Word must have %d letters: '%s'".formatted(WORD_LENGTH, word));
    }
    this.word = word;
  }

  public String value() {
    return word;
  }

  public char charAt(int position) {
    return word.charAt(position);
  }

  /**
   * Whether this word could be the target given {@code clue}. A {@link Verdict#MATCH} position must
   * hold the clue letter, an {@link Verdict#ABSENT} position must not, and the letter must occur
   * at least {@link Clue#minOccurrences()} times.
   */
  public boolean satisfies(Clue clue) {
    char letter = clue.letter();
    int occurrences = 0;
    for (int i = 0; i < WORD_LENGTH; i++) {
      char c = word.charAt(i);
      if (c == letter) {
        occurrences++;
      }
      switch (clue.verdictAt(i)) {
        case MATCH:
          if (c != letter) return false;
          break;
        case ABSENT:
          if (c == letter) return false;
          break;
        default:
          break;
      }
    }
    return occurrences >= clue.minOccurrences();
  }

  /**
   * Greedy information score against the frequency table of the remaining answers. Every distinct
   * letter of the word contributes its count at each position, weighted by {@link
   * #EXACT_POSITION_WEIGHT} where this word places the letter itself.
   */
  public int score(LetterFrequency frequency) {
    int score = 0;
    for (int letter : word.chars().distinct().toArray()) {
      char c = (char) letter;
      for (int i = 0; i < WORD_LENGTH; i++) {
        int count = frequency.count(c, i);
        score += word.charAt(i) == c ? count * EXACT_POSITION_WEIGHT : count;
      }
    }
    return score;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof CandidateWord other)) return false;
    return word.equals(other.word);
  }

  @Override
  public int hashCode() {
    return word.hashCode();
  }

  @Override
  public String toString() {
    return word;
  }
}
