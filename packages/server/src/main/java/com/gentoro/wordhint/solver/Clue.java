package com.gentoro.wordhint.solver;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Everything one feedback report says about a single letter: the minimum number of times it occurs
 * in the target word and a {@link Verdict} for every position.
 *
 * <p>A built clue always holds exactly {@link CandidateWord#WORD_LENGTH} verdicts. Positions that
 * were not decided while the clue was assembled only exist inside {@link Builder}.
 */
public final class Clue {
  private final char letter;
  private final int minOccurrences;
  private final List<Verdict> verdicts;

  private Clue(char letter, int minOccurrences, Verdict[] verdicts) {
    this.letter = letter;
    this.minOccurrences = minOccurrences;
    this.verdicts = Collections.unmodifiableList(Arrays.asList(verdicts));
  }

  /** Creates a clue from explicit verdicts, one per position. */
  public static Clue of(char letter, int minOccurrences, Verdict... verdicts) {
    if (verdicts.length != CandidateWord.WORD_LENGTH) {
      throw new IllegalArgumentException(
          "Expected %d verdicts, got %d".formatted(CandidateWord.WORD_LENGTH, verdicts.length));
    }
    if (minOccurrences < 0) {
      throw new IllegalArgumentException("minOccurrences must not be negative");
    }
    for (Verdict v : verdicts) {
      Objects.requireNonNull(v, "verdict");
    }
    return new Clue(letter, minOccurrences, verdicts.clone());
  }

  /** Clue that pins {@code letter} to the first position and leaves the rest open. */
  public static Clue firstLetter(char letter) {
    return builder(letter)
        .minOccurrences(1)
        .verdict(0, Verdict.MATCH)
        .build(Verdict.PRESENT_ELSEWHERE_ALLOWED);
  }

  public static Builder builder(char letter) {
    return new Builder(letter);
  }

  public char letter() {
    return letter;
  }

  public int minOccurrences() {
    return minOccurrences;
  }

  public List<Verdict> verdicts() {
    return verdicts;
  }

  public Verdict verdictAt(int position) {
    return verdicts.get(position);
  }

  /** True when every position holds a definite {@link Verdict#MATCH} or {@link Verdict#ABSENT}. */
  public boolean isFullyResolved() {
    return !verdicts.contains(Verdict.PRESENT_ELSEWHERE_ALLOWED);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Clue other)) return false;
    return letter == other.letter
        && minOccurrences == other.minOccurrences
        && verdicts.equals(other.verdicts);
  }

  @Override
  public int hashCode() {
    return Objects.hash(letter, minOccurrences, verdicts);
  }

  @Override
  public String toString() {
    return "Clue[letter=" + letter + ", minOccurrences=" + minOccurrences + ", verdicts=" + verdicts
        + "]";
  }

  /**
   * Mutable clue under construction. Slots start empty; {@link #build(Verdict)} fills the empty
   * ones with a single verdict, so an unresolved position never reaches a {@link Clue}.
   */
  public static final class Builder {
    private final char letter;
    private final Verdict[] slots = new Verdict[CandidateWord.WORD_LENGTH];
    private int minOccurrences;

    private Builder(char letter) {
      this.letter = letter;
    }

    public Builder verdict(int position, Verdict verdict) {
      slots[position] = Objects.requireNonNull(verdict, "verdict");
      return this;
    }

    public Builder minOccurrences(int minOccurrences) {
      this.minOccurrences = minOccurrences;
      return this;
    }

    public Clue build(Verdict undecided) {
      Objects.requireNonNull(undecided, "undecided");
      Verdict[] verdicts = slots.clone();
      for (int i = 0; i < verdicts.length; i++) {
        if (verdicts[i] == null) {
          verdicts[i] = undecided;
        }
      }
      return new Clue(letter, minOccurrences, verdicts);
    }
  }
}
