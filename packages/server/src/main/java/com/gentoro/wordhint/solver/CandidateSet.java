package com.gentoro.wordhint.solver;

import com.gentoro.wordhint.exception.StateException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered collection of {@link CandidateWord}s plus the letters whose information is fully
 * determined. Resolved letters stop contributing to {@link #charFrequency()}.
 *
 * <p>Not thread-safe; a set is owned by the {@link SolverSession} holding it.
 */
public final class CandidateSet {
  private final List<CandidateWord> words;
  private final Set<Character> resolvedLetters;

  public CandidateSet(List<CandidateWord> words) {
    this(new ArrayList<>(words), new LinkedHashSet<>());
  }

  private CandidateSet(List<CandidateWord> words, Set<Character> resolvedLetters) {
    this.words = words;
    this.resolvedLetters = resolvedLetters;
  }

  public static CandidateSet empty() {
    return new CandidateSet(List.of());
  }

  /** Independent copy; later filtering or ranking of either set does not affect the other. */
  public CandidateSet copy() {
    return new CandidateSet(new ArrayList<>(words), new LinkedHashSet<>(resolvedLetters));
  }

  /**
   * Drops every word that does not satisfy {@code clue}. A fully resolved clue also marks its
   * letter as resolved.
   */
  public void filter(Clue clue) {
    if (clue.isFullyResolved()) {
      resolvedLetters.add(clue.letter());
    }
    words.removeIf(w -> !w.satisfies(clue));
  }

  /** Positional letter counts over the current words, with resolved letters zeroed. */
  public LetterFrequency charFrequency() {
    LetterFrequency frequency = new LetterFrequency();
    for (CandidateWord word : words) {
      for (int i = 0; i < CandidateWord.WORD_LENGTH; i++) {
        frequency.increment(word.charAt(i), i);
      }
    }
    for (Character letter : resolvedLetters) {
      frequency.zero(letter);
    }
    return frequency;
  }

  /**
   * Orders the words by descending score, keeping the current relative order of equal scores, and
   * returns the first one. Membership is unchanged.
   */
  public CandidateWord rankBest(LetterFrequency frequency) {
    if (words.isEmpty()) {
      throw new StateException("Cannot rank an empty candidate set");
    }
    List<Scored> scored = new ArrayList<>(words.size());
    for (CandidateWord word : words) {
      scored.add(new Scored(word, word.score(frequency)));
    }
    scored.sort(Comparator.comparingInt(Scored::score).reversed());
    for (int i = 0; i < scored.size(); i++) {
      words.set(i, scored.get(i).word());
    }
    return words.get(0);
  }

  public int size() {
    return words.size();
  }

  public boolean isEmpty() {
    return words.isEmpty();
  }

  public boolean contains(String word) {
    return words.stream().anyMatch(w -> w.value().equals(word));
  }

  public List<CandidateWord> words() {
    return Collections.unmodifiableList(words);
  }

  public Set<Character> resolvedLetters() {
    return Collections.unmodifiableSet(resolvedLetters);
  }

  private record Scored(CandidateWord word, int score) {}
}
