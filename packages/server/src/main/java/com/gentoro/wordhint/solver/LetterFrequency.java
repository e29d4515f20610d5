package com.gentoro.wordhint.solver;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

/**
 * Positional letter counts over a {@link CandidateSet}: for each letter, how many words hold it at
 * each position. Letters that never occur read as all zeros.
 */
public final class LetterFrequency {
  private final Map<Character, int[]> counts = new HashMap<>();

  void increment(char letter, int position) {
    counts.computeIfAbsent(letter, k -> new int[CandidateWord.WORD_LENGTH])[position]++;
  }

  void zero(char letter) {
    int[] row = counts.get(letter);
    if (row != null) {
      Arrays.fill(row, 0);
    }
  }

  public int count(char letter, int position) {
    int[] row = counts.get(letter);
    return row == null ? 0 : row[position];
  }

  /** Copy of the per-position counts for {@code letter}. */
  public int[] counts(char letter) {
    int[] row = counts.get(letter);
    return row == null ? new int[CandidateWord.WORD_LENGTH] : row.clone();
  }
}
