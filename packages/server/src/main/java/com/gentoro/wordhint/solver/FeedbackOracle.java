package com.gentoro.wordhint.solver;

/**
 * Produces honest feedback for a guess against a known target, the way a Wordle board colours it:
 * exact positions first, then "wrong position" for letters still unaccounted for in the target,
 * absent for everything else.
 */
public final class FeedbackOracle {
  private final String target;

  public FeedbackOracle(String target) {
    this.target = FeedbackCodec.normalizeGuess(target);
  }

  public String target() {
    return target;
  }

  public String feedbackFor(String guess) {
    String word = FeedbackCodec.normalizeGuess(guess);
    char[] result = new char[CandidateWord.WORD_LENGTH];
    int[] unmatched = new int[26];

    for (int i = 0; i < CandidateWord.WORD_LENGTH; i++) {
      if (word.charAt(i) == target.charAt(i)) {
        result[i] = FeedbackCodec.CORRECT;
      } else {
        unmatched[target.charAt(i) - 'a']++;
      }
    }
    for (int i = 0; i < CandidateWord.WORD_LENGTH; i++) {
      if (result[i] == FeedbackCodec.CORRECT) continue;
      int idx = word.charAt(i) - 'a';
      if (unmatched[idx] > 0) {
        unmatched[idx]--;
        result[i] = FeedbackCodec.WRONG_PLACE;
      } else {
        result[i] = 'a';
      }
    }
    return new String(result);
  }

  public boolean isSolvedBy(String guess) {
    return target.equals(FeedbackCodec.normalizeGuess(guess));
  }
}
