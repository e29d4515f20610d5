package com.gentoro.wordhint.solver;

/** What a clue says about its letter at one position of the target word. */
public enum Verdict {
  /** The letter is at this position. */
  MATCH,
  /** The letter is not at this position. It may still occur elsewhere. */
  ABSENT,
  /** Nothing is known about this position yet. */
  PRESENT_ELSEWHERE_ALLOWED
}
