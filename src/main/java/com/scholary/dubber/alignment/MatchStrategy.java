package com.scholary.dubber.alignment;

/** How a clip was brought to its target duration. */
public enum MatchStrategy {
  /** Target too short to hold speech; replaced by silence. */
  SILENCE,
  /** Already within tolerance; only re-encoded. */
  PASS_THROUGH,
  /** Shorter than the target; trailing silence appended. */
  PAD,
  /** Longer than the target; tempo raised, then trimmed. */
  STRETCH,
  /** Too long to stretch; cut at the target. */
  TRIM
}
