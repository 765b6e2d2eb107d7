package io.forgecascade.governance.electorate;

/** Trust score to voting weight: {@code (trust / 100) ^ 1.5}. */
public final class VotingWeights {

  public static final int MAX_TRUST_SCORE = 100;

  private VotingWeights() {}

  public static double fromTrustScore(int trustScore) {
    if (trustScore < 0 || trustScore > MAX_TRUST_SCORE) {
      throw new IllegalArgumentException("Trust score out of range: " + trustScore);
    }
    return Math.pow(trustScore / 100.0, 1.5);
  }
}
