package io.forgecascade.governance.electorate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class VotingWeightsTest {

  @Test
  void fromTrustScore_followsPowerCurve() {
    assertThat(VotingWeights.fromTrustScore(0)).isZero();
    assertThat(VotingWeights.fromTrustScore(100)).isEqualTo(1.0);
    assertThat(VotingWeights.fromTrustScore(25)).isCloseTo(0.125, within(1e-12));
    assertThat(VotingWeights.fromTrustScore(64)).isCloseTo(0.512, within(1e-12));
  }

  @Test
  void fromTrustScore_isMonotonic() {
    for (int trust = 1; trust <= 100; trust++) {
      assertThat(VotingWeights.fromTrustScore(trust))
          .isGreaterThan(VotingWeights.fromTrustScore(trust - 1));
    }
  }

  @Test
  void fromTrustScore_outOfRange_throws() {
    assertThatThrownBy(() -> VotingWeights.fromTrustScore(-1))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> VotingWeights.fromTrustScore(101))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
