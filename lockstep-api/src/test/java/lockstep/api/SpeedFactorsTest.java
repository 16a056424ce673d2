package lockstep.api;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SpeedFactorsTest {

  @Test
  void normalizesZeroAndNegativeToOne() {
    assertThat(SpeedFactors.normalize(0)).isEqualTo(1);
    assertThat(SpeedFactors.normalize(-4)).isEqualTo(1);
    assertThat(SpeedFactors.normalize(1)).isEqualTo(1);
    assertThat(SpeedFactors.normalize(7)).isEqualTo(7);
  }

  @Test
  void memberIsDueOnMultiplesOfItsFactor() {
    assertThat(SpeedFactors.isDue(1, 1)).isTrue();
    assertThat(SpeedFactors.isDue(1, 2)).isFalse();
    assertThat(SpeedFactors.isDue(2, 2)).isTrue();
    assertThat(SpeedFactors.isDue(99, 100)).isFalse();
    assertThat(SpeedFactors.isDue(100, 100)).isTrue();
    assertThat(SpeedFactors.isDue(5, 0)).isTrue();
  }

  @Test
  @DisplayName("steps beyond Long.MAX_VALUE are treated as unsigned")
  void usesUnsignedArithmeticAfterWrap() {
    long twoToThe63 = Long.MIN_VALUE;
    assertThat(SpeedFactors.isDue(twoToThe63, 2)).isTrue();
    assertThat(SpeedFactors.isDue(twoToThe63, 4)).isTrue();
    assertThat(SpeedFactors.isDue(twoToThe63, 3)).isFalse();

    // 2^64 - 1 = 3 * 5 * 17 * 257 * 641 * 65537 * 6700417, while signed -1 % 3 == -1
    long maxUnsigned = -1L;
    assertThat(SpeedFactors.isDue(maxUnsigned, 3)).isTrue();
    assertThat(SpeedFactors.isDue(maxUnsigned, 5)).isTrue();
    assertThat(SpeedFactors.isDue(maxUnsigned, 2)).isFalse();

    // wrapping to 0 makes every member due
    assertThat(SpeedFactors.isDue(maxUnsigned + 1, 7)).isTrue();
  }
}
