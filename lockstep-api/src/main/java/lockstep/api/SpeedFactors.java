package lockstep.api;

/**
 * Arithmetic on speed factors. A member with speed factor {@code k} is due on every step whose
 * number is a multiple of {@code k}.
 */
public final class SpeedFactors {

  private SpeedFactors() {}

  /**
   * @return {@code speedFactor}, or 1 when it is zero or negative
   */
  public static int normalize(int speedFactor) {
    return speedFactor < 1 ? 1 : speedFactor;
  }

  /**
   * Whether a member with the given speed factor participates in {@code step}.
   *
   * <p>The step counter is unsigned and wraps modulo 2<sup>64</sup>, so {@code step} is read as an
   * unsigned value.
   *
   * @param step the step number, read as unsigned
   * @param speedFactor the member's speed factor, normalized before use
   */
  public static boolean isDue(long step, int speedFactor) {
    return Long.remainderUnsigned(step, normalize(speedFactor)) == 0;
  }
}
