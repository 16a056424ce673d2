package lockstep.api;

/** The readiness of a tick member as seen by the coordination loop. */
public enum MemberState {

  /** Still doing work for the current cycle; holds the gate shut while due. */
  RUNNING,

  /** Done for the current cycle. Reset to {@link #RUNNING} by the next tick it receives. */
  FINISHED,

  /**
   * Permanently ready. The member still receives ticks but never blocks a step, and a tick does not
   * reset it to {@link #RUNNING}.
   */
  HIDDEN;

  /**
   * @return true if a due member in this state lets the gate open
   */
  public boolean isReady() {
    return this != RUNNING;
  }
}
