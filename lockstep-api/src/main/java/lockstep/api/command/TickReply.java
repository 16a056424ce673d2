package lockstep.api.command;

/** Messages the coordination loop sends back to a single member. */
public sealed interface TickReply permits TickReply.SelfId, TickReply.Tick {

  /** The id assigned on registration. */
  record SelfId(long memberId) implements TickReply {}

  /** The member may proceed with step {@code step}. */
  record Tick(long step) implements TickReply {}
}
