package lockstep.api.command;

/**
 * The loop-facing end of a member's reply channel. Sends never block: the channel holds at most
 * one undelivered reply.
 */
public interface ReplyChannel {

  /**
   * Hands a reply to the member without blocking.
   *
   * @return false if the channel is closed or its slot is still occupied
   */
  boolean offer(TickReply reply);

  /**
   * @return true once the member has abandoned the channel; its registration may then be dropped
   */
  boolean isClosed();
}
