package lockstep.test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import lockstep.api.Cadence;
import lockstep.api.MemberState;
import lockstep.api.TickManager;
import lockstep.api.TickMember;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

public class MemberStateTest extends BaseTest {

  @Test
  @Timeout(10)
  @DisplayName("a HIDDEN member is released with the others but never holds a step back")
  public void hiddenMemberDoesNotBlock() throws InterruptedException {
    TickManager manager = newManager(Cadence.fps(100));
    TickMember active = newMember(manager, 1);
    TickMember hidden = newMember(manager, 1);
    hidden.setState(MemberState.HIDDEN);

    for (int i = 0; i < 5; i++) {
      active.waitForTick();
    }

    assertThat(manager.member(hidden.getId()).orElseThrow())
        .satisfies(
            snapshot -> {
              assertThat(snapshot.state()).isEqualTo(MemberState.HIDDEN);
              assertThat(snapshot.ticksDelivered()).isGreaterThanOrEqualTo(5);
            });
  }

  @Test
  @Timeout(10)
  public void repeatedStateChangesAreIdempotent() throws InterruptedException {
    TickManager manager = newManager(Cadence.fps(100));
    TickMember member = newMember(manager, 1);

    member.setState(MemberState.FINISHED);
    member.setState(MemberState.FINISHED);
    member.waitForTick();
    member.setState(MemberState.HIDDEN);
    member.setState(MemberState.HIDDEN);

    await()
        .atMost(Duration.ofSeconds(2))
        .untilAsserted(
            () ->
                assertThat(manager.member(member.getId()).orElseThrow().state())
                    .isEqualTo(MemberState.HIDDEN));
    assertThat(manager.members()).hasSize(1);
  }

  @Test
  @Timeout(10)
  @DisplayName("a member that stops waiting holds back every step it is due on")
  public void runningMemberHoldsTheGate() throws InterruptedException {
    TickManager manager = newManager(Cadence.fps(100));
    TickMember member = newMember(manager, 1);

    long step = member.waitForTick();
    Thread.sleep(100);

    assertThat(manager.currentStep()).isEqualTo(step);
    assertThat(manager.member(member.getId()).orElseThrow().state())
        .isEqualTo(MemberState.RUNNING);
  }

  @Test
  @Timeout(10)
  @DisplayName("a member that was HIDDEN waits for a new step instead of returning an old tick")
  public void waitAfterHiddenBlocksForNextStep() throws InterruptedException {
    TickManager manager = newManager(Cadence.fps(100));
    TickMember member = newMember(manager, 1);
    member.setState(MemberState.HIDDEN);
    await().atMost(Duration.ofSeconds(2)).until(() -> manager.currentStep() >= 10);

    long before = manager.currentStep();
    long step = member.waitForTick();

    assertThat(step).isGreaterThanOrEqualTo(before);
  }

  @Test
  @Timeout(10)
  @DisplayName("a tick landing after an interrupted wait does not let the member pass a held gate")
  public void interruptedWaitLeavesNoTickBehind() throws Exception {
    TickManager manager = newManager(Cadence.fps(100));
    TickMember member = newMember(manager, 1);
    TickMember blocker = newMember(manager, 1);

    Future<Long> interrupted = workers.submit(member::waitForTick);
    await()
        .atMost(Duration.ofSeconds(2))
        .untilAsserted(
            () ->
                assertThat(manager.member(member.getId()).orElseThrow().state())
                    .isEqualTo(MemberState.FINISHED));
    interrupted.cancel(true);
    assertThatThrownBy(interrupted::get).isInstanceOf(CancellationException.class);
    long beforeRelease = manager.currentStep();

    // the member is still FINISHED, so hiding the blocker releases one step into its slot
    blocker.setState(MemberState.HIDDEN);
    await().atMost(Duration.ofSeconds(2)).until(() -> manager.currentStep() > beforeRelease);
    blocker.setState(MemberState.RUNNING);
    await()
        .atMost(Duration.ofSeconds(2))
        .untilAsserted(
            () ->
                assertThat(manager.member(blocker.getId()).orElseThrow().state())
                    .isEqualTo(MemberState.RUNNING));
    long held = manager.currentStep();

    Future<Long> next = workers.submit(member::waitForTick);
    Thread.sleep(200);
    assertThat(next).isNotDone();

    blocker.setState(MemberState.FINISHED);
    assertThat(next.get(2, TimeUnit.SECONDS)).isGreaterThan(held);
  }
}
