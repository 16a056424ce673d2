package lockstep.test;

import static org.assertj.core.api.Assertions.assertThat;

import lockstep.api.Cadence;
import lockstep.api.TickManager;
import lockstep.api.TickMember;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;
import java.util.stream.LongStream;

public class SpeedFactorTest extends BaseTest {

  @Test
  @Timeout(30)
  @DisplayName("a half-rate member is released on exactly the even steps of a full-rate member")
  public void halfRateMemberAlignsWithFullRateMember() throws Exception {
    TickManager manager = newManager(Cadence.fps(120));
    TickMember full = newMember(manager, 1);
    TickMember half = newMember(manager, 2);

    Future<List<Long>> fullSteps = workers.submit(collectSteps(full, 12));
    Future<List<Long>> halfSteps = workers.submit(collectSteps(half, 6));

    List<Long> fullRun = fullSteps.get();
    List<Long> halfRun = halfSteps.get();

    long first = fullRun.get(0);
    assertThat(fullRun)
        .containsExactlyElementsOf(LongStream.range(first, first + 12).boxed().toList());
    assertThat(halfRun).hasSize(6).allMatch(step -> step % 2 == 0);
    assertThat(fullRun).containsAll(halfRun);
  }

  @Test
  @Timeout(30)
  @DisplayName("a member that is not due never holds back faster members")
  public void slowMemberDoesNotBlockFastMember() throws Exception {
    TickManager manager = newManager(Cadence.fps(60));
    TickMember fast = newMember(manager, 1);
    TickMember slow = newMember(manager, 100);

    List<Long> steps = workers.submit(collectSteps(fast, 8)).get();

    assertThat(steps).hasSize(8).noneMatch(step -> step % 100 == 0);
    assertThat(manager.member(slow.getId()).orElseThrow().ticksDelivered()).isZero();
  }

  private static Callable<List<Long>> collectSteps(TickMember member, int times) {
    return () -> {
      List<Long> steps = new ArrayList<>();
      for (int i = 0; i < times; i++) {
        steps.add(member.waitForTick());
      }
      return steps;
    };
  }
}
