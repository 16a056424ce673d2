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
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

public class RegistrationTest extends BaseTest {

  @Test
  @Timeout(30)
  @DisplayName("sequential registrations receive ids 0, 1, 2, ... in order")
  public void sequentialIds() {
    TickManager manager = newManager(Cadence.fps(60));

    List<Long> ids = new ArrayList<>();
    for (int i = 0; i < 100; i++) {
      ids.add(newMember(manager, 1).getId());
    }

    assertThat(ids).containsExactlyElementsOf(LongStream.range(0, 100).boxed().toList());
    assertThat(manager.members()).hasSize(100);
  }

  @Test
  @Timeout(30)
  @DisplayName("concurrent registrations receive distinct ids covering 0..N-1")
  public void concurrentIds() throws Exception {
    TickManager manager = newManager(Cadence.fps(60));
    int count = 32;
    CountDownLatch start = new CountDownLatch(1);
    Set<TickMember> joined = ConcurrentHashMap.newKeySet();

    List<Future<?>> futures = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      futures.add(
          workers.submit(
              () -> {
                start.await();
                joined.add(manager.handle().newMember(1));
                return null;
              }));
    }
    start.countDown();
    for (Future<?> future : futures) {
      future.get();
    }

    try {
      assertThat(joined.stream().map(TickMember::getId).collect(Collectors.toSet()))
          .containsExactlyInAnyOrderElementsOf(LongStream.range(0, count).boxed().toList());
    } finally {
      joined.forEach(TickMember::close);
    }
  }

  @Test
  @Timeout(10)
  public void idsAreNotReusedAfterUnregistration() {
    TickManager manager = newManager(Cadence.fps(60));

    TickMember first = newMember(manager, 1);
    first.close();
    TickMember second = newMember(manager, 1);

    assertThat(first.getId()).isZero();
    assertThat(second.getId()).isEqualTo(1);
  }

  @Test
  @Timeout(10)
  public void nonPositiveSpeedFactorIsTreatedAsOne() {
    TickManager manager = newManager(Cadence.fps(60));

    TickMember member = newMember(manager, -4);

    assertThat(member.getSpeedFactor()).isEqualTo(1);
    assertThat(manager.member(member.getId()).orElseThrow().speedFactor()).isEqualTo(1);
  }
}
