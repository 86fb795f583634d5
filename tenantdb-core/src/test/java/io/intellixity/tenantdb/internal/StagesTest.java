package io.intellixity.tenantdb.internal;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

final class StagesTest {
  @Test
  void loopRunsInOrderAndStopsAtFirstFailure() {
    List<String> seen = new ArrayList<>();
    CompletableFuture<Void> f = Stages.loop(List.of("a", "b", "c"), (item, i) -> {
      seen.add(i + ":" + item);
      if (item.equals("b")) return Stages.failed(new IllegalStateException("b failed"));
      return Stages.voidFuture();
    });
    CompletionException e = assertThrows(CompletionException.class, f::join);
    assertTrue(Stages.unwrap(e) instanceof IllegalStateException);
    assertEquals(List.of("0:a", "1:b"), seen);
  }

  @Test
  void loopTurnsThrowsIntoFailedStages() {
    CompletableFuture<Void> f = Stages.loop(List.of(1), (item, i) -> {
      throw new IllegalArgumentException("sync");
    });
    assertTrue(f.isCompletedExceptionally());
  }
}
