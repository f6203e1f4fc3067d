package ca.gc.cra.strata.infrastructure.concurrency;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class MemoryAwareConcurrencyPolicyTest {
  private static final long GIB = 1024L * 1024L * 1024L;

  @Test
  void permitsScaleWithHeap() {
    assertEquals(50, MemoryAwareConcurrencyPolicy.permitsFor(GIB));
    assertEquals(100, MemoryAwareConcurrencyPolicy.permitsFor(2 * GIB));
    assertEquals(250, MemoryAwareConcurrencyPolicy.permitsFor(6 * GIB));
    assertEquals(500, MemoryAwareConcurrencyPolicy.permitsFor(16 * GIB));
  }

  @Test
  void unknownHeapUsesDefaultPermits() {
    assertEquals(100, MemoryAwareConcurrencyPolicy.permitsFor(Long.MAX_VALUE));
    assertEquals(100, MemoryAwareConcurrencyPolicy.permitsFor(0));
  }

  @Test
  void workersAreClampedAndPermitsComeFromSupplier() {
    MemoryAwareConcurrencyPolicy policy = new MemoryAwareConcurrencyPolicy(0, () -> 4 * GIB);

    assertEquals(1, policy.workerCount());
    assertEquals(250, policy.permitCount());
  }
}
