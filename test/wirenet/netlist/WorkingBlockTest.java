package wirenet.netlist;

import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import wirenet.frontend.WireVector;

class WorkingBlockTest {

  @Test
  void testUseRestoresPrevious() {
    Block before = WorkingBlock.get();
    var inner = new Block();
    try (var scope = WorkingBlock.use(inner)) {
      Assertions.assertSame(inner, WorkingBlock.get());
      Assertions.assertSame(inner, new WireVector(1).getBlock());
    }
    Assertions.assertSame(before, WorkingBlock.get());
  }

  @Test
  void testNestedScopes() {
    Block before = WorkingBlock.get();
    var outer = new Block();
    var inner = new Block();
    try (var outerScope = WorkingBlock.use(outer)) {
      try (var innerScope = WorkingBlock.use(inner)) {
        Assertions.assertSame(inner, WorkingBlock.get());
      }
      Assertions.assertSame(outer, WorkingBlock.get());
    }
    Assertions.assertSame(before, WorkingBlock.get());
  }

  @Test
  void testScopeCloseIdempotent() {
    Block before = WorkingBlock.get();
    var scope = WorkingBlock.use(new Block());
    scope.close();
    WorkingBlock.set(new Block());
    Block replaced = WorkingBlock.get();
    scope.close();
    Assertions.assertSame(replaced, WorkingBlock.get());
    WorkingBlock.set(before);
  }

  @Test
  void testExplicitBlockPreferred() {
    var explicit = new Block();
    Assertions.assertSame(explicit, WorkingBlock.get(explicit));
    Assertions.assertSame(WorkingBlock.get(), WorkingBlock.get(null));
  }

  @Test
  void testReset() {
    Block before = WorkingBlock.get();
    Block fresh = WorkingBlock.reset();
    Assertions.assertNotSame(before, fresh);
    Assertions.assertSame(fresh, WorkingBlock.get());
    Assertions.assertTrue(fresh.nets().isEmpty());
    WorkingBlock.set(before);
  }

  @Test
  void testPerThread() throws InterruptedException {
    var inner = new Block();
    var seen = new AtomicReference<Block>();
    try (var scope = WorkingBlock.use(inner)) {
      var thread = new Thread(() -> seen.set(WorkingBlock.get()));
      thread.start();
      thread.join();
    }
    Assertions.assertNotNull(seen.get());
    Assertions.assertNotSame(inner, seen.get());
  }
}
