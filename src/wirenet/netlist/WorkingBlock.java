package wirenet.netlist;

import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import wirenet.config.WireNetConfig;

/**
 * Holds the block that new wires are placed in when no block is given explicitly.
 * The working block is tracked per thread.
 */
public final class WorkingBlock {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private static final ThreadLocal<Block> current = ThreadLocal.withInitial(() -> new Block(WireNetConfig.fromClasspath()));

  private WorkingBlock() {}

  /** Restores the previous working block when closed. */
  public static final class Scope implements AutoCloseable {
    private final Block previous;
    private boolean closed = false;

    private Scope(Block previous) { this.previous = previous; }

    @Override
    public void close() {
      if (closed)
        return;
      closed = true;
      set(previous);
    }
  }

  public static Block get() { return current.get(); }

  /**
   * Returns the given block, or the working block if none is given.
   * @param block an explicit block or null
   * @return the block to use
   */
  public static Block get(Block block) { return (block != null) ? block : current.get(); }

  public static void set(Block block) {
    logger.debug("Switching working block");
    current.set(Objects.requireNonNull(block));
  }

  /**
   * Replaces the working block with a new, empty block.
   * @return the new block
   */
  public static Block reset() {
    Block block = new Block(WireNetConfig.fromClasspath());
    set(block);
    return block;
  }

  /**
   * Makes a block the working block until the returned scope is closed.
   * <pre>
   * try (var scope = WorkingBlock.use(block)) {
   *   ...
   * }
   * </pre>
   * @param block the block
   * @return the scope to close
   */
  public static Scope use(Block block) {
    Scope scope = new Scope(current.get());
    set(block);
    return scope;
  }
}
