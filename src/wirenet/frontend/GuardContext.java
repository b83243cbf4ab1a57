package wirenet.frontend;

/**
 * The part of a conditional update implementation that wire assignments depend on.
 * Each {@link wirenet.netlist.Block} owns one guard context.
 */
public interface GuardContext {
  /** A pushed guard condition, popped by {@link #close()}. */
  public interface GuardScope extends AutoCloseable {
    @Override
    void close();
  }

  /**
   * Tells whether a guard condition is currently pushed.
   * @return true iff conditional assignments must be deferred
   */
  boolean isGuardActive();

  /**
   * Records a conditional assignment under the currently active guards.
   * The implementation must eventually call {@link WireVector#buildDriver(WireVector)} on dest.
   * @param dest the assigned wire
   * @param rhs the value, already coerced to the bitwidth of dest
   */
  void deferBuild(WireVector dest, WireVector rhs);

  /**
   * Pushes a guard condition.
   * @param condition a 1-bit wire
   * @return the scope that pops the condition when closed
   */
  GuardScope pushGuard(WireVector condition);
}
