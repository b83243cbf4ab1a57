package wirenet.frontend;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import wirenet.WireNetException;
import wirenet.netlist.Block;
import wirenet.netlist.LogicNet;
import wirenet.netlist.OpCode;
import wirenet.util.Literals;

/**
 * A WireVector with an embedded state element, updated on the (implicit) clock edge.
 * <p>
 * The register itself is its value in the current cycle. The value for the next cycle is set exactly once, in two steps:
 * <pre>
 * counter.setNext(counter.next().assign(counter.add(1)));
 * </pre>
 * {@link #next()} returns a handle that can only be assigned to, the assignment returns a {@link NextSetter} that carries the
 * coerced value, and {@link #setNext(NextSetter)} adds the register net. The register cannot be assigned directly.
 */
public class Register extends WireVector {
  private final BigInteger resetValue;
  private WireVector nextInput = null;
  private boolean nextSet = false;

  /** The handle returned by {@link Register#next()}. It only supports assignment. */
  public static final class Next {
    private final Register reg;

    private Next(Register reg) { this.reg = reg; }

    public Register getRegister() { return reg; }

    /**
     * Stages an unconditional next value.
     * @param other a WireVector or anything {@link Const} accepts
     * @return the setter to pass to {@link Register#setNext(NextSetter)}
     */
    public NextSetter assign(Object other) { return reg.nextAssign(other, false); }

    /**
     * Stages a next value under the active guard conditions. The register needs a known bitwidth.
     * @param other a WireVector or anything {@link Const} accepts
     * @return the setter to pass to {@link Register#setNext(NextSetter)}
     */
    public NextSetter conditionalAssign(Object other) { return reg.nextAssign(other, true); }

    /**
     * @deprecated always throws; the next value of a register has no compile-time truth value
     */
    @Deprecated
    public boolean booleanValue() {
      throw new WireNetException("cannot convert Register.next to compile-time boolean. This error often happens when you attempt "
                                 + "to compare a Register.next handle instead of assigning to it");
    }

    @Override
    public String toString() {
      return reg.getName() + ".next";
    }
  }

  /** A staged next value, the result of assigning to a {@link Next} handle. */
  public static final class NextSetter {
    private final Register reg;
    private final WireVector rhs;
    private final boolean conditional;

    private NextSetter(Register reg, WireVector rhs, boolean conditional) {
      this.reg = reg;
      this.rhs = rhs;
      this.conditional = conditional;
    }

    public Register getRegister() { return reg; }
    /** The staged value, already coerced to the register's bitwidth. */
    public WireVector getRhs() { return rhs; }
    /** True iff staged through {@link Next#conditionalAssign(Object)}. */
    public boolean isConditional() { return conditional; }
  }

  public Register(Integer bitwidth) { this(bitwidth, null, null, null); }
  public Register(Integer bitwidth, String name) { this(bitwidth, name, null, null); }
  public Register(Integer bitwidth, String name, Object resetValue) { this(bitwidth, name, resetValue, null); }
  /**
   * @param bitwidth the bitwidth, or null to take it from the first staged next value
   * @param name unique name within the block, or null/"" for a generated name
   * @param resetValue the initial value used by simulation and export, or null; must fit into the bitwidth
   * @param block the block to place the register in, or null for the working block
   */
  public Register(Integer bitwidth, String name, Object resetValue, Block block) {
    super(bitwidth, name, block);
    if (resetValue != null) {
      if (bitwidth == null)
        throw new WireNetException(String.format("Register \"%s\" needs a bitwidth to check its reset_value", getName()));
      Literals.ValueAndWidth inferred = Literals.infer(resetValue);
      if (inferred.bitwidth() > bitwidth)
        throw new WireNetException(String.format("reset_value \"%s\" cannot fit in the specified %d bits for register \"%s\"",
                                                 resetValue, bitwidth, getName()));
      this.resetValue = inferred.value();
    } else {
      this.resetValue = null;
    }
  }

  @Override
  protected char getKindCode() {
    return 'R';
  }

  public Optional<BigInteger> getResetValue() { return Optional.ofNullable(resetValue); }

  /**
   * Returns the wire driving the next value, once the register net was added.
   * @return the driving wire, or empty
   */
  public Optional<WireVector> getNextInput() { return Optional.ofNullable(nextInput); }

  /** True once {@link #setNext(NextSetter)} was called, even if the assignment is still deferred. */
  public boolean isNextSet() { return nextSet; }

  /**
   * Returns the handle for staging the value of the next cycle.
   * @return a handle bound to this register
   */
  public Next next() { return new Next(this); }

  private NextSetter nextAssign(Object other, boolean conditional) {
    if (conditional && !hasBitwidth())
      throw new WireNetException("Conditional assignment only defined on Registers with pre-defined bitwidths");
    WireVector rhs = prepareForAssignment(other);
    return new NextSetter(this, rhs, conditional);
  }

  /**
   * Sets the value of the next cycle. May be called only once per register.
   * A conditional setter is deferred to the block's {@link GuardContext} while a guard is active.
   * @param nextSetter the result of next().assign(...) or next().conditionalAssign(...)
   */
  public void setNext(NextSetter nextSetter) {
    if (nextSetter == null)
      throw new WireNetException("error, the next value of a register should be set with next().assign(...) or "
                                 + "next().conditionalAssign(...)");
    if (nextSetter.getRegister() != this)
      throw new WireNetException(String.format("error, next value staged for register \"%s\" was set on register \"%s\"",
                                               nextSetter.getRegister().getName(), getName()));
    if (nextSet)
      throw new WireNetException(String.format("error, the next value of register \"%s\" should be set once and only once", getName()));
    nextSet = true;
    GuardContext guards = getBlock().getGuardContext();
    if (nextSetter.isConditional() && guards.isGuardActive())
      guards.deferBuild(this, nextSetter.getRhs());
    else
      buildDriver(nextSetter.getRhs());
  }

  /** Adds the register net with next as its input. */
  @Override
  public void buildDriver(WireVector next) {
    this.nextInput = next;
    getBlock().addNet(new LogicNet(OpCode.REGISTER, null, List.of(next), this));
  }

  @Override
  public WireVector assign(Object other) {
    throw new WireNetException(
        String.format("error, you cannot set registers such as \"%s\" directly, set next() instead", getName()));
  }

  @Override
  public WireVector conditionalAssign(Object other) {
    throw new WireNetException(
        String.format("error, you cannot set registers such as \"%s\" directly, set next() instead", getName()));
  }

  /**
   * Convenience for {@code setNext(next().assign(other))}.
   * @param other a WireVector or anything {@link Const} accepts
   */
  public void setNextValue(Object other) { setNext(next().assign(other)); }
}
