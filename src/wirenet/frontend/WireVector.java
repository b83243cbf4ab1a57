package wirenet.frontend;

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import wirenet.WireNetException;
import wirenet.WireNetInternalException;
import wirenet.netlist.Block;
import wirenet.netlist.LogicNet;
import wirenet.netlist.OpCode;
import wirenet.netlist.WorkingBlock;
import wirenet.util.CallPoints;
import wirenet.util.Slices;
import wirenet.util.Wires;

/**
 * An ordered collection of wires, the unit of value flow in a {@link Block}.
 * <p>
 * Bit 0 is the least significant bit. Every operation method immediately adds a new result wire and the net computing it to
 * the block, so an expression such as {@code a.add(b).and(c)} builds two nets.
 * <p>
 * The bitwidth may be left open at construction and is then fixed by the first {@link #assign(Object)}; once known it never
 * changes. Equality and hashing are by identity; use {@link #eq(Object)} to build an equality comparator.
 */
public class WireVector {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private static final String SELECTION_HINT = "For example: wire.slice(2, 9) selects the wires from index 2 to index 8 "
                                               + "to make a new length 7 wire.";

  private final Block block;
  private String name = null;
  private Integer bitwidth;
  private List<String> initCallStack = null;

  /** Creates a wire with an open bitwidth and a generated name in the working block. */
  public WireVector() { this(null, null, null); }
  public WireVector(Integer bitwidth) { this(bitwidth, null, null); }
  public WireVector(Integer bitwidth, String name) { this(bitwidth, name, null); }
  /**
   * @param bitwidth the bitwidth, or null to have it set by the first assignment
   * @param name unique name within the block, or null/"" for a generated name
   * @param block the block to place the wire in, or null for the working block
   */
  public WireVector(Integer bitwidth, String name, Block block) {
    this.block = WorkingBlock.get(block);
    this.bitwidth = validateBitwidth(bitwidth);
    setName(nextTempvarName(name));
    if (this.block.getConfig().keep_call_stack)
      this.initCallStack = CallPoints.captureStack();
  }

  /**
   * Checks a bitwidth argument.
   * @param bitwidth the bitwidth, or null for 'not yet known'
   * @return bitwidth
   */
  public static Integer validateBitwidth(Integer bitwidth) {
    if (bitwidth != null) {
      if (bitwidth == 0)
        throw new WireNetException("bitwidth must be greater than or equal to 1");
      if (bitwidth < 0)
        throw new WireNetException(String.format("bitwidth must be positive, got a negative bitwidth of %d", bitwidth));
    }
    return bitwidth;
  }

  private String nextTempvarName(String name) {
    if (name == null || name.isEmpty()) {
      String suffix = "";
      if (block.getConfig().debug_mode)
        suffix = CallPoints.findUserCallPoint().map(CallPoints::nameSuffix).orElse("");
      return block.makeTempName(suffix);
    }
    return name;
  }

  //////////   naming and identity   //////////

  public String getName() { return name; }

  /**
   * Renames the wire and re-indexes it in its block.
   * @param name the new name, unique within the block
   */
  public void setName(String name) {
    if (name == null || name.isEmpty())
      throw new WireNetException("WireVector names must be non-empty strings");
    if (name.equalsIgnoreCase("clk") || name.equalsIgnoreCase("clock"))
      throw new WireNetException("Clock signals should never be explicit");
    if (name.equals(this.name))
      return;
    block.checkNameAvailable(name, this);
    String oldName = this.name;
    if (oldName != null)
      block.remove(this);
    this.name = name;
    block.add(this);
    if (oldName != null)
      logger.debug("Renamed wire {} to {}", oldName, name);
  }

  public Block getBlock() { return block; }

  /**
   * Returns the call stack at construction, if the block configuration has keep_call_stack enabled.
   * @return the stack frames, innermost first
   */
  public Optional<List<String>> getInitCallStack() { return Optional.ofNullable(initCallStack); }

  /** Single character identifying the kind of wire in {@link #toString()}. */
  protected char getKindCode() { return 'W'; }

  @Override
  public final boolean equals(Object obj) {
    return this == obj;
  }
  @Override
  public final int hashCode() {
    return System.identityHashCode(this);
  }
  /** Renders the wire as "name/bitwidth" followed by the kind code, e.g. "a/8I". */
  @Override
  public String toString() {
    return name + "/" + (bitwidth == null ? "?" : bitwidth.toString()) + getKindCode();
  }

  //////////   bitwidth   //////////

  public boolean hasBitwidth() { return bitwidth != null; }

  /**
   * Returns the bitwidth, or null if it is not yet known.
   * @return the bitwidth or null
   */
  public Integer getBitwidth() { return bitwidth; }

  /**
   * Returns the bitwidth, which must be known already.
   * @return the bitwidth
   */
  public int bitwidth() {
    if (bitwidth == null)
      throw new WireNetException(String.format("bitwidth of WireVector \"%s\" not yet defined", name));
    return bitwidth;
  }

  /**
   * Sets a so far unknown bitwidth.
   * @param newBitwidth the bitwidth
   */
  protected void fixBitwidth(int newBitwidth) {
    if (bitwidth == null) {
      validateBitwidth(newBitwidth);
      bitwidth = newBitwidth;
      logger.debug("Inferred bitwidth of {}", this);
    } else if (bitwidth != newBitwidth) {
      throw new WireNetInternalException(
          String.format("attempt to change the bitwidth of WireVector \"%s\" from %d to %d", name, bitwidth, newBitwidth));
    }
  }

  /**
   * Returns an integer with the lowest bitwidth() bits set, e.g. 0b111 for a 3-bit wire.
   * @return the mask
   */
  public BigInteger bitmask() { return BigInteger.ONE.shiftLeft(bitwidth()).subtract(BigInteger.ONE); }

  //////////   assignment   //////////

  /**
   * Drives this wire with a value ("connect"). If the bitwidth of this wire is not known yet, it is taken from the value.
   * The value is zero-extended or truncated to the bitwidth of this wire.
   * @param other a WireVector or anything {@link Const} accepts
   * @return this
   */
  public WireVector assign(Object other) {
    WireVector rhs = prepareForAssignment(other);
    buildDriver(rhs);
    return this;
  }

  /**
   * Drives this wire with a value under the active guard conditions of the block.
   * Behaves like {@link #assign(Object)} if no guard condition is active.
   * @param other a WireVector or anything {@link Const} accepts
   * @return this
   */
  public WireVector conditionalAssign(Object other) {
    if (bitwidth == null)
      throw new WireNetException("Conditional assignment only defined on WireVectors with pre-defined bitwidths");
    WireVector rhs = prepareForAssignment(other);
    GuardContext guards = block.getGuardContext();
    if (guards.isGuardActive())
      guards.deferBuild(this, rhs);
    else
      buildDriver(rhs);
    return this;
  }

  /**
   * Coerces an assigned value to a wire and infers the bitwidth of this wire if necessary.
   * @param other the assigned value
   * @return the coerced value
   */
  protected WireVector prepareForAssignment(Object other) {
    WireVector rhs = Wires.asWires(other, bitwidth, block);
    if (bitwidth == null) {
      if (!rhs.hasBitwidth())
        throw new WireNetException(String.format("Cannot infer the bitwidth of \"%s\" from \"%s\", whose bitwidth is not yet defined",
                                                 name, rhs.getName()));
      fixBitwidth(rhs.bitwidth());
    }
    return rhs;
  }

  /**
   * Adds the net that drives this wire. Called right away for unconditional assignments and by the {@link GuardContext}
   * once a deferred assignment is resolved.
   * @param rhs the driving wire, with the bitwidth of this wire
   */
  public void buildDriver(WireVector rhs) { block.addNet(new LogicNet(OpCode.CONNECT, null, List.of(rhs), this)); }

  /**
   * Pushes this 1-bit wire as a guard condition for conditional assignments.
   * @return the scope to close
   */
  public GuardContext.GuardScope guard() { return block.getGuardContext().pushGuard(this); }

  //////////   operations   //////////

  protected WireVector twoVarOp(Object other, OpCode op) {
    List<WireVector> matched = Wires.matchBitwidth(this, Wires.asWires(other, null, block));
    WireVector a = matched.get(0);
    WireVector b = matched.get(1);
    int resultLen = op.binaryResultBitwidth(a.bitwidth());

    WireVector s = new WireVector(resultLen, null, block);
    block.addNet(new LogicNet(op, null, List.of(a, b), s));
    return s;
  }

  /** Bitwise AND, result has the matched bitwidth. */
  public WireVector and(Object other) { return twoVarOp(other, OpCode.AND); }
  /** Bitwise OR, result has the matched bitwidth. */
  public WireVector or(Object other) { return twoVarOp(other, OpCode.OR); }
  /** Bitwise XOR, result has the matched bitwidth. */
  public WireVector xor(Object other) { return twoVarOp(other, OpCode.XOR); }
  /** Bitwise NAND, result has the matched bitwidth. */
  public WireVector nand(Object other) { return twoVarOp(other, OpCode.NAND); }

  /**
   * Adds two wires. The result has one more bit than the wider operand.
   * Addition is compatible with two's complement signed numbers.
   * @param other a WireVector or anything {@link Const} accepts
   * @return the sum
   */
  public WireVector add(Object other) { return twoVarOp(other, OpCode.ADD); }

  /**
   * Subtracts other from this wire. The result has one more bit than the wider operand.
   * Subtraction is compatible with two's complement signed numbers.
   * @param other a WireVector or anything {@link Const} accepts
   * @return the difference
   */
  public WireVector subtract(Object other) { return twoVarOp(other, OpCode.SUBTRACT); }

  /**
   * Subtracts this wire from other, i.e. builds "other - this".
   * @param other a WireVector or anything {@link Const} accepts
   * @return the difference
   */
  public WireVector reverseSubtract(Object other) { return Wires.asWires(other, null, block).subtract(this); }

  /**
   * Multiplies two wires. The result has twice the bitwidth of the wider operand.
   * Multiplication is not compatible with two's complement signed numbers.
   * @param other a WireVector or anything {@link Const} accepts
   * @return the product
   */
  public WireVector multiply(Object other) { return twoVarOp(other, OpCode.MULTIPLY); }

  /** Unsigned less than, 1-bit result. */
  public WireVector lt(Object other) { return twoVarOp(other, OpCode.LESS_THAN); }
  /** Unsigned greater than, 1-bit result. */
  public WireVector gt(Object other) { return twoVarOp(other, OpCode.GREATER_THAN); }
  /** Equality, 1-bit result. */
  public WireVector eq(Object other) { return twoVarOp(other, OpCode.EQUALS); }
  /** Unsigned less than or equal, built as the inverse of {@link #gt(Object)}. */
  public WireVector le(Object other) { return twoVarOp(other, OpCode.GREATER_THAN).invert(); }
  /** Inequality, built as the inverse of {@link #eq(Object)}. */
  public WireVector ne(Object other) { return twoVarOp(other, OpCode.EQUALS).invert(); }
  /** Unsigned greater than or equal, built as the inverse of {@link #lt(Object)}. */
  public WireVector ge(Object other) { return twoVarOp(other, OpCode.LESS_THAN).invert(); }

  /** Bitwise inversion, same bitwidth as this wire. */
  public WireVector invert() {
    WireVector outwire = new WireVector(bitwidth(), null, block);
    block.addNet(new LogicNet(OpCode.NOT, null, List.of(this), outwire));
    return outwire;
  }

  //////////   bit selection   //////////

  /**
   * Selects a single bit. Negative indices count from the most significant bit, i.e. -1 is the MSB.
   * @param index the bit index, in -bitwidth()..bitwidth()-1
   * @return a 1-bit wire
   */
  public WireVector select(int index) {
    int width = requireSelectableBitwidth();
    int position = (index < 0) ? index + width : index;
    if (position < 0 || position >= width)
      throw new WireNetException(
          String.format("index %d is out of range for WireVector \"%s\" with a bitwidth of %d", index, name, width));
    return selectPositions(List.of(position), "[" + index + "]");
  }

  /**
   * Selects the bits start..stop-1. Arguments follow list slicing rules: null means 'from the start' or 'to the end' and
   * negative values count from the most significant bit. {@code slice(null, 4)} selects the lower 4 bits,
   * {@code slice(-4, null)} the upper 4 bits.
   * @param start the first selected bit, or null
   * @param stop the bit after the last selected bit, or null
   * @return a wire with the selected bits, bit start becoming bit 0
   */
  public WireVector slice(Integer start, Integer stop) { return slice(start, stop, null); }

  /**
   * Selects every step-th bit from start (inclusive) to stop (exclusive), following list slicing rules.
   * @param start the first selected bit, or null
   * @param stop the end bit (exclusive), or null
   * @param step the distance between selected bits, non-zero; null for 1
   * @return a wire with the selected bits in selection order
   */
  public WireVector slice(Integer start, Integer stop, Integer step) {
    int width = requireSelectableBitwidth();
    List<Integer> positions = Slices.indices(width, start, stop, step);
    return selectPositions(positions, String.format("[%s:%s%s]", start == null ? "" : start, stop == null ? "" : stop,
                                                    step == null ? "" : ":" + step));
  }

  private int requireSelectableBitwidth() {
    if (bitwidth == null)
      throw new WireNetException(String.format("You cannot get a subset of WireVector \"%s\", which has no bitwidth", name));
    return bitwidth;
  }

  private WireVector selectPositions(List<Integer> selectedNums, String selectionText) {
    if (selectedNums.isEmpty())
      throw new WireNetException(String.format("selection %s must have at least one selected wire", selectionText));
    WireVector outwire = new WireVector(selectedNums.size(), null, block);
    block.addNet(new LogicNet(OpCode.SELECT, selectedNums, List.of(this), outwire));
    return outwire;
  }

  /**
   * Keeps the lower bits of this wire.
   * @param newBitwidth the bitwidth of the result, at most bitwidth()
   * @return the truncated wire
   */
  public WireVector truncate(int newBitwidth) {
    if (newBitwidth > bitwidth())
      throw new WireNetException(String.format("Cannot truncate WireVector \"%s\" of bitwidth %d to %d bits, "
                                                   + "which is more bits than it started with",
                                               name, bitwidth(), newBitwidth));
    if (newBitwidth < 1)
      throw new WireNetException(String.format("Cannot truncate WireVector \"%s\" to %d bits", name, newBitwidth));
    return slice(null, newBitwidth);
  }

  /**
   * Extends this wire by repeating its most significant bit.
   * @param newBitwidth the bitwidth of the result, at least bitwidth()
   * @return the extended wire, or this wire itself if newBitwidth equals bitwidth()
   */
  public WireVector signExtended(int newBitwidth) { return extendWithBit(newBitwidth, () -> select(-1)); }

  /**
   * Extends this wire with zeros above its most significant bit.
   * @param newBitwidth the bitwidth of the result, at least bitwidth()
   * @return the extended wire, or this wire itself if newBitwidth equals bitwidth()
   */
  public WireVector zeroExtended(int newBitwidth) { return extendWithBit(newBitwidth, () -> new Const(0, 1, null, false, block)); }

  private WireVector extendWithBit(int newBitwidth, Supplier<WireVector> extbit) {
    if (newBitwidth < bitwidth())
      throw new WireNetException("Neither zeroExtended nor signExtended can reduce the number of bits");
    int numext = newBitwidth - bitwidth();
    if (numext == 0)
      return this;
    WireVector extvector = new WireVector(numext, null, block);
    block.addNet(new LogicNet(OpCode.SELECT, Collections.nCopies(numext, 0), List.of(extbit.get()), extvector));
    return Wires.concat(extvector, this);
  }

  //////////   unsupported operators   //////////

  /**
   * WireVectors have no compile-time truth value.
   * @deprecated always throws; comparisons build hardware and return a WireVector, not a boolean
   */
  @Deprecated
  public boolean booleanValue() {
    throw new WireNetException("cannot convert WireVector to compile-time boolean. This error often happens when you attempt "
                               + "to use the result of a comparison such as eq() in a Java condition");
  }

  /**
   * @deprecated always throws; select bits with {@link #slice(Integer, Integer)} or use a shifter circuit
   */
  @Deprecated
  public WireVector shiftLeft(Object other) {
    throw new WireNetException("Shifting a WireVector with shiftLeft/shiftRight is not supported. If you are trying to select bits "
                               + "in a wire, use select or slice instead. " + SELECTION_HINT
                               + " If you really need to shift at execution time, build a shifter with an explicit shift amount.");
  }

  /**
   * @deprecated always throws; select bits with {@link #slice(Integer, Integer)} or use a shifter circuit
   */
  @Deprecated
  public WireVector shiftRight(Object other) {
    return shiftLeft(other);
  }

  /**
   * @deprecated always throws; mask bits with {@link #slice(Integer, Integer)}
   */
  @Deprecated
  public WireVector mod(Object other) {
    throw new WireNetException("Masking with mod is not supported. Instead if you are trying to select bits in a wire, "
                               + "use select or slice. " + SELECTION_HINT);
  }

  /** @deprecated always throws; use {@code x = x.add(y)} or {@link #assign(Object)} */
  @Deprecated
  public WireVector addInPlace(Object other) {
    throw inPlaceNotAllowed();
  }
  /** @deprecated always throws; use {@code x = x.subtract(y)} or {@link #assign(Object)} */
  @Deprecated
  public WireVector subtractInPlace(Object other) {
    throw inPlaceNotAllowed();
  }
  /** @deprecated always throws; use {@code x = x.multiply(y)} or {@link #assign(Object)} */
  @Deprecated
  public WireVector multiplyInPlace(Object other) {
    throw inPlaceNotAllowed();
  }
  /** @deprecated always throws; use {@code x = x.and(y)} or {@link #assign(Object)} */
  @Deprecated
  public WireVector andInPlace(Object other) {
    throw inPlaceNotAllowed();
  }
  /** @deprecated always throws; use {@code x = x.xor(y)} or {@link #assign(Object)} */
  @Deprecated
  public WireVector xorInPlace(Object other) {
    throw inPlaceNotAllowed();
  }

  private WireNetException inPlaceNotAllowed() {
    return new WireNetException(String.format("error, in-place operation not allowed on WireVector \"%s\": use assign or "
                                                  + "conditionalAssign to drive it",
                                              name));
  }
}
