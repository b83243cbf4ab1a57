package wirenet.frontend;

import java.math.BigInteger;
import wirenet.WireNetException;
import wirenet.WireNetInternalException;
import wirenet.netlist.Block;
import wirenet.netlist.WorkingBlock;
import wirenet.util.Literals;

/**
 * A WireVector with a constant value.
 * <p>
 * The value may be a Boolean, an integer (Integer, Long, BigInteger) or a Verilog-style string such as "8'hff"; see
 * {@link Literals#infer(Object, Integer, boolean)}. Without an explicit bitwidth, the smallest bitwidth that represents the
 * value is used. Negative values are stored in two's complement representation of the bitwidth. A constant created as signed
 * is still a raw bit vector: the flag only affects bitwidth inference and range checks.
 */
public class Const extends WireVector {
  private final BigInteger value;

  public Const(Object value) { this(value, null, null, false, null); }
  public Const(Object value, Integer bitwidth) { this(value, bitwidth, null, false, null); }
  public Const(Object value, Integer bitwidth, String name) { this(value, bitwidth, name, false, null); }
  /**
   * @param value the literal
   * @param bitwidth the bitwidth, or null to infer it from the value
   * @param name unique name within the block, or null/"" for a generated "const_N_value" name
   * @param signed interpret the value as two's complement for inference and range checks
   * @param block the block to place the constant in, or null for the working block
   */
  public Const(Object value, Integer bitwidth, String name, boolean signed, Block block) {
    this(checkInferred(Literals.infer(value, validateBitwidth(bitwidth), signed)), value, name, WorkingBlock.get(block));
  }

  private Const(Literals.ValueAndWidth inferred, Object literal, String name, Block block) {
    super(inferred.bitwidth(), (name == null || name.isEmpty()) ? block.makeConstName(literal) : name, block);
    this.value = inferred.value();
  }

  private static Literals.ValueAndWidth checkInferred(Literals.ValueAndWidth inferred) {
    if (inferred.value().signum() < 0)
      throw new WireNetInternalException("Const somehow evaluating to negative integer after checks");
    if (inferred.value().shiftRight(inferred.bitwidth()).signum() != 0)
      throw new WireNetInternalException(String.format("constant %d returned by literal inference somehow not fitting in %d bits",
                                                       inferred.value(), inferred.bitwidth()));
    return inferred;
  }

  /**
   * Returns the value as an unsigned integer below 2^bitwidth().
   * @return the value
   */
  public BigInteger getValue() { return value; }

  @Override
  protected char getKindCode() {
    return 'C';
  }

  @Override
  public WireVector assign(Object other) {
    throw new WireNetException(String.format("Const WireVectors, such as \"%s\", should never be assigned to", getName()));
  }

  @Override
  public WireVector conditionalAssign(Object other) {
    throw new WireNetException(String.format("Connection using conditionalAssign attempted on Const. Const WireVectors, such as "
                                                 + "\"%s\", cannot have other wires driving them",
                                             getName()));
  }

  @Override
  public void buildDriver(WireVector rhs) {
    throw new WireNetException(String.format("Const WireVectors, such as \"%s\", can never be driven", getName()));
  }
}
