package wirenet.netlist;

import java.util.Optional;
import java.util.stream.Stream;
import wirenet.WireNetException;

/**
 * The closed set of operations a {@link LogicNet} can perform.
 * CONCAT and MUX are only emitted by the concatenation and conditional update helpers.
 */
public enum OpCode {
  CONNECT('w', 1),
  AND('&', 2),
  OR('|', 2),
  XOR('^', 2),
  NAND('n', 2),
  NOT('~', 1),
  ADD('+', 2),
  SUBTRACT('-', 2),
  MULTIPLY('*', 2),
  LESS_THAN('<', 2),
  GREATER_THAN('>', 2),
  EQUALS('=', 2),
  /** Bit selection, the net parameter holds the selected positions (LSB first). */
  SELECT('s', 1),
  /** Synchronous register update, the destination is the register. */
  REGISTER('r', 1),
  /** Concatenation, most significant argument first. */
  CONCAT('c', -1),
  /** Multiplexer with arguments (select, false case, true case). */
  MUX('x', 3);

  /** Single-character code of the operation, as used in the textual net representation. */
  public final char symbol;
  private final int arity;

  private OpCode(char symbol, int arity) {
    this.symbol = symbol;
    this.arity = arity;
  }

  /**
   * Returns the number of arguments of a net with this operation.
   * @return the argument count, or empty for a variable argument count
   */
  public Optional<Integer> getArity() { return arity < 0 ? Optional.empty() : Optional.of(arity); }

  public boolean isRelational() { return this == LESS_THAN || this == GREATER_THAN || this == EQUALS; }

  /**
   * Computes the result bitwidth of a two-operand operation.
   * @param matchedBitwidth the common bitwidth of both operands after width matching
   * @return the bitwidth of the result wire
   */
  public int binaryResultBitwidth(int matchedBitwidth) {
    try {
      return computeBinaryResultBitwidth(matchedBitwidth);
    } catch (ArithmeticException e) {
      throw new WireNetException(
          String.format("result bitwidth of %s on %d-bit operands exceeds the largest supported bitwidth", this, matchedBitwidth));
    }
  }

  private int computeBinaryResultBitwidth(int matchedBitwidth) {
    switch (this) {
    case AND:
    case OR:
    case XOR:
    case NAND:
      return matchedBitwidth;
    case ADD:
    case SUBTRACT:
      // carry/borrow bit
      return Math.addExact(matchedBitwidth, 1);
    case MULTIPLY:
      return Math.multiplyExact(matchedBitwidth, 2);
    case LESS_THAN:
    case GREATER_THAN:
    case EQUALS:
      return 1;
    default:
      throw new IllegalArgumentException(this + " is not a two-operand operation");
    }
  }

  public static Optional<OpCode> fromSymbol(char symbol) {
    return Stream.of(OpCode.values()).filter(op -> op.symbol == symbol).findAny();
  }
}
