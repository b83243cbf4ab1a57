package wirenet.util;

import java.math.BigInteger;
import java.util.Locale;
import wirenet.WireNetException;
import wirenet.frontend.WireVector;

/**
 * Infers the value and bitwidth of constant literals.
 */
public final class Literals {
  private Literals() {}

  /**
   * A literal value and its bitwidth. The value is non-negative and below 2^bitwidth.
   */
  public static record ValueAndWidth(BigInteger value, int bitwidth) {}

  /** @see #infer(Object, Integer, boolean) */
  public static ValueAndWidth infer(Object rawint) { return infer(rawint, null, false); }

  /**
   * Converts a Boolean, an integer (Integer, Long, Short, Byte, BigInteger) or a Verilog-style string (e.g. "8'hff", "4'b1010",
   * "12'd1_000") to an unsigned value and a bitwidth.
   * <ul>
   * <li>Booleans default to one bit.</li>
   * <li>Non-negative integers default to the minimal bitwidth, plus a sign bit if signed is set and the value is non-zero.</li>
   * <li>Negative integers need signed or an explicit bitwidth and are stored in two's complement of that bitwidth.</li>
   * <li>Verilog strings carry their own bitwidth; an explicit bitwidth must match it.</li>
   * </ul>
   * @param rawint the literal
   * @param bitwidth the requested bitwidth, or null to infer it
   * @param signed interpret the value as a two's complement number
   * @return the value and bitwidth
   */
  public static ValueAndWidth infer(Object rawint, Integer bitwidth, boolean signed) {
    WireVector.validateBitwidth(bitwidth);
    if (rawint instanceof Boolean)
      return convertBool((Boolean)rawint, bitwidth, signed);
    if (rawint instanceof BigInteger)
      return convertInt((BigInteger)rawint, bitwidth, signed);
    if (rawint instanceof Integer || rawint instanceof Long || rawint instanceof Short || rawint instanceof Byte)
      return convertInt(BigInteger.valueOf(((Number)rawint).longValue()), bitwidth, signed);
    if (rawint instanceof String)
      return convertVerilogString((String)rawint, bitwidth, signed);
    throw new WireNetException(String.format("error, the value provided is of an improper type \"%s\", proper types are "
                                                 + "Boolean, integers and Verilog-style strings",
                                             rawint == null ? "null" : rawint.getClass().getSimpleName()));
  }

  private static ValueAndWidth convertBool(boolean boolVal, Integer bitwidth, boolean signed) {
    if (signed)
      throw new WireNetException("error, \"signed\" option with Boolean values is not supported");
    return new ValueAndWidth(boolVal ? BigInteger.ONE : BigInteger.ZERO, (bitwidth == null) ? 1 : bitwidth);
  }

  private static ValueAndWidth convertInt(BigInteger val, Integer bitwidth, boolean signed) {
    if (val.signum() >= 0) {
      int minBitwidth = Math.max(1, val.bitLength());
      if (signed && val.signum() != 0)
        minBitwidth += 1; // room for the sign bit
      int width = checkMinBitwidth(val, bitwidth, minBitwidth);
      return new ValueAndWidth(val, width);
    }
    if (!signed && bitwidth == null)
      throw new WireNetException(String.format("negative Const %d without a bitwidth specified, set a bitwidth or signed", val));
    int minBitwidth = val.not().bitLength() + 1;
    int width = checkMinBitwidth(val, bitwidth, minBitwidth);
    BigInteger mask = BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE);
    return new ValueAndWidth(val.and(mask), width);
  }

  private static int checkMinBitwidth(BigInteger val, Integer bitwidth, int minBitwidth) {
    if (bitwidth == null)
      return minBitwidth;
    if (bitwidth < minBitwidth)
      throw new WireNetException(
          String.format("bitwidth %d specified is insufficient to represent constant %d, which needs %d bits", bitwidth, val, minBitwidth));
    return bitwidth;
  }

  private static ValueAndWidth convertVerilogString(String val, Integer bitwidth, boolean signed) {
    if (signed)
      throw new WireNetException("error, \"signed\" option with Verilog-style string constants is not supported");
    int quote = val.indexOf('\'');
    if (quote < 0 || quote != val.lastIndexOf('\'') || quote + 2 > val.length())
      throw new WireNetException(String.format("error, string \"%s\" for Const is not a Verilog-style constant such as \"8'hff\"", val));
    String bwstring = val.substring(0, quote).trim();
    String rest = val.substring(quote + 1).trim().toLowerCase(Locale.ROOT);
    if (rest.isEmpty())
      throw new WireNetException(String.format("error, Verilog-style constant \"%s\" has no base and value", val));
    if (rest.startsWith("s"))
      throw new WireNetException(String.format("error, signed Verilog-style constant \"%s\" is not supported", val));

    int radix;
    switch (rest.charAt(0)) {
    case 'b':
      radix = 2;
      break;
    case 'o':
      radix = 8;
      break;
    case 'd':
      radix = 10;
      break;
    case 'h':
      radix = 16;
      break;
    default:
      throw new WireNetException(String.format("error, unknown base '%c' in Verilog-style constant \"%s\"", rest.charAt(0), val));
    }
    String numstring = rest.substring(1).replace("_", "");

    int bitwidthInString;
    BigInteger num;
    try {
      bitwidthInString = Integer.parseInt(bwstring);
      num = new BigInteger(numstring, radix);
    } catch (NumberFormatException e) {
      throw new WireNetException(String.format("error, cannot parse Verilog-style constant \"%s\"", val));
    }
    if (bitwidthInString <= 0)
      throw new WireNetException(String.format("error, Verilog-style constant \"%s\" must have a positive bitwidth", val));
    if (bitwidth != null && bitwidth != bitwidthInString)
      throw new WireNetException(
          String.format("error, bitwidth %d does not match the bitwidth of Verilog-style constant \"%s\"", bitwidth, val));
    if (num.signum() < 0 || num.shiftRight(bitwidthInString).signum() != 0)
      throw new WireNetException(String.format("error, value of Verilog-style constant \"%s\" is too large for its bitwidth", val));
    return new ValueAndWidth(num, bitwidthInString);
  }
}
