package wirenet.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import wirenet.WireNetException;
import wirenet.frontend.Const;
import wirenet.frontend.Register;
import wirenet.frontend.WireVector;
import wirenet.netlist.Block;
import wirenet.netlist.LogicNet;
import wirenet.netlist.OpCode;
import wirenet.netlist.WorkingBlock;

/**
 * Coercion of values to wires, width matching and the multi-wire circuits the wire operations rely on (concatenation and
 * multiplexing).
 */
public final class Wires {
  private Wires() {}

  /** @see #asWires(Object, Integer, Block) */
  public static WireVector asWires(Object val) { return asWires(val, null, null); }

  /**
   * Returns a wire for a value.
   * A WireVector is returned as is if bitwidth is null, else zero-extended or truncated to bitwidth.
   * Any other value becomes a {@link Const} of the given bitwidth.
   * @param val a WireVector or anything {@link Const} accepts
   * @param bitwidth the required bitwidth, or null to keep/infer it
   * @param block the block for new constants, or null for the working block
   * @return the wire
   */
  public static WireVector asWires(Object val, Integer bitwidth, Block block) {
    if (val instanceof WireVector) {
      WireVector wire = (WireVector)val;
      if (bitwidth == null)
        return wire;
      if (bitwidth > wire.bitwidth())
        return wire.zeroExtended(bitwidth);
      if (bitwidth < wire.bitwidth())
        return wire.truncate(bitwidth);
      return wire;
    }
    if (val instanceof Register.Next)
      throw new WireNetException(String.format("Attempted to use %s as a value, which is undefined: next() may only be assigned to", val));
    return new Const(val, bitwidth, null, false, WorkingBlock.get(block));
  }

  /** @see #matchBitwidth(boolean, WireVector...) */
  public static List<WireVector> matchBitwidth(WireVector... args) { return matchBitwidth(false, args); }

  /**
   * Extends all wires to the bitwidth of the widest one.
   * @param signed sign-extend instead of zero-extend
   * @param args the wires, all with known bitwidths
   * @return the extended wires, in argument order; wires already at full width are returned unchanged
   */
  public static List<WireVector> matchBitwidth(boolean signed, WireVector... args) {
    int maxLen = Arrays.stream(args).mapToInt(WireVector::bitwidth).max().orElse(0);
    return Arrays.stream(args)
        .map(wire -> signed ? wire.signExtended(maxLen) : wire.zeroExtended(maxLen))
        .collect(Collectors.toList());
  }

  /**
   * Concatenates wires. The first argument becomes the most significant part of the result.
   * @param args WireVectors or anything {@link Const} accepts, at least one
   * @return a wire with the sum of the argument bitwidths, or the argument itself if there is only one
   */
  public static WireVector concat(Object... args) {
    if (args.length == 0)
      throw new WireNetException("error, concat requires at least one argument");
    Block block = Arrays.stream(args)
                      .filter(arg -> arg instanceof WireVector)
                      .map(arg -> ((WireVector)arg).getBlock())
                      .findFirst()
                      .orElse(WorkingBlock.get());
    List<WireVector> wires = Arrays.stream(args).map(arg -> asWires(arg, null, block)).collect(Collectors.toList());
    if (wires.size() == 1)
      return wires.get(0);
    int finalWidth = wires.stream().mapToInt(WireVector::bitwidth).sum();
    WireVector outwire = new WireVector(finalWidth, null, block);
    block.addNet(new LogicNet(OpCode.CONCAT, null, wires, outwire));
    return outwire;
  }

  /**
   * Concatenates wires given least significant first, as in {@code concatList(List.of(lsb, ..., msb))}.
   * @param lsbFirst the parts, at least one
   * @return the concatenated wire
   */
  public static WireVector concatList(List<?> lsbFirst) {
    List<Object> msbFirst = new ArrayList<>(lsbFirst);
    Collections.reverse(msbFirst);
    return concat(msbFirst.toArray());
  }

  /**
   * Builds a 2:1 multiplexer. The cases are zero-extended to a common bitwidth.
   * @param sel a 1-bit wire
   * @param truecase the result if sel is 1
   * @param falsecase the result if sel is 0
   * @return the multiplexer output
   */
  public static WireVector select(WireVector sel, Object truecase, Object falsecase) {
    Block block = sel.getBlock();
    if (sel.bitwidth() != 1)
      throw new WireNetException(String.format("error, select condition \"%s\" must be a 1-bit WireVector", sel.getName()));
    List<WireVector> cases = matchBitwidth(asWires(falsecase, null, block), asWires(truecase, null, block));
    WireVector f = cases.get(0);
    WireVector t = cases.get(1);
    WireVector outwire = new WireVector(f.bitwidth(), null, block);
    block.addNet(new LogicNet(OpCode.MUX, null, List.of(sel, f, t), outwire));
    return outwire;
  }
}
