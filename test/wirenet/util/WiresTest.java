package wirenet.util;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import wirenet.WireNetException;
import wirenet.frontend.Const;
import wirenet.frontend.Input;
import wirenet.frontend.WireVector;
import wirenet.netlist.Block;
import wirenet.netlist.LogicNet;
import wirenet.netlist.NetEvaluator;
import wirenet.netlist.OpCode;
import wirenet.netlist.WorkingBlock;

class WiresTest {
  private Block block;
  private WorkingBlock.Scope scope;

  @BeforeEach
  void setUp() {
    block = new Block();
    scope = WorkingBlock.use(block);
  }

  @AfterEach
  void tearDown() {
    scope.close();
  }

  @Test
  void testAsWiresKeepsWire() {
    var a = new Input(4, "a");
    Assertions.assertSame(a, Wires.asWires(a));
    Assertions.assertSame(a, Wires.asWires(a, 4, null));
    Assertions.assertTrue(block.nets().isEmpty());
  }

  @Test
  void testAsWiresResizes() {
    var a = new Input(4, "a");
    Assertions.assertEquals(6, Wires.asWires(a, 6, null).bitwidth());
    Assertions.assertEquals(2, Wires.asWires(a, 2, null).bitwidth());
  }

  @Test
  void testAsWiresConst() {
    var c = Wires.asWires(9, 8, null);
    Assertions.assertTrue(c instanceof Const);
    Assertions.assertEquals(8, c.bitwidth());
    Assertions.assertSame(block, c.getBlock());
    var other = new Block();
    Assertions.assertSame(other, Wires.asWires(1, null, other).getBlock());
  }

  @Test
  void testMatchBitwidth() {
    var a = new Input(2, "a");
    var b = new Input(5, "b");
    List<WireVector> matched = Wires.matchBitwidth(a, b);
    Assertions.assertEquals(5, matched.get(0).bitwidth());
    Assertions.assertSame(b, matched.get(1));
    List<WireVector> signed = Wires.matchBitwidth(true, a, b);
    Assertions.assertEquals(0b11111L, NetEvaluator.evaluate(block, signed.get(0), Map.of(a, 0b11, b, 0)));
    Assertions.assertEquals(0b00011L, NetEvaluator.evaluate(block, matched.get(0), Map.of(a, 0b11, b, 0)));
  }

  @Test
  void testConcat() {
    var hi = new Input(3, "hi");
    var lo = new Input(5, "lo");
    var both = Wires.concat(hi, lo);
    Assertions.assertEquals(8, both.bitwidth());
    LogicNet net = block.logicSubset(OpCode.CONCAT).get(0);
    Assertions.assertEquals(List.of(hi, lo), net.getArgs());
    Assertions.assertEquals(0b101_00011L, NetEvaluator.evaluate(block, both, Map.of(hi, 0b101, lo, 0b00011)));
  }

  @Test
  void testConcatSingleAndEmpty() {
    var a = new Input(3, "a");
    Assertions.assertSame(a, Wires.concat(a));
    Assertions.assertThrows(WireNetException.class, () -> Wires.concat());
  }

  @Test
  void testConcatList() {
    var lsb = new Input(1, "lsb");
    var msb = new Input(2, "msb");
    var both = Wires.concatList(List.of(lsb, msb));
    Assertions.assertEquals(0b10_1L, NetEvaluator.evaluate(block, both, Map.of(lsb, 1, msb, 0b10)));
  }

  @Test
  void testSelect() {
    var sel = new Input(1, "sel");
    var a = new Input(4, "a");
    var out = Wires.select(sel, a, 3);
    Assertions.assertEquals(4, out.bitwidth());
    LogicNet mux = block.logicSubset(OpCode.MUX).get(0);
    Assertions.assertSame(sel, mux.getArgs().get(0));
    Assertions.assertSame(a, mux.getArgs().get(2));
    Assertions.assertEquals(9L, NetEvaluator.evaluate(block, out, Map.of(sel, 1, a, 9)));
    Assertions.assertEquals(3L, NetEvaluator.evaluate(block, out, Map.of(sel, 0, a, 9)));
    Assertions.assertThrows(WireNetException.class, () -> Wires.select(a, 1, 2));
  }
}
