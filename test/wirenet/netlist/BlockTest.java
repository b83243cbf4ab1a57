package wirenet.netlist;

import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import wirenet.WireNetException;
import wirenet.WireNetInternalException;
import wirenet.config.WireNetConfig;
import wirenet.frontend.Const;
import wirenet.frontend.Input;
import wirenet.frontend.Output;
import wirenet.frontend.Register;
import wirenet.frontend.WireVector;

class BlockTest {
  private Block block;

  @BeforeEach
  void setUp() {
    block = new Block();
  }

  @Test
  void testRegistrationOrder() {
    var a = new Input(1, "a", block);
    var b = new WireVector(1, "b", block);
    var c = new Output(1, "c", block);
    Assertions.assertEquals(List.of(a, b, c), List.copyOf(block.wirevectors()));
  }

  @Test
  void testWirevectorSubset() {
    var a = new Input(1, "a", block);
    var r = new Register(2, "r", null, block);
    new Output(1, "o", block);
    new WireVector(1, "w", block);
    Assertions.assertEquals(List.of(a), List.copyOf(block.wirevectorSubset(Input.class)));
    Assertions.assertEquals(List.of(r), List.copyOf(block.wirevectorSubset(Register.class)));
    Assertions.assertEquals(4, block.wirevectorSubset(WireVector.class).size());
  }

  @Test
  void testLogicSubset() {
    var a = new Input(2, "a", block);
    var b = new Input(2, "b", block);
    var sum = a.add(b);
    var eq = a.eq(b);
    var out = new Output(3, "out", block);
    out.assign(sum);
    Assertions.assertEquals(3, block.logicSubset().size());
    Assertions.assertEquals(1, block.logicSubset(OpCode.EQUALS).size());
    Assertions.assertSame(eq, block.logicSubset(OpCode.EQUALS).get(0).getDest());
    Assertions.assertEquals(2, block.logicSubset(OpCode.ADD, OpCode.CONNECT).size());
    Assertions.assertTrue(block.logicSubset(OpCode.REGISTER).isEmpty());
  }

  @Test
  void testNetsUnmodifiable() {
    var a = new Input(2, "a", block);
    a.invert();
    Assertions.assertThrows(UnsupportedOperationException.class, () -> block.nets().clear());
    Assertions.assertThrows(UnsupportedOperationException.class, () -> block.wirevectors().clear());
  }

  @Test
  void testAddNetChecksBlock() {
    var other = new Block();
    var a = new Input(2, "a", block);
    var foreign = new WireVector(2, "f", other);
    Assertions.assertThrows(WireNetException.class, () -> block.addNet(new LogicNet(OpCode.CONNECT, null, List.of(a), foreign)));
    Assertions.assertThrows(WireNetException.class, () -> other.addNet(new LogicNet(OpCode.CONNECT, null, List.of(a), foreign)));
    Assertions.assertTrue(block.nets().isEmpty());
    Assertions.assertTrue(other.nets().isEmpty());
  }

  @Test
  void testAddNetRejectsUndrivable() {
    var a = new Input(2, "a", block);
    var b = new Input(2, "b", block);
    var c = new Const(1, 2, "c", false, block);
    Assertions.assertThrows(WireNetInternalException.class, () -> block.addNet(new LogicNet(OpCode.CONNECT, null, List.of(a), b)));
    Assertions.assertThrows(WireNetInternalException.class, () -> block.addNet(new LogicNet(OpCode.CONNECT, null, List.of(a), c)));
  }

  @Test
  void testAddForeignWire() {
    var foreign = new WireVector(2, "f", new Block());
    Assertions.assertThrows(WireNetException.class, () -> block.add(foreign));
  }

  @Test
  void testRemoveKeepsNets() {
    var a = new Input(2, "a", block);
    var inv = a.invert();
    block.remove(inv);
    Assertions.assertTrue(block.getWireVector(inv.getName()).isEmpty());
    Assertions.assertEquals(1, block.nets().size());
  }

  @Test
  void testConfiguredPrefixes() {
    var cfg = new WireNetConfig();
    cfg.temp_prefix = "t_";
    cfg.const_prefix = "k";
    var custom = new Block(cfg);
    Assertions.assertEquals("t_0", new WireVector(1, null, custom).getName());
    Assertions.assertEquals("k0_7", new Const(7, null, null, false, custom).getName());
    Assertions.assertSame(cfg, custom.getConfig());
  }

  @Test
  void testCountersPerBlock() {
    var other = new Block();
    Assertions.assertEquals("tmp0", new WireVector(1, null, block).getName());
    Assertions.assertEquals("tmp0", new WireVector(1, null, other).getName());
    Assertions.assertEquals("tmp1", block.makeTempName(""));
  }

  @Test
  void testToString() {
    var a = new Input(2, "a", block);
    var b = new Input(2, "b", block);
    var s = a.and(b);
    var o = new Output(2, "o", block);
    o.assign(s);
    Assertions.assertEquals("tmp0/2W <-- & -- a/2I, b/2I\no/2O <-- w -- tmp0/2W", block.toString());
  }
}
