package wirenet.util;

import java.math.BigInteger;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import wirenet.WireNetException;

class LiteralsTest {

  private static void assertInferred(long value, int bitwidth, Literals.ValueAndWidth actual) {
    Assertions.assertEquals(BigInteger.valueOf(value), actual.value());
    Assertions.assertEquals(bitwidth, actual.bitwidth());
  }

  @Test
  void testBooleans() {
    assertInferred(1, 1, Literals.infer(true));
    assertInferred(0, 1, Literals.infer(false));
    assertInferred(1, 4, Literals.infer(true, 4, false));
    Assertions.assertThrows(WireNetException.class, () -> Literals.infer(true, null, true));
  }

  @Test
  void testUnsignedIntegers() {
    assertInferred(0, 1, Literals.infer(0));
    assertInferred(1, 1, Literals.infer(1));
    assertInferred(2, 2, Literals.infer(2));
    assertInferred(255, 8, Literals.infer(255));
    assertInferred(256, 9, Literals.infer(256L));
    assertInferred(3, 2, Literals.infer((short)3));
    assertInferred(3, 2, Literals.infer((byte)3));
    assertInferred(5, 10, Literals.infer(5, 10, false));
  }

  @Test
  void testSignedIntegers() {
    assertInferred(0, 1, Literals.infer(0, null, true));
    assertInferred(5, 4, Literals.infer(5, null, true));
    assertInferred(0b111, 3, Literals.infer(-1, 3, false));
    assertInferred(0b1, 1, Literals.infer(-1, null, true));
    assertInferred(0b10, 2, Literals.infer(-2, null, true));
    assertInferred(0b101, 3, Literals.infer(-3, null, true));
    assertInferred(0xF8, 8, Literals.infer(-8, 8, true));
  }

  @Test
  void testNegativeNeedsWidthOrSigned() {
    var ex = Assertions.assertThrows(WireNetException.class, () -> Literals.infer(-1));
    Assertions.assertTrue(ex.getMessage().contains("negative"));
    Assertions.assertThrows(WireNetException.class, () -> Literals.infer(-8, 3, false));
  }

  @Test
  void testInsufficientBitwidth() {
    Assertions.assertThrows(WireNetException.class, () -> Literals.infer(4, 2, false));
    Assertions.assertThrows(WireNetException.class, () -> Literals.infer(4, 3, true));
  }

  @Test
  void testBigIntegers() {
    var big = BigInteger.ONE.shiftLeft(100);
    var inferred = Literals.infer(big);
    Assertions.assertEquals(big, inferred.value());
    Assertions.assertEquals(101, inferred.bitwidth());
  }

  @Test
  void testVerilogStrings() {
    assertInferred(0xff, 8, Literals.infer("8'hff"));
    assertInferred(0xAB, 12, Literals.infer("12'hAB"));
    assertInferred(10, 4, Literals.infer("4'b1010"));
    assertInferred(063, 6, Literals.infer("6'o63"));
    assertInferred(1000, 12, Literals.infer("12'd1_000"));
    assertInferred(0, 3, Literals.infer("3'b0", 3, false));
  }

  @ParameterizedTest
  @ValueSource(strings = {"ff", "8'", "8'hfff", "8'x12", "8'sh1", "0'h0", "a'h1", "8'hzz", "8'h1'h1", "-1'b1"})
  void testBadVerilogStrings(String literal) {
    Assertions.assertThrows(WireNetException.class, () -> Literals.infer(literal));
  }

  @Test
  void testVerilogStringWidthMismatch() {
    Assertions.assertThrows(WireNetException.class, () -> Literals.infer("8'hff", 16, false));
    Assertions.assertThrows(WireNetException.class, () -> Literals.infer("8'hff", null, true));
  }

  @Test
  void testImproperTypes() {
    Assertions.assertThrows(WireNetException.class, () -> Literals.infer(null));
    Assertions.assertThrows(WireNetException.class, () -> Literals.infer(2.0));
    Assertions.assertThrows(WireNetException.class, () -> Literals.infer('a'));
  }

  @Test
  void testInvalidBitwidth() {
    Assertions.assertThrows(WireNetException.class, () -> Literals.infer(1, 0, false));
    Assertions.assertThrows(WireNetException.class, () -> Literals.infer(1, -3, false));
  }
}
