package io.portmeta.utils;

import static org.junit.jupiter.api.Assertions.*;

import io.portmeta.metadata.api.ElementType;
import io.portmeta.metadata.api.InvalidMetadataDataException;
import org.junit.jupiter.api.Test;

class PrimitiveSlotsTest {

  @Test
  void testFloatNanPayloadSurvivesWidening() {
    float nan = Float.intBitsToFloat(0xFFC0BEEF);
    long slot = PrimitiveSlots.floatToSlot(nan);
    assertTrue(Double.isNaN(Double.longBitsToDouble(slot)));
    assertTrue(slot < 0);
    assertEquals(0xFFC0BEEF, Float.floatToRawIntBits(PrimitiveSlots.floatFromSlot(slot)));
  }

  @Test
  void testOrdinaryFloatsWidenToTheirDoubleValue() {
    assertEquals(Double.doubleToRawLongBits(1.5d), PrimitiveSlots.floatToSlot(1.5f));
    assertEquals(-0.0f, PrimitiveSlots.floatFromSlot(Double.doubleToRawLongBits(-0.0d)));
    assertEquals(
        Float.MIN_VALUE,
        PrimitiveSlots.floatFromSlot(PrimitiveSlots.floatToSlot(Float.MIN_VALUE)));
  }

  @Test
  void testDoubleOnlyNanNarrowsToQuietNan() {
    long slot = 0x7FF0000000000001L;
    float narrowed = PrimitiveSlots.floatFromSlot(slot);
    assertTrue(Float.isNaN(narrowed));
    assertEquals(0x7FC00000, Float.floatToRawIntBits(narrowed));
  }

  @Test
  void testUnsignedTypesAreZeroExtended() {
    assertEquals(0xFFL, PrimitiveSlots.toSlot((byte) -1, ElementType.U1));
    assertEquals(-1L, PrimitiveSlots.toSlot((byte) -1, ElementType.I1));
    assertEquals(0xFFFEL, PrimitiveSlots.toSlot((short) -2, ElementType.U2));
    assertEquals(0xFFFFFFFFL, PrimitiveSlots.toSlot(-1, ElementType.U4));
    assertEquals(-1L, PrimitiveSlots.toSlot(-1, ElementType.I4));
    assertEquals(65L, PrimitiveSlots.toSlot('A', ElementType.CHAR));
    assertEquals(1L, PrimitiveSlots.toSlot(true, ElementType.BOOLEAN));
  }

  @Test
  void testSlotsUnpackToTheBoxOfTheSameWidth() {
    assertEquals(Byte.valueOf((byte) -1), PrimitiveSlots.fromSlot(0xFFL, ElementType.U1));
    assertEquals(Integer.valueOf(-1), PrimitiveSlots.fromSlot(0xFFFFFFFFL, ElementType.U4));
    assertEquals(
        Long.valueOf(Long.MIN_VALUE), PrimitiveSlots.fromSlot(Long.MIN_VALUE, ElementType.U8));
    assertEquals(Boolean.FALSE, PrimitiveSlots.fromSlot(0, ElementType.BOOLEAN));
    assertEquals(Character.valueOf('B'), PrimitiveSlots.fromSlot(66, ElementType.CHAR));
  }

  @Test
  void testMismatchedValuesAreInvalidData() {
    InvalidMetadataDataException e =
        assertThrows(
            InvalidMetadataDataException.class,
            () -> PrimitiveSlots.toSlot("x", ElementType.I4));
    assertTrue(e.getMessage().contains("I4"));
    assertThrows(
        InvalidMetadataDataException.class, () -> PrimitiveSlots.toSlot(1, ElementType.I8));
    assertThrows(
        InvalidMetadataDataException.class, () -> PrimitiveSlots.toSlot(null, ElementType.R8));
    assertThrows(
        InvalidMetadataDataException.class,
        () -> PrimitiveSlots.fromSlot(0, ElementType.STRING));
    assertFalse(PrimitiveSlots.hasSlot(ElementType.STRING));
    assertTrue(PrimitiveSlots.hasSlot(ElementType.R4));
  }

  @Test
  void testValueEqualityComparesFloatingBits() {
    assertFalse(PrimitiveSlots.valueEquals(0.0d, -0.0d));
    assertTrue(PrimitiveSlots.valueEquals(Float.NaN, Float.NaN));
    assertTrue(PrimitiveSlots.valueEquals(new byte[] {1, 2}, new byte[] {1, 2}));
    assertTrue(PrimitiveSlots.valueEquals(null, null));
  }
}
