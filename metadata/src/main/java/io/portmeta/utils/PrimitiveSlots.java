package io.portmeta.utils;

import io.portmeta.metadata.api.ElementType;
import io.portmeta.metadata.api.InvalidMetadataDataException;
import java.util.Arrays;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Packs primitive constants and operands into a single 64-bit slot and back.
 *
 * <p>Integral values are sign- or zero-extended according to the element type. {@code R4} values
 * are stored as the bits of the float widened to double; the widening and narrowing are done on
 * the bit patterns so NaN payloads survive.
 */
public final class PrimitiveSlots {
  private static final Logger log = LoggerFactory.getLogger(PrimitiveSlots.class);

  private static final int FLOAT_EXPONENT_MASK = 0x7F800000;
  private static final int FLOAT_MANTISSA_MASK = 0x007FFFFF;
  private static final int FLOAT_QUIET_BIT = 0x00400000;
  private static final long DOUBLE_EXPONENT_MASK = 0x7FF0000000000000L;
  private static final long DOUBLE_MANTISSA_MASK = 0x000FFFFFFFFFFFFFL;
  private static final int MANTISSA_SHIFT = 52 - 23;

  private PrimitiveSlots() {}

  /**
   * Widens a float to the bits of a double, keeping NaN payloads.
   *
   * @param value the float
   * @return raw double bits
   */
  public static long floatToSlot(float value) {
    int bits = Float.floatToRawIntBits(value);
    if ((bits & FLOAT_EXPONENT_MASK) == FLOAT_EXPONENT_MASK && (bits & FLOAT_MANTISSA_MASK) != 0) {
      long sign = (long) (bits >>> 31) << 63;
      long mantissa = (long) (bits & FLOAT_MANTISSA_MASK) << MANTISSA_SHIFT;
      return sign | DOUBLE_EXPONENT_MASK | mantissa;
    }
    return Double.doubleToRawLongBits(value);
  }

  /**
   * Narrows the bits of a double back to a float. A NaN whose low mantissa bits are set cannot
   * have come from {@link #floatToSlot(float)}; those bits are dropped with a warning.
   *
   * @param slot raw double bits
   * @return the float
   */
  public static float floatFromSlot(long slot) {
    if ((slot & DOUBLE_EXPONENT_MASK) == DOUBLE_EXPONENT_MASK
        && (slot & DOUBLE_MANTISSA_MASK) != 0) {
      long lost = slot & ((1L << MANTISSA_SHIFT) - 1);
      if (lost != 0) {
        log.warn(
            "Dropping low NaN payload bits 0x{} while narrowing to float",
            Long.toHexString(lost));
      }
      int mantissa = (int) ((slot & DOUBLE_MANTISSA_MASK) >>> MANTISSA_SHIFT);
      if (mantissa == 0) {
        mantissa = FLOAT_QUIET_BIT;
      }
      int sign = (int) (slot >>> 63) << 31;
      return Float.intBitsToFloat(sign | FLOAT_EXPONENT_MASK | mantissa);
    }
    return (float) Double.longBitsToDouble(slot);
  }

  /**
   * Packs a boxed primitive into a slot.
   *
   * @param value value boxed as described by {@link io.portmeta.metadata.api.PortableConstant}
   * @param type element type of the value
   * @return the slot
   * @throws InvalidMetadataDataException if the value does not match the element type
   */
  public static long toSlot(Object value, ElementType type) {
    Objects.requireNonNull(type, "type");
    try {
      switch (type) {
        case BOOLEAN:
          return ((Boolean) value) ? 1 : 0;
        case CHAR:
          return (Character) value;
        case I1:
          return (Byte) value;
        case U1:
          return ((Byte) value) & 0xFFL;
        case I2:
          return (Short) value;
        case U2:
          return ((Short) value) & 0xFFFFL;
        case I4:
          return (Integer) value;
        case U4:
          return ((Integer) value) & 0xFFFFFFFFL;
        case I8:
        case U8:
          return (Long) value;
        case R4:
          return floatToSlot((Float) value);
        case R8:
          return Double.doubleToRawLongBits((Double) value);
        default:
          throw new InvalidMetadataDataException("Element type has no primitive slot: " + type);
      }
    } catch (ClassCastException | NullPointerException e) {
      throw new InvalidMetadataDataException(
          "Value does not match element type " + type, e, String.valueOf(value));
    }
  }

  /**
   * Unpacks a slot into the boxed type matching {@code type}.
   *
   * @throws InvalidMetadataDataException if the element type has no primitive slot
   */
  public static Object fromSlot(long slot, ElementType type) {
    switch (type) {
      case BOOLEAN:
        return slot != 0;
      case CHAR:
        return (char) slot;
      case I1:
      case U1:
        return (byte) slot;
      case I2:
      case U2:
        return (short) slot;
      case I4:
      case U4:
        return (int) slot;
      case I8:
      case U8:
        return slot;
      case R4:
        return floatFromSlot(slot);
      case R8:
        return Double.longBitsToDouble(slot);
      default:
        throw new InvalidMetadataDataException("Element type has no primitive slot: " + type);
    }
  }

  /** True if {@code type} is carried in a primitive slot. */
  public static boolean hasSlot(ElementType type) {
    switch (type) {
      case BOOLEAN:
      case CHAR:
      case I1:
      case U1:
      case I2:
      case U2:
      case I4:
      case U4:
      case I8:
      case U8:
      case R4:
      case R8:
        return true;
      default:
        return false;
    }
  }

  /** Value equality with floats and doubles compared by raw bits and arrays by content. */
  public static boolean valueEquals(Object a, Object b) {
    if (a instanceof Float && b instanceof Float) {
      return Float.floatToRawIntBits((Float) a) == Float.floatToRawIntBits((Float) b);
    }
    if (a instanceof Double && b instanceof Double) {
      return Double.doubleToRawLongBits((Double) a) == Double.doubleToRawLongBits((Double) b);
    }
    if (a instanceof byte[] && b instanceof byte[]) {
      return Arrays.equals((byte[]) a, (byte[]) b);
    }
    return Objects.equals(a, b);
  }
}
