package io.portmeta.metadata.api;

import io.portmeta.utils.PrimitiveSlots;
import java.util.Objects;

/**
 * Default value of a field or parameter.
 *
 * <p>{@code value} is boxed with the Java type of the same width as the element type: {@code
 * Boolean}, {@code Character}, {@code Byte} (I1, U1), {@code Short} (I2, U2), {@code Integer}
 * (I4, U4), {@code Long} (I8, U8), {@code Float}, {@code Double}, {@code String}. A {@code
 * Class} constant has a {@code null} value.
 *
 * @param type element type code
 * @param value boxed value
 */
public record PortableConstant(int type, Object value) {

  public static PortableConstant of(ElementType type, Object value) {
    return new PortableConstant(type.getCode(), value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PortableConstant)) {
      return false;
    }
    PortableConstant that = (PortableConstant) o;
    return type == that.type && PrimitiveSlots.valueEquals(value, that.value);
  }

  @Override
  public int hashCode() {
    return type * 31 + Objects.hashCode(value);
  }
}
