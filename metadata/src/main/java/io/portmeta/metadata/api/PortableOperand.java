package io.portmeta.metadata.api;

import java.util.Arrays;
import java.util.Objects;

/**
 * Operand of a {@link PortableInstruction}. Branch targets are stored as {@link Int32} instruction
 * indices; local and argument operands as {@link Int32} indices.
 */
public sealed interface PortableOperand {

  static PortableOperand of(int value) {
    return new Int32(value);
  }

  static PortableOperand of(long value) {
    return new Int64(value);
  }

  static PortableOperand of(float value) {
    return new Float32(value);
  }

  static PortableOperand of(double value) {
    return new Float64(value);
  }

  static PortableOperand of(String value) {
    return new Str(value);
  }

  static PortableOperand of(int[] targets) {
    return new Switch(targets);
  }

  static PortableOperand of(PortableComplexType type) {
    return new Type(type);
  }

  record Int32(int value) implements PortableOperand {}

  record Int64(long value) implements PortableOperand {}

  /** Compared by raw bits so NaN payloads are kept apart. */
  record Float32(float value) implements PortableOperand {
    @Override
    public boolean equals(Object o) {
      return o instanceof Float32
          && Float.floatToRawIntBits(value) == Float.floatToRawIntBits(((Float32) o).value);
    }

    @Override
    public int hashCode() {
      return Float.floatToRawIntBits(value);
    }
  }

  /** Compared by raw bits so NaN payloads are kept apart. */
  record Float64(double value) implements PortableOperand {
    @Override
    public boolean equals(Object o) {
      return o instanceof Float64
          && Double.doubleToRawLongBits(value) == Double.doubleToRawLongBits(((Float64) o).value);
    }

    @Override
    public int hashCode() {
      return Long.hashCode(Double.doubleToRawLongBits(value));
    }
  }

  record Str(String value) implements PortableOperand {
    public Str {
      Objects.requireNonNull(value, "value");
    }
  }

  /** Switch targets as instruction indices. */
  record Switch(int[] targets) implements PortableOperand {
    public Switch {
      Objects.requireNonNull(targets, "targets");
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Switch && Arrays.equals(targets, ((Switch) o).targets);
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(targets);
    }

    @Override
    public String toString() {
      return "Switch" + Arrays.toString(targets);
    }
  }

  record Type(PortableComplexType value) implements PortableOperand {
    public Type {
      Objects.requireNonNull(value, "value");
    }
  }
}
