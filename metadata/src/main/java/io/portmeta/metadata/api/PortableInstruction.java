package io.portmeta.metadata.api;

import java.util.Objects;

/**
 * A CIL instruction.
 *
 * @param opCode opcode name as written in IL, e.g. {@code ldc.i4.s}
 * @param operand operand, or {@code null} for inline-none opcodes
 */
public record PortableInstruction(String opCode, PortableOperand operand) {

  public PortableInstruction {
    Objects.requireNonNull(opCode, "opCode");
  }

  public PortableInstruction(String opCode) {
    this(opCode, null);
  }

  @Override
  public String toString() {
    return operand == null ? opCode : opCode + " " + operand;
  }
}
