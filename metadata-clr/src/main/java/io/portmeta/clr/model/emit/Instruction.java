package io.portmeta.clr.model.emit;

import java.util.Objects;

/**
 * One CIL instruction. Instructions have identity: branch operands and exception handlers point
 * at instances.
 *
 * <p>The operand's Java type follows {@link OpCode#getOperandType()}: {@code Instruction} for
 * branches, {@code List<Instruction>} for {@code switch}, {@code Byte} for short integers
 * ({@code ldc.i4.s} reads it signed, {@code unaligned.} and {@code no.} unsigned), {@code
 * Integer}, {@code Long}, {@code Float}, {@code Double}, {@code String}, {@link Local} or {@link
 * Parameter} for variables, and model objects for tokens.
 */
public final class Instruction {
  private final OpCode opCode;
  private Object operand;

  public Instruction(OpCode opCode) {
    this(opCode, null);
  }

  public Instruction(OpCode opCode, Object operand) {
    this.opCode = Objects.requireNonNull(opCode, "opCode");
    this.operand = operand;
  }

  public OpCode getOpCode() {
    return opCode;
  }

  public Object getOperand() {
    return operand;
  }

  public void setOperand(Object operand) {
    this.operand = operand;
  }

  @Override
  public String toString() {
    if (operand == null) {
      return opCode.getName();
    }
    if (operand instanceof Instruction) {
      return opCode.getName() + " -> " + ((Instruction) operand).opCode.getName();
    }
    return opCode.getName() + " " + operand;
  }
}
