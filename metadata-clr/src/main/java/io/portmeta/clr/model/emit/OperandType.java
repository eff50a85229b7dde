package io.portmeta.clr.model.emit;

/** Encoding of the operand that follows an opcode. */
public enum OperandType {
  INLINE_BR_TARGET,
  INLINE_FIELD,
  INLINE_I,
  INLINE_I8,
  INLINE_METHOD,
  INLINE_NONE,
  INLINE_PHI,
  INLINE_R,
  INLINE_SIG,
  INLINE_STRING,
  INLINE_SWITCH,
  INLINE_TOK,
  INLINE_TYPE,
  INLINE_VAR,
  SHORT_INLINE_BR_TARGET,
  SHORT_INLINE_I,
  SHORT_INLINE_R,
  SHORT_INLINE_VAR
}
