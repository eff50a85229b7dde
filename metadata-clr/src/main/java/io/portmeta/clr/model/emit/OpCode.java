package io.portmeta.clr.model.emit;

import java.util.HashMap;
import java.util.Map;

/** CIL opcodes keyed by their textual name, e.g. {@code ldarg.s} or {@code constrained.}. */
public enum OpCode {
  NOP("nop", 0x00, OperandType.INLINE_NONE),
  BREAK("break", 0x01, OperandType.INLINE_NONE),
  LDARG_0("ldarg.0", 0x02, OperandType.INLINE_NONE),
  LDARG_1("ldarg.1", 0x03, OperandType.INLINE_NONE),
  LDARG_2("ldarg.2", 0x04, OperandType.INLINE_NONE),
  LDARG_3("ldarg.3", 0x05, OperandType.INLINE_NONE),
  LDLOC_0("ldloc.0", 0x06, OperandType.INLINE_NONE),
  LDLOC_1("ldloc.1", 0x07, OperandType.INLINE_NONE),
  LDLOC_2("ldloc.2", 0x08, OperandType.INLINE_NONE),
  LDLOC_3("ldloc.3", 0x09, OperandType.INLINE_NONE),
  STLOC_0("stloc.0", 0x0A, OperandType.INLINE_NONE),
  STLOC_1("stloc.1", 0x0B, OperandType.INLINE_NONE),
  STLOC_2("stloc.2", 0x0C, OperandType.INLINE_NONE),
  STLOC_3("stloc.3", 0x0D, OperandType.INLINE_NONE),
  LDARG_S("ldarg.s", 0x0E, OperandType.SHORT_INLINE_VAR),
  LDARGA_S("ldarga.s", 0x0F, OperandType.SHORT_INLINE_VAR),
  STARG_S("starg.s", 0x10, OperandType.SHORT_INLINE_VAR),
  LDLOC_S("ldloc.s", 0x11, OperandType.SHORT_INLINE_VAR),
  LDLOCA_S("ldloca.s", 0x12, OperandType.SHORT_INLINE_VAR),
  STLOC_S("stloc.s", 0x13, OperandType.SHORT_INLINE_VAR),
  LDNULL("ldnull", 0x14, OperandType.INLINE_NONE),
  LDC_I4_M1("ldc.i4.m1", 0x15, OperandType.INLINE_NONE),
  LDC_I4_0("ldc.i4.0", 0x16, OperandType.INLINE_NONE),
  LDC_I4_1("ldc.i4.1", 0x17, OperandType.INLINE_NONE),
  LDC_I4_2("ldc.i4.2", 0x18, OperandType.INLINE_NONE),
  LDC_I4_3("ldc.i4.3", 0x19, OperandType.INLINE_NONE),
  LDC_I4_4("ldc.i4.4", 0x1A, OperandType.INLINE_NONE),
  LDC_I4_5("ldc.i4.5", 0x1B, OperandType.INLINE_NONE),
  LDC_I4_6("ldc.i4.6", 0x1C, OperandType.INLINE_NONE),
  LDC_I4_7("ldc.i4.7", 0x1D, OperandType.INLINE_NONE),
  LDC_I4_8("ldc.i4.8", 0x1E, OperandType.INLINE_NONE),
  LDC_I4_S("ldc.i4.s", 0x1F, OperandType.SHORT_INLINE_I),
  LDC_I4("ldc.i4", 0x20, OperandType.INLINE_I),
  LDC_I8("ldc.i8", 0x21, OperandType.INLINE_I8),
  LDC_R4("ldc.r4", 0x22, OperandType.SHORT_INLINE_R),
  LDC_R8("ldc.r8", 0x23, OperandType.INLINE_R),
  DUP("dup", 0x25, OperandType.INLINE_NONE),
  POP("pop", 0x26, OperandType.INLINE_NONE),
  JMP("jmp", 0x27, OperandType.INLINE_METHOD),
  CALL("call", 0x28, OperandType.INLINE_METHOD),
  CALLI("calli", 0x29, OperandType.INLINE_SIG),
  RET("ret", 0x2A, OperandType.INLINE_NONE),
  BR_S("br.s", 0x2B, OperandType.SHORT_INLINE_BR_TARGET),
  BRFALSE_S("brfalse.s", 0x2C, OperandType.SHORT_INLINE_BR_TARGET),
  BRTRUE_S("brtrue.s", 0x2D, OperandType.SHORT_INLINE_BR_TARGET),
  BEQ_S("beq.s", 0x2E, OperandType.SHORT_INLINE_BR_TARGET),
  BGE_S("bge.s", 0x2F, OperandType.SHORT_INLINE_BR_TARGET),
  BGT_S("bgt.s", 0x30, OperandType.SHORT_INLINE_BR_TARGET),
  BLE_S("ble.s", 0x31, OperandType.SHORT_INLINE_BR_TARGET),
  BLT_S("blt.s", 0x32, OperandType.SHORT_INLINE_BR_TARGET),
  BNE_UN_S("bne.un.s", 0x33, OperandType.SHORT_INLINE_BR_TARGET),
  BGE_UN_S("bge.un.s", 0x34, OperandType.SHORT_INLINE_BR_TARGET),
  BGT_UN_S("bgt.un.s", 0x35, OperandType.SHORT_INLINE_BR_TARGET),
  BLE_UN_S("ble.un.s", 0x36, OperandType.SHORT_INLINE_BR_TARGET),
  BLT_UN_S("blt.un.s", 0x37, OperandType.SHORT_INLINE_BR_TARGET),
  BR("br", 0x38, OperandType.INLINE_BR_TARGET),
  BRFALSE("brfalse", 0x39, OperandType.INLINE_BR_TARGET),
  BRTRUE("brtrue", 0x3A, OperandType.INLINE_BR_TARGET),
  BEQ("beq", 0x3B, OperandType.INLINE_BR_TARGET),
  BGE("bge", 0x3C, OperandType.INLINE_BR_TARGET),
  BGT("bgt", 0x3D, OperandType.INLINE_BR_TARGET),
  BLE("ble", 0x3E, OperandType.INLINE_BR_TARGET),
  BLT("blt", 0x3F, OperandType.INLINE_BR_TARGET),
  BNE_UN("bne.un", 0x40, OperandType.INLINE_BR_TARGET),
  BGE_UN("bge.un", 0x41, OperandType.INLINE_BR_TARGET),
  BGT_UN("bgt.un", 0x42, OperandType.INLINE_BR_TARGET),
  BLE_UN("ble.un", 0x43, OperandType.INLINE_BR_TARGET),
  BLT_UN("blt.un", 0x44, OperandType.INLINE_BR_TARGET),
  SWITCH("switch", 0x45, OperandType.INLINE_SWITCH),
  LDIND_I1("ldind.i1", 0x46, OperandType.INLINE_NONE),
  LDIND_U1("ldind.u1", 0x47, OperandType.INLINE_NONE),
  LDIND_I2("ldind.i2", 0x48, OperandType.INLINE_NONE),
  LDIND_U2("ldind.u2", 0x49, OperandType.INLINE_NONE),
  LDIND_I4("ldind.i4", 0x4A, OperandType.INLINE_NONE),
  LDIND_U4("ldind.u4", 0x4B, OperandType.INLINE_NONE),
  LDIND_I8("ldind.i8", 0x4C, OperandType.INLINE_NONE),
  LDIND_I("ldind.i", 0x4D, OperandType.INLINE_NONE),
  LDIND_R4("ldind.r4", 0x4E, OperandType.INLINE_NONE),
  LDIND_R8("ldind.r8", 0x4F, OperandType.INLINE_NONE),
  LDIND_REF("ldind.ref", 0x50, OperandType.INLINE_NONE),
  STIND_REF("stind.ref", 0x51, OperandType.INLINE_NONE),
  STIND_I1("stind.i1", 0x52, OperandType.INLINE_NONE),
  STIND_I2("stind.i2", 0x53, OperandType.INLINE_NONE),
  STIND_I4("stind.i4", 0x54, OperandType.INLINE_NONE),
  STIND_I8("stind.i8", 0x55, OperandType.INLINE_NONE),
  STIND_R4("stind.r4", 0x56, OperandType.INLINE_NONE),
  STIND_R8("stind.r8", 0x57, OperandType.INLINE_NONE),
  ADD("add", 0x58, OperandType.INLINE_NONE),
  SUB("sub", 0x59, OperandType.INLINE_NONE),
  MUL("mul", 0x5A, OperandType.INLINE_NONE),
  DIV("div", 0x5B, OperandType.INLINE_NONE),
  DIV_UN("div.un", 0x5C, OperandType.INLINE_NONE),
  REM("rem", 0x5D, OperandType.INLINE_NONE),
  REM_UN("rem.un", 0x5E, OperandType.INLINE_NONE),
  AND("and", 0x5F, OperandType.INLINE_NONE),
  OR("or", 0x60, OperandType.INLINE_NONE),
  XOR("xor", 0x61, OperandType.INLINE_NONE),
  SHL("shl", 0x62, OperandType.INLINE_NONE),
  SHR("shr", 0x63, OperandType.INLINE_NONE),
  SHR_UN("shr.un", 0x64, OperandType.INLINE_NONE),
  NEG("neg", 0x65, OperandType.INLINE_NONE),
  NOT("not", 0x66, OperandType.INLINE_NONE),
  CONV_I1("conv.i1", 0x67, OperandType.INLINE_NONE),
  CONV_I2("conv.i2", 0x68, OperandType.INLINE_NONE),
  CONV_I4("conv.i4", 0x69, OperandType.INLINE_NONE),
  CONV_I8("conv.i8", 0x6A, OperandType.INLINE_NONE),
  CONV_R4("conv.r4", 0x6B, OperandType.INLINE_NONE),
  CONV_R8("conv.r8", 0x6C, OperandType.INLINE_NONE),
  CONV_U4("conv.u4", 0x6D, OperandType.INLINE_NONE),
  CONV_U8("conv.u8", 0x6E, OperandType.INLINE_NONE),
  CALLVIRT("callvirt", 0x6F, OperandType.INLINE_METHOD),
  CPOBJ("cpobj", 0x70, OperandType.INLINE_TYPE),
  LDOBJ("ldobj", 0x71, OperandType.INLINE_TYPE),
  LDSTR("ldstr", 0x72, OperandType.INLINE_STRING),
  NEWOBJ("newobj", 0x73, OperandType.INLINE_METHOD),
  CASTCLASS("castclass", 0x74, OperandType.INLINE_TYPE),
  ISINST("isinst", 0x75, OperandType.INLINE_TYPE),
  CONV_R_UN("conv.r.un", 0x76, OperandType.INLINE_NONE),
  UNBOX("unbox", 0x79, OperandType.INLINE_TYPE),
  THROW("throw", 0x7A, OperandType.INLINE_NONE),
  LDFLD("ldfld", 0x7B, OperandType.INLINE_FIELD),
  LDFLDA("ldflda", 0x7C, OperandType.INLINE_FIELD),
  STFLD("stfld", 0x7D, OperandType.INLINE_FIELD),
  LDSFLD("ldsfld", 0x7E, OperandType.INLINE_FIELD),
  LDSFLDA("ldsflda", 0x7F, OperandType.INLINE_FIELD),
  STSFLD("stsfld", 0x80, OperandType.INLINE_FIELD),
  STOBJ("stobj", 0x81, OperandType.INLINE_TYPE),
  CONV_OVF_I1_UN("conv.ovf.i1.un", 0x82, OperandType.INLINE_NONE),
  CONV_OVF_I2_UN("conv.ovf.i2.un", 0x83, OperandType.INLINE_NONE),
  CONV_OVF_I4_UN("conv.ovf.i4.un", 0x84, OperandType.INLINE_NONE),
  CONV_OVF_I8_UN("conv.ovf.i8.un", 0x85, OperandType.INLINE_NONE),
  CONV_OVF_U1_UN("conv.ovf.u1.un", 0x86, OperandType.INLINE_NONE),
  CONV_OVF_U2_UN("conv.ovf.u2.un", 0x87, OperandType.INLINE_NONE),
  CONV_OVF_U4_UN("conv.ovf.u4.un", 0x88, OperandType.INLINE_NONE),
  CONV_OVF_U8_UN("conv.ovf.u8.un", 0x89, OperandType.INLINE_NONE),
  CONV_OVF_I_UN("conv.ovf.i.un", 0x8A, OperandType.INLINE_NONE),
  CONV_OVF_U_UN("conv.ovf.u.un", 0x8B, OperandType.INLINE_NONE),
  BOX("box", 0x8C, OperandType.INLINE_TYPE),
  NEWARR("newarr", 0x8D, OperandType.INLINE_TYPE),
  LDLEN("ldlen", 0x8E, OperandType.INLINE_NONE),
  LDELEMA("ldelema", 0x8F, OperandType.INLINE_TYPE),
  LDELEM_I1("ldelem.i1", 0x90, OperandType.INLINE_NONE),
  LDELEM_U1("ldelem.u1", 0x91, OperandType.INLINE_NONE),
  LDELEM_I2("ldelem.i2", 0x92, OperandType.INLINE_NONE),
  LDELEM_U2("ldelem.u2", 0x93, OperandType.INLINE_NONE),
  LDELEM_I4("ldelem.i4", 0x94, OperandType.INLINE_NONE),
  LDELEM_U4("ldelem.u4", 0x95, OperandType.INLINE_NONE),
  LDELEM_I8("ldelem.i8", 0x96, OperandType.INLINE_NONE),
  LDELEM_I("ldelem.i", 0x97, OperandType.INLINE_NONE),
  LDELEM_R4("ldelem.r4", 0x98, OperandType.INLINE_NONE),
  LDELEM_R8("ldelem.r8", 0x99, OperandType.INLINE_NONE),
  LDELEM_REF("ldelem.ref", 0x9A, OperandType.INLINE_NONE),
  STELEM_I("stelem.i", 0x9B, OperandType.INLINE_NONE),
  STELEM_I1("stelem.i1", 0x9C, OperandType.INLINE_NONE),
  STELEM_I2("stelem.i2", 0x9D, OperandType.INLINE_NONE),
  STELEM_I4("stelem.i4", 0x9E, OperandType.INLINE_NONE),
  STELEM_I8("stelem.i8", 0x9F, OperandType.INLINE_NONE),
  STELEM_R4("stelem.r4", 0xA0, OperandType.INLINE_NONE),
  STELEM_R8("stelem.r8", 0xA1, OperandType.INLINE_NONE),
  STELEM_REF("stelem.ref", 0xA2, OperandType.INLINE_NONE),
  LDELEM("ldelem", 0xA3, OperandType.INLINE_TYPE),
  STELEM("stelem", 0xA4, OperandType.INLINE_TYPE),
  UNBOX_ANY("unbox.any", 0xA5, OperandType.INLINE_TYPE),
  CONV_OVF_I1("conv.ovf.i1", 0xB3, OperandType.INLINE_NONE),
  CONV_OVF_U1("conv.ovf.u1", 0xB4, OperandType.INLINE_NONE),
  CONV_OVF_I2("conv.ovf.i2", 0xB5, OperandType.INLINE_NONE),
  CONV_OVF_U2("conv.ovf.u2", 0xB6, OperandType.INLINE_NONE),
  CONV_OVF_I4("conv.ovf.i4", 0xB7, OperandType.INLINE_NONE),
  CONV_OVF_U4("conv.ovf.u4", 0xB8, OperandType.INLINE_NONE),
  CONV_OVF_I8("conv.ovf.i8", 0xB9, OperandType.INLINE_NONE),
  CONV_OVF_U8("conv.ovf.u8", 0xBA, OperandType.INLINE_NONE),
  REFANYVAL("refanyval", 0xC2, OperandType.INLINE_TYPE),
  CKFINITE("ckfinite", 0xC3, OperandType.INLINE_NONE),
  MKREFANY("mkrefany", 0xC6, OperandType.INLINE_TYPE),
  LDTOKEN("ldtoken", 0xD0, OperandType.INLINE_TOK),
  CONV_U2("conv.u2", 0xD1, OperandType.INLINE_NONE),
  CONV_U1("conv.u1", 0xD2, OperandType.INLINE_NONE),
  CONV_I("conv.i", 0xD3, OperandType.INLINE_NONE),
  CONV_OVF_I("conv.ovf.i", 0xD4, OperandType.INLINE_NONE),
  CONV_OVF_U("conv.ovf.u", 0xD5, OperandType.INLINE_NONE),
  ADD_OVF("add.ovf", 0xD6, OperandType.INLINE_NONE),
  ADD_OVF_UN("add.ovf.un", 0xD7, OperandType.INLINE_NONE),
  MUL_OVF("mul.ovf", 0xD8, OperandType.INLINE_NONE),
  MUL_OVF_UN("mul.ovf.un", 0xD9, OperandType.INLINE_NONE),
  SUB_OVF("sub.ovf", 0xDA, OperandType.INLINE_NONE),
  SUB_OVF_UN("sub.ovf.un", 0xDB, OperandType.INLINE_NONE),
  ENDFINALLY("endfinally", 0xDC, OperandType.INLINE_NONE),
  LEAVE("leave", 0xDD, OperandType.INLINE_BR_TARGET),
  LEAVE_S("leave.s", 0xDE, OperandType.SHORT_INLINE_BR_TARGET),
  STIND_I("stind.i", 0xDF, OperandType.INLINE_NONE),
  CONV_U("conv.u", 0xE0, OperandType.INLINE_NONE),
  ARGLIST("arglist", 0xFE00, OperandType.INLINE_NONE),
  CEQ("ceq", 0xFE01, OperandType.INLINE_NONE),
  CGT("cgt", 0xFE02, OperandType.INLINE_NONE),
  CGT_UN("cgt.un", 0xFE03, OperandType.INLINE_NONE),
  CLT("clt", 0xFE04, OperandType.INLINE_NONE),
  CLT_UN("clt.un", 0xFE05, OperandType.INLINE_NONE),
  LDFTN("ldftn", 0xFE06, OperandType.INLINE_METHOD),
  LDVIRTFTN("ldvirtftn", 0xFE07, OperandType.INLINE_METHOD),
  LDARG("ldarg", 0xFE09, OperandType.INLINE_VAR),
  LDARGA("ldarga", 0xFE0A, OperandType.INLINE_VAR),
  STARG("starg", 0xFE0B, OperandType.INLINE_VAR),
  LDLOC("ldloc", 0xFE0C, OperandType.INLINE_VAR),
  LDLOCA("ldloca", 0xFE0D, OperandType.INLINE_VAR),
  STLOC("stloc", 0xFE0E, OperandType.INLINE_VAR),
  LOCALLOC("localloc", 0xFE0F, OperandType.INLINE_NONE),
  ENDFILTER("endfilter", 0xFE11, OperandType.INLINE_NONE),
  UNALIGNED("unaligned.", 0xFE12, OperandType.SHORT_INLINE_I),
  VOLATILE("volatile.", 0xFE13, OperandType.INLINE_NONE),
  TAIL("tail.", 0xFE14, OperandType.INLINE_NONE),
  INITOBJ("initobj", 0xFE15, OperandType.INLINE_TYPE),
  CONSTRAINED("constrained.", 0xFE16, OperandType.INLINE_TYPE),
  CPBLK("cpblk", 0xFE17, OperandType.INLINE_NONE),
  INITBLK("initblk", 0xFE18, OperandType.INLINE_NONE),
  NO("no.", 0xFE19, OperandType.SHORT_INLINE_I),
  RETHROW("rethrow", 0xFE1A, OperandType.INLINE_NONE),
  SIZEOF("sizeof", 0xFE1C, OperandType.INLINE_TYPE),
  REFANYTYPE("refanytype", 0xFE1D, OperandType.INLINE_NONE),
  READONLY("readonly.", 0xFE1E, OperandType.INLINE_NONE);

  private static final Map<String, OpCode> BY_NAME = new HashMap<>();

  static {
    for (OpCode opCode : values()) {
      BY_NAME.put(opCode.name, opCode);
    }
  }

  private final String name;
  private final int code;
  private final OperandType operandType;

  OpCode(String name, int code, OperandType operandType) {
    this.name = name;
    this.code = code;
    this.operandType = operandType;
  }

  public String getName() {
    return name;
  }

  /** One-byte value, or {@code 0xFExx} for two-byte opcodes. */
  public int getCode() {
    return code;
  }

  public OperandType getOperandType() {
    return operandType;
  }

  /** Whether a variable operand names an argument rather than a local. */
  public boolean isArgumentAccess() {
    switch (this) {
      case LDARG:
      case LDARG_S:
      case LDARGA:
      case LDARGA_S:
      case STARG:
      case STARG_S:
        return true;
      default:
        return false;
    }
  }

  /** @return the opcode, or {@code null} if {@code name} is unknown */
  public static OpCode fromName(String name) {
    return BY_NAME.get(name);
  }

  @Override
  public String toString() {
    return name;
  }
}
