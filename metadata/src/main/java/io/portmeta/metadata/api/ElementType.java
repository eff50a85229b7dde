package io.portmeta.metadata.api;

import java.util.HashMap;
import java.util.Map;

/**
 * ECMA-335 element types as used by {@link PortableComplexTypeKind#TYPE_SIG} complex types.
 *
 * <p>Each constant carries its one-byte code, the name used by the compact text format and the
 * shape of the arguments the complex type holds.
 */
public enum ElementType {
  END(0x00, "End", Shape.LEAF),
  VOID(0x01, "Void", Shape.LEAF),
  BOOLEAN(0x02, "Boolean", Shape.LEAF),
  CHAR(0x03, "Char", Shape.LEAF),
  I1(0x04, "I1", Shape.LEAF),
  U1(0x05, "U1", Shape.LEAF),
  I2(0x06, "I2", Shape.LEAF),
  U2(0x07, "U2", Shape.LEAF),
  I4(0x08, "I4", Shape.LEAF),
  U4(0x09, "U4", Shape.LEAF),
  I8(0x0A, "I8", Shape.LEAF),
  U8(0x0B, "U8", Shape.LEAF),
  R4(0x0C, "R4", Shape.LEAF),
  R8(0x0D, "R8", Shape.LEAF),
  STRING(0x0E, "String", Shape.LEAF),
  PTR(0x0F, "Ptr", Shape.NEXT),
  BY_REF(0x10, "ByRef", Shape.NEXT),
  VALUE_TYPE(0x11, "ValueType", Shape.NEXT),
  CLASS(0x12, "Class", Shape.NEXT),
  VAR(0x13, "Var", Shape.INDEX),
  ARRAY(0x14, "Array", Shape.ARRAY),
  GENERIC_INST(0x15, "GenericInst", Shape.GENERIC_INST),
  TYPED_BY_REF(0x16, "TypedByRef", Shape.LEAF),
  VALUE_ARRAY(0x17, "ValueArray", Shape.VALUE_ARRAY),
  I(0x18, "I", Shape.LEAF),
  U(0x19, "U", Shape.LEAF),
  R(0x1A, "R", Shape.LEAF),
  FN_PTR(0x1B, "FnPtr", Shape.NEXT),
  OBJECT(0x1C, "Object", Shape.LEAF),
  SZ_ARRAY(0x1D, "SZArray", Shape.NEXT),
  MVAR(0x1E, "MVar", Shape.INDEX),
  CMOD_REQD(0x1F, "CModReqd", Shape.MODIFIER),
  CMOD_OPT(0x20, "CModOpt", Shape.MODIFIER),
  MODULE(0x3F, "Module", Shape.MODULE),
  SENTINEL(0x41, "Sentinel", Shape.LEAF),
  PINNED(0x45, "Pinned", Shape.NEXT);

  /** Argument layout of a type signature. */
  public enum Shape {
    /** No arguments. */
    LEAF,
    /** {@code next}. */
    NEXT,
    /** {@code Int32 index}. */
    INDEX,
    /** {@code next, rank, numSizes, sizes..., numLowerBounds, lowerBounds...}. */
    ARRAY,
    /** {@code next, numArgs, args...}. */
    GENERIC_INST,
    /** {@code next, size}. */
    VALUE_ARRAY,
    /** {@code modifier, next}. */
    MODIFIER,
    /** {@code index, next}. */
    MODULE
  }

  private static final ElementType[] BY_CODE = new ElementType[0x100];
  private static final Map<String, ElementType> BY_NAME = new HashMap<>();

  static {
    for (ElementType type : values()) {
      BY_CODE[type.code] = type;
      BY_NAME.put(type.displayName, type);
    }
  }

  private final int code;
  private final String displayName;
  private final Shape shape;

  ElementType(int code, String displayName, Shape shape) {
    this.code = code;
    this.displayName = displayName;
    this.shape = shape;
  }

  public int getCode() {
    return code;
  }

  /** The name used by the compact text format. */
  public String getDisplayName() {
    return displayName;
  }

  public Shape getShape() {
    return shape;
  }

  /** Returns the element type with the given code, or {@code null} if there is none. */
  public static ElementType fromCode(int code) {
    return code >= 0 && code < BY_CODE.length ? BY_CODE[code] : null;
  }

  /** Returns the element type with the given compact-format name, or {@code null}. */
  public static ElementType fromDisplayName(String name) {
    return BY_NAME.get(name);
  }

  /**
   * @param code the element type code
   * @return the element type
   * @throws InvalidMetadataDataException if the code is unknown
   */
  public static ElementType require(int code) {
    ElementType type = fromCode(code);
    if (type == null) {
      throw InvalidMetadataDataException.unknownCode("element type", code);
    }
    return type;
  }

  /** True for the unsigned integral types whose slot value is zero-extended. */
  public boolean isUnsigned() {
    return this == CHAR || this == U1 || this == U2 || this == U4 || this == U8 || this == U;
  }
}
