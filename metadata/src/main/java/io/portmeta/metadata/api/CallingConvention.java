package io.portmeta.metadata.api;

import java.util.HashMap;
import java.util.Map;

/**
 * Calling conventions as used by {@link PortableComplexTypeKind#CALLING_CONVENTION_SIG} complex
 * types. The low nibble of the signature flags selects the convention; the remaining bits are
 * {@link #GENERIC}, {@link #HAS_THIS} and {@link #EXPLICIT_THIS}.
 */
public enum CallingConvention {
  DEFAULT(0x0, "Default", Shape.METHOD),
  C(0x1, "C", Shape.METHOD),
  STD_CALL(0x2, "StdCall", Shape.METHOD),
  THIS_CALL(0x3, "ThisCall", Shape.METHOD),
  FAST_CALL(0x4, "FastCall", Shape.METHOD),
  VAR_ARG(0x5, "VarArg", Shape.METHOD),
  FIELD(0x6, "Field", Shape.FIELD),
  LOCAL_SIG(0x7, "LocalSig", Shape.LOCAL_SIG),
  PROPERTY(0x8, "Property", Shape.METHOD),
  UNMANAGED(0x9, "Unmanaged", Shape.METHOD),
  GENERIC_INST(0xA, "GenericInstCC", Shape.GENERIC_INST),
  NATIVE_VAR_ARG(0xB, "NativeVarArg", Shape.METHOD);

  public static final int MASK = 0x0F;
  public static final int GENERIC = 0x10;
  public static final int HAS_THIS = 0x20;
  public static final int EXPLICIT_THIS = 0x40;

  /** Argument layout following the leading {@code Int32(flags)}. */
  public enum Shape {
    /** {@code [genericParamCount], paramCount, returnType, params...}. */
    METHOD,
    /** {@code fieldType}. */
    FIELD,
    /** {@code numLocals, locals...}. */
    LOCAL_SIG,
    /** {@code numArgs, args...}. */
    GENERIC_INST
  }

  private static final CallingConvention[] BY_CODE = new CallingConvention[MASK + 1];
  private static final Map<String, CallingConvention> BY_NAME = new HashMap<>();

  static {
    for (CallingConvention cc : values()) {
      BY_CODE[cc.code] = cc;
      BY_NAME.put(cc.displayName, cc);
    }
  }

  private final int code;
  private final String displayName;
  private final Shape shape;

  CallingConvention(int code, String displayName, Shape shape) {
    this.code = code;
    this.displayName = displayName;
    this.shape = shape;
  }

  public int getCode() {
    return code;
  }

  public String getDisplayName() {
    return displayName;
  }

  public Shape getShape() {
    return shape;
  }

  /** Returns the convention with the given code (flags must already be masked off), or null. */
  public static CallingConvention fromCode(int code) {
    return code >= 0 && code < BY_CODE.length ? BY_CODE[code] : null;
  }

  public static CallingConvention fromDisplayName(String name) {
    return BY_NAME.get(name);
  }

  /**
   * @throws InvalidMetadataDataException if the code is unknown
   */
  public static CallingConvention require(int code) {
    CallingConvention cc = fromCode(code);
    if (cc == null) {
      throw InvalidMetadataDataException.unknownCode("calling convention", code);
    }
    return cc;
  }

  /** Extracts the convention from full signature flags. */
  public static CallingConvention fromFlags(int flags) {
    return require(flags & MASK);
  }
}
