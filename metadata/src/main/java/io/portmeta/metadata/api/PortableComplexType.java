package io.portmeta.metadata.api;

import io.portmeta.metadata.impl.ComplexTypeFormatter;
import io.portmeta.metadata.impl.ComplexTypeParser;
import io.portmeta.metadata.impl.ComplexTypeShapes;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Recursive, immutable value representing a token reference, a type signature, a calling
 * convention signature, an embedded integer, a generic method instantiation or an inline
 * instruction operand.
 *
 * <p>Arguments are either absent ({@code null}) or a non-empty, unmodifiable list. Equality is
 * structural. {@link #toString()} renders the compact text form, which {@link #parse(String)}
 * reads back into an equal value.
 */
public final class PortableComplexType {
  private final PortableComplexTypeKind kind;
  private final PortableToken token;
  private final int value;
  private final int type;
  private final List<PortableComplexType> arguments;

  private PortableComplexType(
      PortableComplexTypeKind kind,
      PortableToken token,
      int value,
      int type,
      List<PortableComplexType> arguments) {
    this.kind = kind;
    this.token = token;
    this.value = value;
    this.type = type;
    this.arguments = arguments;
  }

  public static PortableComplexType token(PortableToken token) {
    Objects.requireNonNull(token, "token");
    return new PortableComplexType(PortableComplexTypeKind.TOKEN, token, 0, 0, null);
  }

  public static PortableComplexType int32(int value) {
    return new PortableComplexType(PortableComplexTypeKind.INT32, null, value, 0, null);
  }

  public static PortableComplexType typeSig(
      ElementType elementType, PortableComplexType... arguments) {
    return typeSig(elementType.getCode(), arguments.length == 0 ? null : Arrays.asList(arguments));
  }

  /**
   * @param elementType raw element type code; unknown codes are accepted here and rejected by
   *     the formatter
   * @param arguments {@code null} or a non-empty list
   */
  public static PortableComplexType typeSig(int elementType, List<PortableComplexType> arguments) {
    return new PortableComplexType(
        PortableComplexTypeKind.TYPE_SIG,
        null,
        0,
        checkByte(elementType),
        copyArguments(arguments));
  }

  public static PortableComplexType callingConventionSig(
      CallingConvention callingConvention, PortableComplexType... arguments) {
    return callingConventionSig(
        callingConvention.getCode(), arguments.length == 0 ? null : Arrays.asList(arguments));
  }

  public static PortableComplexType callingConventionSig(
      int callingConvention, List<PortableComplexType> arguments) {
    return new PortableComplexType(
        PortableComplexTypeKind.CALLING_CONVENTION_SIG,
        null,
        0,
        checkByte(callingConvention),
        copyArguments(arguments));
  }

  public static PortableComplexType methodSpec(
      PortableComplexType method, PortableComplexType instantiation) {
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(instantiation, "instantiation");
    return new PortableComplexType(
        PortableComplexTypeKind.METHOD_SPEC, null, 0, 0, List.of(method, instantiation));
  }

  public static PortableComplexType inlineType(PortableComplexType type) {
    return inlineOperand(PortableComplexTypeKind.INLINE_TYPE, type);
  }

  public static PortableComplexType inlineField(PortableComplexType field) {
    return inlineOperand(PortableComplexTypeKind.INLINE_FIELD, field);
  }

  public static PortableComplexType inlineMethod(PortableComplexType method) {
    return inlineOperand(PortableComplexTypeKind.INLINE_METHOD, method);
  }

  /**
   * @param kind one of {@code INLINE_TYPE}, {@code INLINE_FIELD}, {@code INLINE_METHOD}
   */
  public static PortableComplexType inlineOperand(
      PortableComplexTypeKind kind, PortableComplexType operand) {
    if (kind != PortableComplexTypeKind.INLINE_TYPE
        && kind != PortableComplexTypeKind.INLINE_FIELD
        && kind != PortableComplexTypeKind.INLINE_METHOD) {
      throw new IllegalArgumentException("Not an inline operand kind: " + kind);
    }
    Objects.requireNonNull(operand, "operand");
    return new PortableComplexType(kind, null, 0, 0, List.of(operand));
  }

  /**
   * Generic factory used by deserializers. Validates the payload against the kind, and the
   * arguments of a signature against the layout of its element type or calling convention.
   *
   * @param int32 the embedded value, only read for {@code INT32}
   * @throws InvalidMetadataDataException if the payload does not fit the kind
   */
  public static PortableComplexType of(
      PortableComplexTypeKind kind,
      PortableToken token,
      int int32,
      int type,
      List<PortableComplexType> arguments) {
    Objects.requireNonNull(kind, "kind");
    switch (kind) {
      case TOKEN:
        if (token == null) {
          throw new InvalidMetadataDataException("Token complex type without token");
        }
        return token(token);
      case INT32:
        return int32(int32);
      case TYPE_SIG:
        return validated(typeSig(type, arguments));
      case CALLING_CONVENTION_SIG:
        return validated(callingConventionSig(type, arguments));
      case METHOD_SPEC:
        if (arguments == null || arguments.size() != 2) {
          throw new InvalidMetadataDataException("MethodSpec requires exactly two arguments");
        }
        return methodSpec(arguments.get(0), arguments.get(1));
      default:
        if (arguments == null || arguments.size() != 1) {
          throw new InvalidMetadataDataException(kind + " requires exactly one argument");
        }
        return inlineOperand(kind, arguments.get(0));
    }
  }

  private static PortableComplexType validated(PortableComplexType type) {
    ComplexTypeShapes.validate(type);
    return type;
  }

  /**
   * Parses the compact text form.
   *
   * @throws IllegalArgumentException if {@code s} is null or blank
   * @throws InvalidMetadataDataException if {@code s} is malformed
   */
  public static PortableComplexType parse(String s) {
    return ComplexTypeParser.parse(s);
  }

  private static int checkByte(int code) {
    if (code < 0 || code > 0xFF) {
      throw new IllegalArgumentException("Type code out of byte range: " + code);
    }
    return code;
  }

  private static List<PortableComplexType> copyArguments(List<PortableComplexType> arguments) {
    if (arguments == null) {
      return null;
    }
    if (arguments.isEmpty()) {
      throw new IllegalArgumentException("Arguments must be null or non-empty");
    }
    for (PortableComplexType argument : arguments) {
      Objects.requireNonNull(argument, "argument");
    }
    return Collections.unmodifiableList(
        Arrays.asList(arguments.toArray(new PortableComplexType[0])));
  }

  public PortableComplexTypeKind getKind() {
    return kind;
  }

  /** The token of a {@code TOKEN} complex type, {@code null} for other kinds. */
  public PortableToken getToken() {
    return token;
  }

  /** Raw element type or calling convention code; zero for other kinds. */
  public int getType() {
    return type;
  }

  /** {@code null} or a non-empty unmodifiable list. */
  public List<PortableComplexType> getArguments() {
    return arguments;
  }

  public int getArgumentCount() {
    return arguments == null ? 0 : arguments.size();
  }

  public PortableComplexType getArgument(int index) {
    if (arguments == null || index < 0 || index >= arguments.size()) {
      throw new IndexOutOfBoundsException(
          "Argument " + index + " out of range for " + getArgumentCount() + " arguments");
    }
    return arguments.get(index);
  }

  /**
   * @throws IllegalStateException if this is not an {@code INT32}
   */
  public int getInt32() {
    if (kind != PortableComplexTypeKind.INT32) {
      throw new IllegalStateException("Not an Int32 complex type: " + kind);
    }
    return value;
  }

  /**
   * Checks that the arguments of this signature match the layout of its element type or calling
   * convention. Nested arguments are not visited; other kinds always pass.
   *
   * @throws InvalidMetadataDataException if the arguments do not match the layout
   */
  public void checkArguments() {
    ComplexTypeShapes.check(this);
  }

  public boolean isToken() {
    return kind == PortableComplexTypeKind.TOKEN;
  }

  /** True for a {@code TYPE_SIG} of the given element type. */
  public boolean isTypeSig(ElementType elementType) {
    return kind == PortableComplexTypeKind.TYPE_SIG && type == elementType.getCode();
  }

  /**
   * @throws IllegalStateException if this is not a {@code TYPE_SIG}
   * @throws InvalidMetadataDataException if the code is unknown
   */
  public ElementType getElementType() {
    if (kind != PortableComplexTypeKind.TYPE_SIG) {
      throw new IllegalStateException("Not a type signature: " + kind);
    }
    return ElementType.require(type);
  }

  /**
   * @throws IllegalStateException if this is not a {@code CALLING_CONVENTION_SIG}
   * @throws InvalidMetadataDataException if the code is unknown
   */
  public CallingConvention getCallingConvention() {
    if (kind != PortableComplexTypeKind.CALLING_CONVENTION_SIG) {
      throw new IllegalStateException("Not a calling convention signature: " + kind);
    }
    return CallingConvention.require(type);
  }

  /**
   * Finds the token of the class or value type a type signature is rooted at, looking through
   * pointers, by-refs, arrays, generic instantiations, pinned types and custom modifiers.
   *
   * @return the token, or {@code null} if the signature is not rooted at a named type
   */
  public PortableToken getScopeType() {
    PortableComplexType current = this;
    while (current.kind == PortableComplexTypeKind.TYPE_SIG) {
      ElementType elementType = ElementType.fromCode(current.type);
      if (elementType == null || current.arguments == null) {
        return null;
      }
      switch (elementType) {
        case PTR:
        case BY_REF:
        case ARRAY:
        case GENERIC_INST:
        case VALUE_ARRAY:
        case SZ_ARRAY:
        case PINNED:
          current = current.arguments.get(0);
          break;
        case VALUE_TYPE:
        case CLASS:
          return current.arguments.get(0).token;
        case CMOD_REQD:
        case CMOD_OPT:
          if (current.arguments.size() < 2) {
            return null;
          }
          current = current.arguments.get(1);
          break;
        default:
          return null;
      }
    }
    return null;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PortableComplexType)) {
      return false;
    }
    PortableComplexType that = (PortableComplexType) o;
    return kind == that.kind
        && value == that.value
        && type == that.type
        && Objects.equals(token, that.token)
        && Objects.equals(arguments, that.arguments);
  }

  @Override
  public int hashCode() {
    int hash = kind.hashCode();
    hash = hash * 31 + (token != null ? token.hashCode() : value);
    hash = hash * 31 + type;
    return hash * 31 + (arguments != null ? arguments.hashCode() : 0);
  }

  /** Compact text form, e.g. {@code SZArray(String)} or {@code Class('Foo')}. */
  @Override
  public String toString() {
    return ComplexTypeFormatter.formatLenient(this);
  }
}
