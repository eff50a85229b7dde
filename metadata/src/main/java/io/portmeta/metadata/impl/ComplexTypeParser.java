package io.portmeta.metadata.impl;

import io.portmeta.metadata.api.CallingConvention;
import io.portmeta.metadata.api.ElementType;
import io.portmeta.metadata.api.InvalidMetadataDataException;
import io.portmeta.metadata.api.PortableComplexType;
import io.portmeta.metadata.api.PortableComplexTypeKind;
import io.portmeta.metadata.api.PortableToken;
import java.util.ArrayList;
import java.util.List;

/**
 * Single-pass parser for the compact complex type text form:
 *
 * <pre>
 * Type  := Token | ElementType Args? | CallingConvention Args? | Special '(' ... ')'
 * Token := 'name' | Integer
 * Args  := '(' Type (',' Type)* ')'
 * </pre>
 *
 * The argument layout of each element type and calling convention is fixed, so the parser never
 * backtracks.
 */
public final class ComplexTypeParser {
  static final char TOKEN_NAME_QUOTE = '\'';

  private final String input;
  private int pos = 0;

  private ComplexTypeParser(String input) {
    this.input = input;
  }

  public static PortableComplexType parse(String input) {
    if (input == null || input.isBlank()) {
      throw new IllegalArgumentException("Complex type string must not be null or blank");
    }
    ComplexTypeParser parser = new ComplexTypeParser(input);
    PortableComplexType type = parser.readType();
    if (!parser.eof()) {
      throw parser.error("Unexpected trailing input '" + input.substring(parser.pos) + "'");
    }
    return type;
  }

  private PortableComplexType readType() {
    int start = pos;
    String word = readNext();
    PortableToken token = tryParseToken(word, start);
    if (token != null) {
      return PortableComplexType.token(token);
    }
    ElementType elementType = ElementType.fromDisplayName(word);
    if (elementType != null) {
      return PortableComplexType.typeSig(elementType.getCode(), readElementTypeArgs(elementType));
    }
    CallingConvention callingConvention = CallingConvention.fromDisplayName(word);
    if (callingConvention != null) {
      return PortableComplexType.callingConventionSig(
          callingConvention.getCode(), readCallingConventionArgs(callingConvention));
    }
    SpecialType special = SpecialType.fromName(word);
    if (special != null) {
      return readSpecialType(special);
    }
    throw errorAt(start, "Invalid complex type beginning '" + word + "'");
  }

  private PortableToken tryParseToken(String word, int start) {
    if (word.length() > 2
        && word.charAt(0) == TOKEN_NAME_QUOTE
        && word.charAt(word.length() - 1) == TOKEN_NAME_QUOTE) {
      String name = word.substring(1, word.length() - 1);
      if (!PortableToken.isValidName(name)) {
        throw errorAt(start, "Invalid token name " + word);
      }
      return PortableToken.of(name);
    }
    if (!isDigits(word)) {
      return null;
    }
    try {
      return PortableToken.of(Integer.parseInt(word));
    } catch (NumberFormatException e) {
      throw new InvalidMetadataDataException("Token index out of range: " + word, e, input);
    }
  }

  private List<PortableComplexType> readElementTypeArgs(ElementType elementType) {
    if (elementType.getShape() == ElementType.Shape.LEAF) {
      return null;
    }
    expect('(');
    List<PortableComplexType> arguments = new ArrayList<>();
    switch (elementType.getShape()) {
      case NEXT:
        arguments.add(readType());
        break;
      case INDEX:
        arguments.add(readInt32());
        break;
      case ARRAY:
        {
          arguments.add(readType());
          arguments.add(nextInt32());
          PortableComplexType numSizes = nextCount();
          arguments.add(numSizes);
          for (int i = 0; i < numSizes.getInt32(); i++) {
            arguments.add(nextInt32());
          }
          PortableComplexType numLowerBounds = nextCount();
          arguments.add(numLowerBounds);
          for (int i = 0; i < numLowerBounds.getInt32(); i++) {
            arguments.add(nextInt32());
          }
          break;
        }
      case GENERIC_INST:
        {
          arguments.add(readType());
          PortableComplexType numArgs = nextCount();
          arguments.add(numArgs);
          for (int i = 0; i < numArgs.getInt32(); i++) {
            arguments.add(nextType());
          }
          break;
        }
      case VALUE_ARRAY:
        arguments.add(readType());
        arguments.add(nextInt32());
        break;
      case MODIFIER:
        arguments.add(readType());
        arguments.add(nextType());
        break;
      case MODULE:
        arguments.add(readInt32());
        arguments.add(nextType());
        break;
      default:
        throw new IllegalStateException("Unhandled shape " + elementType.getShape());
    }
    expect(')');
    return arguments;
  }

  private List<PortableComplexType> readCallingConventionArgs(CallingConvention callingConvention) {
    expect('(');
    PortableComplexType flags = readInt32();
    List<PortableComplexType> arguments = new ArrayList<>();
    arguments.add(flags);
    switch (callingConvention.getShape()) {
      case METHOD:
        {
          if ((flags.getInt32() & CallingConvention.GENERIC) != 0) {
            arguments.add(nextCount());
          }
          PortableComplexType paramCount = nextCount();
          arguments.add(paramCount);
          arguments.add(nextType());
          boolean sentinelSeen = false;
          for (int i = 0; i < paramCount.getInt32(); i++) {
            expect(',');
            int start = pos;
            PortableComplexType param = readType();
            arguments.add(param);
            if (param.isTypeSig(ElementType.SENTINEL)) {
              // sentinel separates vararg parameters and is not counted
              if (sentinelSeen) {
                throw errorAt(start, "Duplicate Sentinel in method signature");
              }
              sentinelSeen = true;
              i--;
            }
          }
          break;
        }
      case FIELD:
        arguments.add(nextType());
        break;
      case LOCAL_SIG:
      case GENERIC_INST:
        {
          PortableComplexType count = nextCount();
          arguments.add(count);
          for (int i = 0; i < count.getInt32(); i++) {
            arguments.add(nextType());
          }
          break;
        }
      default:
        throw new IllegalStateException("Unhandled shape " + callingConvention.getShape());
    }
    expect(')');
    return arguments;
  }

  private PortableComplexType readSpecialType(SpecialType special) {
    expect('(');
    PortableComplexType type;
    switch (special) {
      case INT32:
        {
          int start = pos;
          String word = readNext();
          try {
            type = PortableComplexType.int32(Integer.parseInt(word));
          } catch (NumberFormatException e) {
            throw errorAt(start, "Invalid Int32 value '" + word + "'");
          }
          break;
        }
      case METHOD_SPEC:
        {
          PortableComplexType method = readType();
          type = PortableComplexType.methodSpec(method, nextType());
          break;
        }
      default:
        type = PortableComplexType.inlineOperand(special.kind, readType());
        break;
    }
    expect(')');
    return type;
  }

  private PortableComplexType readInt32() {
    int start = pos;
    PortableComplexType type = readType();
    if (type.getKind() != PortableComplexTypeKind.INT32) {
      throw errorAt(start, "Expected Int32 but found " + type.getKind());
    }
    return type;
  }

  private PortableComplexType readCount() {
    int start = pos;
    PortableComplexType count = readInt32();
    if (count.getInt32() < 0) {
      throw errorAt(start, "Negative count " + count.getInt32());
    }
    return count;
  }

  // arguments after the first one in a list are preceded by exactly one comma

  private PortableComplexType nextType() {
    expect(',');
    return readType();
  }

  private PortableComplexType nextInt32() {
    expect(',');
    return readInt32();
  }

  private PortableComplexType nextCount() {
    expect(',');
    return readCount();
  }

  /** Reads one word, up to the next comma or parenthesis, which is left for the caller. */
  private String readNext() {
    int start = pos;
    while (!eof()) {
      char c = input.charAt(pos);
      if (c == '(' || c == ')' || c == ',') {
        break;
      }
      pos++;
    }
    String word = input.substring(start, pos);
    if (word.isEmpty()) {
      throw errorAt(start, eof() ? "Unexpected end of input" : "Expected a word");
    }
    return word;
  }

  private void expect(char c) {
    if (eof() || input.charAt(pos) != c) {
      throw error("Expected '" + c + "'");
    }
    pos++;
  }

  private boolean eof() {
    return pos >= input.length();
  }

  private static boolean isDigits(String word) {
    for (int i = 0; i < word.length(); i++) {
      if (!Character.isDigit(word.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  private InvalidMetadataDataException error(String msg) {
    return errorAt(pos, msg);
  }

  private InvalidMetadataDataException errorAt(int position, String msg) {
    return InvalidMetadataDataException.syntaxError(input, position, msg);
  }

  /** Complex type kinds written as {@code Name(...)}. */
  enum SpecialType {
    INT32("Int32", PortableComplexTypeKind.INT32),
    METHOD_SPEC("MethodSpec", PortableComplexTypeKind.METHOD_SPEC),
    INLINE_TYPE("InlineType", PortableComplexTypeKind.INLINE_TYPE),
    INLINE_FIELD("InlineField", PortableComplexTypeKind.INLINE_FIELD),
    INLINE_METHOD("InlineMethod", PortableComplexTypeKind.INLINE_METHOD);

    final String displayName;
    final PortableComplexTypeKind kind;

    SpecialType(String displayName, PortableComplexTypeKind kind) {
      this.displayName = displayName;
      this.kind = kind;
    }

    static SpecialType fromName(String name) {
      for (SpecialType type : values()) {
        if (type.displayName.equals(name)) {
          return type;
        }
      }
      return null;
    }

    static SpecialType fromKind(PortableComplexTypeKind kind) {
      for (SpecialType type : values()) {
        if (type.kind == kind) {
          return type;
        }
      }
      return null;
    }
  }
}
