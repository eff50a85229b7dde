package io.portmeta.metadata.impl;

import io.portmeta.metadata.api.CallingConvention;
import io.portmeta.metadata.api.ElementType;
import io.portmeta.metadata.api.InvalidMetadataDataException;
import io.portmeta.metadata.api.PortableComplexType;
import io.portmeta.metadata.api.PortableToken;
import java.util.List;

/** Writes the compact complex type text form read by {@link ComplexTypeParser}. */
public final class ComplexTypeFormatter {
  private final StringBuilder sb = new StringBuilder();
  private final boolean lenient;

  private ComplexTypeFormatter(boolean lenient) {
    this.lenient = lenient;
  }

  /**
   * @throws InvalidMetadataDataException if an element type or calling convention code is
   *     unknown, or if the arguments of a signature do not match its layout
   */
  public static String format(PortableComplexType type) {
    ComplexTypeFormatter formatter = new ComplexTypeFormatter(false);
    formatter.writeType(type);
    return formatter.sb.toString();
  }

  /**
   * Like {@link #format} but renders unknown codes as hex instead of failing, and writes the
   * arguments as they are.
   */
  public static String formatLenient(PortableComplexType type) {
    ComplexTypeFormatter formatter = new ComplexTypeFormatter(true);
    formatter.writeType(type);
    return formatter.sb.toString();
  }

  private void writeType(PortableComplexType type) {
    if (!lenient) {
      ComplexTypeShapes.check(type);
    }
    switch (type.getKind()) {
      case TOKEN:
        writeToken(type.getToken());
        return;
      case INT32:
        sb.append("Int32(").append(type.getInt32()).append(')');
        return;
      case TYPE_SIG:
        {
          ElementType elementType = ElementType.fromCode(type.getType());
          if (elementType != null) {
            sb.append(elementType.getDisplayName());
          } else if (lenient) {
            sb.append(String.format("TypeSig<0x%02X>", type.getType()));
          } else {
            throw InvalidMetadataDataException.unknownCode("element type", type.getType());
          }
          break;
        }
      case CALLING_CONVENTION_SIG:
        {
          CallingConvention callingConvention = CallingConvention.fromCode(type.getType());
          if (callingConvention != null) {
            sb.append(callingConvention.getDisplayName());
          } else if (lenient) {
            sb.append(String.format("CallingConventionSig<0x%02X>", type.getType()));
          } else {
            throw InvalidMetadataDataException.unknownCode("calling convention", type.getType());
          }
          break;
        }
      default:
        sb.append(ComplexTypeParser.SpecialType.fromKind(type.getKind()).displayName);
        break;
    }
    writeArguments(type.getArguments());
  }

  private void writeToken(PortableToken token) {
    if (token.isNamed()) {
      sb.append(ComplexTypeParser.TOKEN_NAME_QUOTE)
          .append(token.getName())
          .append(ComplexTypeParser.TOKEN_NAME_QUOTE);
    } else {
      sb.append(token.getIndex());
    }
  }

  private void writeArguments(List<PortableComplexType> arguments) {
    if (arguments == null) {
      return;
    }
    sb.append('(');
    for (int i = 0; i < arguments.size(); i++) {
      if (i > 0) {
        sb.append(',');
      }
      writeType(arguments.get(i));
    }
    sb.append(')');
  }
}
