package io.portmeta.metadata.impl;

import io.portmeta.metadata.api.CallingConvention;
import io.portmeta.metadata.api.ElementType;
import io.portmeta.metadata.api.InvalidMetadataDataException;
import io.portmeta.metadata.api.PortableComplexType;
import io.portmeta.metadata.api.PortableComplexTypeKind;
import java.util.List;

/**
 * Checks type and calling convention signatures against the argument layout of their element
 * type or calling convention. The layouts are the ones {@link ComplexTypeParser} reads, so a tree
 * that passes can be formatted and parsed back.
 */
public final class ComplexTypeShapes {
  private ComplexTypeShapes() {}

  /** Checks {@code type} and, recursively, all of its arguments. */
  public static void validate(PortableComplexType type) {
    check(type);
    if (type.getArguments() != null) {
      for (PortableComplexType argument : type.getArguments()) {
        validate(argument);
      }
    }
  }

  /**
   * Checks the arguments of {@code type} itself. Nested arguments are not visited.
   *
   * @throws InvalidMetadataDataException if the arguments do not match the layout or the code is
   *     unknown
   */
  public static void check(PortableComplexType type) {
    if (type.getKind() == PortableComplexTypeKind.TYPE_SIG) {
      checkTypeSig(type);
    } else if (type.getKind() == PortableComplexTypeKind.CALLING_CONVENTION_SIG) {
      checkCallingConventionSig(type);
    }
  }

  private static void checkTypeSig(PortableComplexType type) {
    ElementType elementType = ElementType.fromCode(type.getType());
    if (elementType == null) {
      throw InvalidMetadataDataException.unknownCode("element type", type.getType());
    }
    Cursor args = new Cursor(type, elementType.getDisplayName());
    switch (elementType.getShape()) {
      case LEAF:
        break;
      case NEXT:
        args.next();
        break;
      case INDEX:
        args.int32();
        break;
      case ARRAY:
        {
          args.next();
          args.int32();
          args.int32s(args.count());
          args.int32s(args.count());
          break;
        }
      case GENERIC_INST:
        {
          args.next();
          int numArgs = args.count();
          for (int i = 0; i < numArgs; i++) {
            args.next();
          }
          break;
        }
      case VALUE_ARRAY:
        args.next();
        args.int32();
        break;
      case MODIFIER:
        args.next();
        args.next();
        break;
      case MODULE:
        args.int32();
        args.next();
        break;
      default:
        throw new IllegalStateException("Unhandled shape " + elementType.getShape());
    }
    args.end();
  }

  private static void checkCallingConventionSig(PortableComplexType type) {
    CallingConvention callingConvention = CallingConvention.fromCode(type.getType());
    if (callingConvention == null) {
      throw InvalidMetadataDataException.unknownCode("calling convention", type.getType());
    }
    Cursor args = new Cursor(type, callingConvention.getDisplayName());
    int flags = args.int32();
    switch (callingConvention.getShape()) {
      case METHOD:
        {
          if ((flags & CallingConvention.GENERIC) != 0) {
            args.count();
          }
          int paramCount = args.count();
          args.next();
          boolean sentinelSeen = false;
          for (int i = 0; i < paramCount; i++) {
            if (args.next().isTypeSig(ElementType.SENTINEL)) {
              // not counted in paramCount
              if (sentinelSeen) {
                throw args.error("Duplicate Sentinel in method signature");
              }
              sentinelSeen = true;
              i--;
            }
          }
          break;
        }
      case FIELD:
        args.next();
        break;
      case LOCAL_SIG:
      case GENERIC_INST:
        {
          int count = args.count();
          for (int i = 0; i < count; i++) {
            args.next();
          }
          break;
        }
      default:
        throw new IllegalStateException("Unhandled shape " + callingConvention.getShape());
    }
    args.end();
  }

  /** Walks the argument list of one node. */
  private static final class Cursor {
    private final PortableComplexType owner;
    private final String name;
    private final List<PortableComplexType> arguments;
    private int pos = 0;

    Cursor(PortableComplexType owner, String name) {
      this.owner = owner;
      this.name = name;
      this.arguments = owner.getArguments() == null ? List.of() : owner.getArguments();
    }

    PortableComplexType next() {
      if (pos >= arguments.size()) {
        throw error(name + " is missing argument " + pos);
      }
      return arguments.get(pos++);
    }

    int int32() {
      int index = pos;
      PortableComplexType argument = next();
      if (argument.getKind() != PortableComplexTypeKind.INT32) {
        throw error(
            name + " expects Int32 at argument " + index + " but found " + argument.getKind());
      }
      return argument.getInt32();
    }

    int count() {
      int index = pos;
      int count = int32();
      if (count < 0) {
        throw error(name + " has negative count " + count + " at argument " + index);
      }
      return count;
    }

    void int32s(int count) {
      for (int i = 0; i < count; i++) {
        int32();
      }
    }

    void end() {
      if (pos != arguments.size()) {
        throw error(name + " takes " + pos + " arguments but has " + arguments.size());
      }
    }

    InvalidMetadataDataException error(String msg) {
      return new InvalidMetadataDataException(msg, owner.toString());
    }
  }
}
