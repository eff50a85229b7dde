package io.portmeta.metadata.api;

/** Discriminator of a {@link PortableComplexType}. */
public enum PortableComplexTypeKind {
  /** A reference to a type, field or method by token. */
  TOKEN,
  /** A type signature, identified by an {@link ElementType}. */
  TYPE_SIG,
  /** A method, field, property, local or generic-instantiation signature. */
  CALLING_CONVENTION_SIG,
  /** An embedded 32-bit integer (counts, ranks, bounds, flags). */
  INT32,
  /** A generic method instantiation: {@code [method, instantiation]}. */
  METHOD_SPEC,
  /** An instruction operand referring to a type. */
  INLINE_TYPE,
  /** An instruction operand referring to a field. */
  INLINE_FIELD,
  /** An instruction operand referring to a method. */
  INLINE_METHOD;

  private static final PortableComplexTypeKind[] VALUES = values();

  /**
   * @param ordinal the numeric kind as written on the wire
   * @return the kind
   * @throws InvalidMetadataDataException if the ordinal is out of range
   */
  public static PortableComplexTypeKind fromOrdinal(int ordinal) {
    if (ordinal < 0 || ordinal >= VALUES.length) {
      throw new InvalidMetadataDataException("Unknown complex type kind " + ordinal);
    }
    return VALUES[ordinal];
  }
}
