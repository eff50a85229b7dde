package io.portmeta.clr.model;

import io.portmeta.clr.model.sig.TypeSig;
import java.util.Objects;

/** Type given by a signature, e.g. a generic instantiation used as a base type. */
public final class TypeSpec implements TypeDefOrRef {
  private final TypeSig typeSig;

  public TypeSpec(TypeSig typeSig) {
    this.typeSig = Objects.requireNonNull(typeSig, "typeSig");
  }

  public TypeSig getTypeSig() {
    return typeSig;
  }

  @Override
  public String getFullName() {
    return typeSig.toString();
  }

  @Override
  public String toString() {
    return getFullName();
  }
}
