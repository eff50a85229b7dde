package io.portmeta.clr.model;

import io.portmeta.clr.model.sig.CallingConventionSig;
import io.portmeta.clr.model.sig.CallingConventionSig.FieldSig;
import io.portmeta.clr.model.sig.CallingConventionSig.MethodSig;
import java.util.Objects;

/** Reference to a field or method of a type outside the module, or of a generic instantiation. */
public final class MemberRef implements MethodDefOrRef, FieldDefOrRef {
  private final MemberRefParent parent;
  private final String name;
  private final CallingConventionSig signature;

  public MemberRef(MemberRefParent parent, String name, CallingConventionSig signature) {
    this.parent = Objects.requireNonNull(parent, "parent");
    this.name = Objects.requireNonNull(name, "name");
    this.signature = Objects.requireNonNull(signature, "signature");
  }

  public MemberRefParent getParent() {
    return parent;
  }

  @Override
  public String getName() {
    return name;
  }

  public CallingConventionSig getSignature() {
    return signature;
  }

  public boolean isFieldRef() {
    return signature instanceof FieldSig;
  }

  public boolean isMethodRef() {
    return signature instanceof MethodSig;
  }

  /** The parent when it is a type, otherwise {@code null}. */
  public TypeDefOrRef getDeclaringType() {
    return parent instanceof TypeDefOrRef ? (TypeDefOrRef) parent : null;
  }

  @Override
  public String toString() {
    TypeDefOrRef declaringType = getDeclaringType();
    String owner = declaringType != null ? declaringType.getFullName() : String.valueOf(parent);
    return owner + "::" + name;
  }
}
