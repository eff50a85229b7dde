package io.portmeta.clr.model;

import io.portmeta.clr.model.sig.CallingConventionSig.FieldSig;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class FieldDef implements FieldDefOrRef {
  private final String name;
  private final FieldSig signature;
  private int attributes;
  private TypeDef declaringType;
  private byte[] initialValue;
  private Constant constant;
  private final List<CustomAttribute> customAttributes = new ArrayList<>();

  public FieldDef(String name, FieldSig signature, int attributes) {
    this.name = Objects.requireNonNull(name, "name");
    this.signature = Objects.requireNonNull(signature, "signature");
    this.attributes = attributes;
  }

  @Override
  public String getName() {
    return name;
  }

  public FieldSig getSignature() {
    return signature;
  }

  public int getAttributes() {
    return attributes;
  }

  public void setAttributes(int attributes) {
    this.attributes = attributes;
  }

  public TypeDef getDeclaringType() {
    return declaringType;
  }

  void setDeclaringType(TypeDef declaringType) {
    this.declaringType = declaringType;
  }

  public ModuleDef getModule() {
    return declaringType != null ? declaringType.getModule() : null;
  }

  /** Field RVA data, or {@code null}. */
  public byte[] getInitialValue() {
    return initialValue;
  }

  public void setInitialValue(byte[] initialValue) {
    this.initialValue = initialValue;
  }

  public Constant getConstant() {
    return constant;
  }

  public void setConstant(Constant constant) {
    this.constant = constant;
  }

  public List<CustomAttribute> getCustomAttributes() {
    return customAttributes;
  }

  @Override
  public String toString() {
    return (declaringType != null ? declaringType.getFullName() : "?") + "::" + name;
  }
}
