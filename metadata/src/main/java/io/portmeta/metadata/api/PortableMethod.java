package io.portmeta.metadata.api;

import java.util.Objects;

/** Method reference: name, declaring type and method signature. */
public sealed class PortableMethod permits PortableMethodDef {
  private String name;
  private PortableComplexType type;
  private PortableComplexType signature;

  PortableMethod() {}

  /**
   * @param name method name
   * @param type declaring type (TypeDefOrRef)
   * @param signature method calling convention signature
   */
  public PortableMethod(String name, PortableComplexType type, PortableComplexType signature) {
    this.name = Objects.requireNonNull(name, "name");
    this.type = Objects.requireNonNull(type, "type");
    this.signature = Objects.requireNonNull(signature, "signature");
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = Objects.requireNonNull(name, "name");
  }

  /** The declaring type. */
  public PortableComplexType getType() {
    return type;
  }

  public void setType(PortableComplexType type) {
    this.type = Objects.requireNonNull(type, "type");
  }

  public PortableComplexType getSignature() {
    return signature;
  }

  public void setSignature(PortableComplexType signature) {
    this.signature = Objects.requireNonNull(signature, "signature");
  }

  public PortableMethod toReference() {
    return new PortableMethod(name, type, signature);
  }

  @Override
  public String toString() {
    return type + "::" + name;
  }
}
