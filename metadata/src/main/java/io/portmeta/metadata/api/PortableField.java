package io.portmeta.metadata.api;

import java.util.Objects;

/** Field reference: name, declaring type and {@code Field} signature. */
public sealed class PortableField permits PortableFieldDef {
  private String name;
  private PortableComplexType type;
  private PortableComplexType signature;

  PortableField() {}

  /**
   * @param name field name
   * @param type declaring type (TypeDefOrRef)
   * @param signature {@code Field} calling convention signature
   */
  public PortableField(String name, PortableComplexType type, PortableComplexType signature) {
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

  public PortableField toReference() {
    return new PortableField(name, type, signature);
  }

  @Override
  public String toString() {
    return type + "::" + name;
  }
}
