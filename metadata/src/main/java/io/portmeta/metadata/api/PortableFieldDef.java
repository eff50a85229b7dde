package io.portmeta.metadata.api;

import java.util.List;

/** Field definition. */
public final class PortableFieldDef extends PortableField {
  private int attributes;
  private byte[] initialValue;
  private PortableConstant constant;
  private List<PortableCustomAttribute> customAttributes;

  PortableFieldDef() {}

  public PortableFieldDef(
      String name,
      PortableComplexType type,
      PortableComplexType signature,
      int attributes,
      byte[] initialValue,
      PortableConstant constant,
      List<PortableCustomAttribute> customAttributes) {
    super(name, type, signature);
    this.attributes = attributes;
    this.initialValue = initialValue;
    this.constant = constant;
    this.customAttributes = customAttributes;
  }

  public int getAttributes() {
    return attributes;
  }

  public void setAttributes(int attributes) {
    this.attributes = attributes;
  }

  /** Data of a field with an RVA, or {@code null}. */
  public byte[] getInitialValue() {
    return initialValue;
  }

  public void setInitialValue(byte[] initialValue) {
    this.initialValue = initialValue;
  }

  public PortableConstant getConstant() {
    return constant;
  }

  public void setConstant(PortableConstant constant) {
    this.constant = constant;
  }

  public List<PortableCustomAttribute> getCustomAttributes() {
    return customAttributes;
  }

  public void setCustomAttributes(List<PortableCustomAttribute> customAttributes) {
    this.customAttributes = customAttributes;
  }
}
