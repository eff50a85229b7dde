package io.portmeta.clr.model;

import io.portmeta.clr.model.sig.CallingConventionSig.PropertySig;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class PropertyDef {
  private final String name;
  private final PropertySig signature;
  private final int attributes;
  private MethodDef getMethod;
  private MethodDef setMethod;
  private final List<CustomAttribute> customAttributes = new ArrayList<>();

  public PropertyDef(String name, PropertySig signature, int attributes) {
    this.name = Objects.requireNonNull(name, "name");
    this.signature = Objects.requireNonNull(signature, "signature");
    this.attributes = attributes;
  }

  public String getName() {
    return name;
  }

  public PropertySig getSignature() {
    return signature;
  }

  public int getAttributes() {
    return attributes;
  }

  public MethodDef getGetMethod() {
    return getMethod;
  }

  public void setGetMethod(MethodDef getMethod) {
    this.getMethod = getMethod;
  }

  public MethodDef getSetMethod() {
    return setMethod;
  }

  public void setSetMethod(MethodDef setMethod) {
    this.setMethod = setMethod;
  }

  public List<CustomAttribute> getCustomAttributes() {
    return customAttributes;
  }

  @Override
  public String toString() {
    return name;
  }
}
