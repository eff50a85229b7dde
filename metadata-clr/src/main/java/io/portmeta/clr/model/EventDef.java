package io.portmeta.clr.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class EventDef {
  private final String name;
  private final TypeDefOrRef eventType;
  private final int attributes;
  private MethodDef addMethod;
  private MethodDef removeMethod;
  private MethodDef invokeMethod;
  private final List<CustomAttribute> customAttributes = new ArrayList<>();

  public EventDef(String name, TypeDefOrRef eventType, int attributes) {
    this.name = Objects.requireNonNull(name, "name");
    this.eventType = Objects.requireNonNull(eventType, "eventType");
    this.attributes = attributes;
  }

  public String getName() {
    return name;
  }

  public TypeDefOrRef getEventType() {
    return eventType;
  }

  public int getAttributes() {
    return attributes;
  }

  public MethodDef getAddMethod() {
    return addMethod;
  }

  public void setAddMethod(MethodDef addMethod) {
    this.addMethod = addMethod;
  }

  public MethodDef getRemoveMethod() {
    return removeMethod;
  }

  public void setRemoveMethod(MethodDef removeMethod) {
    this.removeMethod = removeMethod;
  }

  public MethodDef getInvokeMethod() {
    return invokeMethod;
  }

  public void setInvokeMethod(MethodDef invokeMethod) {
    this.invokeMethod = invokeMethod;
  }

  public List<CustomAttribute> getCustomAttributes() {
    return customAttributes;
  }

  @Override
  public String toString() {
    return name;
  }
}
