package io.portmeta.metadata.api;

import java.util.List;

/**
 * Type definition. Child members (nested types, fields, methods) are referenced by token and
 * only filled in at {@link PortableMetadataLevel#DEFINITION_WITH_CHILDREN}.
 */
public final class PortableTypeDef extends PortableType {
  private int attributes;
  private PortableComplexType baseType;
  private List<PortableComplexType> interfaces;
  private PortableClassLayout classLayout;
  private List<PortableGenericParameter> genericParameters;
  private List<PortableCustomAttribute> customAttributes;
  private List<PortableToken> nestedTypes;
  private List<PortableToken> fields;
  private List<PortableToken> methods;
  private List<PortableProperty> properties;
  private List<PortableEvent> events;

  PortableTypeDef() {}

  public PortableTypeDef(
      String name,
      String namespace,
      String assembly,
      List<String> enclosingNames,
      int attributes,
      PortableComplexType baseType,
      List<PortableComplexType> interfaces,
      PortableClassLayout classLayout,
      List<PortableGenericParameter> genericParameters,
      List<PortableCustomAttribute> customAttributes) {
    super(name, namespace, assembly, enclosingNames);
    this.attributes = attributes;
    this.baseType = baseType;
    this.interfaces = interfaces;
    this.classLayout = classLayout;
    this.genericParameters = genericParameters;
    this.customAttributes = customAttributes;
  }

  public int getAttributes() {
    return attributes;
  }

  public void setAttributes(int attributes) {
    this.attributes = attributes;
  }

  /** TypeDefOrRef of the base type, or {@code null}. */
  public PortableComplexType getBaseType() {
    return baseType;
  }

  public void setBaseType(PortableComplexType baseType) {
    this.baseType = baseType;
  }

  public List<PortableComplexType> getInterfaces() {
    return interfaces;
  }

  public void setInterfaces(List<PortableComplexType> interfaces) {
    this.interfaces = interfaces;
  }

  public PortableClassLayout getClassLayout() {
    return classLayout;
  }

  public void setClassLayout(PortableClassLayout classLayout) {
    this.classLayout = classLayout;
  }

  public List<PortableGenericParameter> getGenericParameters() {
    return genericParameters;
  }

  public void setGenericParameters(List<PortableGenericParameter> genericParameters) {
    this.genericParameters = genericParameters;
  }

  public List<PortableCustomAttribute> getCustomAttributes() {
    return customAttributes;
  }

  public void setCustomAttributes(List<PortableCustomAttribute> customAttributes) {
    this.customAttributes = customAttributes;
  }

  public List<PortableToken> getNestedTypes() {
    return nestedTypes;
  }

  public void setNestedTypes(List<PortableToken> nestedTypes) {
    this.nestedTypes = nestedTypes;
  }

  public List<PortableToken> getFields() {
    return fields;
  }

  public void setFields(List<PortableToken> fields) {
    this.fields = fields;
  }

  public List<PortableToken> getMethods() {
    return methods;
  }

  public void setMethods(List<PortableToken> methods) {
    this.methods = methods;
  }

  public List<PortableProperty> getProperties() {
    return properties;
  }

  public void setProperties(List<PortableProperty> properties) {
    this.properties = properties;
  }

  public List<PortableEvent> getEvents() {
    return events;
  }

  public void setEvents(List<PortableEvent> events) {
    this.events = events;
  }
}
