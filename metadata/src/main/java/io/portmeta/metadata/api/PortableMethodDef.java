package io.portmeta.metadata.api;

import java.util.List;

/** Method definition, optionally with its body. */
public final class PortableMethodDef extends PortableMethod {
  private int attributes;
  private int implAttributes;
  private List<PortableParameter> parameters;
  private PortableMethodBody body;
  private List<PortableToken> overrides;
  private PortableImplMap implMap;
  private List<PortableGenericParameter> genericParameters;
  private List<PortableCustomAttribute> customAttributes;

  PortableMethodDef() {}

  public PortableMethodDef(
      String name,
      PortableComplexType type,
      PortableComplexType signature,
      int attributes,
      int implAttributes,
      List<PortableParameter> parameters,
      PortableMethodBody body,
      List<PortableToken> overrides,
      PortableImplMap implMap,
      List<PortableGenericParameter> genericParameters,
      List<PortableCustomAttribute> customAttributes) {
    super(name, type, signature);
    this.attributes = attributes;
    this.implAttributes = implAttributes;
    this.parameters = parameters;
    this.body = body;
    this.overrides = overrides;
    this.implMap = implMap;
    this.genericParameters = genericParameters;
    this.customAttributes = customAttributes;
  }

  public int getAttributes() {
    return attributes;
  }

  public void setAttributes(int attributes) {
    this.attributes = attributes;
  }

  public int getImplAttributes() {
    return implAttributes;
  }

  public void setImplAttributes(int implAttributes) {
    this.implAttributes = implAttributes;
  }

  public List<PortableParameter> getParameters() {
    return parameters;
  }

  public void setParameters(List<PortableParameter> parameters) {
    this.parameters = parameters;
  }

  /** {@code null} for abstract, extern and runtime methods, or when bodies are not exported. */
  public PortableMethodBody getBody() {
    return body;
  }

  public void setBody(PortableMethodBody body) {
    this.body = body;
  }

  /** Tokens of the interface methods this method explicitly implements. */
  public List<PortableToken> getOverrides() {
    return overrides;
  }

  public void setOverrides(List<PortableToken> overrides) {
    this.overrides = overrides;
  }

  public PortableImplMap getImplMap() {
    return implMap;
  }

  public void setImplMap(PortableImplMap implMap) {
    this.implMap = implMap;
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
}
