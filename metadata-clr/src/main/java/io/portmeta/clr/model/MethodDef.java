package io.portmeta.clr.model;

import io.portmeta.clr.model.emit.CilBody;
import io.portmeta.clr.model.emit.Parameter;
import io.portmeta.clr.model.sig.CallingConventionSig.MethodSig;
import io.portmeta.clr.model.sig.TypeSig;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public final class MethodDef implements MethodDefOrRef, MemberRefParent {
  private final String name;
  private MethodSig signature;
  private int attributes;
  private int implAttributes;
  private TypeDef declaringType;
  private CilBody body;
  private ImplMap implMap;
  private final List<ParamDef> paramDefs = new ArrayList<>();
  private final List<MethodOverride> overrides = new ArrayList<>();
  private final List<GenericParam> genericParameters = new ArrayList<>();
  private final List<CustomAttribute> customAttributes = new ArrayList<>();

  public MethodDef(String name, MethodSig signature, int attributes) {
    this.name = Objects.requireNonNull(name, "name");
    this.signature = signature;
    this.attributes = attributes;
  }

  @Override
  public String getName() {
    return name;
  }

  public MethodSig getSignature() {
    return signature;
  }

  public void setSignature(MethodSig signature) {
    this.signature = signature;
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

  public TypeDef getDeclaringType() {
    return declaringType;
  }

  void setDeclaringType(TypeDef declaringType) {
    this.declaringType = declaringType;
  }

  public ModuleDef getModule() {
    return declaringType != null ? declaringType.getModule() : null;
  }

  /** CIL body, or {@code null} for abstract, runtime and P/Invoke methods. */
  public CilBody getBody() {
    return body;
  }

  public void setBody(CilBody body) {
    this.body = body;
  }

  public ImplMap getImplMap() {
    return implMap;
  }

  public void setImplMap(ImplMap implMap) {
    this.implMap = implMap;
  }

  public List<ParamDef> getParamDefs() {
    return paramDefs;
  }

  public List<MethodOverride> getOverrides() {
    return overrides;
  }

  public List<GenericParam> getGenericParameters() {
    return genericParameters;
  }

  public List<CustomAttribute> getCustomAttributes() {
    return customAttributes;
  }

  /**
   * Argument slots derived from the signature. An instance method without explicit {@code this}
   * starts with the hidden {@code this} slot.
   */
  public List<Parameter> getParameters() {
    if (signature == null) {
      return Collections.emptyList();
    }
    List<Parameter> parameters = new ArrayList<>(signature.params().size() + 1);
    if (signature.hasThis() && !signature.isExplicitThis()) {
      parameters.add(new Parameter(0, null, true));
    }
    for (TypeSig type : signature.params()) {
      parameters.add(new Parameter(parameters.size(), type, false));
    }
    return parameters;
  }

  @Override
  public String toString() {
    return (declaringType != null ? declaringType.getFullName() : "?") + "::" + name;
  }
}
