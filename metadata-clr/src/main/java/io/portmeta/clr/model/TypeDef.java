package io.portmeta.clr.model;

import io.portmeta.clr.model.sig.CallingConventionSig.FieldSig;
import io.portmeta.clr.model.sig.CallingConventionSig.MethodSig;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Type defined in a {@link ModuleDef}. A nested type has an empty namespace and reaches its
 * module through the declaring type.
 */
public final class TypeDef implements TypeDefOrRef {
  private final String namespace;
  private final String name;
  private int attributes;
  private ModuleDef module;
  private TypeDef declaringType;
  private TypeDefOrRef baseType;
  private ClassLayout classLayout;
  private final List<TypeDefOrRef> interfaces = new ArrayList<>();
  private final List<GenericParam> genericParameters = new ArrayList<>();
  private final List<CustomAttribute> customAttributes = new ArrayList<>();
  private final List<TypeDef> nestedTypes = new ArrayList<>();
  private final List<FieldDef> fields = new ArrayList<>();
  private final List<MethodDef> methods = new ArrayList<>();
  private final List<PropertyDef> properties = new ArrayList<>();
  private final List<EventDef> events = new ArrayList<>();

  public TypeDef(String namespace, String name) {
    this(namespace, name, 0);
  }

  public TypeDef(String namespace, String name, int attributes) {
    this.namespace = Objects.requireNonNull(namespace, "namespace");
    this.name = Objects.requireNonNull(name, "name");
    this.attributes = attributes;
  }

  public String getNamespace() {
    return namespace;
  }

  public String getName() {
    return name;
  }

  public int getAttributes() {
    return attributes;
  }

  public void setAttributes(int attributes) {
    this.attributes = attributes;
  }

  public ModuleDef getModule() {
    return declaringType != null ? declaringType.getModule() : module;
  }

  void setModule(ModuleDef module) {
    this.module = module;
  }

  public TypeDef getDeclaringType() {
    return declaringType;
  }

  public TypeDefOrRef getBaseType() {
    return baseType;
  }

  public void setBaseType(TypeDefOrRef baseType) {
    this.baseType = baseType;
  }

  public ClassLayout getClassLayout() {
    return classLayout;
  }

  public void setClassLayout(ClassLayout classLayout) {
    this.classLayout = classLayout;
  }

  public List<TypeDefOrRef> getInterfaces() {
    return interfaces;
  }

  public List<GenericParam> getGenericParameters() {
    return genericParameters;
  }

  public List<CustomAttribute> getCustomAttributes() {
    return customAttributes;
  }

  public List<TypeDef> getNestedTypes() {
    return Collections.unmodifiableList(nestedTypes);
  }

  public List<FieldDef> getFields() {
    return Collections.unmodifiableList(fields);
  }

  public List<MethodDef> getMethods() {
    return Collections.unmodifiableList(methods);
  }

  public List<PropertyDef> getProperties() {
    return properties;
  }

  public List<EventDef> getEvents() {
    return events;
  }

  public TypeDef addNestedType(TypeDef nestedType) {
    checkUnowned(nestedType.declaringType != null || nestedType.module != null, nestedType);
    nestedType.declaringType = this;
    nestedTypes.add(nestedType);
    return nestedType;
  }

  public FieldDef addField(FieldDef field) {
    checkUnowned(field.getDeclaringType() != null, field);
    field.setDeclaringType(this);
    fields.add(field);
    return field;
  }

  public MethodDef addMethod(MethodDef method) {
    checkUnowned(method.getDeclaringType() != null, method);
    method.setDeclaringType(this);
    methods.add(method);
    return method;
  }

  private static void checkUnowned(boolean owned, Object member) {
    if (owned) {
      throw new IllegalArgumentException(member + " already belongs to a type or module");
    }
  }

  /** @return the nested type called {@code name}, or {@code null} */
  public TypeDef findNestedType(String name) {
    for (TypeDef nestedType : nestedTypes) {
      if (nestedType.name.equals(name)) {
        return nestedType;
      }
    }
    return null;
  }

  /** @return the field with this name and signature, or {@code null} */
  public FieldDef findField(String name, FieldSig signature) {
    for (FieldDef field : fields) {
      if (field.getName().equals(name) && field.getSignature().equals(signature)) {
        return field;
      }
    }
    return null;
  }

  /** @return the method with this name and signature, or {@code null} */
  public MethodDef findMethod(String name, MethodSig signature) {
    for (MethodDef method : methods) {
      if (method.getName().equals(name) && Objects.equals(method.getSignature(), signature)) {
        return method;
      }
    }
    return null;
  }

  /** @return the first method called {@code name}, or {@code null} */
  public MethodDef findMethod(String name) {
    for (MethodDef method : methods) {
      if (method.getName().equals(name)) {
        return method;
      }
    }
    return null;
  }

  @Override
  public String getFullName() {
    if (declaringType != null) {
      return declaringType.getFullName() + "/" + name;
    }
    return namespace.isEmpty() ? name : namespace + "." + name;
  }

  @Override
  public String toString() {
    return getFullName();
  }
}
