package io.portmeta.clr.model;

import java.util.Objects;

/**
 * Reference to a type defined outside the module. A nested type reference has the enclosing
 * {@code TypeRef} as its scope and an empty namespace.
 */
public final class TypeRef implements TypeDefOrRef, ResolutionScope {
  private final ResolutionScope resolutionScope;
  private final String namespace;
  private final String name;

  public TypeRef(ResolutionScope resolutionScope, String namespace, String name) {
    this.resolutionScope = Objects.requireNonNull(resolutionScope, "resolutionScope");
    this.namespace = Objects.requireNonNull(namespace, "namespace");
    this.name = Objects.requireNonNull(name, "name");
  }

  public ResolutionScope getResolutionScope() {
    return resolutionScope;
  }

  public String getNamespace() {
    return namespace;
  }

  public String getName() {
    return name;
  }

  /** The enclosing type reference, or {@code null} for a top level type. */
  public TypeRef getDeclaringType() {
    return resolutionScope instanceof TypeRef ? (TypeRef) resolutionScope : null;
  }

  /** The outermost scope, which is an {@link AssemblyRef} or a {@link ModuleRef}. */
  public ResolutionScope getDefinitionScope() {
    ResolutionScope scope = resolutionScope;
    while (scope instanceof TypeRef) {
      scope = ((TypeRef) scope).resolutionScope;
    }
    return scope;
  }

  @Override
  public String getFullName() {
    TypeRef declaringType = getDeclaringType();
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
