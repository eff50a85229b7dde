package io.portmeta.metadata.api;

import java.util.List;
import java.util.Objects;

/**
 * Type reference: enough to find or create the type on the other side.
 *
 * <p>A {@code null} assembly means the type is defined in the same container. Enclosing names
 * list the declaring types of a nested type, innermost first; the namespace is the one of the
 * outermost type.
 */
public sealed class PortableType permits PortableTypeDef {
  private String name;
  private String namespace;
  private String assembly;
  private List<String> enclosingNames;

  PortableType() {}

  public PortableType(String name, String namespace, String assembly, List<String> enclosingNames) {
    this.name = Objects.requireNonNull(name, "name");
    this.namespace = Objects.requireNonNull(namespace, "namespace");
    this.assembly = assembly;
    this.enclosingNames = enclosingNames;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = Objects.requireNonNull(name, "name");
  }

  public String getNamespace() {
    return namespace;
  }

  public void setNamespace(String namespace) {
    this.namespace = Objects.requireNonNull(namespace, "namespace");
  }

  /** Assembly identity, {@code null} when defined in the same container. */
  public String getAssembly() {
    return assembly;
  }

  public void setAssembly(String assembly) {
    this.assembly = assembly;
  }

  /** Declaring type names, innermost first; {@code null} for a top-level type. */
  public List<String> getEnclosingNames() {
    return enclosingNames;
  }

  public void setEnclosingNames(List<String> enclosingNames) {
    this.enclosingNames = enclosingNames;
  }

  /** Returns a plain reference with the identity fields of this type. */
  public PortableType toReference() {
    return new PortableType(name, namespace, assembly, enclosingNames);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    if (!namespace.isEmpty()) {
      sb.append(namespace).append('.');
    }
    if (enclosingNames != null) {
      for (int i = enclosingNames.size() - 1; i >= 0; i--) {
        sb.append(enclosingNames.get(i)).append('/');
      }
    }
    sb.append(name);
    if (assembly != null) {
      sb.append(", ").append(assembly);
    }
    return sb.toString();
  }
}
