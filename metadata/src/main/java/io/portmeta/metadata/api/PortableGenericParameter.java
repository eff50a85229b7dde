package io.portmeta.metadata.api;

import java.util.List;
import java.util.Objects;

/**
 * Generic parameter of a type or method.
 *
 * @param name parameter name
 * @param attributes variance and constraint flags
 * @param number zero-based position
 * @param constraints TypeDefOrRef constraints, or {@code null}
 */
public record PortableGenericParameter(
    String name, int attributes, int number, List<PortableComplexType> constraints) {

  public PortableGenericParameter {
    Objects.requireNonNull(name, "name");
  }

  @Override
  public String toString() {
    return name;
  }
}
