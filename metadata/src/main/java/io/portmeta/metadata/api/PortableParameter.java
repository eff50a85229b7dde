package io.portmeta.metadata.api;

import java.util.List;
import java.util.Objects;

/**
 * Parameter row of a method definition. Sequence 0 is the return value.
 *
 * @param name parameter name
 * @param sequence one-based position, 0 for the return value
 * @param attributes parameter attributes
 * @param constant default value, or {@code null}
 * @param customAttributes custom attributes, or {@code null}
 */
public record PortableParameter(
    String name,
    int sequence,
    int attributes,
    PortableConstant constant,
    List<PortableCustomAttribute> customAttributes) {

  public PortableParameter {
    Objects.requireNonNull(name, "name");
  }

  @Override
  public String toString() {
    return name;
  }
}
