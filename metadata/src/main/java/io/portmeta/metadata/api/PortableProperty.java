package io.portmeta.metadata.api;

import java.util.List;
import java.util.Objects;

/**
 * Property declared by a type.
 *
 * @param name property name
 * @param signature {@code Property} calling convention signature
 * @param attributes property attributes
 * @param getMethod token of the getter, or {@code null}
 * @param setMethod token of the setter, or {@code null}
 * @param customAttributes custom attributes, or {@code null}
 */
public record PortableProperty(
    String name,
    PortableComplexType signature,
    int attributes,
    PortableToken getMethod,
    PortableToken setMethod,
    List<PortableCustomAttribute> customAttributes) {

  public PortableProperty {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(signature, "signature");
  }

  @Override
  public String toString() {
    return name;
  }
}
