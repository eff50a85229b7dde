package io.portmeta.metadata.api;

import java.util.List;
import java.util.Objects;

/**
 * Event declared by a type.
 *
 * @param name event name
 * @param type TypeDefOrRef of the event handler type
 * @param attributes event attributes
 * @param addMethod token of the add accessor, or {@code null}
 * @param removeMethod token of the remove accessor, or {@code null}
 * @param invokeMethod token of the raise accessor, or {@code null}
 * @param customAttributes custom attributes, or {@code null}
 */
public record PortableEvent(
    String name,
    PortableComplexType type,
    int attributes,
    PortableToken addMethod,
    PortableToken removeMethod,
    PortableToken invokeMethod,
    List<PortableCustomAttribute> customAttributes) {

  public PortableEvent {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
  }

  @Override
  public String toString() {
    return name;
  }
}
