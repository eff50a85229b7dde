package io.portmeta.clr.model;

import io.portmeta.metadata.api.ElementType;
import java.util.Objects;

/**
 * Default value of a field or parameter, boxed the same way as {@link
 * io.portmeta.metadata.api.PortableConstant}.
 */
public record Constant(ElementType type, Object value) {
  public Constant {
    Objects.requireNonNull(type, "type");
  }
}
