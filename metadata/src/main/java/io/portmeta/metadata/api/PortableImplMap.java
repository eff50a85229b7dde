package io.portmeta.metadata.api;

import java.util.Objects;

/**
 * P/Invoke information of a method.
 *
 * @param name imported entry point
 * @param module native module name
 * @param attributes P/Invoke attributes
 */
public record PortableImplMap(String name, String module, int attributes) {

  public PortableImplMap {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(module, "module");
  }
}
