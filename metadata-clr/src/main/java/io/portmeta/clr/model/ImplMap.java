package io.portmeta.clr.model;

import java.util.Objects;

/** P/Invoke mapping of a method to an entry point of a native module. */
public record ImplMap(ModuleRef module, String name, int attributes) {
  public ImplMap {
    Objects.requireNonNull(module, "module");
    Objects.requireNonNull(name, "name");
  }
}
