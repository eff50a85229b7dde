package io.portmeta.clr.model;

import java.util.Objects;

/** Reference to another module, typically a native library named by a P/Invoke map. */
public final class ModuleRef implements ResolutionScope, MemberRefParent {
  private final String name;

  public ModuleRef(String name) {
    this.name = Objects.requireNonNull(name, "name");
  }

  public String getName() {
    return name;
  }

  @Override
  public String toString() {
    return name;
  }
}
