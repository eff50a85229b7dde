package io.portmeta.clr.model;

import java.util.Objects;

/** Explicit interface implementation: {@code methodBody} implements {@code methodDeclaration}. */
public record MethodOverride(MethodDefOrRef methodBody, MethodDefOrRef methodDeclaration) {
  public MethodOverride {
    Objects.requireNonNull(methodBody, "methodBody");
    Objects.requireNonNull(methodDeclaration, "methodDeclaration");
  }
}
