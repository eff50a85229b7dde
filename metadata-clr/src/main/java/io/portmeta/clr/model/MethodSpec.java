package io.portmeta.clr.model;

import io.portmeta.clr.model.sig.CallingConventionSig.GenericInstMethodSig;
import java.util.Objects;

/** Instantiation of a generic method. */
public record MethodSpec(MethodDefOrRef method, GenericInstMethodSig instantiation) {
  public MethodSpec {
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(instantiation, "instantiation");
  }
}
