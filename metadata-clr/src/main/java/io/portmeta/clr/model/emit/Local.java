package io.portmeta.clr.model.emit;

import io.portmeta.clr.model.sig.TypeSig;
import java.util.Objects;

/** Local variable slot of a method body. */
public record Local(int index, TypeSig type) {
  public Local {
    Objects.requireNonNull(type, "type");
  }
}
