package io.portmeta.clr.model;

import java.util.Arrays;
import java.util.Objects;

/** Custom attribute kept as its constructor and the undecoded value blob. */
public final class CustomAttribute {
  private final MethodDefOrRef constructor;
  private final byte[] blob;

  public CustomAttribute(MethodDefOrRef constructor, byte[] blob) {
    this.constructor = Objects.requireNonNull(constructor, "constructor");
    this.blob = Objects.requireNonNull(blob, "blob").clone();
  }

  public MethodDefOrRef getConstructor() {
    return constructor;
  }

  public byte[] getBlob() {
    return blob.clone();
  }

  @Override
  public String toString() {
    return "CustomAttribute{" + constructor.getName() + ", " + Arrays.toString(blob) + '}';
  }
}
