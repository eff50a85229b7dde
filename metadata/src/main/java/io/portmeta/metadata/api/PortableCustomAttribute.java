package io.portmeta.metadata.api;

import java.util.Arrays;
import java.util.Objects;

/**
 * Custom attribute as its constructor plus the undecoded blob.
 *
 * @param constructor token of the constructor method
 * @param rawData custom attribute blob
 */
public record PortableCustomAttribute(PortableToken constructor, byte[] rawData) {

  public PortableCustomAttribute {
    Objects.requireNonNull(constructor, "constructor");
    Objects.requireNonNull(rawData, "rawData");
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PortableCustomAttribute)) {
      return false;
    }
    PortableCustomAttribute that = (PortableCustomAttribute) o;
    return constructor.equals(that.constructor) && Arrays.equals(rawData, that.rawData);
  }

  @Override
  public int hashCode() {
    return constructor.hashCode() * 31 + Arrays.hashCode(rawData);
  }

  @Override
  public String toString() {
    return "PortableCustomAttribute[constructor="
        + constructor
        + ", rawData="
        + rawData.length
        + " bytes]";
  }
}
