package io.portmeta.clr.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Generic parameter of a type or method with its constraints. */
public final class GenericParam {
  private final int number;
  private final int attributes;
  private final String name;
  private final List<TypeDefOrRef> constraints = new ArrayList<>();

  public GenericParam(int number, int attributes, String name) {
    this.number = number;
    this.attributes = attributes;
    this.name = Objects.requireNonNull(name, "name");
  }

  public int getNumber() {
    return number;
  }

  public int getAttributes() {
    return attributes;
  }

  public String getName() {
    return name;
  }

  public List<TypeDefOrRef> getConstraints() {
    return constraints;
  }

  @Override
  public String toString() {
    return name;
  }
}
