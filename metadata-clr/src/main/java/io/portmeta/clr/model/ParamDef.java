package io.portmeta.clr.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Param row: name, attributes and default value of a parameter. Sequence 0 is the return value. */
public final class ParamDef {
  private final String name;
  private final int sequence;
  private final int attributes;
  private Constant constant;
  private final List<CustomAttribute> customAttributes = new ArrayList<>();

  public ParamDef(String name, int sequence, int attributes) {
    this.name = Objects.requireNonNull(name, "name");
    this.sequence = sequence;
    this.attributes = attributes;
  }

  public String getName() {
    return name;
  }

  public int getSequence() {
    return sequence;
  }

  public int getAttributes() {
    return attributes;
  }

  public Constant getConstant() {
    return constant;
  }

  public void setConstant(Constant constant) {
    this.constant = constant;
  }

  public List<CustomAttribute> getCustomAttributes() {
    return customAttributes;
  }

  @Override
  public String toString() {
    return name;
  }
}
