package io.portmeta.clr.model;

/** A {@link TypeDef}, {@link TypeRef} or {@link TypeSpec}. */
public interface TypeDefOrRef extends MemberRefParent {

  /** Display name, e.g. {@code System.Collections.Generic.List`1} or {@code Outer/Inner}. */
  String getFullName();
}
