package io.portmeta.clr.model;

/** A {@link FieldDef} or a field {@link MemberRef}. */
public interface FieldDefOrRef {

  String getName();
}
