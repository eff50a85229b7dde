package io.portmeta.clr.model;

/** A {@link MethodDef} or a method {@link MemberRef}. */
public interface MethodDefOrRef {

  String getName();
}
