package io.portmeta.clr.model;

/** Scope a {@link TypeRef} is resolved in: an assembly, a module or an enclosing type. */
public interface ResolutionScope {}
