package io.portmeta.clr.model;

/** Owner of a {@link MemberRef}. */
public interface MemberRefParent {}
