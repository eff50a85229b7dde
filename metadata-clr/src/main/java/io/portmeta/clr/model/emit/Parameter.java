package io.portmeta.clr.model.emit;

import io.portmeta.clr.model.sig.TypeSig;

/**
 * Argument slot of a method as seen by {@code ldarg}/{@code starg}. Index 0 is the hidden
 * {@code this} of an instance method, whose {@code type} is {@code null}.
 */
public record Parameter(int index, TypeSig type, boolean hiddenThis) {}
