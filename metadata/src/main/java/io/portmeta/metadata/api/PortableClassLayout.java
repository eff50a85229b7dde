package io.portmeta.metadata.api;

/**
 * Explicit layout of a type.
 *
 * @param packingSize field alignment in bytes
 * @param classSize total size in bytes
 */
public record PortableClassLayout(int packingSize, int classSize) {}
