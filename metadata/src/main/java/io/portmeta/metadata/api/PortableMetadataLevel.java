package io.portmeta.metadata.api;

/** How much of an entity has been materialized. Levels only ever increase. */
public enum PortableMetadataLevel {
  /** Identity only. */
  REFERENCE,
  /** Full definition without child members. */
  DEFINITION,
  /** Definition with nested types, fields, methods, properties and events. Types only. */
  DEFINITION_WITH_CHILDREN;

  public boolean isAtLeast(PortableMetadataLevel other) {
    return compareTo(other) >= 0;
  }
}
