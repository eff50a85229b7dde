package io.portmeta.clr.model;

import java.util.Objects;

/**
 * Reference to an external assembly, identified by its simple name and its display name, e.g.
 * {@code System.Runtime, Version=8.0.0.0, Culture=neutral, PublicKeyToken=b03f5f7f11d50a3a}.
 */
public final class AssemblyRef implements ResolutionScope {
  private static final String DEFAULT_IDENTITY =
      ", Version=0.0.0.0, Culture=neutral, PublicKeyToken=null";

  private final String name;
  private final String fullName;

  public AssemblyRef(String name) {
    this(name, name + DEFAULT_IDENTITY);
  }

  public AssemblyRef(String name, String fullName) {
    this.name = Objects.requireNonNull(name, "name");
    this.fullName = Objects.requireNonNull(fullName, "fullName");
  }

  /** Parses a display name; the simple name is everything before the first comma. */
  public static AssemblyRef fromFullName(String fullName) {
    Objects.requireNonNull(fullName, "fullName");
    int comma = fullName.indexOf(',');
    String name = (comma < 0 ? fullName : fullName.substring(0, comma)).trim();
    if (name.isEmpty()) {
      throw new IllegalArgumentException("Assembly name is empty: '" + fullName + "'");
    }
    return comma < 0 ? new AssemblyRef(name) : new AssemblyRef(name, fullName);
  }

  public String getName() {
    return name;
  }

  public String getFullName() {
    return fullName;
  }

  @Override
  public String toString() {
    return fullName;
  }
}
