package io.portmeta.metadata.api;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/** Container options. Serialized as an int of OR-ed flags. */
public enum PortableMetadataOptions {
  /** Tokens are generated names instead of dense indices. */
  USE_NAMED_TOKEN(1),
  /** Type assembly identity is the full assembly name rather than the simple name. */
  USE_ASSEMBLY_FULL_NAME(2),
  /** Method definitions carry their bodies. */
  INCLUDE_METHOD_BODIES(4),
  /** Definitions carry custom attributes. */
  INCLUDE_CUSTOM_ATTRIBUTES(8);

  public static final Set<PortableMetadataOptions> DEFAULT =
      Collections.unmodifiableSet(
          EnumSet.of(USE_ASSEMBLY_FULL_NAME, INCLUDE_METHOD_BODIES, INCLUDE_CUSTOM_ATTRIBUTES));

  private static final int ALL_FLAGS = 1 | 2 | 4 | 8;

  private final int flag;

  PortableMetadataOptions(int flag) {
    this.flag = flag;
  }

  public int getFlag() {
    return flag;
  }

  public static int toFlags(Set<PortableMetadataOptions> options) {
    int flags = 0;
    for (PortableMetadataOptions option : options) {
      flags |= option.flag;
    }
    return flags;
  }

  /**
   * @throws IllegalArgumentException if {@code flags} has unknown bits
   */
  public static Set<PortableMetadataOptions> fromFlags(int flags) {
    if ((flags & ~ALL_FLAGS) != 0) {
      throw new IllegalArgumentException(
          String.format("Unknown portable metadata option flags 0x%X", flags & ~ALL_FLAGS));
    }
    EnumSet<PortableMetadataOptions> options = EnumSet.noneOf(PortableMetadataOptions.class);
    for (PortableMetadataOptions option : values()) {
      if ((flags & option.flag) != 0) {
        options.add(option);
      }
    }
    return options;
  }
}
