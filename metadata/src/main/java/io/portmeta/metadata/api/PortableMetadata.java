package io.portmeta.metadata.api;

import io.portmeta.metadata.impl.TokenMaps;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Container of portable types, fields and methods keyed by {@link PortableToken}.
 *
 * <p>The token flavour is fixed at construction by {@link
 * PortableMetadataOptions#USE_NAMED_TOKEN}: indexed containers hold dense, in-order keys; named
 * containers keep insertion order. Entities are populated through a {@link
 * PortableMetadataUpdater}.
 */
public final class PortableMetadata {
  private final Set<PortableMetadataOptions> options;
  private final TokenMap<PortableType> types;
  private final TokenMap<PortableField> fields;
  private final TokenMap<PortableMethod> methods;

  public PortableMetadata() {
    this(PortableMetadataOptions.DEFAULT);
  }

  public PortableMetadata(Set<PortableMetadataOptions> options) {
    Objects.requireNonNull(options, "options");
    EnumSet<PortableMetadataOptions> copy = EnumSet.noneOf(PortableMetadataOptions.class);
    copy.addAll(options);
    this.options = Collections.unmodifiableSet(copy);
    boolean named = copy.contains(PortableMetadataOptions.USE_NAMED_TOKEN);
    this.types = TokenMaps.create(named);
    this.fields = TokenMaps.create(named);
    this.methods = TokenMaps.create(named);
  }

  /**
   * @param flags OR-ed {@link PortableMetadataOptions} flags
   * @throws IllegalArgumentException on unknown flag bits
   */
  public static PortableMetadata withFlags(int flags) {
    return new PortableMetadata(PortableMetadataOptions.fromFlags(flags));
  }

  public Set<PortableMetadataOptions> getOptions() {
    return options;
  }

  public int getOptionFlags() {
    return PortableMetadataOptions.toFlags(options);
  }

  public boolean hasOption(PortableMetadataOptions option) {
    return options.contains(option);
  }

  public boolean isNamedTokens() {
    return options.contains(PortableMetadataOptions.USE_NAMED_TOKEN);
  }

  public TokenMap<PortableType> getTypes() {
    return types;
  }

  public TokenMap<PortableField> getFields() {
    return fields;
  }

  public TokenMap<PortableMethod> getMethods() {
    return methods;
  }

  /**
   * Freezes the container. Later writes fail with {@link UnsupportedOperationException}; reads
   * may then happen from several threads.
   *
   * @return this container
   */
  public PortableMetadata seal() {
    TokenMaps.seal(types);
    TokenMaps.seal(fields);
    TokenMaps.seal(methods);
    return this;
  }

  @Override
  public String toString() {
    return "PortableMetadata{options="
        + options
        + ", types="
        + types.size()
        + ", fields="
        + fields.size()
        + ", methods="
        + methods.size()
        + '}';
  }
}
