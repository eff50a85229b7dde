package io.portmeta.metadata.impl;

import io.portmeta.metadata.api.TokenMap;

/** Factory for {@link TokenMap} implementations. */
public final class TokenMaps {
  private TokenMaps() {}

  public static <T> TokenMap<T> create(boolean named) {
    return named ? new NamedTokenMap<>() : new DenseTokenMap<>();
  }

  /**
   * Makes {@code map} reject further writes.
   *
   * @throws IllegalArgumentException if the map was not created by {@link #create(boolean)}
   */
  public static void seal(TokenMap<?> map) {
    if (!(map instanceof AbstractTokenMap)) {
      throw new IllegalArgumentException("Unsupported token map " + map.getClass().getName());
    }
    ((AbstractTokenMap<?>) map).seal();
  }
}
