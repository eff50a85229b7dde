package io.portmeta.metadata.api;

import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Token-keyed, insertion-ordered store of one entity kind. Entries are added or replaced, never
 * removed.
 *
 * @param <T> entity type
 */
public interface TokenMap<T> extends Iterable<Map.Entry<PortableToken, T>> {

  int size();

  boolean containsKey(PortableToken token);

  /**
   * @throws NoSuchElementException if the token is not present
   */
  T get(PortableToken token);

  /** Returns the value, or {@code null} if the token is not present. */
  T find(PortableToken token);

  /**
   * Adds a new entry.
   *
   * @throws IllegalArgumentException if the token is already present or not acceptable to this
   *     map
   */
  void add(PortableToken token, T value);

  /**
   * Replaces the value of an existing entry or appends a new one.
   *
   * @throws IllegalArgumentException if the token is not acceptable to this map
   */
  void put(PortableToken token, T value);

  /** Whether this map is keyed by named tokens. */
  boolean isNamed();
}
