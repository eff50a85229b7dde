package io.portmeta.metadata.api;

import java.util.Objects;

/**
 * Identifies an entity within one {@link PortableMetadata} container.
 *
 * <p>A token is either <em>indexed</em> (a non-negative, dense insertion index) or <em>named</em>
 * (a non-empty, human-readable string). Named tokens sort before indexed tokens; named tokens
 * compare lexicographically, indexed tokens numerically.
 */
public final class PortableToken implements Comparable<PortableToken> {
  private static final String INVALID_NAME_CHARS = "(),@'";

  private final int index;
  private final String name;

  private PortableToken(int index, String name) {
    this.index = index;
    this.name = name;
  }

  /**
   * Creates an indexed token.
   *
   * @param index a non-negative index
   * @return the token
   * @throws IllegalArgumentException if {@code index} is negative
   */
  public static PortableToken of(int index) {
    if (index < 0) {
      throw new IllegalArgumentException("Token index must be non-negative: " + index);
    }
    return new PortableToken(index, null);
  }

  /**
   * Creates a named token.
   *
   * @param name a non-empty name free of {@code ( ) , @ '}
   * @return the token
   * @throws IllegalArgumentException if the name is empty or holds a reserved character
   */
  public static PortableToken of(String name) {
    Objects.requireNonNull(name, "name");
    if (name.isEmpty()) {
      throw new IllegalArgumentException("Token name must not be empty");
    }
    int invalid = indexOfInvalidChar(name);
    if (invalid >= 0) {
      throw new IllegalArgumentException(
          "Token name contains invalid character '" + name.charAt(invalid) + "': " + name);
    }
    return new PortableToken(-1, name);
  }

  /** Checks whether {@code name} may be used as a named token. */
  public static boolean isValidName(String name) {
    return name != null && !name.isEmpty() && indexOfInvalidChar(name) < 0;
  }

  /** Characters that cannot appear in a token name. */
  public static String invalidNameChars() {
    return INVALID_NAME_CHARS;
  }

  private static int indexOfInvalidChar(String name) {
    for (int i = 0; i < name.length(); i++) {
      if (INVALID_NAME_CHARS.indexOf(name.charAt(i)) >= 0) {
        return i;
      }
    }
    return -1;
  }

  public boolean isNamed() {
    return name != null;
  }

  /**
   * @return the index of an indexed token
   * @throws IllegalStateException if the token is named
   */
  public int getIndex() {
    if (name != null) {
      throw new IllegalStateException("Token '" + name + "' is named, not indexed");
    }
    return index;
  }

  /**
   * @return the name of a named token
   * @throws IllegalStateException if the token is indexed
   */
  public String getName() {
    if (name == null) {
      throw new IllegalStateException("Token " + index + " is indexed, not named");
    }
    return name;
  }

  @Override
  public int compareTo(PortableToken other) {
    if (name != null) {
      return other.name != null ? name.compareTo(other.name) : -1;
    }
    return other.name != null ? 1 : Integer.compare(index, other.index);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PortableToken)) {
      return false;
    }
    PortableToken that = (PortableToken) o;
    return index == that.index && Objects.equals(name, that.name);
  }

  @Override
  public int hashCode() {
    return name != null ? name.hashCode() : index;
  }

  @Override
  public String toString() {
    return name != null ? name : Integer.toString(index);
  }
}
