package io.portmeta.metadata.impl;

import io.portmeta.metadata.api.PortableToken;
import io.portmeta.metadata.api.TokenMap;
import java.util.NoSuchElementException;
import java.util.Objects;

abstract class AbstractTokenMap<T> implements TokenMap<T> {
  private boolean readOnly;

  /** Rejects all further writes. */
  void seal() {
    readOnly = true;
  }

  final void checkWritable() {
    if (readOnly) {
      throw new UnsupportedOperationException("Token map is read-only");
    }
  }

  @Override
  public final T get(PortableToken token) {
    T value = find(Objects.requireNonNull(token, "token"));
    if (value == null) {
      throw new NoSuchElementException("No entry for token " + token);
    }
    return value;
  }

  @Override
  public final void add(PortableToken token, T value) {
    checkWritable();
    Objects.requireNonNull(token, "token");
    Objects.requireNonNull(value, "value");
    if (containsKey(token)) {
      throw new IllegalArgumentException("Duplicate token " + token);
    }
    doPut(token, value);
  }

  @Override
  public final void put(PortableToken token, T value) {
    checkWritable();
    doPut(Objects.requireNonNull(token, "token"), Objects.requireNonNull(value, "value"));
  }

  abstract void doPut(PortableToken token, T value);

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("{");
    for (var entry : this) {
      if (sb.length() > 1) {
        sb.append(", ");
      }
      sb.append(entry.getKey()).append('=').append(entry.getValue());
    }
    return sb.append('}').toString();
  }
}
