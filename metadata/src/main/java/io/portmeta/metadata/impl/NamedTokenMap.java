package io.portmeta.metadata.impl;

import io.portmeta.metadata.api.PortableToken;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/** Insertion-ordered map for named tokens. */
public final class NamedTokenMap<T> extends AbstractTokenMap<T> {
  private final Map<PortableToken, T> entries = new LinkedHashMap<>();

  @Override
  public int size() {
    return entries.size();
  }

  @Override
  public boolean containsKey(PortableToken token) {
    return entries.containsKey(token);
  }

  @Override
  public T find(PortableToken token) {
    return entries.get(token);
  }

  @Override
  void doPut(PortableToken token, T value) {
    if (!token.isNamed()) {
      throw new IllegalArgumentException("Indexed token " + token + " in a named map");
    }
    entries.put(token, value);
  }

  @Override
  public boolean isNamed() {
    return true;
  }

  @Override
  public Iterator<Map.Entry<PortableToken, T>> iterator() {
    return Collections.unmodifiableMap(entries).entrySet().iterator();
  }
}
