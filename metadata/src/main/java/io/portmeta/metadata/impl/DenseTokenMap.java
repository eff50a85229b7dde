package io.portmeta.metadata.impl;

import io.portmeta.metadata.api.PortableToken;
import java.util.AbstractMap;
import java.util.Arrays;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Array-backed map for indexed tokens. Keys are the dense range {@code 0..size-1}; a new key must
 * be exactly {@code size}.
 */
public final class DenseTokenMap<T> extends AbstractTokenMap<T> {
  private Object[] data;
  private int size;

  public DenseTokenMap() {
    this(16);
  }

  public DenseTokenMap(int initialCapacity) {
    this.data = new Object[Math.max(1, initialCapacity)];
  }

  @Override
  public int size() {
    return size;
  }

  @Override
  public boolean containsKey(PortableToken token) {
    return !token.isNamed() && token.getIndex() < size;
  }

  @Override
  @SuppressWarnings("unchecked")
  public T find(PortableToken token) {
    if (token.isNamed() || token.getIndex() >= size) {
      return null;
    }
    return (T) data[token.getIndex()];
  }

  @Override
  void doPut(PortableToken token, T value) {
    if (token.isNamed()) {
      throw new IllegalArgumentException("Named token " + token + " in an indexed map");
    }
    int index = token.getIndex();
    if (index < size) {
      data[index] = value;
      return;
    }
    if (index != size) {
      throw new IllegalArgumentException(
          "Token " + index + " is out of order, next index is " + size);
    }
    if (size == data.length) {
      data = Arrays.copyOf(data, data.length << 1);
    }
    data[size++] = value;
  }

  @Override
  public boolean isNamed() {
    return false;
  }

  @Override
  public Iterator<Map.Entry<PortableToken, T>> iterator() {
    return new Iterator<>() {
      private int next;

      @Override
      public boolean hasNext() {
        return next < size;
      }

      @Override
      @SuppressWarnings("unchecked")
      public Map.Entry<PortableToken, T> next() {
        if (next >= size) {
          throw new NoSuchElementException();
        }
        int index = next++;
        return new AbstractMap.SimpleImmutableEntry<>(PortableToken.of(index), (T) data[index]);
      }
    };
  }
}
