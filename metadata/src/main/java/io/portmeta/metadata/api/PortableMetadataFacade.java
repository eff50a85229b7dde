package io.portmeta.metadata.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serialization-friendly projection of a {@link PortableMetadata}.
 *
 * <p>Each entity kind is split into a map of references and a map of definitions, both keyed by
 * the token's string form. In named-token mode the interleaving of the two is recorded in {@code
 * orders}: the sequence starts with references and switches side at every listed position. In
 * indexed mode the keys {@code "0".."n-1"} already give the order.
 */
public final class PortableMetadataFacade {

  /**
   * References and definitions of one entity kind.
   *
   * @param <T> reference type
   * @param <D> definition type
   */
  public static final class EntityFacade<T, D extends T> {
    private Map<String, T> references = new LinkedHashMap<>();
    private Map<String, D> definitions = new LinkedHashMap<>();
    private List<Integer> orders = new ArrayList<>();

    public Map<String, T> getReferences() {
      return references != null ? references : Collections.emptyMap();
    }

    public Map<String, D> getDefinitions() {
      return definitions != null ? definitions : Collections.emptyMap();
    }

    public List<Integer> getOrders() {
      return orders != null ? orders : Collections.emptyList();
    }

    public int size() {
      return getReferences().size() + getDefinitions().size();
    }
  }

  private int options;
  private EntityFacade<PortableType, PortableTypeDef> types = new EntityFacade<>();
  private EntityFacade<PortableField, PortableFieldDef> fields = new EntityFacade<>();
  private EntityFacade<PortableMethod, PortableMethodDef> methods = new EntityFacade<>();

  /** Creates an empty facade, used by deserializers. */
  public PortableMetadataFacade() {}

  public PortableMetadataFacade(PortableMetadata metadata) {
    this.options = metadata.getOptionFlags();
    boolean named = metadata.isNamedTokens();
    copy(metadata.getTypes(), types, PortableTypeDef.class, named);
    copy(metadata.getFields(), fields, PortableFieldDef.class, named);
    copy(metadata.getMethods(), methods, PortableMethodDef.class, named);
  }

  public int getOptions() {
    return options;
  }

  public EntityFacade<PortableType, PortableTypeDef> getTypes() {
    return types;
  }

  public EntityFacade<PortableField, PortableFieldDef> getFields() {
    return fields;
  }

  public EntityFacade<PortableMethod, PortableMethodDef> getMethods() {
    return methods;
  }

  private static <T, D extends T> void copy(
      TokenMap<T> source, EntityFacade<T, D> target, Class<D> definitionClass, boolean named) {
    boolean lastIsDef = false;
    int i = 0;
    for (Map.Entry<PortableToken, T> entry : source) {
      String key = entry.getKey().toString();
      T value = entry.getValue();
      boolean addOrder;
      if (definitionClass.isInstance(value)) {
        target.definitions.put(key, definitionClass.cast(value));
        addOrder = !lastIsDef;
        lastIsDef = true;
      } else {
        target.references.put(key, value);
        addOrder = lastIsDef;
        lastIsDef = false;
      }
      if (addOrder && named) {
        target.orders.add(i);
      }
      i++;
    }
  }

  /**
   * Rebuilds the container with the same enumeration order it was projected from.
   *
   * @throws IllegalArgumentException on unknown option flags
   * @throws InvalidMetadataDataException if keys or orders are inconsistent
   */
  public PortableMetadata toMetadata() {
    PortableMetadata metadata = PortableMetadata.withFlags(options);
    boolean named = metadata.isNamedTokens();
    copy(types, metadata.getTypes(), named, "Types");
    copy(fields, metadata.getFields(), named, "Fields");
    copy(methods, metadata.getMethods(), named, "Methods");
    return metadata;
  }

  private static <T, D extends T> void copy(
      EntityFacade<T, D> source, TokenMap<T> destination, boolean named, String section) {
    if (source == null) {
      return;
    }
    int count = source.size();
    if (named) {
      Iterator<Integer> orders = source.getOrders().iterator();
      Iterator<Map.Entry<String, T>> refs = source.getReferences().entrySet().iterator();
      Iterator<Map.Entry<String, D>> defs = source.getDefinitions().entrySet().iterator();
      int nextOrder = orders.hasNext() ? orders.next() : -1;
      boolean lastIsDef = false;
      for (int i = 0; i < count; i++) {
        if (i == nextOrder) {
          lastIsDef = !lastIsDef;
          nextOrder = orders.hasNext() ? orders.next() : -1;
        }
        Iterator<? extends Map.Entry<String, ? extends T>> side = lastIsDef ? defs : refs;
        if (!side.hasNext()) {
          throw new InvalidMetadataDataException(
              "Orders do not match the number of " + (lastIsDef ? "definitions" : "references"),
              section);
        }
        Map.Entry<String, ? extends T> entry = side.next();
        destination.add(namedToken(entry.getKey(), section), entry.getValue());
      }
    } else {
      for (int i = 0; i < count; i++) {
        String key = Integer.toString(i);
        T value = source.getReferences().get(key);
        if (value == null) {
          value = source.getDefinitions().get(key);
        }
        if (value == null) {
          throw new InvalidMetadataDataException("Missing entry for token " + key, section);
        }
        destination.add(PortableToken.of(i), value);
      }
    }
  }

  private static PortableToken namedToken(String key, String section) {
    try {
      return PortableToken.of(key);
    } catch (IllegalArgumentException e) {
      throw new InvalidMetadataDataException("Invalid token name '" + key + "'", e, section);
    }
  }
}
