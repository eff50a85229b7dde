package io.portmeta.metadata.api;

import io.portmeta.metadata.api.PortableMetadataEqualityComparer.Equivalence;
import io.portmeta.metadata.api.PortableMetadataEqualityComparer.Key;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers entities in a {@link PortableMetadata} container, deduplicating by reference identity
 * and upgrading stored values as higher {@link PortableMetadataLevel levels} are requested.
 *
 * <p>Each entity goes through {@code unregistered -> REFERENCE -> DEFINITION ->
 * DEFINITION_WITH_CHILDREN}; its token never changes once allocated. Not thread-safe.
 */
public final class PortableMetadataUpdater {
  private static final Logger log = LoggerFactory.getLogger(PortableMetadataUpdater.class);

  /** Token plus the level an entity is currently stored at. */
  public record UpdateResult(PortableToken token, PortableMetadataLevel level) {}

  private static final class TokenWithLevel {
    final PortableToken token;
    PortableMetadataLevel level;

    TokenWithLevel(PortableToken token, PortableMetadataLevel level) {
      this.token = token;
      this.level = level;
    }
  }

  private final PortableMetadata metadata;
  private final Map<Key<PortableType>, TokenWithLevel> typeTokens;
  private final Map<Key<PortableField>, TokenWithLevel> fieldTokens;
  private final Map<Key<PortableMethod>, TokenWithLevel> methodTokens;

  /**
   * Attaches to {@code metadata}, indexing the entries it already holds: definition-shaped values
   * count as {@link PortableMetadataLevel#DEFINITION}, the rest as references.
   */
  public PortableMetadataUpdater(PortableMetadata metadata) {
    this.metadata = Objects.requireNonNull(metadata, "metadata");
    PortableMetadataEqualityComparer comparer = PortableMetadataEqualityComparer.REFERENCE;
    this.typeTokens = index(metadata.getTypes(), comparer.types(), PortableTypeDef.class);
    this.fieldTokens = index(metadata.getFields(), comparer.fields(), PortableFieldDef.class);
    this.methodTokens = index(metadata.getMethods(), comparer.methods(), PortableMethodDef.class);
  }

  private static <T> Map<Key<T>, TokenWithLevel> index(
      TokenMap<T> source, Equivalence<T> equivalence, Class<? extends T> definitionClass) {
    Map<Key<T>, TokenWithLevel> map = new HashMap<>();
    for (Map.Entry<PortableToken, T> entry : source) {
      PortableMetadataLevel level =
          definitionClass.isInstance(entry.getValue())
              ? PortableMetadataLevel.DEFINITION
              : PortableMetadataLevel.REFERENCE;
      map.put(equivalence.wrap(entry.getValue()), new TokenWithLevel(entry.getKey(), level));
    }
    return map;
  }

  public PortableMetadata getMetadata() {
    return metadata;
  }

  /**
   * Registers or upgrades a type.
   *
   * @param type the type, at the shape matching {@code level}
   * @param level the requested level
   * @return the type token and the level it is stored at after this call; for an already
   *     registered type requested at a lower or equal level that is the previously stored level
   */
  public UpdateResult update(PortableType type, PortableMetadataLevel level) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(level, "level");
    return update(
        PortableMetadataEqualityComparer.REFERENCE.types().wrap(type),
        type,
        level,
        typeTokens,
        metadata.getTypes(),
        () -> uniqueName(type.getName(), metadata.getTypes()::containsKey));
  }

  /**
   * Registers or upgrades a field.
   *
   * @throws IllegalArgumentException if {@code level} is {@code DEFINITION_WITH_CHILDREN}
   */
  public UpdateResult update(PortableField field, PortableMetadataLevel level) {
    Objects.requireNonNull(field, "field");
    checkMemberLevel(level);
    return update(
        PortableMetadataEqualityComparer.REFERENCE.fields().wrap(field),
        field,
        level,
        fieldTokens,
        metadata.getFields(),
        () -> memberName(field.getType(), field.getName(), metadata.getFields()::containsKey));
  }

  /**
   * Registers or upgrades a method.
   *
   * @throws IllegalArgumentException if {@code level} is {@code DEFINITION_WITH_CHILDREN}
   */
  public UpdateResult update(PortableMethod method, PortableMetadataLevel level) {
    Objects.requireNonNull(method, "method");
    checkMemberLevel(level);
    return update(
        PortableMetadataEqualityComparer.REFERENCE.methods().wrap(method),
        method,
        level,
        methodTokens,
        metadata.getMethods(),
        () -> memberName(method.getType(), method.getName(), metadata.getMethods()::containsKey));
  }

  private static void checkMemberLevel(PortableMetadataLevel level) {
    Objects.requireNonNull(level, "level");
    if (level == PortableMetadataLevel.DEFINITION_WITH_CHILDREN) {
      throw new IllegalArgumentException("Members have no children level: " + level);
    }
  }

  private <T> UpdateResult update(
      Key<T> key,
      T value,
      PortableMetadataLevel level,
      Map<Key<T>, TokenWithLevel> tokens,
      TokenMap<T> store,
      Supplier<String> names) {
    TokenWithLevel tl = tokens.get(key);
    if (tl == null) {
      PortableToken token =
          metadata.isNamedTokens() ? PortableToken.of(names.get()) : PortableToken.of(store.size());
      tl = new TokenWithLevel(token, level);
      tokens.put(key, tl);
      store.add(token, value);
      return new UpdateResult(token, level);
    }
    if (level.compareTo(tl.level) > 0) {
      log.debug("Upgrading {} from {} to {}", tl.token, tl.level, level);
      tl.level = level;
      store.put(tl.token, value);
      return new UpdateResult(tl.token, level);
    }
    return new UpdateResult(tl.token, tl.level);
  }

  private static String memberName(
      PortableComplexType declaringType, String name, Predicate<PortableToken> exists) {
    String typeName;
    if (declaringType.isToken()) {
      typeName = declaringType.getToken().toString();
    } else {
      PortableToken scope = declaringType.getScopeType();
      typeName = (scope != null ? scope.toString() : "") + "<?>";
    }
    return uniqueName(typeName + "::" + name, exists);
  }

  /**
   * Sanitizes {@code baseName} into a valid token name and appends {@code _2}, {@code _3}, ...
   * until it is unused.
   */
  static String uniqueName(String baseName, Predicate<PortableToken> exists) {
    String invalid = PortableToken.invalidNameChars();
    StringBuilder sb = new StringBuilder(baseName.isEmpty() ? "_" : baseName);
    for (int i = 0; i < sb.length(); i++) {
      if (invalid.indexOf(sb.charAt(i)) >= 0) {
        sb.setCharAt(i, '_');
      }
    }
    String name = sb.toString();
    if (!exists.test(PortableToken.of(name))) {
      return name;
    }
    for (int n = 2; n < Integer.MAX_VALUE; n++) {
      String candidate = name + "_" + n;
      if (!exists.test(PortableToken.of(candidate))) {
        log.debug("Token name {} is taken, using {}", name, candidate);
        return candidate;
      }
    }
    throw new IllegalStateException("No unique name left for " + name);
  }
}
