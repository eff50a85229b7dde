package io.portmeta.metadata.api;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.BiPredicate;
import java.util.function.ToIntFunction;

/**
 * Equality for portable types, fields, methods and complex types.
 *
 * <p>{@link #REFERENCE} compares identity fields only and treats a {@code null} list as equal to
 * an empty one; it is the identity the updater and writer deduplicate by. {@link #FULL} compares
 * every field, requires the same runtime shape (reference vs definition) and keeps {@code null}
 * and empty apart. Hash codes only cover identity fields in both modes.
 */
public final class PortableMetadataEqualityComparer {
  public static final PortableMetadataEqualityComparer REFERENCE =
      new PortableMetadataEqualityComparer(true, true);
  public static final PortableMetadataEqualityComparer FULL =
      new PortableMetadataEqualityComparer(false, false);

  private static final int HASH_MULTIPLIER = -1521134295;

  private final boolean onlyReference;
  private final boolean nullEqualsEmpty;

  private final Equivalence<PortableType> types =
      new Equivalence<PortableType>((x, y) -> equals(x, y), t -> hashCode(t));
  private final Equivalence<PortableField> fields =
      new Equivalence<PortableField>((x, y) -> equals(x, y), f -> hashCode(f));
  private final Equivalence<PortableMethod> methods =
      new Equivalence<PortableMethod>((x, y) -> equals(x, y), m -> hashCode(m));

  private PortableMetadataEqualityComparer(boolean onlyReference, boolean nullEqualsEmpty) {
    this.onlyReference = onlyReference;
    this.nullEqualsEmpty = nullEqualsEmpty;
  }

  public Equivalence<PortableType> types() {
    return types;
  }

  public Equivalence<PortableField> fields() {
    return fields;
  }

  public Equivalence<PortableMethod> methods() {
    return methods;
  }

  public boolean equals(PortableType x, PortableType y) {
    if (x == y) {
      return true;
    }
    if (x == null || y == null) {
      return false;
    }
    if (!onlyReference && x.getClass() != y.getClass()) {
      return false;
    }
    if (!x.getName().equals(y.getName())
        || !x.getNamespace().equals(y.getNamespace())
        || !Objects.equals(x.getAssembly(), y.getAssembly())
        || !listEquals(x.getEnclosingNames(), y.getEnclosingNames(), Objects::equals)) {
      return false;
    }
    if (onlyReference || !(x instanceof PortableTypeDef)) {
      return true;
    }
    PortableTypeDef xd = (PortableTypeDef) x;
    PortableTypeDef yd = (PortableTypeDef) y;
    return xd.getAttributes() == yd.getAttributes()
        && Objects.equals(xd.getBaseType(), yd.getBaseType())
        && customAttributesEqual(xd.getCustomAttributes(), yd.getCustomAttributes())
        && listEquals(
            xd.getGenericParameters(), yd.getGenericParameters(), this::genericParamEquals)
        && listEquals(xd.getInterfaces(), yd.getInterfaces(), Objects::equals)
        && Objects.equals(xd.getClassLayout(), yd.getClassLayout())
        && listEquals(xd.getNestedTypes(), yd.getNestedTypes(), Objects::equals)
        && listEquals(xd.getFields(), yd.getFields(), Objects::equals)
        && listEquals(xd.getMethods(), yd.getMethods(), Objects::equals)
        && listEquals(xd.getProperties(), yd.getProperties(), this::propertyEquals)
        && listEquals(xd.getEvents(), yd.getEvents(), this::eventEquals);
  }

  public int hashCode(PortableType obj) {
    if (obj == null) {
      return 0;
    }
    int hash = obj.getName().hashCode();
    hash = hash * HASH_MULTIPLIER + obj.getNamespace().hashCode();
    hash = hash * HASH_MULTIPLIER + Objects.hashCode(obj.getAssembly());
    return hash * HASH_MULTIPLIER + nameListHash(obj.getEnclosingNames());
  }

  public boolean equals(PortableField x, PortableField y) {
    if (x == y) {
      return true;
    }
    if (x == null || y == null) {
      return false;
    }
    if (!onlyReference && x.getClass() != y.getClass()) {
      return false;
    }
    if (!memberReferenceEquals(
        x.getName(), x.getType(), x.getSignature(), y.getName(), y.getType(), y.getSignature())) {
      return false;
    }
    if (onlyReference || !(x instanceof PortableFieldDef)) {
      return true;
    }
    PortableFieldDef xd = (PortableFieldDef) x;
    PortableFieldDef yd = (PortableFieldDef) y;
    return xd.getAttributes() == yd.getAttributes()
        && byteArrayEquals(xd.getInitialValue(), yd.getInitialValue())
        && customAttributesEqual(xd.getCustomAttributes(), yd.getCustomAttributes())
        && Objects.equals(xd.getConstant(), yd.getConstant());
  }

  public int hashCode(PortableField obj) {
    return obj == null ? 0 : memberHash(obj.getName(), obj.getType(), obj.getSignature());
  }

  public boolean equals(PortableMethod x, PortableMethod y) {
    if (x == y) {
      return true;
    }
    if (x == null || y == null) {
      return false;
    }
    if (!onlyReference && x.getClass() != y.getClass()) {
      return false;
    }
    if (!memberReferenceEquals(
        x.getName(), x.getType(), x.getSignature(), y.getName(), y.getType(), y.getSignature())) {
      return false;
    }
    if (onlyReference || !(x instanceof PortableMethodDef)) {
      return true;
    }
    PortableMethodDef xd = (PortableMethodDef) x;
    PortableMethodDef yd = (PortableMethodDef) y;
    return xd.getAttributes() == yd.getAttributes()
        && xd.getImplAttributes() == yd.getImplAttributes()
        && listEquals(xd.getParameters(), yd.getParameters(), this::parameterEquals)
        && methodBodyEquals(xd.getBody(), yd.getBody())
        && customAttributesEqual(xd.getCustomAttributes(), yd.getCustomAttributes())
        && listEquals(
            xd.getGenericParameters(), yd.getGenericParameters(), this::genericParamEquals)
        && listEquals(xd.getOverrides(), yd.getOverrides(), Objects::equals)
        && Objects.equals(xd.getImplMap(), yd.getImplMap());
  }

  public int hashCode(PortableMethod obj) {
    return obj == null ? 0 : memberHash(obj.getName(), obj.getType(), obj.getSignature());
  }

  public boolean equals(PortableComplexType x, PortableComplexType y) {
    return Objects.equals(x, y);
  }

  public int hashCode(PortableComplexType obj) {
    if (obj == null) {
      return 0;
    }
    int hash = obj.getKind().ordinal();
    hash = hash * HASH_MULTIPLIER + Objects.hashCode(obj.getToken());
    if (obj.getKind() == PortableComplexTypeKind.INT32) {
      hash = hash * HASH_MULTIPLIER + obj.getInt32();
    }
    hash = hash * HASH_MULTIPLIER + obj.getType();
    if (obj.getArguments() != null) {
      for (PortableComplexType argument : obj.getArguments()) {
        hash = hash * HASH_MULTIPLIER + hashCode(argument);
      }
    }
    return hash;
  }

  private boolean memberReferenceEquals(
      String xName,
      PortableComplexType xType,
      PortableComplexType xSignature,
      String yName,
      PortableComplexType yType,
      PortableComplexType ySignature) {
    return xName.equals(yName) && xType.equals(yType) && xSignature.equals(ySignature);
  }

  private int memberHash(String name, PortableComplexType type, PortableComplexType signature) {
    int hash = name.hashCode();
    hash = hash * HASH_MULTIPLIER + hashCode(type);
    return hash * HASH_MULTIPLIER + hashCode(signature);
  }

  private static int nameListHash(List<String> names) {
    if (names == null) {
      return 0;
    }
    int hash = 0;
    for (String name : names) {
      hash = hash * HASH_MULTIPLIER + name.hashCode();
    }
    return hash;
  }

  private <T> boolean listEquals(List<T> x, List<T> y, BiPredicate<T, T> elementEquals) {
    if (x == y) {
      return true;
    }
    if (x == null || y == null) {
      return nullEqualsEmpty && (x == null ? y.isEmpty() : x.isEmpty());
    }
    if (x.size() != y.size()) {
      return false;
    }
    for (int i = 0; i < x.size(); i++) {
      if (!elementEquals.test(x.get(i), y.get(i))) {
        return false;
      }
    }
    return true;
  }

  private boolean byteArrayEquals(byte[] x, byte[] y) {
    if (x == null || y == null) {
      return x == y || (nullEqualsEmpty && (x == null ? y.length == 0 : x.length == 0));
    }
    return Arrays.equals(x, y);
  }

  private boolean customAttributesEqual(
      List<PortableCustomAttribute> x, List<PortableCustomAttribute> y) {
    return listEquals(x, y, PortableCustomAttribute::equals);
  }

  private boolean genericParamEquals(PortableGenericParameter x, PortableGenericParameter y) {
    return x.name().equals(y.name())
        && x.attributes() == y.attributes()
        && x.number() == y.number()
        && listEquals(x.constraints(), y.constraints(), Objects::equals);
  }

  private boolean propertyEquals(PortableProperty x, PortableProperty y) {
    return x.name().equals(y.name())
        && x.signature().equals(y.signature())
        && x.attributes() == y.attributes()
        && Objects.equals(x.getMethod(), y.getMethod())
        && Objects.equals(x.setMethod(), y.setMethod())
        && customAttributesEqual(x.customAttributes(), y.customAttributes());
  }

  private boolean eventEquals(PortableEvent x, PortableEvent y) {
    return x.name().equals(y.name())
        && x.type().equals(y.type())
        && x.attributes() == y.attributes()
        && Objects.equals(x.addMethod(), y.addMethod())
        && Objects.equals(x.removeMethod(), y.removeMethod())
        && Objects.equals(x.invokeMethod(), y.invokeMethod())
        && customAttributesEqual(x.customAttributes(), y.customAttributes());
  }

  private boolean parameterEquals(PortableParameter x, PortableParameter y) {
    return x.name().equals(y.name())
        && x.sequence() == y.sequence()
        && x.attributes() == y.attributes()
        && customAttributesEqual(x.customAttributes(), y.customAttributes())
        && Objects.equals(x.constant(), y.constant());
  }

  private boolean methodBodyEquals(PortableMethodBody x, PortableMethodBody y) {
    if (x == null || y == null) {
      return x == y;
    }
    return x.maxStack() == y.maxStack()
        && x.initLocals() == y.initLocals()
        && listEquals(x.instructions(), y.instructions(), PortableInstruction::equals)
        && listEquals(
            x.exceptionHandlers(), y.exceptionHandlers(), PortableExceptionHandler::equals)
        && listEquals(x.variables(), y.variables(), Objects::equals);
  }

  /**
   * An equality strategy for one entity kind, usable as a hash key through {@link #wrap}.
   *
   * @param <T> the compared type
   */
  public static final class Equivalence<T> {
    private final BiPredicate<T, T> equals;
    private final ToIntFunction<T> hash;

    Equivalence(BiPredicate<T, T> equals, ToIntFunction<T> hash) {
      this.equals = equals;
      this.hash = hash;
    }

    public boolean equivalent(T x, T y) {
      return equals.test(x, y);
    }

    public int hash(T value) {
      return hash.applyAsInt(value);
    }

    public Key<T> wrap(T value) {
      return new Key<>(this, value);
    }
  }

  /** Hash key whose equality is defined by an {@link Equivalence}. */
  public static final class Key<T> {
    private final Equivalence<T> equivalence;
    private final T value;
    private final int hash;

    Key(Equivalence<T> equivalence, T value) {
      this.equivalence = equivalence;
      this.value = Objects.requireNonNull(value, "value");
      this.hash = equivalence.hash(value);
    }

    public T get() {
      return value;
    }

    @Override
    @SuppressWarnings("unchecked")
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof Key)) {
        return false;
      }
      Key<?> that = (Key<?>) o;
      return equivalence == that.equivalence && equivalence.equivalent(value, (T) that.value);
    }

    @Override
    public int hashCode() {
      return hash;
    }

    @Override
    public String toString() {
      return String.valueOf(value);
    }
  }
}
