package io.portmeta.metadata.api;

import static io.portmeta.metadata.api.PortableMetadataFixtures.fieldSig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.portmeta.metadata.api.PortableMetadataEqualityComparer.Equivalence;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class PortableMetadataEqualityComparerTest {
  private static final PortableMetadataEqualityComparer REFERENCE =
      PortableMetadataEqualityComparer.REFERENCE;
  private static final PortableMetadataEqualityComparer FULL =
      PortableMetadataEqualityComparer.FULL;

  private static PortableTypeDef typeDef(int attributes, List<PortableComplexType> interfaces) {
    return new PortableTypeDef(
        "Foo", "N", null, null, attributes, null, interfaces, null, null, null);
  }

  private static PortableFieldDef fieldDef(int attributes, byte[] initialValue) {
    return new PortableFieldDef(
        "f",
        PortableComplexType.token(PortableToken.of(0)),
        fieldSig(PortableComplexType.typeSig(ElementType.I4)),
        attributes,
        initialValue,
        null,
        null);
  }

  @Test
  void referenceModeIgnoresDefinitionContent() {
    PortableTypeDef a = typeDef(0x1, null);
    PortableTypeDef b = typeDef(0x100001, null);
    PortableType ref = new PortableType("Foo", "N", null, null);

    assertThat(REFERENCE.equals(a, b)).isTrue();
    assertThat(REFERENCE.equals(a, ref)).isTrue();
    assertThat(REFERENCE.hashCode(a)).isEqualTo(REFERENCE.hashCode(ref));

    assertThat(FULL.equals(a, b)).isFalse();
    assertThat(FULL.equals(a, ref)).isFalse();
    assertThat(FULL.equals(a, typeDef(0x1, null))).isTrue();
  }

  @Test
  void identityFieldsAlwaysMatter() {
    PortableType a = new PortableType("Foo", "N", "asm", null);
    assertThat(REFERENCE.equals(a, new PortableType("Foo", "M", "asm", null))).isFalse();
    assertThat(REFERENCE.equals(a, new PortableType("Foo", "N", null, null))).isFalse();
    assertThat(REFERENCE.equals(a, new PortableType("Foo", "N", "asm", List.of("Outer"))))
        .isFalse();
    assertThat(REFERENCE.equals(a, null)).isFalse();
    assertThat(REFERENCE.equals((PortableType) null, null)).isTrue();
  }

  @Test
  void nullAndEmptyListsOnlyMatchInReferenceMode() {
    PortableType nullNames = new PortableType("Foo", "N", null, null);
    PortableType emptyNames = new PortableType("Foo", "N", null, List.of());
    assertThat(REFERENCE.equals(nullNames, emptyNames)).isTrue();
    assertThat(FULL.equals(nullNames, emptyNames)).isFalse();

    assertThat(FULL.equals(typeDef(1, null), typeDef(1, List.of()))).isFalse();
    assertThat(FULL.equals(fieldDef(1, null), fieldDef(1, new byte[0]))).isFalse();
    assertThat(FULL.equals(fieldDef(1, new byte[] {1}), fieldDef(1, new byte[] {1}))).isTrue();
  }

  @Test
  void membersCompareSignatures() {
    PortableComplexType owner = PortableComplexType.token(PortableToken.of(0));
    PortableField i4 =
        new PortableField("f", owner, fieldSig(PortableComplexType.typeSig(ElementType.I4)));
    PortableField i8 =
        new PortableField("f", owner, fieldSig(PortableComplexType.typeSig(ElementType.I8)));
    assertThat(REFERENCE.equals(i4, i8)).isFalse();
    assertThat(REFERENCE.equals(i4, fieldDef(0x10, null))).isTrue();
    assertThat(REFERENCE.hashCode(i4)).isEqualTo(REFERENCE.hashCode(fieldDef(0x10, null)));
  }

  @Test
  void methodBodiesAreComparedInFullMode() {
    PortableComplexType owner = PortableComplexType.token(PortableToken.of(0));
    PortableComplexType sig =
        PortableMetadataFixtures.methodSig(0, PortableComplexType.typeSig(ElementType.VOID));
    PortableMethodDef a = methodWithStack(owner, sig, 8);
    PortableMethodDef b = methodWithStack(owner, sig, 16);

    assertThat(REFERENCE.equals(a, b)).isTrue();
    assertThat(FULL.equals(a, b)).isFalse();
    assertThat(FULL.equals(a, methodWithStack(owner, sig, 8))).isTrue();
    assertThat(FULL.hashCode(a)).isEqualTo(FULL.hashCode(b));
  }

  private static PortableMethodDef methodWithStack(
      PortableComplexType owner, PortableComplexType sig, int maxStack) {
    PortableMethodBody body =
        new PortableMethodBody(
            List.of(new PortableInstruction("ret")), List.of(), List.of(), maxStack, true);
    return new PortableMethodDef(
        "M", owner, sig, 0x16, 0, List.of(), body, null, null, null, null);
  }

  @Test
  void wrappedKeysWorkInHashMaps() {
    Equivalence<PortableType> types = REFERENCE.types();
    Map<PortableMetadataEqualityComparer.Key<PortableType>, String> map = new HashMap<>();
    map.put(types.wrap(new PortableType("Foo", "N", null, null)), "foo");

    assertThat(map.get(types.wrap(typeDef(0x1, List.of())))).isEqualTo("foo");
    assertThat(map.get(FULL.types().wrap(new PortableType("Foo", "N", null, null)))).isNull();
    assertThatThrownBy(() -> types.wrap(null)).isInstanceOf(NullPointerException.class);
  }
}
