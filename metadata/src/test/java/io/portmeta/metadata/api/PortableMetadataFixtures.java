package io.portmeta.metadata.api;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Small hand-built containers shared by the serialization tests. */
public final class PortableMetadataFixtures {
  public static final float NAN_WITH_PAYLOAD = Float.intBitsToFloat(0x7FC00123);

  private PortableMetadataFixtures() {}

  public static PortableComplexType methodSig(
      int flags, PortableComplexType ret, PortableComplexType... params) {
    List<PortableComplexType> args = new ArrayList<>();
    args.add(PortableComplexType.int32(flags));
    args.add(PortableComplexType.int32(params.length));
    args.add(ret);
    args.addAll(List.of(params));
    return PortableComplexType.callingConventionSig(CallingConvention.DEFAULT.getCode(), args);
  }

  public static PortableComplexType fieldSig(PortableComplexType type) {
    return PortableComplexType.callingConventionSig(
        CallingConvention.FIELD, PortableComplexType.int32(0), type);
  }

  /**
   * Container with an external type reference, a defined class holding a constant field and a
   * static method with a body, and a reference to {@code Console.WriteLine}. Entries alternate
   * between references and definitions.
   */
  public static PortableMetadata sample(Set<PortableMetadataOptions> options) {
    PortableMetadata metadata = new PortableMetadata(options);
    PortableMetadataUpdater updater = new PortableMetadataUpdater(metadata);

    PortableToken object =
        updater
            .update(
                new PortableType("Object", "System", "mscorlib", null),
                PortableMetadataLevel.REFERENCE)
            .token();
    PortableToken console =
        updater
            .update(
                new PortableType("Console", "System", "mscorlib", null),
                PortableMetadataLevel.REFERENCE)
            .token();
    PortableToken program =
        updater
            .update(
                new PortableType("Program", "Demo", null, null), PortableMetadataLevel.REFERENCE)
            .token();

    PortableComplexType stringType = PortableComplexType.typeSig(ElementType.STRING);
    PortableComplexType voidType = PortableComplexType.typeSig(ElementType.VOID);
    PortableToken writeLine =
        updater
            .update(
                new PortableMethod(
                    "WriteLine",
                    PortableComplexType.token(console),
                    methodSig(0, voidType, stringType)),
                PortableMetadataLevel.REFERENCE)
            .token();

    PortableToken greeting =
        updater
            .update(
                new PortableFieldDef(
                    "Greeting",
                    PortableComplexType.token(program),
                    fieldSig(PortableComplexType.typeSig(ElementType.R4)),
                    0x8051,
                    null,
                    PortableConstant.of(ElementType.R4, NAN_WITH_PAYLOAD),
                    null),
                PortableMetadataLevel.DEFINITION)
            .token();

    List<PortableInstruction> instructions =
        List.of(
            new PortableInstruction("ldarg.0"),
            new PortableInstruction("switch", PortableOperand.of(new int[] {3, 5})),
            new PortableInstruction("br.s", PortableOperand.of(5)),
            new PortableInstruction("ldstr", PortableOperand.of("hello")),
            new PortableInstruction(
                "call",
                PortableOperand.of(
                    PortableComplexType.inlineMethod(PortableComplexType.token(writeLine)))),
            new PortableInstruction("ldc.r4", PortableOperand.of(NAN_WITH_PAYLOAD)),
            new PortableInstruction("ldc.i8", PortableOperand.of(Long.MIN_VALUE)),
            new PortableInstruction("ldc.r8", PortableOperand.of(-0.0d)),
            new PortableInstruction("pop"),
            new PortableInstruction("pop"),
            new PortableInstruction(
                "ldsfld",
                PortableOperand.of(
                    PortableComplexType.inlineField(PortableComplexType.token(greeting)))),
            new PortableInstruction("pop"),
            new PortableInstruction("ret"));
    PortableMethodBody body =
        new PortableMethodBody(
            instructions,
            List.of(
                new PortableExceptionHandler(
                    3, 5, -1, 5, 12, PortableComplexType.token(object), 0)),
            List.of(PortableComplexType.typeSig(ElementType.I4)),
            4,
            true);
    updater.update(
        new PortableMethodDef(
            "Main",
            PortableComplexType.token(program),
            methodSig(0, voidType, PortableComplexType.typeSig(ElementType.I4)),
            0x0096,
            0,
            List.of(new PortableParameter("arg", 1, 0, null, null)),
            body,
            null,
            null,
            null,
            List.of(new PortableCustomAttribute(writeLine, new byte[] {1, 0, 0, 0}))),
        PortableMetadataLevel.DEFINITION);

    PortableTypeDef programDef =
        new PortableTypeDef(
            "Program",
            "Demo",
            null,
            null,
            0x100001,
            PortableComplexType.token(object),
            List.of(),
            null,
            null,
            null);
    programDef.setFields(List.of(greeting));
    updater.update(programDef, PortableMetadataLevel.DEFINITION_WITH_CHILDREN);
    return metadata;
  }

  /** Asserts both containers hold fully equal entries under the same tokens in the same order. */
  public static void assertFullyEqual(PortableMetadata actual, PortableMetadata expected) {
    assertThat(actual.getOptions()).isEqualTo(expected.getOptions());
    PortableMetadataEqualityComparer full = PortableMetadataEqualityComparer.FULL;
    assertEntries(actual.getTypes(), expected.getTypes(), full.types());
    assertEntries(actual.getFields(), expected.getFields(), full.fields());
    assertEntries(actual.getMethods(), expected.getMethods(), full.methods());
  }

  private static <T> void assertEntries(
      TokenMap<T> actual,
      TokenMap<T> expected,
      PortableMetadataEqualityComparer.Equivalence<T> eq) {
    assertThat(actual.size()).isEqualTo(expected.size());
    Iterator<Map.Entry<PortableToken, T>> a = actual.iterator();
    for (Map.Entry<PortableToken, T> e : expected) {
      Map.Entry<PortableToken, T> next = a.next();
      assertThat(next.getKey()).isEqualTo(e.getKey());
      assertThat(eq.equivalent(next.getValue(), e.getValue()))
          .as("%s equals %s", next.getValue(), e.getValue())
          .isTrue();
    }
  }
}
