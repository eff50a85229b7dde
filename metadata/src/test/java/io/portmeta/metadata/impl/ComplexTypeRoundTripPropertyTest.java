package io.portmeta.metadata.impl;

import static org.assertj.core.api.Assertions.assertThat;

import io.portmeta.metadata.api.CallingConvention;
import io.portmeta.metadata.api.ElementType;
import io.portmeta.metadata.api.PortableComplexType;
import io.portmeta.metadata.api.PortableToken;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.PropertyDefaults;
import net.jqwik.api.Provide;
import net.jqwik.api.Tuple;

/** Any well-formed complex type survives formatting and parsing unchanged. */
@PropertyDefaults(tries = 500)
public class ComplexTypeRoundTripPropertyTest {
  private static final int MAX_DEPTH = 3;

  @Property
  void parseOfFormatIsIdentity(@ForAll("complexTypes") PortableComplexType type) {
    String text = ComplexTypeFormatter.format(type);
    PortableComplexType parsed = ComplexTypeParser.parse(text);
    assertThat(parsed).isEqualTo(type);
    assertThat(parsed.hashCode()).isEqualTo(type.hashCode());
    assertThat(ComplexTypeFormatter.format(parsed)).isEqualTo(text);
  }

  @Property
  void tokenNamesSurviveQuoting(@ForAll("tokenNames") String name) {
    PortableComplexType type = PortableComplexType.token(PortableToken.of(name));
    assertThat(ComplexTypeParser.parse(type.toString()).getToken().getName()).isEqualTo(name);
  }

  @Provide
  Arbitrary<PortableComplexType> complexTypes() {
    Arbitrary<PortableComplexType> typeSigs = typeSigs(MAX_DEPTH);
    return Arbitraries.oneOf(
        typeSigs,
        callingConventionSigs(typeSigs),
        tokens(),
        int32s(),
        methodSpecs(typeSigs),
        typeSigs.map(PortableComplexType::inlineType),
        tokens().map(PortableComplexType::inlineField),
        Arbitraries.oneOf(tokens(), methodSpecs(typeSigs)).map(PortableComplexType::inlineMethod));
  }

  @Provide
  Arbitrary<String> tokenNames() {
    return Arbitraries.strings()
        .withChars("abcXYZ019._:<>`/ !")
        .ofMinLength(1)
        .ofMaxLength(16);
  }

  private Arbitrary<PortableComplexType> tokens() {
    return Arbitraries.oneOf(
        Arbitraries.integers().between(0, 100_000).map(PortableToken::of),
        tokenNames().map(PortableToken::of))
        .map(PortableComplexType::token);
  }

  private static Arbitrary<PortableComplexType> int32s() {
    return Arbitraries.integers().map(PortableComplexType::int32);
  }

  private static Arbitrary<PortableComplexType> counts(int max) {
    return Arbitraries.integers().between(0, max).map(PortableComplexType::int32);
  }

  private static Arbitrary<PortableComplexType> leafTypeSigs() {
    List<ElementType> leaves =
        Arrays.stream(ElementType.values())
            .filter(t -> t.getShape() == ElementType.Shape.LEAF && t != ElementType.SENTINEL)
            .collect(Collectors.toList());
    return Arbitraries.of(leaves).map(t -> PortableComplexType.typeSig(t));
  }

  private Arbitrary<PortableComplexType> typeSigs(int depth) {
    Arbitrary<PortableComplexType> leaves =
        Arbitraries.oneOf(
            leafTypeSigs(),
            tokens().map(t -> PortableComplexType.typeSig(ElementType.CLASS, t)),
            tokens().map(t -> PortableComplexType.typeSig(ElementType.VALUE_TYPE, t)),
            counts(8).map(n -> PortableComplexType.typeSig(ElementType.VAR, n)),
            counts(8).map(n -> PortableComplexType.typeSig(ElementType.MVAR, n)));
    if (depth == 0) {
      return leaves;
    }
    Arbitrary<PortableComplexType> inner = typeSigs(depth - 1);
    return Arbitraries.frequencyOf(
        Tuple.of(4, leaves),
        Tuple.of(1, nextShape(inner, ElementType.PTR)),
        Tuple.of(1, nextShape(inner, ElementType.BY_REF)),
        Tuple.of(1, nextShape(inner, ElementType.SZ_ARRAY)),
        Tuple.of(1, nextShape(inner, ElementType.PINNED)),
        Tuple.of(1, arrays(inner)),
        Tuple.of(1, genericInsts(inner)),
        Tuple.of(1, modifiers(inner)),
        Tuple.of(
            1,
            Combinators.combine(inner, int32s())
                .as(
                    (next, size) ->
                        PortableComplexType.typeSig(ElementType.VALUE_ARRAY, next, size))),
        Tuple.of(
            1,
            Combinators.combine(int32s(), inner)
                .as((index, next) -> PortableComplexType.typeSig(ElementType.MODULE, index, next))),
        Tuple.of(
            1,
            methodSigs(inner).map(sig -> PortableComplexType.typeSig(ElementType.FN_PTR, sig))));
  }

  private static Arbitrary<PortableComplexType> nextShape(
      Arbitrary<PortableComplexType> inner, ElementType elementType) {
    return inner.map(next -> PortableComplexType.typeSig(elementType, next));
  }

  private static Arbitrary<PortableComplexType> arrays(Arbitrary<PortableComplexType> inner) {
    Arbitrary<List<Integer>> bounds = Arbitraries.integers().between(-4, 64).list().ofMaxSize(3);
    return Combinators.combine(inner, Arbitraries.integers().between(1, 4), bounds, bounds)
        .as(
            (next, rank, sizes, lowerBounds) -> {
              List<PortableComplexType> args = new ArrayList<>();
              args.add(next);
              args.add(PortableComplexType.int32(rank));
              args.add(PortableComplexType.int32(sizes.size()));
              sizes.forEach(s -> args.add(PortableComplexType.int32(s)));
              args.add(PortableComplexType.int32(lowerBounds.size()));
              lowerBounds.forEach(b -> args.add(PortableComplexType.int32(b)));
              return PortableComplexType.typeSig(ElementType.ARRAY.getCode(), args);
            });
  }

  private Arbitrary<PortableComplexType> genericInsts(Arbitrary<PortableComplexType> inner) {
    return Combinators.combine(tokens(), inner.list().ofMinSize(1).ofMaxSize(3))
        .as(
            (token, typeArgs) -> {
              List<PortableComplexType> args = new ArrayList<>();
              args.add(PortableComplexType.typeSig(ElementType.CLASS, token));
              args.add(PortableComplexType.int32(typeArgs.size()));
              args.addAll(typeArgs);
              return PortableComplexType.typeSig(ElementType.GENERIC_INST.getCode(), args);
            });
  }

  private Arbitrary<PortableComplexType> modifiers(Arbitrary<PortableComplexType> inner) {
    return Combinators.combine(
            Arbitraries.of(ElementType.CMOD_REQD, ElementType.CMOD_OPT), tokens(), inner)
        .as((modifier, token, next) -> PortableComplexType.typeSig(modifier, token, next));
  }

  private static Arbitrary<PortableComplexType> methodSigs(Arbitrary<PortableComplexType> inner) {
    Arbitrary<CallingConvention> conventions =
        Arbitraries.of(
            CallingConvention.DEFAULT,
            CallingConvention.C,
            CallingConvention.STD_CALL,
            CallingConvention.VAR_ARG,
            CallingConvention.PROPERTY);
    Arbitrary<Integer> flags =
        Arbitraries.of(
            0,
            CallingConvention.HAS_THIS,
            CallingConvention.GENERIC,
            CallingConvention.HAS_THIS | CallingConvention.EXPLICIT_THIS);
    return Combinators.combine(
            conventions,
            flags,
            Arbitraries.integers().between(0, 3),
            inner,
            inner.list().ofMaxSize(4),
            Arbitraries.integers().between(-1, 4))
        .as(
            (cc, flag, genParamCount, retType, params, sentinelAt) -> {
              List<PortableComplexType> args = new ArrayList<>();
              args.add(PortableComplexType.int32(flag));
              if ((flag & CallingConvention.GENERIC) != 0) {
                args.add(PortableComplexType.int32(genParamCount));
              }
              args.add(PortableComplexType.int32(params.size()));
              args.add(retType);
              for (int i = 0; i < params.size(); i++) {
                if (i == sentinelAt) {
                  args.add(PortableComplexType.typeSig(ElementType.SENTINEL));
                }
                args.add(params.get(i));
              }
              return PortableComplexType.callingConventionSig(cc.getCode(), args);
            });
  }

  private static Arbitrary<PortableComplexType> countedSigs(
      CallingConvention cc, Arbitrary<PortableComplexType> inner, int minSize) {
    return inner
        .list()
        .ofMinSize(minSize)
        .ofMaxSize(4)
        .map(
            items -> {
              List<PortableComplexType> args = new ArrayList<>();
              args.add(PortableComplexType.int32(0));
              args.add(PortableComplexType.int32(items.size()));
              args.addAll(items);
              return PortableComplexType.callingConventionSig(cc.getCode(), args);
            });
  }

  private static Arbitrary<PortableComplexType> callingConventionSigs(
      Arbitrary<PortableComplexType> typeSigs) {
    return Arbitraries.oneOf(
        methodSigs(typeSigs),
        typeSigs.map(
            t ->
                PortableComplexType.callingConventionSig(
                    CallingConvention.FIELD, PortableComplexType.int32(0), t)),
        countedSigs(CallingConvention.LOCAL_SIG, typeSigs, 0),
        countedSigs(CallingConvention.GENERIC_INST, typeSigs, 1));
  }

  private Arbitrary<PortableComplexType> methodSpecs(Arbitrary<PortableComplexType> typeSigs) {
    return Combinators.combine(
            tokens(), countedSigs(CallingConvention.GENERIC_INST, typeSigs, 1))
        .as(PortableComplexType::methodSpec);
  }
}
