package io.portmeta.metadata.impl;

import static org.junit.jupiter.api.Assertions.*;

import io.portmeta.metadata.api.CallingConvention;
import io.portmeta.metadata.api.ElementType;
import io.portmeta.metadata.api.InvalidMetadataDataException;
import io.portmeta.metadata.api.PortableComplexType;
import io.portmeta.metadata.api.PortableComplexTypeKind;
import io.portmeta.metadata.api.PortableToken;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ComplexTypeParserTest {

  @Test
  void testInt32() {
    PortableComplexType type = ComplexTypeParser.parse("Int32(42)");
    assertEquals(PortableComplexTypeKind.INT32, type.getKind());
    assertEquals(42, type.getInt32());
    assertNull(type.getArguments());
    assertEquals(-5, ComplexTypeParser.parse("Int32(-5)").getInt32());
  }

  @Test
  void testTokens() {
    assertEquals(
        PortableComplexType.token(PortableToken.of(12)), ComplexTypeParser.parse("12"));
    assertEquals(
        PortableComplexType.token(PortableToken.of("System.Object")),
        ComplexTypeParser.parse("'System.Object'"));
  }

  @Test
  void testNestedTypeSig() {
    PortableComplexType type = ComplexTypeParser.parse("SZArray(String)");
    assertEquals(
        PortableComplexType.typeSig(
            ElementType.SZ_ARRAY, PortableComplexType.typeSig(ElementType.STRING)),
        type);
    assertEquals(ElementType.SZ_ARRAY, type.getElementType());
    assertNull(type.getArgument(0).getArguments());
  }

  @Test
  void testClassWithNamedToken() {
    PortableComplexType type = ComplexTypeParser.parse("Class('Foo')");
    assertEquals(ElementType.CLASS, type.getElementType());
    assertEquals(PortableToken.of("Foo"), type.getArgument(0).getToken());
    assertEquals(PortableToken.of("Foo"), type.getScopeType());
  }

  @Test
  void testStaticMethodSignature() {
    PortableComplexType type = ComplexTypeParser.parse("Default(Int32(0),Int32(1),Void,String)");
    assertEquals(PortableComplexTypeKind.CALLING_CONVENTION_SIG, type.getKind());
    assertEquals(CallingConvention.DEFAULT, type.getCallingConvention());
    assertEquals(4, type.getArgumentCount());
    assertEquals(0, type.getArgument(0).getInt32());
    assertEquals(1, type.getArgument(1).getInt32());
    assertTrue(type.getArgument(2).isTypeSig(ElementType.VOID));
    assertTrue(type.getArgument(3).isTypeSig(ElementType.STRING));
  }

  @Test
  void testGenericMethodSignature() {
    // flags carry GENERIC, so a generic parameter count precedes the parameter count
    PortableComplexType type =
        ComplexTypeParser.parse(
            "Default(Int32(16),Int32(1),Int32(1),MVar(Int32(0)),MVar(Int32(0)))");
    assertEquals(5, type.getArgumentCount());
    assertEquals(
        PortableComplexType.typeSig(ElementType.MVAR, PortableComplexType.int32(0)),
        type.getArgument(3));
  }

  @Test
  void testSentinelIsNotCounted() {
    PortableComplexType type =
        ComplexTypeParser.parse("VarArg(Int32(0),Int32(2),Void,I4,Sentinel,String)");
    assertEquals(6, type.getArgumentCount());
    assertTrue(type.getArgument(4).isTypeSig(ElementType.SENTINEL));
  }

  @Test
  void testArrayWithSizesAndBounds() {
    PortableComplexType type =
        ComplexTypeParser.parse(
            "Array(I4,Int32(2),Int32(1),Int32(10),Int32(2),Int32(0),Int32(1))");
    assertEquals(7, type.getArgumentCount());
    assertEquals(1, type.getArgument(6).getInt32());
  }

  @Test
  void testGenericInstantiation() {
    PortableComplexType type =
        ComplexTypeParser.parse("GenericInst(Class(3),Int32(2),I4,Class('Bar'))");
    assertEquals(4, type.getArgumentCount());
    assertEquals(PortableToken.of("Bar"), type.getArgument(3).getArgument(0).getToken());
  }

  @Test
  void testSpecialForms() {
    PortableComplexType spec =
        ComplexTypeParser.parse(
            "InlineMethod(MethodSpec(5,GenericInstCC(Int32(0),Int32(1),String)))");
    assertEquals(PortableComplexTypeKind.INLINE_METHOD, spec.getKind());
    PortableComplexType methodSpec = spec.getArgument(0);
    assertEquals(PortableComplexTypeKind.METHOD_SPEC, methodSpec.getKind());
    assertEquals(PortableToken.of(5), methodSpec.getArgument(0).getToken());
    assertEquals(CallingConvention.GENERIC_INST, methodSpec.getArgument(1).getCallingConvention());

    assertEquals(
        PortableComplexTypeKind.INLINE_FIELD, ComplexTypeParser.parse("InlineField(1)").getKind());
    assertEquals(
        ElementType.SZ_ARRAY,
        ComplexTypeParser.parse("InlineType(SZArray(I4))").getArgument(0).getElementType());
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "Int32(42)",
        "SZArray(String)",
        "Class('Foo')",
        "Default(Int32(0),Int32(1),Void,String)",
        "Default(Int32(32),Int32(0),Void)",
        "Field(Int32(0),Ptr(U1))",
        "LocalSig(Int32(0),Int32(2),I4,Pinned(ByRef(Char)))",
        "CModReqd(7,I4)",
        "Module(Int32(1),Object)",
        "ValueArray(I8,Int32(4))",
        "FnPtr(C(Int32(0),Int32(0),Void))",
        "InlineType('T')"
      })
  void testFormatsBackToTheSameText(String text) {
    assertEquals(text, ComplexTypeFormatter.format(ComplexTypeParser.parse(text)));
  }

  @Test
  void testBlankInputIsAnArgumentError() {
    assertThrows(IllegalArgumentException.class, () -> ComplexTypeParser.parse(" "));
    assertThrows(IllegalArgumentException.class, () -> ComplexTypeParser.parse(null));
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "Foo",
        "SZArray(String",
        "SZArray(String))",
        "SZArray()",
        "SZArray(,,String)",
        "SZArray(String,)",
        "String,",
        "GenericInst(Class(0)Int32(1)String)",
        "GenericInst(Class(0),,Int32(1),String)",
        "Int32(1,2)",
        "Int32(abc)",
        "Int32",
        "Var(String)",
        "Default(Int32(0),Int32(-1),Void)",
        "Default(Int32(0),Int32(2),Void,I4)",
        "Default(Int32(0),Int32(1),Void,Sentinel,Sentinel,I4)",
        "''",
        "'a b'x",
        "99999999999"
      })
  void testRejectsMalformedInput(String text) {
    assertThrows(InvalidMetadataDataException.class, () -> ComplexTypeParser.parse(text));
  }

  @Test
  void testArgumentsNeedExactlyOneComma() {
    InvalidMetadataDataException e =
        assertThrows(
            InvalidMetadataDataException.class,
            () -> ComplexTypeParser.parse("SZArray(,,String)"));
    assertTrue(e.getMessage().contains("position 8"));
    e =
        assertThrows(
            InvalidMetadataDataException.class,
            () -> ComplexTypeParser.parse("GenericInst(Class(0)Int32(1)String)"));
    assertTrue(e.getMessage().contains("position 20: Expected ','"));
  }

  @Test
  void testErrorCarriesPositionAndInput() {
    InvalidMetadataDataException e =
        assertThrows(
            InvalidMetadataDataException.class, () -> ComplexTypeParser.parse("SZArray(Bogus)"));
    assertTrue(e.getMessage().contains("position 8"));
    assertTrue(e.getMessage().contains("Bogus"));
    assertEquals("SZArray(Bogus)", e.getContext());
  }

  @Test
  void testLenientFormattingRendersUnknownCodes() {
    PortableComplexType unknown = PortableComplexType.typeSig(0x7F, null);
    assertEquals("TypeSig<0x7F>", ComplexTypeFormatter.formatLenient(unknown));
    assertEquals("TypeSig<0x7F>", unknown.toString());
    assertThrows(InvalidMetadataDataException.class, () -> ComplexTypeFormatter.format(unknown));
  }

  @Test
  void testStrictFormattingChecksArguments() {
    // Array(String) lacks rank and bound counts, so its text would not parse back
    PortableComplexType array =
        PortableComplexType.typeSig(
            ElementType.ARRAY, PortableComplexType.typeSig(ElementType.STRING));
    PortableComplexType field =
        PortableComplexType.callingConventionSig(
            CallingConvention.FIELD, PortableComplexType.int32(0), array);

    assertEquals("Field(Int32(0),Array(String))", ComplexTypeFormatter.formatLenient(field));
    InvalidMetadataDataException e =
        assertThrows(InvalidMetadataDataException.class, () -> ComplexTypeFormatter.format(field));
    assertTrue(e.getMessage().contains("Array is missing argument 1"));
    assertEquals("Array(String)", e.getContext());

    PortableComplexType i4WithArgument =
        PortableComplexType.typeSig(ElementType.I4, PortableComplexType.int32(0));
    assertThrows(
        InvalidMetadataDataException.class, () -> ComplexTypeFormatter.format(i4WithArgument));
  }

  @Test
  void testCheckedLayoutsMatchParsedOnes() {
    PortableComplexType parsed =
        ComplexTypeParser.parse(
            "VarArg(Int32(16),Int32(1),Int32(2),Void,"
                + "Array(I4,Int32(1),Int32(0),Int32(1),Int32(-1)),Sentinel,String)");
    ComplexTypeShapes.validate(parsed);

    PortableComplexType twoSentinels =
        PortableComplexType.callingConventionSig(
            CallingConvention.VAR_ARG,
            PortableComplexType.int32(0),
            PortableComplexType.int32(1),
            PortableComplexType.typeSig(ElementType.VOID),
            PortableComplexType.typeSig(ElementType.SENTINEL),
            PortableComplexType.typeSig(ElementType.SENTINEL),
            PortableComplexType.typeSig(ElementType.I4));
    InvalidMetadataDataException e =
        assertThrows(
            InvalidMetadataDataException.class, () -> ComplexTypeShapes.validate(twoSentinels));
    assertTrue(e.getMessage().contains("Duplicate Sentinel"));

    PortableComplexType negativeCount =
        PortableComplexType.callingConventionSig(
            CallingConvention.LOCAL_SIG,
            PortableComplexType.int32(0),
            PortableComplexType.int32(-1));
    assertThrows(
        InvalidMetadataDataException.class, () -> ComplexTypeShapes.validate(negativeCount));
  }
}
