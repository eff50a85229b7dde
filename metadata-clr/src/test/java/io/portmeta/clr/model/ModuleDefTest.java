package io.portmeta.clr.model;

import static org.junit.jupiter.api.Assertions.*;

import io.portmeta.clr.model.emit.Parameter;
import io.portmeta.clr.model.sig.CallingConventionSig.MethodSig;
import io.portmeta.clr.model.sig.TypeSig;
import io.portmeta.metadata.api.ElementType;
import java.util.List;
import org.junit.jupiter.api.Test;

class ModuleDefTest {

  @Test
  void testGlobalTypeComesFirst() {
    ModuleDef module = new ModuleDef("A.dll");
    TypeDef foo = module.addType(new TypeDef("N", "Foo"));

    assertEquals(List.of(module.getGlobalType(), foo), module.getTypes());
    assertEquals(ModuleDef.GLOBAL_TYPE_NAME, module.getGlobalType().getName());
    assertSame(foo, module.findType("N", "Foo"));
    assertNull(module.findType("", "Foo"));
  }

  @Test
  void testTypesBelongToOneOwner() {
    ModuleDef module = new ModuleDef("A.dll");
    TypeDef foo = module.addType(new TypeDef("N", "Foo"));
    TypeDef bar = foo.addNestedType(new TypeDef("", "Bar"));

    assertThrows(IllegalArgumentException.class, () -> module.addType(foo));
    assertThrows(IllegalArgumentException.class, () -> new ModuleDef("B.dll").addType(bar));
    assertThrows(IllegalArgumentException.class, () -> foo.addNestedType(bar));
    assertSame(module, bar.getModule());
  }

  @Test
  void testAllTypesListsOuterBeforeNested() {
    ModuleDef module = new ModuleDef("A.dll");
    TypeDef foo = module.addType(new TypeDef("N", "Foo"));
    TypeDef bar = foo.addNestedType(new TypeDef("", "Bar"));
    TypeDef baz = bar.addNestedType(new TypeDef("", "Baz"));
    TypeDef qux = module.addType(new TypeDef("N", "Qux"));

    assertEquals(List.of(module.getGlobalType(), foo, bar, baz, qux), module.getAllTypes());
    assertEquals("N.Foo/Bar/Baz", baz.getFullName());
    assertSame(bar, foo.findNestedType("Bar"));
  }

  @Test
  void testNestedReferencesResolveToTheirAssembly() {
    AssemblyRef corlib = new AssemblyRef("System.Runtime");
    TypeRef dictionary = new TypeRef(corlib, "System.Collections.Generic", "Dictionary`2");
    TypeRef enumerator = new TypeRef(dictionary, "", "Enumerator");

    assertEquals("System.Collections.Generic.Dictionary`2/Enumerator", enumerator.getFullName());
    assertSame(dictionary, enumerator.getDeclaringType());
    assertSame(corlib, enumerator.getDefinitionScope());
  }

  @Test
  void testAssemblyNamesParseFromDisplayNames() {
    AssemblyRef full =
        AssemblyRef.fromFullName(
            "System.Runtime, Version=8.0.0.0, Culture=neutral, PublicKeyToken=b03f5f7f11d50a3a");
    assertEquals("System.Runtime", full.getName());

    AssemblyRef simple = AssemblyRef.fromFullName("Lib");
    assertEquals("Lib", simple.getName());
    assertEquals(
        "Lib, Version=0.0.0.0, Culture=neutral, PublicKeyToken=null", simple.getFullName());

    assertThrows(
        IllegalArgumentException.class, () -> AssemblyRef.fromFullName(", Version=1.0.0.0"));
  }

  @Test
  void testInstanceMethodsHaveHiddenThisParameter() {
    TypeSig i4 = new TypeSig.CorLibTypeSig(ElementType.I4);
    MethodDef instance = new MethodDef("Add", MethodSig.createInstance(i4, i4, i4), 0x0086);
    MethodDef shared = new MethodDef("Add", MethodSig.createStatic(i4, i4, i4), 0x0096);

    assertEquals(
        List.of(
            new Parameter(0, null, true), new Parameter(1, i4, false), new Parameter(2, i4, false)),
        instance.getParameters());
    assertEquals(
        List.of(new Parameter(0, i4, false), new Parameter(1, i4, false)),
        shared.getParameters());
  }

  @Test
  void testMembersAreFoundBySignature() {
    TypeSig i4 = new TypeSig.CorLibTypeSig(ElementType.I4);
    TypeSig i8 = new TypeSig.CorLibTypeSig(ElementType.I8);
    TypeDef type = new TypeDef("N", "Calc");
    MethodDef narrow = type.addMethod(new MethodDef("Add", MethodSig.createStatic(i4, i4), 0));
    MethodDef wide = type.addMethod(new MethodDef("Add", MethodSig.createStatic(i8, i8), 0));

    assertSame(wide, type.findMethod("Add", MethodSig.createStatic(i8, i8)));
    assertSame(narrow, type.findMethod("Add"));
    assertNull(type.findMethod("Sub", MethodSig.createStatic(i4, i4)));
    assertThrows(IllegalArgumentException.class, () -> new TypeDef("N", "Other").addMethod(wide));
  }
}
