package io.portmeta.clr;

import io.portmeta.clr.model.AssemblyRef;
import io.portmeta.clr.model.Constant;
import io.portmeta.clr.model.CustomAttribute;
import io.portmeta.clr.model.FieldDef;
import io.portmeta.clr.model.GenericParam;
import io.portmeta.clr.model.MemberRef;
import io.portmeta.clr.model.MethodDef;
import io.portmeta.clr.model.MethodSpec;
import io.portmeta.clr.model.ModuleDef;
import io.portmeta.clr.model.ParamDef;
import io.portmeta.clr.model.PropertyDef;
import io.portmeta.clr.model.TypeDef;
import io.portmeta.clr.model.TypeRef;
import io.portmeta.clr.model.emit.CilBody;
import io.portmeta.clr.model.emit.ExceptionHandler;
import io.portmeta.clr.model.emit.Instruction;
import io.portmeta.clr.model.emit.Local;
import io.portmeta.clr.model.emit.OpCode;
import io.portmeta.clr.model.sig.CallingConventionSig.FieldSig;
import io.portmeta.clr.model.sig.CallingConventionSig.GenericInstMethodSig;
import io.portmeta.clr.model.sig.CallingConventionSig.MethodSig;
import io.portmeta.clr.model.sig.CallingConventionSig.PropertySig;
import io.portmeta.clr.model.sig.TypeSig;
import io.portmeta.metadata.api.CallingConvention;
import io.portmeta.metadata.api.ElementType;
import java.util.List;

/**
 * A small module with a class deriving from an external type, a nested type, a literal field, a
 * property, a generic method and an entry point whose body uses branches, a switch, a protected
 * block, a vararg call and a generic instantiation.
 */
final class SampleModule {
  static final String MSCORLIB =
      "mscorlib, Version=4.0.0.0, Culture=neutral, PublicKeyToken=b77a5c561934e089";

  final ModuleDef module = new ModuleDef("Sample.dll");
  final AssemblyRef mscorlib = module.addAssemblyRef(AssemblyRef.fromFullName(MSCORLIB));
  final TypeRef object = module.addTypeRef(new TypeRef(mscorlib, "System", "Object"));
  final TypeRef console = module.addTypeRef(new TypeRef(mscorlib, "System", "Console"));
  final TypeRef exception = module.addTypeRef(new TypeRef(mscorlib, "System", "Exception"));
  final TypeRef obsolete =
      module.addTypeRef(new TypeRef(mscorlib, "System", "ObsoleteAttribute"));

  final TypeDef program = module.addType(new TypeDef("Demo", "Program", 0x100001));
  final TypeDef inner = program.addNestedType(new TypeDef("", "Inner", 0x100002));
  final FieldDef answer;
  final MethodDef identity;
  final MethodDef getAnswer;
  final MethodDef main;
  final MemberRef writeLine;
  final MemberRef printf;
  final MemberRef obsoleteCtor;

  SampleModule() {
    TypeSig i4 = corLib(ElementType.I4);
    TypeSig string = corLib(ElementType.STRING);
    TypeSig voidType = corLib(ElementType.VOID);

    program.setBaseType(object);
    obsoleteCtor = new MemberRef(obsolete, ".ctor", MethodSig.createInstance(voidType));
    program.getCustomAttributes().add(new CustomAttribute(obsoleteCtor, new byte[] {1, 0, 0, 0}));

    answer = program.addField(new FieldDef("Answer", new FieldSig(i4), 0x8053));
    answer.setConstant(new Constant(ElementType.I4, 42));

    identity =
        program.addMethod(
            new MethodDef(
                "Identity",
                MethodSig.createStaticGeneric(
                    1, new TypeSig.GenericMVar(0), new TypeSig.GenericMVar(0)),
                0x0016));
    identity.getGenericParameters().add(new GenericParam(0, 0, "T"));
    CilBody identityBody = new CilBody();
    identityBody.getInstructions().add(new Instruction(OpCode.LDARG_0));
    identityBody.getInstructions().add(new Instruction(OpCode.RET));
    identity.setBody(identityBody);

    getAnswer =
        program.addMethod(new MethodDef("get_Answer", MethodSig.createInstance(i4), 0x0886));
    CilBody getterBody = new CilBody();
    getterBody.getInstructions().add(new Instruction(OpCode.LDC_I4_S, (byte) 42));
    getterBody.getInstructions().add(new Instruction(OpCode.RET));
    getAnswer.setBody(getterBody);
    PropertyDef property = new PropertyDef("Answer", PropertySig.createInstance(i4), 0);
    property.setGetMethod(getAnswer);
    program.getProperties().add(property);

    writeLine = new MemberRef(console, "WriteLine", MethodSig.createStatic(voidType, string));
    printf =
        new MemberRef(
            console,
            "Printf",
            new MethodSig(
                CallingConvention.VAR_ARG.getCode(), 0, voidType, List.of(string), List.of(i4)));

    main =
        program.addMethod(
            new MethodDef(
                "Main", MethodSig.createStatic(voidType, new TypeSig.SZArraySig(string)), 0x0096));
    main.getParamDefs().add(new ParamDef("args", 1, 0));
    main.setBody(mainBody(i4));
  }

  /**
   * Instruction layout:
   *
   * <pre>
   *  0 ldarg.s args     6 call Printf        12 leave.s 15
   *  1 pop              7 ldc.i4.s 7         13 pop
   *  2 ldstr "hi"       8 call Identity<I4>  14 leave.s 15
   *  3 call WriteLine   9 stloc.s 0          15 ret
   *  4 ldstr "%d"      10 ldloc.s 0
   *  5 ldc.i4.s -3     11 switch (12, 14)
   * </pre>
   *
   * Instructions 2 to 12 are protected by a catch of {@code System.Exception} handled at 13.
   */
  private CilBody mainBody(TypeSig i4) {
    CilBody body = new CilBody();
    body.setMaxStack(4);
    Local local = new Local(0, i4);
    body.getVariables().add(local);

    Instruction ret = new Instruction(OpCode.RET);
    Instruction leave = new Instruction(OpCode.LEAVE_S, ret);
    Instruction handlerLeave = new Instruction(OpCode.LEAVE_S, ret);
    Instruction handlerStart = new Instruction(OpCode.POP);
    List<Instruction> instructions = body.getInstructions();
    instructions.add(new Instruction(OpCode.LDARG_S, main.getParameters().get(0)));
    instructions.add(new Instruction(OpCode.POP));
    instructions.add(new Instruction(OpCode.LDSTR, "hi"));
    instructions.add(new Instruction(OpCode.CALL, writeLine));
    instructions.add(new Instruction(OpCode.LDSTR, "%d"));
    instructions.add(new Instruction(OpCode.LDC_I4_S, (byte) -3));
    instructions.add(new Instruction(OpCode.CALL, printf));
    instructions.add(new Instruction(OpCode.LDC_I4_S, (byte) 7));
    instructions.add(
        new Instruction(
            OpCode.CALL, new MethodSpec(identity, new GenericInstMethodSig(List.of(i4)))));
    instructions.add(new Instruction(OpCode.STLOC_S, local));
    instructions.add(new Instruction(OpCode.LDLOC_S, local));
    instructions.add(new Instruction(OpCode.SWITCH, List.of(leave, handlerLeave)));
    instructions.add(leave);
    instructions.add(handlerStart);
    instructions.add(handlerLeave);
    instructions.add(ret);

    body.getExceptionHandlers()
        .add(
            new ExceptionHandler(
                ExceptionHandler.CATCH,
                instructions.get(2),
                handlerStart,
                null,
                handlerStart,
                ret,
                exception));
    return body;
  }

  static TypeSig corLib(ElementType elementType) {
    return new TypeSig.CorLibTypeSig(elementType);
  }
}
