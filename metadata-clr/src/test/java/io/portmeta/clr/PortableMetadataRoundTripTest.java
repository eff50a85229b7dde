package io.portmeta.clr;

import static io.portmeta.clr.SampleModule.corLib;
import static org.assertj.core.api.Assertions.assertThat;

import io.portmeta.clr.model.AssemblyRef;
import io.portmeta.clr.model.FieldDef;
import io.portmeta.clr.model.MemberRef;
import io.portmeta.clr.model.MethodDef;
import io.portmeta.clr.model.MethodSpec;
import io.portmeta.clr.model.ModuleDef;
import io.portmeta.clr.model.TypeDef;
import io.portmeta.clr.model.TypeRef;
import io.portmeta.clr.model.emit.CilBody;
import io.portmeta.clr.model.emit.ExceptionHandler;
import io.portmeta.clr.model.emit.Instruction;
import io.portmeta.clr.model.emit.Local;
import io.portmeta.clr.model.emit.Parameter;
import io.portmeta.clr.model.sig.CallingConventionSig.MethodSig;
import io.portmeta.clr.model.sig.TypeSig;
import io.portmeta.metadata.api.ElementType;
import io.portmeta.metadata.api.PortableMetadata;
import io.portmeta.metadata.api.PortableMetadataLevel;
import io.portmeta.metadata.api.PortableMetadataOptions;
import io.portmeta.metadata.api.PortableToken;
import io.portmeta.metadata.json.PortableMetadataJson;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class PortableMetadataRoundTripTest {
  private SampleModule sample;
  private ModuleDef target;
  private TypeDef program;

  @BeforeEach
  void setUp() {
    sample = new SampleModule();
    target = new ModuleDef("Target.dll");
    program = copyProgram(PortableMetadataOptions.DEFAULT);
  }

  private TypeDef copyProgram(Set<PortableMetadataOptions> options) {
    PortableMetadataReader reader = new PortableMetadataReader(sample.module, options);
    PortableToken token =
        reader.addType(sample.program, PortableMetadataLevel.DEFINITION_WITH_CHILDREN);

    PortableMetadataJson json = PortableMetadataJson.create();
    PortableMetadata metadata = json.fromJson(json.toJson(reader.getMetadata()));

    PortableMetadataWriter writer = new PortableMetadataWriter(target, metadata);
    return writer.addType(
        metadata.getTypes().get(token), PortableMetadataLevel.DEFINITION_WITH_CHILDREN);
  }

  @Test
  void typeShapeIsRecreated() {
    assertThat(target.findType("Demo", "Program")).isSameAs(program);
    assertThat(program.getAttributes()).isEqualTo(0x100001);
    assertThat(program.getNestedTypes()).extracting(TypeDef::getFullName).containsExactly(
        "Demo.Program/Inner");
    assertThat(program.getMethods())
        .extracting(MethodDef::getName)
        .containsExactly("Identity", "get_Answer", "Main");
    assertThat(program.getProperties()).hasSize(1);
    assertThat(program.getProperties().get(0).getGetMethod())
        .isSameAs(program.findMethod("get_Answer"));
  }

  @Test
  void externalTypesBecomeReferencesToOneAssembly() {
    assertThat(target.getAssemblyRefs()).hasSize(1);
    AssemblyRef mscorlib = target.getAssemblyRefs().get(0);
    assertThat(mscorlib.getName()).isEqualTo("mscorlib");
    assertThat(mscorlib.getFullName()).isEqualTo(SampleModule.MSCORLIB);

    assertThat(program.getBaseType()).isInstanceOf(TypeRef.class);
    assertThat(((TypeRef) program.getBaseType()).getResolutionScope()).isSameAs(mscorlib);
    assertThat(target.getTypeRefs())
        .extracting(TypeRef::getFullName)
        .containsExactlyInAnyOrder(
            "System.Object", "System.ObsoleteAttribute", "System.Console", "System.Exception");
  }

  @Test
  void fieldsAndAttributesSurvive() {
    FieldDef answer = program.getFields().get(0);
    assertThat(answer.getName()).isEqualTo("Answer");
    assertThat(answer.getAttributes()).isEqualTo(0x8053);
    assertThat(answer.getSignature().type()).isEqualTo(corLib(ElementType.I4));
    assertThat(answer.getConstant().value()).isEqualTo(42);

    assertThat(program.getCustomAttributes()).hasSize(1);
    MemberRef ctor = (MemberRef) program.getCustomAttributes().get(0).getConstructor();
    assertThat(ctor.getName()).isEqualTo(".ctor");
    assertThat(ctor.getDeclaringType().getFullName()).isEqualTo("System.ObsoleteAttribute");
    assertThat(program.getCustomAttributes().get(0).getBlob()).containsExactly(1, 0, 0, 0);
  }

  @Test
  void genericMethodKeepsItsSignature() {
    MethodDef identity = program.findMethod("Identity");
    assertThat(identity.getSignature())
        .isEqualTo(
            MethodSig.createStaticGeneric(
                1, new TypeSig.GenericMVar(0), new TypeSig.GenericMVar(0)));
    assertThat(identity.getGenericParameters()).hasSize(1);
    assertThat(identity.getGenericParameters().get(0).getName()).isEqualTo("T");
  }

  @Test
  void bodyOperandsAreRebound() {
    MethodDef main = program.findMethod("Main");
    assertThat(main.getParamDefs()).hasSize(1);
    CilBody body = main.getBody();
    List<Instruction> instructions = body.getInstructions();
    assertThat(instructions).hasSize(16);
    assertThat(body.getMaxStack()).isEqualTo(4);
    assertThat(body.getVariables()).containsExactly(new Local(0, corLib(ElementType.I4)));

    assertThat(instructions.get(0).getOperand())
        .isEqualTo(new Parameter(0, new TypeSig.SZArraySig(corLib(ElementType.STRING)), false));
    assertThat(instructions.get(2).getOperand()).isEqualTo("hi");
    assertThat(instructions.get(5).getOperand()).isEqualTo((byte) -3);
    assertThat(instructions.get(9).getOperand()).isSameAs(body.getVariables().get(0));

    MemberRef writeLine = (MemberRef) instructions.get(3).getOperand();
    assertThat(writeLine.getName()).isEqualTo("WriteLine");
    assertThat(writeLine.getDeclaringType().getFullName()).isEqualTo("System.Console");

    MethodSpec spec = (MethodSpec) instructions.get(8).getOperand();
    assertThat(spec.method()).isSameAs(program.findMethod("Identity"));
    assertThat(spec.instantiation().genericArguments()).containsExactly(corLib(ElementType.I4));
  }

  @Test
  void varargCallKeepsArgumentsAfterSentinel() {
    MemberRef printf = (MemberRef) program.findMethod("Main").getBody().getInstructions().get(6)
        .getOperand();
    MethodSig sig = (MethodSig) printf.getSignature();
    assertThat(sig.params()).containsExactly(corLib(ElementType.STRING));
    assertThat(sig.paramsAfterSentinel()).containsExactly(corLib(ElementType.I4));
    assertThat(sig.callingConvention()).isEqualTo(sample.printf.getSignature().callingConvention());
  }

  @Test
  void branchesAndHandlersPointAtInstructions() {
    CilBody body = program.findMethod("Main").getBody();
    List<Instruction> instructions = body.getInstructions();
    assertThat(instructions.get(11).getOperand())
        .isEqualTo(List.of(instructions.get(12), instructions.get(14)));
    assertThat(instructions.get(12).getOperand()).isSameAs(instructions.get(15));

    assertThat(body.getExceptionHandlers()).hasSize(1);
    ExceptionHandler handler = body.getExceptionHandlers().get(0);
    assertThat(handler.handlerType()).isEqualTo(ExceptionHandler.CATCH);
    assertThat(handler.tryStart()).isSameAs(instructions.get(2));
    assertThat(handler.tryEnd()).isSameAs(instructions.get(13));
    assertThat(handler.filterStart()).isNull();
    assertThat(handler.handlerStart()).isSameAs(instructions.get(13));
    assertThat(handler.handlerEnd()).isSameAs(instructions.get(15));
    assertThat(handler.catchType().getFullName()).isEqualTo("System.Exception");
  }

  @Test
  void secondWriterReusesExistingDefinitionsAndReferences() {
    TypeDef again = copyProgram(PortableMetadataOptions.DEFAULT);
    assertThat(again).isSameAs(program);
    assertThat(target.getTypes()).extracting(TypeDef::getName).containsExactly(
        ModuleDef.GLOBAL_TYPE_NAME, "Program");
    assertThat(program.getNestedTypes()).hasSize(1);
    assertThat(program.getMethods()).hasSize(3);
    assertThat(program.getFields()).hasSize(1);
    assertThat(target.getAssemblyRefs()).hasSize(1);
    assertThat(target.getTypeRefs()).hasSize(4);
  }

  @Test
  void namedTokensWithSimpleAssemblyNames() {
    target = new ModuleDef("Named.dll");
    program =
        copyProgram(
            EnumSet.of(
                PortableMetadataOptions.USE_NAMED_TOKEN,
                PortableMetadataOptions.INCLUDE_METHOD_BODIES));

    assertThat(target.getAssemblyRefs()).extracting(AssemblyRef::getName).containsExactly(
        "mscorlib");
    assertThat(program.getCustomAttributes()).isEmpty();
    assertThat(program.findMethod("Main").getBody().getInstructions()).hasSize(16);
  }

  @Test
  void bodiesAreLeftOutWithoutTheOption() {
    target = new ModuleDef("NoBodies.dll");
    program = copyProgram(EnumSet.of(PortableMetadataOptions.USE_ASSEMBLY_FULL_NAME));

    assertThat(program.findMethod("Main").getBody()).isNull();
    assertThat(program.findMethod("Main").getSignature()).isEqualTo(sample.main.getSignature());
  }
}
