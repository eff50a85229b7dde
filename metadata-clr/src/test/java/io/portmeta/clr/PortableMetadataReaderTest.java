package io.portmeta.clr;

import static io.portmeta.clr.SampleModule.corLib;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.portmeta.clr.model.MemberRef;
import io.portmeta.clr.model.MethodDef;
import io.portmeta.clr.model.ModuleDef;
import io.portmeta.clr.model.ModuleRef;
import io.portmeta.clr.model.TypeDef;
import io.portmeta.clr.model.TypeRef;
import io.portmeta.clr.model.emit.CilBody;
import io.portmeta.clr.model.emit.Instruction;
import io.portmeta.clr.model.emit.OpCode;
import io.portmeta.clr.model.sig.CallingConventionSig.MethodSig;
import io.portmeta.metadata.api.CallingConvention;
import io.portmeta.metadata.api.ElementType;
import io.portmeta.metadata.api.PortableInstruction;
import io.portmeta.metadata.api.PortableMetadata;
import io.portmeta.metadata.api.PortableMetadataLevel;
import io.portmeta.metadata.api.PortableMetadataOptions;
import io.portmeta.metadata.api.PortableMethodDef;
import io.portmeta.metadata.api.PortableOperand;
import io.portmeta.metadata.api.PortableToken;
import io.portmeta.metadata.api.PortableType;
import io.portmeta.metadata.api.PortableTypeDef;
import io.portmeta.metadata.api.UnsupportedMetadataException;
import java.util.EnumSet;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class PortableMetadataReaderTest {
  private SampleModule sample;
  private PortableMetadataReader reader;

  @BeforeEach
  void setUp() {
    sample = new SampleModule();
    reader = new PortableMetadataReader(sample.module);
  }

  @Test
  void levelsAreUpgradedInPlace() {
    PortableToken token = reader.addType(sample.program, PortableMetadataLevel.REFERENCE);
    PortableMetadata metadata = reader.getMetadata();
    assertThat(metadata.getTypes().get(token)).isNotInstanceOf(PortableTypeDef.class);
    assertThat(metadata.getTypes().size()).isEqualTo(1);

    assertThat(reader.addType(sample.program, PortableMetadataLevel.DEFINITION)).isEqualTo(token);
    PortableTypeDef definition = (PortableTypeDef) metadata.getTypes().get(token);
    assertThat(definition.getAttributes()).isEqualTo(0x100001);
    assertThat(definition.getBaseType().isToken()).isTrue();
    assertThat(definition.getNestedTypes()).isNull();
    assertThat(definition.getMethods()).isNull();

    reader.addType(sample.program, PortableMetadataLevel.DEFINITION_WITH_CHILDREN);
    assertThat(definition.getMethods()).hasSize(3);
    assertThat(definition.getFields()).hasSize(1);
    assertThat(definition.getNestedTypes()).hasSize(1);
  }

  @Test
  void referencedTypesCarryTheirAssembly() {
    PortableToken token = reader.addType(sample.program, PortableMetadataLevel.DEFINITION);
    PortableTypeDef program = (PortableTypeDef) reader.getMetadata().getTypes().get(token);
    PortableType object = reader.getMetadata().getTypes().get(program.getBaseType().getToken());

    assertThat(object.getName()).isEqualTo("Object");
    assertThat(object.getNamespace()).isEqualTo("System");
    assertThat(object.getAssembly()).isEqualTo(SampleModule.MSCORLIB);
    assertThat(program.getAssembly()).isNull();
  }

  @Test
  void simpleAssemblyNamesWithoutFullNameOption() {
    reader =
        new PortableMetadataReader(
            sample.module, EnumSet.of(PortableMetadataOptions.INCLUDE_METHOD_BODIES));
    PortableToken token = reader.addType(sample.program, PortableMetadataLevel.DEFINITION);
    PortableTypeDef program = (PortableTypeDef) reader.getMetadata().getTypes().get(token);

    assertThat(reader.getMetadata().getTypes().get(program.getBaseType().getToken()).getAssembly())
        .isEqualTo("mscorlib");
    assertThat(program.getCustomAttributes()).isNull();
  }

  @Test
  void nestedTypesListEnclosingNamesInnermostFirst() {
    TypeDef deeper = sample.inner.addNestedType(new TypeDef("", "Deeper"));
    PortableToken token = reader.addType(deeper, PortableMetadataLevel.REFERENCE);
    PortableType type = reader.getMetadata().getTypes().get(token);

    assertThat(type.getName()).isEqualTo("Deeper");
    assertThat(type.getNamespace()).isEqualTo("Demo");
    assertThat(type.getEnclosingNames()).containsExactly("Inner", "Program");
  }

  @Test
  void bodiesAreOmittedWithoutTheOption() {
    reader =
        new PortableMetadataReader(
            sample.module, EnumSet.of(PortableMetadataOptions.USE_ASSEMBLY_FULL_NAME));
    PortableToken token = reader.addMethod(sample.main, PortableMetadataLevel.DEFINITION);
    PortableMethodDef main = (PortableMethodDef) reader.getMetadata().getMethods().get(token);

    assertThat(main.getBody()).isNull();
    assertThat(main.getParameters()).hasSize(1);
    assertThat(main.getParameters().get(0).name()).isEqualTo("args");
  }

  @Test
  void bodyOperandsBecomeIndexesAndTokens() {
    PortableToken token = reader.addMethod(sample.main, PortableMetadataLevel.DEFINITION);
    PortableMethodDef main = (PortableMethodDef) reader.getMetadata().getMethods().get(token);
    List<PortableInstruction> instructions = main.getBody().instructions();

    assertThat(instructions).hasSize(16);
    assertThat(instructions.get(0).opCode()).isEqualTo("ldarg.s");
    assertThat(instructions.get(0).operand()).isEqualTo(PortableOperand.of(0));
    assertThat(instructions.get(5).operand()).isEqualTo(PortableOperand.of(-3));
    assertThat(instructions.get(12).operand()).isEqualTo(PortableOperand.of(15));
    assertThat(((PortableOperand.Switch) instructions.get(11).operand()).targets())
        .containsExactly(12, 14);
    assertThat(instructions.get(6).operand().toString()).contains("Sentinel");
    assertThat(main.getBody().exceptionHandlers().get(0).filterStart()).isEqualTo(-1);
    assertThat(main.getBody().variables()).hasSize(1);
  }

  @Test
  void typesOfAnotherModuleAreRejected() {
    ModuleDef other = new ModuleDef("Other.dll");
    TypeDef foreign = other.addType(new TypeDef("Other", "Foreign"));

    assertThatThrownBy(() -> reader.addType(foreign, PortableMetadataLevel.REFERENCE))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void membersHaveNoChildrenLevel() {
    assertThatThrownBy(
            () -> reader.addField(sample.answer, PortableMetadataLevel.DEFINITION_WITH_CHILDREN))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(
            () -> reader.addMethod(sample.main, PortableMetadataLevel.DEFINITION_WITH_CHILDREN))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void varargCallSiteReferenceIsUnsupported() {
    MethodDef varargs =
        sample.program.addMethod(
            new MethodDef(
                "Format",
                new MethodSig(
                    CallingConvention.VAR_ARG.getCode(),
                    0,
                    corLib(ElementType.VOID),
                    List.of(corLib(ElementType.STRING)),
                    null),
                0x0096));
    MemberRef callSite =
        new MemberRef(
            varargs,
            "Format",
            new MethodSig(
                CallingConvention.VAR_ARG.getCode(),
                0,
                corLib(ElementType.VOID),
                List.of(corLib(ElementType.STRING)),
                List.of(corLib(ElementType.I8))));
    MethodDef caller =
        sample.program.addMethod(
            new MethodDef("Caller", MethodSig.createStatic(corLib(ElementType.VOID)), 0x0096));
    CilBody body = new CilBody();
    body.getInstructions().add(new Instruction(OpCode.CALL, callSite));
    body.getInstructions().add(new Instruction(OpCode.RET));
    caller.setBody(body);

    assertThatThrownBy(() -> reader.addMethod(caller, PortableMetadataLevel.DEFINITION))
        .isInstanceOf(UnsupportedMetadataException.class);
  }

  @Test
  void typeReferenceIntoAnotherModuleIsUnsupported() {
    TypeDef derived = sample.module.addType(new TypeDef("Demo", "Derived"));
    derived.setBaseType(new TypeRef(new ModuleRef("Helper.netmodule"), "Demo", "Helper"));

    assertThatThrownBy(() -> reader.addType(derived, PortableMetadataLevel.DEFINITION))
        .isInstanceOf(UnsupportedMetadataException.class)
        .hasMessageContaining("another module");
  }
}
