package io.portmeta.clr;

import io.portmeta.clr.model.AssemblyRef;
import io.portmeta.clr.model.Constant;
import io.portmeta.clr.model.CustomAttribute;
import io.portmeta.clr.model.EventDef;
import io.portmeta.clr.model.FieldDef;
import io.portmeta.clr.model.FieldDefOrRef;
import io.portmeta.clr.model.GenericParam;
import io.portmeta.clr.model.ImplMap;
import io.portmeta.clr.model.MemberRef;
import io.portmeta.clr.model.MethodDef;
import io.portmeta.clr.model.MethodDefOrRef;
import io.portmeta.clr.model.MethodOverride;
import io.portmeta.clr.model.MethodSpec;
import io.portmeta.clr.model.ModuleDef;
import io.portmeta.clr.model.ModuleRef;
import io.portmeta.clr.model.ParamDef;
import io.portmeta.clr.model.PropertyDef;
import io.portmeta.clr.model.ResolutionScope;
import io.portmeta.clr.model.TypeDef;
import io.portmeta.clr.model.TypeDefOrRef;
import io.portmeta.clr.model.TypeRef;
import io.portmeta.clr.model.TypeSpec;
import io.portmeta.clr.model.emit.CilBody;
import io.portmeta.clr.model.emit.ExceptionHandler;
import io.portmeta.clr.model.emit.Instruction;
import io.portmeta.clr.model.emit.Local;
import io.portmeta.clr.model.emit.OpCode;
import io.portmeta.clr.model.emit.Parameter;
import io.portmeta.clr.model.sig.CallingConventionSig;
import io.portmeta.clr.model.sig.CallingConventionSig.FieldSig;
import io.portmeta.clr.model.sig.CallingConventionSig.GenericInstMethodSig;
import io.portmeta.clr.model.sig.CallingConventionSig.LocalSig;
import io.portmeta.clr.model.sig.CallingConventionSig.MethodBaseSig;
import io.portmeta.clr.model.sig.TypeSig;
import io.portmeta.metadata.api.CallingConvention;
import io.portmeta.metadata.api.ElementType;
import io.portmeta.metadata.api.PortableClassLayout;
import io.portmeta.metadata.api.PortableComplexType;
import io.portmeta.metadata.api.PortableConstant;
import io.portmeta.metadata.api.PortableCustomAttribute;
import io.portmeta.metadata.api.PortableEvent;
import io.portmeta.metadata.api.PortableExceptionHandler;
import io.portmeta.metadata.api.PortableField;
import io.portmeta.metadata.api.PortableFieldDef;
import io.portmeta.metadata.api.PortableGenericParameter;
import io.portmeta.metadata.api.PortableImplMap;
import io.portmeta.metadata.api.PortableInstruction;
import io.portmeta.metadata.api.PortableMetadata;
import io.portmeta.metadata.api.PortableMetadataLevel;
import io.portmeta.metadata.api.PortableMetadataOptions;
import io.portmeta.metadata.api.PortableMetadataUpdater;
import io.portmeta.metadata.api.PortableMetadataUpdater.UpdateResult;
import io.portmeta.metadata.api.PortableMethod;
import io.portmeta.metadata.api.PortableMethodBody;
import io.portmeta.metadata.api.PortableMethodDef;
import io.portmeta.metadata.api.PortableOperand;
import io.portmeta.metadata.api.PortableParameter;
import io.portmeta.metadata.api.PortableProperty;
import io.portmeta.metadata.api.PortableToken;
import io.portmeta.metadata.api.PortableType;
import io.portmeta.metadata.api.PortableTypeDef;
import io.portmeta.metadata.api.UnsupportedMetadataException;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Projects entities of a {@link ModuleDef} into a fresh {@link PortableMetadata}.
 *
 * <p>Every entity is first registered as a reference, then upgraded to the requested level.
 * Anything an entity points at (base types, signatures, instruction operands) is registered as a
 * reference only, so exporting one method pulls in just what is needed to rebind it elsewhere.
 * Not thread-safe.
 */
public final class PortableMetadataReader {
  private static final Logger log = LoggerFactory.getLogger(PortableMetadataReader.class);

  private final ModuleDef module;
  private final PortableMetadata metadata;
  private final PortableMetadataUpdater updater;

  public PortableMetadataReader(ModuleDef module) {
    this(module, PortableMetadataOptions.DEFAULT);
  }

  public PortableMetadataReader(ModuleDef module, Set<PortableMetadataOptions> options) {
    this.module = Objects.requireNonNull(module, "module");
    this.metadata = new PortableMetadata(options);
    this.updater = new PortableMetadataUpdater(metadata);
  }

  public ModuleDef getModule() {
    return module;
  }

  public PortableMetadata getMetadata() {
    return metadata;
  }

  private boolean useAssemblyFullName() {
    return metadata.hasOption(PortableMetadataOptions.USE_ASSEMBLY_FULL_NAME);
  }

  private boolean includeMethodBodies() {
    return metadata.hasOption(PortableMetadataOptions.INCLUDE_METHOD_BODIES);
  }

  private boolean includeCustomAttributes() {
    return metadata.hasOption(PortableMetadataOptions.INCLUDE_CUSTOM_ATTRIBUTES);
  }

  /**
   * Adds a type defined in the module.
   *
   * @return the type token
   * @throws IllegalArgumentException if the type belongs to another module
   */
  public PortableToken addType(TypeDef type, PortableMetadataLevel level) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(level, "level");
    if (type.getModule() != module) {
      throw new IllegalArgumentException("Type " + type + " is not in module " + module);
    }

    // reference
    List<String> enclosingNames = type.getDeclaringType() != null ? new ArrayList<>() : null;
    TypeDef outermost = type;
    while (outermost.getDeclaringType() != null) {
      outermost = outermost.getDeclaringType();
      enclosingNames.add(outermost.getName());
    }
    String namespace = outermost.getNamespace();
    UpdateResult result =
        updater.update(
            new PortableType(type.getName(), namespace, null, enclosingNames),
            PortableMetadataLevel.REFERENCE);
    PortableToken token = result.token();
    PortableMetadataLevel oldLevel = result.level();
    if (oldLevel.isAtLeast(level)) {
      return token;
    }

    // definition
    if (!oldLevel.isAtLeast(PortableMetadataLevel.DEFINITION)) {
      PortableComplexType baseType =
          type.getBaseType() != null ? addType(type.getBaseType()) : null;
      PortableTypeDef typeDef =
          new PortableTypeDef(
              type.getName(),
              namespace,
              null,
              enclosingNames,
              type.getAttributes(),
              baseType,
              addInterfaces(type.getInterfaces()),
              type.getClassLayout() != null
                  ? new PortableClassLayout(
                      type.getClassLayout().packingSize(), type.getClassLayout().classSize())
                  : null,
              addGenericParameters(type.getGenericParameters()),
              addCustomAttributes(type.getCustomAttributes()));
      updater.update(typeDef, PortableMetadataLevel.DEFINITION);
      log.debug("Read type definition {} as {}", type, token);
    }
    if (level == PortableMetadataLevel.DEFINITION) {
      return token;
    }

    // children
    PortableTypeDef typeDef = (PortableTypeDef) metadata.getTypes().get(token);
    typeDef.setNestedTypes(addTypes(type.getNestedTypes(), level));
    typeDef.setFields(addFields(type.getFields(), PortableMetadataLevel.DEFINITION));
    typeDef.setMethods(addMethods(type.getMethods(), PortableMetadataLevel.DEFINITION));
    typeDef.setProperties(addProperties(type.getProperties()));
    typeDef.setEvents(addEvents(type.getEvents()));
    updater.update(typeDef, PortableMetadataLevel.DEFINITION_WITH_CHILDREN);
    return token;
  }

  /** Adds the signature of a type specification; the {@link TypeSpec} itself gets no token. */
  public PortableComplexType addTypeSpec(TypeSpec type) {
    Objects.requireNonNull(type, "type");
    return addTypeSig(type.getTypeSig());
  }

  /**
   * Adds a field defined in the module.
   *
   * @throws IllegalArgumentException if the field belongs to another module, or {@code level} is
   *     {@code DEFINITION_WITH_CHILDREN}
   */
  public PortableToken addField(FieldDef field, PortableMetadataLevel level) {
    Objects.requireNonNull(field, "field");
    checkMemberLevel(level);
    if (field.getModule() != module) {
      throw new IllegalArgumentException("Field " + field + " is not in module " + module);
    }

    PortableComplexType type = addType(field.getDeclaringType());
    PortableComplexType signature = addCallingConventionSig(field.getSignature());
    UpdateResult result =
        updater.update(
            new PortableField(field.getName(), type, signature), PortableMetadataLevel.REFERENCE);
    if (level == PortableMetadataLevel.REFERENCE
        || result.level().isAtLeast(PortableMetadataLevel.DEFINITION)) {
      return result.token();
    }

    PortableFieldDef fieldDef =
        new PortableFieldDef(
            field.getName(),
            type,
            signature,
            field.getAttributes(),
            field.getInitialValue(),
            addConstant(field.getConstant()),
            addCustomAttributes(field.getCustomAttributes()));
    updater.update(fieldDef, PortableMetadataLevel.DEFINITION);
    return result.token();
  }

  /**
   * Adds a method defined in the module. The body is included only with {@link
   * PortableMetadataOptions#INCLUDE_METHOD_BODIES}.
   *
   * @throws IllegalArgumentException if the method belongs to another module, or {@code level}
   *     is {@code DEFINITION_WITH_CHILDREN}
   */
  public PortableToken addMethod(MethodDef method, PortableMetadataLevel level) {
    Objects.requireNonNull(method, "method");
    checkMemberLevel(level);
    if (method.getModule() != module) {
      throw new IllegalArgumentException("Method " + method + " is not in module " + module);
    }

    PortableComplexType type = addType(method.getDeclaringType());
    PortableComplexType signature = addCallingConventionSig(method.getSignature());
    UpdateResult result =
        updater.update(
            new PortableMethod(method.getName(), type, signature), PortableMetadataLevel.REFERENCE);
    if (level == PortableMetadataLevel.REFERENCE
        || result.level().isAtLeast(PortableMetadataLevel.DEFINITION)) {
      return result.token();
    }

    PortableMethodDef methodDef =
        new PortableMethodDef(
            method.getName(),
            type,
            signature,
            method.getAttributes(),
            method.getImplAttributes(),
            addParameters(method.getParamDefs()),
            includeMethodBodies() ? addMethodBody(method.getBody()) : null,
            addMethodOverrides(method.getOverrides()),
            addImplMap(method.getImplMap()),
            addGenericParameters(method.getGenericParameters()),
            addCustomAttributes(method.getCustomAttributes()));
    updater.update(methodDef, PortableMetadataLevel.DEFINITION);
    log.debug("Read method definition {} as {}", method, result.token());
    return result.token();
  }

  public List<PortableToken> addTypes(List<TypeDef> types, PortableMetadataLevel level) {
    Objects.requireNonNull(types, "types");
    List<PortableToken> tokens = new ArrayList<>(types.size());
    for (TypeDef type : types) {
      tokens.add(addType(type, level));
    }
    return tokens;
  }

  public List<PortableToken> addFields(List<FieldDef> fields, PortableMetadataLevel level) {
    Objects.requireNonNull(fields, "fields");
    List<PortableToken> tokens = new ArrayList<>(fields.size());
    for (FieldDef field : fields) {
      tokens.add(addField(field, level));
    }
    return tokens;
  }

  public List<PortableToken> addMethods(List<MethodDef> methods, PortableMetadataLevel level) {
    Objects.requireNonNull(methods, "methods");
    List<PortableToken> tokens = new ArrayList<>(methods.size());
    for (MethodDef method : methods) {
      tokens.add(addMethod(method, level));
    }
    return tokens;
  }

  private static void checkMemberLevel(PortableMetadataLevel level) {
    Objects.requireNonNull(level, "level");
    if (level == PortableMetadataLevel.DEFINITION_WITH_CHILDREN) {
      throw new IllegalArgumentException("Members have no children level: " + level);
    }
  }

  // references

  private PortableToken addTypeRef(TypeRef type) {
    ResolutionScope scope = type.getDefinitionScope();
    if (scope instanceof ModuleRef) {
      throw new UnsupportedMetadataException(
          "References to types of another module are not supported", type.getFullName());
    }
    AssemblyRef assembly = (AssemblyRef) scope;
    List<String> enclosingNames = type.getDeclaringType() != null ? new ArrayList<>() : null;
    TypeRef outermost = type;
    while (outermost.getDeclaringType() != null) {
      outermost = outermost.getDeclaringType();
      enclosingNames.add(outermost.getName());
    }
    PortableType typeRef =
        new PortableType(
            type.getName(),
            outermost.getNamespace(),
            useAssemblyFullName() ? assembly.getFullName() : assembly.getName(),
            enclosingNames);
    return updater.update(typeRef, PortableMetadataLevel.REFERENCE).token();
  }

  private PortableComplexType addType(TypeDefOrRef type) {
    return addType(type, true);
  }

  private PortableComplexType addType(TypeDefOrRef type, boolean allowTypeSpec) {
    Objects.requireNonNull(type, "type");
    if (type instanceof TypeDef) {
      return PortableComplexType.token(addType((TypeDef) type, PortableMetadataLevel.REFERENCE));
    } else if (type instanceof TypeRef) {
      return PortableComplexType.token(addTypeRef((TypeRef) type));
    } else if (allowTypeSpec && type instanceof TypeSpec) {
      return addTypeSpec((TypeSpec) type);
    }
    throw new UnsupportedMetadataException(
        "Type " + type.getFullName() + " cannot be used here", type.getClass().getSimpleName());
  }

  private PortableToken addFieldRef(MemberRef field) {
    if (!field.isFieldRef()) {
      throw new IllegalArgumentException("Member reference is not a field reference: " + field);
    }
    if (field.getParent() instanceof ModuleRef) {
      throw new UnsupportedMetadataException(
          "References to members of another module's global type are not supported",
          field.toString());
    }
    PortableComplexType type = addType(field.getDeclaringType());
    PortableComplexType signature = addCallingConventionSig(field.getSignature());
    return updater
        .update(
            new PortableField(field.getName(), type, signature),
            PortableMetadataLevel.REFERENCE)
        .token();
  }

  private PortableToken addField(FieldDefOrRef field) {
    if (field instanceof FieldDef) {
      return addField((FieldDef) field, PortableMetadataLevel.REFERENCE);
    }
    return addFieldRef((MemberRef) field);
  }

  private PortableToken addMethodRef(MemberRef method) {
    if (!method.isMethodRef()) {
      throw new IllegalArgumentException("Member reference is not a method reference: " + method);
    }
    if (method.getParent() instanceof MethodDef) {
      throw new UnsupportedMetadataException(
          "Vararg method references are not supported", method.toString());
    }
    if (method.getParent() instanceof ModuleRef) {
      throw new UnsupportedMetadataException(
          "References to members of another module's global type are not supported",
          method.toString());
    }
    PortableComplexType type = addType(method.getDeclaringType());
    PortableComplexType signature = addCallingConventionSig(method.getSignature());
    return updater
        .update(
            new PortableMethod(method.getName(), type, signature), PortableMetadataLevel.REFERENCE)
        .token();
  }

  private PortableToken addMethod(MethodDefOrRef method) {
    Objects.requireNonNull(method, "method");
    if (method instanceof MethodDef) {
      return addMethod((MethodDef) method, PortableMetadataLevel.REFERENCE);
    }
    return addMethodRef((MemberRef) method);
  }

  // attached data

  private List<PortableCustomAttribute> addCustomAttributes(
      List<CustomAttribute> customAttributes) {
    if (!includeCustomAttributes() || customAttributes.isEmpty()) {
      return null;
    }
    List<PortableCustomAttribute> list = new ArrayList<>(customAttributes.size());
    for (CustomAttribute ca : customAttributes) {
      list.add(new PortableCustomAttribute(addMethod(ca.getConstructor()), ca.getBlob()));
    }
    return list;
  }

  private List<PortableGenericParameter> addGenericParameters(
      List<GenericParam> genericParameters) {
    if (genericParameters.isEmpty()) {
      return null;
    }
    List<PortableGenericParameter> list = new ArrayList<>(genericParameters.size());
    for (GenericParam gp : genericParameters) {
      List<PortableComplexType> constraints = null;
      if (!gp.getConstraints().isEmpty()) {
        constraints = new ArrayList<>(gp.getConstraints().size());
        for (TypeDefOrRef constraint : gp.getConstraints()) {
          constraints.add(addType(constraint));
        }
      }
      list.add(
          new PortableGenericParameter(
              gp.getName(), gp.getAttributes(), gp.getNumber(), constraints));
    }
    return list;
  }

  private static PortableConstant addConstant(Constant constant) {
    return constant != null ? PortableConstant.of(constant.type(), constant.value()) : null;
  }

  private List<PortableComplexType> addInterfaces(List<TypeDefOrRef> interfaces) {
    if (interfaces.isEmpty()) {
      return null;
    }
    List<PortableComplexType> list = new ArrayList<>(interfaces.size());
    for (TypeDefOrRef i : interfaces) {
      list.add(addType(i));
    }
    return list;
  }

  private List<PortableParameter> addParameters(List<ParamDef> parameters) {
    List<PortableParameter> list = new ArrayList<>(parameters.size());
    for (ParamDef p : parameters) {
      list.add(
          new PortableParameter(
              p.getName(),
              p.getSequence(),
              p.getAttributes(),
              addConstant(p.getConstant()),
              addCustomAttributes(p.getCustomAttributes())));
    }
    return list;
  }

  private List<PortableToken> addMethodOverrides(List<MethodOverride> overrides) {
    if (overrides.isEmpty()) {
      return null;
    }
    List<PortableToken> list = new ArrayList<>(overrides.size());
    for (MethodOverride o : overrides) {
      list.add(addMethod(o.methodDeclaration()));
    }
    return list;
  }

  private static PortableImplMap addImplMap(ImplMap implMap) {
    if (implMap == null) {
      return null;
    }
    return new PortableImplMap(implMap.name(), implMap.module().getName(), implMap.attributes());
  }

  private List<PortableProperty> addProperties(List<PropertyDef> properties) {
    List<PortableProperty> list = new ArrayList<>(properties.size());
    for (PropertyDef p : properties) {
      list.add(
          new PortableProperty(
              p.getName(),
              addCallingConventionSig(p.getSignature()),
              p.getAttributes(),
              p.getGetMethod() != null ? addMethod(p.getGetMethod()) : null,
              p.getSetMethod() != null ? addMethod(p.getSetMethod()) : null,
              addCustomAttributes(p.getCustomAttributes())));
    }
    return list;
  }

  private List<PortableEvent> addEvents(List<EventDef> events) {
    List<PortableEvent> list = new ArrayList<>(events.size());
    for (EventDef e : events) {
      list.add(
          new PortableEvent(
              e.getName(),
              addType(e.getEventType()),
              e.getAttributes(),
              e.getAddMethod() != null ? addMethod(e.getAddMethod()) : null,
              e.getRemoveMethod() != null ? addMethod(e.getRemoveMethod()) : null,
              e.getInvokeMethod() != null ? addMethod(e.getInvokeMethod()) : null,
              addCustomAttributes(e.getCustomAttributes())));
    }
    return list;
  }

  // method body

  private PortableMethodBody addMethodBody(CilBody body) {
    if (body == null) {
      return null;
    }
    Map<Instruction, Integer> indexes = new IdentityHashMap<>();
    for (Instruction instr : body.getInstructions()) {
      indexes.put(instr, indexes.size());
    }

    List<PortableInstruction> instructions = new ArrayList<>(body.getInstructions().size());
    for (Instruction instr : body.getInstructions()) {
      instructions.add(
          new PortableInstruction(instr.getOpCode().getName(), addOperand(instr, indexes)));
    }

    List<PortableExceptionHandler> exceptionHandlers =
        new ArrayList<>(body.getExceptionHandlers().size());
    for (ExceptionHandler eh : body.getExceptionHandlers()) {
      exceptionHandlers.add(
          new PortableExceptionHandler(
              indexOf(indexes, eh.tryStart()),
              indexOf(indexes, eh.tryEnd()),
              indexOf(indexes, eh.filterStart()),
              indexOf(indexes, eh.handlerStart()),
              indexOf(indexes, eh.handlerEnd()),
              eh.catchType() != null ? addType(eh.catchType()) : null,
              eh.handlerType()));
    }

    List<PortableComplexType> variables = new ArrayList<>(body.getVariables().size());
    for (Local local : body.getVariables()) {
      variables.add(addTypeSig(local.type()));
    }
    return new PortableMethodBody(
        instructions, exceptionHandlers, variables, body.getMaxStack(), body.isInitLocals());
  }

  private static int indexOf(Map<Instruction, Integer> indexes, Instruction instruction) {
    if (instruction == null) {
      return -1;
    }
    Integer index = indexes.get(instruction);
    if (index == null) {
      throw new IllegalStateException("Instruction " + instruction + " is not part of the body");
    }
    return index;
  }

  private PortableOperand addOperand(Instruction instr, Map<Instruction, Integer> indexes) {
    Object operand = instr.getOperand();
    switch (instr.getOpCode().getOperandType()) {
      case INLINE_BR_TARGET:
      case SHORT_INLINE_BR_TARGET:
        return PortableOperand.of(indexOf(indexes, (Instruction) operand));

      case INLINE_FIELD:
      case INLINE_METHOD:
      case INLINE_SIG:
      case INLINE_TOK:
      case INLINE_TYPE:
        return PortableOperand.of(addToken(operand));

      case INLINE_NONE:
      case INLINE_PHI:
        return null;

      case INLINE_I:
        return PortableOperand.of((int) (Integer) operand);

      case INLINE_I8:
        return PortableOperand.of((long) (Long) operand);

      case INLINE_R:
        return PortableOperand.of((double) (Double) operand);

      case SHORT_INLINE_R:
        return PortableOperand.of((float) (Float) operand);

      case INLINE_STRING:
        return PortableOperand.of((String) operand);

      case INLINE_SWITCH:
        {
          @SuppressWarnings("unchecked")
          List<Instruction> targets = (List<Instruction>) operand;
          int[] newTargets = new int[targets.size()];
          for (int i = 0; i < newTargets.length; i++) {
            newTargets[i] = indexOf(indexes, targets.get(i));
          }
          return PortableOperand.of(newTargets);
        }

      case INLINE_VAR:
      case SHORT_INLINE_VAR:
        if (operand instanceof Parameter) {
          return PortableOperand.of(((Parameter) operand).index());
        }
        return PortableOperand.of(((Local) operand).index());

      case SHORT_INLINE_I:
        {
          byte b = (Byte) operand;
          return PortableOperand.of(instr.getOpCode() == OpCode.LDC_I4_S ? b : b & 0xFF);
        }

      default:
        throw new UnsupportedMetadataException(
            "Unsupported operand type " + instr.getOpCode().getOperandType(), instr.toString());
    }
  }

  private PortableComplexType addToken(Object operand) {
    if (operand instanceof CallingConventionSig) {
      return addCallingConventionSig((CallingConventionSig) operand);
    }
    if (operand instanceof TypeDefOrRef) {
      return PortableComplexType.inlineType(addType((TypeDefOrRef) operand));
    }
    if (operand instanceof FieldDef
        || (operand instanceof MemberRef && ((MemberRef) operand).isFieldRef())) {
      return PortableComplexType.inlineField(
          PortableComplexType.token(addField((FieldDefOrRef) operand)));
    }
    if (operand instanceof MethodDefOrRef) {
      return PortableComplexType.inlineMethod(
          PortableComplexType.token(addMethod((MethodDefOrRef) operand)));
    }
    if (operand instanceof MethodSpec) {
      MethodSpec spec = (MethodSpec) operand;
      return PortableComplexType.inlineMethod(
          PortableComplexType.methodSpec(
              PortableComplexType.token(addMethod(spec.method())),
              addCallingConventionSig(spec.instantiation())));
    }
    throw new UnsupportedMetadataException(
        "Unsupported token operand " + operand,
        operand != null ? operand.getClass().getSimpleName() : null);
  }

  // signatures

  private PortableComplexType addTypeSig(TypeSig typeSig) {
    ElementType elementType = typeSig.elementType();
    if (typeSig instanceof TypeSig.CorLibTypeSig || typeSig instanceof TypeSig.SentinelSig) {
      return PortableComplexType.typeSig(elementType);
    }
    if (typeSig instanceof TypeSig.PtrSig) {
      return PortableComplexType.typeSig(
          elementType, addTypeSig(((TypeSig.PtrSig) typeSig).next()));
    }
    if (typeSig instanceof TypeSig.ByRefSig) {
      return PortableComplexType.typeSig(
          elementType, addTypeSig(((TypeSig.ByRefSig) typeSig).next()));
    }
    if (typeSig instanceof TypeSig.SZArraySig) {
      return PortableComplexType.typeSig(
          elementType, addTypeSig(((TypeSig.SZArraySig) typeSig).next()));
    }
    if (typeSig instanceof TypeSig.PinnedSig) {
      return PortableComplexType.typeSig(
          elementType, addTypeSig(((TypeSig.PinnedSig) typeSig).next()));
    }
    if (typeSig instanceof TypeSig.FnPtrSig) {
      return PortableComplexType.typeSig(
          elementType, addCallingConventionSig(((TypeSig.FnPtrSig) typeSig).signature()));
    }
    if (typeSig instanceof TypeSig.ClassSig) {
      return PortableComplexType.typeSig(
          elementType, addType(((TypeSig.ClassSig) typeSig).type(), false));
    }
    if (typeSig instanceof TypeSig.ValueTypeSig) {
      return PortableComplexType.typeSig(
          elementType, addType(((TypeSig.ValueTypeSig) typeSig).type(), false));
    }
    if (typeSig instanceof TypeSig.GenericVar) {
      return PortableComplexType.typeSig(
          elementType, PortableComplexType.int32(((TypeSig.GenericVar) typeSig).number()));
    }
    if (typeSig instanceof TypeSig.GenericMVar) {
      return PortableComplexType.typeSig(
          elementType, PortableComplexType.int32(((TypeSig.GenericMVar) typeSig).number()));
    }
    if (typeSig instanceof TypeSig.ArraySig) {
      // Array(next, rank, numSizes, sizes.., numLowerBounds, lowerBounds..)
      TypeSig.ArraySig arraySig = (TypeSig.ArraySig) typeSig;
      List<PortableComplexType> arguments = new ArrayList<>();
      arguments.add(addTypeSig(arraySig.next()));
      arguments.add(PortableComplexType.int32(arraySig.rank()));
      arguments.add(PortableComplexType.int32(arraySig.sizes().size()));
      for (int size : arraySig.sizes()) {
        arguments.add(PortableComplexType.int32(size));
      }
      arguments.add(PortableComplexType.int32(arraySig.lowerBounds().size()));
      for (int lowerBound : arraySig.lowerBounds()) {
        arguments.add(PortableComplexType.int32(lowerBound));
      }
      return PortableComplexType.typeSig(elementType.getCode(), arguments);
    }
    if (typeSig instanceof TypeSig.GenericInstSig) {
      // GenericInst(genericType, numArgs, args..)
      TypeSig.GenericInstSig instSig = (TypeSig.GenericInstSig) typeSig;
      List<PortableComplexType> arguments = new ArrayList<>();
      arguments.add(addTypeSig(instSig.genericType()));
      arguments.add(PortableComplexType.int32(instSig.genericArguments().size()));
      for (TypeSig arg : instSig.genericArguments()) {
        arguments.add(addTypeSig(arg));
      }
      return PortableComplexType.typeSig(elementType.getCode(), arguments);
    }
    if (typeSig instanceof TypeSig.ValueArraySig) {
      TypeSig.ValueArraySig valueArraySig = (TypeSig.ValueArraySig) typeSig;
      return PortableComplexType.typeSig(
          elementType,
          addTypeSig(valueArraySig.next()),
          PortableComplexType.int32(valueArraySig.size()));
    }
    if (typeSig instanceof TypeSig.CModReqdSig) {
      TypeSig.CModReqdSig modSig = (TypeSig.CModReqdSig) typeSig;
      return PortableComplexType.typeSig(
          elementType, addType(modSig.modifier()), addTypeSig(modSig.next()));
    }
    if (typeSig instanceof TypeSig.CModOptSig) {
      TypeSig.CModOptSig modSig = (TypeSig.CModOptSig) typeSig;
      return PortableComplexType.typeSig(
          elementType, addType(modSig.modifier()), addTypeSig(modSig.next()));
    }
    if (typeSig instanceof TypeSig.ModuleSig) {
      TypeSig.ModuleSig moduleSig = (TypeSig.ModuleSig) typeSig;
      return PortableComplexType.typeSig(
          elementType, PortableComplexType.int32(moduleSig.index()), addTypeSig(moduleSig.next()));
    }
    throw new IllegalStateException("Unhandled type signature " + typeSig);
  }

  private PortableComplexType addCallingConventionSig(CallingConventionSig sig) {
    CallingConvention callingConvention = sig.kind();
    List<PortableComplexType> arguments = new ArrayList<>();
    arguments.add(PortableComplexType.int32(sig.flags()));
    switch (callingConvention.getShape()) {
      case METHOD:
        {
          // cc(flags, [numGPs], numParams, retType, params.., [Sentinel, varargs..])
          MethodBaseSig methodSig = (MethodBaseSig) sig;
          if (methodSig.isGeneric()) {
            arguments.add(PortableComplexType.int32(methodSig.genParamCount()));
          }
          arguments.add(
              PortableComplexType.int32(
                  methodSig.params().size() + methodSig.paramsAfterSentinel().size()));
          arguments.add(addTypeSig(methodSig.retType()));
          for (TypeSig param : methodSig.params()) {
            arguments.add(addTypeSig(param));
          }
          if (!methodSig.paramsAfterSentinel().isEmpty()) {
            arguments.add(PortableComplexType.typeSig(ElementType.SENTINEL));
            for (TypeSig param : methodSig.paramsAfterSentinel()) {
              arguments.add(addTypeSig(param));
            }
          }
          break;
        }
      case FIELD:
        arguments.add(addTypeSig(((FieldSig) sig).type()));
        break;
      case LOCAL_SIG:
        {
          List<TypeSig> locals = ((LocalSig) sig).locals();
          arguments.add(PortableComplexType.int32(locals.size()));
          for (TypeSig local : locals) {
            arguments.add(addTypeSig(local));
          }
          break;
        }
      case GENERIC_INST:
        {
          List<TypeSig> genericArguments = ((GenericInstMethodSig) sig).genericArguments();
          arguments.add(PortableComplexType.int32(genericArguments.size()));
          for (TypeSig arg : genericArguments) {
            arguments.add(addTypeSig(arg));
          }
          break;
        }
      default:
        throw new IllegalStateException("Unhandled calling convention " + callingConvention);
    }
    return PortableComplexType.callingConventionSig(callingConvention.getCode(), arguments);
  }
}
