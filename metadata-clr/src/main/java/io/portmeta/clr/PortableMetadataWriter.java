package io.portmeta.clr;

import io.portmeta.clr.model.AssemblyRef;
import io.portmeta.clr.model.ClassLayout;
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
import io.portmeta.clr.model.sig.CallingConventionSig.MethodSig;
import io.portmeta.clr.model.sig.CallingConventionSig.PropertySig;
import io.portmeta.clr.model.sig.TypeSig;
import io.portmeta.metadata.api.CallingConvention;
import io.portmeta.metadata.api.ElementType;
import io.portmeta.metadata.api.InvalidMetadataDataException;
import io.portmeta.metadata.api.PortableClassLayout;
import io.portmeta.metadata.api.PortableComplexType;
import io.portmeta.metadata.api.PortableComplexTypeKind;
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
import io.portmeta.metadata.api.PortableMetadataEqualityComparer;
import io.portmeta.metadata.api.PortableMetadataEqualityComparer.Equivalence;
import io.portmeta.metadata.api.PortableMetadataEqualityComparer.Key;
import io.portmeta.metadata.api.PortableMetadataLevel;
import io.portmeta.metadata.api.PortableMetadataOptions;
import io.portmeta.metadata.api.PortableMethod;
import io.portmeta.metadata.api.PortableMethodBody;
import io.portmeta.metadata.api.PortableMethodDef;
import io.portmeta.metadata.api.PortableOperand;
import io.portmeta.metadata.api.PortableParameter;
import io.portmeta.metadata.api.PortableProperty;
import io.portmeta.metadata.api.PortableToken;
import io.portmeta.metadata.api.PortableType;
import io.portmeta.metadata.api.PortableTypeDef;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Materializes entities of a {@link PortableMetadata} into a {@link ModuleDef}.
 *
 * <p>Types without an assembly are defined in the target module: existing definitions with the
 * same name are reused, missing ones are created. Types with an assembly become {@link TypeRef}s
 * scoped by an {@link AssemblyRef}. Each entity is resolved once and then upgraded level by
 * level, so adding the same entity twice never duplicates it. Not thread-safe.
 */
public final class PortableMetadataWriter {
  private static final Logger log = LoggerFactory.getLogger(PortableMetadataWriter.class);

  /** Visibility given to members created on demand before their definition is written. */
  private static final int ASSEMBLY_VISIBILITY = 0x0003;

  private static final class EntityWithLevel<T> {
    final T value;
    PortableMetadataLevel level = PortableMetadataLevel.REFERENCE;

    EntityWithLevel(T value) {
      this.value = value;
    }
  }

  private final ModuleDef module;
  private final PortableMetadata metadata;
  private final Equivalence<PortableType> typeEquivalence;
  private final Equivalence<PortableField> fieldEquivalence;
  private final Equivalence<PortableMethod> methodEquivalence;
  private final Map<Key<PortableType>, EntityWithLevel<TypeDefOrRef>> types = new HashMap<>();
  private final Map<Key<PortableField>, EntityWithLevel<FieldDefOrRef>> fields = new HashMap<>();
  private final Map<Key<PortableMethod>, EntityWithLevel<MethodDefOrRef>> methods = new HashMap<>();
  private final Map<Key<PortableType>, PortableType> originalTypes = new HashMap<>();
  private final Map<String, AssemblyRef> assemblies = new HashMap<>();

  private Function<String, AssemblyRef> assemblyResolver;
  private BiFunction<AssemblyRef, PortableType, TypeDefOrRef> typeResolver;

  public PortableMetadataWriter(ModuleDef module, PortableMetadata metadata) {
    this.module = Objects.requireNonNull(module, "module");
    this.metadata = Objects.requireNonNull(metadata, "metadata");
    PortableMetadataEqualityComparer comparer = PortableMetadataEqualityComparer.REFERENCE;
    this.typeEquivalence = comparer.types();
    this.fieldEquivalence = comparer.fields();
    this.methodEquivalence = comparer.methods();
    for (Map.Entry<PortableToken, PortableType> entry : metadata.getTypes()) {
      originalTypes.put(typeEquivalence.wrap(entry.getValue()), entry.getValue());
    }
  }

  public ModuleDef getModule() {
    return module;
  }

  public PortableMetadata getMetadata() {
    return metadata;
  }

  /**
   * Hook consulted before the module's assembly references. Receives the assembly name as stored
   * in the metadata; returning {@code null} falls back to lookup-or-create.
   */
  public void setAssemblyResolver(Function<String, AssemblyRef> assemblyResolver) {
    this.assemblyResolver = assemblyResolver;
  }

  /**
   * Hook consulted before the default type lookup. Receives the resolved assembly ({@code null}
   * for types of the target module) and the type; returning {@code null} falls back to the
   * default lookup. Types of the target module must resolve to a {@link TypeDef}.
   */
  public void setTypeResolver(BiFunction<AssemblyRef, PortableType, TypeDefOrRef> typeResolver) {
    this.typeResolver = typeResolver;
  }

  /**
   * Adds a type that is defined in the target module.
   *
   * @throws IllegalStateException if the type has an assembly, or a definition level is requested
   *     for a reference-shaped type
   */
  public TypeDef addType(PortableType type, PortableMetadataLevel level) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(level, "level");
    if (!isDefinedInModule(type)) {
      throw new IllegalStateException("Type " + type + " is not defined in module " + module);
    }
    if (!(type instanceof PortableTypeDef) && level.isAtLeast(PortableMetadataLevel.DEFINITION)) {
      throw new IllegalStateException("Type " + type + " is a reference but level is " + level);
    }

    Key<PortableType> key = typeEquivalence.wrap(type);
    TypeDef typeDef = (TypeDef) resolveType(type);
    EntityWithLevel<TypeDefOrRef> result = types.get(key);
    if (result.level.isAtLeast(level)) {
      return typeDef;
    }

    PortableTypeDef type2 = (PortableTypeDef) type;
    if (!result.level.isAtLeast(PortableMetadataLevel.DEFINITION)) {
      typeDef.setAttributes(type2.getAttributes());
      typeDef.setBaseType(type2.getBaseType() != null ? addType(type2.getBaseType()) : null);
      addCustomAttributes(type2.getCustomAttributes(), typeDef.getCustomAttributes());
      addGenericParameters(type2.getGenericParameters(), typeDef.getGenericParameters());
      addInterfaces(type2.getInterfaces(), typeDef.getInterfaces());
      typeDef.setClassLayout(addClassLayout(type2.getClassLayout()));
      result.level = PortableMetadataLevel.DEFINITION;
      log.debug("Wrote type definition {}", typeDef);
    }
    if (level == PortableMetadataLevel.DEFINITION) {
      return typeDef;
    }

    if (type2.getNestedTypes() != null) {
      for (PortableToken nestedType : type2.getNestedTypes()) {
        addType(metadata.getTypes().get(nestedType), level);
      }
    }
    if (type2.getFields() != null) {
      for (PortableToken field : type2.getFields()) {
        addField(metadata.getFields().get(field), PortableMetadataLevel.DEFINITION);
      }
    }
    if (type2.getMethods() != null) {
      for (PortableToken method : type2.getMethods()) {
        addMethod(metadata.getMethods().get(method), PortableMetadataLevel.DEFINITION);
      }
    }
    addProperties(type2.getProperties(), typeDef.getProperties());
    addEvents(type2.getEvents(), typeDef.getEvents());
    result.level = PortableMetadataLevel.DEFINITION_WITH_CHILDREN;
    return typeDef;
  }

  /**
   * Adds a field whose declaring type is defined in the target module.
   *
   * @throws IllegalArgumentException if {@code level} is {@code DEFINITION_WITH_CHILDREN}
   * @throws IllegalStateException if the declaring type is not defined in the module, or a
   *     definition level is requested for a reference-shaped field
   */
  public FieldDef addField(PortableField field, PortableMetadataLevel level) {
    Objects.requireNonNull(field, "field");
    checkMemberLevel(level);
    checkDeclaredInModule(field.getType(), field);
    if (!(field instanceof PortableFieldDef) && level.isAtLeast(PortableMetadataLevel.DEFINITION)) {
      throw new IllegalStateException("Field " + field + " is a reference but level is " + level);
    }

    FieldDef fieldDef = (FieldDef) resolveField(field);
    EntityWithLevel<FieldDefOrRef> result = fields.get(fieldEquivalence.wrap(field));
    if (result.level.isAtLeast(level)) {
      return fieldDef;
    }

    PortableFieldDef field2 = (PortableFieldDef) field;
    fieldDef.setAttributes(field2.getAttributes());
    fieldDef.setInitialValue(field2.getInitialValue());
    addCustomAttributes(field2.getCustomAttributes(), fieldDef.getCustomAttributes());
    fieldDef.setConstant(addConstant(field2.getConstant()));
    result.level = PortableMetadataLevel.DEFINITION;
    return fieldDef;
  }

  /**
   * Adds a method whose declaring type is defined in the target module. An existing body is
   * replaced when the definition carries one.
   *
   * @throws IllegalArgumentException if {@code level} is {@code DEFINITION_WITH_CHILDREN}
   * @throws IllegalStateException if the declaring type is not defined in the module, or a
   *     definition level is requested for a reference-shaped method
   */
  public MethodDef addMethod(PortableMethod method, PortableMetadataLevel level) {
    Objects.requireNonNull(method, "method");
    checkMemberLevel(level);
    checkDeclaredInModule(method.getType(), method);
    if (!(method instanceof PortableMethodDef)
        && level.isAtLeast(PortableMetadataLevel.DEFINITION)) {
      throw new IllegalStateException("Method " + method + " is a reference but level is " + level);
    }

    MethodDef methodDef = (MethodDef) resolveMethod(method);
    EntityWithLevel<MethodDefOrRef> result = methods.get(methodEquivalence.wrap(method));
    if (result.level.isAtLeast(level)) {
      return methodDef;
    }

    PortableMethodDef method2 = (PortableMethodDef) method;
    methodDef.setAttributes(method2.getAttributes());
    methodDef.setImplAttributes(method2.getImplAttributes());
    if (method2.getParameters() != null) {
      methodDef.getParamDefs().clear();
      addParameters(method2.getParameters(), methodDef.getParamDefs());
    }
    if (method2.getBody() != null) {
      methodDef.setBody(addMethodBody(method2.getBody(), methodDef.getParameters()));
    }
    addCustomAttributes(method2.getCustomAttributes(), methodDef.getCustomAttributes());
    addGenericParameters(method2.getGenericParameters(), methodDef.getGenericParameters());
    if (method2.getOverrides() != null) {
      for (PortableToken o : method2.getOverrides()) {
        methodDef.getOverrides().add(new MethodOverride(methodDef, addMethod(o)));
      }
    }
    methodDef.setImplMap(addImplMap(method2.getImplMap()));
    result.level = PortableMetadataLevel.DEFINITION;
    log.debug("Wrote method definition {}", methodDef);
    return methodDef;
  }

  public List<TypeDef> addTypes(
      Iterable<? extends PortableType> types, PortableMetadataLevel level) {
    Objects.requireNonNull(types, "types");
    List<TypeDef> list = new ArrayList<>();
    for (PortableType type : types) {
      list.add(addType(type, level));
    }
    return list;
  }

  public List<FieldDef> addFields(
      Iterable<? extends PortableField> fields, PortableMetadataLevel level) {
    Objects.requireNonNull(fields, "fields");
    List<FieldDef> list = new ArrayList<>();
    for (PortableField field : fields) {
      list.add(addField(field, level));
    }
    return list;
  }

  public List<MethodDef> addMethods(
      Iterable<? extends PortableMethod> methods, PortableMetadataLevel level) {
    Objects.requireNonNull(methods, "methods");
    List<MethodDef> list = new ArrayList<>();
    for (PortableMethod method : methods) {
      list.add(addMethod(method, level));
    }
    return list;
  }

  private static void checkMemberLevel(PortableMetadataLevel level) {
    Objects.requireNonNull(level, "level");
    if (level == PortableMetadataLevel.DEFINITION_WITH_CHILDREN) {
      throw new IllegalArgumentException("Members have no children level: " + level);
    }
  }

  private void checkDeclaredInModule(PortableComplexType declaringType, Object member) {
    if (!declaringType.isToken()
        || !isDefinedInModule(metadata.getTypes().get(declaringType.getToken()))) {
      throw new IllegalStateException(
          "Declaring type of " + member + " is not defined in module " + module);
    }
  }

  private static boolean isDefinedInModule(PortableType type) {
    return type.getAssembly() == null;
  }

  // token wrappers

  private TypeDefOrRef addType(PortableComplexType type) {
    return addType(type, true);
  }

  private TypeDefOrRef addType(PortableComplexType type, boolean allowTypeSpec) {
    if (type.isToken()) {
      return resolveType(metadata.getTypes().get(type.getToken()));
    } else if (allowTypeSpec) {
      return new TypeSpec(addTypeSig(type));
    }
    throw new InvalidMetadataDataException(
        "Expected a type token but found " + type.getKind(), type.toString());
  }

  private FieldDefOrRef addField(PortableToken field) {
    return resolveField(metadata.getFields().get(field));
  }

  private MethodDefOrRef addMethod(PortableToken method) {
    return resolveMethod(metadata.getMethods().get(method));
  }

  // resolution

  private AssemblyRef resolveAssembly(String name) {
    AssemblyRef assembly = assemblies.get(name);
    if (assembly != null) {
      return assembly;
    }

    if (assemblyResolver != null) {
      assembly = assemblyResolver.apply(name);
    }
    if (assembly == null) {
      boolean useFullName = metadata.hasOption(PortableMetadataOptions.USE_ASSEMBLY_FULL_NAME);
      for (AssemblyRef asmRef : module.getAssemblyRefs()) {
        if ((useFullName ? asmRef.getFullName() : asmRef.getName()).equals(name)) {
          assembly = asmRef;
          break;
        }
      }
      if (assembly == null) {
        assembly =
            module.addAssemblyRef(
                useFullName ? AssemblyRef.fromFullName(name) : new AssemblyRef(name));
        log.debug("Added assembly reference {}", assembly);
      }
    }
    assemblies.put(name, assembly);
    return assembly;
  }

  private TypeDefOrRef resolveType(PortableType type) {
    Key<PortableType> key = typeEquivalence.wrap(type);
    EntityWithLevel<TypeDefOrRef> existing = types.get(key);
    if (existing != null) {
      return existing.value;
    }

    if (type instanceof PortableTypeDef
        && ModuleDef.GLOBAL_TYPE_NAME.equals(type.getName())
        && type.getNamespace().isEmpty()
        && type.getAssembly() == null
        && (type.getEnclosingNames() == null || type.getEnclosingNames().isEmpty())) {
      types.put(key, new EntityWithLevel<>(module.getGlobalType()));
      return module.getGlobalType();
    }

    AssemblyRef assembly = type.getAssembly() != null ? resolveAssembly(type.getAssembly()) : null;

    boolean asTypeDef = isDefinedInModule(type);
    if (typeResolver != null) {
      TypeDefOrRef resolved = typeResolver.apply(assembly, type);
      if (resolved != null) {
        if (asTypeDef && !(resolved instanceof TypeDef)) {
          throw new IllegalStateException(
              "Type " + type + " must be resolved to a TypeDef but was " + resolved);
        }
        types.put(key, new EntityWithLevel<>(resolved));
        return resolved;
      }
    }

    TypeDefOrRef enclosingType = null;
    List<String> enclosingNames = type.getEnclosingNames();
    if (enclosingNames != null && !enclosingNames.isEmpty()) {
      PortableType enclosing =
          new PortableType(
              enclosingNames.get(0),
              type.getNamespace(),
              type.getAssembly(),
              enclosingNames.size() > 1
                  ? new ArrayList<>(enclosingNames.subList(1, enclosingNames.size()))
                  : null);
      PortableType original = originalTypes.get(typeEquivalence.wrap(enclosing));
      if (original == null) {
        throw new InvalidMetadataDataException(
            "Enclosing type of " + type + " is missing", enclosing.toString());
      }
      enclosingType = resolveType(original);
    }
    boolean nested = enclosingType != null;

    TypeDefOrRef result;
    if (asTypeDef) {
      TypeDef found;
      if (nested) {
        found = ((TypeDef) enclosingType).findNestedType(type.getName());
      } else {
        found = module.findType(type.getNamespace(), type.getName());
      }
      if (found == null) {
        found = new TypeDef(nested ? "" : type.getNamespace(), type.getName());
        if (nested) {
          ((TypeDef) enclosingType).addNestedType(found);
        } else {
          module.addType(found);
        }
        log.debug("Created type definition {}", found);
      }
      result = found;
    } else {
      ResolutionScope scope = nested ? (TypeRef) enclosingType : assembly;
      TypeRef found = null;
      for (TypeRef tr : module.getTypeRefs()) {
        if (tr.getName().equals(type.getName())
            && (nested || tr.getNamespace().equals(type.getNamespace()))
            && tr.getResolutionScope() == scope) {
          found = tr;
          break;
        }
      }
      if (found == null) {
        found =
            module.addTypeRef(
                new TypeRef(scope, nested ? "" : type.getNamespace(), type.getName()));
        log.debug("Created type reference {}", found);
      }
      result = found;
    }

    types.put(key, new EntityWithLevel<>(result));
    return result;
  }

  private FieldDefOrRef resolveField(PortableField field) {
    Key<PortableField> key = fieldEquivalence.wrap(field);
    EntityWithLevel<FieldDefOrRef> existing = fields.get(key);
    if (existing != null) {
      return existing.value;
    }

    TypeDefOrRef declaringType = addType(field.getType());
    CallingConventionSig sig = addCallingConventionSig(field.getSignature());
    if (!(sig instanceof FieldSig)) {
      throw new InvalidMetadataDataException(
          "Field signature expected for " + field.getName(), field.getSignature().toString());
    }
    FieldDefOrRef result;
    if (declaringType instanceof TypeDef) {
      TypeDef declaringTypeDef = (TypeDef) declaringType;
      FieldDef fieldDef = declaringTypeDef.findField(field.getName(), (FieldSig) sig);
      if (fieldDef == null) {
        fieldDef =
            declaringTypeDef.addField(
                new FieldDef(field.getName(), (FieldSig) sig, ASSEMBLY_VISIBILITY));
      }
      result = fieldDef;
    } else {
      result = new MemberRef(declaringType, field.getName(), sig);
    }
    fields.put(key, new EntityWithLevel<>(result));
    return result;
  }

  private MethodDefOrRef resolveMethod(PortableMethod method) {
    Key<PortableMethod> key = methodEquivalence.wrap(method);
    EntityWithLevel<MethodDefOrRef> existing = methods.get(key);
    if (existing != null) {
      return existing.value;
    }

    TypeDefOrRef declaringType = addType(method.getType());
    CallingConventionSig sig = addCallingConventionSig(method.getSignature());
    if (!(sig instanceof MethodSig)) {
      throw new InvalidMetadataDataException(
          "Method signature expected for " + method.getName(), method.getSignature().toString());
    }
    MethodDefOrRef result;
    if (declaringType instanceof TypeDef) {
      TypeDef declaringTypeDef = (TypeDef) declaringType;
      MethodDef methodDef = declaringTypeDef.findMethod(method.getName(), (MethodSig) sig);
      if (methodDef == null) {
        methodDef =
            declaringTypeDef.addMethod(
                new MethodDef(method.getName(), (MethodSig) sig, ASSEMBLY_VISIBILITY));
      }
      result = methodDef;
    } else {
      result = new MemberRef(declaringType, method.getName(), sig);
    }
    methods.put(key, new EntityWithLevel<>(result));
    return result;
  }

  // attached data

  private void addCustomAttributes(
      List<PortableCustomAttribute> source, List<CustomAttribute> destination) {
    if (source == null) {
      return;
    }
    for (PortableCustomAttribute ca : source) {
      destination.add(new CustomAttribute(addMethod(ca.constructor()), ca.rawData()));
    }
  }

  private void addGenericParameters(
      List<PortableGenericParameter> source, List<GenericParam> destination) {
    if (source == null) {
      return;
    }
    for (PortableGenericParameter gp : source) {
      GenericParam gp2 = new GenericParam(gp.number(), gp.attributes(), gp.name());
      if (gp.constraints() != null) {
        for (PortableComplexType constraint : gp.constraints()) {
          gp2.getConstraints().add(addType(constraint));
        }
      }
      destination.add(gp2);
    }
  }

  private static Constant addConstant(PortableConstant constant) {
    if (constant == null) {
      return null;
    }
    return new Constant(ElementType.require(constant.type()), constant.value());
  }

  private void addInterfaces(List<PortableComplexType> source, List<TypeDefOrRef> destination) {
    if (source == null) {
      return;
    }
    for (PortableComplexType i : source) {
      destination.add(addType(i));
    }
  }

  private static ClassLayout addClassLayout(PortableClassLayout classLayout) {
    return classLayout != null
        ? new ClassLayout(classLayout.packingSize(), classLayout.classSize())
        : null;
  }

  private void addParameters(List<PortableParameter> source, List<ParamDef> destination) {
    for (PortableParameter p : source) {
      ParamDef p2 = new ParamDef(p.name(), p.sequence(), p.attributes());
      addCustomAttributes(p.customAttributes(), p2.getCustomAttributes());
      p2.setConstant(addConstant(p.constant()));
      destination.add(p2);
    }
  }

  private ImplMap addImplMap(PortableImplMap implMap) {
    if (implMap == null) {
      return null;
    }
    ModuleRef scope = null;
    for (ModuleRef moduleRef : module.getModuleRefs()) {
      if (moduleRef.getName().equals(implMap.module())) {
        scope = moduleRef;
        break;
      }
    }
    if (scope == null) {
      scope = module.addModuleRef(new ModuleRef(implMap.module()));
    }
    return new ImplMap(scope, implMap.name(), implMap.attributes());
  }

  private void addProperties(List<PortableProperty> source, List<PropertyDef> destination) {
    if (source == null) {
      return;
    }
    for (PortableProperty p : source) {
      CallingConventionSig sig = addCallingConventionSig(p.signature());
      if (!(sig instanceof PropertySig)) {
        throw new InvalidMetadataDataException(
            "Property signature expected for " + p.name(), p.signature().toString());
      }
      PropertyDef p2 = new PropertyDef(p.name(), (PropertySig) sig, p.attributes());
      p2.setGetMethod(p.getMethod() != null ? methodDef(p.getMethod()) : null);
      p2.setSetMethod(p.setMethod() != null ? methodDef(p.setMethod()) : null);
      addCustomAttributes(p.customAttributes(), p2.getCustomAttributes());
      destination.add(p2);
    }
  }

  private void addEvents(List<PortableEvent> source, List<EventDef> destination) {
    if (source == null) {
      return;
    }
    for (PortableEvent e : source) {
      EventDef e2 = new EventDef(e.name(), addType(e.type()), e.attributes());
      e2.setAddMethod(e.addMethod() != null ? methodDef(e.addMethod()) : null);
      e2.setRemoveMethod(e.removeMethod() != null ? methodDef(e.removeMethod()) : null);
      e2.setInvokeMethod(e.invokeMethod() != null ? methodDef(e.invokeMethod()) : null);
      addCustomAttributes(e.customAttributes(), e2.getCustomAttributes());
      destination.add(e2);
    }
  }

  private MethodDef methodDef(PortableToken method) {
    MethodDefOrRef resolved = addMethod(method);
    if (!(resolved instanceof MethodDef)) {
      throw new InvalidMetadataDataException(
          "Accessor must be defined in the module", method.toString());
    }
    return (MethodDef) resolved;
  }

  // method body

  private CilBody addMethodBody(PortableMethodBody body, List<Parameter> parameters) {
    CilBody cilBody = new CilBody();
    cilBody.setMaxStack(body.maxStack());
    cilBody.setInitLocals(body.initLocals());
    List<Local> variables = cilBody.getVariables();
    for (PortableComplexType v : body.variables()) {
      variables.add(new Local(variables.size(), addTypeSig(v)));
    }

    List<Instruction> instructions = cilBody.getInstructions();
    for (PortableInstruction instr : body.instructions()) {
      OpCode opCode = OpCode.fromName(instr.opCode());
      if (opCode == null) {
        throw new InvalidMetadataDataException("Unknown opcode '" + instr.opCode() + "'");
      }
      instructions.add(new Instruction(opCode));
    }

    for (int i = 0; i < instructions.size(); i++) {
      Instruction instr = instructions.get(i);
      PortableOperand operand = body.instructions().get(i).operand();
      instr.setOperand(addOperand(instr.getOpCode(), operand, instructions, variables, parameters));
    }

    for (PortableExceptionHandler eh : body.exceptionHandlers()) {
      cilBody
          .getExceptionHandlers()
          .add(
              new ExceptionHandler(
                  eh.handlerType(),
                  instructionAt(instructions, eh.tryStart(), false),
                  instructionAt(instructions, eh.tryEnd(), true),
                  instructionAt(instructions, eh.filterStart(), true),
                  instructionAt(instructions, eh.handlerStart(), false),
                  instructionAt(instructions, eh.handlerEnd(), true),
                  eh.catchType() != null ? addType(eh.catchType()) : null));
    }
    return cilBody;
  }

  private static Instruction instructionAt(
      List<Instruction> instructions, int index, boolean optional) {
    if (index == -1 && optional) {
      return null;
    }
    if (index < 0 || index >= instructions.size()) {
      throw new InvalidMetadataDataException("Instruction index out of range: " + index);
    }
    return instructions.get(index);
  }

  private Object addOperand(
      OpCode opCode,
      PortableOperand operand,
      List<Instruction> instructions,
      List<Local> variables,
      List<Parameter> parameters) {
    switch (opCode.getOperandType()) {
      case INLINE_BR_TARGET:
      case SHORT_INLINE_BR_TARGET:
        return instructionAt(
            instructions, operand(opCode, operand, PortableOperand.Int32.class).value(), false);

      case INLINE_FIELD:
      case INLINE_METHOD:
      case INLINE_SIG:
      case INLINE_TOK:
      case INLINE_TYPE:
        return addToken(operand(opCode, operand, PortableOperand.Type.class).value());

      case INLINE_NONE:
      case INLINE_PHI:
        if (operand != null) {
          throw new InvalidMetadataDataException("Opcode " + opCode + " takes no operand");
        }
        return null;

      case INLINE_I:
        return operand(opCode, operand, PortableOperand.Int32.class).value();

      case INLINE_I8:
        return operand(opCode, operand, PortableOperand.Int64.class).value();

      case INLINE_R:
        return operand(opCode, operand, PortableOperand.Float64.class).value();

      case SHORT_INLINE_R:
        return operand(opCode, operand, PortableOperand.Float32.class).value();

      case INLINE_STRING:
        return operand(opCode, operand, PortableOperand.Str.class).value();

      case INLINE_SWITCH:
        {
          int[] targets = operand(opCode, operand, PortableOperand.Switch.class).targets();
          List<Instruction> newTargets = new ArrayList<>(targets.length);
          for (int target : targets) {
            newTargets.add(instructionAt(instructions, target, false));
          }
          return newTargets;
        }

      case INLINE_VAR:
      case SHORT_INLINE_VAR:
        {
          int index = operand(opCode, operand, PortableOperand.Int32.class).value();
          List<?> slots = opCode.isArgumentAccess() ? parameters : variables;
          if (index < 0 || index >= slots.size()) {
            throw new InvalidMetadataDataException(
                "Variable index " + index + " out of range for " + opCode);
          }
          return slots.get(index);
        }

      case SHORT_INLINE_I:
        return (byte) operand(opCode, operand, PortableOperand.Int32.class).value();

      default:
        throw new InvalidMetadataDataException("Unsupported operand type for " + opCode);
    }
  }

  private static <T extends PortableOperand> T operand(
      OpCode opCode, PortableOperand operand, Class<T> expected) {
    if (!expected.isInstance(operand)) {
      throw new InvalidMetadataDataException(
          "Opcode " + opCode + " expects a " + expected.getSimpleName() + " operand",
          String.valueOf(operand));
    }
    return expected.cast(operand);
  }

  private Object addToken(PortableComplexType type) {
    if (type.getKind() == PortableComplexTypeKind.CALLING_CONVENTION_SIG) {
      return addCallingConventionSig(type);
    }
    PortableComplexTypeKind kind = type.getKind();
    if (type.getArguments() == null) {
      throw new InvalidMetadataDataException("Token operand without argument", type.toString());
    }
    PortableComplexType inner = type.getArgument(0);
    switch (kind) {
      case INLINE_TYPE:
        return addType(inner);
      case INLINE_FIELD:
        return addField(requireToken(inner));
      case INLINE_METHOD:
        if (inner.getKind() == PortableComplexTypeKind.METHOD_SPEC) {
          CallingConventionSig instantiation = addCallingConventionSig(inner.getArgument(1));
          if (!(instantiation instanceof GenericInstMethodSig)) {
            throw new InvalidMetadataDataException(
                "Generic method instantiation expected", inner.toString());
          }
          return new MethodSpec(
              addMethod(requireToken(inner.getArgument(0))), (GenericInstMethodSig) instantiation);
        }
        return addMethod(requireToken(inner));
      default:
        throw new InvalidMetadataDataException("Not a token operand: " + kind, type.toString());
    }
  }

  private static PortableToken requireToken(PortableComplexType type) {
    if (!type.isToken()) {
      throw new InvalidMetadataDataException(
          "Expected a token but found " + type.getKind(), type.toString());
    }
    return type.getToken();
  }

  // signatures

  private TypeSig addTypeSig(PortableComplexType type) {
    if (type.getKind() != PortableComplexTypeKind.TYPE_SIG) {
      throw new InvalidMetadataDataException(
          "Expected a type signature but found " + type.getKind(), type.toString());
    }
    type.checkArguments();
    ElementType elementType = type.getElementType();
    switch (elementType) {
      case END:
      case R:
        throw new InvalidMetadataDataException(
            "Element type " + elementType.getDisplayName() + " is not supported", type.toString());
      case SENTINEL:
        return new TypeSig.SentinelSig();
      default:
        break;
    }
    if (elementType.getShape() == ElementType.Shape.LEAF) {
      return new TypeSig.CorLibTypeSig(elementType);
    }

    List<PortableComplexType> arguments = type.getArguments();
    switch (elementType) {
      case PTR:
        return new TypeSig.PtrSig(addTypeSig(arguments.get(0)));
      case BY_REF:
        return new TypeSig.ByRefSig(addTypeSig(arguments.get(0)));
      case FN_PTR:
        return new TypeSig.FnPtrSig(addCallingConventionSig(arguments.get(0)));
      case SZ_ARRAY:
        return new TypeSig.SZArraySig(addTypeSig(arguments.get(0)));
      case PINNED:
        return new TypeSig.PinnedSig(addTypeSig(arguments.get(0)));
      case VALUE_TYPE:
        return new TypeSig.ValueTypeSig(addType(arguments.get(0), false));
      case CLASS:
        return new TypeSig.ClassSig(addType(arguments.get(0), false));
      case VAR:
        return new TypeSig.GenericVar(arguments.get(0).getInt32());
      case MVAR:
        return new TypeSig.GenericMVar(arguments.get(0).getInt32());
      case ARRAY:
        {
          // Array(next, rank, numSizes, sizes.., numLowerBounds, lowerBounds..)
          TypeSig next = addTypeSig(arguments.get(0));
          int rank = arguments.get(1).getInt32();
          int numSizes = arguments.get(2).getInt32();
          List<Integer> sizes = new ArrayList<>(numSizes);
          for (int i = 0; i < numSizes; i++) {
            sizes.add(arguments.get(3 + i).getInt32());
          }
          int numLowerBounds = arguments.get(3 + numSizes).getInt32();
          List<Integer> lowerBounds = new ArrayList<>(numLowerBounds);
          for (int i = 0; i < numLowerBounds; i++) {
            lowerBounds.add(arguments.get(4 + numSizes + i).getInt32());
          }
          return new TypeSig.ArraySig(next, rank, sizes, lowerBounds);
        }
      case GENERIC_INST:
        {
          TypeSig genericType = addTypeSig(arguments.get(0));
          int num = arguments.get(1).getInt32();
          List<TypeSig> genericArguments = new ArrayList<>(num);
          for (int i = 0; i < num; i++) {
            genericArguments.add(addTypeSig(arguments.get(2 + i)));
          }
          return new TypeSig.GenericInstSig(genericType, genericArguments);
        }
      case VALUE_ARRAY:
        return new TypeSig.ValueArraySig(
            addTypeSig(arguments.get(0)), arguments.get(1).getInt32());
      case CMOD_REQD:
        return new TypeSig.CModReqdSig(addType(arguments.get(0)), addTypeSig(arguments.get(1)));
      case CMOD_OPT:
        return new TypeSig.CModOptSig(addType(arguments.get(0)), addTypeSig(arguments.get(1)));
      case MODULE:
        return new TypeSig.ModuleSig(arguments.get(0).getInt32(), addTypeSig(arguments.get(1)));
      default:
        throw new InvalidMetadataDataException(
            "Element type " + elementType.getDisplayName() + " is not supported", type.toString());
    }
  }

  private CallingConventionSig addCallingConventionSig(PortableComplexType type) {
    if (type.getKind() != PortableComplexTypeKind.CALLING_CONVENTION_SIG) {
      throw new InvalidMetadataDataException(
          "Expected a calling convention signature but found " + type.getKind(), type.toString());
    }
    type.checkArguments();
    CallingConvention callingConvention = type.getCallingConvention();
    List<PortableComplexType> arguments = type.getArguments();
    int flags = arguments.get(0).getInt32();
    switch (callingConvention.getShape()) {
      case METHOD:
        {
          // cc(flags, [numGPs], numParams, retType, params.., [Sentinel, varargs..])
          int index = 1;
          int genParamCount = 0;
          if ((flags & CallingConvention.GENERIC) != 0) {
            genParamCount = arguments.get(index++).getInt32();
          }
          int numParams = arguments.get(index++).getInt32();
          TypeSig retType = addTypeSig(arguments.get(index++));
          List<TypeSig> params = new ArrayList<>(numParams);
          List<TypeSig> paramsAfterSentinel = null;
          for (int i = 0; i < numParams; i++) {
            TypeSig paramType = addTypeSig(arguments.get(index++));
            if (paramType instanceof TypeSig.SentinelSig) {
              paramsAfterSentinel = new ArrayList<>();
              i--;
            } else if (paramsAfterSentinel != null) {
              paramsAfterSentinel.add(paramType);
            } else {
              params.add(paramType);
            }
          }
          int cc = callingConvention.getCode() | flags;
          if (callingConvention == CallingConvention.PROPERTY) {
            return new PropertySig(cc, genParamCount, retType, params, paramsAfterSentinel);
          }
          return new MethodSig(cc, genParamCount, retType, params, paramsAfterSentinel);
        }
      case FIELD:
        return new FieldSig(addTypeSig(arguments.get(1)));
      case LOCAL_SIG:
        {
          int numLocals = arguments.get(1).getInt32();
          List<TypeSig> locals = new ArrayList<>(numLocals);
          for (int i = 0; i < numLocals; i++) {
            locals.add(addTypeSig(arguments.get(2 + i)));
          }
          return new LocalSig(locals);
        }
      case GENERIC_INST:
        {
          int numArgs = arguments.get(1).getInt32();
          List<TypeSig> args = new ArrayList<>(numArgs);
          for (int i = 0; i < numArgs; i++) {
            args.add(addTypeSig(arguments.get(2 + i)));
          }
          return new GenericInstMethodSig(args);
        }
      default:
        throw new InvalidMetadataDataException(
            "Calling convention " + callingConvention + " is not supported", type.toString());
    }
  }
}
