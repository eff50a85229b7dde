package io.portmeta.clr.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * In-memory module: the top level types it defines plus the external references it uses. The
 * first type is always the global {@code <Module>} type.
 */
public final class ModuleDef {
  public static final String GLOBAL_TYPE_NAME = "<Module>";

  private final String name;
  private final TypeDef globalType;
  private final List<TypeDef> types = new ArrayList<>();
  private final List<AssemblyRef> assemblyRefs = new ArrayList<>();
  private final List<TypeRef> typeRefs = new ArrayList<>();
  private final List<ModuleRef> moduleRefs = new ArrayList<>();

  public ModuleDef(String name) {
    this.name = Objects.requireNonNull(name, "name");
    this.globalType = addType(new TypeDef("", GLOBAL_TYPE_NAME));
  }

  public String getName() {
    return name;
  }

  public TypeDef getGlobalType() {
    return globalType;
  }

  /** Top level types, starting with the global type. */
  public List<TypeDef> getTypes() {
    return Collections.unmodifiableList(types);
  }

  public TypeDef addType(TypeDef type) {
    if (type.getModule() != null || type.getDeclaringType() != null) {
      throw new IllegalArgumentException(type + " already belongs to a module");
    }
    type.setModule(this);
    types.add(type);
    return type;
  }

  /** All types including nested ones, outer types before the types they enclose. */
  public List<TypeDef> getAllTypes() {
    List<TypeDef> result = new ArrayList<>();
    for (TypeDef type : types) {
      collect(type, result);
    }
    return result;
  }

  private static void collect(TypeDef type, List<TypeDef> result) {
    result.add(type);
    for (TypeDef nestedType : type.getNestedTypes()) {
      collect(nestedType, result);
    }
  }

  /** @return the top level type, or {@code null} */
  public TypeDef findType(String namespace, String name) {
    for (TypeDef type : types) {
      if (type.getNamespace().equals(namespace) && type.getName().equals(name)) {
        return type;
      }
    }
    return null;
  }

  public List<AssemblyRef> getAssemblyRefs() {
    return Collections.unmodifiableList(assemblyRefs);
  }

  public AssemblyRef addAssemblyRef(AssemblyRef assemblyRef) {
    assemblyRefs.add(Objects.requireNonNull(assemblyRef, "assemblyRef"));
    return assemblyRef;
  }

  public List<TypeRef> getTypeRefs() {
    return Collections.unmodifiableList(typeRefs);
  }

  public TypeRef addTypeRef(TypeRef typeRef) {
    typeRefs.add(Objects.requireNonNull(typeRef, "typeRef"));
    return typeRef;
  }

  public List<ModuleRef> getModuleRefs() {
    return Collections.unmodifiableList(moduleRefs);
  }

  public ModuleRef addModuleRef(ModuleRef moduleRef) {
    moduleRefs.add(Objects.requireNonNull(moduleRef, "moduleRef"));
    return moduleRef;
  }

  @Override
  public String toString() {
    return name;
  }
}
