package io.portmeta.clr.model.sig;

import io.portmeta.metadata.api.CallingConvention;
import java.util.List;
import java.util.Objects;

/**
 * Signature blob introduced by a calling convention byte. {@link #callingConvention()} is the
 * whole byte: the low nibble plus the {@code GENERIC}, {@code HAS_THIS} and {@code
 * EXPLICIT_THIS} flags.
 */
public sealed interface CallingConventionSig
    permits CallingConventionSig.MethodBaseSig,
        CallingConventionSig.FieldSig,
        CallingConventionSig.LocalSig,
        CallingConventionSig.GenericInstMethodSig {

  int callingConvention();

  default CallingConvention kind() {
    return CallingConvention.require(callingConvention() & CallingConvention.MASK);
  }

  default int flags() {
    return callingConvention() & ~CallingConvention.MASK;
  }

  /** Method or property signature. */
  sealed interface MethodBaseSig extends CallingConventionSig permits MethodSig, PropertySig {
    int genParamCount();

    TypeSig retType();

    List<TypeSig> params();

    /** Parameters after the vararg sentinel, empty when there is none. */
    List<TypeSig> paramsAfterSentinel();

    default boolean isGeneric() {
      return (callingConvention() & CallingConvention.GENERIC) != 0;
    }

    default boolean hasThis() {
      return (callingConvention() & CallingConvention.HAS_THIS) != 0;
    }

    default boolean isExplicitThis() {
      return (callingConvention() & CallingConvention.EXPLICIT_THIS) != 0;
    }
  }

  record MethodSig(
      int callingConvention,
      int genParamCount,
      TypeSig retType,
      List<TypeSig> params,
      List<TypeSig> paramsAfterSentinel)
      implements MethodBaseSig {

    public MethodSig {
      Objects.requireNonNull(retType, "retType");
      params = List.copyOf(params);
      paramsAfterSentinel =
          paramsAfterSentinel == null ? List.of() : List.copyOf(paramsAfterSentinel);
    }

    public static MethodSig createStatic(TypeSig retType, TypeSig... params) {
      return new MethodSig(CallingConvention.DEFAULT.getCode(), 0, retType, List.of(params), null);
    }

    public static MethodSig createInstance(TypeSig retType, TypeSig... params) {
      return new MethodSig(
          CallingConvention.DEFAULT.getCode() | CallingConvention.HAS_THIS,
          0,
          retType,
          List.of(params),
          null);
    }

    public static MethodSig createStaticGeneric(
        int genParamCount, TypeSig retType, TypeSig... params) {
      return new MethodSig(
          CallingConvention.DEFAULT.getCode() | CallingConvention.GENERIC,
          genParamCount,
          retType,
          List.of(params),
          null);
    }
  }

  record PropertySig(
      int callingConvention,
      int genParamCount,
      TypeSig retType,
      List<TypeSig> params,
      List<TypeSig> paramsAfterSentinel)
      implements MethodBaseSig {

    public PropertySig {
      Objects.requireNonNull(retType, "retType");
      params = List.copyOf(params);
      paramsAfterSentinel =
          paramsAfterSentinel == null ? List.of() : List.copyOf(paramsAfterSentinel);
    }

    public static PropertySig createInstance(TypeSig retType, TypeSig... params) {
      return new PropertySig(
          CallingConvention.PROPERTY.getCode() | CallingConvention.HAS_THIS,
          0,
          retType,
          List.of(params),
          null);
    }
  }

  record FieldSig(TypeSig type) implements CallingConventionSig {
    public FieldSig {
      Objects.requireNonNull(type, "type");
    }

    @Override
    public int callingConvention() {
      return CallingConvention.FIELD.getCode();
    }
  }

  record LocalSig(List<TypeSig> locals) implements CallingConventionSig {
    public LocalSig {
      locals = List.copyOf(locals);
    }

    @Override
    public int callingConvention() {
      return CallingConvention.LOCAL_SIG.getCode();
    }
  }

  /** Type arguments of a generic method instantiation. */
  record GenericInstMethodSig(List<TypeSig> genericArguments) implements CallingConventionSig {
    public GenericInstMethodSig {
      genericArguments = List.copyOf(genericArguments);
    }

    @Override
    public int callingConvention() {
      return CallingConvention.GENERIC_INST.getCode();
    }
  }
}
