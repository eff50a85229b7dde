package io.portmeta.clr.model.sig;

import io.portmeta.clr.model.TypeDefOrRef;
import io.portmeta.metadata.api.ElementType;
import java.util.List;
import java.util.Objects;

/**
 * Type signature tree. Each variant corresponds to one {@link ElementType}; leaves with no
 * payload are {@link CorLibTypeSig}.
 */
public sealed interface TypeSig {

  ElementType elementType();

  /** Primitive or well-known core library type with no payload. */
  record CorLibTypeSig(ElementType elementType) implements TypeSig {
    public CorLibTypeSig {
      Objects.requireNonNull(elementType, "elementType");
      if (elementType.getShape() != ElementType.Shape.LEAF || elementType == ElementType.SENTINEL) {
        throw new IllegalArgumentException("Not a core library element type: " + elementType);
      }
    }

    @Override
    public String toString() {
      return elementType.getDisplayName();
    }
  }

  record PtrSig(TypeSig next) implements TypeSig {
    public PtrSig {
      Objects.requireNonNull(next, "next");
    }

    @Override
    public ElementType elementType() {
      return ElementType.PTR;
    }
  }

  record ByRefSig(TypeSig next) implements TypeSig {
    public ByRefSig {
      Objects.requireNonNull(next, "next");
    }

    @Override
    public ElementType elementType() {
      return ElementType.BY_REF;
    }
  }

  record SZArraySig(TypeSig next) implements TypeSig {
    public SZArraySig {
      Objects.requireNonNull(next, "next");
    }

    @Override
    public ElementType elementType() {
      return ElementType.SZ_ARRAY;
    }
  }

  record PinnedSig(TypeSig next) implements TypeSig {
    public PinnedSig {
      Objects.requireNonNull(next, "next");
    }

    @Override
    public ElementType elementType() {
      return ElementType.PINNED;
    }
  }

  /** Function pointer; the method signature takes the place of the next type. */
  record FnPtrSig(CallingConventionSig signature) implements TypeSig {
    public FnPtrSig {
      Objects.requireNonNull(signature, "signature");
    }

    @Override
    public ElementType elementType() {
      return ElementType.FN_PTR;
    }
  }

  record ClassSig(TypeDefOrRef type) implements TypeSig {
    public ClassSig {
      Objects.requireNonNull(type, "type");
    }

    @Override
    public ElementType elementType() {
      return ElementType.CLASS;
    }

    @Override
    public String toString() {
      return "Class(" + type.getFullName() + ")";
    }
  }

  record ValueTypeSig(TypeDefOrRef type) implements TypeSig {
    public ValueTypeSig {
      Objects.requireNonNull(type, "type");
    }

    @Override
    public ElementType elementType() {
      return ElementType.VALUE_TYPE;
    }

    @Override
    public String toString() {
      return "ValueType(" + type.getFullName() + ")";
    }
  }

  /** Type generic parameter {@code !number}. */
  record GenericVar(int number) implements TypeSig {
    @Override
    public ElementType elementType() {
      return ElementType.VAR;
    }
  }

  /** Method generic parameter {@code !!number}. */
  record GenericMVar(int number) implements TypeSig {
    @Override
    public ElementType elementType() {
      return ElementType.MVAR;
    }
  }

  /** Multi-dimensional array with optional sizes and lower bounds. */
  record ArraySig(TypeSig next, int rank, List<Integer> sizes, List<Integer> lowerBounds)
      implements TypeSig {
    public ArraySig {
      Objects.requireNonNull(next, "next");
      sizes = List.copyOf(sizes);
      lowerBounds = List.copyOf(lowerBounds);
    }

    @Override
    public ElementType elementType() {
      return ElementType.ARRAY;
    }
  }

  /** Generic instantiation; {@code genericType} is a {@link ClassSig} or {@link ValueTypeSig}. */
  record GenericInstSig(TypeSig genericType, List<TypeSig> genericArguments) implements TypeSig {
    public GenericInstSig {
      Objects.requireNonNull(genericType, "genericType");
      genericArguments = List.copyOf(genericArguments);
    }

    @Override
    public ElementType elementType() {
      return ElementType.GENERIC_INST;
    }
  }

  record ValueArraySig(TypeSig next, int size) implements TypeSig {
    public ValueArraySig {
      Objects.requireNonNull(next, "next");
    }

    @Override
    public ElementType elementType() {
      return ElementType.VALUE_ARRAY;
    }
  }

  record CModReqdSig(TypeDefOrRef modifier, TypeSig next) implements TypeSig {
    public CModReqdSig {
      Objects.requireNonNull(modifier, "modifier");
      Objects.requireNonNull(next, "next");
    }

    @Override
    public ElementType elementType() {
      return ElementType.CMOD_REQD;
    }
  }

  record CModOptSig(TypeDefOrRef modifier, TypeSig next) implements TypeSig {
    public CModOptSig {
      Objects.requireNonNull(modifier, "modifier");
      Objects.requireNonNull(next, "next");
    }

    @Override
    public ElementType elementType() {
      return ElementType.CMOD_OPT;
    }
  }

  record ModuleSig(int index, TypeSig next) implements TypeSig {
    public ModuleSig {
      Objects.requireNonNull(next, "next");
    }

    @Override
    public ElementType elementType() {
      return ElementType.MODULE;
    }
  }

  /** Marks the start of the variable arguments of a vararg call site. */
  record SentinelSig() implements TypeSig {
    @Override
    public ElementType elementType() {
      return ElementType.SENTINEL;
    }
  }
}
