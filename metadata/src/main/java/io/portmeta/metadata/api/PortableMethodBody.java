package io.portmeta.metadata.api;

import java.util.List;
import java.util.Objects;

/**
 * CIL body of a method definition.
 *
 * @param instructions instructions in order
 * @param exceptionHandlers exception handling clauses
 * @param variables local variable types
 * @param maxStack maximum evaluation stack depth
 * @param initLocals whether locals are zero-initialized
 */
public record PortableMethodBody(
    List<PortableInstruction> instructions,
    List<PortableExceptionHandler> exceptionHandlers,
    List<PortableComplexType> variables,
    int maxStack,
    boolean initLocals) {

  public PortableMethodBody {
    Objects.requireNonNull(instructions, "instructions");
    Objects.requireNonNull(exceptionHandlers, "exceptionHandlers");
    Objects.requireNonNull(variables, "variables");
  }
}
