package io.portmeta.clr.model.emit;

import io.portmeta.clr.model.TypeDefOrRef;
import java.util.Objects;

/**
 * Exception handling clause. End boundaries are the first instruction after the block, {@code
 * null} when the block runs to the end of the method.
 */
public record ExceptionHandler(
    int handlerType,
    Instruction tryStart,
    Instruction tryEnd,
    Instruction filterStart,
    Instruction handlerStart,
    Instruction handlerEnd,
    TypeDefOrRef catchType) {

  public static final int CATCH = 0;
  public static final int FILTER = 1;
  public static final int FINALLY = 2;
  public static final int FAULT = 4;

  public ExceptionHandler {
    Objects.requireNonNull(tryStart, "tryStart");
    Objects.requireNonNull(handlerStart, "handlerStart");
  }
}
