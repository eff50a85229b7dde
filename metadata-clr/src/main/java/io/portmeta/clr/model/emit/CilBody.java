package io.portmeta.clr.model.emit;

import java.util.ArrayList;
import java.util.List;

public final class CilBody {
  private final List<Instruction> instructions = new ArrayList<>();
  private final List<ExceptionHandler> exceptionHandlers = new ArrayList<>();
  private final List<Local> variables = new ArrayList<>();
  private int maxStack = 8;
  private boolean initLocals = true;

  public List<Instruction> getInstructions() {
    return instructions;
  }

  public List<ExceptionHandler> getExceptionHandlers() {
    return exceptionHandlers;
  }

  public List<Local> getVariables() {
    return variables;
  }

  public int getMaxStack() {
    return maxStack;
  }

  public void setMaxStack(int maxStack) {
    this.maxStack = maxStack;
  }

  public boolean isInitLocals() {
    return initLocals;
  }

  public void setInitLocals(boolean initLocals) {
    this.initLocals = initLocals;
  }

  public int indexOf(Instruction instruction) {
    for (int i = 0; i < instructions.size(); i++) {
      if (instructions.get(i) == instruction) {
        return i;
      }
    }
    return -1;
  }
}
