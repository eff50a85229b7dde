package io.portmeta.metadata.json;

import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import io.portmeta.metadata.api.InvalidMetadataDataException;
import io.portmeta.metadata.api.PortableComplexType;
import io.portmeta.metadata.api.PortableInstruction;
import io.portmeta.metadata.api.PortableOperand;
import io.portmeta.utils.PrimitiveSlots;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Instruction codec. The operand goes into one of {@code PrimitiveValue}, {@code StringValue},
 * {@code Int32ArrayValue} or {@code TypeValue}; a primitive slot is interpreted by the opcode.
 * Only {@code ldstr} takes a string and only {@code switch} takes an array.
 */
final class PortableInstructionAdapter extends TypeAdapter<PortableInstruction> {
  private final TypeAdapter<PortableComplexType> complexTypes;

  PortableInstructionAdapter(TypeAdapter<PortableComplexType> complexTypes) {
    this.complexTypes = complexTypes;
  }

  @Override
  public void write(JsonWriter out, PortableInstruction instruction) throws IOException {
    if (instruction == null) {
      out.nullValue();
      return;
    }
    out.beginObject();
    out.name("OpCode").value(instruction.opCode());
    PortableOperand operand = instruction.operand();
    if (operand instanceof PortableOperand.Int32) {
      out.name("PrimitiveValue").value(((PortableOperand.Int32) operand).value());
    } else if (operand instanceof PortableOperand.Int64) {
      out.name("PrimitiveValue").value(((PortableOperand.Int64) operand).value());
    } else if (operand instanceof PortableOperand.Float32) {
      out.name("PrimitiveValue")
          .value(PrimitiveSlots.floatToSlot(((PortableOperand.Float32) operand).value()));
    } else if (operand instanceof PortableOperand.Float64) {
      out.name("PrimitiveValue")
          .value(Double.doubleToRawLongBits(((PortableOperand.Float64) operand).value()));
    } else if (operand instanceof PortableOperand.Str) {
      out.name("StringValue").value(((PortableOperand.Str) operand).value());
    } else if (operand instanceof PortableOperand.Switch) {
      out.name("Int32ArrayValue").beginArray();
      for (int target : ((PortableOperand.Switch) operand).targets()) {
        out.value(target);
      }
      out.endArray();
    } else if (operand instanceof PortableOperand.Type) {
      out.name("TypeValue");
      complexTypes.write(out, ((PortableOperand.Type) operand).value());
    }
    out.endObject();
  }

  @Override
  public PortableInstruction read(JsonReader in) throws IOException {
    if (in.peek() == JsonToken.NULL) {
      in.nextNull();
      return null;
    }
    String opCode = null;
    Long primitive = null;
    String string = null;
    int[] targets = null;
    PortableComplexType type = null;
    in.beginObject();
    while (in.hasNext()) {
      String name = in.nextName();
      if (in.peek() == JsonToken.NULL) {
        in.nextNull();
        continue;
      }
      switch (name) {
        case "OpCode":
          opCode = in.nextString();
          break;
        case "PrimitiveValue":
          primitive = in.nextLong();
          break;
        case "StringValue":
          string = in.nextString();
          break;
        case "Int32ArrayValue":
          targets = readInts(in);
          break;
        case "TypeValue":
          type = complexTypes.read(in);
          break;
        default:
          in.skipValue();
          break;
      }
    }
    in.endObject();
    if (opCode == null) {
      throw new InvalidMetadataDataException("Instruction without OpCode", in.getPath());
    }
    if (string != null && !"ldstr".equals(opCode)) {
      throw new InvalidMetadataDataException(
          "StringValue on '" + opCode + "' instruction", in.getPath());
    }
    if (targets != null && !"switch".equals(opCode)) {
      throw new InvalidMetadataDataException(
          "Int32ArrayValue on '" + opCode + "' instruction", in.getPath());
    }
    PortableOperand operand = null;
    if (primitive != null) {
      operand = primitiveOperand(opCode, primitive);
    } else if (string != null) {
      operand = PortableOperand.of(string);
    } else if (targets != null) {
      operand = PortableOperand.of(targets);
    } else if (type != null) {
      operand = PortableOperand.of(type);
    }
    return new PortableInstruction(opCode, operand);
  }

  private static PortableOperand primitiveOperand(String opCode, long slot) {
    switch (opCode) {
      case "ldc.i8":
        return PortableOperand.of(slot);
      case "ldc.r4":
        return PortableOperand.of(PrimitiveSlots.floatFromSlot(slot));
      case "ldc.r8":
        return PortableOperand.of(Double.longBitsToDouble(slot));
      default:
        return PortableOperand.of((int) slot);
    }
  }

  private static int[] readInts(JsonReader in) throws IOException {
    List<Integer> values = new ArrayList<>();
    in.beginArray();
    while (in.hasNext()) {
      values.add(in.nextInt());
    }
    in.endArray();
    int[] result = new int[values.size()];
    for (int i = 0; i < result.length; i++) {
      result[i] = values.get(i);
    }
    return result;
  }
}
