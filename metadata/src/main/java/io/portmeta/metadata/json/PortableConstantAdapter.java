package io.portmeta.metadata.json;

import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import io.portmeta.metadata.api.ElementType;
import io.portmeta.metadata.api.InvalidMetadataDataException;
import io.portmeta.metadata.api.PortableConstant;
import io.portmeta.utils.PrimitiveSlots;
import java.io.IOException;

/** Constant codec: {@code {"Type": n, "PrimitiveValue": slot}} or {@code "StringValue"}. */
final class PortableConstantAdapter extends TypeAdapter<PortableConstant> {

  @Override
  public void write(JsonWriter out, PortableConstant constant) throws IOException {
    if (constant == null) {
      out.nullValue();
      return;
    }
    out.beginObject();
    out.name("Type").value(constant.type());
    Object value = constant.value();
    if (value instanceof String) {
      out.name("StringValue").value((String) value);
    } else if (value != null) {
      out.name("PrimitiveValue")
          .value(PrimitiveSlots.toSlot(value, ElementType.require(constant.type())));
    }
    out.endObject();
  }

  @Override
  public PortableConstant read(JsonReader in) throws IOException {
    if (in.peek() == JsonToken.NULL) {
      in.nextNull();
      return null;
    }
    Integer type = null;
    Long primitive = null;
    String string = null;
    in.beginObject();
    while (in.hasNext()) {
      String name = in.nextName();
      if (in.peek() == JsonToken.NULL) {
        in.nextNull();
        continue;
      }
      switch (name) {
        case "Type":
          type = in.nextInt();
          break;
        case "PrimitiveValue":
          primitive = in.nextLong();
          break;
        case "StringValue":
          string = in.nextString();
          break;
        default:
          in.skipValue();
          break;
      }
    }
    in.endObject();
    if (type == null) {
      throw new InvalidMetadataDataException("Constant without Type", in.getPath());
    }
    Object value = null;
    if (primitive != null) {
      value = PrimitiveSlots.fromSlot(primitive, ElementType.require(type));
    } else if (string != null && type == ElementType.STRING.getCode()) {
      value = string;
    }
    return new PortableConstant(type, value);
  }
}
