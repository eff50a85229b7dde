package io.portmeta.metadata.json;

import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import io.portmeta.metadata.api.InvalidMetadataDataException;
import java.io.IOException;
import java.util.Base64;

/** Byte arrays as base64 strings. */
final class ByteArrayBase64Adapter extends TypeAdapter<byte[]> {

  @Override
  public void write(JsonWriter out, byte[] value) throws IOException {
    if (value == null) {
      out.nullValue();
    } else {
      out.value(Base64.getEncoder().encodeToString(value));
    }
  }

  @Override
  public byte[] read(JsonReader in) throws IOException {
    if (in.peek() == JsonToken.NULL) {
      in.nextNull();
      return null;
    }
    String s = in.nextString();
    try {
      return Base64.getDecoder().decode(s);
    } catch (IllegalArgumentException e) {
      throw new InvalidMetadataDataException("Invalid base64 data", e, in.getPath());
    }
  }
}
