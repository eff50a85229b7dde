package io.portmeta.metadata.json;

import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import io.portmeta.metadata.api.InvalidMetadataDataException;
import io.portmeta.metadata.api.PortableToken;
import java.io.IOException;

/**
 * Writes a token as a JSON number (indexed) or string (named). Also reads the object form
 * {@code {"Index": n}} / {@code {"Name": s}}.
 */
final class PortableTokenAdapter extends TypeAdapter<PortableToken> {

  @Override
  public void write(JsonWriter out, PortableToken token) throws IOException {
    if (token == null) {
      out.nullValue();
    } else if (token.isNamed()) {
      out.value(token.getName());
    } else {
      out.value(token.getIndex());
    }
  }

  @Override
  public PortableToken read(JsonReader in) throws IOException {
    JsonToken peek = in.peek();
    try {
      switch (peek) {
        case NULL:
          in.nextNull();
          return null;
        case NUMBER:
          return PortableToken.of(in.nextInt());
        case STRING:
          return PortableToken.of(in.nextString());
        case BEGIN_OBJECT:
          return readObject(in);
        default:
          throw new InvalidMetadataDataException("Unexpected " + peek + " for token", in.getPath());
      }
    } catch (IllegalArgumentException e) {
      throw new InvalidMetadataDataException("Invalid token", e, in.getPath());
    }
  }

  private static PortableToken readObject(JsonReader in) throws IOException {
    PortableToken token = null;
    in.beginObject();
    while (in.hasNext()) {
      String name = in.nextName();
      if ("Name".equals(name) && in.peek() == JsonToken.STRING) {
        token = PortableToken.of(in.nextString());
      } else if ("Index".equals(name) && in.peek() == JsonToken.NUMBER && token == null) {
        token = PortableToken.of(in.nextInt());
      } else {
        in.skipValue();
      }
    }
    in.endObject();
    if (token == null) {
      throw new InvalidMetadataDataException("Token object without Index or Name", in.getPath());
    }
    return token;
  }
}
