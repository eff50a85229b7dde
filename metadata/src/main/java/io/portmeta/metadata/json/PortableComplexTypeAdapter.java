package io.portmeta.metadata.json;

import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import io.portmeta.metadata.api.InvalidMetadataDataException;
import io.portmeta.metadata.api.PortableComplexType;
import io.portmeta.metadata.api.PortableComplexTypeKind;
import io.portmeta.metadata.api.PortableToken;
import io.portmeta.metadata.impl.ComplexTypeFormatter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes complex types either as their compact string form or as a structured object:
 *
 * <pre>
 * {"Kind": 1, "Type": 29, "Arguments": [{"Kind": 1, "Type": 14}]}
 * </pre>
 *
 * Both shapes are accepted on read. In the object form the token slot carries the value of an
 * {@code INT32}.
 */
final class PortableComplexTypeAdapter extends TypeAdapter<PortableComplexType> {
  private final boolean compact;
  private final PortableTokenAdapter tokens = new PortableTokenAdapter();

  PortableComplexTypeAdapter(boolean compact) {
    this.compact = compact;
  }

  @Override
  public void write(JsonWriter out, PortableComplexType type) throws IOException {
    if (type == null) {
      out.nullValue();
    } else if (compact) {
      out.value(ComplexTypeFormatter.format(type));
    } else {
      writeObject(out, type);
    }
  }

  private void writeObject(JsonWriter out, PortableComplexType type) throws IOException {
    out.beginObject();
    out.name("Kind").value(type.getKind().ordinal());
    switch (type.getKind()) {
      case TOKEN:
        out.name("Token");
        tokens.write(out, type.getToken());
        break;
      case INT32:
        out.name("Token").beginObject().name("Index").value(type.getInt32()).endObject();
        break;
      case TYPE_SIG:
      case CALLING_CONVENTION_SIG:
        out.name("Type").value(type.getType());
        break;
      default:
        break;
    }
    if (type.getArguments() != null) {
      out.name("Arguments").beginArray();
      for (PortableComplexType argument : type.getArguments()) {
        writeObject(out, argument);
      }
      out.endArray();
    }
    out.endObject();
  }

  @Override
  public PortableComplexType read(JsonReader in) throws IOException {
    JsonToken peek = in.peek();
    switch (peek) {
      case NULL:
        in.nextNull();
        return null;
      case STRING:
        {
          String s = in.nextString();
          try {
            return PortableComplexType.parse(s);
          } catch (IllegalArgumentException e) {
            throw new InvalidMetadataDataException("Invalid complex type", e, in.getPath());
          }
        }
      case BEGIN_OBJECT:
        return readObject(in);
      default:
        throw new InvalidMetadataDataException(
            "Unexpected " + peek + " for complex type", in.getPath());
    }
  }

  private PortableComplexType readObject(JsonReader in) throws IOException {
    PortableComplexTypeKind kind = null;
    PortableToken token = null;
    int int32 = 0;
    int type = 0;
    List<PortableComplexType> arguments = null;
    in.beginObject();
    while (in.hasNext()) {
      switch (in.nextName()) {
        case "Kind":
          kind = readKind(in);
          break;
        case "Token":
          if (in.peek() == JsonToken.BEGIN_OBJECT) {
            in.beginObject();
            while (in.hasNext()) {
              String name = in.nextName();
              if ("Index".equals(name) && in.peek() == JsonToken.NUMBER) {
                int32 = in.nextInt();
                token = int32 >= 0 ? PortableToken.of(int32) : null;
              } else if ("Name".equals(name) && in.peek() == JsonToken.STRING) {
                token = readName(in);
              } else {
                in.skipValue();
              }
            }
            in.endObject();
          } else if (in.peek() == JsonToken.NUMBER) {
            // an Int32 value may be negative, a token index may not
            int32 = in.nextInt();
            token = int32 >= 0 ? PortableToken.of(int32) : null;
          } else {
            token = tokens.read(in);
          }
          break;
        case "Type":
          type = in.nextInt();
          break;
        case "Arguments":
          if (in.peek() == JsonToken.NULL) {
            in.nextNull();
            break;
          }
          List<PortableComplexType> list = new ArrayList<>();
          in.beginArray();
          while (in.hasNext()) {
            list.add(read(in));
          }
          in.endArray();
          arguments = list.isEmpty() ? null : list;
          break;
        default:
          in.skipValue();
          break;
      }
    }
    in.endObject();
    if (kind == null) {
      throw new InvalidMetadataDataException("Complex type object without Kind", in.getPath());
    }
    try {
      return PortableComplexType.of(kind, token, int32, type, arguments);
    } catch (IllegalArgumentException | InvalidMetadataDataException e) {
      throw new InvalidMetadataDataException("Invalid complex type object", e, in.getPath());
    }
  }

  private static PortableComplexTypeKind readKind(JsonReader in) throws IOException {
    if (in.peek() == JsonToken.NUMBER) {
      return PortableComplexTypeKind.fromOrdinal(in.nextInt());
    }
    String name = in.nextString();
    for (PortableComplexTypeKind kind : PortableComplexTypeKind.values()) {
      if (kind.name().replace("_", "").equalsIgnoreCase(name)) {
        return kind;
      }
    }
    throw new InvalidMetadataDataException("Unknown complex type kind " + name, in.getPath());
  }

  private static PortableToken readName(JsonReader in) throws IOException {
    String name = in.nextString();
    try {
      return PortableToken.of(name);
    } catch (IllegalArgumentException e) {
      throw new InvalidMetadataDataException("Invalid token name", e, in.getPath());
    }
  }
}
