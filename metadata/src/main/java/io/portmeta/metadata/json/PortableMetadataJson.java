package io.portmeta.metadata.json;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import io.portmeta.metadata.api.InvalidMetadataDataException;
import io.portmeta.metadata.api.PortableComplexType;
import io.portmeta.metadata.api.PortableConstant;
import io.portmeta.metadata.api.PortableInstruction;
import io.portmeta.metadata.api.PortableMetadata;
import io.portmeta.metadata.api.PortableMetadataFacade;
import io.portmeta.metadata.api.PortableToken;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gson-based JSON codec for {@link PortableMetadata}.
 *
 * <p>The document is the {@link PortableMetadataFacade} projection with upper camel case
 * property names and {@code null}s omitted:
 *
 * <pre>
 * {"Options": 14,
 *  "Types": {"References": {"0": {...}}, "Definitions": {"1": {...}}, "Orders": []},
 *  "Fields": {...}, "Methods": {...}}
 * </pre>
 *
 * Instances are immutable and thread-safe.
 */
public final class PortableMetadataJson {
  private static final Logger log = LoggerFactory.getLogger(PortableMetadataJson.class);

  private final Gson gson;

  private PortableMetadataJson(Builder builder) {
    PortableComplexTypeAdapter complexTypes =
        new PortableComplexTypeAdapter(builder.compactComplexTypes);
    GsonBuilder gsonBuilder =
        new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.UPPER_CAMEL_CASE)
            .disableHtmlEscaping()
            .registerTypeAdapter(PortableToken.class, new PortableTokenAdapter().nullSafe())
            .registerTypeAdapter(PortableComplexType.class, complexTypes)
            .registerTypeAdapter(
                PortableInstruction.class, new PortableInstructionAdapter(complexTypes))
            .registerTypeAdapter(PortableConstant.class, new PortableConstantAdapter())
            .registerTypeAdapter(byte[].class, new ByteArrayBase64Adapter());
    if (builder.prettyPrinting) {
      gsonBuilder.setPrettyPrinting();
    }
    this.gson = gsonBuilder.create();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Codec with compact complex types and no pretty printing. */
  public static PortableMetadataJson create() {
    return builder().build();
  }

  /** The configured Gson instance, for embedding portable values in other documents. */
  public Gson gson() {
    return gson;
  }

  public String toJson(PortableMetadata metadata) {
    return gson.toJson(new PortableMetadataFacade(metadata));
  }

  public void toJson(PortableMetadata metadata, Writer writer) throws IOException {
    try {
      gson.toJson(new PortableMetadataFacade(metadata), writer);
    } catch (com.google.gson.JsonIOException e) {
      if (e.getCause() instanceof IOException) {
        throw (IOException) e.getCause();
      }
      throw e;
    }
  }

  /**
   * @throws InvalidMetadataDataException if the document is malformed
   */
  public PortableMetadata fromJson(String json) {
    try {
      return toMetadata(gson.fromJson(json, PortableMetadataFacade.class));
    } catch (JsonParseException | IllegalStateException e) {
      throw new InvalidMetadataDataException("Malformed portable metadata JSON", e, null);
    }
  }

  /**
   * @throws InvalidMetadataDataException if the document is malformed
   */
  public PortableMetadata fromJson(Reader reader) {
    try {
      return toMetadata(gson.fromJson(reader, PortableMetadataFacade.class));
    } catch (JsonParseException | IllegalStateException e) {
      throw new InvalidMetadataDataException("Malformed portable metadata JSON", e, null);
    }
  }

  private static PortableMetadata toMetadata(PortableMetadataFacade facade) {
    if (facade == null) {
      throw new InvalidMetadataDataException("Empty portable metadata document");
    }
    try {
      PortableMetadata metadata = facade.toMetadata();
      log.debug("Read {}", metadata);
      return metadata;
    } catch (IllegalArgumentException e) {
      throw new InvalidMetadataDataException("Inconsistent portable metadata document", e, null);
    }
  }

  /** Codec settings. */
  public static final class Builder {
    private boolean compactComplexTypes = true;
    private boolean prettyPrinting;

    private Builder() {}

    /** Write complex types as compact strings (default) or as structured objects. */
    public Builder compactComplexTypes(boolean compactComplexTypes) {
      this.compactComplexTypes = compactComplexTypes;
      return this;
    }

    public Builder prettyPrinting(boolean prettyPrinting) {
      this.prettyPrinting = prettyPrinting;
      return this;
    }

    public PortableMetadataJson build() {
      return new PortableMetadataJson(this);
    }
  }
}
