package dev.southwinds.source.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.southwinds.source.exception.DecodeException;
import dev.southwinds.source.exception.UsageException;
import dev.southwinds.source.utility.JacksonUtility;
import java.io.IOException;
import java.time.Instant;

/**
 * A configuration item as stored by the source service, before it is interpreted as a concrete
 * type.
 *
 * <p>Example JSON:
 *
 * <pre>{@code
 * {
 *   "key": "OPT_1",
 *   "type": "AAA",
 *   "value": "eyJpbnNlY3VyZVRyYW5zcG9ydCI6ZmFsc2V9",
 *   "updated": "2022-09-12T10:15:30.123Z"
 * }
 * }</pre>
 *
 * @param key unique identifier of the item in the store
 * @param type name of the registered type the item was validated against
 * @param value raw JSON of the item (base64 on the wire); only read on conversion
 * @param updatedAt time of the last write, set by the service
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Item(
    String key, String type, byte[] value, @JsonProperty("updated") Instant updatedAt) {

  public Item {
    value = value == null ? null : value.clone();
  }

  @Override
  public byte[] value() {
    return value == null ? null : value.clone();
  }

  /**
   * Decodes the item value into {@code prototype} and returns the same instance.
   *
   * <p>Fields missing from the value keep the prototype's defaults and unknown fields are ignored.
   *
   * @param prototype an empty, mutable instance of the target type
   * @throws UsageException if {@code prototype} cannot be populated in place
   * @throws DecodeException if the value does not match the prototype's shape
   */
  public <T> T typed(T prototype) {
    Prototypes.requireWritable(prototype, "Item.typed()");
    try {
      return JacksonUtility.getJsonMapper().readerForUpdating(prototype).readValue(bytes());
    } catch (IOException e) {
      throw new DecodeException(
          "cannot decode item '%s' into %s".formatted(key, prototype.getClass().getName()), e);
    }
  }

  /**
   * Decodes the item value into a new instance of {@code type}. Unlike {@link #typed(Object)} this
   * also works for records and other immutable types.
   */
  public <T> T typed(Class<T> type) {
    if (type == null) {
      throw new UsageException("type argument passed to Item.typed() must not be null");
    }
    try {
      return JacksonUtility.getJsonMapper().readValue(bytes(), type);
    } catch (IOException e) {
      throw new DecodeException("cannot decode item '%s' into %s".formatted(key, type.getName()), e);
    }
  }

  private byte[] bytes() {
    return value == null ? new byte[0] : value;
  }
}
