package dev.southwinds.source.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Registration payload of an item type: its JSON schema and a serialized example. Built for one
 * {@code PUT /type} request and not retained.
 *
 * @param key the type name items refer to
 * @param schema JSON schema of the type (base64 on the wire)
 * @param proto JSON of the example instance (base64 on the wire)
 */
public record TypeDescriptor(
    @JsonInclude(JsonInclude.Include.NON_EMPTY) String key,
    byte[] schema,
    @JsonProperty("proto") byte[] proto) {

  public TypeDescriptor {
    schema = schema == null ? null : schema.clone();
    proto = proto == null ? null : proto.clone();
  }

  @Override
  public byte[] schema() {
    return schema == null ? null : schema.clone();
  }

  @Override
  public byte[] proto() {
    return proto == null ? null : proto.clone();
  }
}
