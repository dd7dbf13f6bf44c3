package dev.southwinds.source.model;

import dev.southwinds.source.exception.UsageException;

/**
 * Label attached to an item. Tags travel in the request path, see {@link #routeSegment()}.
 *
 * @param itemKey key of the tagged item
 * @param name tag name, required
 * @param value optional tag value
 */
public record Tag(String itemKey, String name, String value) {

  public Tag {
    if (name == null || name.isEmpty()) {
      throw new UsageException("a tag name is required");
    }
  }

  public static Tag of(String itemKey, String name) {
    return new Tag(itemKey, name, null);
  }

  /** Path segment identifying the tag: {@code name} or {@code name|value}. */
  public String routeSegment() {
    return value == null || value.isEmpty() ? name : name + "|" + value;
  }
}
