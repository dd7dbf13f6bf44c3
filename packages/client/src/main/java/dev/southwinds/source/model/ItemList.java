package dev.southwinds.source.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import dev.southwinds.source.exception.UsageException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.function.Supplier;

/**
 * Ordered sequence of {@link Item}s as returned by the source service. The client never re-sorts.
 */
public final class ItemList implements Iterable<Item> {
  private static final ItemList EMPTY = new ItemList(Collections.emptyList());

  private final List<Item> items;

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public ItemList(List<Item> items) {
    this.items = items == null ? Collections.emptyList() : List.copyOf(items);
  }

  public static ItemList empty() {
    return EMPTY;
  }

  @JsonValue
  public List<Item> items() {
    return items;
  }

  public int size() {
    return items.size();
  }

  public boolean isEmpty() {
    return items.isEmpty();
  }

  public Item get(int index) {
    return items.get(index);
  }

  @Override
  public Iterator<Item> iterator() {
    return items.iterator();
  }

  /**
   * Converts every item into a fresh instance obtained from {@code factory}.
   *
   * <p>All or nothing: the first item that fails to decode aborts the conversion and its exception
   * propagates; no partially converted list is returned.
   *
   * @param factory creates an empty, mutable instance per item
   */
  public <T> List<T> typed(Supplier<? extends T> factory) {
    if (factory == null) {
      throw new UsageException("factory argument passed to ItemList.typed() must not be null");
    }
    List<T> result = new ArrayList<>(items.size());
    for (Item item : items) {
      T prototype = factory.get();
      if (prototype == null) {
        throw new UsageException("factory passed to ItemList.typed() returned null");
      }
      result.add(item.typed(prototype));
    }
    return Collections.unmodifiableList(result);
  }

  @Override
  public String toString() {
    return "ItemList" + items.stream().map(Item::key).toList();
  }
}
