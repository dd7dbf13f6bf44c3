package dev.southwinds.source.model;

import dev.southwinds.source.exception.UsageException;
import java.lang.ref.Reference;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/** Argument checks shared by the typed-conversion and save paths. */
public final class Prototypes {
  private Prototypes() {}

  /**
   * Ensures {@code prototype} is an instance Jackson can populate in place.
   *
   * @throws UsageException for {@code null}, records, enums, arrays and JDK value types
   */
  public static void requireWritable(Object prototype, String operation) {
    if (prototype == null) {
      throw new UsageException("prototype argument passed to %s must not be null".formatted(operation));
    }
    Class<?> type = prototype.getClass();
    if (type.isRecord()
        || type.isEnum()
        || type.isArray()
        || prototype instanceof CharSequence
        || prototype instanceof Number
        || prototype instanceof Boolean
        || prototype instanceof Character) {
      throw new UsageException(
          "prototype argument passed to %s must be a mutable instance, got %s"
              .formatted(operation, type.getName()));
    }
  }

  /**
   * Ensures {@code item} is the value itself rather than a holder pointing at one.
   *
   * @throws UsageException for {@code null} and reference holders
   */
  public static void requireOwnedValue(Object item, String operation) {
    if (item == null) {
      throw new UsageException("item argument passed to %s must not be null".formatted(operation));
    }
    if (item instanceof Reference<?>
        || item instanceof AtomicReference<?>
        || item instanceof Optional<?>) {
      throw new UsageException(
          "item argument passed to %s must not be a reference holder, got %s"
              .formatted(operation, item.getClass().getName()));
    }
  }
}
