package dev.southwinds.source.model;

/**
 * Capability required of every value saved through {@link dev.southwinds.source.SourceClient#save}.
 * The client calls {@link #validate()} before serializing the value; nothing is sent when it
 * throws.
 */
public interface Validatable {

  /**
   * Checks the state of this value.
   *
   * @throws dev.southwinds.source.exception.ValidationException if the value must not be stored
   */
  void validate();
}
