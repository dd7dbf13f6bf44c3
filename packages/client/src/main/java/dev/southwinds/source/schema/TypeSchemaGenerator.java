package dev.southwinds.source.schema;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.victools.jsonschema.generator.FieldScope;
import com.github.victools.jsonschema.generator.Option;
import com.github.victools.jsonschema.generator.OptionPreset;
import com.github.victools.jsonschema.generator.SchemaGenerator;
import com.github.victools.jsonschema.generator.SchemaGeneratorConfigBuilder;
import com.github.victools.jsonschema.generator.SchemaVersion;
import dev.southwinds.source.exception.SchemaException;
import dev.southwinds.source.exception.UsageException;
import dev.southwinds.source.model.TypeDescriptor;
import dev.southwinds.source.utility.JacksonUtility;

/**
 * Derives the registration payload of an item type from an example value: a JSON schema generated
 * from the example's class and the example itself serialized as the prototype.
 *
 * <p>Only the shape of the example drives the schema; its values end up in the prototype.
 */
public class TypeSchemaGenerator {
  private static final org.slf4j.Logger log =
      dev.southwinds.source.logging.LoggingService.getLogger(TypeSchemaGenerator.class);

  private final SchemaGenerator generator;

  public TypeSchemaGenerator() {
    SchemaGeneratorConfigBuilder configBuilder =
        new SchemaGeneratorConfigBuilder(
            JacksonUtility.getJsonMapper(), SchemaVersion.DRAFT_2020_12, OptionPreset.PLAIN_JSON);
    configBuilder.with(Option.DEFINITIONS_FOR_ALL_OBJECTS);
    configBuilder
        .forFields()
        // honour @JsonProperty renames so the schema matches the serialized prototype
        .withPropertyNameOverrideResolver(TypeSchemaGenerator::jsonPropertyName);
    this.generator = new SchemaGenerator(configBuilder.build());
  }

  /** JSON schema of {@code type}. */
  public ObjectNode generateSchema(Class<?> type) {
    try {
      return generator.generateSchema(type);
    } catch (RuntimeException e) {
      throw new SchemaException("cannot derive a JSON schema from " + type.getName(), e);
    }
  }

  /**
   * Builds the descriptor registered under {@code key} for the type of {@code example}.
   *
   * @throws UsageException if {@code key} is blank or {@code example} is null
   * @throws SchemaException if the example's class cannot be introspected
   */
  public TypeDescriptor describe(String key, Object example) {
    if (key == null || key.isBlank()) {
      throw new UsageException("a type key is required");
    }
    if (example == null) {
      throw new UsageException("an example value is required to register type '%s'".formatted(key));
    }
    ObjectNode schema = generateSchema(example.getClass());
    log.trace("Derived schema for type '{}': {}", key, schema);
    return new TypeDescriptor(
        key, JacksonUtility.toJsonBytes(schema), JacksonUtility.toJsonBytes(example));
  }

  private static String jsonPropertyName(FieldScope field) {
    JsonProperty annotation = field.getAnnotationConsideringFieldAndGetter(JsonProperty.class);
    if (annotation == null || annotation.value().isEmpty()) {
      return null;
    }
    return annotation.value();
  }
}
