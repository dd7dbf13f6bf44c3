package dev.southwinds.source;

import dev.southwinds.source.exception.ConfigException;
import dev.southwinds.source.exception.UsageException;
import dev.southwinds.source.exception.ValidationException;
import dev.southwinds.source.http.OkHttpFactory;
import dev.southwinds.source.http.RequestExecutor;
import dev.southwinds.source.http.RetryPolicy;
import dev.southwinds.source.http.Route;
import dev.southwinds.source.key.KeySequencer;
import dev.southwinds.source.logging.LoggingService;
import dev.southwinds.source.model.Item;
import dev.southwinds.source.model.ItemList;
import dev.southwinds.source.model.Link;
import dev.southwinds.source.model.Prototypes;
import dev.southwinds.source.model.Tag;
import dev.southwinds.source.model.TypeDescriptor;
import dev.southwinds.source.model.Validatable;
import dev.southwinds.source.schema.TypeSchemaGenerator;
import dev.southwinds.source.utility.JacksonUtility;
import java.io.Closeable;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.apache.commons.configuration2.Configuration;

/**
 * Client of the source configuration service.
 *
 * <p>Typical use:
 *
 * <pre>{@code
 * try (SourceClient client = new SourceClient("http://127.0.0.1:8080", "admin", "adm1n", null)) {
 *   client.registerType("AAA", new SourceClientOptions(true, Duration.ofSeconds(5)));
 *   client.save("OPT_1", "AAA", new SourceClientOptions(false, Duration.ofSeconds(60)));
 *   SourceClientOptions opts = client.load("OPT_1", new SourceClientOptions());
 *   List<SourceClientOptions> all = client.loadItemsByType(SourceClientOptions::new, "AAA");
 * }
 * }</pre>
 *
 * <p>Every call is synchronous and maps to one HTTP request (retried on transient failures). The
 * client is immutable and safe for concurrent use; all calls share one connection pool.
 */
public class SourceClient implements Closeable {
  private static final org.slf4j.Logger log = LoggingService.getLogger(SourceClient.class);

  private final RequestExecutor executor;
  private final KeySequencer keys;
  private final TypeSchemaGenerator schemas;

  /**
   * @param host base URL of the service, e.g. {@code http://127.0.0.1:8080}
   * @param options transport options, {@code null} for {@link SourceClientOptions#defaults()}
   * @throws ConfigException if the host is not a valid URL or the options are invalid
   */
  public SourceClient(String host, String user, String password, SourceClientOptions options) {
    this(host, user, password, options, RetryPolicy.defaults());
  }

  public SourceClient(
      String host,
      String user,
      String password,
      SourceClientOptions options,
      RetryPolicy retryPolicy) {
    this(
        new RequestExecutor(
            host, OkHttpFactory.create(user, password, checked(options), retryPolicy)),
        new KeySequencer(),
        new TypeSchemaGenerator());
  }

  public SourceClient(
      RequestExecutor executor, KeySequencer keys, TypeSchemaGenerator schemas) {
    this.executor = Objects.requireNonNull(executor, "executor");
    this.keys = Objects.requireNonNull(keys, "keys");
    this.schemas = Objects.requireNonNull(schemas, "schemas");
  }

  /**
   * Builds a client from the {@code source.*} keys of a configuration, see {@link
   * ConfigurationProvider}. Logging levels under {@code logging.level} are applied as well.
   *
   * @throws ConfigException if {@code source.host} is missing or a value is invalid
   */
  public static SourceClient fromConfiguration(Configuration cfg) {
    LoggingService.applyConfiguration(cfg);
    String host = cfg.getString("source.host", null);
    if (host == null || host.isBlank()) {
      throw new ConfigException("source.host is required");
    }
    SourceClientOptions defaults = SourceClientOptions.defaults();
    SourceClientOptions options =
        new SourceClientOptions(
            cfg.getBoolean("source.insecureTransport", defaults.isInsecureTransport()),
            Duration.ofSeconds(
                cfg.getLong(
                    "source.requestTimeout", defaults.getRequestTimeout().toSeconds())));
    RetryPolicy retryPolicy;
    try {
      retryPolicy =
          new RetryPolicy(
              cfg.getInt("source.retry.maxAttempts", RetryPolicy.DEFAULT_MAX_ATTEMPTS),
              cfg.getLong("source.retry.baseDelayMs", RetryPolicy.DEFAULT_BASE_DELAY_MS),
              cfg.getLong("source.retry.maxDelayMs", RetryPolicy.DEFAULT_MAX_DELAY_MS),
              cfg.getDouble("source.retry.jitterFactor", RetryPolicy.DEFAULT_JITTER_FACTOR));
    } catch (IllegalArgumentException e) {
      throw new ConfigException("invalid source.retry configuration: " + e.getMessage(), e);
    }
    log.debug("Creating source client for {} with {} and {}", host, options, retryPolicy);
    return new SourceClient(
        host,
        cfg.getString("source.user", ""),
        cfg.getString("source.password", ""),
        options,
        retryPolicy);
  }

  private static SourceClientOptions checked(SourceClientOptions options) {
    SourceClientOptions opts = options == null ? SourceClientOptions.defaults() : options;
    try {
      opts.validate();
    } catch (ValidationException e) {
      throw new ConfigException("invalid client options: " + e.getMessage(), e);
    }
    return opts;
  }

  /**
   * Registers (or replaces) the item type {@code key}. The JSON schema is derived from the class of
   * {@code example}; the example's values are sent as the type's prototype.
   */
  public void registerType(String key, Object example) {
    TypeDescriptor descriptor = schemas.describe(key, example);
    executor.send(Route.REGISTER_TYPE, JacksonUtility.toJsonBytes(descriptor), null);
    log.debug("Registered type '{}'", key);
  }

  /**
   * Saves {@code item} under {@code key} as an item of type {@code itemType}.
   *
   * <p>The item validates itself first; a failing validation throws before any request is sent.
   * The item is serialized before dispatch, so later changes to it do not affect what is stored. If
   * {@code key} contains {@code ?}, the first one is replaced with a UTC timestamp (see {@link
   * KeySequencer}).
   *
   * @return the key the item was stored under
   * @throws ValidationException if the item rejects its own state
   * @throws UsageException if the item is null or a reference holder, or the type is blank
   */
  public String save(String key, String itemType, Validatable item) {
    Prototypes.requireOwnedValue(item, "save()");
    item.validate();
    if (itemType == null || itemType.isEmpty()) {
      throw new UsageException("item type is required to validate the item data");
    }
    requireKey(key, "save()");
    String resolved = keys.resolve(key);
    byte[] body = JacksonUtility.toJsonBytes(item);
    executor.send(Route.SAVE_ITEM, body, itemType, resolved);
    log.debug("Saved item '{}' of type '{}'", resolved, itemType);
    return resolved;
  }

  /** Raw item stored under {@code key}. */
  public Item loadRaw(String key) {
    requireKey(key, "loadRaw()");
    return JacksonUtility.fromJson(executor.fetch(Route.LOAD_ITEM, key), Item.class);
  }

  /** Item stored under {@code key}, decoded into {@code prototype}. */
  public <T> T load(String key, T prototype) {
    Prototypes.requireWritable(prototype, "load()");
    return loadRaw(key).typed(prototype);
  }

  /** Item stored under {@code key}, decoded into a new instance of {@code type}. */
  public <T> T load(String key, Class<T> type) {
    return loadRaw(key).typed(type);
  }

  public void delete(String key) {
    requireKey(key, "delete()");
    executor.send(Route.DELETE_ITEM, key);
  }

  /** Items carrying any of {@code tags}; each tag is {@code name} or {@code name|value}. */
  public ItemList loadItemsByTagRaw(String... tags) {
    if (tags == null || tags.length == 0) {
      throw new UsageException("at least one tag is required");
    }
    return list(executor.fetch(Route.ITEMS_BY_TAG, String.join("|", tags)));
  }

  public <T> List<T> loadItemsByTag(Supplier<T> factory, String... tags) {
    return loadItemsByTagRaw(tags).typed(factory);
  }

  public ItemList loadItemsByTypeRaw(String itemType) {
    requireKey(itemType, "loadItemsByTypeRaw()");
    return list(executor.fetch(Route.ITEMS_BY_TYPE, itemType));
  }

  public <T> List<T> loadItemsByType(Supplier<T> factory, String itemType) {
    return loadItemsByTypeRaw(itemType).typed(factory);
  }

  /** Removes and returns the oldest item of {@code itemType}, or empty if there is none. */
  public Optional<Item> popOldestRaw(String itemType) {
    return pop(Route.POP_OLDEST, itemType);
  }

  public <T> Optional<T> popOldest(String itemType, T prototype) {
    Prototypes.requireWritable(prototype, "popOldest()");
    return popOldestRaw(itemType).map(item -> item.typed(prototype));
  }

  /** Removes and returns the newest item of {@code itemType}, or empty if there is none. */
  public Optional<Item> popNewestRaw(String itemType) {
    return pop(Route.POP_NEWEST, itemType);
  }

  public <T> Optional<T> popNewest(String itemType, T prototype) {
    Prototypes.requireWritable(prototype, "popNewest()");
    return popNewestRaw(itemType).map(item -> item.typed(prototype));
  }

  private Optional<Item> pop(Route route, String itemType) {
    requireKey(itemType, route.action());
    return executor
        .fetchIfPresent(route, itemType)
        .map(body -> JacksonUtility.fromJson(body, Item.class));
  }

  /** Items linked from {@code key}. */
  public ItemList loadChildrenRaw(String key) {
    requireKey(key, "loadChildrenRaw()");
    return list(executor.fetch(Route.CHILDREN, key));
  }

  public <T> List<T> loadChildren(Supplier<T> factory, String key) {
    return loadChildrenRaw(key).typed(factory);
  }

  /** Items linking to {@code key}. */
  public ItemList loadParentsRaw(String key) {
    requireKey(key, "loadParentsRaw()");
    return list(executor.fetch(Route.PARENTS, key));
  }

  public <T> List<T> loadParents(Supplier<T> factory, String key) {
    return loadParentsRaw(key).typed(factory);
  }

  /**
   * Attaches a tag to an item.
   *
   * @param value optional; when empty only the name is attached
   * @throws UsageException if {@code name} is empty
   */
  public void tag(String itemKey, String name, String value) {
    Tag tag = new Tag(itemKey, name, value);
    requireKey(itemKey, "tag()");
    executor.send(Route.TAG_ITEM, tag.itemKey(), tag.routeSegment());
  }

  /**
   * Removes the tag {@code name} from an item.
   *
   * @throws UsageException if {@code name} is empty
   */
  public void untag(String itemKey, String name) {
    Tag tag = Tag.of(itemKey, name);
    requireKey(itemKey, "untag()");
    executor.send(Route.UNTAG_ITEM, tag.itemKey(), tag.name());
  }

  /** Makes {@code toKey} a child of {@code fromKey}. */
  public void link(String fromKey, String toKey) {
    Link link = link(fromKey, toKey, "link()");
    executor.send(Route.LINK, link.from(), link.to());
  }

  public void unlink(String fromKey, String toKey) {
    Link link = link(fromKey, toKey, "unlink()");
    executor.send(Route.UNLINK, link.from(), link.to());
  }

  private static Link link(String fromKey, String toKey, String operation) {
    requireKey(fromKey, operation);
    requireKey(toKey, operation);
    return new Link(fromKey, toKey);
  }

  private static ItemList list(byte[] body) {
    ItemList items = body.length == 0 ? null : JacksonUtility.fromJson(body, ItemList.class);
    // the service answers "null" when nothing matches
    return items == null ? ItemList.empty() : items;
  }

  private static void requireKey(String key, String operation) {
    if (key == null || key.isEmpty()) {
      throw new UsageException("a key is required by " + operation);
    }
  }

  @Override
  public void close() {
    executor.close();
  }
}
