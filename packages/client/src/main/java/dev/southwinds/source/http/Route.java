package dev.southwinds.source.http;

import dev.southwinds.source.exception.UsageException;
import okhttp3.HttpUrl;

/**
 * Routes of the source service. Templates are host-relative; each {@code {}} segment is filled
 * with one positional argument, percent-encoded as a single path segment.
 */
public enum Route {
  REGISTER_TYPE("PUT", "type", "set type"),
  SAVE_ITEM("PUT", "item/{}", "save item"),
  LOAD_ITEM("GET", "item/{}", "get item"),
  DELETE_ITEM("DELETE", "item/{}", "delete item"),
  POP_OLDEST("DELETE", "item/pop/oldest/{}", "pop oldest item"),
  POP_NEWEST("DELETE", "item/pop/newest/{}", "pop newest item"),
  ITEMS_BY_TAG("GET", "item/tag/{}", "get tagged items"),
  ITEMS_BY_TYPE("GET", "item/type/{}", "get items for type"),
  CHILDREN("GET", "item/{}/children", "get children for item"),
  PARENTS("GET", "item/{}/parents", "get parents for item"),
  TAG_ITEM("PUT", "item/{}/tag/{}", "tag item"),
  UNTAG_ITEM("DELETE", "item/{}/tag/{}", "untag item"),
  LINK("PUT", "link/{}/to/{}", "link items"),
  UNLINK("DELETE", "link/{}/to/{}", "unlink items");

  private static final String PARAM = "{}";

  private final String method;
  private final String[] segments;
  private final String action;

  Route(String method, String template, String action) {
    this.method = method;
    this.segments = template.split("/");
    this.action = action;
  }

  public String method() {
    return method;
  }

  /** Human readable verb phrase used in error messages, e.g. {@code "save item"}. */
  public String action() {
    return action;
  }

  public int arity() {
    int n = 0;
    for (String s : segments) if (PARAM.equals(s)) n++;
    return n;
  }

  /**
   * Resolves the route against {@code host}, keeping any path prefix the host already carries.
   *
   * @throws UsageException if the argument count does not match or an argument is null
   */
  public HttpUrl url(HttpUrl host, String... args) {
    if (args.length != arity()) {
      throw new UsageException(
          "route %s expects %d argument(s), got %d".formatted(name(), arity(), args.length));
    }
    HttpUrl.Builder builder = host.newBuilder();
    int next = 0;
    for (String segment : segments) {
      if (PARAM.equals(segment)) {
        String arg = args[next++];
        if (arg == null) {
          throw new UsageException("null path argument for route " + name());
        }
        builder.addPathSegment(arg);
      } else {
        builder.addPathSegment(segment);
      }
    }
    return builder.build();
  }
}
