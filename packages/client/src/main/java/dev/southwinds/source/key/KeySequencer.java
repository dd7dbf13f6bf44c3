package dev.southwinds.source.key;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Resolves wildcard key patterns into time-ordered keys.
 *
 * <p>The first {@code ?} of a pattern is replaced with the current UTC time formatted as {@code
 * yyyyMMddHHmmss.SSS}; any further {@code ?} is kept verbatim. Because the suffix sorts
 * lexicographically in time order, keys generated from the same pattern sort chronologically.
 * Two resolutions within the same millisecond produce the same key.
 */
public final class KeySequencer {
  public static final char WILDCARD = '?';

  private static final DateTimeFormatter SEQUENCE_FORMAT =
      DateTimeFormatter.ofPattern("yyyyMMddHHmmss.SSS").withZone(ZoneOffset.UTC);

  private final Clock clock;

  public KeySequencer() {
    this(Clock.systemUTC());
  }

  public KeySequencer(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /** Returns {@code pattern} with its first wildcard replaced, or unchanged if it has none. */
  public String resolve(String pattern) {
    int idx = pattern.indexOf(WILDCARD);
    if (idx < 0) {
      return pattern;
    }
    return pattern.substring(0, idx)
        + SEQUENCE_FORMAT.format(clock.instant())
        + pattern.substring(idx + 1);
  }
}
