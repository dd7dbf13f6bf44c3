package dev.southwinds.source;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/** Client version, read from the build-filtered {@code source-client-version.properties}. */
public final class Version {
  private static final org.slf4j.Logger log =
      dev.southwinds.source.logging.LoggingService.getLogger(Version.class);

  public static final String VERSION = load();

  public static final String USER_AGENT = "SW-SOURCE-CLIENT-" + VERSION;

  private Version() {}

  private static String load() {
    try (InputStream in = Version.class.getResourceAsStream("/source-client-version.properties")) {
      if (in == null) return "dev";
      Properties props = new Properties();
      props.load(in);
      String v = props.getProperty("version", "dev");
      // unfiltered resource (e.g. running from an IDE)
      return v.startsWith("${") ? "dev" : v;
    } catch (IOException e) {
      log.warn("Cannot read client version; reporting 'dev'", e);
      return "dev";
    }
  }
}
