package dev.southwinds.source.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The source service answered with a non-success status. Carries the status code, the status line
 * and, when the service sent one, the response body as diagnostic detail.
 */
public class RemoteException extends SourceException {
  private final int status;
  private final String statusLine;
  private final String body;

  public RemoteException(String action, int status, String statusLine, String body) {
    super(
        SourceErrorCode.REMOTE_ERROR,
        message(action, statusLine, body),
        context(status, body));
    this.status = status;
    this.statusLine = statusLine;
    this.body = body;
  }

  public int getStatus() {
    return status;
  }

  public String getStatusLine() {
    return statusLine;
  }

  /** Response body text, or {@code null} when the service sent none. */
  public String getBody() {
    return body;
  }

  private static String message(String action, String statusLine, String body) {
    String msg = "cannot %s, source server responded with: %s".formatted(action, statusLine);
    return body == null || body.isEmpty() ? msg : msg + ", " + body;
  }

  private static Map<String, Object> context(int status, String body) {
    Map<String, Object> ctx = new LinkedHashMap<>();
    ctx.put("status", status);
    if (body != null && !body.isEmpty()) ctx.put("body", body);
    return ctx;
  }
}
