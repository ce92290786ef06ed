package cafe.woden.ircwire.net;

import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * A server address with the protocol default port applied.
 *
 * <p>Accepted forms: {@code host}, {@code host:port}, {@code [v6addr]}, {@code [v6addr]:port} and a
 * bare IPv6 literal (more than one colon, no brackets, never carries a port).
 */
@ValueObject
public record IrcAddress(String host, int port, boolean explicitPort) {

  public static final int DEFAULT_PORT = 6667;
  public static final int DEFAULT_TLS_PORT = 6697;

  public IrcAddress {
    host = Objects.requireNonNull(host, "host").trim();
    if (host.isEmpty()) throw new IllegalArgumentException("host is blank");
    if (port <= 0 || port > 65535) {
      throw new IllegalArgumentException("port out of range: " + port);
    }
  }

  public static int defaultPort(boolean tls) {
    return tls ? DEFAULT_TLS_PORT : DEFAULT_PORT;
  }

  /**
   * Parse {@code address}, appending {@link #DEFAULT_PORT} or {@link #DEFAULT_TLS_PORT} only when
   * no port was given.
   */
  public static IrcAddress parse(String address, boolean tls) {
    String s = (address == null) ? "" : address.trim();
    if (s.isEmpty()) throw new IllegalArgumentException("address is blank");

    if (s.startsWith("[")) {
      int close = s.indexOf(']');
      if (close < 0) throw new IllegalArgumentException("unterminated IPv6 literal: " + address);
      String host = s.substring(1, close);
      String tail = s.substring(close + 1);
      if (tail.isEmpty()) return new IrcAddress(host, defaultPort(tls), false);
      if (!tail.startsWith(":")) throw new IllegalArgumentException("unexpected text after ']': " + address);
      return new IrcAddress(host, parsePort(tail.substring(1), address), true);
    }

    int first = s.indexOf(':');
    if (first < 0) return new IrcAddress(s, defaultPort(tls), false);
    if (s.indexOf(':', first + 1) >= 0) {
      // Bare IPv6 literal.
      return new IrcAddress(s, defaultPort(tls), false);
    }
    return new IrcAddress(s.substring(0, first), parsePort(s.substring(first + 1), address), true);
  }

  private static int parsePort(String raw, String address) {
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("invalid port in address: " + address, e);
    }
  }

  /** {@code host:port}, bracketing IPv6 literals. */
  @Override
  public String toString() {
    return (host.indexOf(':') >= 0 ? "[" + host + "]" : host) + ":" + port;
  }
}
