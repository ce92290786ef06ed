package cafe.woden.ircwire.irc;

import java.time.Instant;

/** Why a session stopped. The first token recorded for a session wins. */
public sealed interface SessionEnd permits SessionEnd.Quit, SessionEnd.ConnectionLost {

  Instant at();

  /** Shutdown was requested. */
  record Quit(Instant at, String reason) implements SessionEnd {}

  /**
   * The connection died underneath the session; {@code source} names the loop that noticed
   * ({@code "read"}, {@code "write"} or {@code "setup"}).
   */
  record ConnectionLost(Instant at, String serverAddress, String source, Throwable cause)
      implements SessionEnd {}
}
