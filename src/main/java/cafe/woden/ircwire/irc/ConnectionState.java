package cafe.woden.ircwire.irc;

/**
 * Lifecycle of an {@link IrcClient}.
 *
 * <p>{@code DISCONNECTED -> CONNECTING -> CONNECTED -> (RECONNECT_PENDING | CLOSING) -> ...}.
 * A failed connect goes straight back to {@code DISCONNECTED}; {@code CLOSING} ends in a
 * terminal {@code DISCONNECTED}.
 */
public enum ConnectionState {
  DISCONNECTED,
  CONNECTING,
  CONNECTED,
  RECONNECT_PENDING,
  CLOSING
}
