package cafe.woden.ircwire.net;

/**
 * Opens the transport for one connection attempt.
 *
 * <p>Exactly one attempt per call: implementations never retry.
 */
public interface TransportConnector {

  /**
   * Dial {@code address}; when {@code tls} is set, complete the TLS handshake before returning.
   *
   * @throws IrcConnectionException on resolve, dial or handshake failure
   */
  IrcTransport open(IrcAddress address, boolean tls) throws IrcConnectionException;
}
