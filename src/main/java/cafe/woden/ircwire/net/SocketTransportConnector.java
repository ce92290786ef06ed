package cafe.woden.ircwire.net;

import cafe.woden.ircwire.config.IrcProperties;
import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Objects;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Plain TCP or TCP+TLS connector built on {@link Socket}. */
public class SocketTransportConnector implements TransportConnector {

  private static final Logger log = LoggerFactory.getLogger(SocketTransportConnector.class);

  private final IrcProperties.Client.Tls tlsSettings;
  private final Duration connectTimeout;
  private final Duration readTimeout;

  public SocketTransportConnector(
      IrcProperties.Client.Tls tlsSettings, Duration connectTimeout, Duration readTimeout) {
    this.tlsSettings = NetTlsContext.normalize(tlsSettings);
    this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
    this.readTimeout = Objects.requireNonNull(readTimeout, "readTimeout");
  }

  public SocketTransportConnector(IrcProperties.Client client) {
    this(
        client.tls(),
        Duration.ofMillis(client.socket().connectTimeoutMs()),
        Duration.ofMillis(client.socket().readTimeoutMs()));
  }

  @Override
  public IrcTransport open(IrcAddress address, boolean tls) throws IrcConnectionException {
    Objects.requireNonNull(address, "address");
    String target = address.toString();

    InetAddress resolved;
    try {
      resolved = InetAddress.getByName(address.host());
    } catch (UnknownHostException e) {
      throw new IrcConnectionException(IrcConnectionException.Stage.RESOLVE, target, "unknown host", e);
    }

    Socket tcp = new Socket();
    try {
      tcp.connect(new InetSocketAddress(resolved, address.port()), toTimeoutMillis(connectTimeout));
      tcp.setSoTimeout(toTimeoutMillis(readTimeout));
      tcp.setKeepAlive(true);
      tcp.setTcpNoDelay(true);
    } catch (IOException | RuntimeException e) {
      closeQuietly(tcp, target);
      throw new IrcConnectionException(IrcConnectionException.Stage.DIAL, target, e.getMessage(), e);
    }

    if (!tls) {
      log.info("[ircwire] Connected to {}", target);
      return new SocketTransport(tcp);
    }

    SSLSocket ssl = null;
    try {
      SSLSocketFactory factory = NetTlsContext.sslSocketFactory(tlsSettings);
      ssl = (SSLSocket) factory.createSocket(tcp, address.host(), address.port(), true);
      NetTlsContext.applyEndpointIdentification(ssl, tlsSettings);
      ssl.setUseClientMode(true);
      ssl.startHandshake();
    } catch (IOException | RuntimeException e) {
      closeQuietly(ssl != null ? ssl : tcp, target);
      throw new IrcConnectionException(IrcConnectionException.Stage.HANDSHAKE, target, e.getMessage(), e);
    }

    log.info("[ircwire] Connected to {} (TLS {}{})",
        target,
        ssl.getSession().getProtocol(),
        tlsSettings.trustAllCertificates() ? ", certificate checks disabled" : "");
    return new SocketTransport(ssl);
  }

  /** 0 keeps its "no timeout" meaning; anything past the int range saturates. */
  static int toTimeoutMillis(Duration d) {
    long ms = d.toMillis();
    if (ms <= 0) return 0;
    return (int) Math.min(ms, Integer.MAX_VALUE);
  }

  private static void closeQuietly(Socket socket, String target) {
    try {
      socket.close();
    } catch (IOException e) {
      log.debug("[ircwire] Failed to close socket for {} after connect failure", target, e);
    }
  }
}
