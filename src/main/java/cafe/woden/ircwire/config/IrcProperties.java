package cafe.woden.ircwire.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * IRC connection configuration.
 *
 * <p>Example YAML:
 * <pre>
 * irc:
 *   client:
 *     tls:
 *       trust-all-certificates: false
 *     socket:
 *       read-timeout-ms: 300000
 *   server:
 *     address: irc.libera.chat
 *     tls: true
 *     nick: ircwire
 * </pre>
 */
@ConfigurationProperties(prefix = "irc")
public record IrcProperties(Client client, Server server) {

  /** Client-wide settings shared by every connection. */
  public record Client(
      String version,
      String quitMessage,
      Tls tls,
      Socket socket,
      Outbound outbound,
      Reconnect reconnect
  ) {

    /**
     * TLS settings for outbound connections.
     *
     * <p>{@code trustAllCertificates} disables certificate and hostname verification. Only meant for
     * self-signed test servers.
     */
    public record Tls(boolean trustAllCertificates) {
      public Tls {
        // default false
      }
    }

    public record Socket(long connectTimeoutMs, long readTimeoutMs, long quitGraceMs) {
      public Socket {
        if (connectTimeoutMs <= 0) connectTimeoutMs = 20_000;
        // 0 means "block until the peer speaks or the socket dies".
        if (readTimeoutMs < 0) readTimeoutMs = 0;
        if (quitGraceMs <= 0) quitGraceMs = 2_000;
        // Socket timeouts are ints.
        connectTimeoutMs = Math.min(connectTimeoutMs, Integer.MAX_VALUE);
        readTimeoutMs = Math.min(readTimeoutMs, Integer.MAX_VALUE);
        quitGraceMs = Math.min(quitGraceMs, Integer.MAX_VALUE);
      }
    }

    public record Outbound(int queueCapacity) {
      public Outbound {
        if (queueCapacity <= 0) queueCapacity = 1_024;
        if (queueCapacity < 16) queueCapacity = 16;
        if (queueCapacity > 1_000_000) queueCapacity = 1_000_000;
      }
    }

    public Client {
      if (version == null || version.isBlank()) {
        version = "ircwire";
      }
      if (quitMessage == null || quitMessage.isBlank()) {
        quitMessage = "Bye";
      }
      if (tls == null) {
        tls = new Tls(false);
      }
      if (socket == null) {
        socket = new Socket(20_000, 0, 2_000);
      }
      if (outbound == null) {
        outbound = new Outbound(1_024);
      }
      if (reconnect == null) {
        reconnect = new Reconnect(true, 1_000, 120_000, 2.0, 0.20, 0);
      }
    }
  }

  public record Reconnect(
      boolean enabled,
      long initialDelayMs,
      long maxDelayMs,
      double multiplier,
      double jitterPct,
      int maxAttempts
  ) {
    public Reconnect {
      if (initialDelayMs <= 0) initialDelayMs = 1_000;
      if (maxDelayMs <= 0) maxDelayMs = 120_000;
      if (maxDelayMs < initialDelayMs) maxDelayMs = initialDelayMs;
      if (multiplier < 1.1) multiplier = 2.0;
      if (jitterPct < 0) jitterPct = 0;
      if (jitterPct > 0.75) jitterPct = 0.75;
      // maxAttempts == 0 means "infinite".
      if (maxAttempts < 0) maxAttempts = 0;
    }
  }

  /**
   * The server to talk to.
   *
   * <p>{@code address} is {@code host} or {@code host:port}; without a port the protocol default
   * (6667, or 6697 with TLS) is used. When {@code nick} is blank no registration is sent.
   */
  public record Server(
      String address,
      boolean tls,
      String password,
      String nick,
      String username,
      String realName,
      boolean autoConnect
  ) {
    public Server {
      if (address == null) address = "";
      if (password == null) password = "";
      if (nick == null) nick = "";
      if (username == null || username.isBlank()) username = nick;
      if (realName == null || realName.isBlank()) realName = nick;
      if (autoConnect && address.isBlank()) {
        throw new IllegalArgumentException("irc.server.auto-connect=true but address is blank");
      }
    }
  }

  public IrcProperties {
    if (client == null) {
      client = new Client(null, null, null, null, null, null);
    }
    if (server == null) {
      server = new Server("", false, "", "", "", "", false);
    }
  }
}
