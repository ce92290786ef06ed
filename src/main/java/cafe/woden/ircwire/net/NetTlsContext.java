package cafe.woden.ircwire.net;

import cafe.woden.ircwire.config.IrcProperties;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;

/**
 * TLS socket factories for IRC-over-TLS.
 *
 * <p><b>WARNING:</b> trust-all disables certificate validation and hostname checks. This makes
 * man-in-the-middle attacks trivial. Only enable it for self-signed servers you control.
 */
public final class NetTlsContext {

  private static final IrcProperties.Client.Tls DEFAULT = new IrcProperties.Client.Tls(false);

  private static final AtomicReference<SSLSocketFactory> TRUST_ALL_SSL = new AtomicReference<>();

  private NetTlsContext() {}

  public static IrcProperties.Client.Tls normalize(IrcProperties.Client.Tls cfg) {
    return (cfg == null) ? DEFAULT : cfg;
  }

  /**
   * Returns the {@link SSLSocketFactory} to layer over a dialed TCP socket. When trust-all is
   * enabled, the factory does not validate certificates.
   */
  public static SSLSocketFactory sslSocketFactory(IrcProperties.Client.Tls cfg) {
    if (!normalize(cfg).trustAllCertificates()) {
      return (SSLSocketFactory) SSLSocketFactory.getDefault();
    }

    SSLSocketFactory existing = TRUST_ALL_SSL.get();
    if (existing != null) return existing;

    TRUST_ALL_SSL.compareAndSet(null, buildTrustAllSslFactory());
    return TRUST_ALL_SSL.get();
  }

  /**
   * Verify the server name against its certificate during the handshake, unless trust-all is on.
   * {@link SSLSocketFactory} alone only validates the chain.
   */
  public static void applyEndpointIdentification(SSLSocket socket, IrcProperties.Client.Tls cfg) {
    if (normalize(cfg).trustAllCertificates()) return;
    SSLParameters params = socket.getSSLParameters();
    params.setEndpointIdentificationAlgorithm("HTTPS");
    socket.setSSLParameters(params);
  }

  private static SSLSocketFactory buildTrustAllSslFactory() {
    TrustManager[] trustAll =
        new TrustManager[] {
          new X509TrustManager() {
            @Override
            public void checkClientTrusted(X509Certificate[] chain, String authType) {
              // trust all
            }

            @Override
            public void checkServerTrusted(X509Certificate[] chain, String authType) {
              // trust all
            }

            @Override
            public X509Certificate[] getAcceptedIssuers() {
              return new X509Certificate[0];
            }
          }
        };

    try {
      SSLContext ctx = SSLContext.getInstance("TLS");
      ctx.init(null, trustAll, new SecureRandom());
      return Objects.requireNonNull(ctx.getSocketFactory());
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("TLS is not available in this JVM", e);
    }
  }
}
