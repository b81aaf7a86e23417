package cafe.woden.ircengine.net;

import cafe.woden.ircengine.config.IrcEngineProperties;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the current TLS settings for outbound IRC sockets.
 *
 * <p><b>WARNING:</b> trust-all disables certificate validation, which makes man-in-the-middle
 * attacks trivial. It exists for private servers with self-signed certificates.
 */
public final class NetTlsContext {

  private static final Logger log = LoggerFactory.getLogger(NetTlsContext.class);

  private static final IrcEngineProperties.Client.Tls DEFAULT =
      new IrcEngineProperties.Client.Tls(false);

  private static volatile IrcEngineProperties.Client.Tls settings = DEFAULT;

  private static final AtomicReference<SSLSocketFactory> TRUST_ALL_SSL = new AtomicReference<>();

  private NetTlsContext() {}

  public static void configure(IrcEngineProperties.Client.Tls cfg) {
    settings = cfg == null ? DEFAULT : cfg;
  }

  public static boolean trustAllCertificates() {
    IrcEngineProperties.Client.Tls s = settings;
    return s != null && s.trustAllCertificates();
  }

  /** Factory for outbound TLS sockets; validates certificates unless trust-all is on. */
  public static SSLSocketFactory sslSocketFactory() {
    SSLSocketFactory defaults = (SSLSocketFactory) SSLSocketFactory.getDefault();
    if (!trustAllCertificates()) return defaults;

    SSLSocketFactory existing = TRUST_ALL_SSL.get();
    if (existing != null) return existing;

    SSLSocketFactory created = buildTrustAllSslFactory();
    if (created == null) return defaults;

    TRUST_ALL_SSL.compareAndSet(null, created);
    return TRUST_ALL_SSL.get();
  }

  private static SSLSocketFactory buildTrustAllSslFactory() {
    try {
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

      SSLContext ctx = SSLContext.getInstance("TLS");
      ctx.init(null, trustAll, new SecureRandom());
      return Objects.requireNonNull(ctx.getSocketFactory());
    } catch (Exception e) {
      log.warn("Could not build trust-all TLS factory; using default certificate validation", e);
      return null;
    }
  }
}
