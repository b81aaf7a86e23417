package cafe.woden.ircengine.net;

import cafe.woden.ircengine.config.IrcEngineProperties;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSocket;
import org.springframework.stereotype.Component;

/**
 * Plain TCP or TLS sockets.
 *
 * <p>TLS is layered over an already connected socket and the handshake is forced here, so a bad
 * certificate fails {@link #open} rather than the first write. Unless every certificate is
 * trusted, the certificate must also match the host name that was dialed.
 */
@Component
public class SocketIrcTransportFactory implements IrcTransportFactory {

  private final boolean tcpNoDelay;

  public SocketIrcTransportFactory(IrcEngineProperties props) {
    this.tcpNoDelay = props == null || props.client().tcpNoDelay();
  }

  @Override
  public IrcTransport open(String host, int port, boolean tls) throws IOException {
    Socket socket = new Socket();
    try {
      socket.setTcpNoDelay(tcpNoDelay);
      socket.connect(new InetSocketAddress(host, port));
      if (!tls) return new SocketTransport(socket);

      SSLSocket ssl =
          (SSLSocket) NetTlsContext.sslSocketFactory().createSocket(socket, host, port, true);
      verifyHostname(ssl, !NetTlsContext.trustAllCertificates());
      ssl.startHandshake();
      return new SocketTransport(ssl);
    } catch (IOException | RuntimeException e) {
      try {
        socket.close();
      } catch (IOException closeError) {
        e.addSuppressed(closeError);
      }
      throw e;
    }
  }

  /** Makes the handshake check that the certificate was issued for the host we dialed. */
  static void verifyHostname(SSLSocket ssl, boolean enabled) {
    if (!enabled) return;
    SSLParameters params = ssl.getSSLParameters();
    params.setEndpointIdentificationAlgorithm("HTTPS");
    ssl.setSSLParameters(params);
  }

  static final class SocketTransport implements IrcTransport {
    private final Socket socket;
    private final BufferedReader reader;
    private final BufferedWriter writer;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    SocketTransport(Socket socket) throws IOException {
      this.socket = socket;
      this.reader =
          new BufferedReader(
              new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
      this.writer =
          new BufferedWriter(
              new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));
    }

    @Override
    public String readLine() throws IOException {
      return reader.readLine();
    }

    @Override
    public void writeLine(String line) throws IOException {
      writer.write(line);
      writer.write("\r\n");
      writer.flush();
    }

    @Override
    public void close() throws IOException {
      if (closed.compareAndSet(false, true)) {
        socket.close();
      }
    }
  }
}
