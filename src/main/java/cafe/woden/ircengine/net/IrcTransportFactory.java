package cafe.woden.ircengine.net;

import java.io.IOException;

/** Opens transports; a returned transport is connected and, for TLS, already handshaken. */
@FunctionalInterface
public interface IrcTransportFactory {

  IrcTransport open(String host, int port, boolean tls) throws IOException;
}
