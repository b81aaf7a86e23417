package cafe.woden.ircengine.net;

import java.io.Closeable;
import java.io.IOException;

/**
 * An open, line-oriented connection to an IRC server.
 *
 * <p>Reads and writes come from different threads: one reader, one writer. {@link #close()} may be
 * called from either and unblocks a pending read.
 */
public interface IrcTransport extends Closeable {

  /** Next line without its terminator, or null on clean EOF. */
  String readLine() throws IOException;

  /** Writes {@code line} followed by CRLF and flushes immediately. */
  void writeLine(String line) throws IOException;

  /** Idempotent. */
  @Override
  void close() throws IOException;
}
