package cafe.woden.ircwire.net;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * An open, full-duplex byte stream to a server.
 *
 * <p>The read side and the write side are used by different threads at the same time; an
 * implementation must allow that without extra locking.
 */
public interface IrcTransport extends Closeable {

  InputStream input() throws IOException;

  OutputStream output() throws IOException;

  /** Half-close: no more writes, the peer sees end-of-stream. Reads continue to work. */
  void shutdownOutput() throws IOException;

  boolean isOpen();

  /** Idempotent. Unblocks a thread blocked reading {@link #input()}. */
  @Override
  void close() throws IOException;
}
