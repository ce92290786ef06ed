package cafe.woden.ircwire.net;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.util.Objects;
import javax.net.ssl.SSLSocket;

/** {@link IrcTransport} over a connected (optionally TLS) {@link Socket}. */
public final class SocketTransport implements IrcTransport {

  private final Socket socket;

  public SocketTransport(Socket socket) {
    this.socket = Objects.requireNonNull(socket, "socket");
  }

  @Override
  public InputStream input() throws IOException {
    return socket.getInputStream();
  }

  @Override
  public OutputStream output() throws IOException {
    return socket.getOutputStream();
  }

  @Override
  public void shutdownOutput() throws IOException {
    if (socket.isClosed()) return;
    if (socket instanceof SSLSocket) {
      // SSLSocket does not support half-close; the coordinator closes it after the quit grace.
      socket.getOutputStream().flush();
      return;
    }
    if (!socket.isOutputShutdown()) socket.shutdownOutput();
  }

  @Override
  public boolean isOpen() {
    return socket.isConnected() && !socket.isClosed();
  }

  @Override
  public void close() throws IOException {
    socket.close();
  }

  public Socket socket() {
    return socket;
  }

  @Override
  public String toString() {
    return "SocketTransport[" + socket.getRemoteSocketAddress() + (socket instanceof SSLSocket ? ", tls" : "") + "]";
  }
}
