package cafe.woden.ircwire.net;

import java.io.IOException;

/**
 * Establishing a connection failed. Never retried by the code that throws it.
 */
public class IrcConnectionException extends IOException {

  public enum Stage {
    RESOLVE,
    DIAL,
    HANDSHAKE,
    REGISTER
  }

  private final Stage stage;
  private final String address;

  public IrcConnectionException(Stage stage, String address, String message, Throwable cause) {
    super(stage + " failed for " + address + ": " + message, cause);
    this.stage = stage;
    this.address = address;
  }

  public Stage stage() {
    return stage;
  }

  public String address() {
    return address;
  }
}
