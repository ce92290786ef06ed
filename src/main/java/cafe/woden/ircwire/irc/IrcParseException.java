package cafe.woden.ircwire.irc;

/** A wire line that does not follow {@code [":" prefix " "] command *(" " middle) [" :" trailing]}. */
public class IrcParseException extends Exception {

  private final String line;

  public IrcParseException(String message, String line) {
    super(message + ": \"" + line + "\"");
    this.line = line;
  }

  /** The offending line as received (without the CRLF terminator). */
  public String line() {
    return line;
  }
}
