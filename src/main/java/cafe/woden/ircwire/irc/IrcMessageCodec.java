package cafe.woden.ircwire.irc;

import java.util.ArrayList;
import java.util.List;

/**
 * Pure framing/parsing of protocol lines.
 *
 * <p>Grammar: {@code [":" prefix " "] command *(" " middle) [" :" trailing]}, CRLF terminated on
 * the wire. No state, no I/O.
 */
public final class IrcMessageCodec {

  public static final String CRLF = "\r\n";

  private IrcMessageCodec() {}

  /**
   * Parse one wire line.
   *
   * <p>A trailing CR/LF terminator is tolerated and stripped. Leading IRCv3 message tags
   * ({@code "@aaa=bbb;ccc "}) are skipped; they carry nothing this client acts on.
   *
   * @throws IrcParseException for an empty line or a line without a command token
   */
  public static IrcMessage parse(String raw) throws IrcParseException {
    if (raw == null) throw new IrcParseException("null line", "");
    String line = stripTerminator(raw);
    if (line.isEmpty()) throw new IrcParseException("empty line", line);

    int pos = 0;
    if (line.charAt(0) == '@') {
      int sp = line.indexOf(' ');
      if (sp < 0) throw new IrcParseException("message tags without command", line);
      pos = skipSpaces(line, sp);
    }

    String prefix = null;
    if (pos < line.length() && line.charAt(pos) == ':') {
      int sp = line.indexOf(' ', pos);
      if (sp < 0) throw new IrcParseException("prefix without command", line);
      prefix = line.substring(pos + 1, sp);
      if (prefix.isEmpty()) throw new IrcParseException("empty prefix", line);
      pos = skipSpaces(line, sp);
    }

    String rest = line.substring(pos);
    if (rest.isEmpty() || rest.charAt(0) == ':') {
      throw new IrcParseException("missing command", line);
    }

    String trailing = null;
    int t = rest.indexOf(" :");
    if (t >= 0) {
      trailing = rest.substring(t + 2);
      rest = rest.substring(0, t);
    }

    List<String> tokens = new ArrayList<>();
    for (String token : rest.split(" ")) {
      if (!token.isEmpty()) tokens.add(token);
    }
    if (tokens.isEmpty()) throw new IrcParseException("missing command", line);

    String command = tokens.get(0);
    return new IrcMessage(prefix, command, tokens.subList(1, tokens.size()), trailing);
  }

  /** The line for {@code message} without the CRLF terminator. */
  public static String format(IrcMessage message) {
    StringBuilder sb = new StringBuilder(64);
    if (message.prefix() != null) {
      sb.append(':').append(message.prefix()).append(' ');
    }
    sb.append(message.command());
    for (String p : message.params()) {
      sb.append(' ').append(p);
    }
    if (message.trailing() != null) {
      sb.append(" :").append(message.trailing());
    }
    return sb.toString();
  }

  /** The wire form of {@code message}, CRLF terminated. */
  public static String serialize(IrcMessage message) {
    return format(message) + CRLF;
  }

  /** Appends CRLF unless the line already ends with it. */
  public static String terminate(String line) {
    String s = (line == null) ? "" : line;
    return s.endsWith(CRLF) ? s : s + CRLF;
  }

  /**
   * Keep-alive reply for a {@code PING}: same arguments, verbatim, under {@code PONG}.
   *
   * @return the reply line (no terminator), or {@code null} if {@code message} is not a PING
   */
  public static String pongFor(IrcMessage message) {
    if (message == null || !message.isCommand("PING")) return null;
    return format(new IrcMessage(null, "PONG", message.params(), message.trailing()));
  }

  private static String stripTerminator(String s) {
    int end = s.length();
    while (end > 0) {
      char c = s.charAt(end - 1);
      if (c == '\n' || c == '\r') end--;
      else break;
    }
    return s.substring(0, end);
  }

  private static int skipSpaces(String s, int from) {
    int i = from;
    while (i < s.length() && s.charAt(i) == ' ') i++;
    return i;
  }
}
