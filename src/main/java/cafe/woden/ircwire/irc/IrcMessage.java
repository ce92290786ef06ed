package cafe.woden.ircwire.irc;

import java.util.List;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * One decoded protocol line.
 *
 * <p>{@code prefix} and {@code trailing} are {@code null} when absent. An empty trailing parameter
 * ({@code "TOPIC #chan :"}) is present and empty, which is not the same as no trailing parameter.
 * Middle parameters are single tokens; anything empty, containing a space or starting with
 * {@code ':'} belongs in {@code trailing}.
 */
@ValueObject
public record IrcMessage(String prefix, String command, List<String> params, String trailing) {

  public IrcMessage {
    Objects.requireNonNull(command, "command");
    if (command.isBlank()) throw new IllegalArgumentException("command is blank");
    if (command.indexOf(' ') >= 0) throw new IllegalArgumentException("command contains a space");
    if (prefix != null && (prefix.isEmpty() || prefix.indexOf(' ') >= 0)) {
      throw new IllegalArgumentException("prefix must be a single non-empty token: '" + prefix + "'");
    }
    params = (params == null) ? List.of() : List.copyOf(params);
    for (String p : params) {
      if (p.isEmpty() || p.indexOf(' ') >= 0 || p.charAt(0) == ':') {
        throw new IllegalArgumentException(
            "middle parameter must be a non-empty token not starting with ':': '" + p + "'");
      }
    }
  }

  public static IrcMessage of(String command, String... params) {
    return new IrcMessage(null, command, List.of(params), null);
  }

  public static IrcMessage withTrailing(String command, String trailing, String... params) {
    return new IrcMessage(null, command, List.of(params), trailing);
  }

  public boolean hasPrefix() {
    return prefix != null;
  }

  public boolean hasTrailing() {
    return trailing != null;
  }

  /**
   * Sender nick derived from the prefix ({@code nick!user@host}, {@code nick@host} or a bare name).
   *
   * @return the nick, or {@code null} when the message has no prefix
   */
  public String nick() {
    if (prefix == null || prefix.isEmpty()) return null;
    int bang = prefix.indexOf('!');
    if (bang > 0) return prefix.substring(0, bang);
    int at = prefix.indexOf('@');
    if (at > 0) return prefix.substring(0, at);
    return prefix;
  }

  /** Middle parameter at {@code index}, or {@code null} if there are not that many. */
  public String param(int index) {
    return (index >= 0 && index < params.size()) ? params.get(index) : null;
  }

  /** The trailing parameter when present, otherwise the last middle parameter. */
  public String lastParam() {
    if (trailing != null) return trailing;
    return params.isEmpty() ? null : params.get(params.size() - 1);
  }

  public boolean isCommand(String name) {
    return command.equalsIgnoreCase(name);
  }

  @Override
  public String toString() {
    return IrcMessageCodec.format(this);
  }
}
