package cafe.woden.ircwire.irc;

import java.util.List;
import java.util.Objects;

/**
 * Builds well-formed command lines and queues them on a client.
 *
 * <p>No channel or nick bookkeeping happens here. Arguments containing CR or LF are rejected so a
 * caller cannot smuggle a second command onto the wire.
 */
public final class IrcCommands {

  private final IrcClient client;

  public IrcCommands(IrcClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  public void raw(String line) {
    String l = clean(line, "line");
    if (l.isBlank()) throw new IllegalArgumentException("line is blank");
    client.write(l);
  }

  public void pass(String password) {
    send("PASS " + token(password, "password"));
  }

  public void nick(String nick) {
    send("NICK " + token(nick, "nick"));
  }

  public void user(String username, String realName) {
    send("USER " + token(username, "username") + " 0 * :" + clean(realName, "realName"));
  }

  public void join(String... channels) {
    join(List.of(channels), List.of());
  }

  /** {@code JOIN #a,#b key1,key2}; keys pair with the leading channels. */
  public void join(List<String> channels, List<String> keys) {
    if (channels == null || channels.isEmpty()) throw new IllegalArgumentException("no channels");
    StringBuilder sb = new StringBuilder("JOIN ").append(list(channels, "channel"));
    if (keys != null && !keys.isEmpty()) {
      sb.append(' ').append(list(keys, "key"));
    }
    send(sb.toString());
  }

  public void part(String channel) {
    part(channel, null);
  }

  public void part(String channel, String reason) {
    send(withReason("PART " + token(channel, "channel"), reason));
  }

  public void privmsg(String target, String text) {
    send("PRIVMSG " + token(target, "target") + " :" + clean(text, "text"));
  }

  public void notice(String target, String text) {
    send("NOTICE " + token(target, "target") + " :" + clean(text, "text"));
  }

  /** CTCP ACTION ("/me"). */
  public void action(String target, String action) {
    privmsg(target, "\u0001ACTION " + clean(action, "action") + "\u0001");
  }

  /** Ask the server for the current topic. */
  public void topic(String channel) {
    send("TOPIC " + token(channel, "channel"));
  }

  /** Set the topic; an empty topic clears it. */
  public void topic(String channel, String topic) {
    send("TOPIC " + token(channel, "channel") + " :" + clean(topic, "topic"));
  }

  public void invite(String nick, String channel) {
    send("INVITE " + token(nick, "nick") + " " + token(channel, "channel"));
  }

  public void kick(String channel, String nick, String reason) {
    send(withReason("KICK " + token(channel, "channel") + " " + token(nick, "nick"), reason));
  }

  public void whois(String nick) {
    send("WHOIS " + token(nick, "nick"));
  }

  /**
   * Set the away message. If {@code message} is null or blank, away is cleared.
   */
  public void away(String message) {
    if (message == null || message.isBlank()) {
      send("AWAY");
      return;
    }
    send("AWAY :" + clean(message, "message"));
  }

  public void mode(String target, String modes, String... args) {
    StringBuilder sb = new StringBuilder("MODE ").append(token(target, "target"));
    if (modes != null && !modes.isBlank()) {
      sb.append(' ').append(token(modes, "modes"));
      for (String a : args) {
        sb.append(' ').append(token(a, "mode argument"));
      }
    }
    send(sb.toString());
  }

  public void oper(String name, String password) {
    send("OPER " + token(name, "name") + " " + token(password, "password"));
  }

  private void send(String line) {
    client.write(line);
  }

  private static String withReason(String base, String reason) {
    if (reason == null || reason.isBlank()) return base;
    return base + " :" + clean(reason, "reason");
  }

  private static String list(List<String> items, String what) {
    StringBuilder sb = new StringBuilder();
    for (String item : items) {
      if (sb.length() > 0) sb.append(',');
      sb.append(token(item, what));
    }
    return sb.toString();
  }

  /** A middle parameter: non-blank, no spaces, no leading colon. */
  private static String token(String value, String what) {
    String v = clean(value, what).trim();
    if (v.isEmpty()) throw new IllegalArgumentException(what + " is blank");
    if (v.indexOf(' ') >= 0) throw new IllegalArgumentException(what + " contains a space: " + v);
    if (v.charAt(0) == ':') throw new IllegalArgumentException(what + " starts with ':': " + v);
    return v;
  }

  private static String clean(String value, String what) {
    String v = (value == null) ? "" : value;
    if (v.indexOf('\r') >= 0 || v.indexOf('\n') >= 0) {
      throw new IllegalArgumentException(what + " contains a line break");
    }
    return v;
  }
}
