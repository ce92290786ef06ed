package cafe.woden.ircwire.irc;

import java.util.ArrayList;
import java.util.List;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Who we register as. A blank nick means "do not register"; the session is raw.
 */
@ValueObject
public record IrcIdentity(String nick, String username, String realName, String password) {

  public static final IrcIdentity NONE = new IrcIdentity("", "", "", "");

  public IrcIdentity {
    nick = (nick == null) ? "" : nick.trim();
    username = (username == null || username.isBlank()) ? nick : username.trim();
    realName = (realName == null || realName.isBlank()) ? nick : realName;
    password = (password == null) ? "" : password;
  }

  public boolean registers() {
    return !nick.isEmpty();
  }

  /** {@code PASS} (if any), {@code NICK}, {@code USER}; empty when {@link #registers()} is false. */
  public List<String> registrationLines() {
    if (!registers()) return List.of();
    List<String> lines = new ArrayList<>(3);
    if (!password.isEmpty()) lines.add("PASS " + password);
    lines.add("NICK " + nick);
    lines.add("USER " + username + " 0 * :" + realName);
    return lines;
  }
}
