package cafe.woden.ircwire.app;

import org.jmolecules.architecture.layered.ApplicationLayer;

/** App-owned contract for appending chat lines to whatever keeps history. */
@ApplicationLayer
public interface MessageLogPort {

  void logMessage(String serverAddress, String senderNick, String destination, String content);
}
