package ca.gc.cra.logkit.domain.id;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Operating-system hostname lookup for {@link HostnameResolver#SYSTEM}.
 *
 * <p>{@link InetAddress#getLocalHost()} fails when the hostname does not resolve (containers without a hosts
 * entry), although the name itself is known. The JDK reports it as {@code <hostname>: <reason>} in the exception
 * message, so it is taken from there, then from the {@code HOSTNAME} environment variable.</p>
 */
final class SystemHostnames {
  static final String HOSTNAME_ENV = "HOSTNAME";

  @FunctionalInterface
  interface Lookup {
    String hostname() throws UnknownHostException;
  }

  private SystemHostnames() {}

  static String resolve() throws UnknownHostException {
    return resolve(() -> InetAddress.getLocalHost().getHostName(), System.getenv(HOSTNAME_ENV));
  }

  static String resolve(Lookup lookup, String environmentHostname) throws UnknownHostException {
    try {
      return lookup.hostname();
    } catch (UnknownHostException ex) {
      String reported = hostFromMessage(ex.getMessage());
      if (reported != null) {
        return reported;
      }
      if (environmentHostname != null && !environmentHostname.isBlank()) {
        return environmentHostname.trim();
      }
      throw ex;
    }
  }

  static String hostFromMessage(String message) {
    if (message == null) {
      return null;
    }
    int colon = message.indexOf(':');
    if (colon <= 0) {
      return null;
    }
    String candidate = message.substring(0, colon).trim();
    return candidate.isEmpty() || candidate.indexOf(' ') >= 0 ? null : candidate;
  }
}
