package ca.gc.cra.logkit.domain.id;

import java.net.InetAddress;

/**
 * Supplies the machine hostname embedded in request identifiers.
 *
 * <p>Implementations may throw or return {@code null}/blank; {@link RequestIdGenerator} substitutes
 * {@code localhost} in those cases.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface HostnameResolver {
  /**
   * Resolves the current hostname.
   *
   * @return hostname, possibly blank
   * @throws Exception when the lookup fails
   */
  String hostname() throws Exception;

  /**
   * Resolver backed by {@link InetAddress#getLocalHost()}; when the name does not resolve, the hostname reported by
   * the failed lookup or the {@code HOSTNAME} environment variable is used.
   */
  HostnameResolver SYSTEM = SystemHostnames::resolve;
}
