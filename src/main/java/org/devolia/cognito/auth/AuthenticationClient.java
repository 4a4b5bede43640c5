package org.devolia.cognito.auth;

import org.devolia.cognito.model.CredentialSet;

/**
 * Performs the network handshake with the identity provider and returns a bearer token.
 *
 * <p>Implementations must honor {@link CredentialSet#getTokenType()}: an id token for {@code id},
 * the access token otherwise. Any timeout budget is the implementation's responsibility.
 *
 * @author Devolia
 * @since 1.0.0
 */
public interface AuthenticationClient extends AutoCloseable {

  /**
   * Authenticates and returns the requested token.
   *
   * @param credentials validated credentials
   * @return the bearer token
   * @throws AuthenticationException on bad credentials, network errors or misconfiguration
   */
  String authenticate(CredentialSet credentials) throws AuthenticationException;

  /** Releases network resources. The default implementation holds none. */
  @Override
  default void close() {}
}
