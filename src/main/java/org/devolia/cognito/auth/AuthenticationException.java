package org.devolia.cognito.auth;

/**
 * Thrown when the identity provider handshake fails.
 *
 * <p>The message is human readable and is what the caller finally sees, so implementations should
 * carry the provider's own wording (for example {@code Incorrect username or password.}).
 *
 * @author Devolia
 * @since 1.0.0
 */
public class AuthenticationException extends Exception {

  private static final long serialVersionUID = 1L;

  public AuthenticationException(String message) {
    super(message);
  }

  public AuthenticationException(String message, Throwable cause) {
    super(message, cause);
  }
}
