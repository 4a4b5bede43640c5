package org.devolia.cognito.token;

/**
 * Thrown when a string is not a structurally well-formed token.
 *
 * <p>Callers inside the cache path treat this as an invalid cache entry and never surface it.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class TokenDecodeException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public TokenDecodeException(String message) {
    super(message);
  }

  public TokenDecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
