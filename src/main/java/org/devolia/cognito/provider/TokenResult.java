package org.devolia.cognito.provider;

import java.util.Objects;

/**
 * Outcome of a token resolution: either a bearer token or an authentication error message.
 *
 * <p>Callers of the string-only surface receive {@link #getValue()}, which is the token on success
 * and the bare error message on failure.
 *
 * @author Devolia
 * @since 1.0.0
 */
public final class TokenResult {

  private final String token;
  private final String failureMessage;
  private final boolean cached;

  private TokenResult(String token, String failureMessage, boolean cached) {
    this.token = token;
    this.failureMessage = failureMessage;
    this.cached = cached;
  }

  /**
   * Creates a successful result.
   *
   * @param token the bearer token
   * @param cached whether the token came from the store
   * @return the result
   */
  public static TokenResult success(String token, boolean cached) {
    return new TokenResult(Objects.requireNonNull(token, "token cannot be null"), null, cached);
  }

  /**
   * Creates a failed result.
   *
   * @param message the authentication error message
   * @param cached whether the error came from a negative cache entry
   * @return the result
   */
  public static TokenResult failure(String message, boolean cached) {
    return new TokenResult(null, Objects.requireNonNull(message, "message cannot be null"), cached);
  }

  public boolean isSuccess() {
    return token != null;
  }

  /**
   * Gets the bearer token.
   *
   * @return the token, or null for a failed result
   */
  public String getToken() {
    return token;
  }

  /**
   * Gets the authentication error message.
   *
   * @return the message, or null for a successful result
   */
  public String getFailureMessage() {
    return failureMessage;
  }

  /**
   * Checks whether this result was answered from the store without authenticating.
   *
   * @return true for cache hits and negative cache hits
   */
  public boolean isCached() {
    return cached;
  }

  /**
   * Gets the token on success, or the error message on failure.
   *
   * @return the caller-facing string
   */
  public String getValue() {
    return isSuccess() ? token : failureMessage;
  }

  @Override
  public String toString() {
    return isSuccess()
        ? "TokenResult{success, cached=" + cached + "}"
        : "TokenResult{failure='" + failureMessage + "', cached=" + cached + "}";
  }
}
