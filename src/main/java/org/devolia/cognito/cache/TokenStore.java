package org.devolia.cognito.cache;

/**
 * Key/value store holding one token string per cache key.
 *
 * <p>Implementations are supplied by the host and must be safe for concurrent use. No expiry is
 * expected from the store; token lifetimes are enforced from the tokens' own claims.
 *
 * @author Devolia
 * @since 1.0.0
 */
public interface TokenStore {

  /**
   * Looks up the token stored under a key.
   *
   * @param key the raw cache key
   * @return the stored token, or null if there is none
   */
  String getItem(String key);

  /**
   * Stores a token under a key, replacing any previous value.
   *
   * @param key the raw cache key
   * @param value the token to store
   */
  void setItem(String key, String value);
}
