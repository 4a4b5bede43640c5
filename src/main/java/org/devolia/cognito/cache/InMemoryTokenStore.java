package org.devolia.cognito.cache;

import com.github.benmanes.caffeine.cache.Cache;

/**
 * {@link TokenStore} backed by a size-bounded Caffeine cache.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class InMemoryTokenStore implements TokenStore {

  private final Cache<String, String> tokens;

  /**
   * Creates a store from cache configuration.
   *
   * @param cacheConfig the cache configuration
   */
  public InMemoryTokenStore(CacheConfig cacheConfig) {
    this(cacheConfig.buildCache());
  }

  /**
   * Creates a store over an existing cache. Used by tests to inspect entries.
   *
   * @param tokens the backing cache
   */
  public InMemoryTokenStore(Cache<String, String> tokens) {
    this.tokens = tokens;
  }

  @Override
  public String getItem(String key) {
    return tokens.getIfPresent(key);
  }

  @Override
  public void setItem(String key, String value) {
    tokens.put(key, value);
  }

  /**
   * Gets the current number of stored tokens.
   *
   * @return estimated entry count
   */
  public long size() {
    return tokens.estimatedSize();
  }

  /** Removes every stored token. */
  public void clear() {
    tokens.invalidateAll();
  }
}
