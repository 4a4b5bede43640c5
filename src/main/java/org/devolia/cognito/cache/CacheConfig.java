package org.devolia.cognito.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for token caching.
 *
 * <p>Covers the in-memory store bound, the lifetime of negative cache entries and whether
 * concurrent callers for the same key are collapsed into a single authentication.
 *
 * <p>The store itself has no time-based eviction: token validity comes from the {@code exp} and
 * {@code nbf} claims of each stored token.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class CacheConfig {

  private static final Logger logger = LoggerFactory.getLogger(CacheConfig.class);

  public static final int DEFAULT_CACHE_MAX_SIZE = 1000;
  public static final int DEFAULT_ERROR_TOKEN_TTL = 60;
  public static final boolean DEFAULT_SINGLE_FLIGHT = true;

  private final int cacheMaxSize;
  private final int errorTokenTtl;
  private final boolean singleFlight;

  /**
   * Constructor with configuration values.
   *
   * @param cacheMaxSize maximum number of stored tokens
   * @param errorTokenTtl lifetime of cached authentication errors in seconds
   * @param singleFlight whether to serialize authentication per cache key
   */
  public CacheConfig(int cacheMaxSize, int errorTokenTtl, boolean singleFlight) {
    this.cacheMaxSize = cacheMaxSize;
    this.errorTokenTtl = errorTokenTtl;
    this.singleFlight = singleFlight;

    logger.debug(
        "Cache configuration initialized - Max size: {}, Error TTL: {}s, Single flight: {}",
        cacheMaxSize,
        errorTokenTtl,
        singleFlight);
  }

  /**
   * Creates configuration with default values.
   *
   * @return default cache configuration
   */
  public static CacheConfig defaultConfig() {
    return new CacheConfig(
        DEFAULT_CACHE_MAX_SIZE, DEFAULT_ERROR_TOKEN_TTL, DEFAULT_SINGLE_FLIGHT);
  }

  /**
   * Builds the Caffeine cache backing {@link InMemoryTokenStore}.
   *
   * @return configured cache instance
   */
  public Cache<String, String> buildCache() {
    Cache<String, String> cache =
        Caffeine.newBuilder().maximumSize(cacheMaxSize).recordStats().build();

    logger.info("Built token cache with max size: {}", cacheMaxSize);
    return cache;
  }

  public int getCacheMaxSize() {
    return cacheMaxSize;
  }

  /**
   * Gets the lifetime of cached authentication errors in seconds.
   *
   * @return error token TTL
   */
  public int getErrorTokenTtl() {
    return errorTokenTtl;
  }

  /**
   * Gets the lifetime of cached authentication errors.
   *
   * @return error token TTL as a duration
   */
  public Duration getErrorTokenTtlDuration() {
    return Duration.ofSeconds(errorTokenTtl);
  }

  public boolean isSingleFlight() {
    return singleFlight;
  }

  /**
   * Validates the cache configuration.
   *
   * @throws IllegalArgumentException if configuration is invalid
   */
  public void validate() {
    if (cacheMaxSize <= 0) {
      throw new IllegalArgumentException("Cache max size must be positive: " + cacheMaxSize);
    }

    if (errorTokenTtl <= 0) {
      throw new IllegalArgumentException("Error token TTL must be positive: " + errorTokenTtl);
    }

    logger.debug("Cache configuration validation passed");
  }
}
