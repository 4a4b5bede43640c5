package org.devolia.cognito.provider;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.Objects;
import java.util.Properties;
import org.devolia.cognito.auth.AuthenticationClient;
import org.devolia.cognito.auth.CognitoAuthenticationClient;
import org.devolia.cognito.cache.CacheConfig;
import org.devolia.cognito.cache.InMemoryTokenStore;
import org.devolia.cognito.cache.TokenStore;
import org.devolia.cognito.metrics.TokenCacheMetrics;
import org.devolia.cognito.resilience.ResilienceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for creating {@link CognitoTokenProvider} instances from configuration.
 *
 * <p>This factory is responsible for:
 *
 * <ul>
 *   <li>Reading and validating configuration properties
 *   <li>Creating providers with their store, authentication client and metrics
 *   <li>Falling back to defaults for absent or unparseable optional values
 * </ul>
 *
 * <p>Recognized properties:
 *
 * <pre>
 * cache-max=1000                              # Max tokens held by the in-memory store
 * error-token-ttl=60                          # Seconds a failed authentication stays cached
 * single-flight=true                          # One authentication per key at a time
 * circuit-breaker-enabled=true
 * circuit-breaker-failure-threshold=50        # Failure rate percentage
 * circuit-breaker-recovery-timeout-ms=30000
 * auth-attempt-timeout-ms=5000                # Single Cognito HTTP attempt
 * auth-call-timeout-ms=10000                  # Whole Cognito API call
 * metrics-scope=default                       # Value of the "scope" metrics tag
 * </pre>
 *
 * @author Devolia
 * @since 1.0.0
 */
public class CognitoTokenProviderFactory {

  private static final Logger logger = LoggerFactory.getLogger(CognitoTokenProviderFactory.class);

  /** Classpath resource read by {@link #fromClasspath()}. */
  public static final String CONFIG_RESOURCE = "cognito-token.properties";

  // Configuration keys
  static final String CONFIG_CACHE_MAX = "cache-max";
  static final String CONFIG_ERROR_TOKEN_TTL = "error-token-ttl";
  static final String CONFIG_SINGLE_FLIGHT = "single-flight";
  static final String CONFIG_CB_ENABLED = "circuit-breaker-enabled";
  static final String CONFIG_CB_FAILURE_THRESHOLD = "circuit-breaker-failure-threshold";
  static final String CONFIG_CB_RECOVERY_TIMEOUT = "circuit-breaker-recovery-timeout-ms";
  static final String CONFIG_ATTEMPT_TIMEOUT = "auth-attempt-timeout-ms";
  static final String CONFIG_CALL_TIMEOUT = "auth-call-timeout-ms";
  static final String CONFIG_METRICS_SCOPE = "metrics-scope";

  private static final String DEFAULT_METRICS_SCOPE = "default";

  private final MeterRegistry meterRegistry;
  private Properties config = new Properties();

  /** Creates a factory recording metrics into a {@link SimpleMeterRegistry}. */
  public CognitoTokenProviderFactory() {
    this(new SimpleMeterRegistry());
  }

  /**
   * Creates a factory recording metrics into the given registry.
   *
   * @param meterRegistry the Micrometer meter registry
   */
  public CognitoTokenProviderFactory(MeterRegistry meterRegistry) {
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry cannot be null");
  }

  /**
   * Creates a factory initialized from {@value #CONFIG_RESOURCE} on the classpath. A missing
   * resource leaves every setting at its default.
   *
   * @return the initialized factory
   * @throws IllegalStateException if the configuration is invalid
   */
  public static CognitoTokenProviderFactory fromClasspath() {
    Properties properties = new Properties();
    ClassLoader classLoader = CognitoTokenProviderFactory.class.getClassLoader();
    try (InputStream in = classLoader.getResourceAsStream(CONFIG_RESOURCE)) {
      if (in != null) {
        properties.load(in);
        logger.debug("Loaded configuration from classpath resource {}", CONFIG_RESOURCE);
      } else {
        logger.debug("No {} on classpath, using defaults", CONFIG_RESOURCE);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + CONFIG_RESOURCE, e);
    }

    CognitoTokenProviderFactory factory = new CognitoTokenProviderFactory();
    factory.init(properties);
    return factory;
  }

  /**
   * Initializes the factory with configuration and validates it.
   *
   * @param config the configuration properties
   * @throws IllegalStateException if the configuration is invalid
   */
  public void init(Properties config) {
    this.config = config != null ? config : new Properties();

    logger.info("Initializing Cognito token provider factory");
    logger.debug(
        "Configuration - Cache max: {}, Error TTL: {}s, Single flight: {}",
        getCacheMaxSize(),
        getErrorTokenTtl(),
        isSingleFlight());

    try {
      createCacheConfig();
      createResilienceConfig();
    } catch (IllegalArgumentException e) {
      logger.error("Invalid Cognito token provider configuration: {}", e.getMessage());
      throw new IllegalStateException(
          "Invalid Cognito token provider configuration: " + e.getMessage(), e);
    }
  }

  /**
   * Creates a provider with an in-memory store and the Cognito authentication client.
   *
   * @return a new provider
   */
  public CognitoTokenProvider create() {
    return create(new InMemoryTokenStore(createCacheConfig()));
  }

  /**
   * Creates a provider over a host-supplied store.
   *
   * @param tokenStore the store holding tokens by cache key
   * @return a new provider
   */
  public CognitoTokenProvider create(TokenStore tokenStore) {
    return create(tokenStore, new CognitoAuthenticationClient(createResilienceConfig()));
  }

  /**
   * Creates a provider over a host-supplied store and authentication client.
   *
   * @param tokenStore the store holding tokens by cache key
   * @param authenticationClient the client performing the handshake
   * @return a new provider
   */
  public CognitoTokenProvider create(
      TokenStore tokenStore, AuthenticationClient authenticationClient) {
    logger.debug("Creating Cognito token provider instance");
    return new CognitoTokenProvider(
        tokenStore,
        authenticationClient,
        createCacheConfig(),
        createMetrics(),
        createResilienceConfig(),
        Clock.systemUTC());
  }

  /**
   * Creates the caller-facing action over a new provider with an in-memory store.
   *
   * @return a new tag
   */
  public CognitoTokenTag createTag() {
    return new CognitoTokenTag(create());
  }

  public int getCacheMaxSize() {
    return getInt(CONFIG_CACHE_MAX, CacheConfig.DEFAULT_CACHE_MAX_SIZE);
  }

  public int getErrorTokenTtl() {
    return getInt(CONFIG_ERROR_TOKEN_TTL, CacheConfig.DEFAULT_ERROR_TOKEN_TTL);
  }

  public boolean isSingleFlight() {
    return getBoolean(CONFIG_SINGLE_FLIGHT, CacheConfig.DEFAULT_SINGLE_FLIGHT);
  }

  public String getMetricsScope() {
    String scope = config.getProperty(CONFIG_METRICS_SCOPE);
    return scope == null || scope.trim().isEmpty() ? DEFAULT_METRICS_SCOPE : scope.trim();
  }

  private CacheConfig createCacheConfig() {
    CacheConfig cacheConfig =
        new CacheConfig(getCacheMaxSize(), getErrorTokenTtl(), isSingleFlight());
    cacheConfig.validate();
    return cacheConfig;
  }

  private ResilienceConfig createResilienceConfig() {
    ResilienceConfig resilienceConfig =
        new ResilienceConfig(
            getBoolean(CONFIG_CB_ENABLED, ResilienceConfig.DEFAULT_CIRCUIT_BREAKER_ENABLED),
            getInt(
                CONFIG_CB_FAILURE_THRESHOLD,
                ResilienceConfig.DEFAULT_CIRCUIT_BREAKER_FAILURE_THRESHOLD),
            getLong(
                CONFIG_CB_RECOVERY_TIMEOUT,
                ResilienceConfig.DEFAULT_CIRCUIT_BREAKER_RECOVERY_TIMEOUT_MS),
            getLong(CONFIG_ATTEMPT_TIMEOUT, ResilienceConfig.DEFAULT_ATTEMPT_TIMEOUT_MS),
            getLong(CONFIG_CALL_TIMEOUT, ResilienceConfig.DEFAULT_CALL_TIMEOUT_MS));
    resilienceConfig.validate();
    return resilienceConfig;
  }

  private TokenCacheMetrics createMetrics() {
    return new TokenCacheMetrics(meterRegistry, getMetricsScope());
  }

  private int getInt(String key, int defaultValue) {
    String value = config.getProperty(key);
    if (value == null || value.trim().isEmpty()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      logger.warn("Invalid value for {}: '{}'. Using default: {}", key, value, defaultValue);
      return defaultValue;
    }
  }

  private long getLong(String key, long defaultValue) {
    String value = config.getProperty(key);
    if (value == null || value.trim().isEmpty()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      logger.warn("Invalid value for {}: '{}'. Using default: {}", key, value, defaultValue);
      return defaultValue;
    }
  }

  private boolean getBoolean(String key, boolean defaultValue) {
    String value = config.getProperty(key);
    if (value == null || value.trim().isEmpty()) {
      return defaultValue;
    }
    String trimmed = value.trim();
    if ("true".equalsIgnoreCase(trimmed) || "false".equalsIgnoreCase(trimmed)) {
      return Boolean.parseBoolean(trimmed);
    }
    logger.warn("Invalid value for {}: '{}'. Using default: {}", key, value, defaultValue);
    return defaultValue;
  }
}
