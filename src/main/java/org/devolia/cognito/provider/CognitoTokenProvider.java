package org.devolia.cognito.provider;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import org.devolia.cognito.auth.AuthenticationClient;
import org.devolia.cognito.auth.AuthenticationException;
import org.devolia.cognito.cache.CacheConfig;
import org.devolia.cognito.cache.CacheKey;
import org.devolia.cognito.cache.TokenStore;
import org.devolia.cognito.metrics.TokenCacheMetrics;
import org.devolia.cognito.model.CredentialSet;
import org.devolia.cognito.resilience.ExceptionClassifier;
import org.devolia.cognito.resilience.ResilienceConfig;
import org.devolia.cognito.token.DecodedToken;
import org.devolia.cognito.token.ErrorTokenFactory;
import org.devolia.cognito.token.TokenCodec;
import org.devolia.cognito.token.TokenDecodeException;
import org.devolia.cognito.token.TokenValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves Cognito bearer tokens through a {@link TokenStore}.
 *
 * <p>Each call takes one of three paths:
 *
 * <ol>
 *   <li>The store holds a valid token for the credentials: it is returned unchanged.
 *   <li>The store holds a valid error token: its error message is returned without contacting
 *       Cognito.
 *   <li>The store holds nothing usable (missing, expired, not yet valid or malformed): the
 *       {@link AuthenticationClient} is called once. A new token is stored and returned; a failure
 *       is stored as a short-lived error token and its message is returned.
 * </ol>
 *
 * <p>Authentication failures are therefore reported as return values, not exceptions. Only
 * missing credential attributes are thrown, as {@code CredentialValidationException}.
 *
 * <p>With single flight enabled, concurrent calls for the same cache key are serialized and the
 * store is read again after acquiring the key lock, so only the first caller authenticates.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class CognitoTokenProvider implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(CognitoTokenProvider.class);

  static final String CIRCUIT_BREAKER_NAME = "cognito-authentication";

  private final TokenStore tokenStore;
  private final AuthenticationClient authenticationClient;
  private final ErrorTokenFactory errorTokenFactory;
  private final TokenCacheMetrics metrics;
  private final Clock clock;
  private final CircuitBreaker circuitBreaker;
  private final LoadingCache<String, ReentrantLock> keyLocks;

  /**
   * Creates a provider.
   *
   * @param tokenStore store holding tokens by cache key
   * @param authenticationClient client performing the Cognito handshake
   * @param cacheConfig cache configuration
   * @param metrics metrics collector
   * @param resilienceConfig resilience patterns configuration
   * @param clock clock used for token validity decisions
   */
  public CognitoTokenProvider(
      TokenStore tokenStore,
      AuthenticationClient authenticationClient,
      CacheConfig cacheConfig,
      TokenCacheMetrics metrics,
      ResilienceConfig resilienceConfig,
      Clock clock) {

    this.tokenStore = Objects.requireNonNull(tokenStore, "tokenStore cannot be null");
    this.authenticationClient =
        Objects.requireNonNull(authenticationClient, "authenticationClient cannot be null");
    this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
    this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    this.errorTokenFactory = new ErrorTokenFactory(cacheConfig.getErrorTokenTtlDuration());

    if (cacheConfig.isSingleFlight()) {
      // Weak values: a lock is collected once no caller holds or waits on it
      this.keyLocks = Caffeine.newBuilder().weakValues().build(key -> new ReentrantLock());
    } else {
      this.keyLocks = null;
      logger.debug("Single flight disabled, concurrent callers may authenticate the same key");
    }

    if (resilienceConfig.isCircuitBreakerEnabled()) {
      CircuitBreakerConfig circuitBreakerConfig =
          CircuitBreakerConfig.custom()
              .failureRateThreshold(resilienceConfig.getCircuitBreakerFailureThreshold())
              .waitDurationInOpenState(resilienceConfig.getCircuitBreakerRecoveryTimeout())
              .recordException(ExceptionClassifier::isCircuitBreakerFailure)
              .slidingWindowSize(10)
              .minimumNumberOfCalls(5)
              .build();

      this.circuitBreaker = CircuitBreaker.of(CIRCUIT_BREAKER_NAME, circuitBreakerConfig);

      circuitBreaker
          .getEventPublisher()
          .onStateTransition(
              event -> {
                String fromState = event.getStateTransition().getFromState().name().toLowerCase();
                String toState = event.getStateTransition().getToState().name().toLowerCase();
                metrics.recordCircuitBreakerState(toState);
                logger.info(
                    "Authentication circuit breaker state transition: {} -> {}",
                    fromState,
                    toState);
              });
    } else {
      this.circuitBreaker = null;
      logger.debug("Authentication circuit breaker disabled");
    }

    logger.info(
        "Initialized Cognito token provider - Error TTL: {}s, Single flight: {}, "
            + "Circuit breaker: {}",
        cacheConfig.getErrorTokenTtl(),
        cacheConfig.isSingleFlight(),
        resilienceConfig.isCircuitBreakerEnabled());
  }

  /**
   * Creates a provider with default resilience configuration and the system UTC clock.
   *
   * @param tokenStore store holding tokens by cache key
   * @param authenticationClient client performing the Cognito handshake
   * @param cacheConfig cache configuration
   * @param metrics metrics collector
   */
  public CognitoTokenProvider(
      TokenStore tokenStore,
      AuthenticationClient authenticationClient,
      CacheConfig cacheConfig,
      TokenCacheMetrics metrics) {
    this(
        tokenStore,
        authenticationClient,
        cacheConfig,
        metrics,
        ResilienceConfig.defaultConfig(),
        Clock.systemUTC());
  }

  /**
   * Resolves a token for the credentials.
   *
   * @param credentials the credential set
   * @return the bearer token, or the authentication error message
   * @throws org.devolia.cognito.model.CredentialValidationException if a mandatory attribute is
   *     missing
   */
  public String resolveToken(CredentialSet credentials) {
    return resolve(credentials).getValue();
  }

  /**
   * Resolves a token for the credentials, keeping success and failure apart.
   *
   * @param credentials the credential set
   * @return the resolution outcome
   * @throws org.devolia.cognito.model.CredentialValidationException if a mandatory attribute is
   *     missing
   */
  public TokenResult resolve(CredentialSet credentials) {
    Objects.requireNonNull(credentials, "credentials cannot be null");
    credentials.validate();

    CacheKey key = CacheKey.of(credentials);
    TokenResult cached = lookup(key);
    if (cached != null) {
      return cached;
    }

    if (keyLocks == null) {
      return authenticateAndStore(credentials, key);
    }

    ReentrantLock lock = keyLocks.get(key.value());
    lock.lock();
    try {
      // Another caller may have stored a result while this one waited
      TokenResult stored = lookup(key);
      if (stored != null) {
        return stored;
      }
      return authenticateAndStore(credentials, key);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Reads the store and decides whether the entry can answer the call.
   *
   * @return the cached outcome, or null if authentication is needed
   */
  private TokenResult lookup(CacheKey key) {
    String token = tokenStore.getItem(key.value());
    if (token == null || token.isEmpty()) {
      logger.debug("No cached token for key: {}", key);
      return null;
    }

    Instant now = clock.instant();
    DecodedToken decoded;
    try {
      decoded = TokenCodec.decode(token);
    } catch (TokenDecodeException e) {
      logger.debug("Cached token for key {} is malformed: {}", key, e.getMessage());
      return null;
    }

    if (!TokenValidator.isValid(decoded, now)) {
      logger.debug("Cached token for key {} is expired or not yet valid", key);
      return null;
    }

    if (decoded.isError()) {
      metrics.incrementNegativeCacheHit();
      logger.debug("Returning cached authentication error for key: {}", key);
      return TokenResult.failure(decoded.getError(), true);
    }

    metrics.incrementCacheHit();
    logger.debug("Token found in cache for key: {}", key);
    return TokenResult.success(token, true);
  }

  private TokenResult authenticateAndStore(CredentialSet credentials, CacheKey key) {
    metrics.incrementCacheMiss();
    long startTime = System.nanoTime();

    String token;
    try {
      token = authenticate(credentials);
    } catch (AuthenticationException | RuntimeException e) {
      long latency = System.nanoTime() - startTime;
      String errorCategory = ExceptionClassifier.getErrorCategory(e);
      metrics.recordError(latency, errorCategory);

      String message = failureMessage(e);
      if (e instanceof AuthenticationException || e instanceof CallNotPermittedException) {
        logger.warn(
            "Authentication failed for user {} (category: {}): {}",
            credentials.getUsername(),
            errorCategory,
            message);
      } else {
        logger.error(
            "Unexpected failure authenticating user {} (category: {})",
            credentials.getUsername(),
            errorCategory,
            e);
      }

      tokenStore.setItem(key.value(), errorTokenFactory.makeErrorToken(message, clock.instant()));
      return TokenResult.failure(message, false);
    }

    metrics.recordSuccess(System.nanoTime() - startTime);
    tokenStore.setItem(key.value(), token);
    logger.debug("Authenticated and cached {} token for key: {}", credentials.getTokenType(), key);
    return TokenResult.success(token, false);
  }

  private String authenticate(CredentialSet credentials) throws AuthenticationException {
    if (circuitBreaker == null) {
      return authenticationClient.authenticate(credentials);
    }

    circuitBreaker.acquirePermission();
    long start = circuitBreaker.getCurrentTimestamp();
    try {
      String token = authenticationClient.authenticate(credentials);
      circuitBreaker.onSuccess(
          circuitBreaker.getCurrentTimestamp() - start, circuitBreaker.getTimestampUnit());
      return token;
    } catch (AuthenticationException | RuntimeException e) {
      circuitBreaker.onError(
          circuitBreaker.getCurrentTimestamp() - start, circuitBreaker.getTimestampUnit(), e);
      throw e;
    }
  }

  private static String failureMessage(Exception e) {
    String message = e.getMessage();
    return message != null && !message.isEmpty() ? message : e.getClass().getSimpleName();
  }

  /** Closes the authentication client. */
  @Override
  public void close() {
    logger.debug("Closing Cognito token provider");
    authenticationClient.close();
  }
}
