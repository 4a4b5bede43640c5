package org.devolia.cognito.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics collector for token resolution.
 *
 * <p>This class provides Micrometer-based metrics:
 *
 * <ul>
 *   <li><strong>cognito_token_cache_operations_total</strong> - Counter of cache lookups by
 *       outcome
 *   <li><strong>cognito_token_auth_requests_total</strong> - Counter of authentication calls by
 *       status
 *   <li><strong>cognito_token_auth_latency_seconds</strong> - Latency of authentication calls
 *   <li><strong>cognito_token_circuit_breaker_state</strong> - Circuit breaker state (0 closed,
 *       0.5 half open, 1 open)
 * </ul>
 *
 * <p>Metrics are tagged with:
 *
 * <ul>
 *   <li><code>operation</code> - hit, negative_hit, miss
 *   <li><code>status</code> - success, error
 *   <li><code>error_category</code> - see {@code ExceptionClassifier#getErrorCategory}
 *   <li><code>scope</code> - the provider scope name
 * </ul>
 *
 * @author Devolia
 * @since 1.0.0
 */
public class TokenCacheMetrics {

  private static final Logger logger = LoggerFactory.getLogger(TokenCacheMetrics.class);

  // Metric names
  private static final String CACHE_OPERATIONS_TOTAL = "cognito_token_cache_operations_total";
  private static final String AUTH_REQUESTS_TOTAL = "cognito_token_auth_requests_total";
  private static final String AUTH_LATENCY_SECONDS = "cognito_token_auth_latency_seconds";
  private static final String CIRCUIT_BREAKER_STATE = "cognito_token_circuit_breaker_state";

  // Status tags
  private static final String STATUS_SUCCESS = "success";
  private static final String STATUS_ERROR = "error";

  // Operation tags
  private static final String OPERATION_HIT = "hit";
  private static final String OPERATION_NEGATIVE_HIT = "negative_hit";
  private static final String OPERATION_MISS = "miss";

  private final MeterRegistry meterRegistry;
  private final String scope;

  private final Counter cacheHitCounter;
  private final Counter negativeHitCounter;
  private final Counter cacheMissCounter;
  private final Counter successCounter;
  private final Timer authTimer;

  private final AtomicReference<String> circuitBreakerState = new AtomicReference<>("closed");

  /**
   * Creates the collector and registers its meters.
   *
   * @param meterRegistry the Micrometer meter registry
   * @param scope the provider scope name for tagging metrics
   */
  public TokenCacheMetrics(MeterRegistry meterRegistry, String scope) {
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry cannot be null");
    this.scope = scope != null ? scope : "default";

    this.cacheHitCounter = cacheCounter(OPERATION_HIT);
    this.negativeHitCounter = cacheCounter(OPERATION_NEGATIVE_HIT);
    this.cacheMissCounter = cacheCounter(OPERATION_MISS);

    this.successCounter =
        Counter.builder(AUTH_REQUESTS_TOTAL)
            .description("Total number of Cognito authentication requests")
            .tag("status", STATUS_SUCCESS)
            .tag("scope", this.scope)
            .register(meterRegistry);

    this.authTimer =
        Timer.builder(AUTH_LATENCY_SECONDS)
            .description("Latency of Cognito authentication requests")
            .tag("scope", this.scope)
            .register(meterRegistry);

    Gauge.builder(CIRCUIT_BREAKER_STATE, circuitBreakerState, state -> stateValue(state.get()))
        .description("Authentication circuit breaker state")
        .tag("scope", this.scope)
        .register(meterRegistry);

    logger.info("Initialized token cache metrics for scope: {}", this.scope);
  }

  private Counter cacheCounter(String operation) {
    return Counter.builder(CACHE_OPERATIONS_TOTAL)
        .description("Total number of token cache lookups")
        .tag("operation", operation)
        .tag("scope", scope)
        .register(meterRegistry);
  }

  /** Records a lookup that returned a valid cached token. */
  public void incrementCacheHit() {
    cacheHitCounter.increment();
  }

  /** Records a lookup that returned a cached authentication error. */
  public void incrementNegativeCacheHit() {
    negativeHitCounter.increment();
  }

  /** Records a lookup that found no entry or an invalid one. */
  public void incrementCacheMiss() {
    cacheMissCounter.increment();
  }

  /**
   * Records a successful authentication.
   *
   * @param latencyNanos the request latency in nanoseconds
   */
  public void recordSuccess(long latencyNanos) {
    successCounter.increment();
    authTimer.record(Duration.ofNanos(latencyNanos));
    logger.debug("Recorded successful authentication (latency: {}ms)", latencyNanos / 1_000_000);
  }

  /**
   * Records a failed authentication.
   *
   * @param latencyNanos the request latency in nanoseconds
   * @param errorCategory the error category (e.g. "not_authorized", "timeout")
   */
  public void recordError(long latencyNanos, String errorCategory) {
    Counter.builder(AUTH_REQUESTS_TOTAL)
        .description("Total number of Cognito authentication requests")
        .tag("status", STATUS_ERROR)
        .tag("error_category", errorCategory != null ? errorCategory : "unknown")
        .tag("scope", scope)
        .register(meterRegistry)
        .increment();

    authTimer.record(Duration.ofNanos(latencyNanos));
    logger.debug(
        "Recorded failed authentication - category: {}, latency: {}ms",
        errorCategory,
        latencyNanos / 1_000_000);
  }

  /**
   * Records a circuit breaker state change.
   *
   * @param state the new state ("closed", "open", "half_open")
   */
  public void recordCircuitBreakerState(String state) {
    circuitBreakerState.set(state);
    logger.debug("Recorded circuit breaker state change: {}", state);
  }

  private static double stateValue(String state) {
    return switch (state) {
      case "closed" -> 0.0;
      case "half_open" -> 0.5;
      case "open" -> 1.0;
      default -> -1.0;
    };
  }

  public double getCacheHitCount() {
    return cacheHitCounter.count();
  }

  public double getNegativeCacheHitCount() {
    return negativeHitCounter.count();
  }

  public double getCacheMissCount() {
    return cacheMissCounter.count();
  }

  public double getSuccessCount() {
    return successCounter.count();
  }

  /**
   * Gets the number of failed authentications across all error categories.
   *
   * @return error count
   */
  public double getErrorCount() {
    return meterRegistry
        .find(AUTH_REQUESTS_TOTAL)
        .tag("status", STATUS_ERROR)
        .tag("scope", scope)
        .counters()
        .stream()
        .mapToDouble(Counter::count)
        .sum();
  }

  /**
   * Gets the mean authentication latency in milliseconds.
   *
   * @return mean latency in milliseconds
   */
  public double getMeanLatencyMs() {
    return authTimer.mean(TimeUnit.MILLISECONDS);
  }

  /**
   * Gets the share of lookups answered from the cache, including cached errors.
   *
   * @return cache hit ratio (0.0 to 1.0)
   */
  public double getCacheHitRatio() {
    double hits = getCacheHitCount() + getNegativeCacheHitCount();
    double total = hits + getCacheMissCount();
    return total > 0 ? hits / total : 0.0;
  }

  public String getCircuitBreakerState() {
    return circuitBreakerState.get();
  }
}
