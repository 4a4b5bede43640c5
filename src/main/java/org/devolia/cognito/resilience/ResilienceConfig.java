package org.devolia.cognito.resilience;

import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for the circuit breaker and call timeouts around authentication.
 *
 * <p>No retry policy is applied: a single token resolution makes at most one authentication
 * attempt.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class ResilienceConfig {

  private static final Logger logger = LoggerFactory.getLogger(ResilienceConfig.class);

  // Default values
  public static final boolean DEFAULT_CIRCUIT_BREAKER_ENABLED = true;
  public static final int DEFAULT_CIRCUIT_BREAKER_FAILURE_THRESHOLD = 50;
  public static final long DEFAULT_CIRCUIT_BREAKER_RECOVERY_TIMEOUT_MS = 30000;
  public static final long DEFAULT_ATTEMPT_TIMEOUT_MS = 5000;
  public static final long DEFAULT_CALL_TIMEOUT_MS = 10000;

  private final boolean circuitBreakerEnabled;
  private final int circuitBreakerFailureThreshold;
  private final Duration circuitBreakerRecoveryTimeout;
  private final Duration attemptTimeout;
  private final Duration callTimeout;

  /**
   * Constructor with configuration values.
   *
   * @param circuitBreakerEnabled whether circuit breaker is enabled (default: true)
   * @param circuitBreakerFailureThreshold failure rate percentage that opens the breaker
   *     (default: 50)
   * @param circuitBreakerRecoveryTimeoutMs open-state wait in milliseconds (default: 30000)
   * @param attemptTimeoutMs timeout of a single Cognito HTTP attempt in milliseconds (default:
   *     5000)
   * @param callTimeoutMs overall timeout of a Cognito API call in milliseconds (default: 10000)
   */
  public ResilienceConfig(
      boolean circuitBreakerEnabled,
      int circuitBreakerFailureThreshold,
      long circuitBreakerRecoveryTimeoutMs,
      long attemptTimeoutMs,
      long callTimeoutMs) {

    this.circuitBreakerEnabled = circuitBreakerEnabled;
    this.circuitBreakerFailureThreshold = circuitBreakerFailureThreshold;
    this.circuitBreakerRecoveryTimeout = Duration.ofMillis(circuitBreakerRecoveryTimeoutMs);
    this.attemptTimeout = Duration.ofMillis(attemptTimeoutMs);
    this.callTimeout = Duration.ofMillis(callTimeoutMs);

    logger.debug(
        "Resilience configuration initialized - CircuitBreaker: enabled={}, threshold={}%, "
            + "recovery={}ms; Timeouts: attempt={}ms, call={}ms",
        circuitBreakerEnabled,
        circuitBreakerFailureThreshold,
        circuitBreakerRecoveryTimeoutMs,
        attemptTimeoutMs,
        callTimeoutMs);
  }

  /**
   * Creates configuration with default values.
   *
   * @return default resilience configuration
   */
  public static ResilienceConfig defaultConfig() {
    return new ResilienceConfig(
        DEFAULT_CIRCUIT_BREAKER_ENABLED,
        DEFAULT_CIRCUIT_BREAKER_FAILURE_THRESHOLD,
        DEFAULT_CIRCUIT_BREAKER_RECOVERY_TIMEOUT_MS,
        DEFAULT_ATTEMPT_TIMEOUT_MS,
        DEFAULT_CALL_TIMEOUT_MS);
  }

  public boolean isCircuitBreakerEnabled() {
    return circuitBreakerEnabled;
  }

  /**
   * Gets the failure rate percentage that opens the circuit breaker.
   *
   * @return failure threshold
   */
  public int getCircuitBreakerFailureThreshold() {
    return circuitBreakerFailureThreshold;
  }

  public Duration getCircuitBreakerRecoveryTimeout() {
    return circuitBreakerRecoveryTimeout;
  }

  public Duration getAttemptTimeout() {
    return attemptTimeout;
  }

  public Duration getCallTimeout() {
    return callTimeout;
  }

  /**
   * Validates the resilience configuration.
   *
   * @throws IllegalArgumentException if configuration is invalid
   */
  public void validate() {
    if (circuitBreakerFailureThreshold <= 0 || circuitBreakerFailureThreshold > 100) {
      throw new IllegalArgumentException(
          "Circuit breaker failure threshold must be between 1 and 100: "
              + circuitBreakerFailureThreshold);
    }

    if (circuitBreakerRecoveryTimeout.isNegative() || circuitBreakerRecoveryTimeout.isZero()) {
      throw new IllegalArgumentException(
          "Circuit breaker recovery timeout must be positive: " + circuitBreakerRecoveryTimeout);
    }

    if (attemptTimeout.isNegative() || attemptTimeout.isZero()) {
      throw new IllegalArgumentException("Attempt timeout must be positive: " + attemptTimeout);
    }

    if (callTimeout.isNegative() || callTimeout.isZero()) {
      throw new IllegalArgumentException("Call timeout must be positive: " + callTimeout);
    }

    if (callTimeout.compareTo(attemptTimeout) < 0) {
      throw new IllegalArgumentException(
          "Call timeout " + callTimeout + " must not be shorter than attempt timeout "
              + attemptTimeout);
    }

    logger.debug("Resilience configuration validation passed");
  }
}
