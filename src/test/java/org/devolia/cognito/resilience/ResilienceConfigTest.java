package org.devolia.cognito.resilience;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ResilienceConfig.
 *
 * @author Devolia
 * @since 1.0.0
 */
class ResilienceConfigTest {

  @Test
  void testDefaultConfig() {
    ResilienceConfig config = ResilienceConfig.defaultConfig();

    assertTrue(config.isCircuitBreakerEnabled());
    assertEquals(50, config.getCircuitBreakerFailureThreshold());
    assertEquals(Duration.ofMillis(30000), config.getCircuitBreakerRecoveryTimeout());
    assertEquals(Duration.ofMillis(5000), config.getAttemptTimeout());
    assertEquals(Duration.ofMillis(10000), config.getCallTimeout());
  }

  @Test
  void testCustomConfig() {
    ResilienceConfig config =
        new ResilienceConfig(
            false, // circuitBreakerEnabled
            25, // circuitBreakerFailureThreshold
            60000, // circuitBreakerRecoveryTimeoutMs
            2000, // attemptTimeoutMs
            4000 // callTimeoutMs
            );

    assertFalse(config.isCircuitBreakerEnabled());
    assertEquals(25, config.getCircuitBreakerFailureThreshold());
    assertEquals(Duration.ofMillis(60000), config.getCircuitBreakerRecoveryTimeout());
    assertEquals(Duration.ofMillis(2000), config.getAttemptTimeout());
    assertEquals(Duration.ofMillis(4000), config.getCallTimeout());
  }

  @Test
  void testValidationSuccess() {
    ResilienceConfig validConfig = new ResilienceConfig(true, 100, 1000, 3000, 3000);

    assertDoesNotThrow(() -> validConfig.validate());
  }

  @Test
  void testValidationFailures() {
    // Failure threshold out of range
    assertThrows(
        IllegalArgumentException.class,
        () -> new ResilienceConfig(true, 0, 30000, 5000, 10000).validate());
    assertThrows(
        IllegalArgumentException.class,
        () -> new ResilienceConfig(true, 101, 30000, 5000, 10000).validate());

    // Non-positive durations
    assertThrows(
        IllegalArgumentException.class,
        () -> new ResilienceConfig(true, 50, 0, 5000, 10000).validate());
    assertThrows(
        IllegalArgumentException.class,
        () -> new ResilienceConfig(true, 50, 30000, -1, 10000).validate());
    assertThrows(
        IllegalArgumentException.class,
        () -> new ResilienceConfig(true, 50, 30000, 5000, 0).validate());
  }

  @Test
  void testCallTimeoutShorterThanAttemptTimeout() {
    IllegalArgumentException exception =
        assertThrows(
            IllegalArgumentException.class,
            () -> new ResilienceConfig(true, 50, 30000, 5000, 4000).validate());
    assertTrue(exception.getMessage().contains("must not be shorter than attempt timeout"));
  }
}
