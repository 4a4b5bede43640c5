package org.devolia.cognito.token;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ErrorTokenFactory.
 *
 * @author Devolia
 * @since 1.0.0
 */
class ErrorTokenFactoryTest {

  private static final Instant NOW = Instant.ofEpochSecond(1_700_000_000L, 250_000_000);

  @Test
  void testErrorTokenCarriesMessageAndExpiry() {
    String token = new ErrorTokenFactory().makeErrorToken("Incorrect username or password.", NOW);

    DecodedToken decoded = TokenCodec.decode(token);
    assertEquals("HS256", decoded.getHeader().get("alg"));
    assertEquals("JWT", decoded.getHeader().get("typ"));
    assertEquals("Incorrect username or password.", decoded.getError());
    assertEquals(1_700_000_060.25, decoded.getExpiresAt());
    assertNull(decoded.getNotBefore());
  }

  @Test
  void testErrorTokenExpiresAfterTtl() {
    String token = new ErrorTokenFactory().makeErrorToken("boom", NOW);

    assertTrue(TokenValidator.isValid(token, NOW));
    assertTrue(TokenValidator.isValid(token, Instant.ofEpochSecond(1_700_000_059L)));
    assertFalse(TokenValidator.isValid(token, Instant.ofEpochSecond(1_700_000_061L)));
  }

  @Test
  void testSubSecondCreationTimeIsKept() {
    Instant now = Instant.ofEpochSecond(1_700_000_000L, 900_000_000);
    String token = new ErrorTokenFactory().makeErrorToken("boom", now);

    assertEquals(1_700_000_060.9, TokenCodec.decode(token).getExpiresAt(), 1e-6);
    assertTrue(TokenValidator.isValid(token, now.plusMillis(59_500)));
    assertTrue(TokenValidator.isValid(token, now.plusSeconds(60)));
    assertFalse(TokenValidator.isValid(token, now.plusMillis(60_500)));
  }

  @Test
  void testCustomTtl() {
    ErrorTokenFactory factory = new ErrorTokenFactory(Duration.ofSeconds(5));
    assertEquals(Duration.ofSeconds(5), factory.getTtl());

    DecodedToken decoded = TokenCodec.decode(factory.makeErrorToken("boom", NOW));
    assertEquals(1_700_000_005.25, decoded.getExpiresAt());
  }

  @Test
  void testDefaultTtl() {
    assertEquals(Duration.ofSeconds(60), new ErrorTokenFactory().getTtl());
  }

  @Test
  void testInvalidTtlIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new ErrorTokenFactory(Duration.ZERO));
    assertThrows(
        IllegalArgumentException.class, () -> new ErrorTokenFactory(Duration.ofSeconds(-1)));
    assertThrows(IllegalArgumentException.class, () -> new ErrorTokenFactory(null));
  }
}
