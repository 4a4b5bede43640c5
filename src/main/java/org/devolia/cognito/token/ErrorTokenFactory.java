package org.devolia.cognito.token;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds short-lived sentinel tokens that carry an authentication error message.
 *
 * <p>Stored in place of a real token, a sentinel makes repeated calls with the same failing
 * credentials return the cached error until its {@code exp} passes, instead of calling the
 * identity provider again.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class ErrorTokenFactory {

  public static final Duration DEFAULT_TTL = Duration.ofSeconds(60);

  private static final String HEADER_ALG = "HS256";
  private static final String HEADER_TYP = "JWT";

  private final Duration ttl;

  /** Creates a factory whose sentinels live for {@link #DEFAULT_TTL}. */
  public ErrorTokenFactory() {
    this(DEFAULT_TTL);
  }

  /**
   * Creates a factory with a custom sentinel lifetime.
   *
   * @param ttl how long an error stays cached
   * @throws IllegalArgumentException if the lifetime is not positive
   */
  public ErrorTokenFactory(Duration ttl) {
    if (ttl == null || ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("Error token TTL must be positive: " + ttl);
    }
    this.ttl = ttl;
  }

  /**
   * Builds an error token expiring {@code ttl} after {@code now}. The {@code exp} claim keeps
   * millisecond precision in fractional epoch seconds.
   *
   * @param message the error message to carry
   * @param now the current time
   * @return the encoded sentinel token
   */
  public String makeErrorToken(String message, Instant now) {
    Map<String, Object> header = new LinkedHashMap<>();
    header.put("alg", HEADER_ALG);
    header.put("typ", HEADER_TYP);

    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put(DecodedToken.CLAIM_ERROR, message);
    payload.put(DecodedToken.CLAIM_EXPIRES_AT, (now.toEpochMilli() + ttl.toMillis()) / 1000.0);

    return TokenCodec.encode(header, payload);
  }

  public Duration getTtl() {
    return ttl;
  }
}
