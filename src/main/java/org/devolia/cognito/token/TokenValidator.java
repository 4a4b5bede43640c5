package org.devolia.cognito.token;

import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a token is currently usable from its {@code exp} and {@code nbf} claims.
 *
 * <p>A token without either claim is always valid. Malformed tokens are reported as invalid so
 * that every cache read yields either a usable answer or a clean miss.
 *
 * @author Devolia
 * @since 1.0.0
 */
public final class TokenValidator {

  private static final Logger logger = LoggerFactory.getLogger(TokenValidator.class);

  private TokenValidator() {}

  /**
   * Checks the validity window of decoded claims.
   *
   * @param token the decoded token
   * @param now the current time
   * @return false if expired or not yet valid, true otherwise
   */
  public static boolean isValid(DecodedToken token, Instant now) {
    double nowSeconds = toEpochSeconds(now);

    Double expiresAt = token.getExpiresAt();
    if (expiresAt != null && expiresAt < nowSeconds) {
      return false;
    }

    Double notBefore = token.getNotBefore();
    if (notBefore != null && notBefore > nowSeconds) {
      return false;
    }

    return true;
  }

  /**
   * Decodes a token and checks its validity window.
   *
   * @param token the encoded token, may be null
   * @param now the current time
   * @return true only if the token decodes and is inside its validity window
   */
  public static boolean isValid(String token, Instant now) {
    try {
      return isValid(TokenCodec.decode(token), now);
    } catch (TokenDecodeException e) {
      logger.debug("Treating undecodable token as invalid: {}", e.getMessage());
      return false;
    }
  }

  private static double toEpochSeconds(Instant instant) {
    return instant.toEpochMilli() / 1000.0;
  }
}
