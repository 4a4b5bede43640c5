package org.devolia.cognito.token;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Header and payload claims of a decoded token.
 *
 * <p>Claims are exposed as read-only maps exactly as deserialized. The typed accessors return
 * null when a claim is absent or has an unexpected JSON type.
 *
 * @author Devolia
 * @since 1.0.0
 */
public final class DecodedToken {

  public static final String CLAIM_EXPIRES_AT = "exp";
  public static final String CLAIM_NOT_BEFORE = "nbf";
  public static final String CLAIM_ERROR = "error";

  private final Map<String, Object> header;
  private final Map<String, Object> payload;

  public DecodedToken(Map<String, Object> header, Map<String, Object> payload) {
    this.header = Collections.unmodifiableMap(new LinkedHashMap<>(header));
    this.payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
  }

  public Map<String, Object> getHeader() {
    return header;
  }

  public Map<String, Object> getPayload() {
    return payload;
  }

  /**
   * Gets the {@code exp} claim in epoch seconds.
   *
   * @return expiry in seconds, or null if absent or not numeric
   */
  public Double getExpiresAt() {
    return numericClaim(CLAIM_EXPIRES_AT);
  }

  /**
   * Gets the {@code nbf} claim in epoch seconds.
   *
   * @return not-before in seconds, or null if absent or not numeric
   */
  public Double getNotBefore() {
    return numericClaim(CLAIM_NOT_BEFORE);
  }

  /**
   * Gets the error message carried by a negative cache entry.
   *
   * <p>Only a non-empty string claim marks an error token; {@code false}, {@code 0} or an object
   * does not.
   *
   * @return the error message, or null if this is not an error token
   */
  public String getError() {
    Object error = payload.get(CLAIM_ERROR);
    if (error instanceof String && !((String) error).isEmpty()) {
      return (String) error;
    }
    return null;
  }

  /**
   * Checks whether this token is an error sentinel.
   *
   * @return true if the payload carries a non-empty {@code error} claim
   */
  public boolean isError() {
    return getError() != null;
  }

  private Double numericClaim(String name) {
    Object value = payload.get(name);
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    return null;
  }
}
