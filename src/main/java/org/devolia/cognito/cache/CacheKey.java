package org.devolia.cognito.cache;

import java.util.Objects;
import org.devolia.cognito.model.CredentialSet;

/**
 * Deterministic store key derived from every attribute of a {@link CredentialSet}.
 *
 * <p>The seven attributes are joined with {@value #SEPARATOR}, with an empty string for an absent
 * client secret. Access and id tokens for the same user therefore cache independently.
 *
 * @author Devolia
 * @since 1.0.0
 */
public final class CacheKey {

  public static final String SEPARATOR = "::";

  private final String value;

  private CacheKey(String value) {
    this.value = value;
  }

  /**
   * Derives the cache key for a credential set.
   *
   * @param credentials the credential set
   * @return the cache key
   */
  public static CacheKey of(CredentialSet credentials) {
    Objects.requireNonNull(credentials, "credentials cannot be null");
    String value =
        String.join(
            SEPARATOR,
            nullToEmpty(credentials.getUsername()),
            nullToEmpty(credentials.getPassword()),
            nullToEmpty(credentials.getRegion()),
            nullToEmpty(credentials.getClientId()),
            nullToEmpty(credentials.getUserPoolId()),
            credentials.getTokenType().getValue(),
            nullToEmpty(credentials.getClientSecret()));
    return new CacheKey(value);
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }

  /**
   * Gets the raw key as handed to the {@link TokenStore}. Contains the password; never log it.
   *
   * @return the raw key
   */
  public String value() {
    return value;
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof CacheKey other && value.equals(other.value));
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public String toString() {
    return mask(value);
  }

  /**
   * Masks a raw key for logging, keeping only the leading username characters.
   *
   * @param rawKey the raw key
   * @return the masked key
   */
  public static String mask(String rawKey) {
    if (rawKey == null || rawKey.length() <= 3) {
      return "***";
    }
    return rawKey.substring(0, 2) + "***";
  }
}
