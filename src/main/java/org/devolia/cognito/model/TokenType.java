package org.devolia.cognito.model;

/**
 * Token representation requested from the identity provider.
 *
 * <p>{@link #RAW_REQUEST} is accepted for compatibility with existing request templates and
 * resolves to the access token.
 *
 * @author Devolia
 * @since 1.0.0
 */
public enum TokenType {
  ACCESS("access"),
  ID("id"),
  RAW_REQUEST("raw_request");

  private final String value;

  TokenType(String value) {
    this.value = value;
  }

  /**
   * Gets the wire value used in cache keys and caller arguments.
   *
   * @return the wire value
   */
  public String getValue() {
    return value;
  }

  /**
   * Parses a caller-supplied token type, ignoring case. Absent or blank values default to
   * {@link #ACCESS}.
   *
   * @param value the wire value, may be null
   * @return the matching token type
   * @throws CredentialValidationException if the value is not a known token type
   */
  public static TokenType fromValue(String value) {
    if (value == null || value.trim().isEmpty()) {
      return ACCESS;
    }
    for (TokenType type : values()) {
      if (type.value.equalsIgnoreCase(value.trim())) {
        return type;
      }
    }
    throw new CredentialValidationException("TokenType", "Unsupported TokenType: " + value);
  }

  @Override
  public String toString() {
    return value;
  }
}
