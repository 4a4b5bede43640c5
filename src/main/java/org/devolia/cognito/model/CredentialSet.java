package org.devolia.cognito.model;

import java.util.Objects;

/**
 * Credentials and options identifying one token request against a Cognito user pool.
 *
 * <p>Instances are built per call and never persisted; only the derived cache key is stored.
 * Mandatory attributes and the token type are checked by {@link #validate()} rather than at build
 * time, so that the first missing attribute is reported by name before the token type is parsed.
 *
 * @author Devolia
 * @since 1.0.0
 */
public final class CredentialSet {

  private final String username;
  private final String password;
  private final String region;
  private final String clientId;
  private final String userPoolId;
  private final String tokenType;
  private final String clientSecret;

  private CredentialSet(Builder builder) {
    this.username = builder.username;
    this.password = builder.password;
    this.region = builder.region;
    this.clientId = builder.clientId;
    this.userPoolId = builder.userPoolId;
    this.tokenType = builder.tokenType;
    this.clientSecret = builder.clientSecret;
  }

  /**
   * Creates a new builder.
   *
   * @return an empty builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Checks that every mandatory attribute is present and non-empty, in caller argument order,
   * then that the token type is known.
   *
   * @throws CredentialValidationException naming the first missing attribute, or {@code
   *     TokenType} for an unknown token type
   */
  public void validate() {
    requireAttribute("Username", username);
    requireAttribute("Password", password);
    requireAttribute("Region", region);
    requireAttribute("ClientId", clientId);
    requireAttribute("UserPoolId", userPoolId);
    TokenType.fromValue(tokenType);
  }

  private static void requireAttribute(String attribute, String value) {
    if (value == null || value.isEmpty()) {
      throw new CredentialValidationException(attribute);
    }
  }

  public String getUsername() {
    return username;
  }

  public String getPassword() {
    return password;
  }

  public String getRegion() {
    return region;
  }

  public String getClientId() {
    return clientId;
  }

  public String getUserPoolId() {
    return userPoolId;
  }

  /**
   * Gets the requested token type. Absent or blank values select {@link TokenType#ACCESS}.
   *
   * @return the token type
   * @throws CredentialValidationException if the value is not a known token type
   */
  public TokenType getTokenType() {
    return TokenType.fromValue(tokenType);
  }

  /**
   * Gets the optional app client secret.
   *
   * @return the client secret, or null when the app client has none
   */
  public String getClientSecret() {
    return clientSecret;
  }

  /**
   * Checks whether an app client secret was supplied.
   *
   * @return true if a non-empty client secret is present
   */
  public boolean hasClientSecret() {
    return clientSecret != null && !clientSecret.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CredentialSet other)) {
      return false;
    }
    return Objects.equals(username, other.username)
        && Objects.equals(password, other.password)
        && Objects.equals(region, other.region)
        && Objects.equals(clientId, other.clientId)
        && Objects.equals(userPoolId, other.userPoolId)
        && Objects.equals(tokenType, other.tokenType)
        && Objects.equals(clientSecret, other.clientSecret);
  }

  @Override
  public int hashCode() {
    return Objects.hash(username, password, region, clientId, userPoolId, tokenType, clientSecret);
  }

  // Password and client secret stay out of logs
  @Override
  public String toString() {
    return "CredentialSet{username="
        + username
        + ", region="
        + region
        + ", clientId="
        + clientId
        + ", userPoolId="
        + userPoolId
        + ", tokenType="
        + tokenType
        + ", clientSecret="
        + (hasClientSecret() ? "****" : "none")
        + "}";
  }

  /** Builder for {@link CredentialSet}. */
  public static final class Builder {
    private String username;
    private String password;
    private String region;
    private String clientId;
    private String userPoolId;
    private String tokenType;
    private String clientSecret;

    private Builder() {}

    public Builder username(String username) {
      this.username = username;
      return this;
    }

    public Builder password(String password) {
      this.password = password;
      return this;
    }

    public Builder region(String region) {
      this.region = region;
      return this;
    }

    public Builder clientId(String clientId) {
      this.clientId = clientId;
      return this;
    }

    public Builder userPoolId(String userPoolId) {
      this.userPoolId = userPoolId;
      return this;
    }

    public Builder tokenType(TokenType tokenType) {
      this.tokenType = tokenType != null ? tokenType.getValue() : null;
      return this;
    }

    /**
     * Sets the token type from its wire value. The value is parsed by {@link #validate()}.
     *
     * @param tokenType the wire value, may be null
     * @return this builder
     */
    public Builder tokenType(String tokenType) {
      this.tokenType = tokenType;
      return this;
    }

    public Builder clientSecret(String clientSecret) {
      this.clientSecret = clientSecret;
      return this;
    }

    public CredentialSet build() {
      return new CredentialSet(this);
    }
  }
}
