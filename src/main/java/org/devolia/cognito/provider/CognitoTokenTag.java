package org.devolia.cognito.provider;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.devolia.cognito.model.CredentialSet;
import org.devolia.cognito.model.TokenType;

/**
 * Named-argument action returning a Cognito token for request templates.
 *
 * <p>The returned string is either a bearer token or a human-readable authentication error; there
 * is no separate success flag. Missing mandatory arguments are thrown as
 * {@code CredentialValidationException}.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class CognitoTokenTag {

  public static final String NAME = "AwsCognitoToken";
  public static final String DISPLAY_NAME = "AWS Cognito Token";
  public static final String DESCRIPTION = "Provides Cognito JWT tokens from AWS";

  public static final String ARG_USERNAME = "Username";
  public static final String ARG_PASSWORD = "Password";
  public static final String ARG_REGION = "Region";
  public static final String ARG_CLIENT_ID = "ClientId";
  public static final String ARG_USER_POOL_ID = "UserPoolId";
  public static final String ARG_TOKEN_TYPE = "TokenType";
  public static final String ARG_CLIENT_SECRET = "ClientSecret";

  private static final List<TagArgument> ARGUMENTS =
      List.of(
          TagArgument.requiredString(ARG_USERNAME),
          TagArgument.requiredString(ARG_PASSWORD),
          TagArgument.requiredString(ARG_REGION),
          TagArgument.requiredString(ARG_CLIENT_ID),
          TagArgument.requiredString(ARG_USER_POOL_ID),
          TagArgument.choice(
              ARG_TOKEN_TYPE,
              TokenType.ACCESS.getValue(),
              List.of(
                  new TagArgument.Option("access", TokenType.ACCESS.getValue()),
                  new TagArgument.Option("id", TokenType.ID.getValue()),
                  new TagArgument.Option("Raw Request", TokenType.RAW_REQUEST.getValue()))),
          TagArgument.optionalString(ARG_CLIENT_SECRET));

  private final CognitoTokenProvider provider;

  public CognitoTokenTag(CognitoTokenProvider provider) {
    this.provider = Objects.requireNonNull(provider, "provider cannot be null");
  }

  /**
   * Gets the argument descriptors in positional order.
   *
   * @return the arguments
   */
  public List<TagArgument> getArguments() {
    return ARGUMENTS;
  }

  /**
   * Runs the action with arguments keyed by their display names.
   *
   * @param arguments argument values; absent keys count as empty
   * @return the bearer token, or the authentication error message
   */
  public String run(Map<String, String> arguments) {
    return run(
        arguments.get(ARG_USERNAME),
        arguments.get(ARG_PASSWORD),
        arguments.get(ARG_REGION),
        arguments.get(ARG_CLIENT_ID),
        arguments.get(ARG_USER_POOL_ID),
        arguments.get(ARG_TOKEN_TYPE),
        arguments.get(ARG_CLIENT_SECRET));
  }

  /**
   * Runs the action with positional arguments.
   *
   * @return the bearer token, or the authentication error message
   * @throws org.devolia.cognito.model.CredentialValidationException if a required argument is
   *     missing or the token type is unknown
   */
  public String run(
      String username,
      String password,
      String region,
      String clientId,
      String userPoolId,
      String tokenType,
      String clientSecret) {
    CredentialSet credentials =
        CredentialSet.builder()
            .username(username)
            .password(password)
            .region(region)
            .clientId(clientId)
            .userPoolId(userPoolId)
            .tokenType(tokenType)
            .clientSecret(clientSecret)
            .build();
    credentials.validate();
    return provider.resolveToken(credentials);
  }
}
