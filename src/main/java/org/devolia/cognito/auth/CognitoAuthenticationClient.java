package org.devolia.cognito.auth;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.devolia.cognito.model.CredentialSet;
import org.devolia.cognito.model.TokenType;
import org.devolia.cognito.resilience.ResilienceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AnonymousCredentialsProvider;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cognitoidentityprovider.CognitoIdentityProviderClient;
import software.amazon.awssdk.services.cognitoidentityprovider.model.AuthFlowType;
import software.amazon.awssdk.services.cognitoidentityprovider.model.AuthenticationResultType;
import software.amazon.awssdk.services.cognitoidentityprovider.model.InitiateAuthRequest;
import software.amazon.awssdk.services.cognitoidentityprovider.model.InitiateAuthResponse;

/**
 * {@link AuthenticationClient} for AWS Cognito user pools.
 *
 * <p>Calls {@code InitiateAuth} with the {@code USER_PASSWORD_AUTH} flow, so the app client must
 * allow that flow. When the credentials carry a client secret, the {@code SECRET_HASH} parameter
 * is computed as Base64(HMAC-SHA256(clientSecret, username + clientId)).
 *
 * <p>{@code InitiateAuth} is an unauthenticated API, so requests are sent with anonymous AWS
 * credentials. Requests go to the region named by the user pool id prefix; the caller's region
 * only takes part in the cache key. One SDK client is created lazily per region and reused until
 * {@link #close()}.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class CognitoAuthenticationClient implements AuthenticationClient {

  private static final Logger logger = LoggerFactory.getLogger(CognitoAuthenticationClient.class);

  static final String PARAM_USERNAME = "USERNAME";
  static final String PARAM_PASSWORD = "PASSWORD";
  static final String PARAM_SECRET_HASH = "SECRET_HASH";

  private static final String HMAC_ALGORITHM = "HmacSHA256";

  private final Function<Region, CognitoIdentityProviderClient> clientFactory;
  private final Map<Region, CognitoIdentityProviderClient> clients = new ConcurrentHashMap<>();

  /**
   * Creates a client whose SDK clients apply the configured call timeouts.
   *
   * @param resilienceConfig timeout configuration
   */
  public CognitoAuthenticationClient(ResilienceConfig resilienceConfig) {
    this(
        region ->
            CognitoIdentityProviderClient.builder()
                .region(region)
                .credentialsProvider(AnonymousCredentialsProvider.create())
                .overrideConfiguration(
                    ClientOverrideConfiguration.builder()
                        .apiCallAttemptTimeout(resilienceConfig.getAttemptTimeout())
                        .apiCallTimeout(resilienceConfig.getCallTimeout())
                        .build())
                .build());
  }

  /**
   * Creates a client with a custom SDK client factory.
   *
   * @param clientFactory creates the SDK client for a region
   */
  public CognitoAuthenticationClient(
      Function<Region, CognitoIdentityProviderClient> clientFactory) {
    this.clientFactory = clientFactory;
  }

  @Override
  public String authenticate(CredentialSet credentials) throws AuthenticationException {
    String poolRegion = poolRegion(credentials.getUserPoolId());
    if (!poolRegion.equals(credentials.getRegion())) {
      logger.debug(
          "Region {} differs from user pool region {}, using the user pool region",
          credentials.getRegion(),
          poolRegion);
    }

    Map<String, String> parameters = new HashMap<>();
    parameters.put(PARAM_USERNAME, credentials.getUsername());
    parameters.put(PARAM_PASSWORD, credentials.getPassword());
    if (credentials.hasClientSecret()) {
      parameters.put(
          PARAM_SECRET_HASH,
          computeSecretHash(
              credentials.getUsername(), credentials.getClientId(), credentials.getClientSecret()));
    }

    InitiateAuthRequest request =
        InitiateAuthRequest.builder()
            .authFlow(AuthFlowType.USER_PASSWORD_AUTH)
            .clientId(credentials.getClientId())
            .authParameters(parameters)
            .build();

    logger.debug(
        "Authenticating user {} against pool {}",
        credentials.getUsername(),
        credentials.getUserPoolId());

    InitiateAuthResponse response;
    try {
      response = clientFor(poolRegion).initiateAuth(request);
    } catch (AwsServiceException e) {
      throw new AuthenticationException(serviceMessage(e), e);
    } catch (SdkClientException e) {
      throw new AuthenticationException(e.getMessage(), e);
    }

    if (response.challengeName() != null) {
      throw new AuthenticationException(
          "Unsupported authentication challenge: " + response.challengeNameAsString());
    }

    AuthenticationResultType result = response.authenticationResult();
    if (result == null) {
      throw new AuthenticationException("Cognito returned no authentication result");
    }

    String token =
        credentials.getTokenType() == TokenType.ID ? result.idToken() : result.accessToken();
    if (token == null || token.isEmpty()) {
      throw new AuthenticationException(
          "Cognito returned no " + credentials.getTokenType() + " token");
    }
    return token;
  }

  /** Closes every SDK client created so far. */
  @Override
  public void close() {
    clients.values().forEach(CognitoIdentityProviderClient::close);
    clients.clear();
    logger.debug("Closed Cognito identity provider clients");
  }

  private CognitoIdentityProviderClient clientFor(String regionName) {
    return clients.computeIfAbsent(Region.of(regionName), clientFactory);
  }

  /**
   * Extracts the region from a user pool id of the form {@code <region>_<id>}. The Cognito
   * endpoint is always the user pool's region.
   */
  private static String poolRegion(String userPoolId) throws AuthenticationException {
    int separator = userPoolId.indexOf('_');
    if (separator <= 0 || separator == userPoolId.length() - 1) {
      throw new AuthenticationException("Invalid UserPoolId format.");
    }
    return userPoolId.substring(0, separator);
  }

  private static String serviceMessage(AwsServiceException e) {
    if (e.awsErrorDetails() != null && e.awsErrorDetails().errorMessage() != null) {
      return e.awsErrorDetails().errorMessage();
    }
    return e.getMessage();
  }

  /**
   * Computes the Cognito {@code SECRET_HASH} authentication parameter.
   *
   * @param username the username
   * @param clientId the app client id
   * @param clientSecret the app client secret
   * @return Base64 encoded HMAC-SHA256 digest
   */
  static String computeSecretHash(String username, String clientId, String clientSecret) {
    try {
      Mac mac = Mac.getInstance(HMAC_ALGORITHM);
      mac.init(new SecretKeySpec(clientSecret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
      byte[] digest = mac.doFinal((username + clientId).getBytes(StandardCharsets.UTF_8));
      return Base64.getEncoder().encodeToString(digest);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Unable to compute Cognito secret hash", e);
    }
  }
}
