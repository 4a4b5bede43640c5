package org.devolia.cognito.resilience;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.concurrent.TimeoutException;
import javax.net.ssl.SSLException;
import org.devolia.cognito.auth.AuthenticationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.ApiCallAttemptTimeoutException;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.cognitoidentityprovider.model.InternalErrorException;
import software.amazon.awssdk.services.cognitoidentityprovider.model.InvalidParameterException;
import software.amazon.awssdk.services.cognitoidentityprovider.model.NotAuthorizedException;
import software.amazon.awssdk.services.cognitoidentityprovider.model.PasswordResetRequiredException;
import software.amazon.awssdk.services.cognitoidentityprovider.model.ResourceNotFoundException;
import software.amazon.awssdk.services.cognitoidentityprovider.model.TooManyRequestsException;
import software.amazon.awssdk.services.cognitoidentityprovider.model.UserNotConfirmedException;
import software.amazon.awssdk.services.cognitoidentityprovider.model.UserNotFoundException;

/**
 * Utility class for classifying authentication failures.
 *
 * <p>Only transient failures (throttling, Cognito server errors, timeouts and network problems)
 * count towards opening the circuit breaker. Wrong credentials and misconfigured pools are
 * reported to the caller and negative-cached, but they say nothing about the health of Cognito.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class ExceptionClassifier {

  private static final Logger logger = LoggerFactory.getLogger(ExceptionClassifier.class);

  private ExceptionClassifier() {}

  /**
   * Determines if an exception represents a transient failure.
   *
   * <p>Transient failures include:
   *
   * <ul>
   *   <li>Client side timeouts and connection issues
   *   <li>Cognito throttling ({@code TooManyRequestsException}, HTTP 429)
   *   <li>Cognito internal errors (HTTP 5xx)
   * </ul>
   *
   * @param exception the exception to classify
   * @return true if the exception represents a transient failure
   */
  public static boolean isTransientFailure(Throwable exception) {
    if (exception == null) {
      return false;
    }

    if (exception instanceof SocketTimeoutException
        || exception instanceof TimeoutException
        || exception instanceof UnknownHostException
        || exception instanceof SSLException
        || exception instanceof ApiCallTimeoutException
        || exception instanceof ApiCallAttemptTimeoutException) {
      logger.debug("Classified as transient failure: {}", exception.getClass().getSimpleName());
      return true;
    }

    if (exception instanceof TooManyRequestsException
        || exception instanceof InternalErrorException) {
      logger.debug("Classified as transient failure: {}", exception.getClass().getSimpleName());
      return true;
    }

    if (exception instanceof AwsServiceException serviceException) {
      int statusCode = serviceException.statusCode();
      boolean isTransient = statusCode == 429 || statusCode >= 500;
      logger.debug(
          "Service exception classified as {}: status={}",
          isTransient ? "transient" : "permanent",
          statusCode);
      return isTransient;
    }

    // Connection failures surface as client exceptions wrapping an IOException
    if (exception instanceof SdkClientException) {
      logger.debug("Classified as transient failure: SDK client error");
      return true;
    }

    // Check nested causes
    Throwable cause = exception.getCause();
    if (cause != null && cause != exception) {
      return isTransientFailure(cause);
    }

    logger.debug("Classified as permanent failure: {}", exception.getClass().getSimpleName());
    return false;
  }

  /**
   * Determines if an exception should be recorded by the circuit breaker as a failure.
   *
   * @param exception the exception to classify
   * @return true if the exception should count as a circuit breaker failure
   */
  public static boolean isCircuitBreakerFailure(Throwable exception) {
    return isTransientFailure(exception);
  }

  /**
   * Gets a human-readable error category for logging and metrics.
   *
   * @param exception the exception to categorize
   * @return error category string
   */
  public static String getErrorCategory(Throwable exception) {
    if (exception == null) {
      return "unknown";
    }

    if (exception instanceof AuthenticationException) {
      Throwable cause = exception.getCause();
      return cause != null ? getErrorCategory(cause) : "authentication";
    }

    if (exception instanceof CallNotPermittedException) {
      return "circuit_open";
    }

    if (exception instanceof NotAuthorizedException) {
      return "not_authorized";
    }

    if (exception instanceof UserNotFoundException) {
      return "user_not_found";
    }

    if (exception instanceof UserNotConfirmedException
        || exception instanceof PasswordResetRequiredException) {
      return "user_state";
    }

    if (exception instanceof ResourceNotFoundException
        || exception instanceof InvalidParameterException) {
      return "configuration";
    }

    if (exception instanceof TooManyRequestsException) {
      return "rate_limited";
    }

    if (exception instanceof AwsServiceException serviceException) {
      return serviceException.statusCode() >= 500 ? "server_error" : "client_error";
    }

    if (exception instanceof SocketTimeoutException
        || exception instanceof TimeoutException
        || exception instanceof ApiCallTimeoutException
        || exception instanceof ApiCallAttemptTimeoutException) {
      return "timeout";
    }

    if (exception instanceof UnknownHostException) {
      return "network";
    }

    if (exception instanceof SSLException) {
      return "ssl";
    }

    if (exception instanceof SdkClientException) {
      Throwable cause = exception.getCause();
      String category =
          cause != null && cause != exception ? getErrorCategory(cause) : "unknown";
      return "unknown".equals(category) ? "network" : category;
    }

    return "unknown";
  }
}
