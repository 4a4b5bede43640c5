package org.devolia.cognito.model;

/**
 * Thrown when a required credential attribute is missing or malformed.
 *
 * <p>Raised before any cache or network access and never cached.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class CredentialValidationException extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  private final String attribute;

  /**
   * Creates an exception for a missing required attribute.
   *
   * @param attribute the caller-facing attribute name (e.g. {@code Username})
   */
  public CredentialValidationException(String attribute) {
    this(attribute, attribute + " attribute is required");
  }

  /**
   * Creates an exception with a custom message.
   *
   * @param attribute the caller-facing attribute name
   * @param message the detail message
   */
  public CredentialValidationException(String attribute, String message) {
    super(message);
    this.attribute = attribute;
  }

  /**
   * Gets the name of the offending attribute.
   *
   * @return the attribute name
   */
  public String getAttribute() {
    return attribute;
  }
}
