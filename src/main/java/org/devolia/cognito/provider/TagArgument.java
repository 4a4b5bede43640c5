package org.devolia.cognito.provider;

import java.util.Collections;
import java.util.List;

/**
 * Describes one named argument of {@link CognitoTokenTag} for hosts that render argument forms.
 *
 * @author Devolia
 * @since 1.0.0
 */
public final class TagArgument {

  /** Argument value kinds. */
  public enum Type {
    STRING,
    ENUM
  }

  /** One selectable value of an {@link Type#ENUM} argument. */
  public static final class Option {
    private final String displayName;
    private final String value;

    public Option(String displayName, String value) {
      this.displayName = displayName;
      this.value = value;
    }

    public String getDisplayName() {
      return displayName;
    }

    public String getValue() {
      return value;
    }
  }

  static final String REQUIRED_MESSAGE = "Required";

  private final String displayName;
  private final Type type;
  private final boolean required;
  private final String defaultValue;
  private final List<Option> options;

  private TagArgument(
      String displayName, Type type, boolean required, String defaultValue, List<Option> options) {
    this.displayName = displayName;
    this.type = type;
    this.required = required;
    this.defaultValue = defaultValue;
    this.options = Collections.unmodifiableList(options);
  }

  static TagArgument requiredString(String displayName) {
    return new TagArgument(displayName, Type.STRING, true, null, List.of());
  }

  static TagArgument optionalString(String displayName) {
    return new TagArgument(displayName, Type.STRING, false, null, List.of());
  }

  static TagArgument choice(String displayName, String defaultValue, List<Option> options) {
    return new TagArgument(displayName, Type.ENUM, false, defaultValue, options);
  }

  public String getDisplayName() {
    return displayName;
  }

  public Type getType() {
    return type;
  }

  public boolean isRequired() {
    return required;
  }

  /**
   * Gets the value used when the caller leaves the argument empty.
   *
   * @return the default value, or null
   */
  public String getDefaultValue() {
    return defaultValue;
  }

  public List<Option> getOptions() {
    return options;
  }

  /**
   * Validates a value entered for this argument.
   *
   * @param value the entered value, may be null
   * @return an empty string when valid, otherwise the message to show
   */
  public String validate(String value) {
    if (required && (value == null || value.isEmpty())) {
      return REQUIRED_MESSAGE;
    }
    return "";
  }
}
