package chatlog;

/**
 * Thrown at build or startup time when a required collaborator or setting is missing.
 */
public final class ConfigurationException extends ChatLogException {
  public ConfigurationException(String message) {
    super(ErrorKind.CONFIGURATION, message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(ErrorKind.CONFIGURATION, message, cause);
  }
}
