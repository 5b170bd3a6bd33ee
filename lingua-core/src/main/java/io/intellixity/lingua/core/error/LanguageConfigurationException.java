package io.intellixity.lingua.core.error;

/**
 * Fatal configuration problem: empty language id, no file selected for save, unregistered format,
 * engine class failing its conformance probe.\n
 *
 * Always raised to the caller.
 */
public final class LanguageConfigurationException extends RuntimeException {
  public LanguageConfigurationException(String message) {
    super(message);
  }

  public LanguageConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
