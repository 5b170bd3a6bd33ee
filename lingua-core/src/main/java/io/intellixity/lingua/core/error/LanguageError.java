package io.intellixity.lingua.core.error;

import java.util.Objects;

/**
 * Failure reported by a load or save without throwing.\n
 *
 * - {@link ConfigurationError}: fatal, callers rethrow it\n
 * - {@link DomainError}: non-fatal, coordinators report it and stop the operation\n
 */
public sealed interface LanguageError permits LanguageError.ConfigurationError, LanguageError.DomainError {
  String message();

  RuntimeException toException();

  static ConfigurationError configuration(String message) {
    return new ConfigurationError(message);
  }

  static DomainError domain(String message) {
    return new DomainError(message, null);
  }

  static DomainError domain(String message, Throwable cause) {
    return new DomainError(message, cause);
  }

  record ConfigurationError(String message) implements LanguageError {
    public ConfigurationError {
      Objects.requireNonNull(message, "message");
    }

    @Override
    public LanguageConfigurationException toException() {
      return new LanguageConfigurationException(message);
    }
  }

  record DomainError(String message, Throwable cause) implements LanguageError {
    public DomainError {
      Objects.requireNonNull(message, "message");
    }

    @Override
    public LanguageDomainException toException() {
      return cause == null ? new LanguageDomainException(message) : new LanguageDomainException(message, cause);
    }
  }
}
