package io.intellixity.lingua.core.error;

/**
 * Throwable form of a {@link LanguageError.DomainError}.\n
 *
 * Only used where a domain error has to cross an API that cannot return a result.
 */
public final class LanguageDomainException extends RuntimeException {
  public LanguageDomainException(String message) {
    super(message);
  }

  public LanguageDomainException(String message, Throwable cause) {
    super(message, cause);
  }
}
