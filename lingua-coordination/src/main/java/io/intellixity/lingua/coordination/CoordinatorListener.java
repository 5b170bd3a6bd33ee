package io.intellixity.lingua.coordination;

import io.intellixity.lingua.core.error.LanguageError;

/** Lifecycle hooks of a {@link LanguageCoordinator}. All methods default to no-ops. */
public interface CoordinatorListener {
  default void beforeLoad(LanguageEvent event) {}

  default void afterLoad(LanguageEvent event) {}

  default void beforeSave(LanguageEvent event) {}

  default void afterSave(LanguageEvent event) {}

  /** Non-fatal failure; the operation that raised it has stopped. */
  default void onError(LanguageCoordinator coordinator, LanguageError.DomainError error) {}
}
