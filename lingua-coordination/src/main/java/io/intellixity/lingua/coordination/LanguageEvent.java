package io.intellixity.lingua.coordination;

import io.intellixity.lingua.core.model.Container;

import java.nio.file.Path;

/** A load or save about to happen (or just done). Cancelling a before-event skips the operation. */
public final class LanguageEvent {
  private final LanguageCoordinator coordinator;
  private final Container container;
  private final Path file;
  private boolean cancelled;

  LanguageEvent(LanguageCoordinator coordinator, Container container, Path file) {
    this.coordinator = coordinator;
    this.container = container;
    this.file = file;
  }

  public LanguageCoordinator coordinator() { return coordinator; }
  public Container container() { return container; }
  public Path file() { return file; }

  public void cancel() {
    this.cancelled = true;
  }

  public boolean isCancelled() {
    return cancelled;
  }
}
