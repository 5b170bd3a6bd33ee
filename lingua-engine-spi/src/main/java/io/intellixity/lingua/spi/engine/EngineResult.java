package io.intellixity.lingua.spi.engine;

import io.intellixity.lingua.core.error.LanguageError;

import java.nio.file.Path;
import java.util.Objects;

/** Outcome of a load or save that did not fail with an I/O error. */
public sealed interface EngineResult permits EngineResult.Completed, EngineResult.Rejected {
  static Completed completed(Path file) {
    return new Completed(file);
  }

  static Rejected rejected(LanguageError error) {
    return new Rejected(error);
  }

  default boolean isCompleted() {
    return this instanceof Completed;
  }

  record Completed(Path file) implements EngineResult {
    public Completed {
      Objects.requireNonNull(file, "file");
    }
  }

  record Rejected(LanguageError error) implements EngineResult {
    public Rejected {
      Objects.requireNonNull(error, "error");
    }
  }
}
