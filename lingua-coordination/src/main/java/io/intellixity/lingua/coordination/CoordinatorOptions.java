package io.intellixity.lingua.coordination;

import io.intellixity.lingua.core.format.PersistenceFormat;
import io.intellixity.lingua.core.model.ContainerTypeRegistry;
import io.intellixity.lingua.spi.engine.EngineSettings;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Construction-time configuration of a {@link LanguageCoordinator}.\n
 *
 * @param format initial persistence format\n
 * @param settings engine settings (exclusions, action rule, auto-create, type metadata)\n
 * @param registerOnStart self-register with the server passed to {@code open}\n
 * @param rootPath folder holding one sub-folder per language, may be null\n
 * @param language initial language id, may be null\n
 * @param listeners attached before the first engine is created, so construction errors are reported too\n
 */
public record CoordinatorOptions(PersistenceFormat format,
                                 EngineSettings settings,
                                 boolean registerOnStart,
                                 Path rootPath,
                                 String language,
                                 List<CoordinatorListener> listeners) {
  public CoordinatorOptions {
    Objects.requireNonNull(format, "format");
    Objects.requireNonNull(settings, "settings");
    listeners = listeners == null ? List.of() : List.copyOf(listeners);
  }

  /** INI format, default engine settings, register on start, no path and no language. */
  public static CoordinatorOptions defaults(ContainerTypeRegistry types) {
    return new CoordinatorOptions(PersistenceFormat.INI, EngineSettings.defaults(types), true, null, null, List.of());
  }

  public CoordinatorOptions withFormat(PersistenceFormat format) {
    return new CoordinatorOptions(format, settings, registerOnStart, rootPath, language, listeners);
  }

  public CoordinatorOptions withSettings(EngineSettings settings) {
    return new CoordinatorOptions(format, settings, registerOnStart, rootPath, language, listeners);
  }

  public CoordinatorOptions withRegisterOnStart(boolean registerOnStart) {
    return new CoordinatorOptions(format, settings, registerOnStart, rootPath, language, listeners);
  }

  public CoordinatorOptions withRootPath(Path rootPath) {
    return new CoordinatorOptions(format, settings, registerOnStart, rootPath, language, listeners);
  }

  public CoordinatorOptions withLanguage(String language) {
    return new CoordinatorOptions(format, settings, registerOnStart, rootPath, language, listeners);
  }

  public CoordinatorOptions withListener(CoordinatorListener listener) {
    List<CoordinatorListener> l = new ArrayList<>(listeners);
    l.add(Objects.requireNonNull(listener, "listener"));
    return new CoordinatorOptions(format, settings, registerOnStart, rootPath, language, l);
  }
}
