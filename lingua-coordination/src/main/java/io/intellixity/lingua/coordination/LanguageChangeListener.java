package io.intellixity.lingua.coordination;

import java.nio.file.Path;

/** Fired by {@link LanguageServer} once every client has been synchronized. */
@FunctionalInterface
public interface LanguageChangeListener {
  void languageChanged(String language, Path rootPath);
}
