package io.intellixity.lingua.core.info;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads the metadata section of a language file.\n
 *
 * Missing optional fields are filled with defaults. Read and parse failures propagate unchanged.
 */
public interface LanguageInfoLoader {
  LanguageInfo loadFromFile(Path file) throws IOException;
}
