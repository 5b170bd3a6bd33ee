package io.intellixity.lingua.spi.format;

import io.intellixity.lingua.core.format.PersistenceFormat;
import io.intellixity.lingua.core.info.LanguageInfoLoader;
import io.intellixity.lingua.core.model.Container;

import java.io.IOException;
import java.nio.file.Path;

/**
 * File-format strategy: the two raw primitives a {@code TranslationEngine} delegates to.\n
 *
 * Implementations must have a public no-arg constructor (they are instantiated per engine) and must
 * not decide eligibility themselves: every attribute read or written goes through the
 * {@link FormatContext}.\n
 *
 * I/O and parse failures propagate as {@link IOException}, unwrapped.
 */
public interface TranslationFormat {
  PersistenceFormat format();

  /**
   * Parse {@code file}: feed every runtime string to {@code strings} and apply attribute values onto the
   * tree below {@code root}.\n
   *
   * @param root traversal root, or null to read runtime strings only
   */
  void deserialize(FormatContext ctx, Container root, Path file, RuntimeStringSink strings) throws IOException;

  /** Write the persistable attributes of every included container reachable from {@code root}. */
  void serialize(FormatContext ctx, Container root, Path file) throws IOException;

  /** Reader for the metadata file of this format. */
  LanguageInfoLoader infoLoader();
}
