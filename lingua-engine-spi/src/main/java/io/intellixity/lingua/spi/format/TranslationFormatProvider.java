package io.intellixity.lingua.spi.format;

import io.intellixity.lingua.core.format.PersistenceFormat;

import java.util.Map;

/** Discovers {@link TranslationFormat} implementations, keyed by the format they handle. */
public interface TranslationFormatProvider {
  Map<PersistenceFormat, Class<? extends TranslationFormat>> formats();
}
