package io.intellixity.lingua.format.json;

import io.intellixity.lingua.core.format.PersistenceFormat;
import io.intellixity.lingua.spi.format.TranslationFormat;
import io.intellixity.lingua.spi.format.TranslationFormatProvider;

import java.util.Map;

/** Registers {@link JsonTranslationFormat} (see META-INF/lingua.factories). */
public final class JsonFormatProvider implements TranslationFormatProvider {
  @Override
  public Map<PersistenceFormat, Class<? extends TranslationFormat>> formats() {
    return Map.of(PersistenceFormat.JSON, JsonTranslationFormat.class);
  }
}
