package io.intellixity.lingua.format.ini;

import io.intellixity.lingua.core.format.PersistenceFormat;
import io.intellixity.lingua.spi.format.TranslationFormat;
import io.intellixity.lingua.spi.format.TranslationFormatProvider;

import java.util.Map;

/** Registers the hierarchical and flat INI formats (see META-INF/lingua.factories). */
public final class IniFormatProvider implements TranslationFormatProvider {
  @Override
  public Map<PersistenceFormat, Class<? extends TranslationFormat>> formats() {
    return Map.of(
        PersistenceFormat.INI, HierarchicalIniFormat.class,
        PersistenceFormat.FLAT_INI, FlatIniFormat.class);
  }
}
